package com.flisp.debug;

public enum DebugLevel {
    TRACE, DEBUG, INFO, WARN, ERROR
}
