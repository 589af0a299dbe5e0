package com.vidnyan.patternscan.domain.error;

public enum ErrorKind {
    NOT_FOUND,
    TYPE_CONTRACT_VIOLATION,
    UNSUPPORTED_INPUT,
    PLUGIN_FAULT,
    TIMEOUT
}
