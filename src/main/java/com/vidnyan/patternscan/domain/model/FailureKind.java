package com.vidnyan.patternscan.domain.model;

public enum FailureKind {
    PLUGIN_FAULT,
    TIMEOUT,
    CANCELLED,
    INTERNAL_ERROR
}
