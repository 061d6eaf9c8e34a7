package com.flinspect.core.model;

public enum ResolutionStatus {
    RESOLVED,
    AMBIGUOUS,
    UNKNOWN
}
