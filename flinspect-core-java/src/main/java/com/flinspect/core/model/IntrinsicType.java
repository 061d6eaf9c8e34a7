package com.flinspect.core.model;

public enum IntrinsicType {
    INTEGER,
    REAL,
    COMPLEX,
    LOGICAL,
    CHARACTER,
    DERIVED,
    UNKNOWN
}
