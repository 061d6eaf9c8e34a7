package com.flinspect.core.graph;

public enum EdgeType {
    CONTAINS,
    USES,
    CALLS
}
