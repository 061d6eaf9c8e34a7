package com.flinspect.core.graph;

/** FORWARD follows edges from source to target (parent to child, user to module, caller to callee). */
public enum Direction {
    FORWARD,
    BACKWARD
}
