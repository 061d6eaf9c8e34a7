package com.flinspect.core.model;

public enum DiagnosticKind {
    /** Inconsistent nesting in a dump; the fragment was skipped. */
    MALFORMED_TREE,
    /** Two units share a qualified name with incompatible kinds; the loser is a shadow. */
    NAME_KIND_CONFLICT,
    /** Two top-level procedures of one name from different files. */
    DUPLICATE_DEFINITION,
    /** A dump file could not be opened or read. */
    IO_FAILURE
}
