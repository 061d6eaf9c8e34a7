package com.flinspect.core.model;

import java.util.Comparator;

/**
 * A recoverable problem found during ingestion.
 *
 * @param subject the unit the diagnostic is attached to, null for file-level problems
 */
public record Diagnostic(DiagnosticKind kind, String sourceFile, int line, UnitId subject, String message) {

    public static final Comparator<Diagnostic> ORDER = Comparator
            .comparing(Diagnostic::sourceFile, Comparator.nullsFirst(Comparator.naturalOrder()))
            .thenComparingInt(Diagnostic::line)
            .thenComparing(Diagnostic::kind)
            .thenComparing(Diagnostic::subject, Comparator.nullsFirst(Comparator.naturalOrder()))
            .thenComparing(Diagnostic::message);

    @Override
    public String toString() {
        String where = sourceFile != null ? sourceFile + ":" + line + ": " : "";
        return where + kind + " " + message;
    }
}
