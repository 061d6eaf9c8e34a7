package com.flinspect.core.model;

import java.util.Comparator;

/** Dump file key and line a construct was read from. */
public record SourceLocation(String file, int line) {

    public static final Comparator<SourceLocation> ORDER =
            Comparator.comparing(SourceLocation::file).thenComparingInt(SourceLocation::line);

    @Override
    public String toString() {
        return file + ":" + line;
    }
}
