package com.flinspect.core.model;

import java.util.List;
import java.util.TreeSet;

/**
 * Outcome of resolving one call site.
 *
 * @param candidates the single target, every surviving candidate, or empty for {@code UNKNOWN}
 * @param via        interfaces the callee name went through
 */
public record Resolution(ResolutionStatus status, List<UnitId> candidates, List<UnitId> via) {

    public Resolution {
        candidates = List.copyOf(new TreeSet<>(candidates));
        via = List.copyOf(new TreeSet<>(via));
        if (status == ResolutionStatus.RESOLVED && candidates.size() != 1) {
            throw new IllegalArgumentException("RESOLVED needs exactly one candidate, got " + candidates);
        }
        if (status == ResolutionStatus.AMBIGUOUS && candidates.size() < 2) {
            throw new IllegalArgumentException("AMBIGUOUS needs at least two candidates, got " + candidates);
        }
        if (status == ResolutionStatus.UNKNOWN && !candidates.isEmpty()) {
            throw new IllegalArgumentException("UNKNOWN carries no candidates");
        }
    }

    /** Status follows from the number of survivors. */
    public static Resolution of(List<UnitId> survivors, List<UnitId> via) {
        int distinct = new TreeSet<>(survivors).size();
        if (distinct == 0) return new Resolution(ResolutionStatus.UNKNOWN, List.of(), via);
        if (distinct == 1) return new Resolution(ResolutionStatus.RESOLVED, survivors, via);
        return new Resolution(ResolutionStatus.AMBIGUOUS, survivors, via);
    }

    public static Resolution unknown() {
        return new Resolution(ResolutionStatus.UNKNOWN, List.of(), List.of());
    }

    public UnitId target() {
        return status == ResolutionStatus.RESOLVED ? candidates.get(0) : null;
    }
}
