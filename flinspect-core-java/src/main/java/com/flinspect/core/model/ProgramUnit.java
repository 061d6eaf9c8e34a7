package com.flinspect.core.model;

import java.util.Comparator;

/**
 * A module, program, subprogram, interface or derived type.
 *
 * A unit with a null {@code location} is a placeholder: it was referenced (a USE of a module
 * no ingested file defines yet) but never defined.
 *
 * @param qualifiedName container's qualified name and own name joined by {@code ::}
 * @param container     enclosing unit, null at top level
 */
public record ProgramUnit(
        UnitId id,
        UnitKind kind,
        String name,
        String qualifiedName,
        UnitId container,
        SourceLocation location,
        UnitPayload payload
) {

    /**
     * Precedence between units competing for one qualified name:
     * defined before placeholder, then source file, then line, then kind, then id.
     */
    public static final Comparator<ProgramUnit> PRECEDENCE = Comparator
            .comparing((ProgramUnit u) -> u.location, Comparator.nullsLast(SourceLocation.ORDER))
            .thenComparing(ProgramUnit::kind)
            .thenComparing(ProgramUnit::id);

    public boolean isDefined() {
        return location != null;
    }

    public boolean isTopLevel() {
        return container == null;
    }

    public ProgramUnit withDefinition(SourceLocation newLocation, UnitPayload newPayload) {
        return new ProgramUnit(id, kind, name, qualifiedName, container, newLocation, newPayload);
    }

    public static String qualify(String containerQualifiedName, String name) {
        return containerQualifiedName == null ? name : containerQualifiedName + "::" + name;
    }
}
