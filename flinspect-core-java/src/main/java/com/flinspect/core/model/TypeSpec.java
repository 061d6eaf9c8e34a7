package com.flinspect.core.model;

/**
 * Declared type of a variable, dummy argument or component.
 * Kind parameters are not tracked, so {@code double precision} is {@code REAL}.
 *
 * @param derivedName  type name for {@code type(t)} / {@code class(t)}, null otherwise
 *                     or for {@code class(*)}
 * @param polymorphic  declared with {@code class(...)}
 */
public record TypeSpec(IntrinsicType intrinsic, String derivedName, boolean polymorphic) {

    public static final TypeSpec UNKNOWN = new TypeSpec(IntrinsicType.UNKNOWN, null, false);

    public static TypeSpec of(IntrinsicType intrinsic) {
        return new TypeSpec(intrinsic, null, false);
    }

    public static TypeSpec derived(String name, boolean polymorphic) {
        return new TypeSpec(IntrinsicType.DERIVED, name, polymorphic);
    }

    public boolean isKnown() {
        return intrinsic != IntrinsicType.UNKNOWN;
    }

    /**
     * Exact match, except that unknown on either side matches, and a polymorphic or
     * unnamed derived type matches any derived type.
     */
    public boolean matches(TypeSpec other) {
        if (!isKnown() || other == null || !other.isKnown()) return true;
        if (intrinsic != other.intrinsic) return false;
        if (intrinsic != IntrinsicType.DERIVED) return true;
        if (polymorphic || other.polymorphic) return true;
        if (derivedName == null || other.derivedName == null) return true;
        return derivedName.equals(other.derivedName);
    }

    @Override
    public String toString() {
        if (intrinsic == IntrinsicType.DERIVED) {
            String name = derivedName != null ? derivedName : "*";
            return (polymorphic ? "class(" : "type(") + name + ")";
        }
        return intrinsic.name().toLowerCase();
    }
}
