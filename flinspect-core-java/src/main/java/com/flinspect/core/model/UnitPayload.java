package com.flinspect.core.model;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * Kind-specific payload of a {@link ProgramUnit}. One arm per {@link UnitKind}.
 */
public sealed interface UnitPayload {

    /**
     * Accessibility of a module's entities.
     *
     * @param defaultPrivate a bare {@code private} statement was seen
     */
    record ModulePayload(boolean defaultPrivate, List<String> publicNames, List<String> privateNames)
            implements UnitPayload {

        public static final ModulePayload EMPTY = new ModulePayload(false, List.of(), List.of());

        public ModulePayload {
            publicNames = List.copyOf(new TreeSet<>(publicNames));
            privateNames = List.copyOf(new TreeSet<>(privateNames));
        }

        public boolean isPublic(String name) {
            if (privateNames.contains(name)) return false;
            if (publicNames.contains(name)) return true;
            return !defaultPrivate;
        }

        /** Names listed explicitly as public; a use-associated name listed here is re-exported. */
        public boolean isExplicitlyPublic(String name) {
            return publicNames.contains(name);
        }

        public ModulePayload merge(ModulePayload other) {
            List<String> pub = new ArrayList<>(publicNames);
            pub.addAll(other.publicNames);
            List<String> priv = new ArrayList<>(privateNames);
            priv.addAll(other.privateNames);
            return new ModulePayload(defaultPrivate || other.defaultPrivate, pub, priv);
        }
    }

    record ProgramPayload() implements UnitPayload {}

    /**
     * Subroutine or function signature.
     *
     * @param resultType null for subroutines
     */
    record SubprogramPayload(List<ArgumentDescriptor> arguments, TypeSpec resultType, int resultRank)
            implements UnitPayload {

        public SubprogramPayload {
            arguments = List.copyOf(arguments);
        }

        public int requiredCount() {
            int n = 0;
            for (ArgumentDescriptor a : arguments) {
                if (!a.optional()) n++;
            }
            return n;
        }
    }

    /** Member procedure names as written; binding them to units is done by the resolver. */
    record InterfacePayload(List<String> memberNames) implements UnitPayload {

        public InterfacePayload {
            memberNames = List.copyOf(memberNames);
        }

        /** Members of both blocks, this one's first. */
        public InterfacePayload merge(InterfacePayload other) {
            Set<String> all = new LinkedHashSet<>(memberNames);
            all.addAll(other.memberNames);
            return new InterfacePayload(new ArrayList<>(all));
        }
    }

    record DerivedTypePayload(List<ComponentDescriptor> components) implements UnitPayload {

        public DerivedTypePayload {
            components = List.copyOf(components);
        }
    }

    static UnitPayload emptyFor(UnitKind kind) {
        return switch (kind) {
            case MODULE -> ModulePayload.EMPTY;
            case PROGRAM -> new ProgramPayload();
            case SUBROUTINE, FUNCTION -> new SubprogramPayload(List.of(), null, Rank.UNKNOWN);
            case INTERFACE -> new InterfacePayload(List.of());
            case DERIVED_TYPE -> new DerivedTypePayload(List.of());
        };
    }
}
