package com.flinspect.core.model;

import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * A USE statement: scope {@code from} uses {@code module}.
 *
 * @param only     names of the ONLY list, null when the statement has none
 * @param renames  local name to remote name
 */
public record UsesEdge(UnitId from, UnitId module, List<String> only, Map<String, String> renames, int line) {

    public static final Comparator<UsesEdge> ORDER = Comparator
            .comparing(UsesEdge::from)
            .thenComparing(UsesEdge::module)
            .thenComparingInt(UsesEdge::line)
            .thenComparing(e -> String.valueOf(e.only()))
            .thenComparing(e -> e.renames().toString());

    public UsesEdge {
        only = only == null ? null : List.copyOf(new TreeSet<>(only));
        renames = renames == null ? Map.of() : Collections.unmodifiableMap(new TreeMap<>(renames));
    }

    /**
     * The remote name a local name refers to through this statement, or null if the
     * statement does not make {@code localName} visible.
     */
    public String remoteNameOf(String localName) {
        String renamed = renames.get(localName);
        if (renamed != null) return renamed;
        if (only != null) {
            return only.contains(localName) ? localName : null;
        }
        // a renamed entity is only visible under its local name
        if (renames.containsValue(localName)) return null;
        return localName;
    }
}
