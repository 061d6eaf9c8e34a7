package com.flinspect.core.registry;

import com.flinspect.core.model.CallEdge;
import com.flinspect.core.model.CallSite;
import com.flinspect.core.model.ContainsEdge;
import com.flinspect.core.model.Diagnostic;
import com.flinspect.core.model.DiagnosticKind;
import com.flinspect.core.model.InterfaceMembers;
import com.flinspect.core.model.ProgramUnit;
import com.flinspect.core.model.Resolution;
import com.flinspect.core.model.SourceLocation;
import com.flinspect.core.model.UnitId;
import com.flinspect.core.model.UnitKind;
import com.flinspect.core.model.UnitPayload;
import com.flinspect.core.model.UnitPayload.InterfacePayload;
import com.flinspect.core.model.UnitPayload.ModulePayload;
import com.flinspect.core.model.UsesEdge;
import com.flinspect.core.model.VariableDecl;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.function.BiFunction;

/**
 * Arena owning every entity of one graph: units, variables, USE edges, call sites and their
 * resolutions. Everything else refers to entities by {@link UnitId}.
 *
 * A registry is either file-local (filled by one extractor, {@code fileKey} set) or merged
 * (filled by {@link #absorb}). It is not thread-safe for writes; once populated it may be read
 * from several threads.
 *
 * Besides the entities it keeps the reverse indexes an incremental merge needs: top-level units
 * by name, the top-level units that USE each module, call sites by enclosing top-level unit and
 * by callee name, and interfaces by member name.
 */
public class NodeRegistry {

    public static class NameKindConflictException extends RuntimeException {
        public NameKindConflictException(String message) { super(message); }
        public NameKindConflictException(String message, Throwable cause) { super(message, cause); }
    }

    private final String fileKey;
    private final Map<UnitId, ProgramUnit> units = new TreeMap<>();
    private final Map<UnitId, Set<UnitId>> children = new HashMap<>();
    private final Set<UnitId> topLevel = new TreeSet<>();
    private final Map<String, Set<UnitId>> byQualifiedName = new HashMap<>();
    private final Set<UsesEdge> uses = new TreeSet<>(UsesEdge.ORDER);
    private final Map<UnitId, Set<UsesEdge>> usesByScope = new HashMap<>();
    private final Map<UnitId, Map<String, VariableDecl>> variables = new HashMap<>();
    private final Map<UnitId, InterfaceMembers> members = new HashMap<>();
    private final Map<String, CallSite> callSites = new TreeMap<>();
    private final Map<String, Resolution> resolutions = new HashMap<>();
    private final Set<Diagnostic> recorded = new TreeSet<>(Diagnostic.ORDER);
    private final Map<String, List<Diagnostic>> conflicts = new HashMap<>();
    private final Set<UnitId> shadowed = new TreeSet<>();

    private final Map<String, Set<UnitId>> topLevelByName = new HashMap<>();
    private final Map<UnitId, Set<UnitId>> usersOf = new HashMap<>();
    private final Map<UnitId, Set<String>> sitesByTopLevel = new HashMap<>();
    private final Map<String, Set<String>> sitesByCallee = new HashMap<>();
    private final Map<String, Set<UnitId>> interfacesByMember = new HashMap<>();

    /**
     * @param fileKey dump file key of a file-local registry, null for a merged one
     */
    public NodeRegistry(String fileKey) {
        this.fileKey = fileKey;
    }

    public static NodeRegistry merged() {
        return new NodeRegistry(null);
    }

    public String fileKey() { return fileKey; }

    // ------------------------------------------------------------------
    // Interning
    // ------------------------------------------------------------------

    /**
     * Returns the identity of {@code name} of {@code kind} inside {@code container}
     * (null for top level), creating an undefined unit on first use.
     *
     * @throws NameKindConflictException if the qualified name is taken by an incompatible kind
     */
    public UnitId intern(UnitId container, String name, UnitKind kind) {
        UnitId id = UnitId.of(kind, container, name, fileKey);
        if (units.containsKey(id)) return id;
        String qualifiedName = ProgramUnit.qualify(container != null ? unit(container).qualifiedName() : null, name);
        for (UnitId other : byQualifiedName.getOrDefault(qualifiedName, Set.of())) {
            UnitKind otherKind = units.get(other).kind();
            if (otherKind != kind && !UnitKind.compatible(otherKind, kind)) {
                throw new NameKindConflictException("'" + qualifiedName + "' is already a "
                        + otherKind.tag() + " (" + other + "), cannot intern it as a " + kind.tag());
            }
        }
        return add(id, kind, name, qualifiedName, container);
    }

    /**
     * Interns by qualified name ({@code m::s}); every enclosing name must already be interned.
     */
    public UnitId intern(String qualifiedName, UnitKind kind) {
        int split = qualifiedName.lastIndexOf("::");
        if (split < 0) return intern(null, qualifiedName, kind);
        String containerName = qualifiedName.substring(0, split);
        List<UnitId> containers = visible(byQualifiedName.getOrDefault(containerName, Set.of()));
        if (containers.size() != 1) {
            throw new IllegalArgumentException("Container '" + containerName + "' of '" + qualifiedName
                    + "' is not a single interned unit: " + containers);
        }
        return intern(containers.get(0), qualifiedName.substring(split + 2), kind);
    }

    /**
     * Interns a unit even though its name clashes with another kind. Which of the two ends up
     * shadowed is settled by {@link #normalizeConflicts()}.
     */
    public UnitId internShadow(UnitId container, String name, UnitKind kind) {
        UnitId id = UnitId.of(kind, container, name, fileKey);
        if (units.containsKey(id)) return id;
        String qualifiedName = ProgramUnit.qualify(container != null ? unit(container).qualifiedName() : null, name);
        return add(id, kind, name, qualifiedName, container);
    }

    private UnitId add(UnitId id, UnitKind kind, String name, String qualifiedName, UnitId container) {
        addUnit(new ProgramUnit(id, kind, name, qualifiedName, container, null, UnitPayload.emptyFor(kind)));
        return id;
    }

    private void addUnit(ProgramUnit unit) {
        if (unit.container() != null && !units.containsKey(unit.container())) {
            throw new IllegalStateException("Container " + unit.container() + " of " + unit.id() + " is not registered");
        }
        store(unit);
        if (unit.container() == null) {
            topLevel.add(unit.id());
            topLevelByName.computeIfAbsent(unit.name(), k -> new TreeSet<>()).add(unit.id());
        } else {
            children.computeIfAbsent(unit.container(), k -> new TreeSet<>()).add(unit.id());
        }
        byQualifiedName.computeIfAbsent(unit.qualifiedName(), k -> new TreeSet<>()).add(unit.id());
    }

    private void store(ProgramUnit unit) {
        units.put(unit.id(), unit);
        if (unit.payload() instanceof InterfacePayload payload) {
            for (String member : payload.memberNames()) {
                interfacesByMember.computeIfAbsent(member, k -> new TreeSet<>()).add(unit.id());
            }
        }
    }

    /** Attaches a definition to an interned unit. A second definition is combined with the first. */
    public void define(UnitId id, SourceLocation location, UnitPayload payload) {
        ProgramUnit existing = unit(id);
        ProgramUnit defined = existing.withDefinition(location, payload);
        store(existing.isDefined() ? combine(existing, defined) : defined);
    }

    /**
     * Combines two records of one unit. The defined one wins over a placeholder; between two
     * definitions the one of higher precedence keeps its location, and module accessibility and
     * interface members are unioned.
     */
    static ProgramUnit combine(ProgramUnit a, ProgramUnit b) {
        if (!b.isDefined()) return a;
        if (!a.isDefined()) return b;
        ProgramUnit first = ProgramUnit.PRECEDENCE.compare(a, b) <= 0 ? a : b;
        ProgramUnit second = first == a ? b : a;
        UnitPayload payload = first.payload();
        if (first.payload() instanceof ModulePayload m1 && second.payload() instanceof ModulePayload m2) {
            payload = m1.merge(m2);
        } else if (first.payload() instanceof InterfacePayload i1 && second.payload() instanceof InterfacePayload i2) {
            payload = i1.merge(i2);
        }
        return first.withDefinition(first.location(), payload);
    }

    public void declare(UnitId scope, VariableDecl decl) {
        unit(scope);
        variables.computeIfAbsent(scope, k -> new TreeMap<>()).put(decl.name(), decl);
    }

    /** @return false if the edge was already present */
    public boolean addUse(UsesEdge edge) {
        unit(edge.from());
        unit(edge.module());
        if (!uses.add(edge)) return false;
        usesByScope.computeIfAbsent(edge.from(), k -> new TreeSet<>(UsesEdge.ORDER)).add(edge);
        usersOf.computeIfAbsent(edge.module(), k -> new TreeSet<>()).add(topLevelOf(edge.from()));
        return true;
    }

    public void addCallSite(CallSite site) {
        unit(site.caller());
        callSites.put(site.id(), site);
        sitesByTopLevel.computeIfAbsent(topLevelOf(site.caller()), k -> new TreeSet<>()).add(site.id());
        sitesByCallee.computeIfAbsent(site.calleeName(), k -> new TreeSet<>()).add(site.id());
    }

    public void setResolution(String callSiteId, Resolution resolution) {
        if (!callSites.containsKey(callSiteId)) {
            throw new IllegalArgumentException("Unknown call site: " + callSiteId);
        }
        resolutions.put(callSiteId, resolution);
    }

    public void bindMembers(UnitId iface, InterfaceMembers bound) {
        if (unit(iface).kind() != UnitKind.INTERFACE) {
            throw new IllegalArgumentException(iface + " is not an interface");
        }
        members.put(iface, bound);
    }

    public void recordDiagnostic(Diagnostic diagnostic) {
        recorded.add(diagnostic);
    }

    public void removeDiagnostic(Diagnostic diagnostic) {
        recorded.remove(diagnostic);
    }

    // ------------------------------------------------------------------
    // Conflicts
    // ------------------------------------------------------------------

    /** Recomputes shadows and conflict diagnostics from scratch. */
    public void normalizeConflicts() {
        shadowed.clear();
        conflicts.clear();
        normalizeConflicts(byQualifiedName.keySet());
    }

    /**
     * Recomputes shadows and conflict diagnostics of the given qualified names only. Within each
     * name, units are taken in precedence order; a unit incompatible with one already kept
     * becomes a shadow.
     *
     * @return the units whose shadow status flipped
     */
    public Set<UnitId> normalizeConflicts(Collection<String> qualifiedNames) {
        Set<UnitId> flipped = new TreeSet<>();
        for (String qualifiedName : new TreeSet<>(qualifiedNames)) {
            Set<UnitId> group = byQualifiedName.getOrDefault(qualifiedName, Set.of());
            Set<UnitId> before = new HashSet<>();
            for (UnitId id : group) {
                if (shadowed.remove(id)) before.add(id);
            }
            conflicts.remove(qualifiedName);
            if (group.size() >= 2) normalizeGroup(qualifiedName, group);
            for (UnitId id : group) {
                if (before.contains(id) != shadowed.contains(id)) flipped.add(id);
            }
        }
        return flipped;
    }

    private void normalizeGroup(String qualifiedName, Set<UnitId> group) {
        List<ProgramUnit> ordered = new ArrayList<>();
        for (UnitId id : group) ordered.add(units.get(id));
        ordered.sort(ProgramUnit.PRECEDENCE);

        List<Diagnostic> found = new ArrayList<>();
        List<ProgramUnit> kept = new ArrayList<>();
        for (ProgramUnit u : ordered) {
            ProgramUnit clash = null;
            ProgramUnit duplicate = null;
            for (ProgramUnit k : kept) {
                if (k.kind() == u.kind()) {
                    duplicate = k;
                } else if (!UnitKind.compatible(k.kind(), u.kind())) {
                    clash = k;
                    break;
                }
            }
            if (clash != null) {
                shadowed.add(u.id());
                found.add(diagnosticFor(u, DiagnosticKind.NAME_KIND_CONFLICT,
                        "'" + u.qualifiedName() + "' as " + u.kind().tag() + " conflicts with "
                                + clash.kind().tag() + " " + clash.id() + "; kept as shadow"));
            } else {
                kept.add(u);
                if (duplicate != null) {
                    found.add(diagnosticFor(u, DiagnosticKind.DUPLICATE_DEFINITION,
                            "'" + u.qualifiedName() + "' is also defined as " + duplicate.id()));
                }
            }
        }
        if (!found.isEmpty()) conflicts.put(qualifiedName, found);
    }

    private static Diagnostic diagnosticFor(ProgramUnit u, DiagnosticKind kind, String message) {
        SourceLocation loc = u.location();
        return new Diagnostic(kind, loc != null ? loc.file() : null, loc != null ? loc.line() : 0, u.id(), message);
    }

    public boolean isShadowed(UnitId id) {
        return shadowed.contains(id);
    }

    // ------------------------------------------------------------------
    // Union
    // ------------------------------------------------------------------

    /**
     * Copies every entity of {@code other} into this registry. Units with the same id are
     * combined; the outcome does not depend on the order registries are absorbed in.
     * Interface bindings are not copied and shadows are not recomputed; callers renormalize
     * and rebind after absorbing.
     *
     * @return the units this registry now sees differently: new or redefined units, scopes with
     *         a changed variable, and scopes with a new USE edge
     */
    public Set<UnitId> absorb(NodeRegistry other) {
        Set<UnitId> changed = new TreeSet<>();
        // TreeMap order puts every container before its children
        for (ProgramUnit u : other.units.values()) {
            ProgramUnit mine = units.get(u.id());
            if (mine == null) {
                addUnit(u);
                changed.add(u.id());
            } else {
                ProgramUnit combined = combine(mine, u);
                if (!combined.equals(mine)) {
                    store(combined);
                    changed.add(u.id());
                }
            }
        }
        other.variables.forEach((scope, decls) -> {
            Map<String, VariableDecl> mine = variables.computeIfAbsent(scope, k -> new TreeMap<>());
            decls.forEach((name, decl) -> {
                VariableDecl before = mine.get(name);
                VariableDecl after = mine.merge(name, decl, (x, y) -> VariableDecl.ORDER.compare(x, y) <= 0 ? x : y);
                if (!after.equals(before)) changed.add(scope);
            });
        });
        for (UsesEdge edge : other.uses) {
            if (addUse(edge)) changed.add(edge.from());
        }
        for (CallSite site : other.callSites.values()) {
            if (!callSites.containsKey(site.id())) addCallSite(site);
        }
        other.resolutions.forEach(resolutions::putIfAbsent);
        recorded.addAll(other.recorded);
        return changed;
    }

    // ------------------------------------------------------------------
    // Queries
    // ------------------------------------------------------------------

    /** @throws IllegalArgumentException if no unit has this id */
    public ProgramUnit unit(UnitId id) {
        ProgramUnit u = units.get(id);
        if (u == null) throw new IllegalArgumentException("Unknown unit: " + id);
        return u;
    }

    public Optional<ProgramUnit> find(UnitId id) {
        return Optional.ofNullable(units.get(id));
    }

    /** All units in id order, shadows included. */
    public Collection<ProgramUnit> units() {
        return Collections.unmodifiableCollection(units.values());
    }

    public int unitCount() {
        return units.size();
    }

    public UnitId containerOf(UnitId id) {
        return unit(id).container();
    }

    public List<UnitId> childrenOf(UnitId id) {
        return new ArrayList<>(children.getOrDefault(id, Set.of()));
    }

    public List<UnitId> topLevelUnits() {
        return new ArrayList<>(topLevel);
    }

    /** Units with this qualified name, shadows included. */
    public List<UnitId> byQualifiedName(String qualifiedName) {
        return new ArrayList<>(byQualifiedName.getOrDefault(qualifiedName, Set.of()));
    }

    /** Containment is carried by each unit's container; edges are derived from it. */
    public List<ContainsEdge> containsEdges() {
        List<ContainsEdge> edges = new ArrayList<>();
        for (ProgramUnit u : units.values()) {
            if (u.container() != null) edges.add(new ContainsEdge(u.container(), u.id()));
        }
        return edges;
    }

    public List<UsesEdge> usesEdges() {
        return new ArrayList<>(uses);
    }

    public List<UsesEdge> usesFrom(UnitId scope) {
        return new ArrayList<>(usesByScope.getOrDefault(scope, Set.of()));
    }

    /** Variables declared directly in {@code scope}, by name. */
    public Map<String, VariableDecl> variables(UnitId scope) {
        return Collections.unmodifiableMap(variables.getOrDefault(scope, Map.of()));
    }

    public VariableDecl variable(UnitId scope, String name) {
        return variables.getOrDefault(scope, Map.of()).get(name);
    }

    public InterfaceMembers interfaceMembers(UnitId iface) {
        return members.getOrDefault(iface, InterfaceMembers.NONE);
    }

    public List<UnitId> interfaces() {
        List<UnitId> result = new ArrayList<>();
        for (ProgramUnit u : units.values()) {
            if (u.kind() == UnitKind.INTERFACE) result.add(u.id());
        }
        return result;
    }

    public Collection<CallSite> callSites() {
        return Collections.unmodifiableCollection(callSites.values());
    }

    public CallSite callSite(String id) {
        return callSites.get(id);
    }

    public Resolution resolution(String callSiteId) {
        return resolutions.get(callSiteId);
    }

    /** Every call site with its resolution; a site not yet resolved reads as {@code UNKNOWN}. */
    public List<CallEdge> callEdges() {
        List<CallEdge> edges = new ArrayList<>();
        for (CallSite site : callSites.values()) {
            edges.add(new CallEdge(site, resolutions.getOrDefault(site.id(), Resolution.unknown())));
        }
        return edges;
    }

    public List<Diagnostic> diagnostics() {
        List<Diagnostic> all = new ArrayList<>(recorded);
        conflicts.values().forEach(all::addAll);
        all.sort(Diagnostic.ORDER);
        return all;
    }

    /** The outermost container of {@code id}, or {@code id} itself if it is top level. */
    public UnitId topLevelOf(UnitId id) {
        UnitId top = id;
        for (UnitId c = containerOf(id); c != null; c = containerOf(c)) top = c;
        return top;
    }

    /** Top-level units named {@code name} that are not shadowed. */
    public List<UnitId> topLevelNamed(String name) {
        return visible(topLevelByName.getOrDefault(name, Set.of()));
    }

    /** Top-level units holding a USE of {@code module} anywhere inside them. */
    public Set<UnitId> usersOf(UnitId module) {
        return Collections.unmodifiableSet(usersOf.getOrDefault(module, Set.of()));
    }

    /** {@code top} and every unit nested in it, containers first. */
    public List<UnitId> unitsUnder(UnitId top) {
        List<UnitId> result = new ArrayList<>();
        Deque<UnitId> work = new ArrayDeque<>();
        work.add(top);
        while (!work.isEmpty()) {
            UnitId id = work.poll();
            result.add(id);
            work.addAll(children.getOrDefault(id, Set.of()));
        }
        return result;
    }

    /** Call sites whose caller is {@code top} or nested in it. */
    public List<CallSite> callSitesIn(UnitId top) {
        return sitesById(sitesByTopLevel.getOrDefault(top, Set.of()));
    }

    /** Call sites naming {@code calleeName}. */
    public List<CallSite> callSitesNamed(String calleeName) {
        return sitesById(sitesByCallee.getOrDefault(calleeName, Set.of()));
    }

    private List<CallSite> sitesById(Set<String> ids) {
        List<CallSite> result = new ArrayList<>();
        for (String id : ids) result.add(callSites.get(id));
        return result;
    }

    /** Interfaces listing {@code memberName} among their members, shadows included. */
    public Set<UnitId> interfacesWithMember(String memberName) {
        return Collections.unmodifiableSet(interfacesByMember.getOrDefault(memberName, Set.of()));
    }

    // ------------------------------------------------------------------
    // Scoped lookup
    // ------------------------------------------------------------------

    /**
     * Units visible as {@code name} from {@code scope}: the innermost scope of the containment
     * chain that has a unit of that name, otherwise every unit reachable through the USE
     * statements of the innermost chain scope that yields any, otherwise top-level units.
     * Shadows are never returned.
     */
    public List<UnitId> resolveName(UnitId scope, String name) {
        List<UnitId> hits = new ArrayList<>(lookup(scope, name, this::visibleChildren));
        if (hits.isEmpty()) hits.addAll(topLevelNamed(name));
        Collections.sort(hits);
        return hits;
    }

    /**
     * Whether {@code name} is a variable of {@code scope} or an enclosing scope (a dummy
     * procedure, say) before any unit of that name is reached along the chain.
     */
    public boolean namesVariable(UnitId scope, String name) {
        for (UnitId s = scope; s != null; s = containerOf(s)) {
            if (!visibleChildren(s, name).isEmpty()) return false;
            if (variable(s, name) != null) return true;
        }
        return false;
    }

    /** The declaration {@code name} refers to from {@code scope}, looked up like {@link #resolveName}. */
    public Optional<VariableDecl> lookupVariable(UnitId scope, String name) {
        List<VariableDecl> hits = lookup(scope, name, (s, n) -> {
            VariableDecl d = variable(s, n);
            return d == null ? List.of() : List.of(d);
        });
        return hits.stream().min(VariableDecl.ORDER);
    }

    private List<UnitId> visibleChildren(UnitId scope, String name) {
        List<UnitId> result = new ArrayList<>();
        for (UnitId child : children.getOrDefault(scope, Set.of())) {
            if (units.get(child).name().equals(name) && !shadowed.contains(child)) result.add(child);
        }
        return result;
    }

    private List<UnitId> visible(Set<UnitId> ids) {
        List<UnitId> result = new ArrayList<>();
        for (UnitId id : ids) {
            if (!shadowed.contains(id)) result.add(id);
        }
        return result;
    }

    private <T> List<T> lookup(UnitId scope, String name, BiFunction<UnitId, String, List<T>> local) {
        for (UnitId s = scope; s != null; s = containerOf(s)) {
            List<T> hits = local.apply(s, name);
            if (!hits.isEmpty()) return hits;
        }
        for (UnitId s = scope; s != null; s = containerOf(s)) {
            Set<T> found = new LinkedHashSet<>();
            for (UsesEdge use : usesFrom(s)) {
                String remote = use.remoteNameOf(name);
                if (remote != null) found.addAll(exported(use.module(), remote, local, new HashSet<>()));
            }
            if (!found.isEmpty()) return new ArrayList<>(found);
        }
        return List.of();
    }

    /**
     * Entities a module makes available as {@code name}: its own public ones, or, when the name
     * is listed explicitly as public, those it re-exports from modules it uses.
     */
    private <T> List<T> exported(UnitId module, String name, BiFunction<UnitId, String, List<T>> local,
                                 Set<UnitId> visited) {
        if (!visited.add(module)) return List.of();
        ProgramUnit unit = units.get(module);
        if (unit == null || !(unit.payload() instanceof ModulePayload access)) return List.of();
        if (!access.isPublic(name)) return List.of();
        List<T> own = local.apply(module, name);
        if (!own.isEmpty()) return own;
        if (!access.isExplicitlyPublic(name)) return List.of();
        Set<T> found = new LinkedHashSet<>();
        for (UsesEdge use : usesFrom(module)) {
            String remote = use.remoteNameOf(name);
            if (remote != null) found.addAll(exported(use.module(), remote, local, visited));
        }
        return new ArrayList<>(found);
    }
}
