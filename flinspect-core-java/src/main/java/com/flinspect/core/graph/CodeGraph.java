package com.flinspect.core.graph;

import com.flinspect.core.model.ArgumentDescriptor;
import com.flinspect.core.model.CallEdge;
import com.flinspect.core.model.ComponentDescriptor;
import com.flinspect.core.model.ContainsEdge;
import com.flinspect.core.model.Diagnostic;
import com.flinspect.core.model.InterfaceMembers;
import com.flinspect.core.model.ProgramUnit;
import com.flinspect.core.model.ResolutionStatus;
import com.flinspect.core.model.UnitId;
import com.flinspect.core.model.UnitKind;
import com.flinspect.core.model.UnitPayload.DerivedTypePayload;
import com.flinspect.core.model.UnitPayload.SubprogramPayload;
import com.flinspect.core.model.UsesEdge;
import com.flinspect.core.model.VariableDecl;
import com.flinspect.core.registry.NodeRegistry;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Read-only view of a merged graph: units, their declared members, Contains/Uses/Calls edges,
 * diagnostics, and traversal over any edge type.
 *
 * Edge indexes are built once from the registry's state at construction.
 */
public class CodeGraph {

    private final NodeRegistry registry;
    private final List<CallEdge> calls;
    private final Map<UnitId, List<CallEdge>> callsFrom = new TreeMap<>();
    private final Map<UnitId, List<CallEdge>> callsTo = new TreeMap<>();

    public CodeGraph(NodeRegistry registry) {
        this.registry = registry;
        this.calls = registry.callEdges();
        for (CallEdge edge : calls) {
            callsFrom.computeIfAbsent(edge.caller(), k -> new ArrayList<>()).add(edge);
            for (UnitId target : edge.resolution().candidates()) {
                callsTo.computeIfAbsent(target, k -> new ArrayList<>()).add(edge);
            }
        }
    }

    // --- units ---

    public List<ProgramUnit> units() {
        return new ArrayList<>(registry.units());
    }

    public List<ProgramUnit> units(UnitKind kind) {
        List<ProgramUnit> result = new ArrayList<>();
        for (ProgramUnit u : registry.units()) {
            if (u.kind() == kind) result.add(u);
        }
        return result;
    }

    public Optional<ProgramUnit> unit(UnitId id) {
        return registry.find(id);
    }

    /** Units with this qualified name ({@code m::s}), shadows included. */
    public List<ProgramUnit> byQualifiedName(String qualifiedName) {
        List<ProgramUnit> result = new ArrayList<>();
        for (UnitId id : registry.byQualifiedName(qualifiedName)) result.add(registry.unit(id));
        return result;
    }

    public boolean isShadowed(UnitId id) {
        return registry.isShadowed(id);
    }

    /** Dummy arguments of a subroutine or function; empty for other kinds. */
    public List<ArgumentDescriptor> arguments(UnitId id) {
        if (registry.unit(id).payload() instanceof SubprogramPayload sub) return sub.arguments();
        return List.of();
    }

    public InterfaceMembers interfaceMembers(UnitId id) {
        return registry.interfaceMembers(id);
    }

    public List<ComponentDescriptor> components(UnitId id) {
        if (registry.unit(id).payload() instanceof DerivedTypePayload type) return type.components();
        return List.of();
    }

    public List<VariableDecl> variables(UnitId id) {
        return new ArrayList<>(registry.variables(id).values());
    }

    // --- edges ---

    public List<ContainsEdge> containsEdges() {
        return registry.containsEdges();
    }

    public List<ContainsEdge> containsEdges(UnitId id, Direction direction) {
        List<ContainsEdge> result = new ArrayList<>();
        for (ContainsEdge e : registry.containsEdges()) {
            if (id.equals(direction == Direction.FORWARD ? e.parent() : e.child())) result.add(e);
        }
        return result;
    }

    public List<UsesEdge> usesEdges() {
        return registry.usesEdges();
    }

    public List<UsesEdge> usesEdges(UnitId id, Direction direction) {
        if (direction == Direction.FORWARD) return registry.usesFrom(id);
        List<UsesEdge> result = new ArrayList<>();
        for (UsesEdge e : registry.usesEdges()) {
            if (e.module().equals(id)) result.add(e);
        }
        return result;
    }

    public List<CallEdge> callEdges() {
        return new ArrayList<>(calls);
    }

    /** FORWARD: calls made by {@code id}. BACKWARD: calls with {@code id} among their targets. */
    public List<CallEdge> callEdges(UnitId id, Direction direction) {
        Map<UnitId, List<CallEdge>> index = direction == Direction.FORWARD ? callsFrom : callsTo;
        return new ArrayList<>(index.getOrDefault(id, List.of()));
    }

    public List<CallEdge> callsByStatus(ResolutionStatus status) {
        List<CallEdge> result = new ArrayList<>();
        for (CallEdge e : calls) {
            if (e.status() == status) result.add(e);
        }
        return result;
    }

    // --- diagnostics ---

    public List<Diagnostic> diagnostics() {
        return registry.diagnostics();
    }

    public List<Diagnostic> diagnostics(UnitId subject) {
        List<Diagnostic> result = new ArrayList<>();
        for (Diagnostic d : registry.diagnostics()) {
            if (Objects.equals(d.subject(), subject)) result.add(d);
        }
        return result;
    }

    // --- traversal ---

    /** Units one edge of {@code type} away from {@code id} in {@code direction}. */
    public Set<UnitId> neighbours(UnitId id, EdgeType type, Direction direction) {
        Set<UnitId> result = new TreeSet<>();
        switch (type) {
            case CONTAINS -> {
                if (direction == Direction.FORWARD) {
                    result.addAll(registry.childrenOf(id));
                } else if (registry.containerOf(id) != null) {
                    result.add(registry.containerOf(id));
                }
            }
            case USES -> {
                for (UsesEdge e : usesEdges(id, direction)) {
                    result.add(direction == Direction.FORWARD ? e.module() : e.from());
                }
            }
            case CALLS -> {
                for (CallEdge e : callEdges(id, direction)) {
                    if (direction == Direction.FORWARD) {
                        result.addAll(e.resolution().candidates());
                    } else {
                        result.add(e.caller());
                    }
                }
            }
        }
        return result;
    }

    /**
     * Every unit reachable from {@code id} by one or more edges of {@code type}. The start unit is
     * included only if it lies on a cycle. Ambiguous calls contribute all their candidates.
     */
    public Set<UnitId> closure(UnitId id, EdgeType type, Direction direction) {
        Set<UnitId> reached = new TreeSet<>();
        Deque<UnitId> work = new ArrayDeque<>(neighbours(id, type, direction));
        while (!work.isEmpty()) {
            UnitId next = work.poll();
            if (reached.add(next)) work.addAll(neighbours(next, type, direction));
        }
        return reached;
    }

    /**
     * USE edges lifted to top-level units: for each top-level unit, the modules used anywhere
     * inside it, itself excluded.
     */
    public Map<UnitId, Set<UnitId>> moduleDependencies() {
        Map<UnitId, Set<UnitId>> deps = new TreeMap<>();
        for (UnitId top : registry.topLevelUnits()) deps.put(top, new TreeSet<>());
        for (UsesEdge e : registry.usesEdges()) {
            UnitId top = topLevelOf(e.from());
            if (!top.equals(e.module())) deps.get(top).add(e.module());
        }
        return deps;
    }

    public UnitId topLevelOf(UnitId id) {
        UnitId top = id;
        while (registry.containerOf(top) != null) top = registry.containerOf(top);
        return top;
    }
}
