package com.flinspect.core.forest;

import com.flinspect.core.model.CallSite;
import com.flinspect.core.model.Resolution;
import com.flinspect.core.model.UnitId;
import com.flinspect.core.model.UnitKind;
import com.flinspect.core.registry.NodeRegistry;
import com.flinspect.core.resolve.CallResolver;
import com.flinspect.core.resolve.InterfaceBinder;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;

/**
 * Absorbs file graphs into a forest registry and re-resolves the calls the batch can affect.
 *
 * The affected region starts from the top-level units the batch changed (a new or redefined
 * unit, a changed variable, a new USE edge, a flipped shadow) and grows through the top-level
 * units that USE a module in it. Interfaces in the region, and those listing a changed top-level
 * name as a member, are rebound; an interface whose binding changed adds its own users. The
 * calls re-resolved are those made from the region, those naming a changed top-level unit, and
 * every call of the batch. Every other call keeps its resolution.
 *
 * Affected calls are re-resolved in parallel when a pool is given, and written back from the
 * calling thread. The result does not depend on the order graphs are absorbed in.
 */
public class GraphUnion {

    private static final int CHUNK = 64;

    private final ExecutorService pool;

    public GraphUnion() {
        this(null);
    }

    /** @param pool workers for re-resolution, or null to re-resolve on the calling thread */
    public GraphUnion(ExecutorService pool) {
        this.pool = pool;
    }

    /** A new registry holding both graphs. */
    public NodeRegistry union(NodeRegistry a, NodeRegistry b) {
        NodeRegistry merged = NodeRegistry.merged();
        absorbAll(merged, List.of(a, b));
        return merged;
    }

    /**
     * Absorbs {@code incoming} into {@code forest} in place.
     *
     * @return the number of call sites re-resolved
     */
    public int absorbAll(NodeRegistry forest, List<NodeRegistry> incoming) {
        Set<UnitId> changed = new TreeSet<>();
        Map<String, CallSite> affected = new TreeMap<>();
        for (NodeRegistry graph : incoming) {
            changed.addAll(forest.absorb(graph));
            for (CallSite site : graph.callSites()) affected.put(site.id(), site);
        }
        Set<String> qualifiedNames = new TreeSet<>();
        for (UnitId id : changed) qualifiedNames.add(forest.unit(id).qualifiedName());
        changed.addAll(forest.normalizeConflicts(qualifiedNames));

        Set<UnitId> seeds = new TreeSet<>();
        for (UnitId id : changed) seeds.add(forest.topLevelOf(id));
        Set<UnitId> region = dependents(forest, seeds);

        Set<UnitId> toBind = new TreeSet<>();
        for (UnitId top : region) {
            for (UnitId id : forest.unitsUnder(top)) {
                if (forest.unit(id).kind() == UnitKind.INTERFACE) toBind.add(id);
            }
        }
        for (UnitId top : seeds) toBind.addAll(forest.interfacesWithMember(forest.unit(top).name()));
        Set<UnitId> rebound = new InterfaceBinder(forest).rebind(toBind);

        // binding reads units only, never other bindings, so one round suffices
        Set<UnitId> reboundTops = new TreeSet<>();
        for (UnitId iface : rebound) reboundTops.add(forest.topLevelOf(iface));
        region.addAll(dependents(forest, reboundTops));

        Set<UnitId> named = new TreeSet<>(seeds);
        named.addAll(reboundTops);
        for (UnitId top : region) {
            for (CallSite site : forest.callSitesIn(top)) affected.put(site.id(), site);
        }
        for (UnitId top : named) {
            for (CallSite site : forest.callSitesNamed(forest.unit(top).name())) affected.put(site.id(), site);
        }

        List<CallSite> sites = new ArrayList<>(affected.values());
        List<Resolution> results = resolve(forest, sites);
        for (int i = 0; i < sites.size(); i++) {
            forest.setResolution(sites.get(i).id(), results.get(i));
        }

        System.err.println("[flinspect] Union: " + incoming.size() + " graphs into " + forest.unitCount()
                + " units, re-resolved " + sites.size() + " of " + forest.callSites().size()
                + " call sites, rebound " + rebound.size() + " interfaces");
        return sites.size();
    }

    /** {@code seeds} and every top-level unit that reaches one of them through USE statements. */
    private static Set<UnitId> dependents(NodeRegistry forest, Set<UnitId> seeds) {
        Set<UnitId> seen = new TreeSet<>(seeds);
        Deque<UnitId> work = new ArrayDeque<>(seeds);
        while (!work.isEmpty()) {
            for (UnitId user : forest.usersOf(work.poll())) {
                if (seen.add(user)) work.add(user);
            }
        }
        return seen;
    }

    private List<Resolution> resolve(NodeRegistry merged, List<CallSite> sites) {
        CallResolver resolver = new CallResolver(merged);
        if (pool == null || sites.size() <= CHUNK) {
            List<Resolution> results = new ArrayList<>();
            for (CallSite site : sites) results.add(resolver.resolve(site));
            return results;
        }

        List<Future<List<Resolution>>> futures = new ArrayList<>();
        for (int start = 0; start < sites.size(); start += CHUNK) {
            List<CallSite> chunk = sites.subList(start, Math.min(sites.size(), start + CHUNK));
            futures.add(pool.submit(() -> {
                List<Resolution> part = new ArrayList<>();
                for (CallSite site : chunk) part.add(resolver.resolve(site));
                return part;
            }));
        }
        List<Resolution> results = new ArrayList<>();
        try {
            for (Future<List<Resolution>> f : futures) results.addAll(f.get());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while re-resolving calls", e);
        } catch (ExecutionException e) {
            throw new IllegalStateException("Call re-resolution failed: " + e.getCause(), e.getCause());
        }
        return results;
    }
}
