package com.flinspect.core.resolve;

import com.flinspect.core.model.ActualArgument;
import com.flinspect.core.model.CallForm;
import com.flinspect.core.model.CallSite;
import com.flinspect.core.model.ExpressionDescriptor;
import com.flinspect.core.model.ProgramUnit;
import com.flinspect.core.model.Resolution;
import com.flinspect.core.model.ResolutionStatus;
import com.flinspect.core.model.UnitId;
import com.flinspect.core.model.UnitKind;
import com.flinspect.core.model.UnitPayload.SubprogramPayload;
import com.flinspect.core.registry.NodeRegistry;

import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;

/**
 * Resolves call sites against the procedures their callee name can reach.
 *
 * The candidate set is the named procedure itself, or the bound members of a generic interface
 * of that name. A callee that names a variable of the calling scope, such as a dummy
 * procedure, has no static candidates. Candidates are filtered by arity, keyword binding, and the declared type and
 * rank of each bound argument. Zero survivors resolve {@code UNKNOWN}, one {@code RESOLVED},
 * more {@code AMBIGUOUS} with every survivor kept.
 *
 * {@link #resolve(CallSite)} only reads the registry and may run on several threads once the
 * registry is populated and interfaces are bound.
 */
public class CallResolver {

    private final NodeRegistry registry;
    private final ExpressionDescriber describer;

    public CallResolver(NodeRegistry registry) {
        this.registry = registry;
        this.describer = new ExpressionDescriber(registry);
    }

    /** Binds interfaces, then resolves every call site and stores the results. */
    public Map<ResolutionStatus, Integer> resolveAll() {
        new InterfaceBinder(registry).bindAll();
        return resolveSites(registry.callSites());
    }

    /** Resolves the given sites and stores the results; interfaces must already be bound. */
    public Map<ResolutionStatus, Integer> resolveSites(Collection<CallSite> sites) {
        Map<ResolutionStatus, Integer> counts = new EnumMap<>(ResolutionStatus.class);
        for (CallSite site : new ArrayList<>(sites)) {
            Resolution resolution = resolve(site);
            registry.setResolution(site.id(), resolution);
            counts.merge(resolution.status(), 1, Integer::sum);
        }
        return counts;
    }

    public Resolution resolve(CallSite site) {
        if (site.form() == CallForm.COMPONENT) {
            return Resolution.unknown();
        }
        // a dummy procedure or procedure variable is bound at run time
        if (registry.namesVariable(site.caller(), site.calleeName())) {
            return Resolution.unknown();
        }
        List<UnitId> via = new ArrayList<>();
        TreeSet<UnitId> candidates = new TreeSet<>();
        for (UnitId hit : registry.resolveName(site.caller(), site.calleeName())) {
            ProgramUnit unit = registry.unit(hit);
            if (unit.kind() == UnitKind.INTERFACE) {
                via.add(hit);
                candidates.addAll(registry.interfaceMembers(hit).bound());
            } else if (unit.kind().isProcedure()) {
                candidates.add(hit);
            }
        }
        if (candidates.isEmpty()) {
            return new Resolution(ResolutionStatus.UNKNOWN, List.of(), via);
        }

        List<ExpressionDescriptor> descriptors = describeArguments(site);
        List<UnitId> survivors = new ArrayList<>();
        for (UnitId candidate : candidates) {
            if (accepts(candidate, site, descriptors)) survivors.add(candidate);
        }
        return Resolution.of(survivors, via);
    }

    public List<ExpressionDescriptor> describeArguments(CallSite site) {
        List<ExpressionDescriptor> descriptors = new ArrayList<>();
        for (ActualArgument arg : site.arguments()) {
            descriptors.add(describer.describe(site.caller(), arg.expr()));
        }
        return descriptors;
    }

    private boolean accepts(UnitId candidate, CallSite site, List<ExpressionDescriptor> descriptors) {
        if (!(registry.unit(candidate).payload() instanceof SubprogramPayload signature)) {
            return true;
        }
        return ArgumentBinder.accepts(signature.arguments(), site.arguments(), descriptors);
    }
}
