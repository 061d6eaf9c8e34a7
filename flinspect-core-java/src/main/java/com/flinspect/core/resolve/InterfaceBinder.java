package com.flinspect.core.resolve;

import com.flinspect.core.model.InterfaceMembers;
import com.flinspect.core.model.ProgramUnit;
import com.flinspect.core.model.UnitId;
import com.flinspect.core.model.UnitKind;
import com.flinspect.core.model.UnitPayload.InterfacePayload;
import com.flinspect.core.registry.NodeRegistry;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * Binds each interface's member names to procedures, looking them up from the scope that
 * declares the interface. Names with no procedure stay listed as unbound.
 */
public class InterfaceBinder {

    private final NodeRegistry registry;

    public InterfaceBinder(NodeRegistry registry) {
        this.registry = registry;
    }

    /** @return the number of member names left unbound */
    public int bindAll() {
        int unbound = 0;
        for (UnitId iface : registry.interfaces()) {
            InterfaceMembers members = bind(iface);
            registry.bindMembers(iface, members);
            unbound += members.unbound().size();
        }
        return unbound;
    }

    /**
     * Rebinds the given interfaces, storing only bindings that differ from the current ones.
     *
     * @return the interfaces whose binding changed
     */
    public Set<UnitId> rebind(Collection<UnitId> interfaces) {
        Set<UnitId> changed = new TreeSet<>();
        for (UnitId iface : interfaces) {
            InterfaceMembers members = bind(iface);
            if (!members.equals(registry.interfaceMembers(iface))) {
                registry.bindMembers(iface, members);
                changed.add(iface);
            }
        }
        return changed;
    }

    InterfaceMembers bind(UnitId iface) {
        ProgramUnit unit = registry.unit(iface);
        if (!(unit.payload() instanceof InterfacePayload payload)) {
            return InterfaceMembers.NONE;
        }
        UnitId scope = unit.container();
        Set<UnitId> bound = new LinkedHashSet<>();
        List<String> unbound = new ArrayList<>();
        for (String name : payload.memberNames()) {
            boolean found = false;
            for (UnitId hit : lookup(scope, name)) {
                if (registry.unit(hit).kind().isProcedure()) {
                    bound.add(hit);
                    found = true;
                }
            }
            if (!found) unbound.add(name);
        }
        return new InterfaceMembers(new ArrayList<>(bound), unbound);
    }

    private List<UnitId> lookup(UnitId scope, String name) {
        if (scope != null) return registry.resolveName(scope, name);
        List<UnitId> globals = new ArrayList<>();
        for (UnitId id : registry.topLevelNamed(name)) {
            if (registry.unit(id).kind() != UnitKind.INTERFACE) globals.add(id);
        }
        return globals;
    }
}
