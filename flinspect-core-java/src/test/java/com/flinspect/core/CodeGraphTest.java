package com.flinspect.core;

import com.flinspect.core.forest.ParseForest;
import com.flinspect.core.graph.CodeGraph;
import com.flinspect.core.graph.Direction;
import com.flinspect.core.graph.EdgeType;
import com.flinspect.core.model.ArgumentDescriptor;
import com.flinspect.core.model.CallEdge;
import com.flinspect.core.model.ProgramUnit;
import com.flinspect.core.model.ResolutionStatus;
import com.flinspect.core.model.UnitId;
import com.flinspect.core.model.UnitKind;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Queries over a forest built from the cross-file fixtures plus the keyword fixture.
 */
class CodeGraphTest {

    private static final Path FIXTURES =
        Paths.get(System.getProperty("user.dir"))
             .getParent()
             .resolve("test-fixtures/ptree");

    private static final UnitId GEOMETRY = UnitId.module("geometry");
    private static final UnitId AREA = new UnitId("module:geometry/interface:area");
    private static final UnitId CIRCLE = new UnitId("module:geometry/subroutine:area_circle");
    private static final UnitId RECT = new UnitId("module:geometry/subroutine:area_rect");
    private static final UnitId LOG_MSG = new UnitId("subroutine:log_msg@xfile_lib_ptree");
    private static final UnitId APP = new UnitId("program:shapes_app@xfile_app_ptree");

    private static CodeGraph graph;

    @BeforeAll
    static void buildForest() {
        ParseForest forest = new ParseForest();
        forest.ingest(List.of(
                FIXTURES.resolve("xfile_lib_ptree"),
                FIXTURES.resolve("xfile_app_ptree"),
                FIXTURES.resolve("keyword_args_ptree")));
        graph = forest.graph();
    }

    @Test
    void unitsCanBeListedByKind() {
        List<ProgramUnit> programs = graph.units(UnitKind.PROGRAM);
        assertEquals(1, programs.size());
        assertEquals(APP, programs.get(0).id());

        List<ProgramUnit> modules = graph.units(UnitKind.MODULE);
        assertEquals(3, modules.size());
        assertTrue(graph.units().size() > modules.size());
    }

    @Test
    void argumentsAndMembersAreExposed() {
        List<ArgumentDescriptor> args = graph.arguments(RECT);
        assertEquals(List.of("w", "h"), List.of(args.get(0).name(), args.get(1).name()));
        assertTrue(graph.arguments(GEOMETRY).isEmpty(), "Modules have no arguments");

        assertEquals(List.of(CIRCLE, RECT), graph.interfaceMembers(AREA).bound());
        assertTrue(graph.interfaceMembers(AREA).unbound().isEmpty());
    }

    @Test
    void containsEdgesRunBothWays() {
        Set<UnitId> children = graph.neighbours(GEOMETRY, EdgeType.CONTAINS, Direction.FORWARD);
        assertEquals(Set.of(AREA, CIRCLE, RECT), children);
        assertEquals(Set.of(GEOMETRY), graph.neighbours(CIRCLE, EdgeType.CONTAINS, Direction.BACKWARD));
        assertEquals(3, graph.containsEdges(GEOMETRY, Direction.FORWARD).size());
    }

    @Test
    void usesEdgesRunBothWays() {
        assertEquals(Set.of(GEOMETRY), graph.neighbours(APP, EdgeType.USES, Direction.FORWARD));
        assertEquals(Set.of(APP), graph.neighbours(GEOMETRY, EdgeType.USES, Direction.BACKWARD));
    }

    @Test
    void callEdgesRunBothWays() {
        Set<UnitId> callees = graph.neighbours(APP, EdgeType.CALLS, Direction.FORWARD);
        assertEquals(Set.of(CIRCLE, RECT, LOG_MSG), callees);

        List<CallEdge> intoCircle = graph.callEdges(CIRCLE, Direction.BACKWARD);
        assertEquals(1, intoCircle.size());
        assertEquals(APP, intoCircle.get(0).caller());
        assertEquals(5, graph.callEdges(APP, Direction.FORWARD).size());
    }

    @Test
    void callsCanBeFilteredByStatus() {
        for (CallEdge e : graph.callsByStatus(ResolutionStatus.UNKNOWN)) {
            assertTrue(e.resolution().candidates().isEmpty());
        }
        assertEquals(2, graph.callsByStatus(ResolutionStatus.UNKNOWN).size());
        assertEquals(7, graph.callsByStatus(ResolutionStatus.RESOLVED).size());
        assertTrue(graph.callsByStatus(ResolutionStatus.AMBIGUOUS).isEmpty());
    }

    @Test
    void closureExcludesStartUnlessCyclic() {
        Set<UnitId> reach = graph.closure(APP, EdgeType.CALLS, Direction.FORWARD);
        assertEquals(Set.of(CIRCLE, RECT, LOG_MSG), reach);
        assertFalse(reach.contains(APP));

        Set<UnitId> ancestors = graph.closure(CIRCLE, EdgeType.CONTAINS, Direction.BACKWARD);
        assertEquals(Set.of(GEOMETRY), ancestors);
    }

    @Test
    void moduleDependenciesLiftUsesToTopLevel() {
        Map<UnitId, Set<UnitId>> deps = graph.moduleDependencies();

        assertEquals(Set.of(GEOMETRY), deps.get(APP));
        assertEquals(Set.of(UnitId.module("keyword_args_mod")), deps.get(UnitId.module("caller_keyword_mod")));
        assertTrue(deps.get(GEOMETRY).isEmpty());
        assertEquals(GEOMETRY, graph.topLevelOf(CIRCLE));
    }

    @Test
    void byQualifiedNameFindsNestedUnits() {
        List<ProgramUnit> hits = graph.byQualifiedName("geometry::area_rect");
        assertEquals(1, hits.size());
        assertEquals(RECT, hits.get(0).id());
        assertTrue(graph.unit(new UnitId("module:nowhere")).isEmpty());
    }
}
