package com.flinspect.core;

import com.flinspect.core.forest.FileIngestor;
import com.flinspect.core.model.CallEdge;
import com.flinspect.core.model.ExpressionDescriptor;
import com.flinspect.core.model.ExpressionDescriptor.ArrayElementOrSlice;
import com.flinspect.core.model.ExpressionDescriptor.StructureComponent;
import com.flinspect.core.model.ExpressionDescriptor.Unclassified;
import com.flinspect.core.model.Resolution;
import com.flinspect.core.model.ResolutionStatus;
import com.flinspect.core.model.UnitId;
import com.flinspect.core.registry.NodeRegistry;
import com.flinspect.core.resolve.CallResolver;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Resolution of generic calls, one fixture per way arguments narrow the candidates.
 */
class CallResolverTest {

    private static final Path FIXTURES =
        Paths.get(System.getProperty("user.dir"))
             .getParent()
             .resolve("test-fixtures/ptree");

    private static NodeRegistry ingest(String fixture) {
        return new FileIngestor().ingest(FIXTURES.resolve(fixture));
    }

    /** Call edges in source order. */
    private static List<CallEdge> calls(NodeRegistry registry) {
        List<CallEdge> edges = new ArrayList<>(registry.callEdges());
        edges.sort(Comparator.comparingInt((CallEdge e) -> e.site().location().line()));
        return edges;
    }

    private static void assertResolved(String expected, CallEdge edge) {
        assertEquals(ResolutionStatus.RESOLVED, edge.status(), "Call at " + edge.site().location());
        assertEquals(new UnitId(expected), edge.resolution().target());
    }

    private static void assertAmbiguous(List<String> expected, CallEdge edge) {
        assertEquals(ResolutionStatus.AMBIGUOUS, edge.status(), "Call at " + edge.site().location());
        List<UnitId> ids = new ArrayList<>();
        for (String e : expected) ids.add(new UnitId(e));
        assertEquals(ids, edge.resolution().candidates());
    }

    @Test
    void intrinsicTypeSelectsSpecific() {
        List<CallEdge> edges = calls(ingest("interface_basic_ptree"));
        assertEquals(3, edges.size());

        assertResolved("module:interface_basic_mod/subroutine:compute_real", edges.get(0));
        assertResolved("module:interface_basic_mod/subroutine:compute_int", edges.get(1));
        assertResolved("module:interface_basic_mod/subroutine:compute_logical", edges.get(2));
        assertEquals(List.of(new UnitId("module:interface_basic_mod/interface:compute")),
                edges.get(0).resolution().via());
    }

    @Test
    void rankSelectsSpecific() {
        List<CallEdge> edges = calls(ingest("interface_rank_ptree"));

        assertResolved("module:interface_rank_mod/subroutine:process_1d", edges.get(0));
        assertResolved("module:interface_rank_mod/subroutine:process_2d", edges.get(1));
        assertResolved("module:interface_rank_mod/subroutine:process_3d", edges.get(2));
    }

    @Test
    void keywordsBindByNameRegardlessOfOrder() {
        List<CallEdge> edges = calls(ingest("keyword_args_ptree"));
        String scale = "module:keyword_args_mod/subroutine:transform_scale";
        String index = "module:keyword_args_mod/subroutine:transform_index";

        assertResolved(scale, edges.get(0));
        assertResolved(index, edges.get(1));
        assertResolved(scale, edges.get(2));
        assertResolved(index, edges.get(3));
    }

    @Test
    void optionalArgumentsWidenArity() {
        List<CallEdge> edges = calls(ingest("optional_args_ptree"));
        String simple = "module:optional_args_mod/subroutine:init_simple";
        String advanced = "module:optional_args_mod/subroutine:init_advanced";

        // two arguments fit both signatures
        assertAmbiguous(List.of(advanced, simple), edges.get(0));
        assertResolved(advanced, edges.get(1));
        assertResolved(advanced, edges.get(2));
        assertResolved(advanced, edges.get(3));
    }

    @Test
    void structureComponentsStayAmbiguous() {
        NodeRegistry registry = ingest("struct_component_ptree");
        List<CallEdge> edges = calls(registry);
        List<String> both = List.of(
                "module:struct_component_mod/subroutine:update_int",
                "module:struct_component_mod/subroutine:update_real");

        assertAmbiguous(both, edges.get(0));
        assertAmbiguous(both, edges.get(1));

        List<ExpressionDescriptor> described = new CallResolver(registry).describeArguments(edges.get(0).site());
        assertEquals(new StructureComponent("scalar_val"), described.get(0));
    }

    @Test
    void subscriptsReduceRankAndCallShapedArraysAreRecognised() {
        NodeRegistry registry = ingest("func_ref_array_ptree");
        List<CallEdge> edges = calls(registry);
        String twoD = "module:func_ref_array_mod/subroutine:send_data_2d";
        String threeD = "module:func_ref_array_mod/subroutine:send_data_3d";

        assertResolved(threeD, edges.get(0));
        assertResolved(twoD, edges.get(1));
        assertResolved(threeD, edges.get(2));
        assertAmbiguous(List.of(twoD, threeD), edges.get(3));

        CallResolver resolver = new CallResolver(registry);
        ExpressionDescriptor slice = resolver.describeArguments(edges.get(1).site()).get(0);
        assertEquals(2, ((ArrayElementOrSlice) slice).rank());
        ExpressionDescriptor element = resolver.describeArguments(edges.get(2).site()).get(0);
        assertEquals(3, ((ArrayElementOrSlice) element).rank());
        ExpressionDescriptor function = resolver.describeArguments(edges.get(3).site()).get(0);
        assertInstanceOf(Unclassified.class, function);
    }

    @Test
    void assumedShapeWithLowerBoundsKeepsRank() {
        List<CallEdge> edges = calls(ingest("assumed_shape_ptree"));

        assertResolved("module:assumed_shape_mod/subroutine:fill_data_2d", edges.get(0));
        assertResolved("module:assumed_shape_mod/subroutine:fill_data_1d", edges.get(1));
    }

    @Test
    void unreachableNamesAndComponentCallsAreUnknown() {
        List<CallEdge> edges = calls(ingest("xfile_app_ptree"));
        assertEquals(5, edges.size());
        for (CallEdge edge : edges) {
            assertEquals(ResolutionStatus.UNKNOWN, edge.status(), "Nothing is defined in this file alone");
            assertTrue(edge.resolution().candidates().isEmpty());
        }
    }

    @Test
    void argumentMismatchesRejectEveryCandidate(@TempDir Path tmp) throws IOException {
        Path file = tmp.resolve("strict_ptree");
        Files.writeString(file, """
            Program -> ProgramUnit -> Module
            | ModuleStmt -> Name = 'strict'
            | ModuleSubprogramPart
            | | ModuleSubprogram -> SubroutineSubprogram
            | | | SubroutineStmt
            | | | | Name = 'one'
            | | | | DummyArg -> Name = 'a'
            | | | SpecificationPart
            | | | | TypeDeclarationStmt
            | | | | | DeclarationTypeSpec -> IntrinsicTypeSpec -> IntegerTypeSpec ->
            | | | | | EntityDecl
            | | | | | | Name = 'a'
            | | ModuleSubprogram -> SubroutineSubprogram
            | | | SubroutineStmt
            | | | | Name = 'driver'
            | | | ExecutionPart -> Block
            | | | | ActionStmt -> CallStmt
            | | | | | Call
            | | | | | | ProcedureDesignator -> Name = 'one'
            | | | | | | ActualArgSpec
            | | | | | | | ActualArg -> Expr -> LiteralConstant -> IntLiteralConstant = '1'
            | | | | ActionStmt -> CallStmt
            | | | | | Call
            | | | | | | ProcedureDesignator -> Name = 'one'
            | | | | | | ActualArgSpec
            | | | | | | | ActualArg -> Expr -> LiteralConstant -> RealLiteralConstant
            | | | | | | | | Real = '1.5'
            | | | | ActionStmt -> CallStmt
            | | | | | Call
            | | | | | | ProcedureDesignator -> Name = 'one'
            | | | | | | ActualArgSpec
            | | | | | | | Keyword -> Name = 'b'
            | | | | | | | ActualArg -> Expr -> LiteralConstant -> IntLiteralConstant = '1'
            | | | | ActionStmt -> CallStmt
            | | | | | Call
            | | | | | | ProcedureDesignator -> Name = 'one'
            | | | | | | ActualArgSpec
            | | | | | | | ActualArg -> Expr -> LiteralConstant -> IntLiteralConstant = '1'
            | | | | | | ActualArgSpec
            | | | | | | | ActualArg -> Expr -> LiteralConstant -> IntLiteralConstant = '2'
            """);
        List<CallEdge> edges = calls(new FileIngestor().ingest(file));
        assertEquals(4, edges.size());

        // a specific procedure called by its own name, from its host module
        assertResolved("module:strict/subroutine:one", edges.get(0));
        Resolution wrongType = edges.get(1).resolution();
        assertEquals(ResolutionStatus.UNKNOWN, wrongType.status());
        assertTrue(wrongType.via().isEmpty());
        assertEquals(ResolutionStatus.UNKNOWN, edges.get(2).status(), "Keyword names no dummy");
        assertEquals(ResolutionStatus.UNKNOWN, edges.get(3).status(), "Too many arguments");
    }

    /** A module {@code shapes} with generic {@code p} over a rank-1 and a rank-2 specific. */
    private static final String RANKED_GENERIC = """
        Program -> ProgramUnit -> Module
        | ModuleStmt -> Name = 'shapes'
        | SpecificationPart
        | | DeclarationConstruct -> SpecificationConstruct -> InterfaceBlock
        | | | InterfaceStmt -> GenericSpec -> Name = 'p'
        | | | InterfaceSpecification -> ProcedureStmt
        | | | | Kind = ModuleProcedure
        | | | | Name = 'p1'
        | | | | Name = 'p2'
        | | | EndInterfaceStmt ->
        | ModuleSubprogramPart
        | | ContainsStmt
        | | ModuleSubprogram -> SubroutineSubprogram
        | | | SubroutineStmt
        | | | | Name = 'p1'
        | | | | DummyArg -> Name = 'v'
        | | | SpecificationPart
        | | | | DeclarationConstruct -> SpecificationConstruct -> TypeDeclarationStmt
        | | | | | DeclarationTypeSpec -> IntrinsicTypeSpec -> Real ->
        | | | | | EntityDecl
        | | | | | | Name = 'v'
        | | | | | | ArraySpec -> AssumedShapeSpec ->
        | | ModuleSubprogram -> SubroutineSubprogram
        | | | SubroutineStmt
        | | | | Name = 'p2'
        | | | | DummyArg -> Name = 'v'
        | | | SpecificationPart
        | | | | DeclarationConstruct -> SpecificationConstruct -> TypeDeclarationStmt
        | | | | | DeclarationTypeSpec -> IntrinsicTypeSpec -> Real ->
        | | | | | EntityDecl
        | | | | | | Name = 'v'
        | | | | | | ArraySpec -> AssumedShapeSpec ->
        | | | | | | AssumedShapeSpec ->
        """;

    private static String callP(String argument) {
        return """
            | | | | ExecutionPartConstruct -> ExecutableConstruct -> ActionStmt -> CallStmt
            | | | | | Call
            | | | | | | ProcedureDesignator -> Name = 'p'
            | | | | | | ActualArgSpec
            | | | | | | | ActualArg -> Expr -> Designator -> DataRef -> Name = '%s'
            """.formatted(argument);
    }

    @Test
    void shapeStatementsGiveDeclaredVariablesTheirRank(@TempDir Path tmp) throws IOException {
        Path file = tmp.resolve("shape_stmts_ptree");
        Files.writeString(file, RANKED_GENERIC + """
            | | ModuleSubprogram -> SubroutineSubprogram
            | | | SubroutineStmt
            | | | | Name = 'driver'
            | | | SpecificationPart
            | | | | DeclarationConstruct -> SpecificationConstruct -> TypeDeclarationStmt
            | | | | | DeclarationTypeSpec -> IntrinsicTypeSpec -> Real ->
            | | | | | EntityDecl
            | | | | | | Name = 'buf'
            | | | | | EntityDecl
            | | | | | | Name = 'grid'
            | | | | | EntityDecl
            | | | | | | Name = 'flat'
            | | | | DeclarationConstruct -> SpecificationConstruct -> OtherSpecificationStmt -> DimensionStmt -> Declaration
            | | | | | Name = 'buf'
            | | | | | ArraySpec -> ExplicitShapeSpec -> SpecificationExpr -> Scalar -> Integer -> Expr -> LiteralConstant -> IntLiteralConstant = '10'
            | | | | DeclarationConstruct -> SpecificationConstruct -> OtherSpecificationStmt -> AllocatableStmt -> ObjectDecl
            | | | | | Name = 'grid'
            | | | | | ArraySpec -> DeferredShapeSpecList -> int = '2'
            | | | | DeclarationConstruct -> SpecificationConstruct -> OtherSpecificationStmt -> AllocatableStmt -> ObjectDecl -> Name = 'flat'
            | | | | DeclarationConstruct -> SpecificationConstruct -> OtherSpecificationStmt -> PointerStmt -> PointerDecl
            | | | | | Name = 'ptr'
            | | | | | DeferredShapeSpecList -> int = '1'
            | | | | DeclarationConstruct -> SpecificationConstruct -> TypeDeclarationStmt
            | | | | | DeclarationTypeSpec -> IntrinsicTypeSpec -> Real ->
            | | | | | EntityDecl
            | | | | | | Name = 'ptr'
            | | | | | EntityDecl
            | | | | | | Name = 'tgt'
            | | | | DeclarationConstruct -> SpecificationConstruct -> OtherSpecificationStmt -> TargetStmt -> TargetDecl
            | | | | | Name = 'tgt'
            | | | | | ArraySpec
            | | | | | | ExplicitShapeSpec -> SpecificationExpr -> Scalar -> Integer -> Expr -> LiteralConstant -> IntLiteralConstant = '4'
            | | | | | | ExplicitShapeSpec -> SpecificationExpr -> Scalar -> Integer -> Expr -> LiteralConstant -> IntLiteralConstant = '4'
            | | | ExecutionPart -> Block
            """ + callP("buf") + callP("grid") + callP("ptr") + callP("tgt") + callP("flat"));
        NodeRegistry registry = new FileIngestor().ingest(file);
        UnitId driver = new UnitId("module:shapes/subroutine:driver");
        assertEquals(1, registry.variable(driver, "buf").rank());
        assertEquals(2, registry.variable(driver, "grid").rank());
        assertEquals(1, registry.variable(driver, "ptr").rank(), "Rank from a POINTER statement before the type");
        assertEquals(2, registry.variable(driver, "tgt").rank());
        assertEquals(0, registry.variable(driver, "flat").rank(), "ALLOCATABLE without a shape keeps the rank");

        List<CallEdge> edges = calls(registry);
        assertEquals(5, edges.size());
        assertResolved("module:shapes/subroutine:p1", edges.get(0));
        assertResolved("module:shapes/subroutine:p2", edges.get(1));
        assertResolved("module:shapes/subroutine:p1", edges.get(2));
        assertResolved("module:shapes/subroutine:p2", edges.get(3));
        assertEquals(ResolutionStatus.UNKNOWN, edges.get(4).status(), "No specific takes a scalar");
    }

    @Test
    void vectorSubscriptKeepsItsDimension(@TempDir Path tmp) throws IOException {
        Path file = tmp.resolve("vector_subscript_ptree");
        Files.writeString(file, RANKED_GENERIC + """
            | | ModuleSubprogram -> SubroutineSubprogram
            | | | SubroutineStmt
            | | | | Name = 'driver'
            | | | SpecificationPart
            | | | | DeclarationConstruct -> SpecificationConstruct -> TypeDeclarationStmt
            | | | | | DeclarationTypeSpec -> IntrinsicTypeSpec -> Real ->
            | | | | | EntityDecl
            | | | | | | Name = 'a'
            | | | | | | ArraySpec -> ExplicitShapeSpec -> SpecificationExpr -> Scalar -> Integer -> Expr -> LiteralConstant -> IntLiteralConstant = '5'
            | | | | | | ExplicitShapeSpec -> SpecificationExpr -> Scalar -> Integer -> Expr -> LiteralConstant -> IntLiteralConstant = '5'
            | | | | DeclarationConstruct -> SpecificationConstruct -> TypeDeclarationStmt
            | | | | | DeclarationTypeSpec -> IntrinsicTypeSpec -> IntegerTypeSpec ->
            | | | | | EntityDecl
            | | | | | | Name = 'idx'
            | | | | | | ArraySpec -> ExplicitShapeSpec -> SpecificationExpr -> Scalar -> Integer -> Expr -> LiteralConstant -> IntLiteralConstant = '3'
            | | | ExecutionPart -> Block
            | | | | ExecutionPartConstruct -> ExecutableConstruct -> ActionStmt -> CallStmt
            | | | | | Call
            | | | | | | ProcedureDesignator -> Name = 'p'
            | | | | | | ActualArgSpec
            | | | | | | | ActualArg -> Expr -> Designator -> DataRef -> ArrayElement
            | | | | | | | | DataRef -> Name = 'a'
            | | | | | | | | SectionSubscript -> Integer -> Expr -> Designator -> DataRef -> Name = 'idx'
            | | | | | | | | SectionSubscript -> Integer -> Expr -> LiteralConstant -> IntLiteralConstant = '1'
            """);
        NodeRegistry registry = new FileIngestor().ingest(file);
        assertEquals(2, registry.variable(new UnitId("module:shapes/subroutine:driver"), "a").rank());

        List<CallEdge> edges = calls(registry);
        assertEquals(1, edges.size());
        assertResolved("module:shapes/subroutine:p1", edges.get(0));

        ExpressionDescriptor section = new CallResolver(registry).describeArguments(edges.get(0).site()).get(0);
        ArrayElementOrSlice slice = assertInstanceOf(ArrayElementOrSlice.class, section);
        assertEquals(1, slice.retainedSubscripts());
        assertEquals(1, slice.scalarSubscripts());
        assertEquals(1, slice.rank());
    }

    @Test
    void callThroughDummyProcedureIsUnknown(@TempDir Path tmp) throws IOException {
        Path file = tmp.resolve("dummy_proc_ptree");
        Files.writeString(file, """
            Program -> ProgramUnit -> SubroutineSubprogram
            | SubroutineStmt
            | | Name = 'cb'
            | | DummyArg -> Name = 'x'
            | ExecutionPart -> Block
            ProgramUnit -> SubroutineSubprogram
            | SubroutineStmt
            | | Name = 'apply'
            | | DummyArg -> Name = 'cb'
            | | DummyArg -> Name = 'y'
            | SpecificationPart
            | | DeclarationConstruct -> SpecificationConstruct -> OtherSpecificationStmt -> ExternalStmt -> Name = 'cb'
            | ExecutionPart -> Block
            | | ExecutionPartConstruct -> ExecutableConstruct -> ActionStmt -> CallStmt
            | | | Call
            | | | | ProcedureDesignator -> Name = 'cb'
            | | | | ActualArgSpec
            | | | | | ActualArg -> Expr -> Designator -> DataRef -> Name = 'y'
            ProgramUnit -> MainProgram
            | ProgramStmt -> Name = 'runner'
            | ExecutionPart -> Block
            | | ExecutionPartConstruct -> ExecutableConstruct -> ActionStmt -> CallStmt
            | | | Call
            | | | | ProcedureDesignator -> Name = 'cb'
            | | | | ActualArgSpec
            | | | | | ActualArg -> Expr -> Designator -> DataRef -> Name = 'z'
            """);
        List<CallEdge> edges = calls(new FileIngestor().ingest(file));
        assertEquals(2, edges.size());

        CallEdge throughDummy = edges.get(0);
        assertEquals(new UnitId("subroutine:apply@dummy_proc_ptree"), throughDummy.caller());
        assertEquals(ResolutionStatus.UNKNOWN, throughDummy.status(), "cb is an argument of apply");
        assertTrue(throughDummy.resolution().candidates().isEmpty());

        assertResolved("subroutine:cb@dummy_proc_ptree", edges.get(1));
    }

    @Test
    void resolvingTwiceGivesTheSameAnswer() {
        NodeRegistry registry = ingest("optional_args_ptree");
        List<CallEdge> before = calls(registry);

        new CallResolver(registry).resolveAll();

        assertEquals(before, calls(registry));
    }
}
