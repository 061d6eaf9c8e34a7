package com.flinspect.core.parse_tree;

import java.util.HashMap;
import java.util.Map;

/**
 * Closed set of construct labels the extractor understands.
 * Any label not listed here maps to {@link #UNKNOWN} and is kept as an opaque passthrough node.
 */
public enum ConstructTag {

    // --- program units ---
    PROGRAM("Program"),
    PROGRAM_UNIT("ProgramUnit"),
    MODULE("Module"),
    MODULE_STMT("ModuleStmt"),
    END_MODULE_STMT("EndModuleStmt"),
    MAIN_PROGRAM("MainProgram"),
    PROGRAM_STMT("ProgramStmt"),
    SUBROUTINE_SUBPROGRAM("SubroutineSubprogram"),
    FUNCTION_SUBPROGRAM("FunctionSubprogram"),
    SUBROUTINE_STMT("SubroutineStmt"),
    FUNCTION_STMT("FunctionStmt"),
    END_SUBROUTINE_STMT("EndSubroutineStmt"),
    END_FUNCTION_STMT("EndFunctionStmt"),
    DUMMY_ARG("DummyArg"),
    PREFIX_SPEC("PrefixSpec"),
    SUFFIX("Suffix"),

    // --- interfaces ---
    INTERFACE_BLOCK("InterfaceBlock"),
    INTERFACE_STMT("InterfaceStmt"),
    INTERFACE_SPECIFICATION("InterfaceSpecification"),
    INTERFACE_BODY("InterfaceBody"),
    SUBROUTINE_BODY("Subroutine"),
    FUNCTION_BODY("Function"),
    PROCEDURE_STMT("ProcedureStmt"),
    GENERIC_SPEC("GenericSpec"),
    DEFINED_OPERATOR("DefinedOperator"),
    INTRINSIC_OPERATOR("IntrinsicOperator"),
    DEFINED_OP_NAME("DefinedOpName"),
    ASSIGNMENT("Assignment"),

    // --- derived types ---
    DERIVED_TYPE_DEF("DerivedTypeDef"),
    DERIVED_TYPE_STMT("DerivedTypeStmt"),
    DATA_COMPONENT_DEF_STMT("DataComponentDefStmt"),
    COMPONENT_DECL("ComponentDecl"),
    COMPONENT_ARRAY_SPEC("ComponentArraySpec"),
    COMPONENT_ATTR_SPEC("ComponentAttrSpec"),

    // --- use association and accessibility ---
    USE_STMT("UseStmt"),
    ONLY("Only"),
    RENAME("Rename"),
    NAMES("Names"),
    MODULE_NATURE("ModuleNature"),
    ACCESS_STMT("AccessStmt"),
    ACCESS_SPEC("AccessSpec"),
    ACCESS_ID("AccessId"),

    // --- declarations ---
    TYPE_DECLARATION_STMT("TypeDeclarationStmt"),
    DECLARATION_TYPE_SPEC("DeclarationTypeSpec"),
    INTRINSIC_TYPE_SPEC("IntrinsicTypeSpec"),
    INTEGER_TYPE_SPEC("IntegerTypeSpec"),
    REAL("Real"),
    DOUBLE_PRECISION("DoublePrecision"),
    COMPLEX("Complex"),
    DOUBLE_COMPLEX("DoubleComplex"),
    CHARACTER("Character"),
    LOGICAL("Logical"),
    TYPE("Type"),
    CLASS("Class"),
    DERIVED_TYPE_SPEC("DerivedTypeSpec"),
    ATTR_SPEC("AttrSpec"),
    INTENT_SPEC("IntentSpec"),
    INTENT("Intent"),
    OPTIONAL("Optional"),
    OPTIONAL_STMT("OptionalStmt"),
    INTENT_STMT("IntentStmt"),
    DIMENSION_STMT("DimensionStmt"),
    DECLARATION("Declaration"),
    ALLOCATABLE_STMT("AllocatableStmt"),
    OBJECT_DECL("ObjectDecl"),
    POINTER_STMT("PointerStmt"),
    POINTER_DECL("PointerDecl"),
    TARGET_STMT("TargetStmt"),
    TARGET_DECL("TargetDecl"),
    ENTITY_DECL("EntityDecl"),
    ARRAY_SPEC("ArraySpec"),
    ASSUMED_SHAPE_SPEC("AssumedShapeSpec"),
    EXPLICIT_SHAPE_SPEC("ExplicitShapeSpec"),
    DEFERRED_SHAPE_SPEC_LIST("DeferredShapeSpecList"),
    ASSUMED_SIZE_SPEC("AssumedSizeSpec"),
    ASSUMED_RANK_SPEC("AssumedRankSpec"),

    // --- calls and expressions ---
    CALL_STMT("CallStmt"),
    CALL("Call"),
    PROCEDURE_DESIGNATOR("ProcedureDesignator"),
    PROC_COMPONENT_REF("ProcComponentRef"),
    ACTUAL_ARG_SPEC("ActualArgSpec"),
    KEYWORD("Keyword"),
    ACTUAL_ARG("ActualArg"),
    EXPR("Expr"),
    DESIGNATOR("Designator"),
    DATA_REF("DataRef"),
    NAME("Name"),
    ARRAY_ELEMENT("ArrayElement"),
    SECTION_SUBSCRIPT("SectionSubscript"),
    SUBSCRIPT_TRIPLET("SubscriptTriplet"),
    STRUCTURE_COMPONENT("StructureComponent"),
    FUNCTION_REFERENCE("FunctionReference"),
    LITERAL_CONSTANT("LiteralConstant"),
    INT_LITERAL_CONSTANT("IntLiteralConstant"),
    REAL_LITERAL_CONSTANT("RealLiteralConstant"),
    LOGICAL_LITERAL_CONSTANT("LogicalLiteralConstant"),
    CHAR_LITERAL_CONSTANT("CharLiteralConstant"),
    COMPLEX_LITERAL_CONSTANT("ComplexLiteralConstant"),
    PARENTHESES("Parentheses"),
    NEGATE("Negate"),
    UNARY_PLUS("UnaryPlus"),

    /** Any label this version does not recognize. */
    UNKNOWN(null);

    private static final Map<String, ConstructTag> BY_LABEL = new HashMap<>();

    static {
        for (ConstructTag tag : values()) {
            if (tag.label != null) {
                BY_LABEL.put(tag.label, tag);
            }
        }
    }

    private final String label;

    ConstructTag(String label) {
        this.label = label;
    }

    /** The dump label this tag matches, or null for {@link #UNKNOWN}. */
    public String label() { return label; }

    public static ConstructTag of(String label) {
        if (label == null) return UNKNOWN;
        return BY_LABEL.getOrDefault(label, UNKNOWN);
    }
}
