package com.syntaxforge.ast;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * The fixed node kinds and the text label each one reports from {@link Node#type()}.
 */
public enum NodeType implements Labeled {
    PROGRAM("Program"),
    FUNCTION_DECLARATION("FunctionDeclaration"),
    CLASS_DECLARATION("ClassDeclaration"),
    METHOD_DECLARATION("MethodDeclaration"),
    VARIABLE_DECLARATION("VariableDeclaration"),
    IF_STATEMENT("IfStatement"),
    WHILE_LOOP("WhileLoop"),
    FOR_LOOP("ForLoop"),
    BLOCK_STATEMENT("BlockStatement"),
    RETURN_STATEMENT("ReturnStatement"),
    EXPRESSION_STATEMENT("ExpressionStatement"),
    CALL_EXPRESSION("CallExpression"),
    IDENTIFIER("Identifier"),
    LITERAL("Literal"),
    BINARY_EXPRESSION("BinaryExpression"),
    ASSIGNMENT_EXPRESSION("AssignmentExpression"),
    IMPORT_DECLARATION("ImportDeclaration"),
    EXPORT_DECLARATION("ExportDeclaration"),
    TRY_STATEMENT("TryStatement"),
    CATCH_CLAUSE("CatchClause"),
    THROW_STATEMENT("ThrowStatement"),
    SWITCH_STATEMENT("SwitchStatement"),
    COMMENT("Comment");

    private static final Map<String, NodeType> BY_LABEL = new HashMap<>();

    static {
        for (NodeType nodeType : values()) {
            BY_LABEL.put(nodeType.label, nodeType);
        }
    }

    private final String label;

    NodeType(String label) {
        this.label = label;
    }

    @Override
    public String label() {
        return label;
    }

    /**
     * Looks up a fixed kind by its label, e.g. {@code "IfStatement"}.
     */
    public static Optional<NodeType> fromLabel(String label) {
        return Optional.ofNullable(BY_LABEL.get(label));
    }

    public static boolean isFixedLabel(String label) {
        return BY_LABEL.containsKey(label);
    }
}
