package com.syntaxforge.ast;

/**
 * Base interface for all AST nodes, whichever language parser produced them.
 *
 * <p>The fixed kinds are records listed in {@link NodeType}; constructs outside
 * that list travel as {@link GenericNode}.</p>
 */
public sealed interface Node permits
    Program,
    FunctionDeclaration,
    ClassDeclaration,
    MethodDeclaration,
    VariableDeclaration,
    IfStatement,
    WhileLoop,
    ForLoop,
    BlockStatement,
    ReturnStatement,
    ExpressionStatement,
    CallExpression,
    Identifier,
    Literal,
    BinaryExpression,
    AssignmentExpression,
    ImportDeclaration,
    ExportDeclaration,
    TryStatement,
    CatchClause,
    ThrowStatement,
    SwitchStatement,
    Comment,
    GenericNode {

    String type();
    SourceLocation loc();
    Range range();
    String raw();

    default boolean is(NodeType nodeType) {
        return nodeType.label().equals(type());
    }
}
