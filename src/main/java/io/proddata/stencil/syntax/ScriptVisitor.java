package io.proddata.stencil.syntax;

/**
 * Double dispatch over the node types of a template.
 *
 * @param <R> the result of a visit
 */
public interface ScriptVisitor<R> {
    R visit(ScriptPage node);

    R visit(ScriptFrontMatter node);

    R visit(ScriptBlockStatement node);

    R visit(ScriptRawStatement node);

    R visit(ScriptEscapeStatement node);

    R visit(ScriptExpressionStatement node);

    R visit(ScriptIfStatement node);

    R visit(ScriptElseStatement node);

    R visit(ScriptForStatement node);

    R visit(ScriptTableRowStatement node);

    R visit(ScriptWhileStatement node);

    R visit(ScriptCaseStatement node);

    R visit(ScriptWhenStatement node);

    R visit(ScriptCaptureStatement node);

    R visit(ScriptWithStatement node);

    R visit(ScriptWrapStatement node);

    R visit(ScriptImportStatement node);

    R visit(ScriptReadOnlyStatement node);

    R visit(ScriptFunction node);

    R visit(ScriptParameter node);

    R visit(ScriptReturnStatement node);

    R visit(ScriptBreakStatement node);

    R visit(ScriptContinueStatement node);

    R visit(ScriptEndStatement node);

    R visit(ScriptLiteral node);

    R visit(ScriptVariable node);

    R visit(ScriptThisExpression node);

    R visit(ScriptMemberExpression node);

    R visit(ScriptIsEmptyExpression node);

    R visit(ScriptIndexerExpression node);

    R visit(ScriptFunctionCall node);

    R visit(ScriptNamedArgument node);

    R visit(ScriptUnaryExpression node);

    R visit(ScriptIncrementDecrementExpression node);

    R visit(ScriptBinaryExpression node);

    R visit(ScriptConditionalExpression node);

    R visit(ScriptPipeCall node);

    R visit(ScriptArrayInitializerExpression node);

    R visit(ScriptObjectInitializerExpression node);

    R visit(ScriptObjectMember node);

    R visit(ScriptNestedExpression node);

    R visit(ScriptInterpolatedStringExpression node);

    R visit(ScriptInterpolatedExpression node);

    R visit(ScriptAssignExpression node);

    R visit(ScriptAnonymousFunction node);

    R visit(ScriptToken node);
}
