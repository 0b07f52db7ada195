package io.proddata.stencil.syntax;

import lombok.Getter;
import lombok.Setter;

@Getter
@Setter
@ScriptSyntax(name = "expression statement", example = "<expression>")
public class ScriptExpressionStatement extends ScriptStatement {
    /** The keyword of the liquid tag the statement was written as: {@code assign}, {@code increment} or {@code decrement}. */
    private ScriptToken tagKeyword;
    private ScriptExpression expression;

    @Override
    public <R> R accept(ScriptVisitor<R> visitor) {
        return visitor.visit(this);
    }
}
