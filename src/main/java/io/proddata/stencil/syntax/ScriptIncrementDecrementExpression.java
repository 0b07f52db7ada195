package io.proddata.stencil.syntax;

import lombok.Getter;
import lombok.Setter;

@Getter
@Setter
@ScriptSyntax(name = "increment/decrement expression", example = "<operator> <expression> or <expression> <operator>")
public class ScriptIncrementDecrementExpression extends ScriptExpression {
    private ScriptUnaryOperator operator;
    private ScriptToken operatorToken;
    private ScriptExpression right;
    /** Postfix form, {@code x++}. */
    private boolean post;

    @Override
    public <R> R accept(ScriptVisitor<R> visitor) {
        return visitor.visit(this);
    }
}
