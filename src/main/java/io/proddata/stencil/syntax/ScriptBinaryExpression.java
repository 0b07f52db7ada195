package io.proddata.stencil.syntax;

import lombok.Getter;
import lombok.Setter;

@Getter
@Setter
@ScriptSyntax(name = "binary expression", example = "<expression> operator <expression>")
public class ScriptBinaryExpression extends ScriptExpression {
    private ScriptExpression left;
    private ScriptBinaryOperator operator;
    /** {@code null} for a synthesized operation, such as a scientific implicit multiplication. */
    private ScriptToken operatorToken;
    private ScriptExpression right;

    @Override
    public boolean canHaveLeadingTrivia() {
        return false;
    }

    @Override
    public <R> R accept(ScriptVisitor<R> visitor) {
        return visitor.visit(this);
    }
}
