package io.proddata.stencil.syntax;

import lombok.Getter;
import lombok.Setter;

@Getter
@Setter
@ScriptSyntax(name = "unary expression", example = "<operator> <expression>")
public class ScriptUnaryExpression extends ScriptExpression {
    private ScriptUnaryOperator operator;
    private ScriptToken operatorToken;
    private ScriptExpression right;

    @Override
    public <R> R accept(ScriptVisitor<R> visitor) {
        return visitor.visit(this);
    }
}
