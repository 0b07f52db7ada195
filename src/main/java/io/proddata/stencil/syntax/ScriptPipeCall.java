package io.proddata.stencil.syntax;

import lombok.Getter;
import lombok.Setter;

@Getter
@Setter
@ScriptSyntax(name = "pipe expression", example = "<expression> | <expression>")
public class ScriptPipeCall extends ScriptExpression {
    private ScriptExpression from;
    private ScriptToken pipeToken;
    private ScriptExpression to;

    @Override
    public boolean canHaveLeadingTrivia() {
        return false;
    }

    @Override
    public <R> R accept(ScriptVisitor<R> visitor) {
        return visitor.visit(this);
    }
}
