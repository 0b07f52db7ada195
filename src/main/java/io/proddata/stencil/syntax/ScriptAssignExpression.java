package io.proddata.stencil.syntax;

import io.proddata.stencil.parsing.TokenType;
import lombok.Getter;
import lombok.Setter;

@Getter
@Setter
@ScriptSyntax(name = "assign expression", example = "<target_expression> = <value_expression>")
public class ScriptAssignExpression extends ScriptExpression {
    private ScriptExpression target;
    /** {@code =} or a compound assignment such as {@code +=}. */
    private ScriptToken equalToken = new ScriptToken(TokenType.EQUAL);
    private ScriptExpression value;

    @Override
    public boolean canHaveLeadingTrivia() {
        return false;
    }

    @Override
    public <R> R accept(ScriptVisitor<R> visitor) {
        return visitor.visit(this);
    }
}
