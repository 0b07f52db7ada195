package io.proddata.stencil.syntax;

import io.proddata.stencil.parsing.TokenType;
import lombok.Getter;
import lombok.Setter;

@Getter
@Setter
@ScriptSyntax(name = "conditional expression", example = "<condition> ? <then_value> : <else_value>")
public class ScriptConditionalExpression extends ScriptExpression {
    private ScriptExpression condition;
    private ScriptToken questionToken = new ScriptToken(TokenType.QUESTION);
    private ScriptExpression thenValue;
    private ScriptToken colonToken = new ScriptToken(TokenType.COLON);
    private ScriptExpression elseValue;

    @Override
    public boolean canHaveLeadingTrivia() {
        return false;
    }

    @Override
    public <R> R accept(ScriptVisitor<R> visitor) {
        return visitor.visit(this);
    }
}
