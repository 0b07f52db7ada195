package io.proddata.stencil.syntax;

import io.proddata.stencil.parsing.TokenType;
import lombok.Getter;
import lombok.Setter;

@Getter
@Setter
@ScriptSyntax(name = "object member", example = "<name>: <expression>")
public class ScriptObjectMember extends ScriptNode {
    /** A {@link ScriptVariable} or a string {@link ScriptLiteral}. */
    private ScriptExpression name;
    private ScriptToken colonToken = new ScriptToken(TokenType.COLON);
    private ScriptExpression value;

    @Override
    public <R> R accept(ScriptVisitor<R> visitor) {
        return visitor.visit(this);
    }
}
