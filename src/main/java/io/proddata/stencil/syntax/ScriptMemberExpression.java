package io.proddata.stencil.syntax;

import io.proddata.stencil.parsing.TokenType;
import lombok.Getter;
import lombok.Setter;

@Getter
@Setter
@ScriptSyntax(name = "member expression", example = "<expression>.<variable_name>")
public class ScriptMemberExpression extends ScriptExpression implements ScriptVariablePath {
    private ScriptExpression target;
    /** {@code .} or the null-conditional {@code ?.}. */
    private ScriptToken dotToken = new ScriptToken(TokenType.DOT);
    private ScriptVariable member;

    public boolean isNullConditional() {
        return dotToken != null && dotToken.getTokenType() == TokenType.QUESTION_DOT;
    }

    @Override
    public String getFirstPath() {
        return target instanceof ScriptVariablePath path ? path.getFirstPath() : null;
    }

    @Override
    public boolean canHaveLeadingTrivia() {
        return false;
    }

    @Override
    public <R> R accept(ScriptVisitor<R> visitor) {
        return visitor.visit(this);
    }
}
