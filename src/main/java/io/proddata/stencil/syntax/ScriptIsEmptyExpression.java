package io.proddata.stencil.syntax;

import io.proddata.stencil.parsing.TokenType;
import lombok.Getter;
import lombok.Setter;

@Getter
@Setter
@ScriptSyntax(name = "empty expression", example = "<expression>.empty?")
public class ScriptIsEmptyExpression extends ScriptExpression implements ScriptVariablePath {
    private ScriptExpression target;
    private ScriptToken dotToken = new ScriptToken(TokenType.DOT);
    /** {@code empty} or its liquid synonym {@code blank}. */
    private ScriptVariable member;
    private ScriptToken questionToken = new ScriptToken(TokenType.QUESTION);

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
