package io.proddata.stencil.syntax;

import io.proddata.stencil.parsing.TokenType;
import lombok.Getter;
import lombok.Setter;

@Getter
@Setter
@ScriptSyntax(name = "indexer expression", example = "<expression>[<index_expression>]")
public class ScriptIndexerExpression extends ScriptExpression implements ScriptVariablePath {
    private ScriptExpression target;
    private ScriptToken openBracket = new ScriptToken(TokenType.OPEN_BRACKET);
    private ScriptExpression index;
    private ScriptToken closeBracket = new ScriptToken(TokenType.CLOSE_BRACKET);
    /**
     * Set when the indexer stands for a plain liquid identifier that is not a valid variable name
     * ({@code my-var} is read as {@code this["my-var"]}).
     */
    private boolean shorthand;

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
