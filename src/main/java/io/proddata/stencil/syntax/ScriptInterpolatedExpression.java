package io.proddata.stencil.syntax;

import io.proddata.stencil.parsing.TokenType;
import lombok.Getter;
import lombok.Setter;

/**
 * A hole of an interpolated string.
 */
@Getter
@Setter
@ScriptSyntax(name = "interpolated expression", example = "{<expression>}")
public class ScriptInterpolatedExpression extends ScriptExpression implements ScriptVariablePath {
    private ScriptToken openBrace = new ScriptToken(TokenType.OPEN_INTERPOLATED_BRACE);
    private ScriptExpression expression;
    private ScriptToken closeBrace = new ScriptToken(TokenType.CLOSE_INTERPOLATED_BRACE);

    public ScriptInterpolatedExpression() {
    }

    public ScriptInterpolatedExpression(ScriptExpression expression) {
        this.expression = expression;
    }

    @Override
    public String getFirstPath() {
        return expression instanceof ScriptVariablePath path ? path.getFirstPath() : null;
    }

    @Override
    public <R> R accept(ScriptVisitor<R> visitor) {
        return visitor.visit(this);
    }
}
