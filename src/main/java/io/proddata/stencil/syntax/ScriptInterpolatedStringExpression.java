package io.proddata.stencil.syntax;

import lombok.Getter;
import lombok.Setter;

import java.util.ArrayList;
import java.util.List;

/**
 * A string with expression holes: {@code $"Hello {name}!"}. The parts alternate a {@link ScriptLiteral} text
 * fragment and a {@link ScriptInterpolatedExpression}, starting and ending with a fragment.
 */
@Getter
@Setter
@ScriptSyntax(name = "interpolated string", example = "$\"...{<expression>}...\"")
public class ScriptInterpolatedStringExpression extends ScriptExpression {
    private ScriptStringQuoteType quoteType = ScriptStringQuoteType.DOUBLE_QUOTE;
    private final List<ScriptExpression> parts = new ArrayList<>();

    public ScriptInterpolatedStringExpression addText(String text) {
        parts.add(new ScriptLiteral(text));
        return this;
    }

    public ScriptInterpolatedStringExpression addExpression(ScriptExpression expression) {
        parts.add(new ScriptInterpolatedExpression(expression));
        return this;
    }

    @Override
    public <R> R accept(ScriptVisitor<R> visitor) {
        return visitor.visit(this);
    }
}
