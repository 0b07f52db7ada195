package io.proddata.stencil.syntax;

import lombok.Getter;
import lombok.Setter;

import java.math.BigInteger;

/**
 * A constant: {@code null}, a boolean, a number ({@link Integer}, {@link Long}, {@link BigInteger},
 * {@link Float}, {@link Double}, {@link java.math.BigDecimal}), a string or a character.
 */
@Getter
@Setter
@ScriptSyntax(name = "literal", example = "<value>")
public class ScriptLiteral extends ScriptExpression implements ScriptTerminal {
    private Object value;
    private ScriptStringQuoteType stringQuoteType = ScriptStringQuoteType.DOUBLE_QUOTE;
    /** The literal as written in the source, {@code null} for synthesized literals. */
    private String sourceText;
    private ScriptTrivias trivias;

    public ScriptLiteral() {
    }

    public ScriptLiteral(Object value) {
        this.value = value;
    }

    public boolean isPositiveInteger() {
        if (value instanceof Integer i) {
            return i >= 0;
        }
        if (value instanceof Long l) {
            return l >= 0;
        }
        return value instanceof BigInteger b && b.signum() >= 0;
    }

    @Override
    public <R> R accept(ScriptVisitor<R> visitor) {
        return visitor.visit(this);
    }
}
