package io.proddata.stencil.expression;

import java.util.Locale;

/**
 * @param strict null operands of comparisons and arithmetic fail instead of yielding {@code false} or {@code null};
 *               {@code !} only accepts booleans and numbers convert to booleans by value
 * @param locale culture used to format numbers
 */
public record EvaluationOptions(boolean strict, Locale locale) {
    public static final EvaluationOptions DEFAULT = new EvaluationOptions(false, Locale.ROOT);

    public EvaluationOptions {
        locale = locale == null ? Locale.ROOT : locale;
    }

    public static EvaluationOptions strictMode() {
        return new EvaluationOptions(true, Locale.ROOT);
    }
}
