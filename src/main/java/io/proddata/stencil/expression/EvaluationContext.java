package io.proddata.stencil.expression;

import io.proddata.stencil.parsing.SourceSpan;

/**
 * Conversions the operators delegate to the host.
 */
public interface EvaluationContext {
    /**
     * Scientific dialect semantics: operations on {@code null} fail.
     */
    boolean isStrict();

    String toString(Value value);

    boolean toBool(SourceSpan span, Value value) throws ExpressionException;

    int toInt(SourceSpan span, Value value) throws ExpressionException;

    /**
     * Whether a value is an empty string, list or object. {@code null} counts as empty.
     */
    boolean isEmpty(SourceSpan span, Value value) throws ExpressionException;

    ValueAccessor getValueAccessor();

    default String getTypeName(Value value) {
        return value == null ? "null" : value.typeName();
    }
}
