package io.proddata.stencil.expression;

import io.proddata.stencil.parsing.SourceSpan;
import io.proddata.stencil.syntax.ScriptBinaryOperator;

import java.util.Optional;

/**
 * Implemented by host objects that define binary operators themselves. The left operand is asked first,
 * then the right one.
 */
public interface CustomBinaryOperation {
    /**
     * @return the result, or empty when this object does not handle the operator for these operands
     */
    Optional<Value> tryEvaluate(EvaluationContext context, SourceSpan span, ScriptBinaryOperator operator,
                                SourceSpan leftSpan, Value left, SourceSpan rightSpan, Value right) throws ExpressionException;
}
