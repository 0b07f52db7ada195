package io.proddata.stencil.expression;

import io.proddata.stencil.parsing.SourceSpan;
import io.proddata.stencil.syntax.ScriptUnaryOperator;

import java.util.Optional;

public interface CustomUnaryOperation {
    Optional<Value> tryEvaluate(EvaluationContext context, SourceSpan span, ScriptUnaryOperator operator,
                                Value operand) throws ExpressionException;
}
