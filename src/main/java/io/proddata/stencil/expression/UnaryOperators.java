package io.proddata.stencil.expression;

import io.proddata.stencil.parsing.SourceSpan;
import io.proddata.stencil.syntax.ScriptUnaryOperator;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Optional;

public final class UnaryOperators {
    private UnaryOperators() {
    }

    public static Value evaluate(EvaluationContext context, SourceSpan span, ScriptUnaryOperator operator, Value value)
        throws ExpressionException {
        Value operand = value == null ? Value.NULL : value;

        if (operand.getPayload() instanceof CustomUnaryOperation custom) {
            Optional<Value> result = custom.tryEvaluate(context, span, operator, operand);
            if (result.isPresent()) {
                return result.get();
            }
            throw notSupported(span, operator);
        }

        switch (operator) {
            case NOT:
                if (context.isStrict()) {
                    if (operand.getKind() != ValueKind.BOOL) {
                        throw new ExpressionException(span, "Expecting a boolean instead of " + context.getTypeName(operand)
                            + " value: " + operand);
                    }
                    return Value.of(!operand.asBoolean());
                }
                return Value.of(!context.toBool(span, operand));
            case NEGATE:
            case PLUS:
                if (operand.isNull()) {
                    break;
                }
                return sign(context, span, operator == ScriptUnaryOperator.NEGATE, operand);
            case FUNCTION_ALIAS:
            case FUNCTION_PARAMETERS_EXPAND:
                return operand;
            default:
                break;
        }
        throw notSupported(span, operator);
    }

    private static Value sign(EvaluationContext context, SourceSpan span, boolean negate, Value operand) throws ExpressionException {
        Object payload = operand.getPayload();
        switch (operand.getKind()) {
            case INT32: {
                int i = (Integer) payload;
                if (!negate) {
                    return operand;
                }
                return i == Integer.MIN_VALUE ? Value.of(-(long) i) : Value.of(-i);
            }
            case INT64: {
                long l = (Long) payload;
                if (!negate) {
                    return operand;
                }
                return l == Long.MIN_VALUE ? Value.of(BigInteger.valueOf(l).negate()) : Value.of(-l);
            }
            case UINT64:
                return negate ? Value.integer(((BigInteger) payload).negate()) : operand;
            case BIG_INTEGER:
                return negate ? Value.of(((BigInteger) payload).negate()) : operand;
            case FLOAT32:
                return negate ? Value.of(-(Float) payload) : operand;
            case FLOAT64:
                return negate ? Value.of(-(Double) payload) : operand;
            case DECIMAL:
                return negate ? Value.of(((BigDecimal) payload).negate()) : operand;
            default:
                throw new ExpressionException(span, "Unexpected value `" + operand + " / Type: " + context.getTypeName(operand)
                    + "`. Cannot negate(-)/positive(+) a non-numeric value");
        }
    }

    private static ExpressionException notSupported(SourceSpan span, ScriptUnaryOperator operator) {
        return new ExpressionException(span, "Operator `" + operator.toText() + "` is not supported");
    }
}
