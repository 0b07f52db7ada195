package io.proddata.stencil.expression;

import io.proddata.stencil.parsing.SourceSpan;
import io.proddata.stencil.syntax.ScriptBinaryOperator;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.MathContext;
import java.math.RoundingMode;
import java.time.Duration;
import java.time.Instant;
import java.util.Arrays;
import java.util.Optional;

/**
 * Evaluates binary operators on runtime values.
 * <p>
 * Numeric operands are promoted along {@code decimal > double > float > bigint > long > ulong > int > bool}.
 * Integer results are narrowed back to the smallest integer kind that holds them.
 */
public final class BinaryOperators {
    private static final BigInteger POWER_MODULUS = BigInteger.ONE.shiftLeft(1024 * 1024);
    private static final MathContext DECIMAL_CONTEXT = MathContext.DECIMAL128;

    private BinaryOperators() {
    }

    public static Value evaluate(EvaluationContext context, SourceSpan span, ScriptBinaryOperator operator,
                                 SourceSpan leftSpan, Value left, SourceSpan rightSpan, Value right) throws ExpressionException {
        Value l = left == null ? Value.NULL : left;
        Value r = right == null ? Value.NULL : right;

        switch (operator) {
            case EMPTY_COALESCING:
                return l.isNull() ? r : l;
            case NOT_EMPTY_COALESCING:
                return l.isNull() ? l : r;
            case AND:
                return Value.of(context.toBool(leftSpan, l) && context.toBool(rightSpan, r));
            case OR:
                return Value.of(context.toBool(leftSpan, l) || context.toBool(rightSpan, r));
            case LIQUID_HAS_KEY:
            case LIQUID_HAS_VALUE:
                if (isDictionary(context, l)) {
                    return Value.of(hasKeyOrValue(context, operator, l, r));
                }
                break;
            default:
                try {
                    if (l.isText() || r.isText()) {
                        return calculateToString(context, span, operator, leftSpan, l, rightSpan, r);
                    }
                    if (l.isEmptyObject() || r.isEmptyObject()) {
                        return calculateEmpty(context, span, operator, l, r);
                    }
                    if (l.getPayload() instanceof CustomBinaryOperation custom) {
                        Optional<Value> result = custom.tryEvaluate(context, span, operator, leftSpan, l, rightSpan, r);
                        if (result.isPresent()) {
                            return result.get();
                        }
                        break;
                    }
                    if (r.getPayload() instanceof CustomBinaryOperation custom) {
                        Optional<Value> result = custom.tryEvaluate(context, span, operator, leftSpan, l, rightSpan, r);
                        if (result.isPresent()) {
                            return result.get();
                        }
                        break;
                    }
                    return calculateOthers(context, span, operator, l, r);
                } catch (RuntimeException e) {
                    String message = e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage();
                    throw new ExpressionException(span, message, Arrays.asList(leftSpan, rightSpan), e);
                }
        }
        throw new ExpressionException(span, "The operator `" + operator.toText() + "` is not supported between `"
            + l + "` and `" + r + "`", Arrays.asList(leftSpan, rightSpan), null);
    }

    private static boolean isDictionary(EvaluationContext context, Value value) {
        return value.getKind() == ValueKind.OBJECT && context.getValueAccessor().supports(value);
    }

    private static boolean hasKeyOrValue(EvaluationContext context, ScriptBinaryOperator operator, Value target, Value key) {
        if (key.isNull()) {
            return false;
        }
        Optional<Value> member = context.getValueAccessor().member(target, context.toString(key));
        if (operator == ScriptBinaryOperator.LIQUID_HAS_KEY) {
            return member.isPresent();
        }
        return member.isPresent() && !member.get().isNull();
    }

    private static Value calculateEmpty(EvaluationContext context, SourceSpan span, ScriptBinaryOperator operator,
                                        Value left, Value right) throws ExpressionException {
        boolean leftIsEmpty = left.isEmptyObject();
        boolean rightIsEmpty = right.isEmptyObject();
        if (leftIsEmpty && rightIsEmpty) {
            switch (operator) {
                case COMPARE_EQUAL:
                case COMPARE_GREATER_OR_EQUAL:
                case COMPARE_LESS_OR_EQUAL:
                    return Value.TRUE;
                case COMPARE_NOT_EQUAL:
                case COMPARE_GREATER:
                case COMPARE_LESS:
                case LIQUID_CONTAINS:
                case LIQUID_STARTS_WITH:
                case LIQUID_ENDS_WITH:
                    return Value.FALSE;
                default:
                    return Value.EMPTY;
            }
        }

        Value against = leftIsEmpty ? right : left;
        boolean againstEmpty = context.isEmpty(span, against);
        switch (operator) {
            case COMPARE_EQUAL:
            case COMPARE_GREATER_OR_EQUAL:
            case COMPARE_LESS_OR_EQUAL:
                return Value.of(againstEmpty);
            case COMPARE_NOT_EQUAL:
                return Value.of(!againstEmpty);
            case COMPARE_GREATER:
            case COMPARE_LESS:
            case LIQUID_CONTAINS:
            case LIQUID_STARTS_WITH:
            case LIQUID_ENDS_WITH:
                return Value.FALSE;
            case ADD:
            case SUBTRACT:
            case MULTIPLY:
            case POWER:
            case BINARY_OR:
            case BINARY_AND:
            case DIVIDE:
            case DIVIDE_ROUND:
            case MODULUS:
            case RANGE_INCLUDE:
            case RANGE_EXCLUDE:
                return Value.EMPTY;
            default:
                throw new ExpressionException(span, "Operator `" + operator.toText() + "` is not implemented for `"
                    + (leftIsEmpty ? "empty" : left) + "` / `" + (rightIsEmpty ? "empty" : right) + "`");
        }
    }

    private static Value calculateToString(EvaluationContext context, SourceSpan span, ScriptBinaryOperator operator,
                                           SourceSpan leftSpan, Value left, SourceSpan rightSpan, Value right) throws ExpressionException {
        switch (operator) {
            case ADD:
                return Value.of(context.toString(left) + context.toString(right));
            case MULTIPLY: {
                Value text = left;
                Value count = right;
                SourceSpan countSpan = rightSpan;
                if (right.isText()) {
                    text = right;
                    count = left;
                    countSpan = leftSpan;
                }
                int times;
                try {
                    times = context.toInt(span, count);
                } catch (ExpressionException e) {
                    throw new ExpressionException(countSpan, "Expecting an integer. The operator `" + operator.toText()
                        + "` is not supported for the expression. Only working on string x int or int x string", e);
                }
                String repeated = context.toString(text);
                return Value.of(times <= 0 ? "" : repeated.repeat(times));
            }
            case COMPARE_EQUAL:
                return Value.of(context.toString(left).equals(context.toString(right)));
            case COMPARE_NOT_EQUAL:
                return Value.of(!context.toString(left).equals(context.toString(right)));
            case COMPARE_GREATER:
                return Value.of(context.toString(left).compareTo(context.toString(right)) > 0);
            case COMPARE_LESS:
                return Value.of(context.toString(left).compareTo(context.toString(right)) < 0);
            case COMPARE_GREATER_OR_EQUAL:
                return Value.of(context.toString(left).compareTo(context.toString(right)) >= 0);
            case COMPARE_LESS_OR_EQUAL:
                return Value.of(context.toString(left).compareTo(context.toString(right)) <= 0);
            case LIQUID_CONTAINS:
                return Value.of(context.toString(left).contains(context.toString(right)));
            case LIQUID_STARTS_WITH:
                return Value.of(context.toString(left).startsWith(context.toString(right)));
            case LIQUID_ENDS_WITH:
                return Value.of(context.toString(left).endsWith(context.toString(right)));
            default:
                throw new ExpressionException(span, "Operator `" + operator.toText() + "` is not supported on string objects");
        }
    }

    private static Value calculateOthers(EvaluationContext context, SourceSpan span, ScriptBinaryOperator operator,
                                         Value left, Value right) throws ExpressionException {
        if (left.isNull() && right.isNull()) {
            switch (operator) {
                case COMPARE_EQUAL:
                    return Value.TRUE;
                case COMPARE_NOT_EQUAL:
                    return Value.FALSE;
                case COMPARE_GREATER:
                case COMPARE_LESS:
                case COMPARE_GREATER_OR_EQUAL:
                case COMPARE_LESS_OR_EQUAL:
                    if (context.isStrict()) {
                        throw bothNull(span);
                    }
                    return Value.FALSE;
                case LIQUID_CONTAINS:
                case LIQUID_STARTS_WITH:
                case LIQUID_ENDS_WITH:
                    return Value.FALSE;
                default:
                    if (context.isStrict()) {
                        throw bothNull(span);
                    }
                    return Value.NULL;
            }
        }

        if (left.isNull() || right.isNull()) {
            String side = left.isNull() ? "left" : "right";
            switch (operator) {
                case COMPARE_EQUAL:
                    return Value.FALSE;
                case COMPARE_NOT_EQUAL:
                    return Value.TRUE;
                case COMPARE_GREATER:
                case COMPARE_LESS:
                case COMPARE_GREATER_OR_EQUAL:
                case COMPARE_LESS_OR_EQUAL:
                case LIQUID_CONTAINS:
                case LIQUID_STARTS_WITH:
                case LIQUID_ENDS_WITH:
                    if (context.isStrict()) {
                        throw oneNull(span, side);
                    }
                    return Value.FALSE;
                default:
                    if (context.isStrict()) {
                        throw oneNull(span, side);
                    }
                    return Value.NULL;
            }
        }

        ValueKind leftKind = left.getKind();
        ValueKind rightKind = right.getKind();

        if (leftKind == ValueKind.DECIMAL || rightKind == ValueKind.DECIMAL) {
            return calculateDecimal(span, operator, left.toBigDecimal(), right.toBigDecimal());
        }
        if (leftKind == ValueKind.FLOAT64 || rightKind == ValueKind.FLOAT64) {
            return calculateDouble(span, operator, left.toDouble(), right.toDouble());
        }
        if (leftKind == ValueKind.FLOAT32 || rightKind == ValueKind.FLOAT32) {
            return calculateFloat(span, operator, left.toFloat(), right.toFloat());
        }
        if (leftKind == ValueKind.BIG_INTEGER || rightKind == ValueKind.BIG_INTEGER
            || leftKind == ValueKind.INT64 || rightKind == ValueKind.INT64
            || leftKind == ValueKind.UINT64 || rightKind == ValueKind.UINT64) {
            return calculateBigInteger(span, operator, left.toBigInteger(), right.toBigInteger());
        }
        if (leftKind == ValueKind.INT32 || rightKind == ValueKind.INT32) {
            return calculateInt(span, operator, left.toInt(), right.toInt());
        }
        if (leftKind == ValueKind.BOOL || rightKind == ValueKind.BOOL) {
            return calculateBool(span, operator, left.toBoolean(), right.toBoolean());
        }
        if (leftKind == ValueKind.DATE_TIME && rightKind == ValueKind.DATE_TIME) {
            return calculateDateTime(span, operator, left.asInstant(), right.asInstant());
        }
        if (leftKind == ValueKind.DATE_TIME && rightKind == ValueKind.TIME_SPAN) {
            return calculateDateTime(span, operator, left.asInstant(), right.asDuration());
        }

        if (operator == ScriptBinaryOperator.COMPARE_EQUAL) {
            return Value.of(left.equals(right));
        }

        throw new ExpressionException(span, "Unsupported types `" + left + "/" + context.getTypeName(left) + "` "
            + operator.toText() + " `" + right + "/" + context.getTypeName(right) + "` for binary operation");
    }

    private static ExpressionException bothNull(SourceSpan span) {
        return new ExpressionException(span, "Both left and right expressions are null. Cannot perform this operation on null values.");
    }

    private static ExpressionException oneNull(SourceSpan span, String side) {
        return new ExpressionException(span, "The " + side + " expression is null. Cannot perform this operation on a null value.");
    }

    private static Value calculateInt(SourceSpan span, ScriptBinaryOperator operator, int leftInt, int rightInt) throws ExpressionException {
        long left = leftInt;
        long right = rightInt;
        switch (operator) {
            case ADD:
                return Value.integer(left + right);
            case SUBTRACT:
                return Value.integer(left - right);
            case MULTIPLY:
                return Value.integer(left * right);
            case DIVIDE:
                return Value.of((double) left / (double) right);
            case DIVIDE_ROUND:
                return Value.integer(left / right);
            case SHIFT_LEFT:
                return Value.integer(BigInteger.valueOf(left).shiftLeft(rightInt));
            case SHIFT_RIGHT:
                return Value.integer(BigInteger.valueOf(left).shiftRight(rightInt));
            case POWER:
                if (right < 0) {
                    return Value.of(Math.pow(left, right));
                }
                return Value.integer(power(BigInteger.valueOf(left), BigInteger.valueOf(right)));
            case BINARY_OR:
                return Value.integer(left | right);
            case BINARY_AND:
                return Value.integer(left & right);
            case MODULUS:
                return Value.integer(left % right);
            case COMPARE_EQUAL:
                return Value.of(left == right);
            case COMPARE_NOT_EQUAL:
                return Value.of(left != right);
            case COMPARE_GREATER:
                return Value.of(left > right);
            case COMPARE_LESS:
                return Value.of(left < right);
            case COMPARE_GREATER_OR_EQUAL:
                return Value.of(left >= right);
            case COMPARE_LESS_OR_EQUAL:
                return Value.of(left <= right);
            case RANGE_INCLUDE:
                return Value.of(ScriptRange.inclusive(left, right));
            case RANGE_EXCLUDE:
                return Value.of(ScriptRange.exclusive(left, right));
            default:
                throw notImplemented(span, operator, "long");
        }
    }

    private static Value calculateBigInteger(SourceSpan span, ScriptBinaryOperator operator, BigInteger left, BigInteger right)
        throws ExpressionException {
        switch (operator) {
            case ADD:
                return Value.integer(left.add(right));
            case SUBTRACT:
                return Value.integer(left.subtract(right));
            case MULTIPLY:
                return Value.integer(left.multiply(right));
            case DIVIDE:
                return Value.of(left.doubleValue() / right.doubleValue());
            case DIVIDE_ROUND:
                return Value.integer(left.divide(right));
            case SHIFT_LEFT:
                return Value.integer(left.shiftLeft(right.intValueExact()));
            case SHIFT_RIGHT:
                return Value.integer(left.shiftRight(right.intValueExact()));
            case POWER:
                if (right.signum() < 0) {
                    return Value.of(Math.pow(left.doubleValue(), right.doubleValue()));
                }
                return Value.integer(power(left, right));
            case BINARY_OR:
                return Value.integer(left.or(right));
            case BINARY_AND:
                return Value.integer(left.and(right));
            case MODULUS:
                return Value.integer(left.remainder(right));
            case COMPARE_EQUAL:
                return Value.of(left.compareTo(right) == 0);
            case COMPARE_NOT_EQUAL:
                return Value.of(left.compareTo(right) != 0);
            case COMPARE_GREATER:
                return Value.of(left.compareTo(right) > 0);
            case COMPARE_LESS:
                return Value.of(left.compareTo(right) < 0);
            case COMPARE_GREATER_OR_EQUAL:
                return Value.of(left.compareTo(right) >= 0);
            case COMPARE_LESS_OR_EQUAL:
                return Value.of(left.compareTo(right) <= 0);
            case RANGE_INCLUDE:
                return Value.of(new ScriptRange(left, right, true));
            case RANGE_EXCLUDE:
                return Value.of(new ScriptRange(left, right, false));
            default:
                throw notImplemented(span, operator, "long");
        }
    }

    /**
     * Integer power reduced modulo 2^(1024*1024), keeping the sign of the base for odd exponents.
     */
    private static BigInteger power(BigInteger base, BigInteger exponent) {
        BigInteger magnitude = base.abs().modPow(exponent, POWER_MODULUS);
        return base.signum() < 0 && exponent.testBit(0) ? magnitude.negate() : magnitude;
    }

    private static Value calculateDouble(SourceSpan span, ScriptBinaryOperator operator, double left, double right)
        throws ExpressionException {
        switch (operator) {
            case ADD:
                return Value.of(left + right);
            case SUBTRACT:
                return Value.of(left - right);
            case MULTIPLY:
                return Value.of(left * right);
            case DIVIDE:
                return Value.of(left / right);
            case DIVIDE_ROUND:
                return Value.of(Math.rint(left / right));
            case SHIFT_LEFT:
                return Value.of(left * Math.pow(2, right));
            case SHIFT_RIGHT:
                return Value.of(left / Math.pow(2, right));
            case POWER:
                return Value.of(Math.pow(left, right));
            case MODULUS:
                return Value.of(left % right);
            case COMPARE_EQUAL:
                return Value.of(left == right);
            case COMPARE_NOT_EQUAL:
                return Value.of(left != right);
            case COMPARE_GREATER:
                return Value.of(left > right);
            case COMPARE_LESS:
                return Value.of(left < right);
            case COMPARE_GREATER_OR_EQUAL:
                return Value.of(left >= right);
            case COMPARE_LESS_OR_EQUAL:
                return Value.of(left <= right);
            default:
                throw notImplemented(span, operator, "double");
        }
    }

    private static Value calculateFloat(SourceSpan span, ScriptBinaryOperator operator, float left, float right)
        throws ExpressionException {
        switch (operator) {
            case ADD:
                return Value.of(left + right);
            case SUBTRACT:
                return Value.of(left - right);
            case MULTIPLY:
                return Value.of(left * right);
            case DIVIDE:
                return Value.of(left / right);
            case DIVIDE_ROUND:
                return Value.of((float) (int) (left / right));
            case SHIFT_LEFT:
                return Value.of(left * (float) Math.pow(2, right));
            case SHIFT_RIGHT:
                return Value.of(left / (float) Math.pow(2, right));
            case POWER:
                return Value.of((float) Math.pow(left, right));
            case MODULUS:
                return Value.of(left % right);
            case COMPARE_EQUAL:
                return Value.of(left == right);
            case COMPARE_NOT_EQUAL:
                return Value.of(left != right);
            case COMPARE_GREATER:
                return Value.of(left > right);
            case COMPARE_LESS:
                return Value.of(left < right);
            case COMPARE_GREATER_OR_EQUAL:
                return Value.of(left >= right);
            case COMPARE_LESS_OR_EQUAL:
                return Value.of(left <= right);
            default:
                throw notImplemented(span, operator, "float");
        }
    }

    private static Value calculateDecimal(SourceSpan span, ScriptBinaryOperator operator, BigDecimal left, BigDecimal right)
        throws ExpressionException {
        switch (operator) {
            case ADD:
                return Value.of(left.add(right));
            case SUBTRACT:
                return Value.of(left.subtract(right));
            case MULTIPLY:
                return Value.of(left.multiply(right));
            case DIVIDE:
                return Value.of(left.divide(right, DECIMAL_CONTEXT));
            case DIVIDE_ROUND:
                return Value.of(left.divide(right, DECIMAL_CONTEXT).setScale(0, RoundingMode.HALF_EVEN));
            case SHIFT_LEFT:
                return Value.of(left.multiply(BigDecimal.valueOf(Math.pow(2, right.doubleValue()))));
            case SHIFT_RIGHT:
                return Value.of(left.divide(BigDecimal.valueOf(Math.pow(2, right.doubleValue())), DECIMAL_CONTEXT));
            case POWER:
                return Value.of(BigDecimal.valueOf(Math.pow(left.doubleValue(), right.doubleValue())));
            case MODULUS:
                return Value.of(left.remainder(right));
            case COMPARE_EQUAL:
                return Value.of(left.compareTo(right) == 0);
            case COMPARE_NOT_EQUAL:
                return Value.of(left.compareTo(right) != 0);
            case COMPARE_GREATER:
                return Value.of(left.compareTo(right) > 0);
            case COMPARE_LESS:
                return Value.of(left.compareTo(right) < 0);
            case COMPARE_GREATER_OR_EQUAL:
                return Value.of(left.compareTo(right) >= 0);
            case COMPARE_LESS_OR_EQUAL:
                return Value.of(left.compareTo(right) <= 0);
            default:
                throw notImplemented(span, operator, "decimal");
        }
    }

    private static Value calculateBool(SourceSpan span, ScriptBinaryOperator operator, boolean left, boolean right)
        throws ExpressionException {
        switch (operator) {
            case COMPARE_EQUAL:
                return Value.of(left == right);
            case COMPARE_NOT_EQUAL:
                return Value.of(left != right);
            default:
                throw new ExpressionException(span, "The operator `" + operator.toText() + "` is not valid for bool<->bool");
        }
    }

    private static Value calculateDateTime(SourceSpan span, ScriptBinaryOperator operator, Instant left, Instant right)
        throws ExpressionException {
        switch (operator) {
            case SUBTRACT:
                return Value.of(Duration.between(right, left));
            case COMPARE_EQUAL:
                return Value.of(left.equals(right));
            case COMPARE_NOT_EQUAL:
                return Value.of(!left.equals(right));
            case COMPARE_LESS:
                return Value.of(left.isBefore(right));
            case COMPARE_LESS_OR_EQUAL:
                return Value.of(!left.isAfter(right));
            case COMPARE_GREATER:
                return Value.of(left.isAfter(right));
            case COMPARE_GREATER_OR_EQUAL:
                return Value.of(!left.isBefore(right));
            default:
                throw new ExpressionException(span, "The operator `" + operator.toText() + "` is not supported for DateTime");
        }
    }

    private static Value calculateDateTime(SourceSpan span, ScriptBinaryOperator operator, Instant left, Duration right)
        throws ExpressionException {
        if (operator == ScriptBinaryOperator.ADD) {
            return Value.of(left.plus(right));
        }
        throw new ExpressionException(span, "The operator `" + operator.toText()
            + "` is not supported for between <DateTime> and <TimeSpan>");
    }

    private static ExpressionException notImplemented(SourceSpan span, ScriptBinaryOperator operator, String type) {
        return new ExpressionException(span, "The operator `" + operator.toText() + "` is not implemented for "
            + type + "<->" + type);
    }
}
