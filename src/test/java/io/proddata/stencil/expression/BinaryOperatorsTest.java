package io.proddata.stencil.expression;

import io.proddata.stencil.parsing.SourceSpan;
import io.proddata.stencil.parsing.TextPosition;
import io.proddata.stencil.syntax.ScriptBinaryOperator;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static io.proddata.stencil.syntax.ScriptBinaryOperator.ADD;
import static io.proddata.stencil.syntax.ScriptBinaryOperator.AND;
import static io.proddata.stencil.syntax.ScriptBinaryOperator.COMPARE_EQUAL;
import static io.proddata.stencil.syntax.ScriptBinaryOperator.COMPARE_GREATER;
import static io.proddata.stencil.syntax.ScriptBinaryOperator.COMPARE_LESS;
import static io.proddata.stencil.syntax.ScriptBinaryOperator.DIVIDE;
import static io.proddata.stencil.syntax.ScriptBinaryOperator.DIVIDE_ROUND;
import static io.proddata.stencil.syntax.ScriptBinaryOperator.EMPTY_COALESCING;
import static io.proddata.stencil.syntax.ScriptBinaryOperator.LIQUID_CONTAINS;
import static io.proddata.stencil.syntax.ScriptBinaryOperator.LIQUID_HAS_KEY;
import static io.proddata.stencil.syntax.ScriptBinaryOperator.LIQUID_HAS_VALUE;
import static io.proddata.stencil.syntax.ScriptBinaryOperator.MODULUS;
import static io.proddata.stencil.syntax.ScriptBinaryOperator.MULTIPLY;
import static io.proddata.stencil.syntax.ScriptBinaryOperator.NOT_EMPTY_COALESCING;
import static io.proddata.stencil.syntax.ScriptBinaryOperator.OR;
import static io.proddata.stencil.syntax.ScriptBinaryOperator.POWER;
import static io.proddata.stencil.syntax.ScriptBinaryOperator.RANGE_EXCLUDE;
import static io.proddata.stencil.syntax.ScriptBinaryOperator.RANGE_INCLUDE;
import static io.proddata.stencil.syntax.ScriptBinaryOperator.SHIFT_LEFT;
import static io.proddata.stencil.syntax.ScriptBinaryOperator.SUBTRACT;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.is;

class BinaryOperatorsTest {
    private static final EvaluationContext LENIENT = new DefaultEvaluationContext();
    private static final EvaluationContext STRICT = new DefaultEvaluationContext(EvaluationOptions.strictMode());
    private static final SourceSpan SPAN = new SourceSpan("<test>", new TextPosition(0, 0, 0), new TextPosition(4, 0, 4));

    private static Value eval(ScriptBinaryOperator operator, Value left, Value right) throws ExpressionException {
        return eval(LENIENT, operator, left, right);
    }

    private static Value eval(EvaluationContext context, ScriptBinaryOperator operator, Value left, Value right) throws ExpressionException {
        return BinaryOperators.evaluate(context, SPAN, operator, SPAN, left, SPAN, right);
    }

    @Test
    void computesIntegers() throws Exception {
        assertThat(eval(ADD, Value.of(2), Value.of(3)), is(Value.of(5)));
        assertThat(eval(DIVIDE_ROUND, Value.of(10), Value.of(4)), is(Value.of(2)));
        assertThat(eval(DIVIDE, Value.of(10), Value.of(4)), is(Value.of(2.5)));
        assertThat(eval(MODULUS, Value.of(7), Value.of(3)), is(Value.of(1)));
        assertThat(eval(COMPARE_LESS, Value.of(1), Value.of(2)), is(Value.TRUE));
    }

    @Test
    void widensIntegerOverflow() throws Exception {
        Value sum = eval(ADD, Value.of(Integer.MAX_VALUE), Value.of(1));

        assertThat(sum.getKind(), is(ValueKind.INT64));
        assertThat(sum.getPayload(), is(2147483648L));

        Value big = eval(ADD, Value.of(Long.MAX_VALUE), Value.of(1));
        assertThat(big.getKind(), is(ValueKind.BIG_INTEGER));
        assertThat(big.getPayload(), is(BigInteger.valueOf(Long.MAX_VALUE).add(BigInteger.ONE)));

        Value shifted = eval(SHIFT_LEFT, Value.of(1), Value.of(40));
        assertThat(shifted, is(Value.of(1L << 40)));
    }

    @Test
    void narrowsWideResults() throws Exception {
        Value difference = eval(SUBTRACT, Value.of(5_000_000_000L), Value.of(4_999_999_999L));

        assertThat(difference, is(Value.of(1)));
    }

    @Test
    void promotesMixedNumbers() throws Exception {
        assertThat(eval(ADD, Value.of(1), Value.of(2.5)), is(Value.of(3.5)));
        assertThat(eval(MULTIPLY, Value.of(2f), Value.of(3)), is(Value.of(6f)));
        assertThat(eval(ADD, Value.of(1), Value.of(new BigDecimal("0.1"))), is(Value.of(new BigDecimal("1.1"))));
        assertThat(eval(ADD, Value.of(2.5), Value.of(new BigDecimal("0.5"))).getKind(), is(ValueKind.DECIMAL));
        assertThat(eval(ADD, Value.of(true), Value.of(1)), is(Value.of(2)));
    }

    @Test
    void roundsDoubleDivisionToEven() throws Exception {
        assertThat(eval(DIVIDE_ROUND, Value.of(7.5), Value.of(2)), is(Value.of(4.0)));
        assertThat(eval(DIVIDE_ROUND, Value.of(5.0), Value.of(2)), is(Value.of(2.0)));
    }

    @Test
    void computesPowers() throws Exception {
        assertThat(eval(POWER, Value.of(2), Value.of(10)), is(Value.of(1024)));
        assertThat(eval(POWER, Value.of(-2), Value.of(3)), is(Value.of(-8)));
        assertThat(eval(POWER, Value.of(-2), Value.of(2)), is(Value.of(4)));
        assertThat(eval(POWER, Value.of(2), Value.of(-1)), is(Value.of(0.5)));
    }

    @Test
    void wrapsArithmeticErrors() {
        ExpressionException exception = Assertions.assertThrows(
            ExpressionException.class,
            () -> eval(DIVIDE_ROUND, Value.of(1), Value.of(0))
        );

        assertThat(exception.getMessage(), containsString("/ by zero"));
        assertThat(exception.getSpan(), is(SPAN));
        assertThat(exception.getOperandSpans(), hasSize(2));
    }

    @Test
    void buildsRanges() throws Exception {
        Value inclusive = eval(RANGE_INCLUDE, Value.of(1), Value.of(3));
        Value exclusive = eval(RANGE_EXCLUDE, Value.of(1), Value.of(3));

        List<Value> values = new ArrayList<>();
        inclusive.asRange().forEach(values::add);
        assertThat(values, contains(Value.of(1), Value.of(2), Value.of(3)));
        assertThat(exclusive.asRange().size(), is(BigInteger.TWO));
    }

    @Test
    void concatenatesAndComparesStrings() throws Exception {
        assertThat(eval(ADD, Value.of("a"), Value.of(1)), is(Value.of("a1")));
        assertThat(eval(ADD, Value.of("v"), Value.of(1.0)), is(Value.of("v1")));
        assertThat(eval(ADD, Value.of('x'), Value.of("y")), is(Value.of("xy")));
        assertThat(eval(MULTIPLY, Value.of("ab"), Value.of(3)), is(Value.of("ababab")));
        assertThat(eval(MULTIPLY, Value.of(2), Value.of("ab")), is(Value.of("abab")));
        assertThat(eval(LIQUID_CONTAINS, Value.of("abc"), Value.of("b")), is(Value.TRUE));
        assertThat(eval(COMPARE_GREATER, Value.of("b"), Value.of("a")), is(Value.TRUE));
        assertThat(eval(COMPARE_EQUAL, Value.of("1"), Value.of(1)), is(Value.TRUE));
    }

    @Test
    void rejectsUnsupportedStringOperators() {
        ExpressionException subtract = Assertions.assertThrows(
            ExpressionException.class,
            () -> eval(SUBTRACT, Value.of("a"), Value.of("b"))
        );
        assertThat(subtract.getOriginalMessage(), is("Operator `-` is not supported on string objects"));

        ExpressionException multiply = Assertions.assertThrows(
            ExpressionException.class,
            () -> eval(MULTIPLY, Value.of("ab"), Value.of("x"))
        );
        assertThat(multiply.getMessage(), containsString("Expecting an integer"));
    }

    @Test
    void treatsNullLeniently() throws Exception {
        assertThat(eval(ADD, Value.NULL, Value.of(1)), is(Value.NULL));
        assertThat(eval(COMPARE_EQUAL, Value.NULL, Value.NULL), is(Value.TRUE));
        assertThat(eval(COMPARE_EQUAL, Value.NULL, Value.of(1)), is(Value.FALSE));
        assertThat(eval(COMPARE_LESS, Value.NULL, Value.of(1)), is(Value.FALSE));
    }

    @Test
    void rejectsNullInStrictMode() throws Exception {
        ExpressionException one = Assertions.assertThrows(
            ExpressionException.class,
            () -> eval(STRICT, ADD, Value.NULL, Value.of(1))
        );
        assertThat(one.getOriginalMessage(), is("The left expression is null. Cannot perform this operation on a null value."));

        ExpressionException both = Assertions.assertThrows(
            ExpressionException.class,
            () -> eval(STRICT, COMPARE_LESS, Value.NULL, Value.NULL)
        );
        assertThat(both.getOriginalMessage(), is("Both left and right expressions are null. Cannot perform this operation on null values."));

        assertThat(eval(STRICT, COMPARE_EQUAL, Value.of(1), Value.NULL), is(Value.FALSE));
    }

    @Test
    void comparesAgainstEmpty() throws Exception {
        assertThat(eval(COMPARE_EQUAL, Value.EMPTY, Value.EMPTY), is(Value.TRUE));
        assertThat(eval(COMPARE_EQUAL, Value.ofArray(List.of()), Value.EMPTY), is(Value.TRUE));
        assertThat(eval(COMPARE_EQUAL, Value.ofArray(List.of(Value.of(1))), Value.EMPTY), is(Value.FALSE));
        assertThat(eval(COMPARE_EQUAL, Value.of(""), Value.EMPTY), is(Value.TRUE));
        assertThat(eval(COMPARE_EQUAL, Value.of(0), Value.EMPTY), is(Value.FALSE));
        assertThat(eval(ADD, Value.EMPTY, Value.of(1)), is(Value.EMPTY));
    }

    @Test
    void coalesces() throws Exception {
        assertThat(eval(EMPTY_COALESCING, Value.NULL, Value.of(1)), is(Value.of(1)));
        assertThat(eval(EMPTY_COALESCING, Value.of(2), Value.of(1)), is(Value.of(2)));
        assertThat(eval(NOT_EMPTY_COALESCING, Value.NULL, Value.of(1)), is(Value.NULL));
        assertThat(eval(NOT_EMPTY_COALESCING, Value.of(2), Value.of(1)), is(Value.of(1)));
    }

    @Test
    void combinesBooleans() throws Exception {
        assertThat(eval(AND, Value.of(1), Value.NULL), is(Value.FALSE));
        assertThat(eval(OR, Value.NULL, Value.of("x")), is(Value.TRUE));
        assertThat(eval(COMPARE_EQUAL, Value.TRUE, Value.TRUE), is(Value.TRUE));

        ExpressionException exception = Assertions.assertThrows(
            ExpressionException.class,
            () -> eval(ADD, Value.TRUE, Value.TRUE)
        );
        assertThat(exception.getOriginalMessage(), is("The operator `+` is not valid for bool<->bool"));
    }

    @Test
    void testsKeysAndValues() throws Exception {
        Map<String, Object> map = new HashMap<>();
        map.put("a", 1);
        map.put("b", null);
        Value object = Value.ofObject(map);

        assertThat(eval(LIQUID_HAS_KEY, object, Value.of("a")), is(Value.TRUE));
        assertThat(eval(LIQUID_HAS_KEY, object, Value.of("b")), is(Value.TRUE));
        assertThat(eval(LIQUID_HAS_VALUE, object, Value.of("b")), is(Value.FALSE));
        assertThat(eval(LIQUID_HAS_KEY, object, Value.of("c")), is(Value.FALSE));

        ExpressionException exception = Assertions.assertThrows(
            ExpressionException.class,
            () -> eval(LIQUID_HAS_KEY, Value.of(1), Value.of("a"))
        );
        assertThat(exception.getOriginalMessage(), is("The operator `hasKey` is not supported between `1` and `a`"));
    }

    @Test
    void computesDates() throws Exception {
        Instant start = Instant.parse("2024-01-01T00:00:00Z");
        Instant end = Instant.parse("2024-01-02T00:00:00Z");

        assertThat(eval(SUBTRACT, Value.of(end), Value.of(start)), is(Value.of(Duration.ofDays(1))));
        assertThat(eval(ADD, Value.of(start), Value.of(Duration.ofDays(1))), is(Value.of(end)));
        assertThat(eval(COMPARE_GREATER, Value.of(end), Value.of(start)), is(Value.TRUE));

        ExpressionException exception = Assertions.assertThrows(
            ExpressionException.class,
            () -> eval(MULTIPLY, Value.of(start), Value.of(start))
        );
        assertThat(exception.getOriginalMessage(), is("The operator `*` is not supported for DateTime"));
    }

    @Test
    void rejectsUnsupportedTypes() {
        ExpressionException exception = Assertions.assertThrows(
            ExpressionException.class,
            () -> eval(ADD, Value.of(Duration.ofSeconds(1)), Value.of(Duration.ofSeconds(2)))
        );

        assertThat(exception.getOriginalMessage(), is("Unsupported types `PT1S/timespan` + `PT2S/timespan` for binary operation"));
        assertThat(exception.getMessage(), containsString("<test>(1,1) : error : "));
    }

    @Test
    void comparesArraysStructurally() throws Exception {
        Value left = Value.ofArray(List.of(Value.of(1), Value.of("a")));
        Value right = Value.ofArray(List.of(Value.of(1), Value.of("a")));

        assertThat(eval(COMPARE_EQUAL, left, right), is(Value.TRUE));
    }

    @Test
    void delegatesToCustomOperations() throws Exception {
        CustomBinaryOperation handled = (context, span, operator, leftSpan, left, rightSpan, right) ->
            Optional.of(Value.of("custom " + operator.toText()));
        CustomBinaryOperation declined = (context, span, operator, leftSpan, left, rightSpan, right) -> Optional.empty();

        assertThat(eval(ADD, Value.of(1), Value.ofObject(handled)), is(Value.of("custom +")));

        ExpressionException exception = Assertions.assertThrows(
            ExpressionException.class,
            () -> eval(ADD, Value.ofObject(declined), Value.of(1))
        );
        assertThat(exception.getOriginalMessage(), containsString("The operator `+` is not supported between"));
    }
}
