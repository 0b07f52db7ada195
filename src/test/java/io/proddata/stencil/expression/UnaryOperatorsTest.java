package io.proddata.stencil.expression;

import io.proddata.stencil.syntax.ScriptUnaryOperator;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.List;
import java.util.Optional;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.is;

class UnaryOperatorsTest {
    private static final EvaluationContext LENIENT = new DefaultEvaluationContext();
    private static final EvaluationContext STRICT = new DefaultEvaluationContext(EvaluationOptions.strictMode());

    @Test
    void negatesNumbers() throws Exception {
        assertThat(UnaryOperators.evaluate(LENIENT, null, ScriptUnaryOperator.NEGATE, Value.of(5)), is(Value.of(-5)));
        assertThat(UnaryOperators.evaluate(LENIENT, null, ScriptUnaryOperator.NEGATE, Value.of(1.5)), is(Value.of(-1.5)));
        assertThat(UnaryOperators.evaluate(LENIENT, null, ScriptUnaryOperator.NEGATE, Value.of(new BigDecimal("2.50"))),
            is(Value.of(new BigDecimal("-2.50"))));
        assertThat(UnaryOperators.evaluate(LENIENT, null, ScriptUnaryOperator.PLUS, Value.of(3L)), is(Value.of(3L)));
    }

    @Test
    void promotesMinimumValues() throws Exception {
        Value negatedInt = UnaryOperators.evaluate(LENIENT, null, ScriptUnaryOperator.NEGATE, Value.of(Integer.MIN_VALUE));
        assertThat(negatedInt, is(Value.of(2147483648L)));

        Value negatedLong = UnaryOperators.evaluate(LENIENT, null, ScriptUnaryOperator.NEGATE, Value.of(Long.MIN_VALUE));
        assertThat(negatedLong, is(Value.of(BigInteger.valueOf(Long.MIN_VALUE).negate())));
    }

    @Test
    void rejectsNonNumericSign() {
        ExpressionException exception = Assertions.assertThrows(
            ExpressionException.class,
            () -> UnaryOperators.evaluate(LENIENT, null, ScriptUnaryOperator.NEGATE, Value.of("x"))
        );

        assertThat(exception.getMessage(), is("Unexpected value `x / Type: string`. Cannot negate(-)/positive(+) a non-numeric value"));
    }

    @Test
    void rejectsNullSign() {
        ExpressionException exception = Assertions.assertThrows(
            ExpressionException.class,
            () -> UnaryOperators.evaluate(LENIENT, null, ScriptUnaryOperator.NEGATE, Value.NULL)
        );

        assertThat(exception.getMessage(), is("Operator `-` is not supported"));
    }

    @Test
    void negatesTruthiness() throws Exception {
        assertThat(UnaryOperators.evaluate(LENIENT, null, ScriptUnaryOperator.NOT, Value.NULL), is(Value.TRUE));
        assertThat(UnaryOperators.evaluate(LENIENT, null, ScriptUnaryOperator.NOT, Value.of("text")), is(Value.FALSE));
        assertThat(UnaryOperators.evaluate(STRICT, null, ScriptUnaryOperator.NOT, Value.TRUE), is(Value.FALSE));
    }

    @Test
    void requiresBooleanNotInStrictMode() {
        ExpressionException exception = Assertions.assertThrows(
            ExpressionException.class,
            () -> UnaryOperators.evaluate(STRICT, null, ScriptUnaryOperator.NOT, Value.of(1))
        );

        assertThat(exception.getMessage(), is("Expecting a boolean instead of int value: 1"));
    }

    @Test
    void passesAliasesThrough() throws Exception {
        Value list = Value.ofArray(List.of(Value.of(1)));

        assertThat(UnaryOperators.evaluate(LENIENT, null, ScriptUnaryOperator.FUNCTION_PARAMETERS_EXPAND, list), is(list));
    }

    @Test
    void delegatesToCustomOperations() throws Exception {
        CustomUnaryOperation custom = (context, span, operator, operand) ->
            operator == ScriptUnaryOperator.NEGATE ? Optional.of(Value.of("negated")) : Optional.empty();

        assertThat(UnaryOperators.evaluate(LENIENT, null, ScriptUnaryOperator.NEGATE, Value.ofObject(custom)), is(Value.of("negated")));
        Assertions.assertThrows(
            ExpressionException.class,
            () -> UnaryOperators.evaluate(LENIENT, null, ScriptUnaryOperator.NOT, Value.ofObject(custom))
        );
    }
}
