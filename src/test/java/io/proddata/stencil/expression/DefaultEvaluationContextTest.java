package io.proddata.stencil.expression;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.is;

class DefaultEvaluationContextTest {
    private final DefaultEvaluationContext context = new DefaultEvaluationContext();

    @Test
    void formatsScalars() {
        assertThat(context.toString(Value.NULL), is(""));
        assertThat(context.toString(Value.of(2.50)), is("2.5"));
        assertThat(context.toString(Value.of(1e20)), is("1.0E20"));
        assertThat(context.toString(Value.of(new BigDecimal("1.10"))), is("1.10"));
        assertThat(context.toString(Value.of(true)), is("true"));
    }

    @Test
    void formatsWithLocale() {
        DefaultEvaluationContext french = new DefaultEvaluationContext(new EvaluationOptions(false, Locale.FRANCE));

        assertThat(french.toString(Value.of(1.25)), is("1,25"));
    }

    @Test
    void formatsCollections() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("name", "a\"b");
        map.put("none", null);

        assertThat(context.toString(Value.ofArray(List.of(Value.of(1), Value.of("x")))), is("[1, \"x\"]"));
        assertThat(context.toString(Value.ofObject(map)), is("{name: \"a\\\"b\", none: null}"));
    }

    @Test
    void convertsToBool() {
        DefaultEvaluationContext strict = new DefaultEvaluationContext(EvaluationOptions.strictMode());

        assertThat(context.toBool(null, Value.NULL), is(false));
        assertThat(context.toBool(null, Value.EMPTY), is(false));
        assertThat(context.toBool(null, Value.of(0)), is(true));
        assertThat(context.toBool(null, Value.of("")), is(true));
        assertThat(strict.toBool(null, Value.of(0)), is(false));
    }

    @Test
    void convertsToInt() throws Exception {
        assertThat(context.toInt(null, Value.of(" 42 ")), is(42));
        assertThat(context.toInt(null, Value.of(2.5)), is(2));
        assertThat(context.toInt(null, Value.NULL), is(0));

        ExpressionException exception = Assertions.assertThrows(
            ExpressionException.class,
            () -> context.toInt(null, Value.of("forty"))
        );
        assertThat(exception.getMessage(), containsString("to int"));
    }

    @Test
    void checksEmptiness() {
        assertThat(context.isEmpty(null, Value.of("")), is(true));
        assertThat(context.isEmpty(null, Value.ofArray(List.of())), is(true));
        assertThat(context.isEmpty(null, Value.of(ScriptRange.exclusive(1, 1))), is(true));
        assertThat(context.isEmpty(null, Value.ofObject(Map.of())), is(true));
        assertThat(context.isEmpty(null, Value.ofObject(Map.of("a", 1))), is(false));
        assertThat(context.isEmpty(null, Value.of(0)), is(false));
    }

    @Test
    void readsStrictFlagFromOptions() {
        assertThat(new DefaultEvaluationContext(EvaluationOptions.strictMode()).isStrict(), is(true));
        assertThat(EvaluationOptions.strictMode().strict(), is(true));
        assertThat(context.isStrict(), is(false));
    }
}
