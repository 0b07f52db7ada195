package io.proddata.stencil.expression;

import com.amazon.ion.IonStruct;
import io.proddata.stencil.ion.IonValueUtils;
import io.proddata.stencil.parsing.Dialect;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.is;

class DefaultExpressionEngineTest {
    private static IonStruct record() throws Exception {
        return IonValueUtils.parseStruct("{user: {name: \"alpha\", tags: [\"a\", \"b\"]}, count: 3}");
    }

    @Test
    void returnsNullForBlankExpression() throws Exception {
        DefaultExpressionEngine engine = new DefaultExpressionEngine();

        Value value = engine.evaluate("   ", IonValueUtils.system().newEmptyStruct());

        assertThat(value.isNull(), is(true));
    }

    @Test
    void rejectsInvalidExpression() {
        DefaultExpressionEngine engine = new DefaultExpressionEngine();
        IonStruct record = IonValueUtils.system().newEmptyStruct();

        ExpressionException exception = Assertions.assertThrows(
            ExpressionException.class,
            () -> engine.evaluate("user.", record)
        );

        assertThat(exception.getMessage(), containsString("Invalid expression: user."));
    }

    @Test
    void readsMembersAndItems() throws Exception {
        DefaultExpressionEngine engine = new DefaultExpressionEngine();
        IonStruct record = record();

        assertThat(engine.evaluate("user.name", record), is(Value.of("alpha")));
        assertThat(engine.evaluate("user[\"name\"]", record), is(Value.of("alpha")));
        assertThat(engine.evaluate("user.tags[1]", record), is(Value.of("b")));
        assertThat(engine.evaluate("user.tags[-2]", record), is(Value.of("a")));
        assertThat(engine.evaluate("user.tags[5]", record).isNull(), is(true));
        assertThat(engine.evaluate("user.missing", record).isNull(), is(true));
        assertThat(engine.evaluate("nothing.at.all", record).isNull(), is(true));
    }

    @Test
    void evaluatesArithmetic() throws Exception {
        DefaultExpressionEngine engine = new DefaultExpressionEngine();
        IonStruct record = record();

        assertThat(engine.evaluate("1 + 2 * 3", record), is(Value.of(7)));
        assertThat(engine.evaluate("(1 + 2) * count", record), is(Value.of(9)));
        assertThat(engine.evaluate("count / 2", record), is(Value.of(1.5)));
        assertThat(engine.evaluate("user.name + \"!\"", record), is(Value.of("alpha!")));
    }

    @Test
    void evaluatesLogic() throws Exception {
        DefaultExpressionEngine engine = new DefaultExpressionEngine();
        IonStruct record = record();

        assertThat(engine.evaluate("count > 2 && user.name == \"alpha\"", record), is(Value.TRUE));
        assertThat(engine.evaluate("!user.missing", record), is(Value.TRUE));
        assertThat(engine.evaluate("count > 5 ? \"big\" : \"small\"", record), is(Value.of("small")));
        assertThat(engine.evaluate("user.missing ?? \"fallback\"", record), is(Value.of("fallback")));
    }

    @Test
    void checksEmptiness() throws Exception {
        DefaultExpressionEngine engine = new DefaultExpressionEngine();
        IonStruct record = record();

        assertThat(engine.evaluate("user.tags.empty?", record), is(Value.FALSE));
        assertThat(engine.evaluate("user.missing.empty?", record), is(Value.TRUE));
        assertThat(engine.evaluate("user.tags == empty", record), is(Value.FALSE));
        assertThat(engine.evaluate("empty", record).getKind(), is(ValueKind.EMPTY));
    }

    @Test
    void buildsArraysAndObjects() throws Exception {
        DefaultExpressionEngine engine = new DefaultExpressionEngine();
        IonStruct record = record();

        Value array = engine.evaluate("[1, count, user.name]", record);
        assertThat(array.asList(), is(List.of(Value.of(1), Value.of(3), Value.of("alpha"))));

        Value object = engine.evaluate("{first: 1, \"second\": user.tags[0]}", record);
        assertThat(object.getPayload(), is(Map.of("first", Value.of(1), "second", Value.of("a"))));
    }

    @Test
    void enumeratesRanges() throws Exception {
        DefaultExpressionEngine engine = new DefaultExpressionEngine();

        Value range = engine.evaluate("1..count", record());

        assertThat(range.getKind(), is(ValueKind.RANGE));
        assertThat(range.toString(), is("1..3"));
    }

    @Test
    void evaluatesScientificPowers() throws Exception {
        DefaultExpressionEngine engine = new DefaultExpressionEngine(Dialect.SCIENTIFIC);

        assertThat(engine.evaluate("2 ^ 10", record()), is(Value.of(1024)));
    }

    @Test
    void rejectsNullMembersInStrictMode() throws Exception {
        DefaultExpressionEngine engine = new DefaultExpressionEngine(Dialect.DEFAULT, EvaluationOptions.strictMode());
        IonStruct record = record();

        ExpressionException exception = Assertions.assertThrows(
            ExpressionException.class,
            () -> engine.evaluate("user.missing.name", record)
        );

        assertThat(exception.getOriginalMessage(), is("Cannot get the member user.missing.name for a null object."));
    }

    @Test
    void rejectsFunctionCalls() {
        DefaultExpressionEngine engine = new DefaultExpressionEngine();
        IonStruct record = IonValueUtils.system().newEmptyStruct();

        ExpressionException exception = Assertions.assertThrows(
            ExpressionException.class,
            () -> engine.evaluate("missing_fn 1", record)
        );

        assertThat(exception.getMessage(), containsString("is not supported by the expression engine"));
    }

    @Test
    void cachesCompiledExpressions() throws Exception {
        DefaultExpressionEngine engine = new DefaultExpressionEngine();

        assertThat(engine.evaluate("count + 1", record()), is(Value.of(4)));
        assertThat(engine.evaluate("count + 1", IonValueUtils.parseStruct("{count: 10}")), is(Value.of(11)));
    }

    @Test
    void evaluatesAgainstHostData() throws Exception {
        DefaultExpressionEngine engine = new DefaultExpressionEngine();
        Map<String, Object> globals = Map.of("user", Map.of("name", "gamma"), "scores", List.of(1, 2));

        assertThat(engine.evaluate("user.name + \"/\" + scores[1]", globals), is(Value.of("gamma/2")));
    }

    @Test
    void convertsResultsToIon() throws Exception {
        DefaultExpressionEngine engine = new DefaultExpressionEngine();
        IonStruct record = record();

        assertThat(engine.evaluateToIon("1..count", record).toString(), is("[1,2,3]"));
        assertThat(engine.evaluateToIon("user", record).toString(), is("{name:\"alpha\",tags:[\"a\",\"b\"]}"));
        assertThat(IonValueUtils.isNull(engine.evaluateToIon("user.missing", record)), is(true));
    }

    @Test
    void buildsFromConfiguration() throws Exception {
        DefaultExpressionEngine engine = DefaultExpressionEngine.fromConfig("{dialect: \"scientific\"}");
        IonStruct record = record();

        assertThat(engine.evaluate("2 ^ 3", record), is(Value.of(8)));
        ExpressionException exception = Assertions.assertThrows(
            ExpressionException.class,
            () -> engine.evaluate("user.missing.name", record)
        );
        assertThat(exception.getOriginalMessage(), containsString("Cannot get the member"));
    }

    @Test
    void evaluatesInterpolatedStrings() throws Exception {
        DefaultExpressionEngine engine = new DefaultExpressionEngine();
        Map<String, Object> globals = Map.of("user", Map.of("name", "gamma"), "scores", List.of(1, 2));

        assertThat(engine.evaluate("$\"Hello {user.name}, {scores[0] + scores[1]} \\{x\\}\"", globals), is(Value.of("Hello gamma, 3 {x}")));
        assertThat(engine.evaluate("$'[{user.missing}]'", globals), is(Value.of("[]")));
    }
}
