package io.proddata.stencil.expression;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.empty;
import static org.hamcrest.Matchers.is;

class ScriptRangeTest {
    private static List<Value> values(ScriptRange range) {
        List<Value> values = new ArrayList<>();
        range.forEach(values::add);
        return values;
    }

    @Test
    void countsUpInclusive() {
        assertThat(values(ScriptRange.inclusive(1, 3)), contains(Value.of(1), Value.of(2), Value.of(3)));
    }

    @Test
    void countsUpExclusive() {
        assertThat(values(ScriptRange.exclusive(1, 3)), contains(Value.of(1), Value.of(2)));
    }

    @Test
    void countsDown() {
        assertThat(values(ScriptRange.inclusive(3, 1)), contains(Value.of(3), Value.of(2), Value.of(1)));
        assertThat(values(ScriptRange.exclusive(3, 1)), contains(Value.of(3), Value.of(2)));
    }

    @Test
    void handlesEmptyAndSingleRanges() {
        ScriptRange none = ScriptRange.exclusive(2, 2);

        assertThat(none.isEmpty(), is(true));
        assertThat(values(none), is(empty()));
        assertThat(values(ScriptRange.inclusive(2, 2)), contains(Value.of(2)));
    }

    @Test
    void narrowsLargeElements() {
        ScriptRange range = new ScriptRange(BigInteger.valueOf(Integer.MAX_VALUE), BigInteger.valueOf(Integer.MAX_VALUE + 1L), true);

        List<Value> values = values(range);

        assertThat(values.get(0).getKind(), is(ValueKind.INT32));
        assertThat(values.get(1).getKind(), is(ValueKind.INT64));
    }

    @Test
    void enumeratesOnce() {
        ScriptRange range = ScriptRange.inclusive(1, 2);
        values(range);

        IllegalStateException exception = Assertions.assertThrows(IllegalStateException.class, range::iterator);

        assertThat(exception.getMessage(), containsString("The range 1..2 has already been enumerated"));
    }

    @Test
    void printsBounds() {
        assertThat(ScriptRange.inclusive(1, 5).toString(), is("1..5"));
        assertThat(ScriptRange.exclusive(1, 5).toString(), is("1..<5"));
    }
}
