package io.proddata.stencil.ion;

import com.amazon.ion.IonBool;
import com.amazon.ion.IonDecimal;
import com.amazon.ion.IonInt;
import com.amazon.ion.IonList;
import com.amazon.ion.IonString;
import com.amazon.ion.IonStruct;
import com.amazon.ion.IonTimestamp;
import com.amazon.ion.IonValue;
import com.amazon.ion.Timestamp;
import io.proddata.stencil.expression.ScriptRange;
import io.proddata.stencil.expression.Value;
import io.proddata.stencil.expression.ValueKind;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.Instant;
import java.util.Date;
import java.util.List;
import java.util.Map;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.instanceOf;
import static org.hamcrest.Matchers.is;

class IonValueUtilsTest {
    @Test
    void convertsHostDataToStruct() throws Exception {
        Map<String, Object> input = Map.of(
            "name", "alpha",
            "count", 12,
            "price", new BigDecimal("3.50"),
            "active", true,
            "tags", List.of("a", "b"),
            "owner", Map.of("since", Date.from(Instant.parse("2024-01-01T00:00:00Z")))
        );

        IonStruct struct = IonValueUtils.toStruct(input);

        assertThat(((IonString) struct.get("name")).stringValue(), is("alpha"));
        assertThat(((IonInt) struct.get("count")).intValue(), is(12));
        assertThat(((IonDecimal) struct.get("price")).bigDecimalValue(), is(new BigDecimal("3.50")));
        assertThat(((IonBool) struct.get("active")).booleanValue(), is(true));
        IonList tags = (IonList) struct.get("tags");
        assertThat(tags.size(), is(2));
        assertThat(((IonString) tags.get(0)).stringValue(), is("a"));
        IonTimestamp since = (IonTimestamp) ((IonStruct) struct.get("owner")).get("since");
        assertThat(since.timestampValue().getMillis(), is(Instant.parse("2024-01-01T00:00:00Z").toEpochMilli()));
        assertThat(IonValueUtils.toStruct(null).isEmpty(), is(true));
    }

    @Test
    void rejectsHostObjectsInStruct() {
        CastException exception = Assertions.assertThrows(
            CastException.class,
            () -> IonValueUtils.toStruct(Map.of("buffer", new StringBuilder("opaque")))
        );

        assertThat(exception.getKind(), is(ValueKind.OBJECT));
    }

    @Test
    void convertsToValues() {
        Instant instant = Instant.parse("2024-01-01T00:00:00Z");
        IonTimestamp timestamp = IonValueUtils.system().newTimestamp(Timestamp.forMillis(instant.toEpochMilli(), null));

        assertThat(IonValueUtils.toValue(null), is(Value.NULL));
        assertThat(IonValueUtils.toValue(IonValueUtils.nullValue()), is(Value.NULL));
        assertThat(IonValueUtils.toValue(IonValueUtils.system().newInt(42)), is(Value.of(42)));
        assertThat(IonValueUtils.toValue(IonValueUtils.system().newInt(new BigInteger("99999999999999999999"))).getKind(),
            is(ValueKind.BIG_INTEGER));
        assertThat(IonValueUtils.toValue(IonValueUtils.system().newDecimal(new BigDecimal("12.75"))), is(Value.of(new BigDecimal("12.75"))));
        assertThat(IonValueUtils.toValue(IonValueUtils.system().newFloat(0.5)), is(Value.of(0.5)));
        assertThat(IonValueUtils.toValue(IonValueUtils.system().newSymbol("sym")), is(Value.of("sym")));
        assertThat(IonValueUtils.toValue(timestamp), is(Value.of(instant)));
    }

    @Test
    void keepsStructsAndConvertsLists() throws Exception {
        IonStruct struct = IonValueUtils.parseStruct("{items: [1, \"two\", null], nested: {a: 1}}");

        Value items = IonValueUtils.toValue(struct.get("items"));
        Value nested = IonValueUtils.toValue(struct.get("nested"));

        assertThat(items.asList(), is(List.of(Value.of(1), Value.of("two"), Value.NULL)));
        assertThat(nested.getKind(), is(ValueKind.OBJECT));
        assertThat(nested.getPayload(), instanceOf(IonStruct.class));
    }

    @Test
    void convertsBackToIon() throws Exception {
        IonValue list = IonValueUtils.toIon(Value.ofArray(List.of(Value.of(1), Value.of("x"), Value.NULL)));
        IonValue range = IonValueUtils.toIon(Value.of(ScriptRange.inclusive(1, 3)));
        IonValue map = IonValueUtils.toIon(Value.ofObject(Map.of("ok", Value.TRUE)));

        assertThat(list.toString(), is("[1,\"x\",null]"));
        assertThat(range.toString(), is("[1,2,3]"));
        assertThat(map.toString(), is("{ok:true}"));
        assertThat(IonValueUtils.isNull(IonValueUtils.toIon(Value.EMPTY)), is(true));
    }

    @Test
    void rejectsHostObjects() {
        CastException exception = Assertions.assertThrows(
            CastException.class,
            () -> IonValueUtils.toIon(Value.ofObject(new StringBuilder("opaque")))
        );

        assertThat(exception.getKind(), is(ValueKind.OBJECT));
        assertThat(exception.getMessage(), is("Unable to convert a value of type `StringBuilder` to Ion"));
    }

    @Test
    void rejectsInvalidStructText() {
        CastException invalid = Assertions.assertThrows(CastException.class, () -> IonValueUtils.parseStruct("{name: "));
        CastException notStruct = Assertions.assertThrows(CastException.class, () -> IonValueUtils.parseStruct("[1, 2]"));

        assertThat(invalid.getMessage(), containsString("Invalid Ion text"));
        assertThat(notStruct.getMessage(), is("Expected an Ion struct, got LIST"));
    }
}
