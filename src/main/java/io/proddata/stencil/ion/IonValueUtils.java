package io.proddata.stencil.ion;

import com.amazon.ion.IonBool;
import com.amazon.ion.IonDecimal;
import com.amazon.ion.IonException;
import com.amazon.ion.IonFloat;
import com.amazon.ion.IonInt;
import com.amazon.ion.IonList;
import com.amazon.ion.IonLob;
import com.amazon.ion.IonStruct;
import com.amazon.ion.IonSystem;
import com.amazon.ion.IonText;
import com.amazon.ion.IonTimestamp;
import com.amazon.ion.IonValue;
import com.amazon.ion.Timestamp;
import com.amazon.ion.system.IonSystemBuilder;
import io.proddata.stencil.expression.Value;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

public final class IonValueUtils {
    private static final IonSystem SYSTEM = IonSystemBuilder.standard().build();

    private IonValueUtils() {
    }

    public static IonSystem system() {
        return SYSTEM;
    }

    public static boolean isNull(IonValue value) {
        return value == null || value.isNullValue();
    }

    public static IonValue nullValue() {
        return SYSTEM.newNull();
    }

    /**
     * Parses Ion text holding a single struct, such as {@code {name: "alpha", count: 2}}.
     */
    public static IonStruct parseStruct(String text) throws CastException {
        IonValue value;
        try {
            value = SYSTEM.singleValue(text);
        } catch (IonException e) {
            throw new CastException("Invalid Ion text: " + text, e);
        }
        if (!(value instanceof IonStruct struct)) {
            throw new CastException("Expected an Ion struct, got " + value.getType());
        }
        return struct;
    }

    /**
     * Converts host data into an Ion struct usable as globals. Values follow {@link Value#from(Object)},
     * nested maps become structs.
     *
     * @throws CastException for values that have no Ion counterpart
     */
    public static IonStruct toStruct(Map<String, ?> data) throws CastException {
        if (data == null) {
            return SYSTEM.newEmptyStruct();
        }
        return (IonStruct) toIon(Value.ofObject(data));
    }

    /**
     * Converts an Ion value into a runtime value. Structs and s-expressions are kept as {@code OBJECT}
     * payloads and read lazily; lists are converted into arrays.
     */
    public static Value toValue(IonValue value) {
        if (isNull(value)) {
            return Value.NULL;
        }
        if (value instanceof IonBool ionBool) {
            return Value.of(ionBool.booleanValue());
        }
        if (value instanceof IonInt ionInt) {
            return Value.integer(ionInt.bigIntegerValue());
        }
        if (value instanceof IonDecimal ionDecimal) {
            return Value.of(ionDecimal.bigDecimalValue());
        }
        if (value instanceof IonFloat ionFloat) {
            return Value.of(ionFloat.doubleValue());
        }
        if (value instanceof IonText ionText) {
            return Value.of(ionText.stringValue());
        }
        if (value instanceof IonTimestamp ionTimestamp) {
            return Value.of(Instant.ofEpochMilli(ionTimestamp.timestampValue().getMillis()));
        }
        if (value instanceof IonList ionList) {
            List<Value> values = new ArrayList<>(ionList.size());
            for (IonValue child : ionList) {
                values.add(toValue(child));
            }
            return Value.ofArray(values);
        }
        if (value instanceof IonLob ionLob) {
            return Value.ofObject(ionLob.getBytes());
        }
        return Value.ofObject(value);
    }

    /**
     * Converts a runtime value back into Ion. Ranges are enumerated into lists.
     *
     * @throws CastException for host objects that are neither Ion values nor maps
     */
    public static IonValue toIon(Value value) throws CastException {
        if (value == null || value.isNull() || value.isEmptyObject()) {
            return nullValue();
        }
        Object payload = value.getPayload();
        switch (value.getKind()) {
            case BOOL:
                return SYSTEM.newBool(value.asBoolean());
            case INT32:
            case INT64:
                return SYSTEM.newInt(((Number) payload).longValue());
            case UINT64:
            case BIG_INTEGER:
                return SYSTEM.newInt((BigInteger) payload);
            case FLOAT32:
            case FLOAT64:
                return SYSTEM.newFloat(((Number) payload).doubleValue());
            case DECIMAL:
                return SYSTEM.newDecimal((BigDecimal) payload);
            case STRING:
            case CHAR:
                return SYSTEM.newString(payload.toString());
            case DATE_TIME:
                return SYSTEM.newTimestamp(Timestamp.forMillis(value.asInstant().toEpochMilli(), null));
            case TIME_SPAN:
                return SYSTEM.newString(((Duration) payload).toString());
            case RANGE:
                return toIonList(value.asRange());
            case ARRAY:
                return toIonList(value.asList());
            default:
                break;
        }
        if (payload instanceof IonValue ionValue) {
            return ionValue.clone();
        }
        if (payload instanceof Map<?, ?> map) {
            IonStruct struct = SYSTEM.newEmptyStruct();
            for (Map.Entry<?, ?> entry : map.entrySet()) {
                struct.put(String.valueOf(entry.getKey()), toIon(Value.from(entry.getValue())));
            }
            return struct;
        }
        throw new CastException(value.getKind(), "Unable to convert a value of type `" + value.typeName() + "` to Ion");
    }

    private static IonList toIonList(Iterable<Value> values) throws CastException {
        IonList list = SYSTEM.newEmptyList();
        for (Value element : values) {
            list.add(toIon(element));
        }
        return list;
    }
}
