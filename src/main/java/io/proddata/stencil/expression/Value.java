package io.proddata.stencil.expression;

import lombok.EqualsAndHashCode;
import lombok.Getter;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.RoundingMode;
import java.time.Duration;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Date;
import java.util.List;
import java.util.Objects;

/**
 * A runtime value: a {@link ValueKind} tag and its payload.
 * <p>
 * Payloads by kind: {@link Boolean}, {@link Integer}, {@link Long}, {@link BigInteger} (for both
 * {@code UINT64} and {@code BIG_INTEGER}), {@link Float}, {@link Double}, {@link BigDecimal},
 * {@link String}, {@link Character}, {@link Instant}, {@link Duration}, {@link ScriptRange},
 * an immutable {@code List<Value>} for arrays and any host object for {@code OBJECT}.
 */
@Getter
@EqualsAndHashCode
public final class Value {
    public static final Value NULL = new Value(ValueKind.NULL, null);
    public static final Value EMPTY = new Value(ValueKind.EMPTY, null);
    public static final Value TRUE = new Value(ValueKind.BOOL, Boolean.TRUE);
    public static final Value FALSE = new Value(ValueKind.BOOL, Boolean.FALSE);

    private static final BigInteger INT_MIN = BigInteger.valueOf(Integer.MIN_VALUE);
    private static final BigInteger INT_MAX = BigInteger.valueOf(Integer.MAX_VALUE);
    private static final BigInteger LONG_MIN = BigInteger.valueOf(Long.MIN_VALUE);
    private static final BigInteger LONG_MAX = BigInteger.valueOf(Long.MAX_VALUE);
    private static final BigInteger ULONG_LIMIT = BigInteger.ONE.shiftLeft(64);

    private final ValueKind kind;
    private final Object payload;

    private Value(ValueKind kind, Object payload) {
        this.kind = kind;
        this.payload = payload;
    }

    public static Value of(boolean value) {
        return value ? TRUE : FALSE;
    }

    public static Value of(int value) {
        return new Value(ValueKind.INT32, value);
    }

    public static Value of(long value) {
        return new Value(ValueKind.INT64, value);
    }

    public static Value of(BigInteger value) {
        return value == null ? NULL : new Value(ValueKind.BIG_INTEGER, value);
    }

    public static Value unsigned(BigInteger value) {
        if (value == null) {
            return NULL;
        }
        if (value.signum() < 0 || value.compareTo(ULONG_LIMIT) >= 0) {
            throw new IllegalArgumentException("The value " + value + " is out of the range of an unsigned 64-bit integer");
        }
        return new Value(ValueKind.UINT64, value);
    }

    public static Value of(float value) {
        return new Value(ValueKind.FLOAT32, value);
    }

    public static Value of(double value) {
        return new Value(ValueKind.FLOAT64, value);
    }

    public static Value of(BigDecimal value) {
        return value == null ? NULL : new Value(ValueKind.DECIMAL, value);
    }

    public static Value of(String value) {
        return value == null ? NULL : new Value(ValueKind.STRING, value);
    }

    public static Value of(char value) {
        return new Value(ValueKind.CHAR, value);
    }

    public static Value of(Instant value) {
        return value == null ? NULL : new Value(ValueKind.DATE_TIME, value);
    }

    public static Value of(Duration value) {
        return value == null ? NULL : new Value(ValueKind.TIME_SPAN, value);
    }

    public static Value of(ScriptRange value) {
        return value == null ? NULL : new Value(ValueKind.RANGE, value);
    }

    public static Value ofArray(List<Value> values) {
        if (values == null) {
            return NULL;
        }
        List<Value> copy = new ArrayList<>(values.size());
        for (Value value : values) {
            copy.add(value == null ? NULL : value);
        }
        return new Value(ValueKind.ARRAY, Collections.unmodifiableList(copy));
    }

    public static Value ofObject(Object host) {
        return host == null ? NULL : new Value(ValueKind.OBJECT, host);
    }

    /**
     * Narrows an integer to the smallest of {@code INT32}, {@code INT64} and {@code BIG_INTEGER} that holds it.
     */
    public static Value integer(long value) {
        if (value >= Integer.MIN_VALUE && value <= Integer.MAX_VALUE) {
            return of((int) value);
        }
        return of(value);
    }

    public static Value integer(BigInteger value) {
        if (value.compareTo(INT_MIN) >= 0 && value.compareTo(INT_MAX) <= 0) {
            return of(value.intValue());
        }
        if (value.compareTo(LONG_MIN) >= 0 && value.compareTo(LONG_MAX) <= 0) {
            return of(value.longValue());
        }
        return of(value);
    }

    /**
     * Wraps a Java object, mapping boxed scalars, strings, dates and lists to their kind.
     * Anything else becomes an {@code OBJECT}.
     */
    public static Value from(Object value) {
        if (value == null) {
            return NULL;
        }
        if (value instanceof Value v) {
            return v;
        }
        if (value instanceof Boolean b) {
            return of(b.booleanValue());
        }
        if (value instanceof Integer || value instanceof Short || value instanceof Byte) {
            return of(((Number) value).intValue());
        }
        if (value instanceof Long l) {
            return of(l.longValue());
        }
        if (value instanceof BigInteger b) {
            return of(b);
        }
        if (value instanceof Float f) {
            return of(f.floatValue());
        }
        if (value instanceof Double d) {
            return of(d.doubleValue());
        }
        if (value instanceof BigDecimal d) {
            return of(d);
        }
        if (value instanceof String s) {
            return of(s);
        }
        if (value instanceof Character c) {
            return of(c.charValue());
        }
        if (value instanceof Instant instant) {
            return of(instant);
        }
        if (value instanceof OffsetDateTime offsetDateTime) {
            return of(offsetDateTime.toInstant());
        }
        if (value instanceof ZonedDateTime zonedDateTime) {
            return of(zonedDateTime.toInstant());
        }
        if (value instanceof Date date) {
            return of(date.toInstant());
        }
        if (value instanceof Duration duration) {
            return of(duration);
        }
        if (value instanceof ScriptRange range) {
            return of(range);
        }
        if (value instanceof List<?> list) {
            List<Value> values = new ArrayList<>(list.size());
            for (Object element : list) {
                values.add(from(element));
            }
            return ofArray(values);
        }
        return ofObject(value);
    }

    public boolean isNull() {
        return kind == ValueKind.NULL;
    }

    public boolean isEmptyObject() {
        return kind == ValueKind.EMPTY;
    }

    /**
     * Strings and characters take the string path of the binary operators.
     */
    public boolean isText() {
        return kind == ValueKind.STRING || kind == ValueKind.CHAR;
    }

    public String typeName() {
        if (kind == ValueKind.OBJECT) {
            return payload.getClass().getSimpleName();
        }
        return kind.typeName();
    }

    public boolean asBoolean() {
        return (Boolean) expect(ValueKind.BOOL);
    }

    public String asString() {
        return (String) expect(ValueKind.STRING);
    }

    public Instant asInstant() {
        return (Instant) expect(ValueKind.DATE_TIME);
    }

    public Duration asDuration() {
        return (Duration) expect(ValueKind.TIME_SPAN);
    }

    public ScriptRange asRange() {
        return (ScriptRange) expect(ValueKind.RANGE);
    }

    @SuppressWarnings("unchecked")
    public List<Value> asList() {
        return (List<Value>) expect(ValueKind.ARRAY);
    }

    private Object expect(ValueKind expected) {
        if (kind != expected) {
            throw new IllegalStateException("Expecting a " + expected.typeName() + " value instead of " + typeName());
        }
        return payload;
    }

    public BigInteger toBigInteger() {
        return switch (kind) {
            case INT32 -> BigInteger.valueOf((Integer) payload);
            case INT64 -> BigInteger.valueOf((Long) payload);
            case UINT64, BIG_INTEGER -> (BigInteger) payload;
            case FLOAT32, FLOAT64 -> BigDecimal.valueOf(((Number) payload).doubleValue()).toBigInteger();
            case DECIMAL -> ((BigDecimal) payload).toBigInteger();
            case BOOL -> (Boolean) payload ? BigInteger.ONE : BigInteger.ZERO;
            default -> throw unableToConvert("bigint");
        };
    }

    public long toLong() {
        return switch (kind) {
            case INT32 -> (Integer) payload;
            case INT64 -> (Long) payload;
            case UINT64, BIG_INTEGER -> ((BigInteger) payload).longValueExact();
            case FLOAT32, FLOAT64 -> roundHalfEven(((Number) payload).doubleValue()).longValueExact();
            case DECIMAL -> ((BigDecimal) payload).setScale(0, RoundingMode.HALF_EVEN).longValueExact();
            case BOOL -> (Boolean) payload ? 1L : 0L;
            default -> throw unableToConvert("long");
        };
    }

    public int toInt() {
        return switch (kind) {
            case INT32 -> (Integer) payload;
            case INT64 -> Math.toIntExact((Long) payload);
            case UINT64, BIG_INTEGER -> ((BigInteger) payload).intValueExact();
            case FLOAT32, FLOAT64 -> roundHalfEven(((Number) payload).doubleValue()).intValueExact();
            case DECIMAL -> ((BigDecimal) payload).setScale(0, RoundingMode.HALF_EVEN).intValueExact();
            case BOOL -> (Boolean) payload ? 1 : 0;
            default -> throw unableToConvert("int");
        };
    }

    public float toFloat() {
        return switch (kind) {
            case INT32, INT64, UINT64, BIG_INTEGER, FLOAT32, FLOAT64, DECIMAL -> ((Number) payload).floatValue();
            case BOOL -> (Boolean) payload ? 1f : 0f;
            default -> throw unableToConvert("float");
        };
    }

    public double toDouble() {
        return switch (kind) {
            case INT32, INT64, UINT64, BIG_INTEGER, FLOAT32, FLOAT64, DECIMAL -> ((Number) payload).doubleValue();
            case BOOL -> (Boolean) payload ? 1d : 0d;
            default -> throw unableToConvert("double");
        };
    }

    public BigDecimal toBigDecimal() {
        return switch (kind) {
            case INT32, INT64 -> BigDecimal.valueOf(((Number) payload).longValue());
            case UINT64, BIG_INTEGER -> new BigDecimal((BigInteger) payload);
            case FLOAT32 -> new BigDecimal(payload.toString());
            case FLOAT64 -> BigDecimal.valueOf((Double) payload);
            case DECIMAL -> (BigDecimal) payload;
            case BOOL -> (Boolean) payload ? BigDecimal.ONE : BigDecimal.ZERO;
            default -> throw unableToConvert("decimal");
        };
    }

    /**
     * Converts to a boolean the way a numeric cast does: non-zero numbers are {@code true}.
     */
    public boolean toBoolean() {
        return switch (kind) {
            case BOOL -> (Boolean) payload;
            case INT32, INT64 -> ((Number) payload).longValue() != 0;
            case UINT64, BIG_INTEGER -> ((BigInteger) payload).signum() != 0;
            case FLOAT32, FLOAT64 -> ((Number) payload).doubleValue() != 0d;
            case DECIMAL -> ((BigDecimal) payload).signum() != 0;
            default -> throw unableToConvert("bool");
        };
    }

    private static BigDecimal roundHalfEven(double value) {
        return BigDecimal.valueOf(Math.rint(value));
    }

    private IllegalArgumentException unableToConvert(String target) {
        return new IllegalArgumentException("Unable to convert type `" + typeName() + "` to " + target);
    }

    @Override
    public String toString() {
        return switch (kind) {
            case NULL -> "null";
            case EMPTY -> "empty";
            default -> Objects.toString(payload);
        };
    }
}
