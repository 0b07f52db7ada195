package io.proddata.stencil.expression;

public enum ValueKind {
    NULL("null"),
    BOOL("bool"),
    INT32("int"),
    INT64("long"),
    UINT64("ulong"),
    BIG_INTEGER("bigint"),
    FLOAT32("float"),
    FLOAT64("double"),
    DECIMAL("decimal"),
    STRING("string"),
    CHAR("char"),
    DATE_TIME("date"),
    TIME_SPAN("timespan"),
    /** The {@code empty} keyword, equal to any empty string, array or object. */
    EMPTY("empty"),
    RANGE("range"),
    ARRAY("array"),
    /** Host objects: maps, Ion structs or any opaque payload. */
    OBJECT("object");

    private final String typeName;

    ValueKind(String typeName) {
        this.typeName = typeName;
    }

    /**
     * The name of the type as shown in error messages.
     */
    public String typeName() {
        return typeName;
    }

    public boolean isInteger() {
        return this == INT32 || this == INT64 || this == UINT64 || this == BIG_INTEGER;
    }

    public boolean isNumber() {
        return isInteger() || this == FLOAT32 || this == FLOAT64 || this == DECIMAL;
    }
}
