package io.proddata.stencil.ion;

import io.proddata.stencil.expression.ValueKind;

/**
 * A value has no counterpart on the other side of the Ion bridge.
 */
public class CastException extends Exception {
    private final ValueKind kind;

    public CastException(String message) {
        this(null, message);
    }

    public CastException(String message, Throwable cause) {
        this(null, message, cause);
    }

    public CastException(ValueKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public CastException(ValueKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    /**
     * The kind of the value that could not be converted, {@code null} when the source was an Ion value.
     */
    public ValueKind getKind() {
        return kind;
    }
}
