package io.proddata.stencil.parsing;

import com.fasterxml.jackson.annotation.JsonCreator;

import java.util.Locale;

public enum Dialect {
    DEFAULT,
    LIQUID,
    /** Default grammar with math operators and strict null handling. */
    SCIENTIFIC;

    @JsonCreator
    public static Dialect from(Object value) {
        if (value == null) {
            return null;
        }
        String raw = String.valueOf(value).trim().replace('-', '_');
        return Dialect.valueOf(raw.toUpperCase(Locale.ROOT));
    }
}
