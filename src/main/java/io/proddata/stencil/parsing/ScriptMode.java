package io.proddata.stencil.parsing;

import com.fasterxml.jackson.annotation.JsonCreator;

import java.util.Locale;

public enum ScriptMode {
    /** Raw text interleaved with code blocks. */
    DEFAULT,
    /** Only the front matter is parsed, the rest of the document is left untouched. */
    FRONT_MATTER_ONLY,
    FRONT_MATTER_AND_CONTENT,
    /** The whole document is code, no enter/exit delimiters. */
    SCRIPT_ONLY;

    public boolean hasFrontMatter() {
        return this == FRONT_MATTER_ONLY || this == FRONT_MATTER_AND_CONTENT;
    }

    @JsonCreator
    public static ScriptMode from(Object value) {
        if (value == null) {
            return null;
        }
        String raw = String.valueOf(value).trim().replace('-', '_');
        return ScriptMode.valueOf(raw.toUpperCase(Locale.ROOT));
    }
}
