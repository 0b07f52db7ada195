package io.proddata.stencil.syntax;

/**
 * Trimming requested by a code enter or exit: {@code -} removes every whitespace up to the next
 * non-space character, {@code ~} stops at the first newline.
 */
public enum ScriptWhitespaceMode {
    NONE(""),
    GREEDY("-"),
    NON_GREEDY("~");

    private final String marker;

    ScriptWhitespaceMode(String marker) {
        this.marker = marker;
    }

    public String marker() {
        return marker;
    }

    public static ScriptWhitespaceMode fromMarker(char c) {
        return switch (c) {
            case '-' -> GREEDY;
            case '~' -> NON_GREEDY;
            default -> NONE;
        };
    }
}
