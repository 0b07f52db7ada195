package io.proddata.stencil.parsing;

/**
 * A diagnostic produced while lexing or parsing.
 */
public record LogMessage(ParserMessageType type, SourceSpan span, String message) {

    public boolean isError() {
        return type == ParserMessageType.ERROR;
    }

    @Override
    public String toString() {
        return span.toStringSimple() + " : " + type.label() + " : " + message;
    }
}
