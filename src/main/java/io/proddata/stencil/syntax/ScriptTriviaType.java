package io.proddata.stencil.syntax;

public enum ScriptTriviaType {
    EMPTY,
    WHITESPACE,
    WHITESPACE_FULL,
    COMMENT,
    COMMA,
    COMMENT_MULTI,
    NEW_LINE,
    SEMI_COLON,
    /** A separator consumed without a node of its own, such as the colon after a liquid filter name. */
    PUNCTUATION;

    public boolean isEndOfStatement() {
        return this == NEW_LINE || this == SEMI_COLON;
    }
}
