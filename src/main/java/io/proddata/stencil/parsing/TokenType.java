package io.proddata.stencil.parsing;

public enum TokenType {
    INVALID(null),
    FRONT_MATTER_MARKER(null),
    CODE_ENTER(null),
    LIQUID_TAG_ENTER(null),
    CODE_EXIT(null),
    LIQUID_TAG_EXIT(null),
    RAW(null),
    ESCAPE(null),
    ESCAPE_ENTER(null),
    ESCAPE_EXIT(null),
    NEW_LINE(null),
    WHITESPACE(null),
    WHITESPACE_FULL(null),
    COMMENT(null),
    COMMENT_MULTI(null),
    IDENTIFIER_SPECIAL(null),
    IDENTIFIER(null),
    INTEGER(null),
    HEXA_INTEGER(null),
    BINARY_INTEGER(null),
    FLOAT(null),
    STRING(null),
    IMPLICIT_STRING(null),
    VERBATIM_STRING(null),
    BEGIN_INTERPOLATED_STRING(null),
    CONTINUATION_INTERPOLATED_STRING(null),
    ENDING_INTERPOLATED_STRING(null),
    OPEN_INTERPOLATED_BRACE("{"),
    CLOSE_INTERPOLATED_BRACE("}"),
    SEMI_COLON(";"),
    ARROBA("@"),
    CARET("^"),
    DOUBLE_CARET("^^"),
    COLON(":"),
    EQUAL("="),
    VERTICAL_BAR("|"),
    PIPE_GREATER("|>"),
    EXCLAMATION("!"),
    DOUBLE_AMP("&&"),
    DOUBLE_VERTICAL_BAR("||"),
    AMP("&"),
    QUESTION("?"),
    DOUBLE_QUESTION("??"),
    QUESTION_DOT("?."),
    QUESTION_EXCLAMATION("?!"),
    DOUBLE_EQUAL("=="),
    EXCLAMATION_EQUAL("!="),
    LESS("<"),
    GREATER(">"),
    LESS_EQUAL("<="),
    GREATER_EQUAL(">="),
    DIVIDE("/"),
    DIVIDE_EQUAL("/="),
    DOUBLE_DIVIDE("//"),
    DOUBLE_DIVIDE_EQUAL("//="),
    ASTERISK("*"),
    ASTERISK_EQUAL("*="),
    PLUS("+"),
    PLUS_EQUAL("+="),
    DOUBLE_PLUS("++"),
    MINUS("-"),
    MINUS_EQUAL("-="),
    DOUBLE_MINUS("--"),
    PERCENT("%"),
    PERCENT_EQUAL("%="),
    DOUBLE_LESS_THAN("<<"),
    DOUBLE_GREATER_THAN(">>"),
    COMMA(","),
    DOT("."),
    DOUBLE_DOT(".."),
    TRIPLE_DOT("..."),
    DOUBLE_DOT_LESS("..<"),
    OPEN_PAREN("("),
    CLOSE_PAREN(")"),
    OPEN_BRACE("{"),
    CLOSE_BRACE("}"),
    OPEN_BRACKET("["),
    CLOSE_BRACKET("]"),
    EOF(null);

    private final String text;

    TokenType(String text) {
        this.text = text;
    }

    /**
     * The fixed text of an operator or punctuation token, {@code null} for tokens whose text varies.
     */
    public String toText() {
        return text;
    }

    public boolean hasText() {
        return text != null;
    }

    public boolean isHidden() {
        return this == COMMENT || this == COMMENT_MULTI || this == WHITESPACE || this == WHITESPACE_FULL;
    }
}
