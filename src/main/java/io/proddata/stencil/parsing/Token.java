package io.proddata.stencil.parsing;

public record Token(TokenType type, TextPosition start, TextPosition end) {
    public static final Token EOF = new Token(TokenType.EOF, TextPosition.EOF, TextPosition.EOF);

    public String getText(String text) {
        if (type == TokenType.EOF) {
            return "<eof>";
        }
        if (text == null || start.offset() < 0 || end.offset() < start.offset() - 1) {
            return null;
        }
        int from = start.offset();
        int to = Math.min(end.offset() + 1, text.length());
        return from >= to ? "" : text.substring(from, to);
    }

    public boolean match(String expected, String text) {
        int length = end.offset() - start.offset() + 1;
        return expected.length() == length && text.regionMatches(start.offset(), expected, 0, length);
    }

    @Override
    public String toString() {
        return type + "(" + start + ":" + end + ")";
    }
}
