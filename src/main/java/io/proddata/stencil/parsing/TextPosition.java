package io.proddata.stencil.parsing;

/**
 * A zero-based position inside a source text.
 */
public record TextPosition(int offset, int line, int column) {
    public static final TextPosition ZERO = new TextPosition(0, 0, 0);
    public static final TextPosition EOF = new TextPosition(-1, -1, -1);

    public TextPosition nextColumn() {
        return new TextPosition(offset + 1, line, column + 1);
    }

    public TextPosition nextLine() {
        return new TextPosition(offset + 1, line + 1, 0);
    }

    public String toStringSimple() {
        return (line + 1) + "," + (column + 1);
    }

    @Override
    public String toString() {
        return "(" + offset + ":" + line + "," + column + ")";
    }
}
