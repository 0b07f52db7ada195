package io.proddata.stencil.parsing;

/**
 * An inclusive range of source text, from {@code start} to {@code end}.
 */
public record SourceSpan(String fileName, TextPosition start, TextPosition end) {

    public int offset() {
        return start.offset();
    }

    public int length() {
        return end.offset() - start.offset() + 1;
    }

    public SourceSpan withEnd(TextPosition newEnd) {
        return new SourceSpan(fileName, start, newEnd);
    }

    public String toStringSimple() {
        return fileName + "(" + start.toStringSimple() + ")";
    }

    @Override
    public String toString() {
        return fileName + start + "-" + end;
    }
}
