package io.proddata.stencil.syntax;

import io.proddata.stencil.parsing.SourceSpan;
import io.proddata.stencil.parsing.TextPosition;
import lombok.Getter;
import lombok.Setter;

/**
 * Base class of every node of a parsed template.
 */
@Getter
@Setter
public abstract class ScriptNode {
    private SourceSpan span;

    public abstract <R> R accept(ScriptVisitor<R> visitor);

    public void setSpanStart(TextPosition start) {
        span = span == null ? new SourceSpan(null, start, start) : new SourceSpan(span.fileName(), start, span.end());
    }

    public void setSpanEnd(TextPosition end) {
        span = span == null ? new SourceSpan(null, end, end) : span.withEnd(end);
    }

    public String syntaxName() {
        ScriptSyntax syntax = getClass().getAnnotation(ScriptSyntax.class);
        return syntax == null ? getClass().getSimpleName() : syntax.name();
    }

    public String syntaxExample() {
        ScriptSyntax syntax = getClass().getAnnotation(ScriptSyntax.class);
        return syntax == null ? "" : syntax.example();
    }

    /**
     * Compound nodes delegate the placement of a required separator to their first child.
     */
    public boolean canHaveLeadingTrivia() {
        return true;
    }

    @Override
    public String toString() {
        return ScriptPrinter.print(this);
    }
}
