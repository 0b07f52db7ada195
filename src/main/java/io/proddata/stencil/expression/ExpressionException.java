package io.proddata.stencil.expression;

import io.proddata.stencil.parsing.SourceSpan;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Raised when an expression cannot be evaluated.
 * <p>
 * The message is prefixed with the location of the failing expression when a span is known;
 * {@link #getOriginalMessage()} returns it without the location.
 */
public class ExpressionException extends Exception {
    private final SourceSpan span;
    private final List<SourceSpan> operandSpans;
    private final String originalMessage;

    public ExpressionException(String message) {
        this(null, message, List.of(), null);
    }

    public ExpressionException(String message, Throwable cause) {
        this(null, message, List.of(), cause);
    }

    public ExpressionException(SourceSpan span, String message) {
        this(span, message, List.of(), null);
    }

    public ExpressionException(SourceSpan span, String message, Throwable cause) {
        this(span, message, List.of(), cause);
    }

    public ExpressionException(SourceSpan span, String message, List<SourceSpan> operandSpans, Throwable cause) {
        super(span == null ? message : span.toStringSimple() + " : error : " + message, cause);
        this.span = span;
        this.operandSpans = operandSpans == null
            ? List.of()
            : Collections.unmodifiableList(new ArrayList<>(operandSpans));
        this.originalMessage = message;
    }

    public SourceSpan getSpan() {
        return span;
    }

    /**
     * The spans of the operands involved, left first, when the failure comes from an operator.
     */
    public List<SourceSpan> getOperandSpans() {
        return operandSpans;
    }

    public String getOriginalMessage() {
        return originalMessage;
    }
}
