package io.proddata.stencil.syntax;

import io.proddata.stencil.parsing.SourceSpan;

/**
 * Source text that carries no meaning for evaluation (whitespace, comments, separators), kept to print
 * a template back exactly.
 */
public record ScriptTrivia(SourceSpan span, ScriptTriviaType type, String text) {
    public static final ScriptTrivia SPACE = new ScriptTrivia(null, ScriptTriviaType.WHITESPACE, " ");

    @Override
    public String toString() {
        return switch (type) {
            case EMPTY -> "";
            case COMMA -> ",";
            case SEMI_COLON -> ";";
            default -> text;
        };
    }
}
