package io.proddata.stencil.syntax;

import lombok.Getter;
import lombok.Setter;

/**
 * Entering or leaving a code block ({@code {{}, {@code }}}, {@code {%}, {@code %}}) or an escape block
 * ({@code {%{}, {@code }%}}).
 */
@Getter
@Setter
@ScriptSyntax(name = "{{ or }}", example = "{{ or }}")
public class ScriptEscapeStatement extends ScriptStatement implements ScriptTerminal {
    private boolean entering;
    private boolean liquidTag;
    private ScriptWhitespaceMode whitespaceMode = ScriptWhitespaceMode.NONE;
    private int escapeCount;
    /** Whitespace between the previous newline and a code enter, {@code null} when the enter is not indented. */
    private String indent;
    /** The delimiter as written in the source. */
    private String tokenText;
    private ScriptTrivias trivias;

    @Override
    public <R> R accept(ScriptVisitor<R> visitor) {
        return visitor.visit(this);
    }
}
