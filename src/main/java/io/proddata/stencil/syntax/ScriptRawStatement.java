package io.proddata.stencil.syntax;

import lombok.Getter;
import lombok.Setter;

/**
 * Text outside of code blocks, or the content of an escape block.
 */
@Getter
@Setter
@ScriptSyntax(name = "raw statement", example = "<raw_text>")
public class ScriptRawStatement extends ScriptStatement implements ScriptTerminal {
    private String text;
    private boolean escape;
    private ScriptTrivias trivias;

    @Override
    public <R> R accept(ScriptVisitor<R> visitor) {
        return visitor.visit(this);
    }
}
