package io.proddata.stencil.syntax;

import lombok.Getter;
import lombok.Setter;

@Getter
@Setter
@ScriptSyntax(name = "end statement", example = "end")
public class ScriptEndStatement extends ScriptStatement {
    private ScriptToken endKeyword = ScriptToken.keyword("end");
    /** Cleared when the end closes an anonymous function inside an expression. */
    private boolean expectEos = true;

    @Override
    public <R> R accept(ScriptVisitor<R> visitor) {
        return visitor.visit(this);
    }
}
