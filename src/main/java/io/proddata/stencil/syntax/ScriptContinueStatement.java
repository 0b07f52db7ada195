package io.proddata.stencil.syntax;

import lombok.Getter;
import lombok.Setter;

@Getter
@Setter
@ScriptSyntax(name = "continue statement", example = "continue")
public class ScriptContinueStatement extends ScriptStatement {
    private ScriptToken continueKeyword = ScriptToken.keyword("continue");

    @Override
    public <R> R accept(ScriptVisitor<R> visitor) {
        return visitor.visit(this);
    }
}
