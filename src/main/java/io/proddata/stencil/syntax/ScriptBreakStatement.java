package io.proddata.stencil.syntax;

import lombok.Getter;
import lombok.Setter;

@Getter
@Setter
@ScriptSyntax(name = "break statement", example = "break")
public class ScriptBreakStatement extends ScriptStatement {
    private ScriptToken breakKeyword = ScriptToken.keyword("break");

    @Override
    public <R> R accept(ScriptVisitor<R> visitor) {
        return visitor.visit(this);
    }
}
