package io.proddata.stencil.syntax;

import lombok.Getter;
import lombok.Setter;

@Getter
@Setter
@ScriptSyntax(name = "wrap statement", example = "wrap <function_call> ... end")
public class ScriptWrapStatement extends ScriptStatement {
    private ScriptToken wrapKeyword = ScriptToken.keyword("wrap");
    private ScriptExpression target;
    private ScriptBlockStatement body;

    @Override
    public <R> R accept(ScriptVisitor<R> visitor) {
        return visitor.visit(this);
    }
}
