package io.proddata.stencil.syntax;

import lombok.Getter;
import lombok.Setter;

@Getter
@Setter
@ScriptSyntax(name = "with statement", example = "with <variable> ... end")
public class ScriptWithStatement extends ScriptStatement {
    private ScriptToken withKeyword = ScriptToken.keyword("with");
    private ScriptExpression name;
    private ScriptBlockStatement body;

    @Override
    public <R> R accept(ScriptVisitor<R> visitor) {
        return visitor.visit(this);
    }
}
