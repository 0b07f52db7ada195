package io.proddata.stencil.syntax;

import lombok.Getter;
import lombok.Setter;

@Getter
@Setter
@ScriptSyntax(name = "anonymous function", example = "do <parameters>? ... end")
public class ScriptAnonymousFunction extends ScriptExpression {
    private ScriptFunction function;

    @Override
    public <R> R accept(ScriptVisitor<R> visitor) {
        return visitor.visit(this);
    }
}
