package io.proddata.stencil.syntax;

import lombok.Getter;
import lombok.Setter;

@Getter
@Setter
@ScriptSyntax(name = "readonly statement", example = "readonly <variable>")
public class ScriptReadOnlyStatement extends ScriptStatement {
    private ScriptToken readOnlyKeyword = ScriptToken.keyword("readonly");
    private ScriptVariable variable;

    @Override
    public <R> R accept(ScriptVisitor<R> visitor) {
        return visitor.visit(this);
    }
}
