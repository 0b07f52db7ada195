package io.proddata.stencil.syntax;

import lombok.Getter;
import lombok.Setter;

@Getter
@Setter
@ScriptSyntax(name = "this expression", example = "this")
public class ScriptThisExpression extends ScriptExpression implements ScriptVariablePath {
    private ScriptToken thisKeyword = ScriptToken.keyword("this");

    @Override
    public String getFirstPath() {
        return "this";
    }

    @Override
    public <R> R accept(ScriptVisitor<R> visitor) {
        return visitor.visit(this);
    }
}
