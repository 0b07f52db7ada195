package io.proddata.stencil.syntax;

import lombok.Getter;
import lombok.Setter;

@Getter
@Setter
@ScriptSyntax(name = "return statement", example = "return <expression>?")
public class ScriptReturnStatement extends ScriptStatement {
    private ScriptToken retKeyword = ScriptToken.keyword("ret");
    private ScriptExpression expression;

    @Override
    public <R> R accept(ScriptVisitor<R> visitor) {
        return visitor.visit(this);
    }
}
