package io.proddata.stencil.syntax;

import lombok.Getter;
import lombok.Setter;

@Getter
@Setter
@ScriptSyntax(name = "else statement", example = "else | else if <expression> ... end|else|else if")
public class ScriptElseStatement extends ScriptConditionStatement {
    private ScriptToken elseKeyword = ScriptToken.keyword("else");
    private ScriptBlockStatement body;

    @Override
    public <R> R accept(ScriptVisitor<R> visitor) {
        return visitor.visit(this);
    }
}
