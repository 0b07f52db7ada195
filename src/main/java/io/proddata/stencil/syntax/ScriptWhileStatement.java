package io.proddata.stencil.syntax;

import lombok.Getter;
import lombok.Setter;

@Getter
@Setter
@ScriptSyntax(name = "while statement", example = "while <expression> ... end")
public class ScriptWhileStatement extends ScriptStatement {
    private ScriptToken whileKeyword = ScriptToken.keyword("while");
    private ScriptExpression condition;
    private ScriptBlockStatement body;

    @Override
    public <R> R accept(ScriptVisitor<R> visitor) {
        return visitor.visit(this);
    }
}
