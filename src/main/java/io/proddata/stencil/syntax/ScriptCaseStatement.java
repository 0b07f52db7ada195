package io.proddata.stencil.syntax;

import lombok.Getter;
import lombok.Setter;

@Getter
@Setter
@ScriptSyntax(name = "case statement", example = "case <expression> ... end|when|else")
public class ScriptCaseStatement extends ScriptStatement {
    private ScriptToken caseKeyword = ScriptToken.keyword("case");
    private ScriptExpression value;
    private ScriptBlockStatement body;

    @Override
    public <R> R accept(ScriptVisitor<R> visitor) {
        return visitor.visit(this);
    }
}
