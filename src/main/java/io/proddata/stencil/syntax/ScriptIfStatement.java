package io.proddata.stencil.syntax;

import lombok.Getter;
import lombok.Setter;

@Getter
@Setter
@ScriptSyntax(name = "if statement", example = "if <expression> ... end|else|else if")
public class ScriptIfStatement extends ScriptConditionStatement {
    /** Set for an {@code else if} (or liquid {@code elsif}). */
    private ScriptToken elseKeyword;
    private ScriptToken ifKeyword = ScriptToken.keyword("if");
    private ScriptExpression condition;
    /** A liquid {@code unless}: the body runs when the condition is false. */
    private boolean invert;
    private ScriptBlockStatement then;
    private ScriptConditionStatement elseStatement;

    public boolean isElseIf() {
        return elseKeyword != null;
    }

    @Override
    public <R> R accept(ScriptVisitor<R> visitor) {
        return visitor.visit(this);
    }
}
