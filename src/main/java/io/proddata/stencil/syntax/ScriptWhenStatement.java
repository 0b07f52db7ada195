package io.proddata.stencil.syntax;

import lombok.Getter;
import lombok.Setter;

import java.util.ArrayList;
import java.util.List;

@Getter
@Setter
@ScriptSyntax(name = "when statement", example = "when <expression> ... end|when|else")
public class ScriptWhenStatement extends ScriptConditionStatement {
    private ScriptToken whenKeyword = ScriptToken.keyword("when");
    private final List<ScriptExpression> values = new ArrayList<>();
    /** The {@code ||} or liquid {@code or} tokens between values, commas are kept as trivia. */
    private final List<ScriptToken> separators = new ArrayList<>();
    private ScriptBlockStatement body;
    private ScriptConditionStatement next;

    @Override
    public <R> R accept(ScriptVisitor<R> visitor) {
        return visitor.visit(this);
    }
}
