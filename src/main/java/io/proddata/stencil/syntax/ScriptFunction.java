package io.proddata.stencil.syntax;

import lombok.Getter;
import lombok.Setter;

import java.util.List;

@Getter
@Setter
@ScriptSyntax(name = "function statement", example = "func <variable> ... end")
public class ScriptFunction extends ScriptStatement {
    private ScriptToken funcToken;
    /** The function name, or the {@code do} keyword of an anonymous function. */
    private ScriptNode nameOrDoToken;
    private ScriptToken openParen;
    private List<ScriptParameter> parameters;
    private ScriptToken closeParen;
    /** Set for the short form {@code name(a, b) = <expression>}. */
    private ScriptToken equalToken;
    private ScriptStatement body;
    private boolean anonymous;

    public boolean hasParameters() {
        return parameters != null && !parameters.isEmpty();
    }

    @Override
    public boolean canHaveLeadingTrivia() {
        return false;
    }

    @Override
    public <R> R accept(ScriptVisitor<R> visitor) {
        return visitor.visit(this);
    }
}
