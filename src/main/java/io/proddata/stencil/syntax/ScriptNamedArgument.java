package io.proddata.stencil.syntax;

import lombok.Getter;
import lombok.Setter;

@Getter
@Setter
@ScriptSyntax(name = "named argument", example = "<name>: <expression>")
public class ScriptNamedArgument extends ScriptExpression {
    private ScriptVariable name;
    private ScriptToken colonToken;
    private ScriptExpression value;

    @Override
    public <R> R accept(ScriptVisitor<R> visitor) {
        return visitor.visit(this);
    }
}
