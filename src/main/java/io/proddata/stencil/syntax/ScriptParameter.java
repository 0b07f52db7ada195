package io.proddata.stencil.syntax;

import lombok.Getter;
import lombok.Setter;

@Getter
@Setter
@ScriptSyntax(name = "parameter", example = "<name> | <name> = <literal> | <name>...")
public class ScriptParameter extends ScriptNode {
    private ScriptVariable name;
    /** {@code =} for an optional parameter, {@code ...} for a variadic one. */
    private ScriptToken equalOrTripleDotToken;
    private ScriptLiteral defaultValue;

    @Override
    public <R> R accept(ScriptVisitor<R> visitor) {
        return visitor.visit(this);
    }
}
