package io.proddata.stencil.syntax;

import lombok.Getter;
import lombok.Setter;

import java.util.ArrayList;
import java.util.List;

@Getter
@Setter
@ScriptSyntax(name = "block statement", example = "<statement>...end")
public class ScriptBlockStatement extends ScriptStatement {
    private final List<ScriptStatement> statements = new ArrayList<>();

    @Override
    public boolean canHaveLeadingTrivia() {
        return false;
    }

    @Override
    public <R> R accept(ScriptVisitor<R> visitor) {
        return visitor.visit(this);
    }
}
