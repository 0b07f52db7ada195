package io.proddata.stencil.syntax;

import lombok.Getter;
import lombok.Setter;

@Getter
@Setter
@ScriptSyntax(name = "page", example = "<statement>...")
public class ScriptPage extends ScriptNode {
    private ScriptFrontMatter frontMatter;
    private ScriptBlockStatement body;

    @Override
    public <R> R accept(ScriptVisitor<R> visitor) {
        return visitor.visit(this);
    }
}
