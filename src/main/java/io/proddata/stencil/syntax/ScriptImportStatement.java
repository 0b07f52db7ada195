package io.proddata.stencil.syntax;

import lombok.Getter;
import lombok.Setter;

@Getter
@Setter
@ScriptSyntax(name = "import statement", example = "import <expression>")
public class ScriptImportStatement extends ScriptStatement {
    private ScriptToken importKeyword = ScriptToken.keyword("import");
    private ScriptExpression expression;

    @Override
    public <R> R accept(ScriptVisitor<R> visitor) {
        return visitor.visit(this);
    }
}
