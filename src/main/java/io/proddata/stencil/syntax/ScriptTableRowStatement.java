package io.proddata.stencil.syntax;

@ScriptSyntax(name = "tablerow statement", example = "tablerow <variable> in <expression> ... end")
public class ScriptTableRowStatement extends ScriptForStatement {

    public ScriptTableRowStatement() {
        setForOrTableRowKeyword(ScriptToken.keyword("tablerow"));
    }

    @Override
    public <R> R accept(ScriptVisitor<R> visitor) {
        return visitor.visit(this);
    }
}
