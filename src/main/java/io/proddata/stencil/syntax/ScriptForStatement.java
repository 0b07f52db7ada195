package io.proddata.stencil.syntax;

import lombok.Getter;
import lombok.Setter;

import java.util.ArrayList;
import java.util.List;

@Getter
@Setter
@ScriptSyntax(name = "for statement", example = "for <variable> in <expression> ... end")
public class ScriptForStatement extends ScriptStatement {
    private ScriptToken forOrTableRowKeyword = ScriptToken.keyword("for");
    private ScriptExpression variable;
    private ScriptToken inKeyword = ScriptToken.keyword("in");
    private ScriptExpression iterator;
    /** Loop options written after the iterator, such as {@code limit:2} or {@code reversed}. */
    private final List<ScriptNamedArgument> namedArguments = new ArrayList<>();
    private ScriptBlockStatement body;
    private ScriptElseStatement elseStatement;
    /** Liquid loops make {@code continue} a loop-local variable. */
    private boolean setContinue;

    @Override
    public <R> R accept(ScriptVisitor<R> visitor) {
        return visitor.visit(this);
    }
}
