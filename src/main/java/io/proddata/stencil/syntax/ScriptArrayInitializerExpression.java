package io.proddata.stencil.syntax;

import io.proddata.stencil.parsing.TokenType;
import lombok.Getter;
import lombok.Setter;

import java.util.ArrayList;
import java.util.List;

@Getter
@Setter
@ScriptSyntax(name = "array initializer", example = "[item1, item2,...]")
public class ScriptArrayInitializerExpression extends ScriptExpression {
    private ScriptToken openBracketToken = new ScriptToken(TokenType.OPEN_BRACKET);
    private final List<ScriptExpression> values = new ArrayList<>();
    private ScriptToken closeBracketToken = new ScriptToken(TokenType.CLOSE_BRACKET);

    @Override
    public <R> R accept(ScriptVisitor<R> visitor) {
        return visitor.visit(this);
    }
}
