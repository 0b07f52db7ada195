package io.proddata.stencil.syntax;

import io.proddata.stencil.parsing.TokenType;
import lombok.Getter;
import lombok.Setter;

import java.util.ArrayList;
import java.util.List;

@Getter
@Setter
@ScriptSyntax(name = "object initializer expression", example = "{ member1: <expression>, member2: ... }")
public class ScriptObjectInitializerExpression extends ScriptExpression {
    private ScriptToken openBrace = new ScriptToken(TokenType.OPEN_BRACE);
    private final List<ScriptObjectMember> members = new ArrayList<>();
    private ScriptToken closeBrace = new ScriptToken(TokenType.CLOSE_BRACE);

    @Override
    public <R> R accept(ScriptVisitor<R> visitor) {
        return visitor.visit(this);
    }
}
