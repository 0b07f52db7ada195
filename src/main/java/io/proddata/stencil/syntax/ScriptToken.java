package io.proddata.stencil.syntax;

import io.proddata.stencil.parsing.TokenType;
import lombok.Getter;
import lombok.Setter;

/**
 * A keyword, an operator or a punctuation of the source.
 */
@Getter
@Setter
@ScriptSyntax(name = "token", example = "<token>")
public class ScriptToken extends ScriptNode implements ScriptTerminal {
    private TokenType tokenType;
    private String text;
    private ScriptTrivias trivias;

    public ScriptToken(TokenType tokenType, String text) {
        this.tokenType = tokenType;
        this.text = text;
    }

    public ScriptToken(TokenType tokenType) {
        this(tokenType, tokenType.toText());
    }

    public static ScriptToken keyword(String keyword) {
        return new ScriptToken(TokenType.IDENTIFIER, keyword);
    }

    public boolean isKeyword(String keyword) {
        return tokenType == TokenType.IDENTIFIER && keyword.equals(text);
    }

    @Override
    public <R> R accept(ScriptVisitor<R> visitor) {
        return visitor.visit(this);
    }
}
