package io.proddata.stencil.syntax;

import io.proddata.stencil.parsing.TextPosition;
import io.proddata.stencil.parsing.TokenType;
import lombok.Getter;
import lombok.Setter;

@Getter
@Setter
@ScriptSyntax(name = "front matter", example = "+++ <statement>... +++")
public class ScriptFrontMatter extends ScriptNode {
    private ScriptToken startMarker = new ScriptToken(TokenType.FRONT_MATTER_MARKER, null);
    private ScriptBlockStatement statements;
    private ScriptToken endMarker = new ScriptToken(TokenType.FRONT_MATTER_MARKER, null);
    /** Where the content starts, right after the closing marker. */
    private TextPosition textPositionAfterEndMarker;

    @Override
    public <R> R accept(ScriptVisitor<R> visitor) {
        return visitor.visit(this);
    }
}
