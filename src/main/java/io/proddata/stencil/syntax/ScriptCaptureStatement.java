package io.proddata.stencil.syntax;

import lombok.Getter;
import lombok.Setter;

@Getter
@Setter
@ScriptSyntax(name = "capture statement", example = "capture <variable> ... end")
public class ScriptCaptureStatement extends ScriptStatement {
    private ScriptToken captureKeyword = ScriptToken.keyword("capture");
    private ScriptExpression target;
    private ScriptBlockStatement body;

    @Override
    public <R> R accept(ScriptVisitor<R> visitor) {
        return visitor.visit(this);
    }
}
