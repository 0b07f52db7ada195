package io.proddata.stencil.syntax;

public abstract class ScriptExpression extends ScriptNode {
}
