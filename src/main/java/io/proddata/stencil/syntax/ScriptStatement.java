package io.proddata.stencil.syntax;

public abstract class ScriptStatement extends ScriptNode {
}
