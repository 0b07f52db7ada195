package io.proddata.stencil.syntax;

/**
 * A statement that can be chained after an {@code if} or a {@code when}.
 */
public abstract class ScriptConditionStatement extends ScriptStatement {
}
