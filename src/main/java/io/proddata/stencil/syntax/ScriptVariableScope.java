package io.proddata.stencil.syntax;

public enum ScriptVariableScope {
    GLOBAL,
    /** Prefixed by {@code $} in the source. */
    LOCAL,
    LOOP
}
