package io.proddata.stencil.syntax;

public enum ScriptStringQuoteType {
    DOUBLE_QUOTE,
    SIMPLE_QUOTE,
    VERBATIM
}
