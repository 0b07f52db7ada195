package io.proddata.stencil.parsing;

public enum ParserMessageType {
    ERROR,
    WARNING;

    public String label() {
        return this == ERROR ? "error" : "warning";
    }
}
