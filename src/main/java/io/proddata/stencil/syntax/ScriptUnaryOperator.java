package io.proddata.stencil.syntax;

public enum ScriptUnaryOperator {
    NOT("!", 200),
    NEGATE("-", 200),
    PLUS("+", 200),
    FUNCTION_ALIAS("@", 200),
    FUNCTION_PARAMETERS_EXPAND("^", 200),
    INCREMENT("++", 210),
    DECREMENT("--", 210);

    private final String text;
    private final int precedence;

    ScriptUnaryOperator(String text, int precedence) {
        this.text = text;
        this.precedence = precedence;
    }

    public String toText() {
        return text;
    }

    public int precedence() {
        return precedence;
    }
}
