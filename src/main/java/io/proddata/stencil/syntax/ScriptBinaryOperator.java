package io.proddata.stencil.syntax;

import io.proddata.stencil.parsing.TokenType;

public enum ScriptBinaryOperator {
    EMPTY_COALESCING("??", TokenType.DOUBLE_QUESTION, 20),
    NOT_EMPTY_COALESCING("?!", TokenType.QUESTION_EXCLAMATION, 20),
    OR("||", TokenType.DOUBLE_VERTICAL_BAR, 30),
    AND("&&", TokenType.DOUBLE_AMP, 40),
    BINARY_OR("|", TokenType.VERTICAL_BAR, 50),
    BINARY_AND("&", TokenType.AMP, 60),
    COMPARE_EQUAL("==", TokenType.DOUBLE_EQUAL, 70),
    COMPARE_NOT_EQUAL("!=", TokenType.EXCLAMATION_EQUAL, 70),
    COMPARE_LESS_OR_EQUAL("<=", TokenType.LESS_EQUAL, 80),
    COMPARE_GREATER_OR_EQUAL(">=", TokenType.GREATER_EQUAL, 80),
    COMPARE_LESS("<", TokenType.LESS, 80),
    COMPARE_GREATER(">", TokenType.GREATER, 80),
    LIQUID_CONTAINS("contains", null, 90),
    LIQUID_STARTS_WITH("startsWith", null, 90),
    LIQUID_ENDS_WITH("endsWith", null, 90),
    LIQUID_HAS_KEY("hasKey", null, 90),
    LIQUID_HAS_VALUE("hasValue", null, 90),
    ADD("+", TokenType.PLUS, 100),
    SUBTRACT("-", TokenType.MINUS, 100),
    MULTIPLY("*", TokenType.ASTERISK, 110),
    DIVIDE("/", TokenType.DIVIDE, 110),
    DIVIDE_ROUND("//", TokenType.DOUBLE_DIVIDE, 110),
    MODULUS("%", TokenType.PERCENT, 110),
    SHIFT_LEFT("<<", TokenType.DOUBLE_LESS_THAN, 110),
    SHIFT_RIGHT(">>", TokenType.DOUBLE_GREATER_THAN, 110),
    POWER("^", TokenType.CARET, 120),
    RANGE_INCLUDE("..", TokenType.DOUBLE_DOT, 130),
    RANGE_EXCLUDE("..<", TokenType.DOUBLE_DOT_LESS, 130);

    public static final int PRECEDENCE_OF_ADD = 100;
    public static final int PRECEDENCE_OF_MULTIPLY = 110;

    private final String text;
    private final TokenType tokenType;
    private final int precedence;

    ScriptBinaryOperator(String text, TokenType tokenType, int precedence) {
        this.text = text;
        this.tokenType = tokenType;
        this.precedence = precedence;
    }

    public String toText() {
        return text;
    }

    /**
     * The token of the operator, {@code null} for the liquid word operators.
     */
    public TokenType toTokenType() {
        return tokenType;
    }

    public int precedence() {
        return precedence;
    }

    public boolean isLiquid() {
        return tokenType == null;
    }

    public static ScriptBinaryOperator fromToken(TokenType type, boolean scientific) {
        return switch (type) {
            case ASTERISK -> MULTIPLY;
            case DIVIDE -> DIVIDE;
            case DOUBLE_DIVIDE -> DIVIDE_ROUND;
            case PLUS -> ADD;
            case MINUS -> SUBTRACT;
            case PERCENT -> MODULUS;
            case DOUBLE_LESS_THAN -> SHIFT_LEFT;
            case DOUBLE_GREATER_THAN -> SHIFT_RIGHT;
            case DOUBLE_QUESTION -> EMPTY_COALESCING;
            case QUESTION_EXCLAMATION -> NOT_EMPTY_COALESCING;
            case DOUBLE_AMP -> AND;
            case DOUBLE_VERTICAL_BAR -> OR;
            case DOUBLE_EQUAL -> COMPARE_EQUAL;
            case EXCLAMATION_EQUAL -> COMPARE_NOT_EQUAL;
            case GREATER -> COMPARE_GREATER;
            case GREATER_EQUAL -> COMPARE_GREATER_OR_EQUAL;
            case LESS -> COMPARE_LESS;
            case LESS_EQUAL -> COMPARE_LESS_OR_EQUAL;
            case DOUBLE_DOT -> RANGE_INCLUDE;
            case DOUBLE_DOT_LESS -> RANGE_EXCLUDE;
            case CARET -> scientific ? POWER : null;
            case AMP -> scientific ? BINARY_AND : null;
            case VERTICAL_BAR -> scientific ? BINARY_OR : null;
            default -> null;
        };
    }

    /**
     * Liquid spells {@code or} and {@code and} as words, plus a few string and object tests.
     */
    public static ScriptBinaryOperator fromLiquidWord(String word) {
        return switch (word) {
            case "or" -> OR;
            case "and" -> AND;
            case "contains" -> LIQUID_CONTAINS;
            case "startsWith" -> LIQUID_STARTS_WITH;
            case "endsWith" -> LIQUID_ENDS_WITH;
            case "hasKey" -> LIQUID_HAS_KEY;
            case "hasValue" -> LIQUID_HAS_VALUE;
            default -> null;
        };
    }
}
