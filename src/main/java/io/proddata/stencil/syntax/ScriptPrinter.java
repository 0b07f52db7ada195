package io.proddata.stencil.syntax;

import io.proddata.stencil.parsing.TokenType;

import java.math.BigDecimal;
import java.util.List;

/**
 * Writes a syntax tree back to template text.
 * <p>
 * A tree parsed with trivia kept prints back to its exact source. Without trivia, the printer inserts the
 * spaces and statement separators the grammar needs.
 */
public class ScriptPrinter implements ScriptVisitor<Void> {
    private final StringBuilder output = new StringBuilder();
    private final boolean scriptOnly;
    private final boolean preserveTrivia;
    private boolean inCode;
    private boolean expectSpace;
    private boolean expectEndOfStatement;
    private boolean previousHasSpace;
    private boolean hasEndOfStatement;
    private boolean hasComma;
    private boolean previousWasSeparator;

    /**
     * @param scriptOnly the tree was parsed without code delimiters, so none is written around it
     * @param preserveTrivia the tree carries its whitespace as trivia, so no separating space is added
     */
    public ScriptPrinter(boolean scriptOnly, boolean preserveTrivia) {
        this.scriptOnly = scriptOnly;
        this.preserveTrivia = preserveTrivia;
        this.inCode = scriptOnly;
        this.hasEndOfStatement = true;
    }

    /**
     * Prints a template page.
     */
    public static String print(ScriptPage page, boolean scriptOnly, boolean preserveTrivia) {
        return new ScriptPrinter(scriptOnly, preserveTrivia).write(page).toString();
    }

    /**
     * Prints a single node as code, used for diagnostics.
     */
    public static String print(ScriptNode node) {
        return new ScriptPrinter(true, false).write(node).toString();
    }

    public boolean isPreviousHasSpace() {
        return previousHasSpace;
    }

    public ScriptPrinter write(ScriptNode node) {
        if (node == null) {
            return this;
        }
        writeBegin(node);
        if (node instanceof ScriptTerminal) {
            hasComma = false;
        }
        node.accept(this);
        writeEnd(node);
        return this;
    }

    public ScriptPrinter write(String text) {
        if (text == null) {
            return this;
        }
        previousHasSpace = !text.isEmpty() && Character.isWhitespace(text.charAt(text.length() - 1));
        previousWasSeparator = false;
        output.append(text);
        return this;
    }

    public ScriptPrinter expectEos() {
        if (!hasEndOfStatement) {
            expectEndOfStatement = true;
        }
        return this;
    }

    public ScriptPrinter expectSpace() {
        expectSpace = true;
        return this;
    }

    public ScriptPrinter writeListWithCommas(List<? extends ScriptNode> list) {
        if (list == null) {
            return this;
        }
        for (int i = 0; i < list.size(); i++) {
            // a comma already printed as trivia is not written twice
            if (i > 0 && !hasComma) {
                write(",");
                hasComma = true;
            }
            write(list.get(i));
        }
        return this;
    }

    private void writeSeparated(ScriptToken token) {
        if (!preserveTrivia) {
            expectSpace();
        }
        write(token);
        if (!preserveTrivia) {
            expectSpace();
        }
    }

    private void writeEnterCode(String text) {
        write(text);
        expectEndOfStatement = false;
        expectSpace = false;
        hasEndOfStatement = true;
        inCode = true;
    }

    private void writeExitCode(String text) {
        write(text);
        expectEndOfStatement = false;
        expectSpace = false;
        hasEndOfStatement = false;
        inCode = false;
    }

    private void writeBegin(ScriptNode node) {
        writeTrivias(node, true);
        handleEos(node);

        if (hasEndOfStatement) {
            hasEndOfStatement = false;
            expectEndOfStatement = false;
        }

        if (node.canHaveLeadingTrivia()) {
            // `append:"x"` and `"a","b"` keep their source spacing
            if (expectSpace && !previousHasSpace && !(preserveTrivia && previousWasSeparator)) {
                write(" ");
            }
            expectSpace = false;
        }
    }

    private void writeEnd(ScriptNode node) {
        writeTrivias(node, false);

        if (node instanceof ScriptPage && inCode && !scriptOnly) {
            writeExitCode("}}");
        }
    }

    private static boolean isFrontMarker(ScriptNode node) {
        return node instanceof ScriptToken token && token.getTokenType() == TokenType.FRONT_MATTER_MARKER;
    }

    private void handleEos(ScriptNode node) {
        boolean frontMarker = isFrontMarker(node);
        boolean blockOrPage = node instanceof ScriptBlockStatement || node instanceof ScriptPage;
        if ((node instanceof ScriptStatement || frontMarker) && !blockOrPage && inCode && expectEndOfStatement) {
            if (!hasEndOfStatement && !(node instanceof ScriptEscapeStatement)) {
                write(frontMarker ? "\n" : "; ");
            }
            expectEndOfStatement = false;
            hasEndOfStatement = false;
            hasComma = false;
        }
    }

    private void writeTrivias(ScriptNode node, boolean before) {
        if (!(node instanceof ScriptTerminal terminal) || terminal.getTrivias() == null) {
            return;
        }
        ScriptTrivias trivias = terminal.getTrivias();
        for (ScriptTrivia trivia : before ? trivias.getBefore() : trivias.getAfter()) {
            write(trivia.toString());
            if (trivia.type().isEndOfStatement()) {
                hasEndOfStatement = true;
                if (trivia.type() == ScriptTriviaType.SEMI_COLON) {
                    hasComma = false;
                }
                // a newline or a semicolon already separates
                expectSpace = false;
            }
            if (trivia.type() == ScriptTriviaType.COMMA) {
                hasComma = true;
            }
            if (trivia.type() == ScriptTriviaType.COMMA || trivia.type() == ScriptTriviaType.PUNCTUATION) {
                previousWasSeparator = true;
            }
        }
    }

    @Override
    public String toString() {
        return output.toString();
    }

    @Override
    public Void visit(ScriptPage node) {
        if (node.getFrontMatter() != null) {
            write(node.getFrontMatter());
            inCode = scriptOnly;
            hasEndOfStatement = true;
            expectEndOfStatement = false;
        }
        write(node.getBody());
        return null;
    }

    @Override
    public Void visit(ScriptFrontMatter node) {
        inCode = true;
        expectEos();
        write(node.getStartMarker());
        hasEndOfStatement = true;
        write(node.getStatements());
        expectEos();
        write(node.getEndMarker());
        hasEndOfStatement = true;
        return null;
    }

    @Override
    public Void visit(ScriptBlockStatement node) {
        for (ScriptStatement statement : node.getStatements()) {
            write(statement);
        }
        return null;
    }

    @Override
    public Void visit(ScriptRawStatement node) {
        if (node.getText() != null && !node.getText().isEmpty()) {
            write(node.getText());
        }
        return null;
    }

    @Override
    public Void visit(ScriptEscapeStatement node) {
        String text = node.getTokenText();
        if (text == null) {
            String escape = "%".repeat(node.getEscapeCount());
            String marker = node.getWhitespaceMode().marker();
            String brace = node.isLiquidTag() ? "%" : "{";
            text = node.isEntering()
                ? "{" + escape + brace + marker
                : marker + (node.isLiquidTag() ? "%" : "}") + escape + "}";
        }
        if (node.isEntering()) {
            writeEnterCode(text);
        } else {
            writeExitCode(text);
        }
        return null;
    }

    @Override
    public Void visit(ScriptExpressionStatement node) {
        ScriptToken tagKeyword = node.getTagKeyword();
        if (tagKeyword != null) {
            write(tagKeyword).expectSpace();
            // increment and decrement name their variable only
            if (!tagKeyword.isKeyword("assign") && node.getExpression() instanceof ScriptBinaryExpression binary) {
                write(binary.getLeft()).expectEos();
                return null;
            }
        }
        write(node.getExpression()).expectEos();
        return null;
    }

    @Override
    public Void visit(ScriptIfStatement node) {
        ScriptToken ifKeyword = node.getIfKeyword();
        if (node.isElseIf() && !ifKeyword.isKeyword("elsif")) {
            write(node.getElseKeyword()).expectSpace();
        }
        write(ifKeyword).expectSpace();
        // ifchanged has an implicit condition
        if (!ifKeyword.isKeyword("ifchanged")) {
            write(node.getCondition());
        }
        expectEos();
        write(node.getThen());
        write(node.getElseStatement());
        return null;
    }

    @Override
    public Void visit(ScriptElseStatement node) {
        write(node.getElseKeyword()).expectEos();
        write(node.getBody()).expectEos();
        return null;
    }

    @Override
    public Void visit(ScriptForStatement node) {
        write(node.getForOrTableRowKeyword()).expectSpace();
        write(node.getVariable()).expectSpace();
        if (!previousHasSpace) {
            write(" ");
        }
        write(node.getInKeyword()).expectSpace();
        write(node.getIterator());
        for (ScriptNamedArgument argument : node.getNamedArguments()) {
            expectSpace();
            write(argument);
        }
        expectEos();
        write(node.getBody()).expectEos();
        write(node.getElseStatement());
        return null;
    }

    @Override
    public Void visit(ScriptTableRowStatement node) {
        return visit((ScriptForStatement) node);
    }

    @Override
    public Void visit(ScriptWhileStatement node) {
        write(node.getWhileKeyword()).expectSpace();
        write(node.getCondition());
        expectEos();
        write(node.getBody()).expectEos();
        return null;
    }

    @Override
    public Void visit(ScriptCaseStatement node) {
        write(node.getCaseKeyword()).expectSpace();
        write(node.getValue()).expectEos();
        write(node.getBody()).expectEos();
        return null;
    }

    @Override
    public Void visit(ScriptWhenStatement node) {
        write(node.getWhenKeyword()).expectSpace();
        List<ScriptExpression> values = node.getValues();
        List<ScriptToken> separators = node.getSeparators();
        for (int i = 0; i < values.size(); i++) {
            if (i > 0) {
                ScriptToken separator = i - 1 < separators.size() ? separators.get(i - 1) : null;
                if (separator != null) {
                    expectSpace();
                    write(separator);
                    expectSpace();
                } else if (!hasComma) {
                    write(",");
                    hasComma = true;
                }
            }
            write(values.get(i));
        }
        expectEos();
        write(node.getBody()).expectEos();
        write(node.getNext());
        return null;
    }

    @Override
    public Void visit(ScriptCaptureStatement node) {
        write(node.getCaptureKeyword()).expectSpace();
        write(node.getTarget()).expectEos();
        write(node.getBody()).expectEos();
        return null;
    }

    @Override
    public Void visit(ScriptWithStatement node) {
        write(node.getWithKeyword()).expectSpace();
        write(node.getName());
        expectEos();
        write(node.getBody()).expectEos();
        return null;
    }

    @Override
    public Void visit(ScriptWrapStatement node) {
        write(node.getWrapKeyword()).expectSpace();
        write(node.getTarget());
        expectEos();
        write(node.getBody()).expectEos();
        return null;
    }

    @Override
    public Void visit(ScriptImportStatement node) {
        write(node.getImportKeyword()).expectSpace();
        write(node.getExpression());
        expectEos();
        return null;
    }

    @Override
    public Void visit(ScriptReadOnlyStatement node) {
        write(node.getReadOnlyKeyword()).expectSpace();
        write(node.getVariable());
        expectEos();
        return null;
    }

    @Override
    public Void visit(ScriptFunction node) {
        boolean blockBody = node.getBody() instanceof ScriptBlockStatement;
        if (!node.isAnonymous() && blockBody) {
            write(node.getFuncToken()).expectSpace();
        }
        write(node.getNameOrDoToken());

        write(node.getOpenParen());
        if (node.hasParameters()) {
            if (node.getOpenParen() != null) {
                writeListWithCommas(node.getParameters());
            } else {
                for (int i = 0; i < node.getParameters().size(); i++) {
                    if (i > 0) {
                        expectSpace();
                    }
                    write(node.getParameters().get(i));
                }
            }
        }
        write(node.getCloseParen());

        if (blockBody) {
            expectEos();
            write(node.getBody());
        } else {
            write(node.getEqualToken());
            write(node.getBody());
        }

        if (!node.isAnonymous()) {
            expectEos();
        }
        return null;
    }

    @Override
    public Void visit(ScriptParameter node) {
        write(node.getName());
        ScriptToken token = node.getEqualOrTripleDotToken();
        if (token != null) {
            write(token);
            if (token.getTokenType() == TokenType.EQUAL) {
                write(node.getDefaultValue());
            }
        }
        return null;
    }

    @Override
    public Void visit(ScriptReturnStatement node) {
        write(node.getRetKeyword()).expectSpace();
        write(node.getExpression()).expectEos();
        return null;
    }

    @Override
    public Void visit(ScriptBreakStatement node) {
        write(node.getBreakKeyword()).expectEos();
        return null;
    }

    @Override
    public Void visit(ScriptContinueStatement node) {
        write(node.getContinueKeyword()).expectEos();
        return null;
    }

    @Override
    public Void visit(ScriptEndStatement node) {
        write(node.getEndKeyword());
        if (node.isExpectEos()) {
            expectEos();
        }
        return null;
    }

    @Override
    public Void visit(ScriptLiteral node) {
        write(node.getSourceText() != null ? node.getSourceText() : toLiteral(node));
        return null;
    }

    @Override
    public Void visit(ScriptVariable node) {
        write(node.toSourceName());
        return null;
    }

    @Override
    public Void visit(ScriptThisExpression node) {
        write(node.getThisKeyword());
        return null;
    }

    @Override
    public Void visit(ScriptMemberExpression node) {
        write(node.getTarget());
        write(node.getDotToken());
        write(node.getMember());
        return null;
    }

    @Override
    public Void visit(ScriptIsEmptyExpression node) {
        write(node.getTarget());
        write(node.getDotToken());
        write(node.getMember());
        write(node.getQuestionToken());
        return null;
    }

    @Override
    public Void visit(ScriptIndexerExpression node) {
        if (node.isShorthand()) {
            write(node.getIndex());
            return null;
        }
        write(node.getTarget());
        write(node.getOpenBracket());
        write(node.getIndex());
        write(node.getCloseBracket());
        return null;
    }

    @Override
    public Void visit(ScriptFunctionCall node) {
        write(node.getTarget());
        if (node.getOpenParen() != null) {
            write(node.getOpenParen());
            writeListWithCommas(node.getArguments());
        } else {
            for (ScriptExpression argument : node.getArguments()) {
                expectSpace();
                write(argument);
            }
        }
        write(node.getCloseParen());
        return null;
    }

    @Override
    public Void visit(ScriptNamedArgument node) {
        if (node.getName() == null) {
            return null;
        }
        write(node.getName());
        if (node.getValue() != null) {
            write(node.getColonToken() != null ? node.getColonToken() : new ScriptToken(TokenType.COLON));
            write(node.getValue());
        }
        return null;
    }

    @Override
    public Void visit(ScriptUnaryExpression node) {
        if (node.getOperatorToken() != null) {
            write(node.getOperatorToken());
        } else {
            write(node.getOperator().toText());
        }
        write(node.getRight());
        return null;
    }

    @Override
    public Void visit(ScriptIncrementDecrementExpression node) {
        if (node.isPost()) {
            write(node.getRight());
        }
        if (node.getOperatorToken() != null) {
            write(node.getOperatorToken());
        } else {
            write(node.getOperator().toText());
        }
        if (!node.isPost()) {
            write(node.getRight());
        }
        return null;
    }

    @Override
    public Void visit(ScriptBinaryExpression node) {
        write(node.getLeft());
        boolean subtract = node.getOperator() == ScriptBinaryOperator.SUBTRACT;
        // a-b is an identifier in liquid, keep the operator apart from its operands
        if (subtract && !previousHasSpace) {
            expectSpace();
        }
        ScriptToken operatorToken = node.getOperatorToken();
        if (operatorToken == null) {
            // implicit multiplication
            expectSpace();
        } else if (operatorToken.getTokenType() == TokenType.IDENTIFIER) {
            expectSpace();
            write(operatorToken);
            expectSpace();
        } else {
            writeSeparated(operatorToken);
        }
        if (subtract) {
            expectSpace();
        }
        write(node.getRight());
        return null;
    }

    @Override
    public Void visit(ScriptConditionalExpression node) {
        write(node.getCondition());
        writeSeparated(node.getQuestionToken());
        write(node.getThenValue());
        writeSeparated(node.getColonToken());
        write(node.getElseValue());
        return null;
    }

    @Override
    public Void visit(ScriptPipeCall node) {
        write(node.getFrom());
        writeSeparated(node.getPipeToken());
        write(node.getTo());
        return null;
    }

    @Override
    public Void visit(ScriptArrayInitializerExpression node) {
        write(node.getOpenBracketToken());
        writeListWithCommas(node.getValues());
        write(node.getCloseBracketToken());
        return null;
    }

    @Override
    public Void visit(ScriptObjectInitializerExpression node) {
        write(node.getOpenBrace());
        writeListWithCommas(node.getMembers());
        write(node.getCloseBrace());
        return null;
    }

    @Override
    public Void visit(ScriptObjectMember node) {
        write(node.getName());
        write(node.getColonToken());
        write(node.getValue());
        return null;
    }

    @Override
    public Void visit(ScriptNestedExpression node) {
        write(node.getOpenParen());
        write(node.getExpression());
        write(node.getCloseParen());
        return null;
    }

    @Override
    public Void visit(ScriptInterpolatedStringExpression node) {
        char quote = node.getQuoteType() == ScriptStringQuoteType.SIMPLE_QUOTE ? '\'' : '"';
        List<ScriptExpression> parts = node.getParts();
        if (parts.isEmpty() || !isSourceFragment(parts.get(0))) {
            write("$" + quote);
        }
        for (ScriptExpression part : parts) {
            if (part instanceof ScriptLiteral fragment && fragment.getSourceText() == null) {
                StringBuilder text = new StringBuilder();
                escape(text, fragment.getValue() == null ? "" : fragment.getValue().toString(), quote, true);
                write(text.toString());
            } else {
                write(part);
            }
        }
        if (parts.isEmpty() || !isSourceFragment(parts.get(parts.size() - 1))) {
            write(String.valueOf(quote));
        }
        return null;
    }

    private static boolean isSourceFragment(ScriptExpression part) {
        return part instanceof ScriptLiteral fragment && fragment.getSourceText() != null;
    }

    @Override
    public Void visit(ScriptInterpolatedExpression node) {
        write(node.getOpenBrace());
        write(node.getExpression());
        write(node.getCloseBrace());
        return null;
    }

    @Override
    public Void visit(ScriptAssignExpression node) {
        write(node.getTarget());
        writeSeparated(node.getEqualToken());
        write(node.getValue());
        return null;
    }

    @Override
    public Void visit(ScriptAnonymousFunction node) {
        write(node.getFunction());
        return null;
    }

    @Override
    public Void visit(ScriptToken node) {
        String text = node.getText();
        if (text == null && node.getTokenType() == TokenType.FRONT_MATTER_MARKER) {
            text = "+++\n";
        }
        write(text);
        return null;
    }

    static String toLiteral(ScriptLiteral literal) {
        Object value = literal.getValue();
        if (value == null) {
            return "null";
        }
        if (value instanceof String text) {
            return quote(literal.getStringQuoteType(), text);
        }
        if (value instanceof Character c) {
            return quote(ScriptStringQuoteType.SIMPLE_QUOTE, c.toString());
        }
        if (value instanceof Double d) {
            return appendDecimalPoint(Double.toString(d));
        }
        if (value instanceof Float f) {
            return appendDecimalPoint(Float.toString(f)) + "f";
        }
        if (value instanceof BigDecimal decimal) {
            return appendDecimalPoint(decimal.toPlainString()) + "m";
        }
        return value.toString();
    }

    private static String appendDecimalPoint(String text) {
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == 'e' || c == 'E' || c == '.') {
                return text;
            }
        }
        if (text.equals("NaN") || text.contains("Infinity")) {
            return text;
        }
        return text + ".0";
    }

    private static String quote(ScriptStringQuoteType quoteType, String input) {
        char quote = switch (quoteType) {
            case DOUBLE_QUOTE -> '"';
            case SIMPLE_QUOTE -> '\'';
            case VERBATIM -> '`';
        };

        StringBuilder literal = new StringBuilder(input.length() + 2);
        literal.append(quote);
        if (quoteType == ScriptStringQuoteType.VERBATIM) {
            literal.append(input.replace("`", "``"));
        } else {
            escape(literal, input, quote, false);
        }
        literal.append(quote);
        return literal.toString();
    }

    private static void escape(StringBuilder literal, String input, char quote, boolean interpolated) {
        for (int i = 0; i < input.length(); i++) {
            char c = input.charAt(i);
            switch (c) {
                case '\\' -> literal.append("\\\\");
                case '\0' -> literal.append("\\0");
                case '\b' -> literal.append("\\b");
                case '\f' -> literal.append("\\f");
                case '\n' -> literal.append("\\n");
                case '\r' -> literal.append("\\r");
                case '\t' -> literal.append("\\t");
                case '\u000b' -> literal.append("\\v");
                default -> {
                    if (c == quote || (interpolated && (c == '{' || c == '}'))) {
                        literal.append('\\').append(c);
                    } else if (Character.isISOControl(c)) {
                        literal.append(String.format("\\u%04x", (int) c));
                    } else {
                        literal.append(c);
                    }
                }
            }
        }
    }
}
