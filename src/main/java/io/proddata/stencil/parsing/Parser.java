package io.proddata.stencil.parsing;

import io.proddata.stencil.syntax.ScriptAnonymousFunction;
import io.proddata.stencil.syntax.ScriptArrayInitializerExpression;
import io.proddata.stencil.syntax.ScriptAssignExpression;
import io.proddata.stencil.syntax.ScriptBinaryExpression;
import io.proddata.stencil.syntax.ScriptBinaryOperator;
import io.proddata.stencil.syntax.ScriptBlockStatement;
import io.proddata.stencil.syntax.ScriptBreakStatement;
import io.proddata.stencil.syntax.ScriptCaptureStatement;
import io.proddata.stencil.syntax.ScriptCaseStatement;
import io.proddata.stencil.syntax.ScriptConditionStatement;
import io.proddata.stencil.syntax.ScriptConditionalExpression;
import io.proddata.stencil.syntax.ScriptContinueStatement;
import io.proddata.stencil.syntax.ScriptElseStatement;
import io.proddata.stencil.syntax.ScriptEndStatement;
import io.proddata.stencil.syntax.ScriptEscapeStatement;
import io.proddata.stencil.syntax.ScriptExpression;
import io.proddata.stencil.syntax.ScriptExpressionStatement;
import io.proddata.stencil.syntax.ScriptForStatement;
import io.proddata.stencil.syntax.ScriptFrontMatter;
import io.proddata.stencil.syntax.ScriptFunction;
import io.proddata.stencil.syntax.ScriptFunctionCall;
import io.proddata.stencil.syntax.ScriptIfStatement;
import io.proddata.stencil.syntax.ScriptImportStatement;
import io.proddata.stencil.syntax.ScriptIncrementDecrementExpression;
import io.proddata.stencil.syntax.ScriptIndexerExpression;
import io.proddata.stencil.syntax.ScriptInterpolatedExpression;
import io.proddata.stencil.syntax.ScriptInterpolatedStringExpression;
import io.proddata.stencil.syntax.ScriptIsEmptyExpression;
import io.proddata.stencil.syntax.ScriptLiteral;
import io.proddata.stencil.syntax.ScriptMemberExpression;
import io.proddata.stencil.syntax.ScriptNamedArgument;
import io.proddata.stencil.syntax.ScriptNestedExpression;
import io.proddata.stencil.syntax.ScriptNode;
import io.proddata.stencil.syntax.ScriptObjectInitializerExpression;
import io.proddata.stencil.syntax.ScriptObjectMember;
import io.proddata.stencil.syntax.ScriptPage;
import io.proddata.stencil.syntax.ScriptParameter;
import io.proddata.stencil.syntax.ScriptPipeCall;
import io.proddata.stencil.syntax.ScriptRawStatement;
import io.proddata.stencil.syntax.ScriptReadOnlyStatement;
import io.proddata.stencil.syntax.ScriptReturnStatement;
import io.proddata.stencil.syntax.ScriptStatement;
import io.proddata.stencil.syntax.ScriptStringQuoteType;
import io.proddata.stencil.syntax.ScriptTableRowStatement;
import io.proddata.stencil.syntax.ScriptTerminal;
import io.proddata.stencil.syntax.ScriptThisExpression;
import io.proddata.stencil.syntax.ScriptToken;
import io.proddata.stencil.syntax.ScriptTrivia;
import io.proddata.stencil.syntax.ScriptTriviaType;
import io.proddata.stencil.syntax.ScriptUnaryExpression;
import io.proddata.stencil.syntax.ScriptUnaryOperator;
import io.proddata.stencil.syntax.ScriptVariable;
import io.proddata.stencil.syntax.ScriptVariablePath;
import io.proddata.stencil.syntax.ScriptVariableScope;
import io.proddata.stencil.syntax.ScriptVisitor;
import io.proddata.stencil.syntax.ScriptWhenStatement;
import io.proddata.stencil.syntax.ScriptWhileStatement;
import io.proddata.stencil.syntax.ScriptWhitespaceMode;
import io.proddata.stencil.syntax.ScriptWithStatement;
import io.proddata.stencil.syntax.ScriptWrapStatement;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Builds the syntax tree of a template from the tokens of a {@link Lexer}.
 * <p>
 * Errors never throw: they are collected as {@link LogMessage}s and parsing resumes at the next statement.
 * Reaching the expression depth limit is the only condition that aborts, {@link #run()} then returns {@code null}.
 * A parser is single-use.
 */
public class Parser {
    private static final Logger logger = LoggerFactory.getLogger(Parser.class);

    private static final Set<String> KEYWORDS = Set.of(
        "if", "else", "end", "for", "case", "when", "while", "break", "continue", "func", "import", "readonly",
        "with", "capture", "ret", "wrap", "do"
    );

    private static final BigInteger UINT_MAX = BigInteger.valueOf(0xFFFF_FFFFL);
    private static final BigInteger ULONG_MAX = BigInteger.ONE.shiftLeft(64).subtract(BigInteger.ONE);

    private final Lexer lexer;
    private final String text;
    private final ParserOptions options;
    private final boolean liquid;
    private final boolean scientific;
    private final boolean keepTrivia;
    private final Iterator<Token> tokens;
    private final List<Token> tokensPreview = new ArrayList<>(4);
    private int tokensPreviewStart;
    private Token previous;
    private Token current;

    private ScriptMode currentParsingMode;
    private boolean inCodeSection;
    private boolean liquidTagSection;
    private boolean inFrontMatter;
    private boolean lexerFailed;
    private int blockLevel;
    private int expressionDepth;
    private int expressionLevel;
    private int allowNewLineLevel;
    private ScriptFrontMatter frontMatter;
    private ScriptBlockStatement currentBlockStatement;
    private final Deque<ScriptNode> blocks = new ArrayDeque<>();

    private final List<ScriptTrivia> trivias = new ArrayList<>();
    private ScriptTerminal lastTerminalWithTrivias;
    private ScriptIncrementDecrementExpression invalidIncrementDecrement;

    private List<LogMessage> messages = new ArrayList<>();
    private boolean hasErrors;

    public Parser(Lexer lexer) {
        this(lexer, null);
    }

    public Parser(Lexer lexer, ParserOptions options) {
        this.lexer = Objects.requireNonNull(lexer, "lexer");
        this.text = lexer.getText();
        this.options = options == null ? ParserOptions.DEFAULT : options;
        this.liquid = lexer.getOptions().getDialect() == Dialect.LIQUID;
        this.scientific = lexer.getOptions().getDialect() == Dialect.SCIENTIFIC;
        this.keepTrivia = lexer.getOptions().isKeepTrivia();
        this.currentParsingMode = lexer.getOptions().getMode();
        this.tokens = lexer.iterator();
        nextToken();
    }

    public List<LogMessage> getMessages() {
        return Collections.unmodifiableList(messages);
    }

    public boolean hasErrors() {
        return hasErrors;
    }

    /**
     * Parses the whole template.
     *
     * @return the page, or {@code null} when a front matter is required but missing or when the depth limit is reached
     */
    public ScriptPage run() {
        messages = new ArrayList<>();
        hasErrors = false;
        blockLevel = 0;
        blocks.clear();

        try {
            return parsePage();
        } catch (DepthLimitException e) {
            logger.warn("Parsing of {} aborted: {}", lexer.getSourcePath(), e.getMessage());
            return null;
        }
    }

    private ScriptPage parsePage() {
        ScriptPage page = open(new ScriptPage());
        ScriptMode parsingMode = currentParsingMode;
        if (parsingMode.hasFrontMatter()) {
            String marker = lexer.getOptions().getFrontMatterMarker();
            if (current.type() != TokenType.FRONT_MATTER_MARKER) {
                logError("When `" + parsingMode + "` is enabled, expecting a `" + marker + "` at the beginning of the text instead of `" + getText(current) + "`");
                return null;
            }

            inFrontMatter = true;
            inCodeSection = true;

            frontMatter = open(new ScriptFrontMatter());
            expectAndParseTokenTo(frontMatter.getStartMarker(), TokenType.FRONT_MATTER_MARKER);
            frontMatter.setStatements(parseBlockStatement(frontMatter, true));

            if (inFrontMatter) {
                logError("End of frontmatter `" + marker + "` not found");
            }

            page.setFrontMatter(frontMatter);
            page.setSpan(frontMatter.getSpan());

            if (parsingMode == ScriptMode.FRONT_MATTER_ONLY) {
                appendLexerErrors();
                return page;
            }
        } else if (parsingMode == ScriptMode.SCRIPT_ONLY) {
            inCodeSection = true;
        }

        ScriptBlockStatement body = parseBlockStatement(page, true);
        page.setBody(body);
        if (page.getFrontMatter() == null) {
            page.setSpan(body.getSpan());
        }

        flushTriviasToLastTerminal();

        if (page.getFrontMatter() != null) {
            fixRawStatementAfterFrontMatter(page);
        }

        appendLexerErrors();
        return page;
    }

    private void appendLexerErrors() {
        for (LogMessage error : lexer.getErrors()) {
            log(error);
        }
    }

    // ---------------------------------------------------------------------------------------------------------
    // Tokens and trivia
    // ---------------------------------------------------------------------------------------------------------

    private void nextToken() {
        previous = current;

        while (tokensPreviewStart < tokensPreview.size()) {
            Token token = tokensPreview.get(tokensPreviewStart++);
            if (tokensPreviewStart == tokensPreview.size()) {
                tokensPreviewStart = 0;
                tokensPreview.clear();
            }
            if (isHidden(token.type())) {
                if (keepTrivia) {
                    pushTrivia(token);
                }
            } else {
                setCurrent(token);
                return;
            }
        }

        while (tokens.hasNext()) {
            Token token = tokens.next();
            if (isHidden(token.type())) {
                if (keepTrivia) {
                    pushTrivia(token);
                }
            } else {
                setCurrent(token);
                return;
            }
        }
        setCurrent(Token.EOF);
    }

    private void setCurrent(Token token) {
        current = token;
        if (token.type() == TokenType.INVALID && lexer.hasErrors()) {
            // the lexer already reported this token
            lexerFailed = true;
        }
    }

    private Token peekToken() {
        for (int i = tokensPreviewStart; i < tokensPreview.size(); i++) {
            Token token = tokensPreview.get(i);
            if (!isHidden(token.type())) {
                return token;
            }
        }
        while (tokens.hasNext()) {
            Token token = tokens.next();
            tokensPreview.add(token);
            if (!isHidden(token.type())) {
                return token;
            }
        }
        return Token.EOF;
    }

    private boolean isHidden(TokenType type) {
        return type.isHidden() || (type == TokenType.NEW_LINE && allowNewLineLevel > 0);
    }

    private void pushTrivia(Token token) {
        ScriptTriviaType type = switch (token.type()) {
            case COMMENT -> ScriptTriviaType.COMMENT;
            case COMMENT_MULTI -> ScriptTriviaType.COMMENT_MULTI;
            case WHITESPACE -> ScriptTriviaType.WHITESPACE;
            case WHITESPACE_FULL -> ScriptTriviaType.WHITESPACE_FULL;
            case NEW_LINE -> ScriptTriviaType.NEW_LINE;
            default -> throw new IllegalStateException("Token type `" + token.type() + "` not supported by trivia");
        };
        trivias.add(new ScriptTrivia(spanOf(token), type, getText(token)));
    }

    private void pushTokenToTrivia() {
        if (!keepTrivia) {
            return;
        }
        ScriptTriviaType type = switch (current.type()) {
            case NEW_LINE -> ScriptTriviaType.NEW_LINE;
            case SEMI_COLON -> ScriptTriviaType.SEMI_COLON;
            case COMMA -> ScriptTriviaType.COMMA;
            default -> null;
        };
        if (type != null) {
            trivias.add(new ScriptTrivia(currentSpan(), type, getText(current)));
        }
    }

    private void pushPunctuationToTrivia() {
        if (keepTrivia) {
            trivias.add(new ScriptTrivia(currentSpan(), ScriptTriviaType.PUNCTUATION, getText(current)));
        }
    }

    private void flushTrivias(ScriptTerminal terminal, boolean before) {
        if (keepTrivia && !trivias.isEmpty()) {
            terminal.addTrivias(trivias, before);
            trivias.clear();
        }
    }

    private void flushTriviasToLastTerminal() {
        if (keepTrivia && lastTerminalWithTrivias != null) {
            flushTrivias(lastTerminalWithTrivias, false);
        }
    }

    private <T extends ScriptNode> T open(T node) {
        TextPosition start = current.type() == TokenType.EOF && previous != null ? previous.end() : current.start();
        node.setSpan(new SourceSpan(lexer.getSourcePath(), start, start));
        if (keepTrivia && node instanceof ScriptTerminal terminal && !(node instanceof ScriptRawStatement)) {
            flushTrivias(terminal, true);
        }
        return node;
    }

    private <T extends ScriptNode> T close(T node) {
        if (previous != null) {
            node.setSpanEnd(previous.end());
        }
        if (keepTrivia && node instanceof ScriptTerminal terminal && !(node instanceof ScriptRawStatement)) {
            lastTerminalWithTrivias = terminal;
            flushTrivias(terminal, false);
        }
        return node;
    }

    private String getText(Token token) {
        return token.getText(text);
    }

    private SourceSpan spanOf(Token token) {
        return new SourceSpan(lexer.getSourcePath(), token.start(), token.end());
    }

    private SourceSpan currentSpan() {
        return spanOf(current);
    }

    private boolean isPreviousCharWhitespace() {
        int position = current.start().offset() - 1;
        return position >= 0 && position < text.length() && Character.isWhitespace(text.charAt(position));
    }

    // ---------------------------------------------------------------------------------------------------------
    // Diagnostics
    // ---------------------------------------------------------------------------------------------------------

    private void logError(String message) {
        logError(currentSpan(), message);
    }

    private void logError(Token token, String message) {
        logError(spanOf(token), message);
    }

    private void logError(SourceSpan span, String message) {
        // an invalid token was already reported by the lexer, anything after it is noise
        if (lexerFailed) {
            return;
        }
        log(new LogMessage(ParserMessageType.ERROR, span, message));
    }

    private void logError(ScriptNode node, String message) {
        logError(node, node.getSpan(), message);
    }

    private void logError(ScriptNode node, SourceSpan span, String message) {
        String in = message.endsWith("after") ? "" : " in";
        logError(span, "Error while parsing " + node.syntaxName() + ": " + message + in + ": " + node.syntaxExample());
    }

    private void log(LogMessage message) {
        messages.add(message);
        if (message.isError()) {
            hasErrors = true;
        }
    }

    private void enterExpression() {
        expressionDepth++;
        Integer limit = options.getExpressionDepthLimit();
        if (limit != null && expressionDepth > limit) {
            String message = "The statement depth limit `" + limit + "` was reached when parsing this statement";
            logError(previous != null ? spanOf(previous) : currentSpan(), message);
            throw new DepthLimitException(message);
        }
    }

    private void leaveExpression() {
        expressionDepth--;
    }

    // ---------------------------------------------------------------------------------------------------------
    // Statements
    // ---------------------------------------------------------------------------------------------------------

    private ScriptBlockStatement parseBlockStatement(ScriptNode parent, boolean parseEndOfStatementAfterEnd) {
        blocks.push(parent);
        blockLevel++;
        enterExpression();

        ScriptBlockStatement block = open(new ScriptBlockStatement());
        ScriptBlockStatement previousBlock = currentBlockStatement;
        currentBlockStatement = block;
        try {
            ParsedStatement parsed = new ParsedStatement();
            while (tryParseStatement(parent, parseEndOfStatementAfterEnd, parsed)) {
                // an else attached to its parent yields no statement
                if (parsed.statement != null) {
                    block.getStatements().add(parsed.statement);
                }
                if (parsed.hasEnd) {
                    break;
                }
            }

            if (!parseEndOfStatementAfterEnd && parsed.statement instanceof ScriptEndStatement end) {
                end.setExpectEos(false);
            }

            if (!parsed.hasEnd && blockLevel > 1) {
                if (liquid) {
                    logError(parent, parent.getSpan() != null ? parent.getSpan() : currentSpan(), "The `end" + liquidTagName(parent) + "` was not found");
                } else {
                    logError(parent, previous != null ? spanOf(previous) : currentSpan(), "The <end> statement was not found");
                }
            }
        } finally {
            currentBlockStatement = previousBlock;
            leaveExpression();
            blockLevel--;
        }

        blocks.pop();
        return close(block);
    }

    private static String liquidTagName(ScriptNode node) {
        if (node instanceof ScriptIfStatement ifStatement) {
            String keyword = ifStatement.getIfKeyword().getText();
            return "elsif".equals(keyword) ? "if" : keyword;
        }
        if (node instanceof ScriptForStatement forStatement) {
            return forStatement.getForOrTableRowKeyword().getText();
        }
        if (node instanceof ScriptCaseStatement || node instanceof ScriptWhenStatement) {
            return "case";
        }
        if (node instanceof ScriptCaptureStatement) {
            return "capture";
        }
        if (node instanceof ScriptElseStatement) {
            return "if";
        }
        return node.syntaxName();
    }

    private boolean tryParseStatement(ScriptNode parent, boolean parseEndOfStatementAfterEnd, ParsedStatement parsed) {
        parsed.statement = null;
        parsed.hasEnd = false;
        parsed.next = true;

        while (true) {
            if (lexerFailed) {
                return false;
            }

            switch (current.type()) {
                case EOF -> {
                    return false;
                }
                case RAW, ESCAPE -> {
                    ScriptRawStatement raw = parseRawStatement();
                    if (parent instanceof ScriptCaseStatement) {
                        // text between a case and its first when is not output
                        keepDroppedRawAsTrivia(raw);
                        continue;
                    }
                    parsed.statement = raw;
                }
                case CODE_ENTER, LIQUID_TAG_ENTER, CODE_EXIT, LIQUID_TAG_EXIT, ESCAPE_ENTER, ESCAPE_EXIT ->
                    parsed.statement = parseEscapeStatement();
                case FRONT_MATTER_MARKER -> {
                    if (inFrontMatter) {
                        inFrontMatter = false;
                        inCodeSection = false;

                        expectAndParseTokenTo(frontMatter.getEndMarker(), TokenType.FRONT_MATTER_MARKER);
                        close(frontMatter);
                        frontMatter.setTextPositionAfterEndMarker(current.start());

                        if (currentParsingMode.hasFrontMatter()) {
                            currentParsingMode = ScriptMode.DEFAULT;
                            parsed.next = false;
                        }
                    } else {
                        logError("Unexpected frontmatter marker `" + lexer.getOptions().getFrontMatterMarker() + "` while not inside a frontmatter");
                        nextToken();
                    }
                }
                default -> {
                    if (!inCodeSection) {
                        parsed.next = false;
                        logError("Unexpected token " + getText(current) + " while not in a code block { ... }");
                        return false;
                    }
                    switch (current.type()) {
                        case NEW_LINE, SEMI_COLON -> {
                            pushTokenToTrivia();
                            nextToken();
                            continue;
                        }
                        case IDENTIFIER, IDENTIFIER_SPECIAL -> {
                            String identifier = getText(current);
                            if (liquid) {
                                parseLiquidStatement(identifier, parent, parsed);
                            } else {
                                parseDefaultStatement(identifier, parent, parseEndOfStatementAfterEnd, parsed);
                            }
                        }
                        default -> {
                            if (isStartOfExpression()) {
                                parsed.statement = parseExpressionStatement();
                            } else {
                                parsed.next = false;
                                logError("Unexpected token " + getText(current));
                            }
                        }
                    }
                }
            }
            return parsed.next;
        }
    }

    private void keepDroppedRawAsTrivia(ScriptRawStatement raw) {
        List<ScriptStatement> statements = currentBlockStatement.getStatements();
        if (keepTrivia && !statements.isEmpty() && statements.get(statements.size() - 1) instanceof ScriptTerminal terminal) {
            terminal.addTrivia(new ScriptTrivia(raw.getSpan(), ScriptTriviaType.WHITESPACE, raw.getText()), false);
        }
    }

    private void parseDefaultStatement(String identifier, ScriptNode parent, boolean parseEndOfStatementAfterEnd, ParsedStatement parsed) {
        Token startToken = current;
        switch (identifier) {
            case "end" -> {
                parsed.hasEnd = true;
                parsed.statement = parseEndStatement(parseEndOfStatementAfterEnd);
            }
            case "wrap" -> {
                checkNotInCase(parent, startToken);
                parsed.statement = parseWrapStatement();
            }
            case "if" -> {
                checkNotInCase(parent, startToken);
                parsed.statement = parseIfStatement(false, null);
            }
            case "case" -> {
                checkNotInCase(parent, startToken);
                parsed.statement = parseCaseStatement();
            }
            case "when" -> parseWhen(parent, startToken, parsed);
            case "else" -> {
                ScriptConditionStatement nextCondition = parseElseStatement(false);
                if (parent instanceof ScriptIfStatement ifStatement) {
                    ifStatement.setElseStatement(nextCondition);
                } else if (parent instanceof ScriptWhenStatement whenStatement) {
                    whenStatement.setNext(nextCondition);
                } else if (parent instanceof ScriptForStatement forStatement) {
                    if (nextCondition instanceof ScriptElseStatement elseStatement) {
                        forStatement.setElseStatement(elseStatement);
                    } else {
                        logError(nextCondition.getSpan(), "Invalid if/else combination within a for statement.");
                    }
                } else {
                    parsed.next = false;
                    logError(startToken, "A else condition must be preceded by another if/else/when condition or a for loop.");
                }
                parsed.hasEnd = true;
            }
            case "for" -> {
                checkNotInCase(parent, startToken);
                parsed.statement = peekToken().type() == TokenType.DOT
                    ? parseExpressionStatement()
                    : parseForStatement(new ScriptForStatement());
            }
            case "tablerow" -> {
                checkNotInCase(parent, startToken);
                if (scientific || peekToken().type() == TokenType.DOT) {
                    parsed.statement = parseExpressionStatement();
                } else {
                    parsed.statement = parseForStatement(new ScriptTableRowStatement());
                }
            }
            case "with" -> {
                checkNotInCase(parent, startToken);
                parsed.statement = parseWithStatement();
            }
            case "import" -> {
                checkNotInCase(parent, startToken);
                parsed.statement = parseImportStatement();
            }
            case "readonly" -> {
                checkNotInCase(parent, startToken);
                parsed.statement = parseReadOnlyStatement();
            }
            case "while" -> {
                checkNotInCase(parent, startToken);
                parsed.statement = peekToken().type() == TokenType.DOT
                    ? parseExpressionStatement()
                    : parseWhileStatement();
            }
            case "break" -> {
                checkNotInCase(parent, startToken);
                parsed.statement = parseBreakStatement();
            }
            case "continue" -> {
                checkNotInCase(parent, startToken);
                parsed.statement = parseContinueStatement();
            }
            case "func" -> {
                checkNotInCase(parent, startToken);
                parsed.statement = parseFunctionStatement(false);
            }
            case "ret" -> {
                checkNotInCase(parent, startToken);
                parsed.statement = parseReturnStatement();
            }
            case "capture" -> {
                checkNotInCase(parent, startToken);
                parsed.statement = parseCaptureStatement();
            }
            default -> {
                checkNotInCase(parent, startToken);
                parsed.statement = parseExpressionStatement();
            }
        }
    }

    private void parseWhen(ScriptNode parent, Token startToken, ParsedStatement parsed) {
        ScriptWhenStatement whenStatement = parseWhenStatement();
        if (parent instanceof ScriptWhenStatement parentWhen) {
            parentWhen.setNext(whenStatement);
        } else if (parent instanceof ScriptCaseStatement) {
            parsed.statement = whenStatement;
        } else {
            parsed.next = false;
            logError(startToken, "A `when` condition must be preceded by another `when`/`else`/`case` condition");
        }
        parsed.hasEnd = true;
    }

    private void parseLiquidStatement(String identifier, ScriptNode parent, ParsedStatement parsed) {
        Token startToken = current;
        if (!liquidTagSection) {
            parsed.statement = parseLiquidExpressionStatement(parent);
            return;
        }

        if (!identifier.equals("when") && !identifier.equals("case") && !identifier.startsWith("end") && parent instanceof ScriptCaseStatement) {
            logError(startToken, "Unexpected statement/expression `" + getText(startToken) + "` in the body of a `case` statement. Only `when`/`else` are expected.");
        }

        ScriptNode startStatement = null;
        String pendingStart = null;
        switch (identifier) {
            case "endif" -> {
                startStatement = findFirstStatementExpectingEnd() instanceof ScriptIfStatement s ? s : null;
                pendingStart = "`if`/`else`";
            }
            case "endifchanged" -> {
                startStatement = findFirstStatementExpectingEnd() instanceof ScriptIfStatement s ? s : null;
                pendingStart = "`ifchanged`";
            }
            case "endunless" -> {
                startStatement = findFirstStatementExpectingEnd() instanceof ScriptIfStatement s ? s : null;
                pendingStart = "`unless`";
            }
            case "endfor" -> {
                startStatement = findFirstStatementExpectingEnd() instanceof ScriptForStatement s ? s : null;
                pendingStart = "`for`";
            }
            case "endcase" -> {
                startStatement = findFirstStatementExpectingEnd() instanceof ScriptCaseStatement s ? s : null;
                pendingStart = "`case`";
            }
            case "endcapture" -> {
                startStatement = findFirstStatementExpectingEnd() instanceof ScriptCaptureStatement s ? s : null;
                pendingStart = "`capture`";
            }
            case "endtablerow" -> {
                startStatement = findFirstStatementExpectingEnd() instanceof ScriptTableRowStatement s ? s : null;
                pendingStart = "`tablerow`";
            }
            case "case" -> parsed.statement = parseCaseStatement();
            case "when" -> parseWhen(parent, startToken, parsed);
            case "if" -> parsed.statement = parseIfStatement(false, null);
            case "ifchanged" -> parsed.statement = parseLiquidIfChanged();
            case "unless" -> {
                checkNotInCase(parent, startToken);
                parsed.statement = parseIfStatement(true, null);
            }
            case "else", "elsif" -> {
                boolean elsif = identifier.equals("elsif");
                ScriptConditionStatement nextCondition = parseElseStatement(elsif);
                if (parent instanceof ScriptIfStatement ifStatement) {
                    ifStatement.setElseStatement(nextCondition);
                } else if (parent instanceof ScriptWhenStatement whenStatement) {
                    if (elsif) {
                        logError(startToken, "A elsif condition is not allowed within a when/case condition");
                    }
                    whenStatement.setNext(nextCondition);
                } else if (!elsif && parent instanceof ScriptForStatement forStatement && nextCondition instanceof ScriptElseStatement elseStatement) {
                    forStatement.setElseStatement(elseStatement);
                } else {
                    parsed.next = false;
                    logError(startToken, elsif
                        ? "A else condition must be preceded by another if/else/unless."
                        : "A else condition must be preceded by another if/else/unless condition or a for loop.");
                }
                parsed.hasEnd = true;
            }
            case "for" -> {
                ScriptForStatement forStatement = parseForStatement(new ScriptForStatement());
                forStatement.setSetContinue(true);
                parsed.statement = forStatement;
            }
            case "tablerow" -> parsed.statement = parseForStatement(new ScriptTableRowStatement());
            case "cycle" -> parsed.statement = parseLiquidCycleStatement();
            case "break" -> parsed.statement = parseBreakStatement();
            case "continue" -> {
                parsed.statement = parseContinueStatement();
                flushTriviasToLastTerminal();
            }
            case "assign" -> parsed.statement = parseLiquidAssignStatement();
            case "capture" -> parsed.statement = parseCaptureStatement();
            case "increment" -> parsed.statement = parseLiquidIncDecStatement(false);
            case "decrement" -> parsed.statement = parseLiquidIncDecStatement(true);
            case "include" -> parsed.statement = parseLiquidIncludeStatement();
            default -> parsed.statement = parseLiquidExpressionStatement(parent);
        }

        if (pendingStart != null) {
            ScriptEndStatement endStatement = open(new ScriptEndStatement());
            endStatement.getEndKeyword().setText(identifier);
            parseKeywordAsIs(endStatement.getEndKeyword());
            parsed.statement = close(endStatement);
            parsed.hasEnd = true;
            parsed.next = true;

            if (startStatement == null) {
                logError(startToken, "Unable to find a pending " + pendingStart + " for this `" + identifier + "`");
            }
        }
    }

    private ScriptStatement parseLiquidExpressionStatement(ScriptNode parent) {
        checkNotInCase(parent, current);
        return parseExpressionStatement();
    }

    private ScriptStatement parseLiquidAssignStatement() {
        ScriptToken assignKeyword = ScriptToken.keyword(getText(current));
        parseKeywordAsIs(assignKeyword);

        Token token = current;
        ScriptStatement statement = parseExpressionStatement();
        if (statement instanceof ScriptExpressionStatement expressionStatement && expressionStatement.getExpression() instanceof ScriptAssignExpression) {
            expressionStatement.setTagKeyword(assignKeyword);
        } else {
            logError(token, "Expecting an assign expression: <variable> = <expression>");
        }
        return statement;
    }

    private ScriptStatement parseLiquidIfChanged() {
        ScriptIfStatement statement = open(new ScriptIfStatement());
        ScriptToken keyword = statement.getIfKeyword();
        keyword.setText(getText(current));
        parseKeywordAsIs(keyword);

        ScriptMemberExpression condition = new ScriptMemberExpression();
        condition.setTarget(ScriptVariable.global("for"));
        condition.setMember(ScriptVariable.global("changed"));
        statement.setCondition(condition);
        statement.setThen(parseBlockStatement(statement, true));
        close(statement);
        condition.setSpan(statement.getSpan());
        return statement;
    }

    private ScriptExpressionStatement parseLiquidCycleStatement() {
        ScriptExpressionStatement statement = open(new ScriptExpressionStatement());
        ScriptFunctionCall functionCall = open(new ScriptFunctionCall());
        statement.setExpression(functionCall);
        functionCall.setTarget(parseVariable());

        if (options.isQualifyLiquidFunctions()) {
            qualifyLiquidFunctionCall(functionCall);
        }

        // cycle "a", "b" is array.cycle ["a", "b"], a leading `"group":` becomes a named argument
        ScriptArrayInitializerExpression values = null;
        boolean first = true;
        while (isVariableOrLiteral(current)) {
            ScriptExpression value = parseVariableOrLiteral();

            if (first && current.type() == TokenType.COLON) {
                ScriptNamedArgument group = open(new ScriptNamedArgument());
                group.setName(ScriptVariable.global("group"));
                group.setColonToken(new ScriptToken(TokenType.COLON));
                expectAndParseTokenTo(group.getColonToken(), TokenType.COLON);
                group.setValue(value);
                close(group);
                group.setSpan(value.getSpan());
                first = false;
                functionCall.getArguments().add(group);
                continue;
            }

            if (values == null) {
                values = open(new ScriptArrayInitializerExpression());
                // the values are written bare
                values.setOpenBracketToken(null);
                values.setCloseBracketToken(null);
                functionCall.getArguments().add(0, values);
                values.setSpanStart(value.getSpan().start());
            }
            values.getValues().add(value);
            values.setSpanEnd(value.getSpan().end());

            if (current.type() == TokenType.COMMA) {
                pushTokenToTrivia();
                nextToken();
                flushTriviasToLastTerminal();
            } else if (current.type() == TokenType.LIQUID_TAG_EXIT) {
                break;
            } else {
                logError(current, "Unexpected token `" + getText(current) + "` after cycle value `" + value + "`. Expecting a `,`");
                nextToken();
                break;
            }
        }

        close(functionCall);
        expectEndOfStatement();
        return close(statement);
    }

    private ScriptStatement parseLiquidIncDecStatement(boolean decrement) {
        ScriptExpressionStatement statement = open(new ScriptExpressionStatement());
        ScriptToken keyword = ScriptToken.keyword(getText(current));
        parseKeywordAsIs(keyword);
        statement.setTagKeyword(keyword);

        ScriptBinaryExpression binary = open(new ScriptBinaryExpression());
        binary.setLeft(expectAndParseVariable(statement));
        ScriptLiteral one = new ScriptLiteral(1);
        one.setSpan(binary.getSpan());
        binary.setRight(one);
        binary.setOperator(decrement ? ScriptBinaryOperator.SUBTRACT : ScriptBinaryOperator.ADD);
        expectEndOfStatement();

        statement.setExpression(binary);
        close(binary);
        return close(statement);
    }

    private ScriptStatement parseLiquidIncludeStatement() {
        ScriptFunctionCall include = open(new ScriptFunctionCall());
        include.setTarget(parseVariable());

        Token templateNameToken = current;
        ScriptExpression templateName = expectAndParseExpression(include, null, 0, null, ExpressionMode.BASIC_EXPRESSION, true);
        if (templateName != null) {
            boolean stringName = templateName instanceof ScriptLiteral literal && literal.getValue() instanceof String;
            if (!stringName && !(templateName instanceof ScriptVariablePath)) {
                logError(templateNameToken, "Unexpected include template name `" + templateName + "` expecting a string or a variable path");
            }
            include.addArgument(templateName);
        }
        close(include);

        ScriptExpressionStatement includeStatement = new ScriptExpressionStatement();
        includeStatement.setSpan(include.getSpan());
        includeStatement.setExpression(include);

        ScriptForStatement forStatement = null;
        ScriptBlockStatement block = null;

        if (current.type() == TokenType.IDENTIFIER) {
            String next = getText(current);
            if (next.equals("with")) {
                // this[name] = value; include name
                nextToken();
                ScriptAssignExpression assign = open(new ScriptAssignExpression());
                assign.setTarget(thisIndexer(templateName));
                assign.setValue(expectAndParseExpression(include, null, 0, null, ExpressionMode.BASIC_EXPRESSION, true));
                close(assign);

                block = new ScriptBlockStatement();
                block.setSpan(include.getSpan());
                block.getStatements().add(expressionStatement(assign));
                block.getStatements().add(includeStatement);
                close(block);
            } else if (next.equals("for")) {
                // for this[name] in value; include name; end
                nextToken();
                forStatement = open(new ScriptForStatement());
                forStatement.setVariable(thisIndexer(templateName));
                forStatement.setIterator(expectAndParseExpression(include, null, 0, null, ExpressionMode.BASIC_EXPRESSION, true));

                ScriptBlockStatement body = new ScriptBlockStatement();
                body.setSpan(include.getSpan());
                body.getStatements().add(includeStatement);
                body.getStatements().add(new ScriptEndStatement());
                forStatement.setBody(body);
                close(forStatement);
            }

            // name: value parameters are assigned before the include
            while (current.type() == TokenType.IDENTIFIER) {
                Token variableToken = current;
                ScriptExpression variableObject = parseVariable();
                ScriptVariable variable = variableObject instanceof ScriptVariable v ? v : null;
                if (variable == null) {
                    logError(variableToken, "Unexpected variable name `" + getText(variableToken) + "` found in include parameter");
                }

                if (current.type() == TokenType.COLON) {
                    pushPunctuationToTrivia();
                    nextToken();
                    flushTriviasToLastTerminal();
                } else {
                    logError(current, "Unexpected token `" + getText(current) + "` after variable `" + variable + "`. Expecting a `:`");
                }

                if (block == null) {
                    block = new ScriptBlockStatement();
                    block.setSpan(include.getSpan());
                    block.getStatements().add(includeStatement);
                }

                ScriptAssignExpression assign = open(new ScriptAssignExpression());
                assign.setTarget(variableObject);
                assign.setValue(expectAndParseExpression(include, null, 0, null, ExpressionMode.BASIC_EXPRESSION, true));
                close(assign);
                block.getStatements().add(0, expressionStatement(assign));

                if (current.type() == TokenType.COMMA) {
                    pushTokenToTrivia();
                    nextToken();
                    flushTriviasToLastTerminal();
                }
            }

            expectEndOfStatement();

            if (forStatement != null) {
                if (block == null) {
                    return close(forStatement);
                }
                block.getStatements().add(forStatement);
            }
            if (block != null) {
                return close(block);
            }
        }

        expectEndOfStatement();
        return close(includeStatement);
    }

    private static ScriptExpressionStatement expressionStatement(ScriptExpression expression) {
        ScriptExpressionStatement statement = new ScriptExpressionStatement();
        statement.setSpan(expression.getSpan());
        statement.setExpression(expression);
        return statement;
    }

    private ScriptIndexerExpression thisIndexer(ScriptExpression index) {
        ScriptThisExpression target = new ScriptThisExpression();
        target.setSpan(currentSpan());
        ScriptIndexerExpression indexer = new ScriptIndexerExpression();
        indexer.setSpan(currentSpan());
        indexer.setTarget(target);
        indexer.setIndex(copyIncludeName(index));
        return indexer;
    }

    private static ScriptExpression copyIncludeName(ScriptExpression name) {
        if (name instanceof ScriptLiteral literal) {
            ScriptLiteral copy = new ScriptLiteral(literal.getValue());
            copy.setSpan(literal.getSpan());
            copy.setStringQuoteType(literal.getStringQuoteType());
            return copy;
        }
        if (name instanceof ScriptVariable variable) {
            ScriptVariable copy = new ScriptVariable(variable.getName(), variable.getScope());
            copy.setSpan(variable.getSpan());
            return copy;
        }
        return name;
    }

    private ScriptEndStatement parseEndStatement(boolean parseEndOfStatementAfterEnd) {
        ScriptEndStatement endStatement = open(new ScriptEndStatement());
        expectAndParseKeywordTo(endStatement.getEndKeyword());
        if (parseEndOfStatementAfterEnd) {
            expectEndOfStatement();
        }
        return close(endStatement);
    }

    private ScriptBreakStatement parseBreakStatement() {
        ScriptBreakStatement statement = open(new ScriptBreakStatement());
        expectAndParseKeywordTo(statement.getBreakKeyword());
        expectEndOfStatement();
        return close(statement);
    }

    private ScriptContinueStatement parseContinueStatement() {
        ScriptContinueStatement statement = open(new ScriptContinueStatement());
        expectAndParseKeywordTo(statement.getContinueKeyword());
        expectEndOfStatement();
        return close(statement);
    }

    private ScriptCaptureStatement parseCaptureStatement() {
        ScriptCaptureStatement statement = open(new ScriptCaptureStatement());
        expectAndParseKeywordTo(statement.getCaptureKeyword());
        statement.setTarget(expectAndParseExpression(statement));
        expectEndOfStatement();
        statement.setBody(parseBlockStatement(statement, true));
        return close(statement);
    }

    private ScriptEscapeStatement parseEscapeStatement() {
        TokenType type = current.type();
        boolean codeEnter = type == TokenType.CODE_ENTER || type == TokenType.LIQUID_TAG_ENTER;
        boolean escape = type == TokenType.ESCAPE_ENTER || type == TokenType.ESCAPE_EXIT;
        boolean enter = codeEnter || type == TokenType.ESCAPE_ENTER;
        boolean liquidTag = type == TokenType.LIQUID_TAG_ENTER || type == TokenType.LIQUID_TAG_EXIT;

        if (codeEnter) {
            if (inCodeSection) {
                logError("Unexpected token while already in a code block");
            }
        } else if (!escape) {
            if (!inCodeSection) {
                logError("Unexpected code block exit '}}' while no code block enter '{{' has been found");
            } else if (currentParsingMode == ScriptMode.SCRIPT_ONLY) {
                logError("Unexpected code clock exit '}}' while parsing in script only mode. '}}' is not allowed.");
            }
        }

        liquidTagSection = codeEnter && liquidTag;
        inCodeSection = codeEnter;

        ScriptEscapeStatement statement = open(new ScriptEscapeStatement());
        statement.setEntering(enter);
        statement.setLiquidTag(liquidTag);

        String tokenText = getText(current);
        statement.setTokenText(tokenText);
        char whitespaceChar = tokenText.isEmpty() ? '\0' : tokenText.charAt(enter ? tokenText.length() - 1 : 0);
        statement.setWhitespaceMode(ScriptWhitespaceMode.fromMarker(whitespaceChar));

        if (escape) {
            if (liquid) {
                statement.setEscapeCount(6);
            } else {
                // minus the opening and closing braces
                int escapeCount = tokenText.length() - 2;
                if (whitespaceChar != (enter ? '{' : '}')) {
                    escapeCount--;
                }
                statement.setEscapeCount(escapeCount);
            }
        }
        nextToken();

        if (codeEnter && !currentBlockStatement.getStatements().isEmpty()) {
            List<ScriptStatement> statements = currentBlockStatement.getStatements();
            if (statements.get(statements.size() - 1) instanceof ScriptRawStatement raw) {
                statement.setIndent(indentOf(raw));
            }
        }

        return close(statement);
    }

    /**
     * The whitespace that follows the last newline of a raw statement, or the whole raw statement when it is
     * the blank start of the document.
     */
    private static String indentOf(ScriptRawStatement raw) {
        String rawText = raw.getText();
        if (rawText == null) {
            return null;
        }
        for (int j = rawText.length() - 1; j >= 0; j--) {
            char c = rawText.charAt(j);
            if (c == '\n') {
                return rawText.substring(j + 1);
            }
            if (!Character.isWhitespace(c)) {
                return null;
            }
        }
        return raw.getSpan() != null && raw.getSpan().offset() == 0 ? rawText : null;
    }

    private ScriptCaseStatement parseCaseStatement() {
        ScriptCaseStatement statement = open(new ScriptCaseStatement());
        expectAndParseKeywordTo(statement.getCaseKeyword());
        statement.setValue(expectAndParseExpression(statement, null, 0, null, ExpressionMode.DEFAULT, false));
        if (expectEndOfStatement()) {
            statement.setBody(parseBlockStatement(statement, true));
        }
        return close(statement);
    }

    private ScriptConditionStatement parseElseStatement(boolean elsif) {
        if (liquid && elsif) {
            return parseIfStatement(false, ScriptToken.keyword("else"));
        }

        Token nextToken = peekToken();
        if (!liquid && nextToken.type() == TokenType.IDENTIFIER && "if".equals(getText(nextToken))) {
            ScriptToken elseKeyword = ScriptToken.keyword("else");
            expectAndParseKeywordTo(elseKeyword);
            return parseIfStatement(false, elseKeyword);
        }

        ScriptElseStatement elseStatement = open(new ScriptElseStatement());
        expectAndParseKeywordTo(elseStatement.getElseKeyword());
        if (expectEndOfStatement()) {
            elseStatement.setBody(parseBlockStatement(elseStatement, true));
        }
        return close(elseStatement);
    }

    private ScriptStatement parseExpressionStatement() {
        ScriptExpressionStatement statement = open(new ScriptExpressionStatement());
        ScriptExpression expression = transformKeyword(expectAndParseExpression(statement));

        if (expression instanceof ExpressionAsStatement asStatement) {
            return asStatement.statement;
        }
        statement.setExpression(expression);
        expectEndOfStatement();
        return close(statement);
    }

    private <T extends ScriptForStatement> T parseForStatement(T forStatement) {
        open(forStatement);
        expectAndParseKeywordTo(forStatement.getForOrTableRowKeyword());

        forStatement.setVariable(expectAndParseExpression(forStatement, null, 0, null, ExpressionMode.BASIC_EXPRESSION, true));
        if (forStatement.getVariable() != null) {
            if (!(forStatement.getVariable() instanceof ScriptVariablePath)) {
                logError(forStatement, "Expecting a variable instead of `" + forStatement.getVariable() + "`");
            }

            if (current.type() != TokenType.IDENTIFIER || !"in".equals(getText(current))) {
                logError(forStatement, "Expecting 'in' word instead of `" + getText(current) + "`");
            } else {
                expectAndParseKeywordTo(forStatement.getInKeyword());
            }

            forStatement.setIterator(expectAndParseExpression(forStatement));
            if (expectEndOfStatement()) {
                forStatement.setBody(parseBlockStatement(forStatement, true));
            }
        }
        return close(forStatement);
    }

    private ScriptIfStatement parseIfStatement(boolean invert, ScriptToken elseKeyword) {
        ScriptIfStatement ifStatement = open(new ScriptIfStatement());
        ifStatement.setElseKeyword(elseKeyword);
        ifStatement.setInvert(invert);

        if (liquid && (elseKeyword != null || invert)) {
            // elsif and unless
            ScriptToken keyword = ifStatement.getIfKeyword();
            keyword.setText(getText(current));
            parseKeywordAsIs(keyword);
        } else {
            expectAndParseKeywordTo(ifStatement.getIfKeyword());
        }

        ifStatement.setCondition(expectAndParseExpression(ifStatement, null, 0, null, ExpressionMode.DEFAULT, false));
        if (expectEndOfStatement()) {
            ifStatement.setThen(parseBlockStatement(ifStatement, true));
        }
        return close(ifStatement);
    }

    private ScriptRawStatement parseRawStatement() {
        ScriptRawStatement statement = open(new ScriptRawStatement());
        statement.setEscape(current.type() == TokenType.ESCAPE);

        Token token = current;
        nextToken();
        close(statement);
        statement.setSpanEnd(token.end());
        String raw = getText(token);
        statement.setText(raw == null ? "" : raw);
        return statement;
    }

    private ScriptWhenStatement parseWhenStatement() {
        ScriptWhenStatement whenStatement = open(new ScriptWhenStatement());
        expectAndParseKeywordTo(whenStatement.getWhenKeyword());

        // a, b, c or a || b || c (liquid: a or b or c)
        List<ScriptExpression> values = whenStatement.getValues();
        List<ScriptToken> separators = whenStatement.getSeparators();
        while (isStartOfExpression()) {
            while (!values.isEmpty() && separators.size() < values.size()) {
                separators.add(null);
            }
            ScriptExpression value = parseExpression(whenStatement, null, 0, ExpressionMode.WHEN_EXPRESSION, false);
            if (value == null) {
                break;
            }
            values.add(value);

            if (current.type() == TokenType.COMMA) {
                pushTokenToTrivia();
                nextToken();
                flushTriviasToLastTerminal();
                separators.add(null);
            } else if ((!liquid && current.type() == TokenType.DOUBLE_VERTICAL_BAR)
                || (liquid && current.type() == TokenType.IDENTIFIER && "or".equals(getText(current)))) {
                separators.add(parseToken(current.type()));
            }
        }

        if (values.isEmpty()) {
            logError(current, "When is expecting at least one value.");
        }

        if (expectEndOfStatement()) {
            whenStatement.setBody(parseBlockStatement(whenStatement, true));
        }
        return close(whenStatement);
    }

    private void checkNotInCase(ScriptNode parent, Token token) {
        if (parent instanceof ScriptCaseStatement) {
            logError(token, "Unexpected statement/expression `" + getText(token) + "` in the body of a `case` statement. Only `when`/`else` are expected.");
        }
    }

    private ScriptVariable expectAndParseVariable(ScriptNode parentNode) {
        if (current.type() == TokenType.IDENTIFIER || current.type() == TokenType.IDENTIFIER_SPECIAL) {
            ScriptExpression variableOrLiteral = parseVariable();
            if (variableOrLiteral instanceof ScriptVariable variable) {
                return variable;
            }
            logError(parentNode, "Unexpected variable `" + variableOrLiteral + "`");
        } else {
            logError(parentNode, "Expecting a variable instead of `" + getText(current) + "`");
        }
        return null;
    }

    /**
     * Consumes a statement separator. On any other token, reports it and skips to the next separator so that
     * the following statements are still parsed.
     *
     * @return {@code false} when the end of the input was reached while recovering
     */
    private boolean expectEndOfStatement() {
        TokenType type = current.type();
        if (liquid) {
            if (type == TokenType.CODE_EXIT || (liquidTagSection && type == TokenType.LIQUID_TAG_EXIT)) {
                return true;
            }
        } else if (type == TokenType.NEW_LINE || type == TokenType.CODE_EXIT || type == TokenType.SEMI_COLON || type == TokenType.EOF) {
            if (type == TokenType.NEW_LINE || type == TokenType.SEMI_COLON) {
                pushTokenToTrivia();
                flushTriviasToLastTerminal();
                nextToken();
            }
            return true;
        }

        logError(currentSpan(), "Invalid token found `" + getText(current) + "`. Expecting <EOL>/end of line.");
        return skipToEndOfStatement();
    }

    private boolean skipToEndOfStatement() {
        while (!lexerFailed) {
            switch (current.type()) {
                case EOF -> {
                    return false;
                }
                case CODE_EXIT, LIQUID_TAG_EXIT -> {
                    return true;
                }
                case NEW_LINE, SEMI_COLON -> {
                    pushTokenToTrivia();
                    flushTriviasToLastTerminal();
                    nextToken();
                    return true;
                }
                default -> nextToken();
            }
        }
        return false;
    }

    private ScriptNode findFirstStatementExpectingEnd() {
        for (ScriptNode node : blocks) {
            if (expectStatementEnd(node)) {
                return node;
            }
        }
        return null;
    }

    private static boolean expectStatementEnd(ScriptNode node) {
        return (node instanceof ScriptIfStatement ifStatement && !ifStatement.isElseIf())
            || node instanceof ScriptForStatement
            || node instanceof ScriptCaptureStatement
            || node instanceof ScriptWithStatement
            || node instanceof ScriptWhileStatement
            || node instanceof ScriptWrapStatement
            || node instanceof ScriptCaseStatement
            || node instanceof ScriptFunction
            || node instanceof ScriptAnonymousFunction;
    }

    private ScriptFunction parseFunctionStatement(boolean anonymous) {
        ScriptFunction function = open(new ScriptFunction());
        function.setAnonymous(anonymous);

        int previousExpressionLevel = expressionLevel;
        try {
            expressionLevel = 0;

            if (anonymous) {
                function.setNameOrDoToken(expectAndParseKeywordTo(ScriptToken.keyword("do")));
            } else {
                function.setFuncToken(expectAndParseKeywordTo(ScriptToken.keyword("func")));
                function.setNameOrDoToken(expectAndParseVariable(function));
            }

            if (current.type() == TokenType.OPEN_PAREN) {
                parseFunctionParameters(function);
            }

            expectEndOfStatement();
            // an anonymous function is followed by the rest of its expression, not by an end of statement
            function.setBody(parseBlockStatement(function, !anonymous));
        } finally {
            expressionLevel = previousExpressionLevel;
        }
        return close(function);
    }

    private void parseFunctionParameters(ScriptFunction function) {
        function.setOpenParen(parseToken(TokenType.OPEN_PAREN));
        List<ScriptParameter> parameters = new ArrayList<>();
        boolean hasTripleDot = false;
        boolean hasOptionals = false;

        boolean first = true;
        while (true) {
            if (current.type() == TokenType.CLOSE_PAREN) {
                function.setCloseParen(parseToken(TokenType.CLOSE_PAREN));
                function.setSpanEnd(function.getCloseParen().getSpan().end());
                break;
            }

            if (!first) {
                if (current.type() == TokenType.COMMA) {
                    pushTokenToTrivia();
                    nextToken();
                    flushTriviasToLastTerminal();
                } else {
                    logError(current, "Expecting a comma to separate arguments in a function call.");
                }
            }
            first = false;

            if (!isStartOfExpression()) {
                logError(current, "Expecting an expression for argument function calls instead of this token.");
                break;
            }

            ScriptParameter parameter = open(new ScriptParameter());
            ScriptVariable name = expectAndParseVariable(function);
            if (name == null) {
                break;
            }
            if (name.getScope() != ScriptVariableScope.GLOBAL) {
                logError(name.getSpan(), "Expecting only a simple name parameter for a function");
            }
            parameter.setName(name);

            if (current.type() == TokenType.EQUAL) {
                if (hasTripleDot) {
                    logError(name.getSpan(), "Cannot declare an optional parameter after a variable parameter (`...`).");
                }
                hasOptionals = true;
                parameter.setEqualOrTripleDotToken(new ScriptToken(TokenType.EQUAL));
                expectAndParseTokenTo(parameter.getEqualOrTripleDotToken(), TokenType.EQUAL);
                parameter.setSpanEnd(parameter.getEqualOrTripleDotToken().getSpan().end());

                ScriptExpression defaultValue = expectAndParseExpression(parameter);
                if (defaultValue instanceof ScriptLiteral literal) {
                    parameter.setDefaultValue(literal);
                    parameter.setSpanEnd(literal.getSpan().end());
                } else {
                    logError(name.getSpan(), "Expecting only a literal for an optional parameter value.");
                }
            } else if (current.type() == TokenType.TRIPLE_DOT) {
                if (hasTripleDot) {
                    logError(name.getSpan(), "Cannot declare multiple variable parameters.");
                }
                hasTripleDot = true;
                hasOptionals = true;
                parameter.setEqualOrTripleDotToken(new ScriptToken(TokenType.TRIPLE_DOT));
                expectAndParseTokenTo(parameter.getEqualOrTripleDotToken(), TokenType.TRIPLE_DOT);
                parameter.setSpanEnd(parameter.getEqualOrTripleDotToken().getSpan().end());
            } else {
                if (hasOptionals) {
                    logError(name.getSpan(), "Cannot declare a normal parameter after an optional parameter.");
                }
                parameter.setSpanEnd(name.getSpan().end());
            }

            parameters.add(parameter);
            function.setSpanEnd(parameter.getSpan().end());
        }

        if (function.getCloseParen() == null) {
            logError(current, "Expecting a closing parenthesis for a function call.");
        }
        function.setParameters(parameters);
    }

    private ScriptImportStatement parseImportStatement() {
        ScriptImportStatement statement = open(new ScriptImportStatement());
        expectAndParseKeywordTo(statement.getImportKeyword());
        statement.setExpression(expectAndParseExpression(statement));
        expectEndOfStatement();
        return close(statement);
    }

    private ScriptReadOnlyStatement parseReadOnlyStatement() {
        ScriptReadOnlyStatement statement = open(new ScriptReadOnlyStatement());
        expectAndParseKeywordTo(statement.getReadOnlyKeyword());
        statement.setVariable(expectAndParseVariable(statement));
        expectEndOfStatement();
        return close(statement);
    }

    private ScriptReturnStatement parseReturnStatement() {
        ScriptReturnStatement statement = open(new ScriptReturnStatement());
        expectAndParseKeywordTo(statement.getRetKeyword());
        if (isStartOfExpression()) {
            statement.setExpression(parseExpression(statement, null, 0, ExpressionMode.DEFAULT, true));
        }
        expectEndOfStatement();
        return close(statement);
    }

    private ScriptWhileStatement parseWhileStatement() {
        ScriptWhileStatement statement = open(new ScriptWhileStatement());
        expectAndParseKeywordTo(statement.getWhileKeyword());
        statement.setCondition(expectAndParseExpression(statement, null, 0, null, ExpressionMode.DEFAULT, false));
        if (expectEndOfStatement()) {
            statement.setBody(parseBlockStatement(statement, true));
        }
        return close(statement);
    }

    private ScriptWithStatement parseWithStatement() {
        ScriptWithStatement statement = open(new ScriptWithStatement());
        expectAndParseKeywordTo(statement.getWithKeyword());
        statement.setName(expectAndParseExpression(statement));
        if (expectEndOfStatement()) {
            statement.setBody(parseBlockStatement(statement, true));
        }
        return close(statement);
    }

    private ScriptWrapStatement parseWrapStatement() {
        ScriptWrapStatement statement = open(new ScriptWrapStatement());
        expectAndParseKeywordTo(statement.getWrapKeyword());
        statement.setTarget(expectAndParseExpression(statement));
        if (expectEndOfStatement()) {
            statement.setBody(parseBlockStatement(statement, true));
        }
        return close(statement);
    }

    /**
     * The content after a front matter starts after the line of its closing marker: leading whitespace of the
     * first raw statement is moved to trivia.
     */
    private void fixRawStatementAfterFrontMatter(ScriptPage page) {
        if (page.getBody() == null || page.getBody().getStatements().isEmpty()
            || !(page.getBody().getStatements().get(0) instanceof ScriptRawStatement raw)) {
            return;
        }
        String rawText = raw.getText();
        int start = 0;
        while (start < rawText.length() && Character.isWhitespace(rawText.charAt(start))) {
            start++;
        }
        if (start == 0) {
            return;
        }
        if (keepTrivia) {
            raw.addTrivia(new ScriptTrivia(raw.getSpan(), ScriptTriviaType.WHITESPACE, rawText.substring(0, start)), true);
        }
        raw.setText(rawText.substring(start));
    }

    // ---------------------------------------------------------------------------------------------------------
    // Expressions
    // ---------------------------------------------------------------------------------------------------------

    private ScriptExpression parseExpression(ScriptNode parentNode, ScriptExpression parentExpression, int precedence, ExpressionMode mode, boolean allowAssignment) {
        boolean hasAnonymousFunction = false;
        int expressionCount = 0;
        expressionLevel++;
        int depthBeforeEntering = expressionDepth;
        int enteringPrecedence = precedence;

        ExpressionMode originalMode = mode;
        if (mode == ExpressionMode.WHEN_EXPRESSION) {
            mode = ExpressionMode.DEFAULT;
        }

        enterExpression();
        try {
            ScriptFunctionCall functionCall = null;

            parseOperand:
            while (true) {
                expressionCount++;
                ScriptExpression leftOperand = null;
                boolean leftOperandClosed = false;

                switch (current.type()) {
                    case IDENTIFIER, IDENTIFIER_SPECIAL -> {
                        leftOperand = parseVariable();

                        // liquid filter arguments follow a colon: `| append: "x"`
                        if (liquid && parentNode instanceof ScriptPipeCall && current.type() == TokenType.COLON) {
                            pushPunctuationToTrivia();
                            nextToken();
                            flushTriviasToLastTerminal();
                        }

                        if (leftOperand instanceof ScriptVariable variable && variable.getScope() == ScriptVariableScope.LOCAL && "$".equals(variable.getName())) {
                            if (expressionCount != 1 || expressionLevel > 1) {
                                logError("Cannot use block delegate $$ in a nested expression");
                            }
                            if (!(parentNode instanceof ScriptExpressionStatement)) {
                                logError(parentNode, "Cannot use block delegate $$ outside an expression statement");
                            }
                            return leftOperand;
                        }
                    }
                    case INTEGER -> leftOperand = parseInteger();
                    case HEXA_INTEGER -> leftOperand = parseHexaInteger();
                    case BINARY_INTEGER -> leftOperand = parseBinaryInteger();
                    case FLOAT -> leftOperand = parseFloat();
                    case STRING -> leftOperand = parseString();
                    case IMPLICIT_STRING -> leftOperand = parseImplicitString();
                    case VERBATIM_STRING -> leftOperand = parseVerbatimString();
                    case BEGIN_INTERPOLATED_STRING -> leftOperand = parseInterpolatedString();
                    case OPEN_PAREN -> leftOperand = parseParenthesis();
                    case OPEN_BRACE -> leftOperand = parseObjectInitializer();
                    case OPEN_BRACKET -> leftOperand = parseArrayInitializer();
                    case DOUBLE_PLUS, DOUBLE_MINUS -> leftOperand = parseIncrementDecrementExpression();
                    default -> {
                        if (isStartingAsUnaryExpression()) {
                            leftOperand = parseUnaryExpression();
                        }
                    }
                }

                if (leftOperand == null) {
                    if (functionCall != null) {
                        logError("Unexpected token `" + getText(current) + "` while parsing function call `" + functionCall + "`");
                    } else {
                        logError("Unexpected token `" + getText(current) + "` while parsing expression");
                    }
                    return null;
                }

                if (leftOperand instanceof ScriptAnonymousFunction) {
                    hasAnonymousFunction = true;
                }

                while (!hasAnonymousFunction) {
                    if (liquid && current.type() == TokenType.COMMA && functionCall != null) {
                        pushTokenToTrivia();
                        nextToken();
                        flushTriviasToLastTerminal();
                    }

                    if (current.type() == TokenType.DOT || (!liquid && current.type() == TokenType.QUESTION_DOT)) {
                        Token nextToken = peekToken();
                        if (nextToken.type() != TokenType.IDENTIFIER) {
                            logError(nextToken, "Invalid token `" + nextToken.type() + "`. The dot operator is expected to be followed by a plain identifier");
                            return leftOperand;
                        }
                        ScriptToken dotToken = parseToken(current.type());
                        String memberText = getText(current);
                        if ((memberText.equals("empty") || memberText.equals("blank")) && peekToken().type() == TokenType.QUESTION) {
                            ScriptIsEmptyExpression isEmpty = open(new ScriptIsEmptyExpression());
                            isEmpty.setSpan(leftOperand.getSpan());
                            isEmpty.setDotToken(dotToken);
                            ScriptExpression member = parseVariable();
                            if (!(member instanceof ScriptVariable memberVariable)) {
                                logError("Unexpected literal member `" + member + "`");
                                return null;
                            }
                            isEmpty.setMember(memberVariable);
                            expectAndParseTokenTo(isEmpty.getQuestionToken(), TokenType.QUESTION);
                            isEmpty.setTarget(leftOperand);
                            leftOperand = close(isEmpty);
                        } else {
                            ScriptMemberExpression memberExpression = open(new ScriptMemberExpression());
                            memberExpression.setSpan(leftOperand.getSpan());
                            memberExpression.setDotToken(dotToken);
                            memberExpression.setTarget(leftOperand);

                            // a?.b.c stays null-conditional after the first member
                            if (leftOperand instanceof ScriptMemberExpression nested && nested.isNullConditional()) {
                                dotToken.setTokenType(TokenType.QUESTION_DOT);
                            }

                            ScriptExpression member = parseVariable();
                            if (!(member instanceof ScriptVariable memberVariable)) {
                                logError("Unexpected literal member `" + member + "`");
                                return null;
                            }
                            memberExpression.setMember(memberVariable);
                            leftOperand = close(memberExpression);
                        }
                        continue;
                    }

                    if (current.type() == TokenType.DOUBLE_PLUS || current.type() == TokenType.DOUBLE_MINUS) {
                        TokenType operatorType = current.type();
                        if (!(leftOperand instanceof ScriptVariablePath)) {
                            logError("The operand of an increment or decrement operator must be a variable, property or indexer");
                        }
                        ScriptIncrementDecrementExpression postExpression = new ScriptIncrementDecrementExpression();
                        postExpression.setSpan(leftOperand.getSpan());
                        postExpression.setRight(leftOperand);
                        postExpression.setOperatorToken(parseToken(operatorType));
                        postExpression.setOperator(operatorType == TokenType.DOUBLE_PLUS ? ScriptUnaryOperator.INCREMENT : ScriptUnaryOperator.DECREMENT);
                        postExpression.setPost(true);
                        postExpression.setSpanEnd(previous.end());
                        leftOperand = postExpression;
                    }

                    // an indexer only applies to a path, a literal or a call when no whitespace precedes the bracket
                    if (current.type() == TokenType.OPEN_BRACKET
                        && (leftOperand instanceof ScriptVariablePath || leftOperand instanceof ScriptLiteral || leftOperand instanceof ScriptFunctionCall)
                        && !isPreviousCharWhitespace()) {
                        ScriptIndexerExpression indexer = open(new ScriptIndexerExpression());
                        indexer.setSpan(leftOperand.getSpan());
                        indexer.setTarget(leftOperand);

                        expectAndParseTokenTo(indexer.getOpenBracket(), TokenType.OPEN_BRACKET);
                        indexer.setIndex(expectAndParseExpression(indexer, functionCall, 0,
                            "Expecting <index_expression> instead of `" + getText(current) + "`", mode, true));

                        if (current.type() != TokenType.CLOSE_BRACKET) {
                            logError("Unexpected `" + getText(current) + "`. Expecting ']'");
                        } else {
                            expectAndParseTokenTo(indexer.getCloseBracket(), TokenType.CLOSE_BRACKET);
                        }

                        leftOperand = close(indexer);
                        continue;
                    }

                    if (mode == ExpressionMode.BASIC_EXPRESSION) {
                        break;
                    }

                    if (mode != ExpressionMode.DEFAULT_NO_NAMED_ARGUMENT && current.type() == TokenType.COLON) {
                        if (!(leftOperand instanceof ScriptVariable name)) {
                            logError(leftOperand.getSpan(), "Expecting a simple global or local variable before `:` in order to create a named argument");
                            break;
                        }
                        ScriptNamedArgument namedArgument = open(new ScriptNamedArgument());
                        namedArgument.setSpanStart(name.getSpan().start());
                        namedArgument.setName(name);
                        namedArgument.setColonToken(parseToken(TokenType.COLON));
                        namedArgument.setValue(expectAndParseExpression(parentNode));
                        close(namedArgument);
                        leftOperand = namedArgument;
                        break;
                    }

                    if (current.type() == TokenType.EQUAL && leftOperand instanceof ScriptFunctionCall call) {
                        ScriptFunction declaration = call.toFunctionDeclaration().orElse(null);
                        if (declaration != null) {
                            if (expressionLevel > 1 || !allowAssignment) {
                                logError(leftOperand, "Creating a function is only allowed for a top level assignment");
                            }
                            declaration.setEqualToken(parseToken(TokenType.EQUAL));
                            declaration.setBody(parseExpressionStatement());
                            declaration.setSpanEnd(declaration.getBody().getSpan().end());
                            leftOperand = new ExpressionAsStatement(declaration);
                            break;
                        }
                    }

                    TokenType assignType = compoundAssignment(current.type());
                    if (assignType != null) {
                        ScriptAssignExpression assign = open(new ScriptAssignExpression());
                        assign.setEqualToken(new ScriptToken(assignType));
                        assign.setSpanStart(leftOperand.getSpan().start());

                        if (!(leftOperand instanceof ScriptVariablePath) || functionCall != null || expressionLevel > 1 || !allowAssignment) {
                            logError(assign, "Expression is only allowed for a top level assignment");
                        }

                        expectAndParseTokenTo(assign.getEqualToken(), assignType);
                        assign.setTarget(transformKeyword(leftOperand));
                        assign.setValue(expectAndParseExpression(assign, parentExpression));
                        leftOperand = close(assign);
                        break;
                    }

                    ScriptBinaryOperator binaryOperator = ScriptBinaryOperator.fromToken(current.type(), scientific);
                    if (binaryOperator == null && liquid && current.type() == TokenType.IDENTIFIER) {
                        binaryOperator = ScriptBinaryOperator.fromLiquidWord(getText(current));
                    }
                    if (binaryOperator != null) {
                        if (originalMode == ExpressionMode.WHEN_EXPRESSION && binaryOperator == ScriptBinaryOperator.OR) {
                            break;
                        }

                        int newPrecedence = binaryOperator.precedence();
                        if (newPrecedence <= precedence) {
                            if (enteringPrecedence == 0) {
                                precedence = enteringPrecedence;
                                continue;
                            }
                            break;
                        }

                        // counts toward the depth limit, restored when this expression is left
                        enterExpression();
                        ScriptBinaryExpression binary = open(new ScriptBinaryExpression());
                        binary.setSpan(leftOperand.getSpan());
                        binary.setLeft(leftOperand);
                        binary.setOperator(binaryOperator);
                        binary.setOperatorToken(parseToken(current.type()));
                        binary.setRight(expectAndParseExpression(binary, functionCall != null ? functionCall : parentExpression, newPrecedence,
                            "Expecting an <expression> to the right of the operator instead of `" + getText(current) + "`", mode, true));
                        leftOperand = close(binary);
                        continue;
                    }

                    if (!liquid && current.type() == TokenType.QUESTION) {
                        if (precedence > 0) {
                            break;
                        }

                        if (functionCall != null) {
                            functionCall.addArgument(leftOperand);
                            close(functionCall);
                            leftOperand = functionCall;
                            functionCall = null;
                        }

                        ScriptConditionalExpression conditional = open(new ScriptConditionalExpression());
                        conditional.setSpan(leftOperand.getSpan());
                        conditional.setCondition(leftOperand);
                        expectAndParseTokenTo(conditional.getQuestionToken(), TokenType.QUESTION);
                        conditional.setThenValue(expectAndParseExpression(conditional, null, 0, null, ExpressionMode.DEFAULT_NO_NAMED_ARGUMENT, true));
                        expectAndParseTokenTo(conditional.getColonToken(), TokenType.COLON);
                        conditional.setElseValue(expectAndParseExpression(conditional, null, 0, null, ExpressionMode.DEFAULT_NO_NAMED_ARGUMENT, true));
                        close(conditional);
                        leftOperand = conditional;
                        break;
                    }

                    if (isStartOfExpression()) {
                        if (parentExpression != null) {
                            break;
                        }

                        ScriptForStatement namedArguments = parentNode instanceof ScriptForStatement forStatement ? forStatement : null;
                        if (!scientific && current.type() == TokenType.IDENTIFIER
                            && (namedArguments != null || (!liquid && peekToken().type() == TokenType.COLON))) {
                            if (namedArguments == null) {
                                if (functionCall == null) {
                                    functionCall = open(new ScriptFunctionCall());
                                    functionCall.setTarget(leftOperand);
                                    functionCall.setSpanStart(leftOperand.getSpan().start());
                                } else {
                                    functionCall.getArguments().add(leftOperand);
                                }
                            }
                            close(leftOperand);
                            leftOperandClosed = true;

                            parseNamedArguments(parentNode, namedArguments, functionCall);

                            if (namedArguments != null || !isStartOfExpression()) {
                                if (functionCall != null) {
                                    leftOperand = functionCall;
                                    functionCall = null;
                                }
                                break;
                            }
                            // positional arguments may follow named ones
                            continue parseOperand;
                        }

                        boolean explicitCall = current.type() == TokenType.OPEN_PAREN && !isPreviousCharWhitespace();
                        if (functionCall == null || explicitCall) {
                            if (scientific && !explicitCall) {
                                // implicit multiplication: 2x
                                int newPrecedence = ScriptBinaryOperator.PRECEDENCE_OF_MULTIPLY;
                                if (newPrecedence <= precedence) {
                                    if (enteringPrecedence == 0) {
                                        precedence = enteringPrecedence;
                                        continue;
                                    }
                                    break;
                                }

                                enterExpression();
                                ScriptBinaryExpression binary = open(new ScriptBinaryExpression());
                                binary.setSpan(leftOperand.getSpan());
                                binary.setLeft(leftOperand);
                                binary.setOperator(ScriptBinaryOperator.MULTIPLY);
                                binary.setRight(expectAndParseExpression(binary, functionCall != null ? functionCall : parentExpression, newPrecedence,
                                    "Expecting an <expression> to the right of the operator instead of `" + getText(current) + "`", ExpressionMode.DEFAULT, true));
                                leftOperand = close(binary);
                                continue;
                            }

                            ScriptFunctionCall pendingFunctionCall = functionCall;
                            functionCall = open(new ScriptFunctionCall());
                            functionCall.setTarget(leftOperand);

                            if (liquid && options.isQualifyLiquidFunctions()) {
                                qualifyLiquidFunctionCall(functionCall);
                            }
                            functionCall.setSpanStart(leftOperand.getSpan().start());

                            if (explicitCall) {
                                parseCallArguments(functionCall);
                                leftOperand = functionCall;
                                functionCall = pendingFunctionCall;
                                continue;
                            }
                        } else {
                            functionCall.addArgument(leftOperand);
                            if (leftOperand instanceof ScriptAnonymousFunction) {
                                break;
                            }
                        }
                        continue parseOperand;
                    }

                    if (enteringPrecedence > 0) {
                        break;
                    }

                    // `1 | math.abs`: a filter without arguments is still a call
                    if (!scientific && parentNode instanceof ScriptPipeCall && functionCall == null && leftOperand instanceof ScriptVariablePath) {
                        ScriptFunctionCall call = open(new ScriptFunctionCall());
                        call.setTarget(leftOperand);
                        call.setSpan(leftOperand.getSpan());
                        if (liquid && options.isQualifyLiquidFunctions()) {
                            qualifyLiquidFunctionCall(call);
                        }
                        leftOperand = call;
                    }

                    if ((!scientific && current.type() == TokenType.VERTICAL_BAR) || current.type() == TokenType.PIPE_GREATER) {
                        if (functionCall != null) {
                            functionCall.addArgument(leftOperand);
                            leftOperand = functionCall;
                            functionCall = null;
                        }

                        ScriptPipeCall pipe = open(new ScriptPipeCall());
                        pipe.setSpanStart(leftOperand.getSpan().start());
                        pipe.setFrom(leftOperand);

                        // a pipe may continue on the next line
                        allowNewLineLevel++;
                        pipe.setPipeToken(parseToken(current.type()));
                        allowNewLineLevel--;

                        pipe.setTo(expectAndParseExpression(pipe));
                        return close(pipe);
                    }

                    break;
                }

                if (functionCall != null) {
                    functionCall.addArgument(leftOperand);
                    return functionCall;
                }

                return leftOperandClosed ? leftOperand : close(leftOperand);
            }
        } finally {
            leaveExpression();
            expressionDepth = depthBeforeEntering;
            expressionLevel--;
        }
    }

    private void parseNamedArguments(ScriptNode parentNode, ScriptForStatement container, ScriptFunctionCall functionCall) {
        while (current.type() == TokenType.IDENTIFIER && (container != null || peekToken().type() == TokenType.COLON)) {
            ScriptNamedArgument argument = open(new ScriptNamedArgument());

            ScriptExpression name = parseVariable();
            if (!(name instanceof ScriptVariable variable)) {
                logError(name.getSpan(), "Invalid identifier passed as a named argument. Expecting a simple variable name");
                break;
            }
            argument.setName(variable);

            if (container != null) {
                container.getNamedArguments().add(close(argument));
            } else {
                functionCall.getArguments().add(argument);
            }

            // without a colon, the argument is a flag
            if (current.type() == TokenType.COLON) {
                argument.setColonToken(new ScriptToken(TokenType.COLON));
                expectAndParseTokenTo(argument.getColonToken(), TokenType.COLON);
                argument.setValue(expectAndParseExpression(parentNode, null, 0, null, ExpressionMode.BASIC_EXPRESSION, true));
                if (argument.getValue() != null) {
                    argument.setSpanEnd(argument.getValue().getSpan().end());
                }
            }

            if (functionCall != null) {
                functionCall.setSpanEnd(argument.getSpan().end());
                if (argument.getValue() instanceof ScriptAnonymousFunction) {
                    break;
                }
            }
        }
    }

    private void parseCallArguments(ScriptFunctionCall functionCall) {
        functionCall.setExplicitCall(true);
        functionCall.setOpenParen(parseToken(TokenType.OPEN_PAREN));

        boolean first = true;
        while (true) {
            if (current.type() == TokenType.CLOSE_PAREN) {
                functionCall.setCloseParen(parseToken(TokenType.CLOSE_PAREN));
                functionCall.setSpanEnd(functionCall.getCloseParen().getSpan().end());
                break;
            }

            if (!first) {
                if (current.type() == TokenType.COMMA) {
                    pushTokenToTrivia();
                    nextToken();
                    flushTriviasToLastTerminal();
                } else {
                    logError(current, "Expecting a comma to separate arguments in a function call.");
                }
            }
            first = false;

            if (!isStartOfExpression()) {
                logError(current, "Expecting an expression for argument function calls instead of this token.");
                break;
            }
            ScriptExpression argument = parseExpression(functionCall, null, 0, ExpressionMode.DEFAULT, true);
            if (argument == null) {
                break;
            }
            functionCall.getArguments().add(argument);
            functionCall.setSpanEnd(argument.getSpan().end());
        }

        if (functionCall.getCloseParen() == null) {
            logError(current, "Expecting a closing parenthesis for a function call.");
        }
    }

    private static TokenType compoundAssignment(TokenType type) {
        return switch (type) {
            case EQUAL, PLUS_EQUAL, MINUS_EQUAL, ASTERISK_EQUAL, DIVIDE_EQUAL, DOUBLE_DIVIDE_EQUAL, PERCENT_EQUAL -> type;
            default -> null;
        };
    }

    private ScriptExpression parseArrayInitializer() {
        ScriptArrayInitializerExpression array = open(new ScriptArrayInitializerExpression());

        // before consuming `[` so that a newline right after it is skipped
        allowNewLineLevel++;
        expectAndParseTokenTo(array.getOpenBracketToken(), TokenType.OPEN_BRACKET);

        while (current.type() != TokenType.CLOSE_BRACKET) {
            ScriptExpression expression = expectAndParseExpression(array);
            if (expression == null) {
                break;
            }
            array.getValues().add(expression);

            if (current.type() != TokenType.COMMA) {
                break;
            }
            pushTokenToTrivia();
            nextToken();
            flushTriviasToLastTerminal();
        }

        // before consuming `]` so that a newline after it ends the statement
        allowNewLineLevel--;
        expectAndParseTokenTo(array.getCloseBracketToken(), TokenType.CLOSE_BRACKET);
        return close(array);
    }

    private ScriptExpression parseObjectInitializer() {
        ScriptObjectInitializerExpression object = open(new ScriptObjectInitializerExpression());

        allowNewLineLevel++;
        expectAndParseTokenTo(object.getOpenBrace(), TokenType.OPEN_BRACE);

        boolean expectingEnd = false;
        boolean hasMemberErrors = false;
        while (current.type() != TokenType.CLOSE_BRACE) {
            if (expectingEnd || (current.type() != TokenType.IDENTIFIER && current.type() != TokenType.STRING)) {
                hasMemberErrors = true;
                logError("Unexpected token `" + getText(current) + "` while parsing object initializer. Expecting a simple identifier for the member name.");
                break;
            }

            Token positionBefore = current;
            ScriptObjectMember member = open(new ScriptObjectMember());

            ScriptExpression name = current.type() == TokenType.IDENTIFIER ? parseVariable() : parseString();
            ScriptVariable variable = name instanceof ScriptVariable v ? v : null;
            ScriptLiteral literal = name instanceof ScriptLiteral l ? l : null;

            if (variable == null && literal == null) {
                hasMemberErrors = true;
                logError(positionBefore, "Unexpected member type `" + name + "/" + name.syntaxName() + "` found for object initializer member name");
                break;
            }
            if (literal != null && !(literal.getValue() instanceof String)) {
                Object value = literal.getValue();
                hasMemberErrors = true;
                logError(positionBefore, "Invalid literal member `" + value + "/" + (value == null ? null : value.getClass().getName())
                    + "` found for object initializer member name. Only literal string or identifier name are allowed");
                break;
            }
            if (variable != null && variable.getScope() != ScriptVariableScope.GLOBAL) {
                hasMemberErrors = true;
                logError("Expecting a simple identifier for member names");
                break;
            }

            if (current.type() != TokenType.COLON) {
                hasMemberErrors = true;
                logError("Unexpected token `" + getText(current) + "` Expecting a colon : after identifier `"
                    + (variable == null ? null : variable.getName()) + "` for object initializer member name");
                break;
            }

            expectAndParseTokenTo(member.getColonToken(), TokenType.COLON);
            member.setName(name);

            if (!isStartOfExpression()) {
                hasMemberErrors = true;
                logError("Unexpected token `" + getText(current) + "`. Expecting an expression for the value of the member.");
                break;
            }

            ScriptExpression value = parseExpression(object, null, 0, ExpressionMode.DEFAULT, true);
            if (value == null) {
                hasMemberErrors = true;
                break;
            }
            member.setValue(value);
            close(member);
            member.setSpanEnd(value.getSpan().end());
            object.getMembers().add(member);

            if (current.type() == TokenType.COMMA) {
                pushTokenToTrivia();
                flushTriviasToLastTerminal();
                nextToken();
            } else {
                expectingEnd = true;
            }
        }

        allowNewLineLevel--;

        if (!hasMemberErrors) {
            expectAndParseTokenTo(object.getCloseBrace(), TokenType.CLOSE_BRACE);
        }
        return close(object);
    }

    private ScriptExpression parseParenthesis() {
        ScriptNestedExpression nested = open(new ScriptNestedExpression());
        expectAndParseTokenTo(nested.getOpenParen(), TokenType.OPEN_PAREN);
        nested.setExpression(expectAndParseExpression(nested));

        if (current.type() == TokenType.CLOSE_PAREN) {
            expectAndParseTokenTo(nested.getCloseParen(), TokenType.CLOSE_PAREN);
        } else {
            logError(current, "Invalid token `" + getText(current) + "`. Expecting a closing `)`.");
        }
        return close(nested);
    }

    private ScriptToken parseToken(TokenType type) {
        ScriptToken token = open(new ScriptToken(current.type(), current.type() == type ? getText(current) : type.toText()));
        if (current.type() != type) {
            logError(currentSpan(), "Unexpected token found `" + getText(current) + "` while expecting `" + type.toText() + "`.");
        }
        nextToken();
        return close(token);
    }

    private void expectAndParseTokenTo(ScriptToken existing, TokenType expected) {
        open(existing);
        if (current.type() != expected) {
            logError(currentSpan(), "Unexpected token found `" + getText(current) + "` while expecting `" + expected.toText() + "`.");
        } else if (!expected.hasText()) {
            existing.setText(getText(current));
        }
        nextToken();
        close(existing);
    }

    private ScriptToken expectAndParseKeywordTo(ScriptToken keyword) {
        open(keyword);
        if (!current.match(keyword.getText(), text)) {
            logError(currentSpan(), "Unexpected keyword found `" + getText(current) + "` while expecting `" + keyword.getText() + "`.");
        }
        nextToken();
        close(keyword);
        return keyword;
    }

    /**
     * Consumes the current token into a keyword whose text was already set from it.
     */
    private void parseKeywordAsIs(ScriptToken keyword) {
        open(keyword);
        nextToken();
        close(keyword);
    }

    private ScriptExpression parseIncrementDecrementExpression() {
        TokenType type = current.type();
        ScriptIncrementDecrementExpression expression = open(new ScriptIncrementDecrementExpression());
        expression.setOperatorToken(parseToken(type));
        expression.setOperator(type == TokenType.DOUBLE_PLUS ? ScriptUnaryOperator.INCREMENT : ScriptUnaryOperator.DECREMENT);
        expression.setRight(expectAndParseExpression(expression, null, expression.getOperator().precedence(), null, ExpressionMode.DEFAULT, true));
        ScriptExpression operand = expression.getRight();
        // a chain of operators reports its innermost invalid operand only
        if (operand != null && operand == invalidIncrementDecrement) {
            invalidIncrementDecrement = expression;
        } else if (!(operand instanceof ScriptVariablePath)) {
            logError("The operand of an increment or decrement operator must be a variable, property or indexer");
            invalidIncrementDecrement = expression;
        }
        return close(expression);
    }

    private ScriptExpression parseUnaryExpression() {
        ScriptUnaryExpression unary = open(new ScriptUnaryExpression());
        TokenType type = current.type();
        unary.setOperatorToken(parseToken(type));

        ScriptUnaryOperator operator = switch (type) {
            case EXCLAMATION -> ScriptUnaryOperator.NOT;
            case MINUS -> ScriptUnaryOperator.NEGATE;
            case PLUS -> ScriptUnaryOperator.PLUS;
            case ARROBA -> ScriptUnaryOperator.FUNCTION_ALIAS;
            case CARET -> scientific ? null : ScriptUnaryOperator.FUNCTION_PARAMETERS_EXPAND;
            case DOUBLE_CARET -> scientific ? ScriptUnaryOperator.FUNCTION_PARAMETERS_EXPAND : null;
            default -> null;
        };
        if (operator == null) {
            logError("Unexpected token `" + type + "` for unary expression");
            return close(unary);
        }
        unary.setOperator(operator);
        unary.setRight(expectAndParseExpression(unary, null, operator.precedence(), null, ExpressionMode.DEFAULT, true));
        return close(unary);
    }

    /**
     * In liquid, a variable named after a keyword ({@code assign case = 1}) is wrapped in parentheses so that it
     * reads as a variable.
     */
    private ScriptExpression transformKeyword(ScriptExpression expression) {
        if (liquid && expression instanceof ScriptVariablePath path && !(expression instanceof ScriptNestedExpression)
            && path.getFirstPath() != null && KEYWORDS.contains(path.getFirstPath())) {
            ScriptNestedExpression nested = ScriptNestedExpression.wrap(expression, keepTrivia);
            if (keepTrivia && lastTerminalWithTrivias != null && lastTerminalWithTrivias == ScriptNestedExpression.lastTerminal(expression)) {
                lastTerminalWithTrivias = nested.getCloseParen();
            }
            return nested;
        }
        return expression;
    }

    private void qualifyLiquidFunctionCall(ScriptFunctionCall functionCall) {
        if (!(functionCall.getTarget() instanceof ScriptVariable liquidTarget)) {
            return;
        }
        String[] qualified = LiquidBuiltins.toQualifiedName(liquidTarget.getName());
        if (qualified == null) {
            return;
        }

        ScriptVariable target = ScriptVariable.global(qualified[0]);
        target.setSpan(liquidTarget.getSpan());
        ScriptVariable member = ScriptVariable.global(qualified[1]);
        member.setSpan(liquidTarget.getSpan());

        ScriptMemberExpression memberExpression = new ScriptMemberExpression();
        memberExpression.setSpan(liquidTarget.getSpan());
        memberExpression.setTarget(target);
        memberExpression.setMember(member);

        if (keepTrivia && liquidTarget.getTrivias() != null) {
            target.addTrivias(liquidTarget.getTrivias().getBefore(), true);
            member.addTrivias(liquidTarget.getTrivias().getAfter(), false);
        }
        if (lastTerminalWithTrivias == liquidTarget) {
            lastTerminalWithTrivias = member;
        }
        functionCall.setTarget(memberExpression);
    }

    private ScriptExpression expectAndParseExpression(ScriptNode parentNode) {
        return expectAndParseExpression(parentNode, null);
    }

    private ScriptExpression expectAndParseExpression(ScriptNode parentNode, ScriptExpression parentExpression) {
        return expectAndParseExpression(parentNode, parentExpression, 0, null, ExpressionMode.DEFAULT, true);
    }

    private ScriptExpression expectAndParseExpression(ScriptNode parentNode, ScriptExpression parentExpression, int newPrecedence,
                                                      String message, ExpressionMode mode, boolean allowAssignment) {
        if (isStartOfExpression()) {
            return parseExpression(parentNode, parentExpression, newPrecedence, mode, allowAssignment);
        }
        logError(parentNode, currentSpan(), message != null ? message : "Expecting <expression> instead of `" + getText(current) + "`");
        return null;
    }

    public boolean isStartOfExpression() {
        if (isStartingAsUnaryExpression()) {
            return true;
        }
        return switch (current.type()) {
            case IDENTIFIER, IDENTIFIER_SPECIAL, INTEGER, HEXA_INTEGER, BINARY_INTEGER, FLOAT, STRING, IMPLICIT_STRING,
                VERBATIM_STRING, BEGIN_INTERPOLATED_STRING, OPEN_PAREN, OPEN_BRACE, OPEN_BRACKET -> true;
            default -> false;
        };
    }

    private boolean isStartingAsUnaryExpression() {
        return switch (current.type()) {
            case EXCLAMATION, MINUS, PLUS, ARROBA, DOUBLE_PLUS, DOUBLE_MINUS -> true;
            // in scientific, ^ is the power operator
            case CARET -> !scientific;
            case DOUBLE_CARET -> scientific;
            default -> false;
        };
    }

    // ---------------------------------------------------------------------------------------------------------
    // Terminals
    // ---------------------------------------------------------------------------------------------------------

    private ScriptExpression parseVariableOrLiteral() {
        return switch (current.type()) {
            case IDENTIFIER, IDENTIFIER_SPECIAL -> parseVariable();
            case INTEGER -> parseInteger();
            case HEXA_INTEGER -> parseHexaInteger();
            case BINARY_INTEGER -> parseBinaryInteger();
            case FLOAT -> parseFloat();
            case STRING -> parseString();
            case IMPLICIT_STRING -> parseImplicitString();
            case VERBATIM_STRING -> parseVerbatimString();
            case BEGIN_INTERPOLATED_STRING -> parseInterpolatedString();
            default -> {
                logError(current, "Unexpected token found `" + getText(current) + "` while parsing a variable or literal");
                yield null;
            }
        };
    }

    private static boolean isVariableOrLiteral(Token token) {
        return switch (token.type()) {
            case IDENTIFIER, IDENTIFIER_SPECIAL, INTEGER, HEXA_INTEGER, BINARY_INTEGER, FLOAT, STRING, IMPLICIT_STRING,
                VERBATIM_STRING, BEGIN_INTERPOLATED_STRING -> true;
            default -> false;
        };
    }

    private ScriptLiteral openLiteral() {
        ScriptLiteral literal = open(new ScriptLiteral());
        literal.setSourceText(getText(current));
        return literal;
    }

    private ScriptLiteral parseFloat() {
        ScriptLiteral literal = openLiteral();
        String tokenText = getText(current);
        String number = tokenText.replace("_", "");
        char suffix = number.charAt(number.length() - 1);
        String digits = Character.isLetter(suffix) && suffix != 'e' && suffix != 'E' ? number.substring(0, number.length() - 1) : number;

        if (suffix == 'f' || suffix == 'F') {
            try {
                literal.setValue(Float.parseFloat(digits));
            } catch (NumberFormatException e) {
                logError("Unable to parse float value `" + tokenText + "`");
            }
        } else {
            boolean explicitDecimal = suffix == 'm' || suffix == 'M';
            try {
                if (explicitDecimal || (options.isParseFloatAsDecimal() && suffix != 'd' && suffix != 'D')) {
                    literal.setValue(new BigDecimal(digits));
                } else {
                    literal.setValue(Double.parseDouble(digits));
                }
            } catch (NumberFormatException e) {
                logError("Unable to parse double value `" + tokenText + "`");
            }
        }

        nextToken();
        return close(literal);
    }

    private ScriptLiteral parseImplicitString() {
        ScriptLiteral literal = openLiteral();
        literal.setValue(getText(current));
        nextToken();
        return close(literal);
    }

    private ScriptLiteral parseInteger() {
        ScriptLiteral literal = openLiteral();
        String number = getText(current).replace("_", "");
        try {
            literal.setValue(narrow(new BigInteger(number)));
        } catch (NumberFormatException e) {
            // 1e3 is an integer written with an exponent
            try {
                literal.setValue(narrow(new BigDecimal(number).toBigIntegerExact()));
            } catch (NumberFormatException | ArithmeticException inner) {
                logError("Unable to parse the integer " + number);
            }
        }
        nextToken();
        return close(literal);
    }

    private ScriptLiteral parseHexaInteger() {
        ScriptLiteral literal = openLiteral();
        String number = getText(current).substring(2).replace("_", "");
        boolean unsigned = false;
        if (number.endsWith("u") || number.endsWith("U")) {
            number = number.substring(0, number.length() - 1);
            unsigned = true;
        }
        try {
            literal.setValue(fromUnsignedBits(new BigInteger(number, 16), unsigned));
        } catch (NumberFormatException e) {
            logError("Unable to parse the integer " + number);
        }
        nextToken();
        return close(literal);
    }

    private ScriptLiteral parseBinaryInteger() {
        ScriptLiteral literal = openLiteral();
        String number = getText(current).replace("_", "");
        boolean unsigned = false;
        if (number.endsWith("u") || number.endsWith("U")) {
            number = number.substring(0, number.length() - 1);
            unsigned = true;
        }

        int dotIndex = number.indexOf('.');
        if (dotIndex > 2) {
            boolean isFloat = false;
            char suffix = number.charAt(number.length() - 1);
            if (suffix == 'f' || suffix == 'F') {
                number = number.substring(0, number.length() - 1);
                isFloat = true;
            } else if (suffix == 'd' || suffix == 'D') {
                number = number.substring(0, number.length() - 1);
            }

            int exponent = dotIndex - 2;
            BigInteger bits = BigInteger.ZERO;
            int digits = 0;
            for (int i = 2; i < number.length(); i++) {
                char c = number.charAt(i);
                if (c == '.') {
                    continue;
                }
                bits = bits.shiftLeft(1);
                if (c == '1') {
                    bits = bits.setBit(0);
                }
                digits++;
            }
            double value = bits.doubleValue() * Math.pow(2, exponent - digits);
            literal.setValue(isFloat ? (Object) (float) value : (Object) value);
        } else {
            BigInteger bits = BigInteger.ZERO;
            for (int i = 2; i < number.length(); i++) {
                bits = bits.shiftLeft(1);
                if (number.charAt(i) == '1') {
                    bits = bits.setBit(0);
                }
            }
            literal.setValue(fromUnsignedBits(bits, unsigned));
        }

        nextToken();
        return close(literal);
    }

    /**
     * Hex and binary literals are bit patterns: up to 32 bits they read as an int (a long when unsigned), up to
     * 64 bits as a long (a big integer when unsigned).
     */
    private static Object fromUnsignedBits(BigInteger bits, boolean unsigned) {
        if (bits.compareTo(UINT_MAX) <= 0) {
            return unsigned ? (Object) bits.longValue() : (Object) bits.intValue();
        }
        if (bits.compareTo(ULONG_MAX) <= 0) {
            return unsigned ? bits : (Object) bits.longValue();
        }
        return bits;
    }

    private static Object narrow(BigInteger value) {
        if (value.bitLength() < 32) {
            return value.intValue();
        }
        if (value.bitLength() < 64) {
            return value.longValue();
        }
        return value;
    }

    private ScriptLiteral parseString() {
        ScriptLiteral literal = openLiteral();
        int start = current.start().offset();
        int end = current.end().offset();
        literal.setStringQuoteType(text.charAt(start) == '\'' ? ScriptStringQuoteType.SIMPLE_QUOTE : ScriptStringQuoteType.DOUBLE_QUOTE);
        literal.setValue(decodeString(start + 1, end));

        nextToken();
        return close(literal);
    }

    /**
     * Parses {@code $"text {expression} text"}. Each text fragment keeps its exact source, without the braces of
     * the holes around it.
     */
    private ScriptInterpolatedStringExpression parseInterpolatedString() {
        ScriptInterpolatedStringExpression interpolated = open(new ScriptInterpolatedStringExpression());
        interpolated.setQuoteType(text.charAt(current.start().offset() + 1) == '\''
            ? ScriptStringQuoteType.SIMPLE_QUOTE : ScriptStringQuoteType.DOUBLE_QUOTE);

        while (true) {
            boolean first = current.type() == TokenType.BEGIN_INTERPOLATED_STRING;
            int start = current.start().offset();
            int end = current.end().offset();
            boolean hole = current.type() != TokenType.ENDING_INTERPOLATED_STRING && text.charAt(end) == '{';

            ScriptLiteral fragment = open(new ScriptLiteral());
            int sourceStart = first ? start : start + 1;
            fragment.setSourceText(text.substring(sourceStart, hole ? end : end + 1));
            fragment.setValue(decodeString(first ? start + 2 : start + 1, end));
            nextToken();
            interpolated.getParts().add(close(fragment));

            if (!hole) {
                break;
            }

            ScriptInterpolatedExpression expression = open(new ScriptInterpolatedExpression());
            expectAndParseTokenTo(expression.getOpenBrace(), TokenType.OPEN_INTERPOLATED_BRACE);
            expression.setExpression(expectAndParseExpression(expression));
            expectAndParseTokenTo(expression.getCloseBrace(), TokenType.CLOSE_INTERPOLATED_BRACE);
            interpolated.getParts().add(close(expression));

            if (current.type() != TokenType.CONTINUATION_INTERPOLATED_STRING && current.type() != TokenType.ENDING_INTERPOLATED_STRING) {
                logError(current, "Unexpected token `" + getText(current) + "` while parsing an interpolated string");
                break;
            }
        }
        return close(interpolated);
    }

    /**
     * Decodes the escape sequences of a quoted string between {@code from} (inclusive) and {@code to} (exclusive).
     */
    private String decodeString(int from, int to) {
        StringBuilder builder = new StringBuilder(Math.max(0, to - from));
        for (int i = from; i < to; i++) {
            char c = text.charAt(i);
            if (c != '\\') {
                builder.append(c);
                continue;
            }
            i++;
            switch (text.charAt(i)) {
                case '0' -> builder.append('\0');
                case '\n' -> {
                    // line continuation
                }
                case '\r' -> {
                    if (i + 1 < to && text.charAt(i + 1) == '\n') {
                        i++;
                    }
                }
                case '\'' -> builder.append('\'');
                case '"' -> builder.append('"');
                case '\\' -> builder.append('\\');
                case '{' -> builder.append('{');
                case '}' -> builder.append('}');
                case 'b' -> builder.append('\b');
                case 'f' -> builder.append('\f');
                case 'n' -> builder.append('\n');
                case 'r' -> builder.append('\r');
                case 't' -> builder.append('\t');
                case 'v' -> builder.append('\u000b');
                case 'u' -> {
                    builder.append((char) Integer.parseInt(text.substring(i + 1, i + 5), 16));
                    i += 4;
                }
                case 'x' -> {
                    builder.append((char) Integer.parseInt(text.substring(i + 1, i + 3), 16));
                    i += 2;
                }
                default -> logError("Unexpected escape character `" + text.charAt(i) + "` in string");
            }
        }
        return builder.toString();
    }

    private ScriptLiteral parseVerbatimString() {
        ScriptLiteral literal = openLiteral();
        literal.setStringQuoteType(ScriptStringQuoteType.VERBATIM);
        int start = current.start().offset() + 1;
        int end = current.end().offset();
        literal.setValue(text.substring(start, Math.max(start, end)).replace("``", "`"));
        nextToken();
        return close(literal);
    }

    private ScriptExpression parseVariable() {
        Token token = current;
        SourceSpan span = currentSpan();
        String name = getText(token);

        switch (name) {
            case "null", "true", "false" -> {
                ScriptLiteral literal = openLiteral();
                literal.setValue(name.equals("null") ? null : Boolean.valueOf(name));
                nextToken();
                return close(literal);
            }
            case "do" -> {
                ScriptAnonymousFunction function = open(new ScriptAnonymousFunction());
                function.setFunction(parseFunctionStatement(true));
                return close(function);
            }
            case "this" -> {
                if (!liquid) {
                    ScriptThisExpression thisExpression = open(new ScriptThisExpression());
                    expectAndParseKeywordTo(thisExpression.getThisKeyword());
                    return close(thisExpression);
                }
            }
            default -> {
            }
        }

        List<ScriptTrivia> triviasBefore = null;
        if (keepTrivia && !trivias.isEmpty()) {
            triviasBefore = new ArrayList<>(trivias);
            trivias.clear();
        }

        nextToken();
        ScriptVariableScope scope = ScriptVariableScope.GLOBAL;
        String sourceText = null;
        if (name.startsWith("$")) {
            scope = ScriptVariableScope.LOCAL;
            name = name.substring(1);
        } else if (name.equals("for") || name.equals("while") || name.equals("tablerow")
            || (liquid && (name.equals("forloop") || name.equals("tablerowloop")))) {
            if (current.type() == TokenType.DOT) {
                String loopName = validateLoopVariable(token, name);
                if (!loopName.equals(name)) {
                    sourceText = name;
                    name = loopName;
                }
            }
        } else if (liquid && name.equals("continue")) {
            scope = ScriptVariableScope.LOCAL;
            sourceText = name;
        }

        // a liquid identifier with dashes is a member of the current object: this["a-b"]
        if (liquid && name.indexOf('-') >= 0) {
            ScriptThisExpression target = new ScriptThisExpression();
            target.setSpan(span);
            ScriptLiteral index = new ScriptLiteral(name);
            index.setSpan(span);
            index.setSourceText(name);
            ScriptIndexerExpression indexer = new ScriptIndexerExpression();
            indexer.setSpan(span);
            indexer.setTarget(target);
            indexer.setIndex(index);
            indexer.setShorthand(true);

            if (keepTrivia) {
                index.addTrivias(triviasBefore, true);
                flushTrivias(index, false);
                lastTerminalWithTrivias = index;
            }
            return indexer;
        }

        ScriptVariable variable = new ScriptVariable(name, scope);
        variable.setSpan(span);
        variable.setSourceText(sourceText);

        if (keepTrivia) {
            variable.addTrivias(triviasBefore, true);
            flushTrivias(variable, false);
            lastTerminalWithTrivias = variable;
        }
        return variable;
    }

    /**
     * Checks the member that follows a loop variable ({@code for.index}) and returns the canonical loop name.
     */
    private String validateLoopVariable(Token token, String loop) {
        Token memberToken = peekToken();
        if (memberToken.type() != TokenType.IDENTIFIER) {
            logError(token, "Invalid token `" + getText(current) + "`. The loop variable <" + loop + "> dot must be followed by an identifier");
            return loop;
        }

        String member = getText(memberToken);
        if (liquid) {
            switch (member) {
                case "first", "last", "index0", "rindex0", "index", "rindex", "length" -> {
                }
                case "col" -> {
                    if (!loop.equals("tablerowloop")) {
                        logError(token, "The loop variable <" + loop + ".col> is invalid");
                    }
                }
                default -> logError(token, "The liquid loop variable <" + loop + "." + member + "> is not supported");
            }
            return switch (loop) {
                case "forloop" -> "for";
                case "tablerowloop" -> "tablerow";
                default -> loop;
            };
        }

        switch (member) {
            case "first", "even", "odd", "index" -> {
            }
            case "last", "changed", "length", "rindex" -> {
                if (loop.equals("while")) {
                    logError(token, "The loop variable <while." + member + "> is invalid");
                }
            }
            case "col" -> {
                if (!loop.equals("tablerow")) {
                    logError(token, "The loop variable <" + loop + ".col> is invalid");
                }
            }
            default -> logError(token, "The loop variable <" + loop + "." + member + "> is not supported");
        }
        return loop;
    }

    private enum ExpressionMode {
        /** Any expression. */
        DEFAULT,
        /** Any expression, a colon does not start a named argument. */
        DEFAULT_NO_NAMED_ARGUMENT,
        /** Literals, unary, nested, initializers, member and indexer access. */
        BASIC_EXPRESSION,
        /** A value of a when clause: a top-level `||` or `or` separates values. */
        WHEN_EXPRESSION
    }

    private static final class ParsedStatement {
        private ScriptStatement statement;
        private boolean hasEnd;
        private boolean next;
    }

    /**
     * Carries a short function declaration, {@code f(x) = x + 1}, out of expression parsing.
     */
    private static final class ExpressionAsStatement extends ScriptExpression {
        private final ScriptStatement statement;

        private ExpressionAsStatement(ScriptStatement statement) {
            this.statement = statement;
            setSpan(statement.getSpan());
        }

        @Override
        public <R> R accept(ScriptVisitor<R> visitor) {
            throw new UnsupportedOperationException("A function declaration is not an expression");
        }
    }

    private static final class DepthLimitException extends RuntimeException {
        private DepthLimitException(String message) {
            super(message);
        }
    }
}
