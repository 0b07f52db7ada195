package io.proddata.stencil.parsing;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Objects;

/**
 * Splits a template into tokens. Iterating again restarts from the configured start position.
 * <p>
 * The lexer records at most one error: the offending token is yielded as {@link TokenType#INVALID}
 * and the sequence ends with {@link TokenType#EOF} right after it.
 */
public class Lexer implements Iterable<Token> {
    public static final String DEFAULT_SOURCE_PATH = "<input>";

    private static final char TRIM_FULL = '-';
    private static final char TRIM_RESTRICTED = '~';
    private static final char RAW_ESCAPE = '%';

    private final String text;
    private final String sourcePath;
    private final LexerOptions options;
    private final int textLength;
    private final boolean liquid;

    private int offset;
    private int line;
    private int column;
    private char c;

    private Token token;
    private BlockType blockType;
    private boolean liquidTagBlock;
    private int openBraceCount;
    private int escapeRawCharCount;
    private boolean expectingFrontMatter;
    private final Deque<Token> pendingTokens = new ArrayDeque<>();
    private final Deque<Interpolation> interpolations = new ArrayDeque<>();
    private List<LogMessage> errors;

    public Lexer(String text) {
        this(text, null, null);
    }

    public Lexer(String text, String sourcePath, LexerOptions options) {
        this.text = Objects.requireNonNull(text, "text");
        this.options = options == null ? LexerOptions.DEFAULT : normalize(options);
        this.sourcePath = sourcePath == null ? DEFAULT_SOURCE_PATH : sourcePath;
        this.textLength = text.length();
        this.liquid = this.options.isLiquid();
        int startOffset = this.options.getStartPosition().offset();
        if (startOffset > textLength) {
            throw new IllegalArgumentException("The starting position `" + startOffset + "` is out of range [0, " + (textLength - 1) + "]");
        }
        reset();
    }

    private static LexerOptions normalize(LexerOptions options) {
        LexerOptions.LexerOptionsBuilder builder = options.toBuilder();
        if (options.getFrontMatterMarker() == null) {
            builder.frontMatterMarker(LexerOptions.DEFAULT_FRONT_MATTER_MARKER);
        }
        if (options.getStartPosition() == null) {
            builder.startPosition(TextPosition.ZERO);
        }
        if (options.getMode() == null) {
            builder.mode(ScriptMode.DEFAULT);
        }
        if (options.getDialect() == null) {
            builder.dialect(Dialect.DEFAULT);
        }
        return builder.build();
    }

    public String getText() {
        return text;
    }

    public String getSourcePath() {
        return sourcePath;
    }

    public LexerOptions getOptions() {
        return options;
    }

    public boolean hasErrors() {
        return errors != null && !errors.isEmpty();
    }

    public List<LogMessage> getErrors() {
        return errors == null ? Collections.emptyList() : Collections.unmodifiableList(errors);
    }

    @Override
    public Iterator<Token> iterator() {
        reset();
        return new TokenIterator();
    }

    private final class TokenIterator implements Iterator<Token> {
        private boolean fetched;
        private boolean available;

        @Override
        public boolean hasNext() {
            if (!fetched) {
                available = moveNext();
                fetched = true;
            }
            return available;
        }

        @Override
        public Token next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            fetched = false;
            return token;
        }
    }

    private enum BlockType {
        CODE,
        ESCAPE,
        RAW
    }

    private record Interpolation(int braceDepth, char quote) {
    }

    private void reset() {
        TextPosition start = options.getStartPosition();
        offset = start.offset();
        line = start.line();
        column = start.column();
        c = offset < textLength ? text.charAt(offset) : '\0';
        token = new Token(TokenType.INVALID, TextPosition.EOF, TextPosition.EOF);
        blockType = options.getMode() == ScriptMode.SCRIPT_ONLY ? BlockType.CODE : BlockType.RAW;
        liquidTagBlock = false;
        openBraceCount = 0;
        escapeRawCharCount = 0;
        expectingFrontMatter = options.getMode().hasFrontMatter();
        pendingTokens.clear();
        interpolations.clear();
        errors = null;
    }

    private TextPosition position() {
        return new TextPosition(offset, line, column);
    }

    private void setPosition(TextPosition position) {
        offset = position.offset();
        line = position.line();
        column = position.column();
    }

    private boolean moveNext() {
        if (hasErrors()) {
            if (token.type() == TokenType.EOF) {
                return false;
            }
            pendingTokens.clear();
            token = Token.EOF;
            return true;
        }

        int previousOffset = -1;
        boolean firstLoop = true;

        while (true) {
            if (!pendingTokens.isEmpty()) {
                token = pendingTokens.poll();
                return true;
            }

            if (token.type() == TokenType.EOF) {
                return false;
            }

            if (offset == textLength) {
                token = Token.EOF;
                return true;
            }

            if (!firstLoop && previousOffset == offset) {
                throw new IllegalStateException("Invalid internal state of the lexer in a forever loop");
            }
            firstLoop = false;
            previousOffset = offset;

            if (options.getMode() != ScriptMode.SCRIPT_ONLY) {
                if (blockType == BlockType.RAW) {
                    if (isCodeEnterOrEscape() != null) {
                        readCodeEnterOrEscape();
                        return true;
                    } else if (expectingFrontMatter && tryReadFrontMatterMarker()) {
                        blockType = BlockType.CODE;
                        return true;
                    }
                }

                if (blockType != BlockType.RAW && isCodeExit()) {
                    boolean wasInCode = blockType == BlockType.CODE;
                    readCodeExitOrEscape();
                    if (wasInCode) {
                        return true;
                    }
                    // leaving an escape block, the exit token is pending
                    continue;
                }

                if (blockType == BlockType.CODE && expectingFrontMatter && tryReadFrontMatterMarker()) {
                    blockType = BlockType.RAW;
                    expectingFrontMatter = false;
                    return true;
                }
            }

            if (offset == textLength) {
                token = Token.EOF;
                return true;
            }

            boolean produced;
            if (blockType == BlockType.CODE) {
                produced = liquid ? readCodeLiquid() : readCode();
            } else {
                produced = readRaw();
            }
            if (produced) {
                return true;
            }
        }
    }

    private boolean tryReadFrontMatterMarker() {
        TextPosition start = position();
        String marker = options.getFrontMatterMarker();
        int i = 0;
        for (; i < marker.length(); i++) {
            if (peekChar(i) != marker.charAt(i)) {
                return false;
            }
        }
        char pc = peekChar(i);
        while (pc == ' ' || pc == '\t') {
            i++;
            pc = peekChar(i);
        }

        boolean valid = false;
        if (pc == '\n') {
            valid = true;
        } else if (pc == '\r') {
            valid = true;
            if (peekChar(i + 1) == '\n') {
                i++;
            }
        }
        if (!valid) {
            return false;
        }

        TextPosition end = start;
        while (i-- >= 0) {
            end = position();
            nextChar();
        }
        token = new Token(TokenType.FRONT_MATTER_MARKER, start, end);
        return true;
    }

    /**
     * Returns the whitespace mode of the code enter at the current position ({@link TokenType#INVALID} when none),
     * or {@code null} when the current position does not start a code enter.
     */
    private TokenType isCodeEnterOrEscape() {
        if (c != '{') {
            return null;
        }
        int i = 1;
        char nc = peekChar(i);
        if (!liquid) {
            while (nc == RAW_ESCAPE) {
                i++;
                nc = peekChar(i);
            }
        }
        if (nc == '{' || (liquid && nc == '%')) {
            char trim = peekChar(i + 1);
            if (trim == TRIM_FULL) {
                return TokenType.WHITESPACE_FULL;
            }
            if (!liquid && trim == TRIM_RESTRICTED) {
                return TokenType.WHITESPACE;
            }
            return TokenType.INVALID;
        }
        return null;
    }

    private void readCodeEnterOrEscape() {
        TextPosition start = position();
        TextPosition end = start;

        nextChar(); // {

        if (!liquid) {
            while (c == RAW_ESCAPE) {
                escapeRawCharCount++;
                end = end.nextColumn();
                nextChar();
            }
        }

        end = end.nextColumn();
        if (liquid && c == '%') {
            liquidTagBlock = true;
        }
        nextChar(); // { or %

        if (c == TRIM_FULL || (!liquid && c == TRIM_RESTRICTED)) {
            end = end.nextColumn();
            nextChar();
        }

        if (escapeRawCharCount > 0) {
            blockType = BlockType.ESCAPE;
            token = new Token(TokenType.ESCAPE_ENTER, start, end);
            return;
        }
        if (liquid && liquidTagBlock && tryReadLiquidCommentOrRaw(start)) {
            return;
        }
        blockType = BlockType.CODE;
        token = new Token(liquidTagBlock ? TokenType.LIQUID_TAG_ENTER : TokenType.CODE_ENTER, start, end);
    }

    private boolean tryReadLiquidCommentOrRaw(TextPosition codeEnterStart) {
        TextPosition start = position();
        int peek = skipPeekSpaces(0);
        boolean comment;
        int matched = matchPeek("comment", peek);
        if (matched >= 0) {
            comment = true;
        } else {
            matched = matchPeek("raw", peek);
            if (matched < 0) {
                return false;
            }
            comment = false;
        }
        peek = matchPeek("%}", skipPeekSpaces(matched));
        if (peek < 0) {
            return false;
        }

        TextPosition codeEnterEnd = new TextPosition(start.offset() + peek - 1, start.line(), start.column() + peek - 1);
        TextPosition contentStart = new TextPosition(start.offset() + peek, start.line(), start.column() + peek);
        TextPosition rewind = position();

        setPosition(new TextPosition(contentStart.offset() - 1, contentStart.line(), contentStart.column() - 1));
        c = '}';
        while (true) {
            TextPosition contentEnd = position();
            nextChar();
            TextPosition codeExitStart = position();
            if (c == '{') {
                nextChar();
                if (c == '%') {
                    nextChar();
                    if (c == TRIM_FULL) {
                        nextChar();
                    }
                    skipSpaces();
                    if (match(comment ? "endcomment" : "endraw")) {
                        skipSpaces();
                        if (c == TRIM_FULL) {
                            nextChar();
                        }
                        if (c == '%') {
                            nextChar();
                            if (c == '}') {
                                TextPosition codeExitEnd = position();
                                nextChar();
                                blockType = BlockType.RAW;
                                if (comment) {
                                    token = new Token(TokenType.CODE_ENTER, codeEnterStart, codeEnterEnd);
                                    pendingTokens.add(new Token(TokenType.COMMENT_MULTI, contentStart, contentEnd));
                                    pendingTokens.add(new Token(TokenType.CODE_EXIT, codeExitStart, codeExitEnd));
                                } else {
                                    token = new Token(TokenType.ESCAPE_ENTER, codeEnterStart, codeEnterEnd);
                                    pendingTokens.add(new Token(TokenType.ESCAPE, contentStart, contentEnd));
                                    pendingTokens.add(new Token(TokenType.ESCAPE_EXIT, codeExitStart, codeExitEnd));
                                }
                                liquidTagBlock = false;
                                return true;
                            }
                        }
                    }
                }
            } else if (c == '\0') {
                break;
            }
        }

        // no closing tag, lex the tag as regular code
        setPosition(rewind);
        c = offset < textLength ? text.charAt(offset) : '\0';
        return false;
    }

    private void skipSpaces() {
        while (c == ' ' || c == '\t') {
            nextChar();
        }
    }

    private int skipPeekSpaces(int i) {
        while (true) {
            char nc = peekChar(i);
            if (nc != ' ' && nc != '\t') {
                return i;
            }
            i++;
        }
    }

    /**
     * Returns the peek offset after {@code expected}, or -1 when it does not match.
     */
    private int matchPeek(String expected, int peekOffset) {
        for (int index = 0; index < expected.length(); index++, peekOffset++) {
            if (peekChar(peekOffset) != expected.charAt(index)) {
                return -1;
            }
        }
        return peekOffset;
    }

    private boolean match(String expected) {
        for (int i = 0; i < expected.length(); i++) {
            if (c != expected.charAt(i)) {
                return false;
            }
            nextChar();
        }
        return true;
    }

    private boolean isCodeExit() {
        // braces of an object initializer and holes of an interpolated string must be closed first
        if (openBraceCount > 0 || !interpolations.isEmpty()) {
            return false;
        }

        int start = 0;
        if (c == TRIM_FULL || (!liquid && c == TRIM_RESTRICTED)) {
            start = 1;
        }
        if (peekChar(start) != (liquidTagBlock ? '%' : '}')) {
            return false;
        }
        start++;
        if (!liquid) {
            for (int i = 0; i < escapeRawCharCount; i++) {
                if (peekChar(i + start) != RAW_ESCAPE) {
                    return false;
                }
            }
        }
        return peekChar(escapeRawCharCount + start) == '}';
    }

    private void readCodeExitOrEscape() {
        TextPosition start = position();

        TokenType whitespaceMode = TokenType.INVALID;
        if (c == TRIM_FULL) {
            whitespaceMode = TokenType.WHITESPACE_FULL;
            nextChar();
        } else if (!liquid && c == TRIM_RESTRICTED) {
            whitespaceMode = TokenType.WHITESPACE;
            nextChar();
        }

        nextChar(); // } or %
        if (!liquid) {
            for (int i = 0; i < escapeRawCharCount; i++) {
                nextChar();
            }
        }
        TextPosition end = position();
        nextChar(); // }

        if (escapeRawCharCount > 0) {
            pendingTokens.add(new Token(TokenType.ESCAPE_EXIT, start, end));
            escapeRawCharCount = 0;
        } else {
            token = new Token(liquidTagBlock ? TokenType.LIQUID_TAG_EXIT : TokenType.CODE_EXIT, start, end);
        }

        if (whitespaceMode != TokenType.INVALID) {
            TextPosition startSpace = position();
            boolean restricted = whitespaceMode == TokenType.WHITESPACE;
            TextPosition endSpace = consumeWhitespace(restricted, restricted);
            if (endSpace != null) {
                pendingTokens.add(new Token(whitespaceMode, startSpace, endSpace));
            }
        }

        liquidTagBlock = false;
        blockType = BlockType.RAW;
    }

    private boolean readRaw() {
        TextPosition start = position();
        TextPosition end = TextPosition.EOF;
        boolean nextCodeEnterOrEscapeExit = false;
        TokenType whitespaceMode = TokenType.INVALID;
        boolean emptyRaw = false;

        TextPosition beforeSpaceFull = TextPosition.EOF;
        TextPosition beforeSpaceRestricted = TextPosition.EOF;
        TextPosition lastSpaceFull = TextPosition.EOF;
        TextPosition lastSpaceRestricted = TextPosition.EOF;

        while (c != '\0') {
            if (blockType == BlockType.RAW) {
                TokenType mode = isCodeEnterOrEscape();
                if (mode != null) {
                    whitespaceMode = mode;
                    emptyRaw = end.offset() < 0;
                    nextCodeEnterOrEscapeExit = true;
                    break;
                }
            } else if (blockType == BlockType.ESCAPE && isCodeExit()) {
                emptyRaw = end.offset() < 0;
                nextCodeEnterOrEscapeExit = true;
                break;
            }

            if (Character.isWhitespace(c)) {
                if (lastSpaceFull.offset() < 0) {
                    lastSpaceFull = position();
                    beforeSpaceFull = end;
                }
                if (!(c == '\n' || (c == '\r' && peekChar(1) != '\n'))) {
                    if (lastSpaceRestricted.offset() < 0) {
                        lastSpaceRestricted = position();
                        beforeSpaceRestricted = end;
                    }
                } else {
                    lastSpaceRestricted = TextPosition.EOF;
                    beforeSpaceRestricted = TextPosition.EOF;
                }
            } else {
                lastSpaceFull = TextPosition.EOF;
                beforeSpaceFull = TextPosition.EOF;
                lastSpaceRestricted = TextPosition.EOF;
                beforeSpaceRestricted = TextPosition.EOF;
            }

            end = position();
            nextChar();
        }

        if (end.offset() < 0) {
            end = start;
        }

        TextPosition lastSpace = whitespaceMode == TokenType.WHITESPACE ? lastSpaceRestricted : lastSpaceFull;
        TextPosition beforeSpace = whitespaceMode == TokenType.WHITESPACE ? beforeSpaceRestricted : beforeSpaceFull;

        if (whitespaceMode != TokenType.INVALID && lastSpace.offset() >= 0) {
            pendingTokens.add(new Token(whitespaceMode, lastSpace, end));
            if (beforeSpace.offset() < 0) {
                // the whole raw run is trimmed away
                return false;
            }
            end = beforeSpace;
        }

        if (nextCodeEnterOrEscapeExit && emptyRaw) {
            end = new TextPosition(start.offset() - 1, start.line(), start.column() - 1);
        }

        token = new Token(blockType == BlockType.ESCAPE ? TokenType.ESCAPE : TokenType.RAW, start, end);

        if (!nextCodeEnterOrEscapeExit) {
            nextChar();
        }
        return true;
    }

    private boolean readCode() {
        TextPosition start = position();
        switch (c) {
            case '\n' -> {
                nextChar();
                token = newLine(start, start);
            }
            case '\r' -> {
                nextChar();
                if (c == '\n') {
                    TextPosition end = position();
                    nextChar();
                    token = newLine(start, end);
                } else {
                    token = newLine(start, start);
                }
            }
            case ';' -> single(TokenType.SEMI_COLON, start);
            case ':' -> single(TokenType.COLON, start);
            case '@' -> single(TokenType.ARROBA, start);
            case ',' -> single(TokenType.COMMA, start);
            case '(' -> single(TokenType.OPEN_PAREN, start);
            case ')' -> single(TokenType.CLOSE_PAREN, start);
            case '[' -> single(TokenType.OPEN_BRACKET, start);
            case ']' -> single(TokenType.CLOSE_BRACKET, start);
            case '^' -> {
                nextChar();
                token = follow('^', TokenType.DOUBLE_CARET, TokenType.CARET, start);
            }
            case '*' -> {
                nextChar();
                token = follow('=', TokenType.ASTERISK_EQUAL, TokenType.ASTERISK, start);
            }
            case '/' -> {
                nextChar();
                if (c == '/') {
                    TextPosition end = position();
                    nextChar();
                    token = follow('=', TokenType.DOUBLE_DIVIDE_EQUAL, null, start);
                    if (token == null) {
                        token = new Token(TokenType.DOUBLE_DIVIDE, start, end);
                    }
                } else {
                    token = follow('=', TokenType.DIVIDE_EQUAL, TokenType.DIVIDE, start);
                }
            }
            case '+' -> {
                nextChar();
                token = c == '+'
                    ? follow('+', TokenType.DOUBLE_PLUS, null, start)
                    : follow('=', TokenType.PLUS_EQUAL, TokenType.PLUS, start);
            }
            case '-' -> {
                nextChar();
                token = c == '-'
                    ? follow('-', TokenType.DOUBLE_MINUS, null, start)
                    : follow('=', TokenType.MINUS_EQUAL, TokenType.MINUS, start);
            }
            case '%' -> {
                nextChar();
                token = follow('=', TokenType.PERCENT_EQUAL, TokenType.PERCENT, start);
            }
            case '&' -> {
                nextChar();
                token = follow('&', TokenType.DOUBLE_AMP, TokenType.AMP, start);
            }
            case '?' -> {
                nextChar();
                if (c == '?') {
                    token = follow('?', TokenType.DOUBLE_QUESTION, null, start);
                } else if (c == '.') {
                    token = follow('.', TokenType.QUESTION_DOT, null, start);
                } else {
                    token = follow('!', TokenType.QUESTION_EXCLAMATION, TokenType.QUESTION, start);
                }
            }
            case '|' -> {
                nextChar();
                if (c == '|') {
                    token = follow('|', TokenType.DOUBLE_VERTICAL_BAR, null, start);
                } else {
                    token = follow('>', TokenType.PIPE_GREATER, TokenType.VERTICAL_BAR, start);
                }
            }
            case '.' -> {
                nextChar();
                if (c == '.') {
                    TextPosition second = position();
                    nextChar();
                    if (c == '<') {
                        token = follow('<', TokenType.DOUBLE_DOT_LESS, null, start);
                    } else if (c == '.') {
                        token = follow('.', TokenType.TRIPLE_DOT, null, start);
                    } else {
                        token = new Token(TokenType.DOUBLE_DOT, start, second);
                    }
                } else {
                    token = new Token(TokenType.DOT, start, start);
                }
            }
            case '!' -> {
                nextChar();
                token = follow('=', TokenType.EXCLAMATION_EQUAL, TokenType.EXCLAMATION, start);
            }
            case '=' -> {
                nextChar();
                token = follow('=', TokenType.DOUBLE_EQUAL, TokenType.EQUAL, start);
            }
            case '<' -> {
                nextChar();
                token = c == '<'
                    ? follow('<', TokenType.DOUBLE_LESS_THAN, null, start)
                    : follow('=', TokenType.LESS_EQUAL, TokenType.LESS, start);
            }
            case '>' -> {
                nextChar();
                token = c == '>'
                    ? follow('>', TokenType.DOUBLE_GREATER_THAN, null, start)
                    : follow('=', TokenType.GREATER_EQUAL, TokenType.GREATER, start);
            }
            case '{' -> {
                openBraceCount++;
                single(TokenType.OPEN_BRACE, start);
            }
            case '}' -> {
                Interpolation interpolation = interpolations.peek();
                if (interpolation != null && interpolation.braceDepth() == openBraceCount) {
                    interpolations.pop();
                    nextChar();
                    readInterpolatedPart(start, false, interpolation.quote());
                    if (!hasErrors()) {
                        // the closing brace also starts the next part of the string
                        pendingTokens.addFirst(token);
                        token = new Token(TokenType.CLOSE_INTERPOLATED_BRACE, start, start);
                    }
                } else if (openBraceCount > 0) {
                    openBraceCount--;
                    single(TokenType.CLOSE_BRACE, start);
                } else if (options.getMode() != ScriptMode.SCRIPT_ONLY && isCodeExit()) {
                    return false;
                } else {
                    addError("Unexpected } while no matching {", start, start);
                    // keep a usable token for the parser
                    single(TokenType.CLOSE_BRACE, start);
                }
            }
            case '#' -> readComment();
            case '"', '\'' -> readString();
            case '`' -> readVerbatimString();
            case '$' -> {
                char quote = peekChar(1);
                if (quote != '"' && quote != '\'') {
                    return readDefault(start, true);
                }
                nextChar();
                nextChar();
                readInterpolatedPart(start, true, quote);
            }
            case '\0' -> token = Token.EOF;
            default -> {
                return readDefault(start, true);
            }
        }
        return true;
    }

    private boolean readCodeLiquid() {
        TextPosition start = position();
        switch (c) {
            case ':' -> single(TokenType.COLON, start);
            case ',' -> single(TokenType.COMMA, start);
            case '|' -> single(TokenType.VERTICAL_BAR, start);
            case '?' -> single(TokenType.QUESTION, start);
            case '-' -> single(TokenType.MINUS, start);
            case '(' -> single(TokenType.OPEN_PAREN, start);
            case ')' -> single(TokenType.CLOSE_PAREN, start);
            case '[' -> single(TokenType.OPEN_BRACKET, start);
            case ']' -> single(TokenType.CLOSE_BRACKET, start);
            case '.' -> {
                nextChar();
                token = follow('.', TokenType.DOUBLE_DOT, TokenType.DOT, start);
            }
            case '!' -> {
                nextChar();
                token = follow('=', TokenType.EXCLAMATION_EQUAL, TokenType.INVALID, start);
            }
            case '=' -> {
                nextChar();
                token = follow('=', TokenType.DOUBLE_EQUAL, TokenType.EQUAL, start);
            }
            case '<' -> {
                nextChar();
                token = follow('=', TokenType.LESS_EQUAL, TokenType.LESS, start);
            }
            case '>' -> {
                nextChar();
                token = follow('=', TokenType.GREATER_EQUAL, TokenType.GREATER, start);
            }
            case '"', '\'' -> readString();
            case '\0' -> token = Token.EOF;
            default -> {
                return readDefault(start, false);
            }
        }
        return true;
    }

    private boolean readDefault(TextPosition start, boolean allowSpecialIdentifier) {
        // newlines are statement separators only outside liquid
        TextPosition lastSpace = consumeWhitespace(!liquid, false);
        if (lastSpace != null) {
            if (options.isKeepTrivia()) {
                token = new Token(TokenType.WHITESPACE, start, lastSpace);
                return true;
            }
            return false;
        }

        boolean special = allowSpecialIdentifier && c == '$';
        if (isFirstIdentifierLetter(c) || special) {
            readIdentifier(special);
            return true;
        }
        if (Character.isDigit(c)) {
            readNumber();
            return true;
        }

        token = new Token(TokenType.INVALID, start, start);
        nextChar();
        return true;
    }

    private void single(TokenType type, TextPosition start) {
        token = new Token(type, start, start);
        nextChar();
    }

    /**
     * The previous character has been consumed: when the current one is {@code expected}, consume it and
     * produce {@code matched}, otherwise produce {@code otherwise} ending at {@code start}.
     */
    private Token follow(char expected, TokenType matched, TokenType otherwise, TextPosition start) {
        if (c == expected) {
            TextPosition end = position();
            nextChar();
            return new Token(matched, start, end);
        }
        return otherwise == null ? null : new Token(otherwise, start, start);
    }

    private Token newLine(TextPosition start, TextPosition end) {
        TextPosition lastSpace = consumeWhitespace(false, false);
        return new Token(TokenType.NEW_LINE, start, lastSpace == null ? end : lastSpace);
    }

    /**
     * Consumes whitespace and returns the position of the last consumed character, {@code null} when nothing
     * was consumed.
     */
    private TextPosition consumeWhitespace(boolean stopAtNewLine, boolean keepNewLine) {
        TextPosition lastSpace = null;
        while (Character.isWhitespace(c)) {
            if (stopAtNewLine && c == '\n') {
                if (keepNewLine) {
                    lastSpace = position();
                    nextChar();
                }
                break;
            }
            lastSpace = position();
            nextChar();
        }
        return lastSpace;
    }

    private void readIdentifier(boolean special) {
        TextPosition start = position();
        TextPosition before;
        boolean first = true;
        do {
            before = position();
            nextChar();
            if (first && special && c == '$') {
                token = new Token(TokenType.IDENTIFIER_SPECIAL, start, position());
                nextChar();
                return;
            }
            first = false;
        } while (isIdentifierLetter(c));

        token = new Token(special ? TokenType.IDENTIFIER_SPECIAL : TokenType.IDENTIFIER, start, before);

        if (liquid && options.isEnableIncludeImplicitString() && token.match("include", text) && Character.isWhitespace(c)) {
            TextPosition startSpace = position();
            TextPosition endSpace = consumeWhitespace(false, false);
            pendingTokens.add(new Token(TokenType.WHITESPACE, startSpace, endSpace));

            TextPosition startPath = position();
            TextPosition endPath = startPath;
            while (!Character.isWhitespace(c) && c != '\0' && c != '%' && peekChar(1) != '}') {
                endPath = position();
                nextChar();
            }
            pendingTokens.add(new Token(TokenType.IMPLICIT_STRING, startPath, endPath));
        }
    }

    private static boolean isFirstIdentifierLetter(char ch) {
        return ch == '_' || Character.isLetter(ch);
    }

    private boolean isIdentifierLetter(char ch) {
        return isFirstIdentifierLetter(ch) || Character.isDigit(ch) || (liquid && ch == '-');
    }

    private static boolean isNumberPostfix(char ch) {
        return ch == 'f' || ch == 'F' || ch == 'd' || ch == 'D' || ch == 'm' || ch == 'M';
    }

    private static boolean isHex(char ch) {
        return (ch >= '0' && ch <= '9') || (ch >= 'a' && ch <= 'f') || (ch >= 'A' && ch <= 'F');
    }

    private void readNumber() {
        TextPosition start = position();
        TextPosition end = start;
        boolean isFloat = false;

        boolean zero = c == '0';
        nextChar();

        if (zero && c == 'x') {
            readHexa(start);
            return;
        }
        if (zero && c == 'b') {
            readBinary(start);
            return;
        }

        while (Character.isDigit(c) || c == '_') {
            end = position();
            nextChar();
        }

        if (c == '.') {
            // 1..2 is a range, 1.f, 1.0 and 1.e10 are floats
            char nc = peekChar(1);
            if (nc != '.' && (isNumberPostfix(nc) || Character.isDigit(nc) || !Character.isLetter(nc) || nc == 'e' || nc == 'E')) {
                isFloat = true;
                end = position();
                nextChar();
                while (Character.isDigit(c)) {
                    end = position();
                    nextChar();
                }
            }
        }

        if (c == 'e' || c == 'E') {
            end = position();
            nextChar();
            if (c == '+' || c == '-') {
                end = position();
                nextChar();
            }
            if (!Character.isDigit(c)) {
                TextPosition here = position();
                addError("Expecting at least one digit after the exponent", here, here);
                return;
            }
            while (Character.isDigit(c)) {
                end = position();
                nextChar();
            }
        }

        if (!isIdentifierLetter(peekChar(1)) && isNumberPostfix(c)) {
            isFloat = true;
            end = position();
            nextChar();
        }

        token = new Token(isFloat ? TokenType.FLOAT : TokenType.INTEGER, start, end);
    }

    private void readHexa(TextPosition start) {
        TextPosition end = position();
        nextChar(); // x

        boolean hasDigit = false;
        while (true) {
            if (isHex(c)) {
                hasDigit = true;
            } else if (c != '_') {
                break;
            }
            end = position();
            nextChar();
        }

        if (!isIdentifierLetter(peekChar(1)) && (c == 'u' || c == 'U')) {
            end = position();
            nextChar();
        }

        if (!hasDigit) {
            addError("Invalid hex number, expecting at least a hex digit [0-9a-fA-F] after 0x", start, end);
        } else {
            token = new Token(TokenType.HEXA_INTEGER, start, end);
        }
    }

    private void readBinary(TextPosition start) {
        TextPosition end = position();
        nextChar(); // b

        boolean hasDigit = false;
        boolean hasDot = false;
        while (true) {
            if (c == '0' || c == '1') {
                hasDigit = true;
            } else if (c != '_') {
                break;
            }
            end = position();
            nextChar();
            if (c == '.') {
                if (hasDot) {
                    break;
                }
                char nc = peekChar(1);
                if (nc != '0' && nc != '1') {
                    break;
                }
                hasDot = true;
                nextChar();
            }
        }

        if (!isIdentifierLetter(peekChar(1)) && (c == 'u' || c == 'U' || hasDot && (c == 'f' || c == 'F' || c == 'd' || c == 'D'))) {
            end = position();
            nextChar();
        }

        if (!hasDigit) {
            addError("Invalid binary number, expecting at least a binary digit 0 or 1 after 0b", start, end);
        } else {
            token = new Token(TokenType.BINARY_INTEGER, start, end);
        }
    }

    private void readString() {
        TextPosition start = position();
        TextPosition end = start;
        char startChar = c;
        nextChar();
        while (true) {
            if (c == '\\') {
                end = readEscape(false);
                if (end == null) {
                    return;
                }
            } else if (c == '\0') {
                addError("Unexpected end of file while parsing a string not terminated by a " + startChar, end, end);
                return;
            } else if (c == startChar) {
                end = position();
                nextChar();
                break;
            } else {
                end = position();
                nextChar();
            }
        }
        token = new Token(TokenType.STRING, start, end);
    }

    /**
     * Reads a part of an interpolated string up to the opening brace of the next hole
     * or the closing quote. The opening brace is queued as its own token.
     */
    private void readInterpolatedPart(TextPosition start, boolean first, char quote) {
        TextPosition end = start;
        while (true) {
            if (c == '\\') {
                end = readEscape(true);
                if (end == null) {
                    return;
                }
            } else if (c == '\0') {
                addError("Unexpected end of file while parsing an interpolated string not terminated by a " + quote, end, end);
                return;
            } else if (c == '{') {
                end = position();
                nextChar();
                token = new Token(first ? TokenType.BEGIN_INTERPOLATED_STRING : TokenType.CONTINUATION_INTERPOLATED_STRING, start, end);
                pendingTokens.add(new Token(TokenType.OPEN_INTERPOLATED_BRACE, end, end));
                interpolations.push(new Interpolation(openBraceCount, quote));
                return;
            } else if (c == quote) {
                end = position();
                nextChar();
                token = new Token(first ? TokenType.BEGIN_INTERPOLATED_STRING : TokenType.ENDING_INTERPOLATED_STRING, start, end);
                return;
            } else {
                end = position();
                nextChar();
            }
        }
    }

    /**
     * Reads an escape sequence starting at the current backslash.
     *
     * @return the position of the last character of the sequence, {@code null} after an error
     */
    private TextPosition readEscape(boolean interpolated) {
        TextPosition end = position();
        nextChar();
        if (interpolated && (c == '{' || c == '}')) {
            end = position();
            nextChar();
            return end;
        }
        switch (c) {
            case '\n', '0', '\'', '"', '\\', 'b', 'f', 'n', 'r', 't', 'v' -> {
                end = position();
                nextChar();
            }
            case '\r' -> {
                end = position();
                nextChar();
                if (c == '\n') {
                    end = position();
                    nextChar();
                }
            }
            case 'u', 'x' -> {
                boolean unicode = c == 'u';
                end = position();
                nextChar();
                for (int i = 0; i < (unicode ? 4 : 2); i++) {
                    if (!isHex(c)) {
                        TextPosition here = position();
                        addError(unicode
                            ? "Unexpected hex number `" + printable(c) + "` following `\\u`. Expecting `\\u0000` to `\\uffff`."
                            : "Unexpected hex number `" + printable(c) + "` following `\\x`. Expecting `\\x00` to `\\xff`", here, here);
                        return null;
                    }
                    end = position();
                    nextChar();
                }
            }
            default -> {
                TextPosition here = position();
                addError("Unexpected escape character `" + printable(c) + "` in string. Only 0 ' \\ \" b f n r t v u0000-uFFFF x00-xFF are allowed", here, here);
                return null;
            }
        }
        return end;
    }

    private static String printable(char ch) {
        return ch == '\0' ? "<eof>" : String.valueOf(ch);
    }

    private void readVerbatimString() {
        TextPosition start = position();
        TextPosition end = start;
        char startChar = c;
        nextChar();
        while (true) {
            if (c == '\0') {
                addError("Unexpected end of file while parsing a verbatim string not terminated by a " + startChar, end, end);
                return;
            } else if (c == startChar) {
                end = position();
                nextChar();
                // a doubled backtick is an escaped backtick
                if (c != startChar) {
                    break;
                }
                end = position();
                nextChar();
            } else {
                end = position();
                nextChar();
            }
        }
        token = new Token(TokenType.VERBATIM_STRING, start, end);
    }

    private void readComment() {
        TextPosition start = position();
        TextPosition end = start;
        nextChar();

        boolean multi = false;
        if (c == '#') {
            multi = true;
            end = position();
            nextChar();
            while (!isCodeExit()) {
                if (c == '\0') {
                    break;
                }
                boolean mayEnd = c == '#';
                end = position();
                nextChar();
                if (mayEnd && c == '#') {
                    end = position();
                    nextChar();
                    break;
                }
            }
        } else {
            while (options.getMode() == ScriptMode.SCRIPT_ONLY || !isCodeExit()) {
                if (c == '\0' || c == '\r' || c == '\n') {
                    break;
                }
                end = position();
                nextChar();
            }
        }
        token = new Token(multi ? TokenType.COMMENT_MULTI : TokenType.COMMENT, start, end);
    }

    private char peekChar(int count) {
        int index = offset + count;
        return index >= 0 && index < textLength ? text.charAt(index) : '\0';
    }

    private void nextChar() {
        offset++;
        if (offset < textLength) {
            char nc = text.charAt(offset);
            if (c == '\n' || (c == '\r' && nc != '\n')) {
                column = 0;
                line++;
            } else {
                column++;
            }
            c = nc;
        } else {
            offset = textLength;
            c = '\0';
        }
    }

    private void addError(String message, TextPosition start, TextPosition end) {
        token = new Token(TokenType.INVALID, start, end);
        if (errors == null) {
            errors = new ArrayList<>();
        }
        errors.add(new LogMessage(ParserMessageType.ERROR, new SourceSpan(sourcePath, start, end), message));
    }
}
