package io.proddata.stencil.parsing;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.is;

class LexerTest {
    private static List<Token> tokens(Lexer lexer) {
        List<Token> tokens = new ArrayList<>();
        lexer.forEach(tokens::add);
        return tokens;
    }

    private static List<TokenType> types(Lexer lexer) {
        return tokens(lexer).stream().map(Token::type).collect(Collectors.toList());
    }

    private static LexerOptions scriptOnly() {
        return LexerOptions.builder().mode(ScriptMode.SCRIPT_ONLY).build();
    }

    @Test
    void splitsRawTextAndCode() {
        Lexer lexer = new Lexer("Hello {{ name }}!");

        List<Token> tokens = tokens(lexer);

        assertThat(tokens.stream().map(Token::type).collect(Collectors.toList()), contains(
            TokenType.RAW,
            TokenType.CODE_ENTER,
            TokenType.IDENTIFIER,
            TokenType.CODE_EXIT,
            TokenType.RAW,
            TokenType.EOF
        ));
        String text = lexer.getText();
        assertThat(tokens.get(0).getText(text), is("Hello "));
        assertThat(tokens.get(2).getText(text), is("name"));
        assertThat(tokens.get(4).getText(text), is("!"));
        assertThat(lexer.hasErrors(), is(false));
    }

    @Test
    void tracksInclusiveEndPositions() {
        Lexer lexer = new Lexer("ab\n{{ x }}");

        List<Token> tokens = tokens(lexer);

        Token raw = tokens.get(0);
        assertThat(raw.start(), is(new TextPosition(0, 0, 0)));
        assertThat(raw.end(), is(new TextPosition(2, 0, 2)));
        Token codeEnter = tokens.get(1);
        assertThat(codeEnter.start(), is(new TextPosition(3, 1, 0)));
        assertThat(codeEnter.end(), is(new TextPosition(4, 1, 1)));
        assertThat(tokens.get(tokens.size() - 1), is(Token.EOF));
    }

    @Test
    void lexesOperatorsInScriptOnlyMode() {
        Lexer lexer = new Lexer("a ?? b // 2 ..< c?.d != e", null, scriptOnly());

        assertThat(types(lexer), contains(
            TokenType.IDENTIFIER,
            TokenType.DOUBLE_QUESTION,
            TokenType.IDENTIFIER,
            TokenType.DOUBLE_DIVIDE,
            TokenType.INTEGER,
            TokenType.DOUBLE_DOT_LESS,
            TokenType.IDENTIFIER,
            TokenType.QUESTION_DOT,
            TokenType.IDENTIFIER,
            TokenType.EXCLAMATION_EQUAL,
            TokenType.IDENTIFIER,
            TokenType.EOF
        ));
    }

    @Test
    void lexesNumbers() {
        Lexer lexer = new Lexer("1_000 0xFF 0b101 1.5e3 2f", null, scriptOnly());

        assertThat(types(lexer), contains(
            TokenType.INTEGER,
            TokenType.HEXA_INTEGER,
            TokenType.BINARY_INTEGER,
            TokenType.FLOAT,
            TokenType.FLOAT,
            TokenType.EOF
        ));
    }

    @Test
    void keepsWhitespaceAsTokensWhenAsked() {
        LexerOptions options = LexerOptions.builder().keepTrivia(true).build();
        Lexer lexer = new Lexer("{{ x }}", null, options);

        assertThat(types(lexer), contains(
            TokenType.CODE_ENTER,
            TokenType.WHITESPACE,
            TokenType.IDENTIFIER,
            TokenType.WHITESPACE,
            TokenType.CODE_EXIT,
            TokenType.EOF
        ));
    }

    @Test
    void trimsWhitespaceBeforeCodeEnter() {
        Lexer lexer = new Lexer("a  {{- x }}");

        List<Token> tokens = tokens(lexer);

        assertThat(tokens.stream().map(Token::type).collect(Collectors.toList()), contains(
            TokenType.RAW,
            TokenType.WHITESPACE_FULL,
            TokenType.CODE_ENTER,
            TokenType.IDENTIFIER,
            TokenType.CODE_EXIT,
            TokenType.EOF
        ));
        assertThat(tokens.get(0).getText(lexer.getText()), is("a"));
        assertThat(tokens.get(1).getText(lexer.getText()), is("  "));
    }

    @Test
    void lexesEscapeBlocks() {
        Lexer lexer = new Lexer("{%{ {{ raw }} }%}");

        assertThat(types(lexer), contains(
            TokenType.ESCAPE_ENTER,
            TokenType.ESCAPE,
            TokenType.ESCAPE_EXIT,
            TokenType.EOF
        ));
    }

    @Test
    void lexesLiquidTags() {
        LexerOptions options = LexerOptions.builder().dialect(Dialect.LIQUID).build();
        Lexer lexer = new Lexer("{% if x %}y{% endif %}", null, options);

        assertThat(types(lexer), contains(
            TokenType.LIQUID_TAG_ENTER,
            TokenType.IDENTIFIER,
            TokenType.IDENTIFIER,
            TokenType.LIQUID_TAG_EXIT,
            TokenType.RAW,
            TokenType.LIQUID_TAG_ENTER,
            TokenType.IDENTIFIER,
            TokenType.LIQUID_TAG_EXIT,
            TokenType.EOF
        ));
    }

    @Test
    void turnsLiquidCommentIntoComment() {
        LexerOptions options = LexerOptions.builder().dialect(Dialect.LIQUID).build();
        Lexer lexer = new Lexer("a{% comment %}hidden{% endcomment %}b", null, options);

        List<Token> tokens = tokens(lexer);

        assertThat(tokens.stream().map(Token::type).collect(Collectors.toList()), contains(
            TokenType.RAW,
            TokenType.CODE_ENTER,
            TokenType.COMMENT_MULTI,
            TokenType.CODE_EXIT,
            TokenType.RAW,
            TokenType.EOF
        ));
        assertThat(tokens.get(2).getText(lexer.getText()), is("hidden"));
    }

    @Test
    void lexesFrontMatterMarkers() {
        LexerOptions options = LexerOptions.builder().mode(ScriptMode.FRONT_MATTER_AND_CONTENT).build();
        Lexer lexer = new Lexer("+++\nx = 1\n+++\nbody", null, options);

        List<TokenType> types = types(lexer);

        assertThat(types.get(0), is(TokenType.FRONT_MATTER_MARKER));
        assertThat(types.contains(TokenType.RAW), is(true));
        assertThat(types.stream().filter(t -> t == TokenType.FRONT_MATTER_MARKER).count(), is(2L));
    }

    @Test
    void stopsAtFirstError() {
        Lexer lexer = new Lexer("{{ \"abc", "test.txt", null);

        List<Token> tokens = tokens(lexer);

        assertThat(tokens.stream().map(Token::type).collect(Collectors.toList()), contains(
            TokenType.CODE_ENTER,
            TokenType.INVALID,
            TokenType.EOF
        ));
        assertThat(lexer.getErrors(), hasSize(1));
        LogMessage error = lexer.getErrors().get(0);
        assertThat(error.isError(), is(true));
        assertThat(error.span().fileName(), is("test.txt"));
        assertThat(error.message(), containsString("Unexpected end of file while parsing a string not terminated by a \""));
    }

    @Test
    void reportsUnbalancedBraceInScriptOnlyMode() {
        Lexer lexer = new Lexer("x }", null, scriptOnly());

        tokens(lexer);

        assertThat(lexer.getErrors(), hasSize(1));
        assertThat(lexer.getErrors().get(0).message(), is("Unexpected } while no matching {"));
    }

    @Test
    void restartsOnEachIteration() {
        Lexer lexer = new Lexer("{{ a }}");

        List<TokenType> first = types(lexer);
        List<TokenType> second = types(lexer);

        assertThat(second, is(first));
    }

    @Test
    void rejectsStartPositionOutOfRange() {
        LexerOptions options = LexerOptions.builder().startPosition(new TextPosition(10, 0, 10)).build();

        IllegalArgumentException exception = Assertions.assertThrows(
            IllegalArgumentException.class,
            () -> new Lexer("abc", null, options)
        );

        assertThat(exception.getMessage(), containsString("out of range"));
    }

    @Test
    void lexesInterpolatedStrings() {
        Lexer lexer = new Lexer("{{ $\"Begin {2} middle {5} end\" }}");

        List<Token> tokens = tokens(lexer);

        assertThat(tokens.stream().map(Token::type).collect(Collectors.toList()), contains(
            TokenType.CODE_ENTER,
            TokenType.BEGIN_INTERPOLATED_STRING,
            TokenType.OPEN_INTERPOLATED_BRACE,
            TokenType.INTEGER,
            TokenType.CLOSE_INTERPOLATED_BRACE,
            TokenType.CONTINUATION_INTERPOLATED_STRING,
            TokenType.OPEN_INTERPOLATED_BRACE,
            TokenType.INTEGER,
            TokenType.CLOSE_INTERPOLATED_BRACE,
            TokenType.ENDING_INTERPOLATED_STRING,
            TokenType.CODE_EXIT,
            TokenType.EOF
        ));
        String text = lexer.getText();
        assertThat(tokens.get(1).start().offset(), is(3));
        assertThat(tokens.get(1).getText(text), is("$\"Begin {"));
        assertThat(tokens.get(2).start().offset(), is(11));
        assertThat(tokens.get(4).start().offset(), is(13));
        assertThat(tokens.get(5).getText(text), is("} middle {"));
        assertThat(tokens.get(9).getText(text), is("} end\""));
        assertThat(lexer.hasErrors(), is(false));
    }

    @Test
    void keepsObjectBracesInsideInterpolationHoles() {
        Lexer lexer = new Lexer("$'a{ {b: 1}.b }\\{c\\}' $x", null, scriptOnly());

        assertThat(types(lexer), contains(
            TokenType.BEGIN_INTERPOLATED_STRING,
            TokenType.OPEN_INTERPOLATED_BRACE,
            TokenType.OPEN_BRACE,
            TokenType.IDENTIFIER,
            TokenType.COLON,
            TokenType.INTEGER,
            TokenType.CLOSE_BRACE,
            TokenType.DOT,
            TokenType.IDENTIFIER,
            TokenType.CLOSE_INTERPOLATED_BRACE,
            TokenType.ENDING_INTERPOLATED_STRING,
            TokenType.IDENTIFIER_SPECIAL,
            TokenType.EOF
        ));
        assertThat(lexer.hasErrors(), is(false));
    }

    @Test
    void reportsUnterminatedInterpolatedString() {
        Lexer lexer = new Lexer("{{ $\"a{1}b }}");

        tokens(lexer);

        assertThat(lexer.getErrors(), hasSize(1));
        assertThat(lexer.getErrors().get(0).message(), is("Unexpected end of file while parsing an interpolated string not terminated by a \""));
    }
}
