package io.proddata.stencil.syntax;

import io.proddata.stencil.parsing.Dialect;
import io.proddata.stencil.parsing.Lexer;
import io.proddata.stencil.parsing.LexerOptions;
import io.proddata.stencil.parsing.Parser;
import io.proddata.stencil.parsing.ScriptMode;
import org.junit.jupiter.api.Test;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.is;

class ScriptPrinterTest {
    private static String roundTrip(String text, Dialect dialect) {
        LexerOptions options = LexerOptions.builder().dialect(dialect).keepTrivia(true).build();
        Parser parser = new Parser(new Lexer(text, null, options));
        ScriptPage page = parser.run();
        assertThat(parser.getMessages().toString(), parser.hasErrors(), is(false));
        return ScriptPrinter.print(page, false, true);
    }

    private static ScriptNode parseScript(String text) {
        LexerOptions options = LexerOptions.builder().mode(ScriptMode.SCRIPT_ONLY).build();
        Parser parser = new Parser(new Lexer(text, null, options));
        ScriptPage page = parser.run();
        assertThat(parser.getMessages().toString(), parser.hasErrors(), is(false));
        return page;
    }

    @Test
    void printsTextAndExpressionVerbatim() {
        String text = "Hello {{ name }}!";

        assertThat(roundTrip(text, Dialect.DEFAULT), is(text));
    }

    @Test
    void printsStatementsVerbatim() {
        String text = "{{ if count > 1 }}many{{ else }}one{{ end }}\n{{ for i in 1..3 }}{{ i }}{{ end }}";

        assertThat(roundTrip(text, Dialect.DEFAULT), is(text));
    }

    @Test
    void printsWhitespaceControlVerbatim() {
        String text = "a  {{- x -}}  b";

        assertThat(roundTrip(text, Dialect.DEFAULT), is(text));
    }

    @Test
    void printsLiquidVerbatim() {
        String text = "{% if user %}Hi {{ user.name }}{% endif %}";

        assertThat(roundTrip(text, Dialect.LIQUID), is(text));
    }

    @Test
    void insertsSpacesWithoutTrivia() {
        ScriptNode page = parseScript("1+2*3");

        assertThat(ScriptPrinter.print((ScriptPage) page, true, false), is("1 + 2 * 3"));
    }

    @Test
    void printsNodesAsCode() {
        ScriptPage page = (ScriptPage) parseScript("user.name");
        ScriptExpressionStatement statement = (ScriptExpressionStatement) page.getBody().getStatements().get(0);

        assertThat(statement.getExpression().toString(), is("user.name"));
    }

    @Test
    void printsInterpolatedStringVerbatim() {
        String text = "{{ $\"Hello { user.name }, {1+2}!\" }}";

        assertThat(roundTrip(text, Dialect.DEFAULT), is(text));
    }

    @Test
    void printsBuiltInterpolatedString() {
        ScriptMemberExpression name = new ScriptMemberExpression();
        name.setTarget(ScriptVariable.global("user"));
        name.setMember(ScriptVariable.global("name"));
        ScriptInterpolatedStringExpression interpolated = new ScriptInterpolatedStringExpression()
            .addText("Hello \"")
            .addExpression(name)
            .addText("\" {ok}");

        assertThat(interpolated.toString(), is("$\"Hello \\\"{user.name}\\\" \\{ok\\}\""));

        interpolated.setQuoteType(ScriptStringQuoteType.SIMPLE_QUOTE);
        interpolated.getParts().remove(2);
        assertThat(interpolated.toString(), is("$'Hello \"{user.name}'"));
    }

    @Test
    void movesTriviaAroundWrappedLiquidKeyword() {
        assertThat(roundTrip("{{ forloop.index }}", Dialect.LIQUID), is("{{ (forloop.index) }}"));
    }

    @Test
    void printsLiquidIncrementVerbatim() {
        String text = "{% increment counter %}{% decrement counter %}";

        assertThat(roundTrip(text, Dialect.LIQUID), is(text));
    }
}
