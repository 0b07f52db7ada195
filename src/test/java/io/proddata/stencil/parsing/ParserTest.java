package io.proddata.stencil.parsing;

import io.proddata.stencil.syntax.ScriptBinaryExpression;
import io.proddata.stencil.syntax.ScriptBinaryOperator;
import io.proddata.stencil.syntax.ScriptConditionalExpression;
import io.proddata.stencil.syntax.ScriptElseStatement;
import io.proddata.stencil.syntax.ScriptExpression;
import io.proddata.stencil.syntax.ScriptExpressionStatement;
import io.proddata.stencil.syntax.ScriptForStatement;
import io.proddata.stencil.syntax.ScriptIfStatement;
import io.proddata.stencil.syntax.ScriptInterpolatedExpression;
import io.proddata.stencil.syntax.ScriptInterpolatedStringExpression;
import io.proddata.stencil.syntax.ScriptIsEmptyExpression;
import io.proddata.stencil.syntax.ScriptLiteral;
import io.proddata.stencil.syntax.ScriptMemberExpression;
import io.proddata.stencil.syntax.ScriptPage;
import io.proddata.stencil.syntax.ScriptPipeCall;
import io.proddata.stencil.syntax.ScriptRawStatement;
import io.proddata.stencil.syntax.ScriptStatement;
import io.proddata.stencil.syntax.ScriptStringQuoteType;
import io.proddata.stencil.syntax.ScriptUnaryExpression;
import io.proddata.stencil.syntax.ScriptUnaryOperator;
import io.proddata.stencil.syntax.ScriptVariable;
import io.proddata.stencil.syntax.ScriptVariableScope;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.util.List;
import java.util.stream.Collectors;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.instanceOf;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.notNullValue;
import static org.hamcrest.Matchers.nullValue;

class ParserTest {
    private static Parser parser(String text, LexerOptions options) {
        return new Parser(new Lexer(text, null, options));
    }

    private static ScriptPage parse(String text) {
        Parser parser = parser(text, null);
        ScriptPage page = parser.run();
        assertThat(parser.getMessages().toString(), parser.hasErrors(), is(false));
        return page;
    }

    private static ScriptExpression parseExpression(String text) {
        Parser parser = parser(text, LexerOptions.builder().mode(ScriptMode.SCRIPT_ONLY).build());
        ScriptPage page = parser.run();
        assertThat(parser.getMessages().toString(), parser.hasErrors(), is(false));
        List<ScriptStatement> statements = page.getBody().getStatements();
        assertThat(statements, hasSize(1));
        return ((ScriptExpressionStatement) statements.get(0)).getExpression();
    }

    @SuppressWarnings("unchecked")
    private static <T extends ScriptStatement> List<T> statementsOf(List<ScriptStatement> statements, Class<T> type) {
        return (List<T>) statements.stream().filter(type::isInstance).collect(Collectors.toList());
    }

    @Test
    void parsesRawTextAndExpression() {
        ScriptPage page = parse("Hello {{ name }}!");

        List<ScriptStatement> statements = page.getBody().getStatements();
        List<ScriptRawStatement> raws = statementsOf(statements, ScriptRawStatement.class);
        assertThat(raws, hasSize(2));
        assertThat(raws.get(0).getText(), is("Hello "));
        assertThat(raws.get(1).getText(), is("!"));

        List<ScriptExpressionStatement> expressions = statementsOf(statements, ScriptExpressionStatement.class);
        assertThat(expressions, hasSize(1));
        ScriptVariable variable = (ScriptVariable) expressions.get(0).getExpression();
        assertThat(variable.getName(), is("name"));
        assertThat(variable.getScope(), is(ScriptVariableScope.GLOBAL));
    }

    @Test
    void parsesIfElse() {
        ScriptPage page = parse("{{ if count > 1 }}many{{ else }}one{{ end }}");

        List<ScriptIfStatement> ifs = statementsOf(page.getBody().getStatements(), ScriptIfStatement.class);
        assertThat(ifs, hasSize(1));
        ScriptIfStatement ifStatement = ifs.get(0);
        assertThat(ifStatement.isInvert(), is(false));
        ScriptBinaryExpression condition = (ScriptBinaryExpression) ifStatement.getCondition();
        assertThat(condition.getOperator(), is(ScriptBinaryOperator.COMPARE_GREATER));
        assertThat(ifStatement.getElseStatement(), instanceOf(ScriptElseStatement.class));

        List<ScriptRawStatement> thenRaws = statementsOf(ifStatement.getThen().getStatements(), ScriptRawStatement.class);
        assertThat(thenRaws.get(0).getText(), is("many"));
    }

    @Test
    void parsesElseIfChain() {
        ScriptPage page = parse("{{ if a }}1{{ else if b }}2{{ else }}3{{ end }}");

        ScriptIfStatement ifStatement = statementsOf(page.getBody().getStatements(), ScriptIfStatement.class).get(0);
        ScriptIfStatement elseIf = (ScriptIfStatement) ifStatement.getElseStatement();
        assertThat(elseIf.isElseIf(), is(true));
        assertThat(elseIf.getElseStatement(), instanceOf(ScriptElseStatement.class));
    }

    @Test
    void parsesForLoop() {
        ScriptPage page = parse("{{ for item in items }}{{ item }}{{ end }}");

        List<ScriptForStatement> loops = statementsOf(page.getBody().getStatements(), ScriptForStatement.class);
        assertThat(loops, hasSize(1));
        assertThat(((ScriptVariable) loops.get(0).getVariable()).getName(), is("item"));
        assertThat(((ScriptVariable) loops.get(0).getIterator()).getName(), is("items"));
    }

    @Test
    void reportsMissingEnd() {
        Parser parser = parser("{{ if a }}text", null);

        ScriptPage page = parser.run();

        assertThat(page, notNullValue());
        assertThat(parser.hasErrors(), is(true));
        assertThat(parser.getMessages().get(0).message(), containsString("The <end> statement was not found"));
    }

    @Test
    void treatsClosingBracesInTextAsRaw() {
        Parser parser = parser("text }} more", LexerOptions.DEFAULT);

        ScriptPage page = parser.run();

        assertThat(parser.hasErrors(), is(false));
        assertThat(((ScriptRawStatement) page.getBody().getStatements().get(0)).getText(), is("text }} more"));
    }

    @Test
    void keepsParsingAfterInvalidStatementEnd() {
        Parser parser = parser("{{ a b c ) }}after", null);

        ScriptPage page = parser.run();

        assertThat(parser.hasErrors(), is(true));
        List<ScriptRawStatement> raws = statementsOf(page.getBody().getStatements(), ScriptRawStatement.class);
        assertThat(raws.get(raws.size() - 1).getText(), is("after"));
    }

    @Test
    void appliesOperatorPrecedence() {
        ScriptBinaryExpression add = (ScriptBinaryExpression) parseExpression("1 + 2 * 3");

        assertThat(add.getOperator(), is(ScriptBinaryOperator.ADD));
        assertThat(((ScriptLiteral) add.getLeft()).getValue(), is(1));
        ScriptBinaryExpression multiply = (ScriptBinaryExpression) add.getRight();
        assertThat(multiply.getOperator(), is(ScriptBinaryOperator.MULTIPLY));
    }

    @Test
    void parsesLiteralKinds() {
        assertThat(((ScriptLiteral) parseExpression("42")).getValue(), is(42));
        assertThat(((ScriptLiteral) parseExpression("5_000_000_000")).getValue(), is(5_000_000_000L));
        assertThat(((ScriptLiteral) parseExpression("99999999999999999999")).getValue(), is(new BigInteger("99999999999999999999")));
        assertThat(((ScriptLiteral) parseExpression("0xFF")).getValue(), is(255));
        assertThat(((ScriptLiteral) parseExpression("0b101")).getValue(), is(5));
        assertThat(((ScriptLiteral) parseExpression("1.5")).getValue(), is(1.5d));
        assertThat(((ScriptLiteral) parseExpression("2.5f")).getValue(), is(2.5f));
        assertThat(((ScriptLiteral) parseExpression("\"a\\tb\"")).getValue(), is("a\tb"));
        assertThat(((ScriptLiteral) parseExpression("true")).getValue(), is(true));
        assertThat(((ScriptLiteral) parseExpression("null")).getValue(), nullValue());
    }

    @Test
    void parsesMemberAccessAndNullConditional() {
        ScriptMemberExpression member = (ScriptMemberExpression) parseExpression("user?.name");

        assertThat(member.isNullConditional(), is(true));
        assertThat(member.getMember().getName(), is("name"));
        assertThat(((ScriptVariable) member.getTarget()).getName(), is("user"));
    }

    @Test
    void parsesEmptyQuestion() {
        ScriptExpression expression = parseExpression("items.empty?");

        assertThat(expression, instanceOf(ScriptIsEmptyExpression.class));
    }

    @Test
    void parsesLocalVariable() {
        ScriptVariable variable = (ScriptVariable) parseExpression("$count");

        assertThat(variable.getName(), is("count"));
        assertThat(variable.getScope(), is(ScriptVariableScope.LOCAL));
        assertThat(variable.toSourceName(), is("$count"));
    }

    @Test
    void parsesUnaryAndConditional() {
        ScriptConditionalExpression conditional = (ScriptConditionalExpression) parseExpression("!ok ? 1 : 2");

        ScriptUnaryExpression not = (ScriptUnaryExpression) conditional.getCondition();
        assertThat(not.getOperator(), is(ScriptUnaryOperator.NOT));
    }

    @Test
    void parsesPipe() {
        ScriptExpression expression = parseExpression("name | string.upcase");

        assertThat(expression, instanceOf(ScriptPipeCall.class));
    }

    @Test
    void parsesPowerInScientificDialect() {
        LexerOptions options = LexerOptions.builder().dialect(Dialect.SCIENTIFIC).mode(ScriptMode.SCRIPT_ONLY).build();
        Parser parser = parser("2 ^ 3", options);

        ScriptPage page = parser.run();

        ScriptExpressionStatement statement = (ScriptExpressionStatement) page.getBody().getStatements().get(0);
        assertThat(((ScriptBinaryExpression) statement.getExpression()).getOperator(), is(ScriptBinaryOperator.POWER));
    }

    @Test
    void parsesImplicitMultiplicationInScientificDialect() {
        LexerOptions options = LexerOptions.builder().dialect(Dialect.SCIENTIFIC).mode(ScriptMode.SCRIPT_ONLY).build();
        Parser parser = parser("2 x", options);

        ScriptPage page = parser.run();

        ScriptExpressionStatement statement = (ScriptExpressionStatement) page.getBody().getStatements().get(0);
        assertThat(((ScriptBinaryExpression) statement.getExpression()).getOperator(), is(ScriptBinaryOperator.MULTIPLY));
    }

    @Test
    void parsesFrontMatter() {
        LexerOptions options = LexerOptions.builder().mode(ScriptMode.FRONT_MATTER_AND_CONTENT).build();
        Parser parser = parser("+++\ntitle = 'x'\n+++\nbody", options);

        ScriptPage page = parser.run();

        assertThat(parser.hasErrors(), is(false));
        assertThat(page.getFrontMatter(), notNullValue());
        List<ScriptExpressionStatement> frontMatterStatements = statementsOf(
            page.getFrontMatter().getStatements().getStatements(), ScriptExpressionStatement.class);
        assertThat(frontMatterStatements, hasSize(1));
        List<ScriptRawStatement> raws = statementsOf(page.getBody().getStatements(), ScriptRawStatement.class);
        assertThat(raws.get(0).getText(), is("body"));
    }

    @Test
    void rejectsMissingFrontMatter() {
        LexerOptions options = LexerOptions.builder().mode(ScriptMode.FRONT_MATTER_ONLY).build();
        Parser parser = parser("no marker", options);

        ScriptPage page = parser.run();

        assertThat(page, nullValue());
        assertThat(parser.getMessages().get(0).message(), containsString("expecting a `+++` at the beginning of the text"));
    }

    @Test
    void abortsAtDepthLimit() {
        ParserOptions options = ParserOptions.builder().expressionDepthLimit(5).build();
        Parser parser = new Parser(new Lexer("((((((((((1))))))))))", null,
            LexerOptions.builder().mode(ScriptMode.SCRIPT_ONLY).build()), options);

        ScriptPage page = parser.run();

        assertThat(page, nullValue());
        assertThat(parser.hasErrors(), is(true));
        assertThat(parser.getMessages().get(0).message(), containsString("The statement depth limit `5` was reached"));
    }

    @Test
    void reportsLexerErrors() {
        Parser parser = parser("{{ 'open", null);

        parser.run();

        assertThat(parser.hasErrors(), is(true));
        assertThat(parser.getMessages().stream().anyMatch(m -> m.message().contains("string not terminated")), is(true));
    }

    @Test
    void parsesInterpolatedString() {
        ScriptExpression expression = parseExpression("$\"Hello {user.name}, {1 + 2}!\"");

        assertThat(expression, instanceOf(ScriptInterpolatedStringExpression.class));
        List<ScriptExpression> parts = ((ScriptInterpolatedStringExpression) expression).getParts();
        assertThat(parts, hasSize(5));
        assertThat(((ScriptLiteral) parts.get(0)).getValue(), is("Hello "));
        assertThat(((ScriptLiteral) parts.get(0)).getSourceText(), is("$\"Hello "));
        assertThat(((ScriptInterpolatedExpression) parts.get(1)).getExpression(), instanceOf(ScriptMemberExpression.class));
        assertThat(((ScriptLiteral) parts.get(2)).getValue(), is(", "));
        assertThat(((ScriptInterpolatedExpression) parts.get(3)).getExpression(), instanceOf(ScriptBinaryExpression.class));
        assertThat(((ScriptLiteral) parts.get(4)).getValue(), is("!"));
        assertThat(((ScriptLiteral) parts.get(4)).getSourceText(), is("!\""));
    }

    @Test
    void parsesInterpolatedStringWithoutHoles() {
        ScriptInterpolatedStringExpression expression = (ScriptInterpolatedStringExpression) parseExpression("$'a\\{b\\}\\n'");

        assertThat(expression.getQuoteType(), is(ScriptStringQuoteType.SIMPLE_QUOTE));
        assertThat(expression.getParts(), hasSize(1));
        assertThat(((ScriptLiteral) expression.getParts().get(0)).getValue(), is("a{b}\n"));
    }

    @Test
    void reportsInvalidIncrementOperandOnce() {
        Parser parser = parser("-- ".repeat(40) + "1", LexerOptions.builder().mode(ScriptMode.SCRIPT_ONLY).build());

        parser.run();

        assertThat(parser.hasErrors(), is(true));
        assertThat(parser.getMessages().stream()
            .filter(m -> m.message().contains("increment or decrement"))
            .count(), is(1L));
    }
}
