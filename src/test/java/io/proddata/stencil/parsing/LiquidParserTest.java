package io.proddata.stencil.parsing;

import io.proddata.stencil.syntax.ScriptAssignExpression;
import io.proddata.stencil.syntax.ScriptBinaryExpression;
import io.proddata.stencil.syntax.ScriptBinaryOperator;
import io.proddata.stencil.syntax.ScriptCaseStatement;
import io.proddata.stencil.syntax.ScriptExpressionStatement;
import io.proddata.stencil.syntax.ScriptForStatement;
import io.proddata.stencil.syntax.ScriptFunctionCall;
import io.proddata.stencil.syntax.ScriptIfStatement;
import io.proddata.stencil.syntax.ScriptMemberExpression;
import io.proddata.stencil.syntax.ScriptPage;
import io.proddata.stencil.syntax.ScriptPipeCall;
import io.proddata.stencil.syntax.ScriptRawStatement;
import io.proddata.stencil.syntax.ScriptStatement;
import io.proddata.stencil.syntax.ScriptVariable;
import io.proddata.stencil.syntax.ScriptWhenStatement;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.instanceOf;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.notNullValue;

class LiquidParserTest {
    private static final LexerOptions LIQUID = LexerOptions.builder().dialect(Dialect.LIQUID).build();

    private static Parser parser(String text) {
        return new Parser(new Lexer(text, null, LIQUID));
    }

    private static ScriptPage parse(String text) {
        Parser parser = parser(text);
        ScriptPage page = parser.run();
        assertThat(parser.getMessages().toString(), parser.hasErrors(), is(false));
        return page;
    }

    @SuppressWarnings("unchecked")
    private static <T extends ScriptStatement> List<T> statementsOf(List<ScriptStatement> statements, Class<T> type) {
        return (List<T>) statements.stream().filter(type::isInstance).collect(Collectors.toList());
    }

    @Test
    void parsesIfWithLiquidOperators() {
        ScriptPage page = parse("{% if name contains 'a' and count > 1 %}yes{% endif %}");

        ScriptIfStatement ifStatement = statementsOf(page.getBody().getStatements(), ScriptIfStatement.class).get(0);
        ScriptBinaryExpression condition = (ScriptBinaryExpression) ifStatement.getCondition();
        assertThat(condition.getOperator(), is(ScriptBinaryOperator.AND));
        assertThat(((ScriptBinaryExpression) condition.getLeft()).getOperator(), is(ScriptBinaryOperator.LIQUID_CONTAINS));
    }

    @Test
    void parsesElsif() {
        ScriptPage page = parse("{% if a %}1{% elsif b %}2{% else %}3{% endif %}");

        ScriptIfStatement ifStatement = statementsOf(page.getBody().getStatements(), ScriptIfStatement.class).get(0);
        ScriptIfStatement elsif = (ScriptIfStatement) ifStatement.getElseStatement();
        assertThat(elsif.isElseIf(), is(true));
        assertThat(elsif.getIfKeyword().getText(), is("elsif"));
        assertThat(elsif.getElseStatement(), notNullValue());
    }

    @Test
    void parsesUnlessAsInvertedIf() {
        ScriptPage page = parse("{% unless done %}todo{% endunless %}");

        ScriptIfStatement ifStatement = statementsOf(page.getBody().getStatements(), ScriptIfStatement.class).get(0);
        assertThat(ifStatement.isInvert(), is(true));
        assertThat(((ScriptVariable) ifStatement.getCondition()).getName(), is("done"));
    }

    @Test
    void parsesIfChangedAsForChanged() {
        ScriptPage page = parse("{% for x in xs %}{% ifchanged %}{{ x }}{% endifchanged %}{% endfor %}");

        ScriptForStatement loop = statementsOf(page.getBody().getStatements(), ScriptForStatement.class).get(0);
        assertThat(loop.isSetContinue(), is(true));
        ScriptIfStatement ifChanged = statementsOf(loop.getBody().getStatements(), ScriptIfStatement.class).get(0);
        ScriptMemberExpression condition = (ScriptMemberExpression) ifChanged.getCondition();
        assertThat(((ScriptVariable) condition.getTarget()).getName(), is("for"));
        assertThat(condition.getMember().getName(), is("changed"));
    }

    @Test
    void parsesAssign() {
        ScriptPage page = parse("{% assign total = count %}");

        ScriptExpressionStatement statement = statementsOf(page.getBody().getStatements(), ScriptExpressionStatement.class).get(0);
        assertThat(statement.getTagKeyword(), notNullValue());
        assertThat(statement.getExpression(), instanceOf(ScriptAssignExpression.class));
    }

    @Test
    void parsesCaseWhen() {
        ScriptPage page = parse("{% case x %}{% when 1, 2 %}low{% else %}high{% endcase %}");

        ScriptCaseStatement caseStatement = statementsOf(page.getBody().getStatements(), ScriptCaseStatement.class).get(0);
        ScriptWhenStatement when = statementsOf(caseStatement.getBody().getStatements(), ScriptWhenStatement.class).get(0);
        assertThat(when.getValues(), hasSize(2));
        assertThat(when.getNext(), notNullValue());
    }

    @Test
    void parsesCycleAsFunctionCall() {
        ScriptPage page = parse("{% for x in xs %}{% cycle 'odd', 'even' %}{% endfor %}");

        ScriptForStatement loop = statementsOf(page.getBody().getStatements(), ScriptForStatement.class).get(0);
        ScriptExpressionStatement cycle = statementsOf(loop.getBody().getStatements(), ScriptExpressionStatement.class).get(0);
        ScriptFunctionCall call = (ScriptFunctionCall) cycle.getExpression();
        assertThat(((ScriptVariable) call.getTarget()).getName(), is("cycle"));
        assertThat(call.getArguments(), hasSize(1));
    }

    @Test
    void parsesRawBlock() {
        ScriptPage page = parse("{% raw %}{{ not code }}{% endraw %}");

        List<ScriptRawStatement> raws = statementsOf(page.getBody().getStatements(), ScriptRawStatement.class);
        assertThat(raws, hasSize(1));
        assertThat(raws.get(0).isEscape(), is(true));
        assertThat(raws.get(0).getText(), is("{{ not code }}"));
    }

    @Test
    void rewritesFiltersToQualifiedNames() {
        ParserOptions options = ParserOptions.builder().qualifyLiquidFunctions(true).build();
        Parser parser = new Parser(new Lexer("{{ name | upcase }}", null, LIQUID), options);

        ScriptPage page = parser.run();

        ScriptExpressionStatement statement = statementsOf(page.getBody().getStatements(), ScriptExpressionStatement.class).get(0);
        ScriptPipeCall pipe = (ScriptPipeCall) statement.getExpression();
        ScriptFunctionCall call = (ScriptFunctionCall) pipe.getTo();
        ScriptMemberExpression target = (ScriptMemberExpression) call.getTarget();
        assertThat(((ScriptVariable) target.getTarget()).getName(), is("string"));
        assertThat(target.getMember().getName(), is("upcase"));
    }

    @Test
    void reportsMissingEndTag() {
        Parser parser = parser("{% if x %}dangling");

        parser.run();

        assertThat(parser.hasErrors(), is(true));
        assertThat(parser.getMessages().get(0).message(), containsString("The `endif` was not found"));
    }

    @Test
    void reportsEndTagWithoutStart() {
        Parser parser = parser("{% endfor %}");

        parser.run();

        assertThat(parser.hasErrors(), is(true));
        assertThat(parser.getMessages().get(0).message(), is("Unable to find a pending `for` for this `endfor`"));
    }
}
