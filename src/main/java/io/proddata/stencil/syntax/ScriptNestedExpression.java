package io.proddata.stencil.syntax;

import io.proddata.stencil.parsing.TokenType;
import lombok.Getter;
import lombok.Setter;

@Getter
@Setter
@ScriptSyntax(name = "nested expression", example = "(<expression>)")
public class ScriptNestedExpression extends ScriptExpression implements ScriptVariablePath {
    private ScriptToken openParen = new ScriptToken(TokenType.OPEN_PAREN);
    private ScriptExpression expression;
    private ScriptToken closeParen = new ScriptToken(TokenType.CLOSE_PAREN);

    public static ScriptNestedExpression wrap(ScriptExpression expression) {
        return wrap(expression, false);
    }

    /**
     * Wraps an expression in parentheses. With {@code transferTrivia}, the trivia before the first terminal of the
     * expression moves before the opening parenthesis and the trivia after its last terminal moves after the
     * closing one.
     */
    public static ScriptNestedExpression wrap(ScriptExpression expression, boolean transferTrivia) {
        ScriptNestedExpression nested = new ScriptNestedExpression();
        nested.setSpan(expression.getSpan());
        nested.setExpression(expression);
        if (transferTrivia) {
            ScriptTerminal first = firstTerminal(expression);
            if (first != null && first.getTrivias() != null && !first.getTrivias().getBefore().isEmpty()) {
                nested.openParen.addTrivias(first.getTrivias().getBefore(), true);
                first.getTrivias().getBefore().clear();
            }
            ScriptTerminal last = lastTerminal(expression);
            if (last != null && last.getTrivias() != null && !last.getTrivias().getAfter().isEmpty()) {
                nested.closeParen.addTrivias(last.getTrivias().getAfter(), false);
                last.getTrivias().getAfter().clear();
            }
        }
        return nested;
    }

    /**
     * @return the leftmost terminal of a variable path, {@code null} for other expressions
     */
    public static ScriptTerminal firstTerminal(ScriptNode node) {
        if (node instanceof ScriptTerminal terminal) {
            return terminal;
        }
        if (node instanceof ScriptMemberExpression member) {
            return firstTerminal(member.getTarget());
        }
        if (node instanceof ScriptIndexerExpression indexer) {
            return firstTerminal(indexer.getTarget());
        }
        if (node instanceof ScriptIsEmptyExpression isEmpty) {
            return firstTerminal(isEmpty.getTarget());
        }
        if (node instanceof ScriptNestedExpression nested) {
            return nested.getOpenParen();
        }
        if (node instanceof ScriptThisExpression self) {
            return self.getThisKeyword();
        }
        return null;
    }

    /**
     * @return the rightmost terminal of a variable path, {@code null} for other expressions
     */
    public static ScriptTerminal lastTerminal(ScriptNode node) {
        if (node instanceof ScriptTerminal terminal) {
            return terminal;
        }
        if (node instanceof ScriptMemberExpression member) {
            return member.getMember();
        }
        if (node instanceof ScriptIndexerExpression indexer) {
            return indexer.getCloseBracket();
        }
        if (node instanceof ScriptIsEmptyExpression isEmpty) {
            return isEmpty.getQuestionToken();
        }
        if (node instanceof ScriptNestedExpression nested) {
            return nested.getCloseParen();
        }
        if (node instanceof ScriptThisExpression self) {
            return self.getThisKeyword();
        }
        return null;
    }

    @Override
    public String getFirstPath() {
        return expression instanceof ScriptVariablePath path ? path.getFirstPath() : null;
    }

    @Override
    public <R> R accept(ScriptVisitor<R> visitor) {
        return visitor.visit(this);
    }
}
