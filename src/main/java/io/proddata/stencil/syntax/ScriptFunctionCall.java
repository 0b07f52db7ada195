package io.proddata.stencil.syntax;

import lombok.Getter;
import lombok.Setter;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

@Getter
@Setter
@ScriptSyntax(name = "function call expression", example = "<target_expression> <arguemnt[0]> ... <arguement[n]>")
public class ScriptFunctionCall extends ScriptExpression {
    private ScriptExpression target;
    private ScriptToken openParen;
    private final List<ScriptExpression> arguments = new ArrayList<>();
    private ScriptToken closeParen;
    /** Arguments between parentheses, {@code f(a, b)}, rather than juxtaposed, {@code f a b}. */
    private boolean explicitCall;

    public void addArgument(ScriptExpression argument) {
        arguments.add(argument);
        if (closeParen == null && argument.getSpan() != null) {
            setSpanEnd(argument.getSpan().end());
        }
    }

    /**
     * Reads {@code name(a, b)} as the head of a short function declaration, {@code name(a, b) = <expression>}.
     */
    public Optional<ScriptFunction> toFunctionDeclaration() {
        if (!explicitCall || openParen == null || closeParen == null) {
            return Optional.empty();
        }
        if (!(target instanceof ScriptVariable name) || name.getScope() != ScriptVariableScope.GLOBAL) {
            return Optional.empty();
        }
        List<ScriptParameter> parameters = new ArrayList<>();
        for (ScriptExpression argument : arguments) {
            if (!(argument instanceof ScriptVariable variable) || variable.getScope() != ScriptVariableScope.GLOBAL) {
                return Optional.empty();
            }
            ScriptParameter parameter = new ScriptParameter();
            parameter.setSpan(variable.getSpan());
            parameter.setName(variable);
            parameters.add(parameter);
        }
        ScriptFunction function = new ScriptFunction();
        function.setSpan(getSpan());
        function.setNameOrDoToken(name);
        function.setOpenParen(openParen);
        function.setCloseParen(closeParen);
        function.setParameters(parameters);
        return Optional.of(function);
    }

    @Override
    public boolean canHaveLeadingTrivia() {
        return false;
    }

    @Override
    public <R> R accept(ScriptVisitor<R> visitor) {
        return visitor.visit(this);
    }
}
