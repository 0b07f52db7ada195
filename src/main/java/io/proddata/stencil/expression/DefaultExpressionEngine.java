package io.proddata.stencil.expression;

import com.amazon.ion.IonStruct;
import io.proddata.stencil.ion.CastException;
import io.proddata.stencil.ion.IonOptionsReader;
import io.proddata.stencil.ion.IonValueAccessor;
import io.proddata.stencil.ion.IonValueUtils;
import io.proddata.stencil.parsing.Dialect;
import io.proddata.stencil.parsing.Lexer;
import io.proddata.stencil.parsing.LexerOptions;
import io.proddata.stencil.parsing.LogMessage;
import io.proddata.stencil.parsing.Parser;
import io.proddata.stencil.parsing.ParserOptions;
import io.proddata.stencil.parsing.ScriptMode;
import io.proddata.stencil.syntax.ScriptArrayInitializerExpression;
import io.proddata.stencil.syntax.ScriptBinaryExpression;
import io.proddata.stencil.syntax.ScriptBinaryOperator;
import io.proddata.stencil.syntax.ScriptConditionalExpression;
import io.proddata.stencil.syntax.ScriptExpression;
import io.proddata.stencil.syntax.ScriptExpressionStatement;
import io.proddata.stencil.syntax.ScriptIndexerExpression;
import io.proddata.stencil.syntax.ScriptInterpolatedExpression;
import io.proddata.stencil.syntax.ScriptInterpolatedStringExpression;
import io.proddata.stencil.syntax.ScriptIsEmptyExpression;
import io.proddata.stencil.syntax.ScriptLiteral;
import io.proddata.stencil.syntax.ScriptMemberExpression;
import io.proddata.stencil.syntax.ScriptNestedExpression;
import io.proddata.stencil.syntax.ScriptNode;
import io.proddata.stencil.syntax.ScriptObjectInitializerExpression;
import io.proddata.stencil.syntax.ScriptObjectMember;
import io.proddata.stencil.syntax.ScriptPage;
import io.proddata.stencil.syntax.ScriptStatement;
import io.proddata.stencil.syntax.ScriptThisExpression;
import io.proddata.stencil.syntax.ScriptUnaryExpression;
import io.proddata.stencil.syntax.ScriptVariable;
import io.proddata.stencil.syntax.ScriptVariableScope;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Evaluates standalone expressions against Ion data. Parsed expressions are cached per source text.
 * <p>
 * Only side-effect free expressions are supported: literals, global variables, member and indexer
 * access, {@code .empty?}, unary, binary and conditional expressions, array and object initializers
 * and ranges. Function calls, pipes and assignments need a template renderer.
 */
public final class DefaultExpressionEngine implements ExpressionEngine {
    private static final Logger logger = LoggerFactory.getLogger(DefaultExpressionEngine.class);
    private static final String SOURCE_PATH = "<expression>";

    private final Map<String, ScriptNode> cache = new ConcurrentHashMap<>();
    private final LexerOptions lexerOptions;
    private final ParserOptions parserOptions;
    private final EvaluationContext context;

    public DefaultExpressionEngine() {
        this(Dialect.DEFAULT);
    }

    /**
     * The scientific dialect evaluates in strict mode.
     */
    public DefaultExpressionEngine(Dialect dialect) {
        this(dialect, dialect == Dialect.SCIENTIFIC ? EvaluationOptions.strictMode() : EvaluationOptions.DEFAULT);
    }

    public DefaultExpressionEngine(Dialect dialect, EvaluationOptions evaluationOptions) {
        this(dialect, evaluationOptions, ParserOptions.DEFAULT);
    }

    public DefaultExpressionEngine(Dialect dialect, EvaluationOptions evaluationOptions, ParserOptions parserOptions) {
        this.lexerOptions = LexerOptions.builder()
            .dialect(dialect == null ? Dialect.DEFAULT : dialect)
            .mode(ScriptMode.SCRIPT_ONLY)
            .build();
        this.parserOptions = parserOptions == null ? ParserOptions.DEFAULT : parserOptions;
        this.context = new DefaultEvaluationContext(evaluationOptions, new IonValueAccessor());
    }

    /**
     * Builds an engine from Ion configuration text such as {@code {dialect: "scientific", locale: "fr-FR"}}.
     *
     * @see IonOptionsReader
     */
    public static DefaultExpressionEngine fromConfig(String ionConfig) throws CastException {
        IonStruct config = IonValueUtils.parseStruct(ionConfig);
        return new DefaultExpressionEngine(
            IonOptionsReader.lexerOptions(config).getDialect(),
            IonOptionsReader.evaluationOptions(config),
            IonOptionsReader.parserOptions(config)
        );
    }

    @Override
    public Value evaluate(String expression, IonStruct globals) throws ExpressionException {
        if (expression == null || expression.isBlank()) {
            return Value.NULL;
        }
        ScriptNode compiled;
        try {
            compiled = cache.computeIfAbsent(expression, this::compile);
        } catch (IllegalArgumentException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            throw new ExpressionException("Invalid expression: " + expression, cause);
        }
        if (!(compiled instanceof ScriptExpression root)) {
            throw unsupported(compiled);
        }
        return eval(root, Value.ofObject(globals));
    }

    /**
     * @return the expression, or the statement that stands in its place
     */
    private ScriptNode compile(String expression) {
        logger.debug("Compiling expression '{}'", expression);
        Parser parser = new Parser(new Lexer(expression, SOURCE_PATH, lexerOptions), parserOptions);
        ScriptPage page = parser.run();
        if (page == null || parser.hasErrors()) {
            LogMessage error = parser.getMessages().stream()
                .filter(LogMessage::isError)
                .findFirst()
                .orElse(null);
            String message = error == null ? "Unable to parse the expression" : error.message();
            throw new IllegalArgumentException(new ExpressionException(error == null ? null : error.span(), message));
        }

        List<ScriptStatement> statements = page.getBody().getStatements();
        if (statements.size() != 1) {
            return page.getBody();
        }
        ScriptStatement statement = statements.get(0);
        if (statement instanceof ScriptExpressionStatement expressionStatement && expressionStatement.getExpression() != null) {
            return expressionStatement.getExpression();
        }
        return statement;
    }

    private Value eval(ScriptExpression node, Value globals) throws ExpressionException {
        if (node instanceof ScriptLiteral literal) {
            return Value.from(literal.getValue());
        }
        if (node instanceof ScriptVariable variable) {
            return evalVariable(variable, globals);
        }
        if (node instanceof ScriptThisExpression) {
            return globals;
        }
        if (node instanceof ScriptNestedExpression nested) {
            return eval(nested.getExpression(), globals);
        }
        if (node instanceof ScriptInterpolatedExpression hole) {
            return eval(hole.getExpression(), globals);
        }
        if (node instanceof ScriptInterpolatedStringExpression interpolated) {
            StringBuilder builder = new StringBuilder();
            for (ScriptExpression part : interpolated.getParts()) {
                builder.append(context.toString(eval(part, globals)));
            }
            return Value.of(builder.toString());
        }
        if (node instanceof ScriptMemberExpression member) {
            return evalMember(member, globals);
        }
        if (node instanceof ScriptIndexerExpression indexer) {
            return evalIndexer(indexer, globals);
        }
        if (node instanceof ScriptIsEmptyExpression isEmpty) {
            Value target = eval(isEmpty.getTarget(), globals);
            if (target.isNull() && context.isStrict()) {
                throw new ExpressionException(isEmpty.getSpan(), "Object `" + isEmpty.getTarget()
                    + "` is null. Cannot access property `empty?`");
            }
            return Value.of(context.isEmpty(isEmpty.getSpan(), target));
        }
        if (node instanceof ScriptUnaryExpression unary) {
            Value operand = eval(unary.getRight(), globals);
            return UnaryOperators.evaluate(context, unary.getSpan(), unary.getOperator(), operand);
        }
        if (node instanceof ScriptBinaryExpression binary) {
            return evalBinary(binary, globals);
        }
        if (node instanceof ScriptConditionalExpression conditional) {
            Value condition = eval(conditional.getCondition(), globals);
            return context.toBool(conditional.getCondition().getSpan(), condition)
                ? eval(conditional.getThenValue(), globals)
                : eval(conditional.getElseValue(), globals);
        }
        if (node instanceof ScriptArrayInitializerExpression array) {
            List<Value> values = new ArrayList<>(array.getValues().size());
            for (ScriptExpression value : array.getValues()) {
                values.add(eval(value, globals));
            }
            return Value.ofArray(values);
        }
        if (node instanceof ScriptObjectInitializerExpression object) {
            Map<String, Value> members = new LinkedHashMap<>();
            for (ScriptObjectMember member : object.getMembers()) {
                members.put(memberName(member), eval(member.getValue(), globals));
            }
            return Value.ofObject(members);
        }
        throw unsupported(node);
    }

    private Value evalVariable(ScriptVariable variable, Value globals) throws ExpressionException {
        if (variable.getScope() != ScriptVariableScope.GLOBAL) {
            throw unsupported(variable);
        }
        ValueAccessor accessor = context.getValueAccessor();
        if (!globals.isNull() && accessor.supports(globals)) {
            Value value = accessor.member(globals, variable.getName()).orElse(null);
            if (value != null) {
                return value;
            }
        }
        // builtin keywords, unless shadowed by the data
        if (variable.getName().equals("empty") || variable.getName().equals("blank")) {
            return Value.EMPTY;
        }
        return Value.NULL;
    }

    private Value evalMember(ScriptMemberExpression member, Value globals) throws ExpressionException {
        Value target = eval(member.getTarget(), globals);
        if (target.isNull()) {
            if (member.isNullConditional() || !context.isStrict()) {
                return Value.NULL;
            }
            throw new ExpressionException(member.getMember().getSpan(), "Cannot get the member " + member + " for a null object.");
        }
        ValueAccessor accessor = context.getValueAccessor();
        if (!accessor.supports(target)) {
            return Value.NULL;
        }
        return accessor.member(target, member.getMember().getName()).orElse(Value.NULL);
    }

    private Value evalIndexer(ScriptIndexerExpression indexer, Value globals) throws ExpressionException {
        Value target = eval(indexer.getTarget(), globals);
        if (target.isNull()) {
            if (!context.isStrict()) {
                return Value.NULL;
            }
            throw new ExpressionException(indexer.getTarget().getSpan(), "Object `" + indexer.getTarget()
                + "` is null. Cannot access indexer: " + indexer);
        }
        Value index = eval(indexer.getIndex(), globals);
        if (index.isNull()) {
            throw new ExpressionException(indexer.getIndex().getSpan(), "Cannot access target `" + indexer.getTarget()
                + "` with a null indexer: " + indexer);
        }
        ValueAccessor accessor = context.getValueAccessor();
        if (!accessor.supports(target)) {
            return Value.NULL;
        }
        try {
            return accessor.index(target, index).orElse(Value.NULL);
        } catch (IllegalArgumentException | ArithmeticException e) {
            throw new ExpressionException(indexer.getIndex().getSpan(), "Cannot access target `" + indexer.getTarget()
                + "` with an indexer: " + indexer.getIndex(), e);
        }
    }

    private Value evalBinary(ScriptBinaryExpression binary, Value globals) throws ExpressionException {
        ScriptBinaryOperator operator = binary.getOperator();
        ScriptExpression leftNode = binary.getLeft();
        ScriptExpression rightNode = binary.getRight();
        Value left = eval(leftNode, globals);

        switch (operator) {
            case AND:
                if (!context.toBool(leftNode.getSpan(), left)) {
                    return Value.FALSE;
                }
                return Value.of(context.toBool(rightNode.getSpan(), eval(rightNode, globals)));
            case OR:
                if (context.toBool(leftNode.getSpan(), left)) {
                    return Value.TRUE;
                }
                return Value.of(context.toBool(rightNode.getSpan(), eval(rightNode, globals)));
            case EMPTY_COALESCING:
                if (!left.isNull()) {
                    return left;
                }
                break;
            default:
                break;
        }
        Value right = eval(rightNode, globals);
        return BinaryOperators.evaluate(context, binary.getSpan(), operator, leftNode.getSpan(), left, rightNode.getSpan(), right);
    }

    private static String memberName(ScriptObjectMember member) {
        if (member.getName() instanceof ScriptVariable variable) {
            return variable.getName();
        }
        if (member.getName() instanceof ScriptLiteral literal) {
            return String.valueOf(literal.getValue());
        }
        return String.valueOf(member.getName());
    }

    private static ExpressionException unsupported(ScriptNode node) {
        return new ExpressionException(node.getSpan(), "The expression `" + node.toString().trim()
            + "` is not supported by the expression engine");
    }
}
