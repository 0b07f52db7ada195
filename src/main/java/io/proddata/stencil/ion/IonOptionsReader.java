package io.proddata.stencil.ion;

import com.amazon.ion.IonBool;
import com.amazon.ion.IonInt;
import com.amazon.ion.IonStruct;
import com.amazon.ion.IonText;
import com.amazon.ion.IonValue;
import io.proddata.stencil.expression.EvaluationOptions;
import io.proddata.stencil.parsing.Dialect;
import io.proddata.stencil.parsing.LexerOptions;
import io.proddata.stencil.parsing.ParserOptions;
import io.proddata.stencil.parsing.ScriptMode;

import java.util.Locale;
import java.util.function.Function;

/**
 * Reads lexer, parser and evaluation options from an Ion struct such as
 * {@code {dialect: "liquid", mode: "script-only", keepTrivia: true, strict: true}}.
 * Missing or {@code null} fields keep their defaults.
 */
public final class IonOptionsReader {
    private IonOptionsReader() {
    }

    public static LexerOptions lexerOptions(IonStruct config) throws CastException {
        LexerOptions.LexerOptionsBuilder builder = LexerOptions.builder();
        if (config == null) {
            return builder.build();
        }
        Dialect dialect = enumField(config, "dialect", Dialect::from);
        if (dialect != null) {
            builder.dialect(dialect);
        }
        ScriptMode mode = enumField(config, "mode", ScriptMode::from);
        if (mode != null) {
            builder.mode(mode);
        }
        String marker = textField(config, "frontMatterMarker");
        if (marker != null) {
            builder.frontMatterMarker(marker);
        }
        return builder
            .keepTrivia(boolField(config, "keepTrivia", false))
            .enableIncludeImplicitString(boolField(config, "enableIncludeImplicitString", false))
            .build();
    }

    public static ParserOptions parserOptions(IonStruct config) throws CastException {
        ParserOptions.ParserOptionsBuilder builder = ParserOptions.builder();
        if (config == null) {
            return builder.build();
        }
        IonValue depth = config.get("expressionDepthLimit");
        if (depth != null) {
            if (depth.isNullValue()) {
                builder.expressionDepthLimit(null);
            } else if (depth instanceof IonInt ionInt) {
                builder.expressionDepthLimit(ionInt.intValue());
            } else {
                throw invalid("expressionDepthLimit", depth);
            }
        }
        return builder
            .qualifyLiquidFunctions(boolField(config, "qualifyLiquidFunctions", false))
            .parseFloatAsDecimal(boolField(config, "parseFloatAsDecimal", false))
            .build();
    }

    /**
     * The scientific dialect turns strict mode on unless {@code strict} says otherwise.
     */
    public static EvaluationOptions evaluationOptions(IonStruct config) throws CastException {
        if (config == null) {
            return EvaluationOptions.DEFAULT;
        }
        Dialect dialect = enumField(config, "dialect", Dialect::from);
        boolean strict = boolField(config, "strict", dialect == Dialect.SCIENTIFIC);
        String locale = textField(config, "locale");
        return new EvaluationOptions(strict, locale == null ? Locale.ROOT : Locale.forLanguageTag(locale));
    }

    private static <E extends Enum<E>> E enumField(IonStruct config, String name, Function<Object, E> factory)
        throws CastException {
        String text = textField(config, name);
        if (text == null) {
            return null;
        }
        try {
            return factory.apply(text);
        } catch (IllegalArgumentException e) {
            throw new CastException("Invalid value `" + text + "` for option `" + name + "`", e);
        }
    }

    private static String textField(IonStruct config, String name) throws CastException {
        IonValue value = config.get(name);
        if (IonValueUtils.isNull(value)) {
            return null;
        }
        if (value instanceof IonText text) {
            return text.stringValue();
        }
        throw invalid(name, value);
    }

    private static boolean boolField(IonStruct config, String name, boolean defaultValue) throws CastException {
        IonValue value = config.get(name);
        if (IonValueUtils.isNull(value)) {
            return defaultValue;
        }
        if (value instanceof IonBool bool) {
            return bool.booleanValue();
        }
        throw invalid(name, value);
    }

    private static CastException invalid(String name, IonValue value) {
        return new CastException("Option `" + name + "` does not accept a value of type " + value.getType());
    }
}
