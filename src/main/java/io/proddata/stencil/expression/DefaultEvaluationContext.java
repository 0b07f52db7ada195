package io.proddata.stencil.expression;

import io.proddata.stencil.parsing.SourceSpan;
import lombok.Getter;

import java.math.BigDecimal;
import java.text.DecimalFormatSymbols;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * Conversions following the template language rules, numbers formatted for the configured locale.
 */
public class DefaultEvaluationContext implements EvaluationContext {
    @Getter
    private final EvaluationOptions options;
    @Getter
    private final ValueAccessor valueAccessor;
    private final char decimalSeparator;

    public DefaultEvaluationContext() {
        this(EvaluationOptions.DEFAULT);
    }

    public DefaultEvaluationContext(EvaluationOptions options) {
        this(options, MapValueAccessor.INSTANCE);
    }

    public DefaultEvaluationContext(EvaluationOptions options, ValueAccessor valueAccessor) {
        this.options = options == null ? EvaluationOptions.DEFAULT : options;
        this.valueAccessor = valueAccessor == null ? MapValueAccessor.INSTANCE : valueAccessor;
        this.decimalSeparator = DecimalFormatSymbols.getInstance(this.options.locale()).getDecimalSeparator();
    }

    @Override
    public boolean isStrict() {
        return options.strict();
    }

    @Override
    public String toString(Value value) {
        return toString(value, false);
    }

    private String toString(Value value, boolean nested) {
        if (value == null || value.isNull() || value.isEmptyObject()) {
            return nested ? "null" : "";
        }
        Object payload = value.getPayload();
        return switch (value.getKind()) {
            case STRING -> nested ? quote((String) payload) : (String) payload;
            case FLOAT32 -> formatDecimal(Float.isFinite((Float) payload) ? new BigDecimal(payload.toString()) : null, payload);
            case FLOAT64 -> formatDecimal(Double.isFinite((Double) payload) ? BigDecimal.valueOf((Double) payload) : null, payload);
            case DECIMAL -> localize(((BigDecimal) payload).toPlainString());
            case ARRAY -> join(value.asList());
            case OBJECT -> payload instanceof Map<?, ?> map ? join(map) : payload.toString();
            default -> payload.toString();
        };
    }

    private String formatDecimal(BigDecimal exact, Object raw) {
        if (exact == null) {
            return raw.toString();
        }
        double magnitude = exact.abs().doubleValue();
        if (magnitude != 0d && (magnitude >= 1e15 || magnitude < 1e-5)) {
            return localize(raw.toString());
        }
        return localize(exact.stripTrailingZeros().toPlainString());
    }

    private String localize(String number) {
        return decimalSeparator == '.' ? number : number.replace('.', decimalSeparator);
    }

    private String join(List<Value> values) {
        StringBuilder builder = new StringBuilder("[");
        for (Iterator<Value> it = values.iterator(); it.hasNext(); ) {
            builder.append(toString(it.next(), true));
            if (it.hasNext()) {
                builder.append(", ");
            }
        }
        return builder.append(']').toString();
    }

    private String join(Map<?, ?> map) {
        StringBuilder builder = new StringBuilder("{");
        for (Iterator<? extends Map.Entry<?, ?>> it = map.entrySet().iterator(); it.hasNext(); ) {
            Map.Entry<?, ?> entry = it.next();
            builder.append(entry.getKey()).append(": ").append(toString(Value.from(entry.getValue()), true));
            if (it.hasNext()) {
                builder.append(", ");
            }
        }
        return builder.append('}').toString();
    }

    private static String quote(String text) {
        StringBuilder builder = new StringBuilder(text.length() + 2).append('"');
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            switch (c) {
                case '"' -> builder.append("\\\"");
                case '\\' -> builder.append("\\\\");
                case '\n' -> builder.append("\\n");
                case '\r' -> builder.append("\\r");
                case '\t' -> builder.append("\\t");
                default -> builder.append(c);
            }
        }
        return builder.append('"').toString();
    }

    @Override
    public boolean toBool(SourceSpan span, Value value) {
        if (value == null || value.isNull() || value.isEmptyObject()) {
            return false;
        }
        if (value.getKind() == ValueKind.BOOL) {
            return value.asBoolean();
        }
        if (isStrict() && value.getKind().isNumber()) {
            return value.toBoolean();
        }
        return true;
    }

    @Override
    public int toInt(SourceSpan span, Value value) throws ExpressionException {
        if (value == null || value.isNull()) {
            return 0;
        }
        try {
            if (value.getKind() == ValueKind.STRING) {
                return Integer.parseInt(value.asString().trim());
            }
            return value.toInt();
        } catch (IllegalArgumentException | ArithmeticException e) {
            throw new ExpressionException(span, "Unable to convert type `" + getTypeName(value) + "` to int", e);
        }
    }

    @Override
    public boolean isEmpty(SourceSpan span, Value value) {
        if (value == null) {
            return true;
        }
        return switch (value.getKind()) {
            case NULL, EMPTY -> true;
            case STRING -> value.asString().isEmpty();
            case ARRAY -> value.asList().isEmpty();
            case RANGE -> value.asRange().isEmpty();
            case OBJECT -> valueAccessor.supports(value) && valueAccessor.count(value) == 0;
            default -> false;
        };
    }
}
