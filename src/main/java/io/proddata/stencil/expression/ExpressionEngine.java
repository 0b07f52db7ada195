package io.proddata.stencil.expression;

import com.amazon.ion.IonStruct;
import com.amazon.ion.IonValue;
import io.proddata.stencil.ion.CastException;
import io.proddata.stencil.ion.IonValueUtils;

import java.util.Map;

public interface ExpressionEngine {
    /**
     * Evaluates a single expression written in the script language, resolving global variables
     * against {@code globals}.
     */
    Value evaluate(String expression, IonStruct globals) throws ExpressionException;

    /**
     * Same as {@link #evaluate(String, IonStruct)} with globals given as plain Java data.
     */
    default Value evaluate(String expression, Map<String, ?> globals) throws ExpressionException {
        IonStruct struct;
        try {
            struct = IonValueUtils.toStruct(globals);
        } catch (CastException e) {
            throw new ExpressionException("Unable to convert the globals of `" + expression + "` to Ion: " + e.getMessage(), e);
        }
        return evaluate(expression, struct);
    }

    /**
     * Evaluates an expression and converts its result to Ion, enumerating ranges into lists.
     */
    default IonValue evaluateToIon(String expression, IonStruct globals) throws ExpressionException {
        Value value = evaluate(expression, globals);
        try {
            return IonValueUtils.toIon(value);
        } catch (CastException e) {
            throw new ExpressionException("Unable to convert the result of `" + expression + "` to Ion: " + e.getMessage(), e);
        }
    }
}
