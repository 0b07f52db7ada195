package io.proddata.stencil.ion;

import com.amazon.ion.IonSequence;
import com.amazon.ion.IonStruct;
import com.amazon.ion.IonValue;
import io.proddata.stencil.expression.MapValueAccessor;
import io.proddata.stencil.expression.Value;

import java.util.Optional;

/**
 * Reads fields of {@link IonStruct}s and items of {@link IonSequence}s, falling back to
 * {@link MapValueAccessor} for arrays and maps.
 */
public class IonValueAccessor extends MapValueAccessor {
    @Override
    public boolean supports(Value target) {
        return target.getPayload() instanceof IonStruct
            || target.getPayload() instanceof IonSequence
            || super.supports(target);
    }

    @Override
    public Optional<Value> member(Value target, String name) {
        if (target.getPayload() instanceof IonStruct struct) {
            IonValue field = struct.get(name);
            return field == null ? Optional.empty() : Optional.of(IonValueUtils.toValue(field));
        }
        return super.member(target, name);
    }

    @Override
    public Optional<Value> index(Value target, Value index) {
        if (target.getPayload() instanceof IonSequence sequence) {
            int i = index.toInt();
            int position = i < 0 ? sequence.size() + i : i;
            if (position < 0 || position >= sequence.size()) {
                return Optional.empty();
            }
            return Optional.of(IonValueUtils.toValue(sequence.get(position)));
        }
        if (target.getPayload() instanceof IonStruct) {
            return member(target, index.isText() ? String.valueOf(index.getPayload()) : index.toString());
        }
        return super.index(target, index);
    }

    @Override
    public int count(Value target) {
        if (target.getPayload() instanceof IonStruct struct) {
            return struct.size();
        }
        if (target.getPayload() instanceof IonSequence sequence) {
            return sequence.size();
        }
        return super.count(target);
    }
}
