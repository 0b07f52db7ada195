package io.proddata.stencil.expression;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Accessor for arrays and {@link Map} payloads.
 */
public class MapValueAccessor implements ValueAccessor {
    public static final MapValueAccessor INSTANCE = new MapValueAccessor();

    @Override
    public boolean supports(Value target) {
        return target.getKind() == ValueKind.ARRAY
            || target.getKind() == ValueKind.OBJECT && target.getPayload() instanceof Map<?, ?>;
    }

    @Override
    public Optional<Value> member(Value target, String name) {
        if (target.getPayload() instanceof Map<?, ?> map && map.containsKey(name)) {
            return Optional.of(Value.from(map.get(name)));
        }
        return Optional.empty();
    }

    @Override
    public Optional<Value> index(Value target, Value index) {
        if (target.getKind() == ValueKind.ARRAY) {
            return item(target.asList(), index.toInt());
        }
        return member(target, index.isText() ? String.valueOf(index.getPayload()) : index.toString());
    }

    @Override
    public int count(Value target) {
        if (target.getKind() == ValueKind.ARRAY) {
            return target.asList().size();
        }
        return target.getPayload() instanceof Map<?, ?> map ? map.size() : 0;
    }

    private static Optional<Value> item(List<?> list, int index) {
        int i = index < 0 ? list.size() + index : index;
        if (i < 0 || i >= list.size()) {
            return Optional.empty();
        }
        return Optional.of(Value.from(list.get(i)));
    }
}
