package work.sdl2.canvas.engine;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import work.sdl2.canvas.error.InvalidFieldPathException;
import work.sdl2.canvas.error.UnknownReferenceException;
import work.sdl2.canvas.model.ParamValue;

/**
 * Replaces {@code $<operationId>.output.<fieldPath>} references with values taken from the outputs of
 * operations that already succeeded.
 *
 * <p>{@code priorOutputs} maps an operation id to its step record, {@code {"output": <result>}}, so a
 * reference walks {@code output.<fieldPath>} from that record. Map segments are looked up by key and list
 * segments by integer index. Resolved values are deep copies; later steps never alias earlier outputs.
 */
public final class ReferenceResolver {
    private static final String OUTPUT_KEY = "output";

    public Object resolve(ParamValue value, Map<String, ?> priorOutputs) {
        if (value instanceof ParamValue.Literal literal) {
            return literal.value();
        }
        if (value instanceof ParamValue.Reference reference) {
            return resolveReference(reference, priorOutputs);
        }
        if (value instanceof ParamValue.ObjectValue object) {
            var copy = new LinkedHashMap<String, Object>();
            for (var entry : object.entries().entrySet()) {
                copy.put(entry.getKey(), resolve(entry.getValue(), priorOutputs));
            }
            return copy;
        }
        if (value instanceof ParamValue.ArrayValue array) {
            var copy = new ArrayList<Object>(array.items().size());
            for (var item : array.items()) {
                copy.add(resolve(item, priorOutputs));
            }
            return copy;
        }
        return null;
    }

    public Map<String, Object> resolveAll(Map<String, ParamValue> params, Map<String, ?> priorOutputs) {
        var resolved = new LinkedHashMap<String, Object>();
        for (var entry : params.entrySet()) {
            resolved.put(entry.getKey(), resolve(entry.getValue(), priorOutputs));
        }
        return resolved;
    }

    private Object resolveReference(ParamValue.Reference reference, Map<String, ?> priorOutputs) {
        var text = reference.text();
        if (priorOutputs == null || !priorOutputs.containsKey(reference.operationId())) {
            throw new UnknownReferenceException(text, reference.operationId());
        }
        Object current = priorOutputs.get(reference.operationId());
        var segments = new ArrayList<String>();
        segments.add(OUTPUT_KEY);
        segments.addAll(List.of(reference.fieldPath().split("\\.", -1)));
        for (var segment : segments) {
            if (current instanceof Map<?, ?> map) {
                if (!map.containsKey(segment)) {
                    throw new InvalidFieldPathException(text, segment);
                }
                current = map.get(segment);
            } else if (current instanceof List<?> list) {
                int index = parseIndex(segment);
                if (index < 0 || index >= list.size()) {
                    throw new InvalidFieldPathException(text, segment);
                }
                current = list.get(index);
            } else {
                throw new InvalidFieldPathException(text, segment);
            }
        }
        return cloneLiteral(current);
    }

    private static int parseIndex(String token) {
        try {
            return Integer.parseInt(token);
        } catch (NumberFormatException ex) {
            return -1;
        }
    }

    private static Object cloneLiteral(Object value) {
        if (value instanceof Map<?, ?> map) {
            var copy = new LinkedHashMap<String, Object>();
            for (var entry : map.entrySet()) {
                copy.put(String.valueOf(entry.getKey()), cloneLiteral(entry.getValue()));
            }
            return copy;
        }
        if (value instanceof List<?> list) {
            var copy = new ArrayList<>(list.size());
            for (var item : list) {
                copy.add(cloneLiteral(item));
            }
            return copy;
        }
        return value;
    }
}
