package work.sdl2.canvas.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Parameter value of an operation: a literal, a reference to an earlier operation output, or a nested
 * object/array of parameter values.
 */
public interface ParamValue {
    Pattern REFERENCE_PATTERN = Pattern.compile("^\\$([A-Za-z0-9_]+)\\.output\\.(.+)$");

    /**
     * Builds the tagged value from a parsed JSON/YAML node (maps, lists, strings, numbers, booleans, null).
     * A string is a reference only when the whole string matches {@link #REFERENCE_PATTERN}.
     */
    static ParamValue parse(Object raw) {
        if (raw instanceof Map<?, ?> map) {
            var entries = new LinkedHashMap<String, ParamValue>();
            for (var entry : map.entrySet()) {
                entries.put(String.valueOf(entry.getKey()), parse(entry.getValue()));
            }
            return new ObjectValue(entries);
        }
        if (raw instanceof List<?> list) {
            var items = new ArrayList<ParamValue>(list.size());
            for (var item : list) {
                items.add(parse(item));
            }
            return new ArrayValue(items);
        }
        if (raw instanceof String str) {
            var matcher = REFERENCE_PATTERN.matcher(str);
            if (matcher.matches()) {
                return new Reference(matcher.group(1), matcher.group(2));
            }
        }
        return new Literal(raw);
    }

    static Map<String, ParamValue> parseAll(Map<String, ?> raw) {
        var params = new LinkedHashMap<String, ParamValue>();
        if (raw != null) {
            raw.forEach((key, value) -> params.put(key, parse(value)));
        }
        return params;
    }

    record Literal(Object value) implements ParamValue {}

    record Reference(String operationId, String fieldPath) implements ParamValue {
        public Reference {
            Objects.requireNonNull(operationId, "operationId");
            Objects.requireNonNull(fieldPath, "fieldPath");
        }

        public String text() {
            return "$" + operationId + ".output." + fieldPath;
        }
    }

    record ObjectValue(Map<String, ParamValue> entries) implements ParamValue {
        public ObjectValue {
            entries = Collections.unmodifiableMap(new LinkedHashMap<>(entries));
        }
    }

    record ArrayValue(List<ParamValue> items) implements ParamValue {
        public ArrayValue {
            items = List.copyOf(items);
        }
    }
}
