package work.sdl2.canvas.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * One declared step of a workflow.
 */
public record Operation(String id, String type, Map<String, ParamValue> params) {
    public Operation {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(type, "type");
        params = params == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(params));
    }

    public static Operation of(String id, String type, Map<String, ?> rawParams) {
        return new Operation(id, type, ParamValue.parseAll(rawParams));
    }
}
