package work.sdl2.canvas.operation;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import work.sdl2.canvas.error.UnsupportedOperationTypeException;

/**
 * Immutable lookup table from operation type to handler.
 */
public final class OperationRegistry {
    private static final OperationRegistry BUILTIN = of(List.of(
        new CyclicVoltammetryHandler(),
        new RollingMeanHandler(),
        new PeakDetectionHandler()
    ));

    private final Map<String, OperationHandler> handlers;

    private OperationRegistry(Map<String, OperationHandler> handlers) {
        this.handlers = Collections.unmodifiableMap(handlers);
    }

    public static OperationRegistry builtin() {
        return BUILTIN;
    }

    public static OperationRegistry of(List<? extends OperationHandler> handlers) {
        var table = new LinkedHashMap<String, OperationHandler>();
        for (var handler : handlers) {
            if (table.putIfAbsent(handler.type(), handler) != null) {
                throw new IllegalArgumentException("Handler registered twice for type: " + handler.type());
            }
        }
        return new OperationRegistry(table);
    }

    /**
     * @throws UnsupportedOperationTypeException when no handler matches {@code type} exactly
     */
    public OperationHandler createHandler(String operationId, String type) {
        var handler = type == null ? null : handlers.get(type);
        if (handler == null) {
            throw new UnsupportedOperationTypeException(operationId, type);
        }
        return handler;
    }

    public Map<String, OperationHandler> handlers() {
        return handlers;
    }
}
