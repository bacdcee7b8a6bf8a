package work.sdl2.canvas.error;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Serializable description of why a step or a workflow failed.
 */
public record ErrorInfo(ErrorCode code, String message, Map<String, Object> data) {
    public ErrorInfo {
        Objects.requireNonNull(code, "code");
        message = message == null || message.isBlank() ? "Unexpected error" : message;
        data = data == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(data));
    }

    public static ErrorInfo of(ErrorCode code, String message) {
        return new ErrorInfo(code, message, Map.of());
    }

    public static ErrorInfo from(Throwable error) {
        if (error instanceof WorkflowException we) {
            var data = new LinkedHashMap<String, Object>(we.details());
            if (we.operationId() != null) {
                data.putIfAbsent("operationId", we.operationId());
            }
            return new ErrorInfo(we.code(), we.getMessage(), data);
        }
        if (error == null) {
            return of(ErrorCode.UNEXPECTED_ERROR, null);
        }
        var message = error.getMessage() != null && !error.getMessage().isBlank()
            ? error.getMessage()
            : error.getClass().getSimpleName();
        return new ErrorInfo(ErrorCode.UNEXPECTED_ERROR, message, Map.of("exception", error.getClass().getName()));
    }

    public Map<String, Object> toMap() {
        var map = new LinkedHashMap<String, Object>();
        map.put("code", code.id());
        map.put("message", message);
        if (!data.isEmpty()) {
            map.put("data", data);
        }
        return map;
    }
}
