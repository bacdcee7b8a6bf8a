package work.sdl2.canvas.client;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Submission for one remote task: the task kind (path segment of {@code /tasks/{kind}/}) and its JSON body.
 */
public record RemoteTaskRequest(String kind, Map<String, Object> payload) {
    public RemoteTaskRequest {
        Objects.requireNonNull(kind, "kind");
        payload = payload == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(payload));
    }
}
