package work.sdl2.canvas.client;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.BiFunction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.sdl2.canvas.error.ResultFetchException;
import work.sdl2.canvas.error.StatusQueryException;
import work.sdl2.canvas.error.SubmissionException;
import work.sdl2.canvas.error.WorkflowException;

/**
 * {@link RemoteTaskClient} speaking JSON over HTTP:
 * {@code POST /tasks/{kind}/} to submit and {@code GET /task/{taskId}} to poll and fetch.
 */
public final class HttpRemoteTaskClient implements RemoteTaskClient {
    static final String API_KEY_HEADER = "X-API-Key";

    private static final Logger log = LoggerFactory.getLogger(HttpRemoteTaskClient.class);
    private static final ObjectMapper JSON = new ObjectMapper();
    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};
    private static final Duration DEFAULT_REQUEST_TIMEOUT = Duration.ofSeconds(30);

    private final String baseUrl;
    private final Optional<String> apiKey;
    private final HttpClient http;
    private final Duration requestTimeout;

    public HttpRemoteTaskClient(URI baseUrl, Optional<String> apiKey) {
        this(
            baseUrl,
            apiKey,
            HttpClient.newBuilder()
                .followRedirects(HttpClient.Redirect.NORMAL)
                .connectTimeout(DEFAULT_REQUEST_TIMEOUT)
                .build(),
            DEFAULT_REQUEST_TIMEOUT
        );
    }

    public HttpRemoteTaskClient(URI baseUrl, Optional<String> apiKey, HttpClient http, Duration requestTimeout) {
        var raw = Objects.requireNonNull(baseUrl, "baseUrl").toString();
        this.baseUrl = raw.endsWith("/") ? raw.substring(0, raw.length() - 1) : raw;
        this.apiKey = Objects.requireNonNull(apiKey, "apiKey").filter(key -> !key.isBlank());
        this.http = Objects.requireNonNull(http, "http");
        this.requestTimeout = Objects.requireNonNull(requestTimeout, "requestTimeout");
        log.info("Initialized task client with base URL: {}", this.baseUrl);
    }

    @Override
    public String submit(RemoteTaskRequest request) {
        var uri = URI.create(baseUrl + "/tasks/" + encode(request.kind()) + "/");
        String body;
        try {
            body = JSON.writeValueAsString(request.payload());
        } catch (JsonProcessingException ex) {
            throw new SubmissionException("Unable to serialize " + request.kind() + " payload: " + ex.getMessage(), ex);
        }
        log.info("Creating {} task with payload: {}", request.kind(), body);
        var httpRequest = newRequest(uri)
            .header("Content-Type", "application/json")
            .POST(HttpRequest.BodyPublishers.ofString(body))
            .build();
        var response = send(httpRequest, "submitting " + request.kind() + " task", SubmissionException::new);
        if (response.statusCode() / 100 != 2) {
            throw new SubmissionException("HTTP " + response.statusCode() + " while submitting " + request.kind() + " task: " + response.body());
        }
        var payload = readBody(response.body(), "submission response", SubmissionException::new);
        var taskId = Optional.ofNullable(payload.get("taskId")).or(() -> Optional.ofNullable(payload.get("id")));
        if (taskId.isEmpty()) {
            throw new SubmissionException("Submission response for " + request.kind() + " task carries no task id");
        }
        var id = String.valueOf(taskId.get());
        log.info("Created task with ID: {}", id);
        return id;
    }

    @Override
    public TaskStatus getStatus(String taskId) {
        var payload = fetchTask(taskId, "querying status of task " + taskId, StatusQueryException::new);
        RemoteStatus status;
        try {
            status = RemoteStatus.from(payload.get("status"));
        } catch (IllegalArgumentException ex) {
            throw new StatusQueryException(ex.getMessage() + " (task " + taskId + ")", ex);
        }
        if (status == RemoteStatus.FAILED) {
            var error = payload.get("error");
            return TaskStatus.failed(error == null ? null : String.valueOf(error));
        }
        return TaskStatus.of(status);
    }

    @Override
    public Object fetchResult(String taskId) {
        var payload = fetchTask(taskId, "fetching result of task " + taskId, ResultFetchException::new);
        RemoteStatus status;
        try {
            status = RemoteStatus.from(payload.get("status"));
        } catch (IllegalArgumentException ex) {
            throw new ResultFetchException(ex.getMessage() + " (task " + taskId + ")", ex);
        }
        if (status != RemoteStatus.SUCCEEDED) {
            throw new ResultFetchException("Task " + taskId + " has no result while " + status);
        }
        if (payload.containsKey("result")) {
            return payload.get("result");
        }
        if (payload.containsKey("output")) {
            return payload.get("output");
        }
        log.warn("Task {} succeeded without a result payload", taskId);
        return Map.of();
    }

    private Map<String, Object> fetchTask(String taskId, String action, BiFunction<String, Throwable, ? extends WorkflowException> failure) {
        var uri = URI.create(baseUrl + "/task/" + encode(taskId));
        var response = send(newRequest(uri).GET().build(), action, failure);
        if (response.statusCode() / 100 != 2) {
            throw failure.apply("HTTP " + response.statusCode() + " while " + action, null);
        }
        return readBody(response.body(), action, failure);
    }

    private HttpRequest.Builder newRequest(URI uri) {
        var builder = HttpRequest.newBuilder(uri)
            .timeout(requestTimeout)
            .header("Accept", "application/json");
        apiKey.ifPresent(key -> builder.header(API_KEY_HEADER, key));
        return builder;
    }

    private HttpResponse<String> send(HttpRequest request, String action, BiFunction<String, Throwable, ? extends WorkflowException> failure) {
        try {
            return http.send(request, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw failure.apply("Interrupted while " + action, ex);
        } catch (IOException ex) {
            log.error("Transport failure while {}: {}", action, ex.toString());
            throw failure.apply("Transport failure while " + action + ": " + ex.getMessage(), ex);
        }
    }

    private static Map<String, Object> readBody(String body, String action, BiFunction<String, Throwable, ? extends WorkflowException> failure) {
        if (body == null || body.isBlank()) {
            throw failure.apply("Empty response body while " + action, null);
        }
        try {
            return JSON.readValue(body, MAP_TYPE);
        } catch (IOException ex) {
            throw failure.apply("Invalid JSON while " + action + ": " + ex.getMessage(), ex);
        }
    }

    private static String encode(String segment) {
        return URLEncoder.encode(segment, StandardCharsets.UTF_8).replace("+", "%20");
    }
}
