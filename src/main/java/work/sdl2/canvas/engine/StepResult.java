package work.sdl2.canvas.engine;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import work.sdl2.canvas.error.ErrorInfo;

/**
 * Execution record of one operation. Only the engine moves it forward, and it is frozen once its status
 * is terminal.
 */
public final class StepResult {
    private final String operationId;
    private String remoteTaskId;
    private StepStatus status = StepStatus.PENDING;
    private Object output;
    private ErrorInfo error;

    StepResult(String operationId) {
        this.operationId = Objects.requireNonNull(operationId, "operationId");
    }

    public String operationId() {
        return operationId;
    }

    public String remoteTaskId() {
        return remoteTaskId;
    }

    public StepStatus status() {
        return status;
    }

    public Object output() {
        return output;
    }

    public ErrorInfo error() {
        return error;
    }

    void dispatched(String taskId) {
        ensureOpen();
        this.remoteTaskId = taskId;
        this.status = StepStatus.PENDING;
    }

    void running() {
        ensureOpen();
        this.status = StepStatus.RUNNING;
    }

    void succeed(Object result) {
        ensureOpen();
        this.output = result;
        this.status = StepStatus.SUCCEEDED;
    }

    void fail(StepStatus terminal, ErrorInfo info) {
        if (terminal != StepStatus.FAILED && terminal != StepStatus.TIMED_OUT) {
            throw new IllegalArgumentException("Not a failure status: " + terminal);
        }
        ensureOpen();
        this.error = Objects.requireNonNull(info, "info");
        this.status = terminal;
    }

    private void ensureOpen() {
        if (status.isTerminal()) {
            throw new IllegalStateException("Step " + operationId + " is already " + status);
        }
    }

    public Map<String, Object> toSerializableMap() {
        var map = new LinkedHashMap<String, Object>();
        map.put("operationId", operationId);
        map.put("remoteTaskId", remoteTaskId);
        map.put("status", status.name());
        map.put("output", output);
        map.put("error", error == null ? null : error.toMap());
        return map;
    }

    @Override
    public String toString() {
        return "StepResult[" + operationId + ", " + status + (remoteTaskId == null ? "" : ", task=" + remoteTaskId) + "]";
    }
}
