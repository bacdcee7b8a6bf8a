package work.sdl2.canvas.engine;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import work.sdl2.canvas.error.ErrorInfo;

/**
 * Sole product of one workflow execution. {@code error} is only present when the workflow was rejected
 * before any operation ran; step failures live in their {@link StepResult}.
 */
public record WorkflowResult(
    String workflowName,
    List<StepResult> steps,
    Status finalStatus,
    Instant startedAt,
    Instant completedAt,
    Optional<ErrorInfo> error
) {
    public WorkflowResult {
        Objects.requireNonNull(workflowName, "workflowName");
        steps = List.copyOf(steps);
        Objects.requireNonNull(finalStatus, "finalStatus");
        Objects.requireNonNull(startedAt, "startedAt");
        Objects.requireNonNull(completedAt, "completedAt");
        Objects.requireNonNull(error, "error");
    }

    static WorkflowResult of(String workflowName, List<StepResult> steps, Instant startedAt, Instant completedAt) {
        boolean allSucceeded = steps.stream().allMatch(step -> step.status() == StepStatus.SUCCEEDED);
        var status = allSucceeded ? Status.SUCCEEDED : Status.FAILED;
        return new WorkflowResult(workflowName, steps, status, startedAt, completedAt, Optional.empty());
    }

    static WorkflowResult rejected(String workflowName, ErrorInfo error, Instant startedAt, Instant completedAt) {
        return new WorkflowResult(workflowName, List.of(), Status.FAILED, startedAt, completedAt, Optional.of(error));
    }

    public boolean succeeded() {
        return finalStatus == Status.SUCCEEDED;
    }

    public Optional<StepResult> step(String operationId) {
        return steps.stream().filter(step -> step.operationId().equals(operationId)).findFirst();
    }

    public Optional<StepResult> failedStep() {
        return steps.stream().filter(step -> step.status() != StepStatus.SUCCEEDED).findFirst();
    }

    public Map<String, Object> toSerializableMap() {
        var serializable = new LinkedHashMap<String, Object>();
        serializable.put("workflowName", workflowName);
        var stepMaps = new ArrayList<Map<String, Object>>(steps.size());
        for (var step : steps) {
            stepMaps.add(step.toSerializableMap());
        }
        serializable.put("steps", stepMaps);
        serializable.put("finalStatus", finalStatus.name());
        serializable.put("startedAt", startedAt.toString());
        serializable.put("completedAt", completedAt.toString());
        error.ifPresent(info -> serializable.put("error", info.toMap()));
        return serializable;
    }

    public enum Status {
        SUCCEEDED(0),
        FAILED(1);

        private final int exitCode;

        Status(int exitCode) {
            this.exitCode = exitCode;
        }

        public int exitCode() {
            return exitCode;
        }
    }
}
