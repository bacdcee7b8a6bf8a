package work.sdl2.canvas.engine;

import java.time.Clock;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.sdl2.canvas.client.RemoteStatus;
import work.sdl2.canvas.client.RemoteTaskClient;
import work.sdl2.canvas.error.DuplicateOperationIdException;
import work.sdl2.canvas.error.ErrorCode;
import work.sdl2.canvas.error.ErrorInfo;
import work.sdl2.canvas.error.WorkflowException;
import work.sdl2.canvas.model.Operation;
import work.sdl2.canvas.model.Workflow;
import work.sdl2.canvas.operation.OperationRegistry;

/**
 * Runs the operations of a workflow one at a time, in declaration order: resolve references, validate,
 * submit, wait, fetch. The first step that does not succeed ends the run; later operations are not
 * touched. {@link #execute} never throws for workflow or remote failures, they are recorded in the
 * returned {@link WorkflowResult}.
 *
 * <p>One instance may run several workflows sequentially; the per-run state lives on the stack of
 * {@code execute}.
 */
public final class WorkflowEngine {
    private static final Logger log = LoggerFactory.getLogger(WorkflowEngine.class);

    private final RemoteTaskClient client;
    private final OperationRegistry registry;
    private final ReferenceResolver resolver;
    private final CompletionWaiter waiter;
    private final Clock clock;

    public WorkflowEngine(RemoteTaskClient client) {
        this(client, OperationRegistry.builtin(), new CompletionWaiter(client), Clock.systemUTC());
    }

    public WorkflowEngine(RemoteTaskClient client, OperationRegistry registry, CompletionWaiter waiter, Clock clock) {
        this.client = Objects.requireNonNull(client, "client");
        this.registry = Objects.requireNonNull(registry, "registry");
        this.waiter = Objects.requireNonNull(waiter, "waiter");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.resolver = new ReferenceResolver();
    }

    public WorkflowResult execute(Workflow workflow, EngineSettings settings) {
        return execute(workflow, settings, new CancellationToken());
    }

    public WorkflowResult execute(Workflow workflow, EngineSettings settings, CancellationToken token) {
        Objects.requireNonNull(workflow, "workflow");
        Objects.requireNonNull(settings, "settings");
        Objects.requireNonNull(token, "token");
        var startedAt = clock.instant();
        try {
            checkUniqueIds(workflow);
        } catch (DuplicateOperationIdException ex) {
            log.error("Rejected workflow {}: {}", workflow.name(), ex.getMessage());
            return WorkflowResult.rejected(workflow.name(), ErrorInfo.from(ex), startedAt, clock.instant());
        }

        log.info("Executing workflow: {} with {} operations", workflow.name(), workflow.operations().size());
        var priorOutputs = new LinkedHashMap<String, Object>();
        var steps = new ArrayList<StepResult>();
        for (var operation : workflow.operations()) {
            var step = runOperation(operation, priorOutputs, settings, token);
            steps.add(step);
            if (step.status() != StepStatus.SUCCEEDED) {
                int remaining = workflow.operations().size() - steps.size();
                log.warn("Operation {} ended {}; aborting {} remaining operation(s)", operation.id(), step.status(), remaining);
                break;
            }
        }

        var result = WorkflowResult.of(workflow.name(), steps, startedAt, clock.instant());
        log.info("Workflow {} finished: {}", workflow.name(), result.finalStatus());
        return result;
    }

    /**
     * Fails fast on the first operation id declared twice.
     */
    public static void checkUniqueIds(Workflow workflow) {
        var seen = new HashSet<String>();
        for (var operation : workflow.operations()) {
            if (!seen.add(operation.id())) {
                throw new DuplicateOperationIdException(operation.id());
            }
        }
    }

    private StepResult runOperation(Operation operation, Map<String, Object> priorOutputs, EngineSettings settings, CancellationToken token) {
        log.info("Executing operation {} of type {}", operation.id(), operation.type());
        var step = new StepResult(operation.id());
        try {
            if (token.isCancelled()) {
                step.fail(StepStatus.TIMED_OUT, ErrorInfo.of(ErrorCode.WAITER_TIMEOUT, CompletionWaiter.CANCELLED_DETAIL));
                return step;
            }
            var params = resolver.resolveAll(operation.params(), priorOutputs);
            var handler = registry.createHandler(operation.id(), operation.type());
            handler.validate(operation.id(), params);
            var request = handler.toRemoteRequest(params);

            var taskId = client.submit(request);
            step.dispatched(taskId);

            var outcome = waiter.await(
                taskId,
                settings.pollInterval(),
                settings.maxWait(),
                settings.statusRetry(),
                token,
                status -> {
                    if (status == RemoteStatus.RUNNING && step.status() == StepStatus.PENDING) {
                        step.running();
                    }
                }
            );
            switch (outcome.kind()) {
                case SUCCEEDED -> {
                    var output = client.fetchResult(taskId);
                    step.succeed(output);
                    var record = new LinkedHashMap<String, Object>();
                    record.put("output", output);
                    priorOutputs.put(operation.id(), record);
                }
                case FAILED -> step.fail(StepStatus.FAILED, remoteFailure(taskId, outcome.errorDetail()));
                case TIMED_OUT -> step.fail(StepStatus.TIMED_OUT, new ErrorInfo(
                    ErrorCode.WAITER_TIMEOUT,
                    outcome.errorDetail(),
                    Map.of("taskId", taskId, "polls", outcome.polls())
                ));
            }
        } catch (WorkflowException ex) {
            log.error("Operation {} failed: {}", operation.id(), ex.getMessage());
            step.fail(StepStatus.FAILED, ErrorInfo.from(ex));
        } catch (RuntimeException ex) {
            log.error("Operation {} failed unexpectedly", operation.id(), ex);
            step.fail(StepStatus.FAILED, ErrorInfo.from(ex));
        }
        return step;
    }

    private static ErrorInfo remoteFailure(String taskId, String detail) {
        var data = new LinkedHashMap<String, Object>();
        data.put("taskId", taskId);
        if (detail != null) {
            data.put("detail", detail);
        }
        var message = detail == null ? "Task " + taskId + " failed with error status" : detail;
        return new ErrorInfo(ErrorCode.REMOTE_TASK_FAILED, message, data);
    }
}
