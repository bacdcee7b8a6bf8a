package work.sdl2.canvas.engine;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import work.sdl2.canvas.client.RemoteStatus;
import work.sdl2.canvas.client.RemoteTaskRequest;
import work.sdl2.canvas.client.TaskStatus;
import work.sdl2.canvas.error.DuplicateOperationIdException;
import work.sdl2.canvas.error.ErrorCode;
import work.sdl2.canvas.model.Operation;
import work.sdl2.canvas.model.Workflow;
import work.sdl2.canvas.model.WorkflowLoader;
import work.sdl2.canvas.operation.CyclicVoltammetryHandler;
import work.sdl2.canvas.operation.OperationHandler;
import work.sdl2.canvas.operation.OperationRegistry;
import work.sdl2.canvas.operation.ParamSpec;
import work.sdl2.canvas.operation.PeakDetectionHandler;
import work.sdl2.canvas.operation.RollingMeanHandler;
import work.sdl2.canvas.support.ManualWaitClock;
import work.sdl2.canvas.support.ScriptedRemoteTaskClient;

class WorkflowEngineTest {
    private static final EngineSettings SETTINGS = EngineSettings.of(Duration.ofSeconds(1), Duration.ofSeconds(2));

    @Test
    void runsEveryOperationInOrderAndChainsOutputs() {
        var client = new ScriptedRemoteTaskClient();
        var result = engine(client).execute(analysisWorkflow(), SETTINGS);

        assertEquals(WorkflowResult.Status.SUCCEEDED, result.finalStatus());
        assertEquals(3, result.steps().size());
        assertEquals(List.of("cv_operation", "rolling_mean", "peak_detection"),
            result.steps().stream().map(StepResult::operationId).toList());
        assertTrue(result.steps().stream().allMatch(step -> step.status() == StepStatus.SUCCEEDED));

        var submissions = client.submissions();
        assertEquals(List.of("cv", "rolling_mean", "peak_detection"),
            submissions.stream().map(RemoteTaskRequest::kind).toList());
        assertEquals("cv-1", submissions.get(1).payload().get("csv_id"));
        assertEquals("rolling_mean-2", submissions.get(2).payload().get("csv_id"));
        assertEquals("rolling_mean-2", result.steps().get(1).remoteTaskId());
    }

    @Test
    void singleCyclicVoltammetryStepExposesItsOutput() {
        var client = new ScriptedRemoteTaskClient().succeed("cv", Map.of("id", "csv-1"));
        var workflow = new Workflow("CV", "", List.of(
            Operation.of("cv1", "uo_sdl2_cv", Map.of("v_range", List.of(-0.5, 0.5), "freq", 0.1))
        ));

        var result = engine(client).execute(workflow, SETTINGS);

        assertEquals(WorkflowResult.Status.SUCCEEDED, result.finalStatus());
        var output = (Map<?, ?>) result.steps().get(0).output();
        assertEquals("csv-1", output.get("id"));
        assertEquals("cv-1", result.steps().get(0).remoteTaskId());
        assertNull(result.steps().get(0).error());
    }

    @Test
    void singleOperationDocumentRunsItsOperation() {
        var client = new ScriptedRemoteTaskClient().succeed("cv", Map.of("id", "csv-7"));
        var workflow = WorkflowLoader.parseJson("{\"name\": \"agent\", \"type\": \"uo_sdl2_cv\", \"params\": {\"freq\": 0.2}}");

        var result = engine(client).execute(workflow, SETTINGS);

        assertEquals(WorkflowResult.Status.SUCCEEDED, result.finalStatus());
        assertEquals(1, result.steps().size());
        assertEquals(1, client.submissions().size());
        assertEquals(0.2, client.submissions().get(0).payload().get("freq"));
        assertEquals(Map.of("id", "csv-7"), result.steps().get(0).output());
    }

    @Test
    void duplicateIdsAreRejectedBeforeAnyRemoteCall() {
        var client = new ScriptedRemoteTaskClient();
        var workflow = new Workflow("dup", "", List.of(
            Operation.of("x", "uo_sdl2_cv", Map.of()),
            Operation.of("x", "uo_sdl2_cv", Map.of())
        ));

        var result = engine(client).execute(workflow, SETTINGS);

        assertEquals(WorkflowResult.Status.FAILED, result.finalStatus());
        assertTrue(result.steps().isEmpty());
        assertEquals(ErrorCode.DUPLICATE_OPERATION_ID, result.error().orElseThrow().code());
        assertEquals(0, client.invocations());
        assertThrows(DuplicateOperationIdException.class, () -> WorkflowEngine.checkUniqueIds(workflow));
    }

    @Test
    void remoteFailureAbortsRemainingOperations() {
        var client = new ScriptedRemoteTaskClient().fail("rolling_mean", "column 'time' not found");
        var peak = new CountingHandler(new PeakDetectionHandler());
        var registry = OperationRegistry.of(List.of(new CyclicVoltammetryHandler(), new RollingMeanHandler(), peak));
        var engine = new WorkflowEngine(client, registry, new CompletionWaiter(client, new ManualWaitClock()), Clock.systemUTC());

        var result = engine.execute(analysisWorkflow(), SETTINGS);

        assertEquals(WorkflowResult.Status.FAILED, result.finalStatus());
        assertEquals(2, result.steps().size());
        var failed = result.steps().get(1);
        assertEquals(StepStatus.FAILED, failed.status());
        assertEquals(ErrorCode.REMOTE_TASK_FAILED, failed.error().code());
        assertEquals("column 'time' not found", failed.error().message());
        assertNull(failed.output());
        assertEquals(0, peak.invocations);
        assertEquals(2, client.submissions().size());
        assertEquals("rolling_mean", result.failedStep().orElseThrow().operationId());
    }

    @Test
    void forwardReferenceFailsWhenTheReferencingOperationRuns() {
        var client = new ScriptedRemoteTaskClient();
        var workflow = new Workflow("forward", "", List.of(
            Operation.of("smooth", "uo_sdl2_rolling_mean", Map.of("csv_id", "$cv.output.id")),
            Operation.of("cv", "uo_sdl2_cv", Map.of())
        ));

        var result = engine(client).execute(workflow, SETTINGS);

        assertEquals(1, result.steps().size());
        assertEquals(ErrorCode.UNKNOWN_REFERENCE, result.steps().get(0).error().code());
        assertEquals(0, client.invocations());
    }

    @Test
    void unresolvedReferenceIsNotReportedAsMissingParameter() {
        var client = new ScriptedRemoteTaskClient();
        var workflow = new Workflow("ghost", "", List.of(
            Operation.of("smooth", "uo_sdl2_rolling_mean", Map.of("csv_id", "$ghost.output.id"))
        ));

        var step = engine(client).execute(workflow, SETTINGS).steps().get(0);

        assertEquals(StepStatus.FAILED, step.status());
        assertEquals(ErrorCode.UNKNOWN_REFERENCE, step.error().code());
    }

    @Test
    void invalidFieldPathFailsTheStep() {
        var client = new ScriptedRemoteTaskClient().succeed("cv", Map.of("id", "csv-1"));
        var workflow = new Workflow("path", "", List.of(
            Operation.of("cv", "uo_sdl2_cv", Map.of()),
            Operation.of("smooth", "uo_sdl2_rolling_mean", Map.of("csv_id", "$cv.output.missing"))
        ));

        var result = engine(client).execute(workflow, SETTINGS);

        assertEquals(2, result.steps().size());
        assertEquals(ErrorCode.INVALID_FIELD_PATH, result.steps().get(1).error().code());
        assertEquals(1, client.submissions().size());
    }

    @Test
    void unsupportedTypeAndMissingParameterNeverReachTheService() {
        var client = new ScriptedRemoteTaskClient();
        var unsupported = engine(client).execute(new Workflow("bad", "", List.of(
            Operation.of("op", "invalid_type", Map.of())
        )), SETTINGS);
        var missing = engine(client).execute(new Workflow("bad", "", List.of(
            Operation.of("op", "uo_sdl2_peak_detection", Map.of("prominence", 0.1))
        )), SETTINGS);
        var wrongType = engine(client).execute(new Workflow("bad", "", List.of(
            Operation.of("op", "uo_sdl2_cv", Map.of("freq", "fast"))
        )), SETTINGS);

        assertEquals(ErrorCode.UNSUPPORTED_OPERATION, unsupported.steps().get(0).error().code());
        assertEquals(ErrorCode.MISSING_PARAMETER, missing.steps().get(0).error().code());
        assertEquals("csv_id", missing.steps().get(0).error().data().get("param"));
        assertEquals(ErrorCode.INVALID_PARAMETER_TYPE, wrongType.steps().get(0).error().code());
        assertEquals(0, client.invocations());
    }

    @Test
    void stepThatNeverFinishesIsTimedOut() {
        var client = new ScriptedRemoteTaskClient()
            .script("cv", List.of(TaskStatus.of(RemoteStatus.RUNNING)), null);
        var workflow = new Workflow("slow", "", List.of(
            Operation.of("cv", "uo_sdl2_cv", Map.of()),
            Operation.of("smooth", "uo_sdl2_rolling_mean", Map.of("csv_id", "$cv.output.id"))
        ));

        var result = engine(client).execute(workflow, SETTINGS);

        assertEquals(WorkflowResult.Status.FAILED, result.finalStatus());
        assertEquals(1, result.steps().size());
        var step = result.steps().get(0);
        assertEquals(StepStatus.TIMED_OUT, step.status());
        assertEquals(ErrorCode.WAITER_TIMEOUT, step.error().code());
        assertEquals("cv-1", step.remoteTaskId());
        assertEquals(0, client.resultFetches());
    }

    @Test
    void submissionFailureIsRecordedAndNotRetried() {
        var client = new ScriptedRemoteTaskClient().rejectSubmission("cv");
        var workflow = new Workflow("down", "", List.of(Operation.of("cv", "uo_sdl2_cv", Map.of())));

        var step = engine(client).execute(workflow, SETTINGS).steps().get(0);

        assertEquals(StepStatus.FAILED, step.status());
        assertEquals(ErrorCode.SUBMISSION_FAILED, step.error().code());
        assertNull(step.remoteTaskId());
        assertEquals(0, client.statusQueries());
    }

    @Test
    void statusQueryFailureFailsTheStepUnlessRetriesAreConfigured() {
        var workflow = new Workflow("flaky", "", List.of(Operation.of("cv", "uo_sdl2_cv", Map.of())));

        var strictClient = new ScriptedRemoteTaskClient().failStatusQueries(1);
        var strict = engine(strictClient).execute(workflow, SETTINGS);
        assertEquals(ErrorCode.STATUS_QUERY_FAILED, strict.steps().get(0).error().code());
        assertEquals(1, strictClient.statusQueries());

        var lenientClient = new ScriptedRemoteTaskClient().failStatusQueries(2);
        var lenientSettings = new EngineSettings(Duration.ofSeconds(1), Duration.ofSeconds(2), StatusRetryPolicy.of(2, Duration.ofMillis(100)));
        var lenient = engine(lenientClient).execute(workflow, lenientSettings);
        assertEquals(WorkflowResult.Status.SUCCEEDED, lenient.finalStatus());
        assertEquals(3, lenientClient.statusQueries());
    }

    @Test
    void cancelledRunRecordsTheStepAsTimedOut() {
        var client = new ScriptedRemoteTaskClient();
        var token = new CancellationToken();
        token.cancel();

        var result = engine(client).execute(analysisWorkflow(), SETTINGS, token);

        assertEquals(1, result.steps().size());
        assertEquals(StepStatus.TIMED_OUT, result.steps().get(0).status());
        assertEquals(0, client.invocations());
    }

    @Test
    void cancellationWhileRetryingStatusRecordsTimedOutStep() {
        var client = new ScriptedRemoteTaskClient().failStatusQueries(5);
        var token = new CancellationToken();
        var cancelling = new WaitClock() {
            @Override
            public long nanoTime() {
                return 0;
            }

            @Override
            public void sleep(Duration duration) {
                token.cancel();
            }
        };
        var engine = new WorkflowEngine(client, OperationRegistry.builtin(), new CompletionWaiter(client, cancelling), Clock.systemUTC());
        var settings = new EngineSettings(Duration.ofSeconds(1), Duration.ofSeconds(2), StatusRetryPolicy.of(3, Duration.ofMillis(10)));

        var result = engine.execute(analysisWorkflow(), settings, token);

        assertEquals(1, result.steps().size());
        var step = result.steps().get(0);
        assertEquals(StepStatus.TIMED_OUT, step.status());
        assertEquals(ErrorCode.WAITER_TIMEOUT, step.error().code());
        assertEquals("cancelled", step.error().message());
    }

    @Test
    void stepsAreFrozenOnceTerminal() {
        var step = new StepResult("cv");
        step.dispatched("cv-1");
        step.succeed(Map.of("id", "csv-1"));

        assertThrows(IllegalStateException.class, () -> step.succeed(Map.of()));
        assertEquals(StepStatus.SUCCEEDED, step.status());
    }

    private static WorkflowEngine engine(ScriptedRemoteTaskClient client) {
        return new WorkflowEngine(
            client,
            OperationRegistry.builtin(),
            new CompletionWaiter(client, new ManualWaitClock()),
            Clock.systemUTC()
        );
    }

    private static Workflow analysisWorkflow() {
        return new Workflow("CV_Analysis", "cv, smoothing, peaks", List.of(
            Operation.of("cv_operation", "uo_sdl2_cv", Map.of("v_range", List.of(-0.5, 0.5), "freq", 0.1)),
            Operation.of("rolling_mean", "uo_sdl2_rolling_mean", Map.of(
                "csv_id", "$cv_operation.output.id",
                "window_size", 20
            )),
            Operation.of("peak_detection", "uo_sdl2_peak_detection", Map.of(
                "csv_id", "$rolling_mean.output.id",
                "height", 0.05
            ))
        ));
    }

    private static final class CountingHandler implements OperationHandler {
        private final OperationHandler delegate;
        private int invocations;

        private CountingHandler(OperationHandler delegate) {
            this.delegate = delegate;
        }

        @Override
        public String type() {
            return delegate.type();
        }

        @Override
        public String remoteKind() {
            return delegate.remoteKind();
        }

        @Override
        public List<ParamSpec> params() {
            return delegate.params();
        }

        @Override
        public void validate(String operationId, Map<String, Object> resolvedParams) {
            invocations++;
            delegate.validate(operationId, resolvedParams);
        }

        @Override
        public RemoteTaskRequest toRemoteRequest(Map<String, Object> resolvedParams) {
            invocations++;
            return delegate.toRemoteRequest(resolvedParams);
        }
    }
}
