package work.sdl2.canvas.api;

import java.util.Objects;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.sdl2.canvas.client.HttpRemoteTaskClient;
import work.sdl2.canvas.client.RemoteTaskClient;
import work.sdl2.canvas.config.RunnerSettings;
import work.sdl2.canvas.engine.CancellationToken;
import work.sdl2.canvas.engine.WorkflowEngine;
import work.sdl2.canvas.engine.WorkflowResult;
import work.sdl2.canvas.model.Workflow;
import work.sdl2.canvas.model.WorkflowLoadException;
import work.sdl2.canvas.model.WorkflowLoader;

/**
 * Public entry point for embedding the runner: load a workflow, execute it against the task service and
 * persist the result document.
 */
public final class WorkflowRunner {
    private static final Logger log = LoggerFactory.getLogger(WorkflowRunner.class);

    private final Function<RunnerSettings, RemoteTaskClient> clientFactory;

    public WorkflowRunner() {
        this(settings -> new HttpRemoteTaskClient(settings.baseUrl(), settings.apiKey()));
    }

    public WorkflowRunner(Function<RunnerSettings, RemoteTaskClient> clientFactory) {
        this.clientFactory = Objects.requireNonNull(clientFactory, "clientFactory");
    }

    /**
     * @throws WorkflowLoadException when the workflow document cannot be read
     */
    public WorkflowResult run(RunConfiguration configuration) {
        return run(configuration, new CancellationToken());
    }

    public WorkflowResult run(RunConfiguration configuration, CancellationToken token) {
        var workflow = load(configuration.source());
        var settings = configuration.settings();
        var engine = new WorkflowEngine(clientFactory.apply(settings));
        var result = engine.execute(workflow, settings.toEngineSettings(), token);
        if (configuration.writeResultFile()) {
            WorkflowResultWriter.write(result, settings.resultFile());
        }
        if (result.succeeded()) {
            log.info("Workflow execution completed successfully");
        } else {
            log.error("Workflow execution failed{}", result.failedStep().map(step -> " at operation " + step.operationId()).orElse(""));
        }
        return result;
    }

    private Workflow load(WorkflowSource source) {
        return source.remoteUri()
            .map(WorkflowLoader::loadFromHttp)
            .orElseGet(() -> WorkflowLoader.loadFromLocalFile(source.localPath().orElseThrow()));
    }
}
