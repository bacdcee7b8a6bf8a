package work.sdl2.canvas.cli;

import ch.qos.logback.classic.Level;
import java.net.URI;
import java.nio.file.Path;
import java.util.Optional;
import java.util.concurrent.Callable;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import work.sdl2.canvas.api.LogLevel;
import work.sdl2.canvas.api.RunConfiguration;
import work.sdl2.canvas.api.WorkflowResultWriter;
import work.sdl2.canvas.api.WorkflowRunner;
import work.sdl2.canvas.api.WorkflowSource;
import work.sdl2.canvas.config.RunnerSettings;
import work.sdl2.canvas.config.SettingsLoader;
import work.sdl2.canvas.shared.DurationParser;

@CommandLine.Command(
    name = "sdl2-canvas-run",
    description = "Execute an SDL2 Canvas workflow against the remote task service.",
    mixinStandardHelpOptions = true,
    versionProvider = VersionProvider.class,
    showDefaultValues = true
)
final class RunWorkflowCommand implements Callable<Integer> {
    @CommandLine.Parameters(
        index = "0",
        paramLabel = "WORKFLOW",
        description = "Workflow file (JSON or YAML) or HTTP(S) URL."
    )
    private String workflow;

    @CommandLine.Option(
        names = "--result-file",
        description = "Where to save the result JSON (default: CANVAS_RESULT_FILE or result.json).",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private Path resultFile;

    @CommandLine.Option(
        names = "--config",
        description = "TOML configuration file (default: ./sdl2.toml when present).",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private Path configFile;

    @CommandLine.Option(
        names = "--base-url",
        description = "Task service base URL (overrides SDL2_API_BASE_URL).",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private String baseUrl;

    @CommandLine.Option(
        names = "--api-key",
        description = "Value of the X-API-Key header (overrides SDL2_API_KEY).",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private String apiKey;

    @CommandLine.Option(
        names = "--poll-interval",
        description = "Delay between status queries (e.g. 500ms, 5s; bare numbers are seconds).",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private String pollIntervalRaw;

    @CommandLine.Option(
        names = "--max-wait",
        description = "Per-operation wait limit (e.g. 90s, 1h; bare numbers are seconds).",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private String maxWaitRaw;

    @CommandLine.Option(
        names = "--status-retries",
        description = "Retries for a failed status query before the step fails.",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private Integer statusRetries;

    @CommandLine.Option(
        names = "--log-level",
        description = "Log threshold (trace|debug|info|warn|error).",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private String logLevelRaw;

    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    private final WorkflowRunner runner;

    RunWorkflowCommand() {
        this(new WorkflowRunner());
    }

    RunWorkflowCommand(WorkflowRunner runner) {
        this.runner = runner;
    }

    @Override
    public Integer call() {
        var workingDir = Path.of("").toAbsolutePath().normalize();
        var settings = resolveSettings(workingDir);
        applyLogLevel(settings.logLevel());

        var configuration = RunConfiguration.builder()
            .source(WorkflowSource.detect(workflow))
            .settings(settings)
            .build();
        var result = runner.run(configuration);
        var out = spec.commandLine().getOut();
        out.println(WorkflowResultWriter.toJson(result));
        out.flush();
        return result.finalStatus().exitCode();
    }

    RunnerSettings resolveSettings(Path workingDir) {
        RunnerSettings.Builder builder = SettingsLoader.load(workingDir, Optional.ofNullable(configFile));
        if (baseUrl != null && !baseUrl.isBlank()) {
            builder.baseUrl(URI.create(baseUrl));
        }
        if (apiKey != null && !apiKey.isBlank()) {
            builder.apiKey(Optional.of(apiKey));
        }
        DurationParser.parseSeconds(pollIntervalRaw).ifPresent(builder::pollInterval);
        DurationParser.parseSeconds(maxWaitRaw).ifPresent(builder::maxWait);
        if (statusRetries != null) {
            builder.statusRetries(statusRetries);
        }
        if (resultFile != null) {
            builder.resultFile(workingDir.resolve(resultFile));
        }
        if (logLevelRaw != null) {
            builder.logLevel(LogLevel.from(logLevelRaw));
        }
        return builder.build();
    }

    private static void applyLogLevel(LogLevel level) {
        var root = LoggerFactory.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME);
        if (root instanceof ch.qos.logback.classic.Logger logback) {
            logback.setLevel(Level.toLevel(level.name(), Level.INFO));
        }
    }
}
