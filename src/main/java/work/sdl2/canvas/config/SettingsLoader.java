package work.sdl2.canvas.config;

import java.io.IOException;
import java.net.URI;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.tomlj.Toml;
import org.tomlj.TomlParseResult;
import org.tomlj.TomlTable;
import work.sdl2.canvas.api.LogLevel;
import work.sdl2.canvas.shared.DurationParser;

/**
 * Builds {@link RunnerSettings} from defaults, an optional {@code sdl2.toml} file and the environment,
 * later sources winning. Callers apply command-line overrides on the returned builder.
 */
public final class SettingsLoader {
    public static final String DEFAULT_CONFIG_FILE = "sdl2.toml";
    static final String TABLE = "sdl2";

    static final String ENV_BASE_URL = "SDL2_API_BASE_URL";
    static final String ENV_API_KEY = "SDL2_API_KEY";
    static final String ENV_POLL_INTERVAL = "TASK_POLL_INTERVAL_SECONDS";
    static final String ENV_MAX_WAIT = "TASK_MAX_WAIT_SECONDS";
    static final String ENV_STATUS_RETRIES = "TASK_STATUS_RETRIES";
    static final String ENV_RESULT_FILE = "CANVAS_RESULT_FILE";
    static final String ENV_LOG_LEVEL = "LOG_LEVEL";

    private static final Logger log = LoggerFactory.getLogger(SettingsLoader.class);

    private SettingsLoader() {}

    public static RunnerSettings.Builder load(Path workingDirectory, Optional<Path> configFile) {
        return load(workingDirectory, configFile, System.getenv());
    }

    /**
     * @param configFile explicit TOML file; must exist when given. Without it {@code sdl2.toml} in the
     *                   working directory is read if present.
     */
    public static RunnerSettings.Builder load(Path workingDirectory, Optional<Path> configFile, Map<String, String> env) {
        var builder = RunnerSettings.builder().resultFile(workingDirectory.resolve(RunnerSettings.DEFAULT_RESULT_FILE));
        var tomlPath = configFile.or(() -> Optional.of(workingDirectory.resolve(DEFAULT_CONFIG_FILE)).filter(Files::isRegularFile));
        tomlPath.ifPresent(path -> applyToml(builder, parseToml(path), workingDirectory));
        applyEnvironment(builder, env, workingDirectory);
        return builder;
    }

    private static TomlParseResult parseToml(Path path) {
        if (!Files.isRegularFile(path)) {
            throw new IllegalArgumentException("Configuration file not found: " + path);
        }
        try {
            var result = Toml.parse(Files.readString(path));
            if (result.hasErrors()) {
                throw new IllegalArgumentException("Invalid configuration file " + path + ": " + result.errors().get(0));
            }
            log.debug("Loaded configuration from {}", path);
            return result;
        } catch (IOException ex) {
            throw new IllegalStateException("Failed to read configuration: " + path, ex);
        }
    }

    private static void applyToml(RunnerSettings.Builder builder, TomlParseResult toml, Path workingDirectory) {
        TomlTable table = toml.getTable(TABLE);
        if (table == null) {
            return;
        }
        tomlText(table, "base_url").ifPresent(value -> builder.baseUrl(URI.create(value)));
        tomlText(table, "api_key").ifPresent(value -> builder.apiKey(Optional.of(value)));
        tomlDuration(table, "poll_interval").ifPresent(builder::pollInterval);
        tomlDuration(table, "max_wait").ifPresent(builder::maxWait);
        if (table.isLong("status_retries")) {
            builder.statusRetries(Math.toIntExact(table.getLong("status_retries")));
        }
        tomlText(table, "result_file").ifPresent(value -> builder.resultFile(workingDirectory.resolve(value)));
        tomlText(table, "log_level").ifPresent(value -> builder.logLevel(LogLevel.from(value)));
    }

    private static Optional<String> tomlText(TomlTable table, String key) {
        if (!table.isString(key)) {
            return Optional.empty();
        }
        return Optional.ofNullable(table.getString(key)).filter(value -> !value.isBlank());
    }

    private static Optional<Duration> tomlDuration(TomlTable table, String key) {
        if (table.isLong(key)) {
            return Optional.of(Duration.ofSeconds(table.getLong(key)));
        }
        return tomlText(table, key).flatMap(DurationParser::parseSeconds);
    }

    private static void applyEnvironment(RunnerSettings.Builder builder, Map<String, String> env, Path workingDirectory) {
        envValue(env, ENV_BASE_URL).ifPresent(value -> builder.baseUrl(URI.create(value)));
        envValue(env, ENV_API_KEY).ifPresent(value -> builder.apiKey(Optional.of(value)));
        envValue(env, ENV_POLL_INTERVAL).flatMap(DurationParser::parseSeconds).ifPresent(builder::pollInterval);
        envValue(env, ENV_MAX_WAIT).flatMap(DurationParser::parseSeconds).ifPresent(builder::maxWait);
        envValue(env, ENV_STATUS_RETRIES).ifPresent(integer(ENV_STATUS_RETRIES, builder::statusRetries));
        envValue(env, ENV_RESULT_FILE).ifPresent(value -> builder.resultFile(workingDirectory.resolve(value)));
        envValue(env, ENV_LOG_LEVEL).ifPresent(value -> builder.logLevel(LogLevel.from(value)));
    }

    private static Optional<String> envValue(Map<String, String> env, String name) {
        return Optional.ofNullable(env.get(name)).map(String::trim).filter(value -> !value.isEmpty());
    }

    private static Consumer<String> integer(String name, Consumer<Integer> target) {
        return value -> {
            try {
                target.accept(Integer.parseInt(value));
            } catch (NumberFormatException ex) {
                throw new IllegalArgumentException("Invalid integer for " + name + ": " + value);
            }
        };
    }
}
