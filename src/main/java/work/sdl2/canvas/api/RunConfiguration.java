package work.sdl2.canvas.api;

import java.util.Objects;
import work.sdl2.canvas.config.RunnerSettings;

/**
 * Immutable input of {@link WorkflowRunner#run}.
 */
public record RunConfiguration(WorkflowSource source, RunnerSettings settings, boolean writeResultFile) {
    public RunConfiguration {
        Objects.requireNonNull(source, "source");
        Objects.requireNonNull(settings, "settings");
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private WorkflowSource source;
        private RunnerSettings settings = RunnerSettings.builder().build();
        private boolean writeResultFile = true;

        public Builder source(WorkflowSource source) {
            this.source = source;
            return this;
        }

        public Builder settings(RunnerSettings settings) {
            this.settings = settings;
            return this;
        }

        public Builder writeResultFile(boolean writeResultFile) {
            this.writeResultFile = writeResultFile;
            return this;
        }

        public RunConfiguration build() {
            return new RunConfiguration(source, settings, writeResultFile);
        }
    }
}
