package work.sdl2.canvas.api;

import java.net.URI;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;

/**
 * Where the workflow document comes from (local file or remote URL).
 */
public record WorkflowSource(Optional<Path> localPath, Optional<URI> remoteUri) {
    public WorkflowSource {
        Objects.requireNonNull(localPath, "localPath");
        Objects.requireNonNull(remoteUri, "remoteUri");
        if (localPath.isEmpty() && remoteUri.isEmpty()) {
            throw new IllegalArgumentException("Either localPath or remoteUri must be present.");
        }
    }

    public static WorkflowSource forLocal(Path path) {
        return new WorkflowSource(Optional.of(path), Optional.empty());
    }

    public static WorkflowSource forRemote(URI uri) {
        return new WorkflowSource(Optional.empty(), Optional.of(uri));
    }

    public static WorkflowSource detect(String value) {
        var lower = value.trim().toLowerCase(Locale.ROOT);
        if (lower.startsWith("http://") || lower.startsWith("https://")) {
            return forRemote(URI.create(value.trim()));
        }
        return forLocal(Path.of(value).toAbsolutePath().normalize());
    }

    public boolean isRemote() {
        return remoteUri.isPresent();
    }

    public String display() {
        return localPath.map(Path::toString).or(() -> remoteUri.map(URI::toString)).orElse("unknown");
    }
}
