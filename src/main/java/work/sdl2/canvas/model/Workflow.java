package work.sdl2.canvas.model;

import java.util.List;
import java.util.Objects;

/**
 * Immutable, linear workflow document. Declaration order is the execution order.
 */
public record Workflow(String name, String description, List<Operation> operations) {
    public Workflow {
        Objects.requireNonNull(name, "name");
        description = description == null ? "" : description;
        operations = operations == null ? List.of() : List.copyOf(operations);
    }
}
