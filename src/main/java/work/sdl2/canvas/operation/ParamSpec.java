package work.sdl2.canvas.operation;

import java.util.Objects;

/**
 * Declared parameter of an operation handler. A {@code null} default on an optional parameter means the
 * parameter is only forwarded when the workflow provides it.
 */
public record ParamSpec(String name, ParamType type, boolean required, Object defaultValue) {
    public ParamSpec {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(type, "type");
    }

    public static ParamSpec required(String name, ParamType type) {
        return new ParamSpec(name, type, true, null);
    }

    public static ParamSpec optional(String name, ParamType type, Object defaultValue) {
        return new ParamSpec(name, type, false, defaultValue);
    }

    public static ParamSpec optional(String name, ParamType type) {
        return new ParamSpec(name, type, false, null);
    }
}
