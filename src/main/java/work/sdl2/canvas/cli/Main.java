package work.sdl2.canvas.cli;

import picocli.CommandLine;

/**
 * Entry point for the {@code java -jar} distribution.
 */
public final class Main {
    private Main() {}

    public static void main(String[] args) {
        int exitCode = newCommandLine().execute(args);
        System.exit(exitCode);
    }

    static CommandLine newCommandLine() {
        return newCommandLine(new RunWorkflowCommand());
    }

    static CommandLine newCommandLine(RunWorkflowCommand command) {
        return new CommandLine(command)
            .setExecutionExceptionHandler(new ShortErrorHandler());
    }
}
