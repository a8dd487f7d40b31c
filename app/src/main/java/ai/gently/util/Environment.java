package ai.gently.util;

import java.io.File;
import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.function.BiFunction;
import java.util.function.Consumer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/** Runs external commands (the git executable) on behalf of the git helpers. */
public class Environment {
    private static final Logger logger = LogManager.getLogger(Environment.class);
    public static final Environment instance = new Environment();

    public static final long GIT_TIMEOUT_SECONDS = 120;

    @FunctionalInterface
    public interface ShellCommandRunner {
        String run(Consumer<String> outputConsumer, long timeoutSeconds)
                throws SubprocessException, InterruptedException;
    }

    // Default factory creates the real runner. Tests can replace this.
    public static final BiFunction<List<String>, Path, ShellCommandRunner> DEFAULT_SHELL_COMMAND_RUNNER_FACTORY =
            (argv, root) -> (outputConsumer, timeoutSeconds) ->
                    runCommandInternal(argv, root, outputConsumer, timeoutSeconds);

    public static BiFunction<List<String>, Path, ShellCommandRunner> shellCommandRunnerFactory =
            DEFAULT_SHELL_COMMAND_RUNNER_FACTORY;

    private Environment() {}

    /**
     * Runs a shell command in {@code root}, returning combined stdout and stderr. Output lines are passed to the
     * consumer as they are produced.
     *
     * @throws SubprocessException if the command fails to start, times out, or returns a non-zero exit code.
     * @throws InterruptedException if the thread is interrupted.
     */
    public String runShellCommand(String command, Path root, Consumer<String> outputConsumer, long timeoutSeconds)
            throws SubprocessException, InterruptedException {
        var argv = isWindows() ? List.of("cmd.exe", "/c", command) : List.of("/bin/sh", "-c", command);
        return runCommand(argv, root, outputConsumer, timeoutSeconds);
    }

    /**
     * Runs a program directly, without a shell: each element of {@code argv} reaches the program unchanged, so
     * arguments built from user input need no quoting.
     *
     * @throws SubprocessException if the command fails to start, times out, or returns a non-zero exit code.
     * @throws InterruptedException if the thread is interrupted.
     */
    public String runCommand(List<String> argv, Path root, Consumer<String> outputConsumer, long timeoutSeconds)
            throws SubprocessException, InterruptedException {
        return shellCommandRunnerFactory.apply(List.copyOf(argv), root).run(outputConsumer, timeoutSeconds);
    }

    private static String runCommandInternal(
            List<String> argv, Path root, Consumer<String> outputConsumer, long timeoutSeconds)
            throws SubprocessException, InterruptedException {
        var command = String.join(" ", argv);
        logger.debug("Running `{}` in `{}`", command, root);

        ProcessBuilder pb = createProcessBuilder(root, argv);
        Process process;
        try {
            process = pb.start();
        } catch (IOException e) {
            throw new StartupException(
                    "unable to start %s in %s (%s)".formatted(argv.get(0), root, e.getMessage()), "");
        }

        // drain stdout/stderr immediately to avoid pipe-buffer deadlock
        CompletableFuture<String> stdoutFuture =
                CompletableFuture.supplyAsync(() -> readStream(process.getInputStream(), outputConsumer));
        CompletableFuture<String> stderrFuture =
                CompletableFuture.supplyAsync(() -> readStream(process.getErrorStream(), outputConsumer));

        String combinedOutput;
        try {
            if (!process.waitFor(timeoutSeconds, TimeUnit.SECONDS)) {
                process.destroyForcibly();
                combinedOutput = formatOutput(stdoutFuture.join(), stderrFuture.join());
                throw new TimeoutException(
                        "process '%s' did not complete within %d seconds".formatted(command, timeoutSeconds),
                        combinedOutput);
            }
        } catch (InterruptedException ie) {
            process.destroyForcibly();
            stdoutFuture.cancel(true);
            stderrFuture.cancel(true);
            logger.warn("Process '{}' interrupted.", command);
            throw ie;
        }

        combinedOutput = formatOutput(stdoutFuture.join(), stderrFuture.join());
        int exitCode = process.exitValue();
        if (exitCode != 0) {
            throw new FailureException(
                    "process '%s' signalled error code %d".formatted(command, exitCode), combinedOutput);
        }
        return combinedOutput;
    }

    private static String readStream(java.io.InputStream in, Consumer<String> outputConsumer) {
        var lines = new java.util.ArrayList<String>();
        try (var reader = new java.io.BufferedReader(
                new java.io.InputStreamReader(in, java.nio.charset.StandardCharsets.UTF_8))) {
            String line;
            while ((line = reader.readLine()) != null) {
                outputConsumer.accept(line);
                lines.add(line);
            }
        } catch (IOException e) {
            // the lines read so far are still returned
            logger.error("Error reading stream", e);
        }
        return String.join("\n", lines);
    }

    private static String formatOutput(String stdout, String stderr) {
        stdout = stdout.trim();
        stderr = stderr.trim();
        if (stderr.isEmpty()) {
            return stdout;
        }
        if (stdout.isEmpty()) {
            return stderr;
        }
        return "stdout:\n" + stdout + "\n\nstderr:\n" + stderr;
    }

    private static ProcessBuilder createProcessBuilder(Path root, List<String> command) {
        var pb = new ProcessBuilder(command);
        pb.directory(root.toFile());
        // interactive prompts must fail fast
        pb.redirectInput(ProcessBuilder.Redirect.from(new File(isWindows() ? "NUL" : "/dev/null")));
        pb.environment().remove("EDITOR");
        pb.environment().remove("VISUAL");
        pb.environment().put("TERM", "dumb");
        pb.environment().put("GIT_TERMINAL_PROMPT", "0");
        return pb;
    }

    /** Base exception for subprocess errors. */
    public abstract static class SubprocessException extends IOException {
        private final String output;

        public SubprocessException(String message, String output) {
            super(message);
            this.output = output;
        }

        public String getOutput() {
            return output;
        }
    }

    /** Thrown when a subprocess fails to start. */
    public static class StartupException extends SubprocessException {
        public StartupException(String message, String output) {
            super(message, output);
        }
    }

    /** Thrown when a subprocess times out. */
    public static class TimeoutException extends SubprocessException {
        public TimeoutException(String message, String output) {
            super(message, output);
        }
    }

    /** Thrown when a subprocess returns a non-zero exit code. */
    public static class FailureException extends SubprocessException {
        public FailureException(String message, String output) {
            super(message, output);
        }
    }

    public static boolean isWindows() {
        return System.getProperty("os.name").toLowerCase(Locale.ROOT).contains("win");
    }

    /** Returns the current user's home directory as a Path. */
    public static Path getHomePath() {
        return Path.of(System.getProperty("user.home"));
    }
}
