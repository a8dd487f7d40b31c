package ai.gently.util;

import static org.junit.jupiter.api.Assertions.*;
import static org.junit.jupiter.api.Assumptions.assumeFalse;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

public class EnvironmentTest {
    @TempDir
    Path tempDir;

    @Test
    void testCapturesOutput() throws Exception {
        assumeFalse(Environment.isWindows());
        var lines = new ArrayList<String>();
        var output = Environment.instance.runShellCommand("echo one; echo two", tempDir, lines::add, 10);

        assertEquals("one\ntwo", output);
        assertEquals(2, lines.size());
    }

    @Test
    void testNonZeroExitIsFailure() {
        assumeFalse(Environment.isWindows());
        var ex = assertThrows(
                Environment.FailureException.class,
                () -> Environment.instance.runShellCommand("echo broken >&2; exit 3", tempDir, s -> {}, 10));
        assertEquals("broken", ex.getOutput());
    }

    @Test
    void testTimeout() {
        assumeFalse(Environment.isWindows());
        assertThrows(
                Environment.TimeoutException.class,
                () -> Environment.instance.runShellCommand("sleep 5", tempDir, s -> {}, 1));
    }

    @Test
    void testRunCommandPassesArgumentsLiterally() throws Exception {
        assumeFalse(Environment.isWindows());
        var output = Environment.instance.runCommand(
                List.of("printf", "%s|", "a$(touch created)b", "say \"hi\"", "`id`"), tempDir, s -> {}, 10);

        assertEquals("a$(touch created)b|say \"hi\"|`id`|", output);
        assertFalse(java.nio.file.Files.exists(tempDir.resolve("created")));
    }
}
