package ai.gently.cli;

import static org.junit.jupiter.api.Assertions.*;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

public class GentlyCliTest {
    @TempDir
    Path tempDir;

    private StringWriter out;
    private StringWriter err;

    @BeforeEach
    void setUp() {
        out = new StringWriter();
        err = new StringWriter();
    }

    private int run(String... args) {
        out.getBuffer().setLength(0);
        err.getBuffer().setLength(0);
        var cmd = GentlyCli.commandLine();
        cmd.setOut(new PrintWriter(out, true));
        cmd.setErr(new PrintWriter(err, true));
        var full = new String[args.length + 2];
        full[0] = "--projects-dir";
        full[1] = tempDir.toString();
        System.arraycopy(args, 0, full, 2, args.length);
        return cmd.execute(full);
    }

    @Test
    void testInitClanStampCollapse() throws Exception {
        assertEquals(0, run("init", "Demo"));
        assertTrue(out.toString().contains("✓ Project created: Demo"));
        assertTrue(Files.exists(tempDir.resolve("demo").resolve("gently.json")));

        assertEquals(0, run("-p", "demo", "clan", "Alpha"));
        assertTrue(out.toString().contains("branch: clan/clan-0-alpha"));
        assertEquals(0, run("-p", "demo", "clan", "Beta", "Second opinion"));

        assertEquals(0, run("-p", "demo", "pin", "alpha", "cache", "wins"));
        assertEquals(0, run("-p", "demo", "gate", "A", "yes", "--clan", "alpha"));
        assertEquals(0, run("-p", "demo", "descend", "alpha"));

        assertEquals(0, run("-p", "demo", "stamp"));
        assertTrue(out.toString().startsWith("[OLO|🌿clan/clan-0-alpha|📍1|🔒A●|📌cache-wins|#"), out.toString());

        assertEquals(0, run("-p", "demo", "collapse", "alpha", "beta", "--name", "Synth"));
        assertTrue(out.toString().contains("=== GENTLY WINDOW: Synth ==="));
        assertTrue(out.toString().strip().endsWith("=== BUILD ON THESE CONSTANTS ==="));

        assertEquals(0, run("-p", "demo", "windows"));
        assertTrue(out.toString().contains("▒ Alpha: \"cache wins\""), out.toString());

        assertEquals(0, run("-p", "demo", "status"));
        assertTrue(out.toString().contains("❄ Beta"), out.toString());
    }

    @Test
    void testProjectGates() {
        assertEquals(0, run("init", "Demo"));

        assertEquals(0, run("gate", "b", "half", "--question", "Is it fast?"));
        assertEquals("  B◐  Is it fast?", out.toString().stripTrailing().replace("\r", ""));

        assertEquals(0, run("gate"));
        assertTrue(out.toString().contains("A○  (no question)"));

        assertEquals(2, run("gate", "b", "maybe"));
        assertEquals(1, run("gate", "q"));
    }

    @Test
    void testErrors() {
        assertEquals(1, run("stamp"));
        assertTrue(err.toString().contains("Not in a gently project."));

        assertEquals(0, run("init", "Demo"));
        assertEquals(1, run("init", "Demo"));
        assertTrue(err.toString().startsWith("Error:"));

        assertEquals(1, run("stamp"));
        assertTrue(err.toString().contains("No active clan found."));

        assertEquals(0, run("clan", "Solo"));
        assertEquals(1, run("collapse", "solo", "--name", "Alone"));
        assertTrue(err.toString().contains("Need at least 2 active clans"));

        assertEquals(2, run("collapse", "solo"));
        assertEquals(2, run("no-such-command"));
    }

    @Test
    void testHashOutsideRepository() {
        assertEquals(0, run("hash", tempDir.toString()));
        assertEquals("00000000", out.toString().strip());
    }

    @Test
    void testLog() {
        assertEquals(0, run("init", "Demo"));
        assertEquals(0, run("clan", "Alpha"));

        assertEquals(0, run("log"));
        assertTrue(out.toString().contains(" clan-start: Alpha"), out.toString());
        assertTrue(out.toString().contains(" init: gently project created"), out.toString());

        assertEquals(0, run("log", "-n", "1"));
        assertEquals(1, out.toString().strip().split("\\R").length);
    }
}
