package ai.gently.git;

import static org.junit.jupiter.api.Assertions.*;
import static org.junit.jupiter.api.Assumptions.assumeTrue;

import ai.gently.util.Environment;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

public class GitBackendTest {
    private final GitBackend backend = new GitBackend();
    private Path root;

    @TempDir
    Path tempDir;

    @BeforeEach
    void setUp() throws Exception {
        root = tempDir.resolve("demo");
        Files.createDirectories(root);
    }

    @AfterEach
    void tearDown() {
        Environment.shellCommandRunnerFactory = Environment.DEFAULT_SHELL_COMMAND_RUNNER_FACTORY;
    }

    private void assumeWorktrees() {
        try (var repo = new GitRepo(root)) {
            assumeTrue(repo.worktrees().supportsWorktrees(), "git executable not available");
        }
    }

    @Test
    void testInitializeCreatesMainWithFirstCommit() throws Exception {
        var hash = backend.initialize(root);

        assertEquals(7, hash.length());
        assertNotEquals(IGitBackend.UNKNOWN_HASH, hash);
        assertEquals(hash, backend.resolveShortHash(root));
        assertTrue(backend.hasBranch(root, GitRepoFactory.INITIAL_BRANCH));
        assertTrue(Files.readString(root.resolve(".gitignore")).contains("worktrees/"));
        try (var repo = new GitRepo(root)) {
            assertEquals("main", repo.getCurrentBranch());
        }
    }

    @Test
    void testResolveShortHashSentinel() throws Exception {
        assertEquals(IGitBackend.UNKNOWN_HASH, backend.resolveShortHash(tempDir.resolve("missing")));
        var plain = tempDir.resolve("plain");
        Files.createDirectories(plain);
        assertEquals(IGitBackend.UNKNOWN_HASH, backend.resolveShortHash(plain));
    }

    @Test
    void testCommitAllowsEmptyAndAdvancesHead() throws Exception {
        var first = backend.initialize(root);
        var second = backend.commit(root, "nothing changed");
        var third = backend.commit(root, "still nothing");

        assertNotEquals(first, second);
        assertNotEquals(second, third);
        assertEquals(third, backend.resolveShortHash(root));
    }

    @Test
    void testCommitTouchesListedFiles() throws Exception {
        backend.initialize(root);
        backend.commit(root, "touch", List.of("notes/a.md", "constants/"));

        assertTrue(Files.isRegularFile(root.resolve("notes/a.md")));
        assertTrue(Files.isDirectory(root.resolve("constants")));
        try (var repo = new GitRepo(root)) {
            var status = repo.getGit().status().call();
            assertFalse(status.getUntracked().contains("notes/a.md"));
        }
    }

    @Test
    void testBranchAndCheckout() throws Exception {
        backend.initialize(root);
        backend.branch(root, "window/synth");
        try (var repo = new GitRepo(root)) {
            assertEquals("window/synth", repo.getCurrentBranch());
        }

        backend.checkout(root, "main");
        try (var repo = new GitRepo(root)) {
            assertEquals("main", repo.getCurrentBranch());
        }
        assertThrows(GitRepo.GitStateException.class, () -> backend.branch(root, "window/synth"));
    }

    @Test
    void testTagAndTagCommit() throws Exception {
        backend.initialize(root);
        var hash = backend.commit(root, "to be tagged");
        backend.tag(root, "const/clan-0-alpha");

        assertEquals(hash, backend.tagCommit(root, "const/clan-0-alpha"));
        assertNull(backend.tagCommit(root, "const/clan-9-none"));

        backend.commit(root, "later");
        assertEquals(hash, backend.tagCommit(root, "const/clan-0-alpha"));
    }

    @Test
    void testAttachWorktreeIsIdempotent() throws Exception {
        backend.initialize(root);
        assumeWorktrees();
        var worktree = root.resolve("worktrees").resolve("clan-0-alpha");

        backend.attachWorktree(root, worktree, "clan/clan-0-alpha");
        backend.attachWorktree(root, worktree, "clan/clan-0-alpha");

        assertTrue(Files.exists(worktree.resolve(".git")));
        assertTrue(backend.hasBranch(root, "clan/clan-0-alpha"));
        try (var repo = new GitRepo(root)) {
            var attached = repo.worktrees().listWorktrees().stream()
                    .filter(w -> "clan/clan-0-alpha".equals(w.branch()))
                    .toList();
            assertEquals(1, attached.size());
            assertEquals(worktree.toRealPath(), attached.get(0).path());
        }
    }

    @Test
    void testWorktreeCommitsStayOnClanBranch() throws Exception {
        var rootHash = backend.initialize(root);
        assumeWorktrees();
        var worktree = root.resolve("worktrees").resolve("clan-0-alpha");
        backend.attachWorktree(root, worktree, "clan/clan-0-alpha");

        Files.writeString(worktree.resolve("state.json"), "{}");
        var clanHash = backend.commit(worktree, "clan-start: Alpha", List.of("state.json"));

        assertEquals(clanHash, backend.resolveShortHash(worktree));
        assertEquals(rootHash, backend.resolveShortHash(root));
        try (var repo = new GitRepo(worktree)) {
            assertEquals("clan/clan-0-alpha", repo.getCurrentBranch());
            assertEquals(root.toRealPath(), repo.getGitTopLevel().toRealPath());
        }
    }

    @Test
    void testWorktreeFailureSurfacesGitOutput() throws Exception {
        backend.initialize(root);
        Environment.shellCommandRunnerFactory = (cmd, dir) -> (out, timeout) -> {
            throw new Environment.FailureException("process '" + cmd + "' signalled error code 128", "fatal: nope");
        };

        var ex = assertThrows(
                GitRepo.GitRepoException.class,
                () -> backend.attachWorktree(root, root.resolve("worktrees").resolve("x"), "clan/x"));
        assertTrue(ex.getMessage().contains("fatal: nope"), ex.getMessage());
    }

    @Test
    void testLogCoversAllBranches() throws Exception {
        backend.initialize(root);
        var mainHash = backend.commit(root, "on main");
        backend.branch(root, "window/synth");
        var windowHash = backend.commit(root, "on window");
        backend.checkout(root, "main");

        var log = backend.log(root, 20);
        assertEquals(3, log.size());
        assertTrue(log.contains(windowHash + " on window"), log.toString());
        assertTrue(log.contains(mainHash + " on main"), log.toString());
        assertTrue(log.stream().anyMatch(l -> l.endsWith(" init: project created")), log.toString());

        assertEquals(1, backend.log(root, 1).size());
    }
}
