package ai.gently.project;

import static org.junit.jupiter.api.Assertions.*;

import ai.gently.git.GitBackend;
import ai.gently.git.GitRepo;
import ai.gently.model.GateState;
import ai.gently.model.Window;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

public class ProjectManagerTest {
    private static final Instant NOW = Instant.parse("2026-03-14T09:26:53Z");

    @TempDir
    Path tempDir;

    private ProjectStore store;
    private ProjectManager manager;

    @BeforeEach
    void setUp() {
        store = new ProjectStore(tempDir);
        manager = new ProjectManager(store, new GitBackend(), Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    void testCreateProject() throws Exception {
        var config = manager.createProject("My Demo");

        assertEquals("my-demo", config.id());
        assertEquals("My Demo", config.name());
        assertEquals(NOW.toString(), config.created());
        assertEquals(5, config.gates().size());
        assertTrue(config.gates().stream().allMatch(g -> g.state() == GateState.OPEN));
        assertTrue(config.clans().isEmpty());
        assertEquals(1, config.windows().size());
        var root = config.windows().get(0);
        assertEquals(Window.ROOT_ID, root.id());
        assertEquals("main", root.gitBranch());
        assertTrue(root.constants().isEmpty());

        var dir = store.projectDir("my-demo");
        for (var sub : ProjectStore.LAYOUT_DIRS) {
            assertTrue(Files.isDirectory(dir.resolve(sub)), sub);
        }
        try (var repo = new GitRepo(dir)) {
            assertEquals("main", repo.getCurrentBranch());
            var status = repo.getGit().status().call();
            assertTrue(status.getUntracked().isEmpty(), "gently.json and .gitignore are committed");
            var log = repo.getGit().log().call().iterator();
            assertEquals("init: gently project created", log.next().getFullMessage());
        }
    }

    @Test
    void testCreateExistingProjectFails() throws Exception {
        manager.createProject("Demo");
        assertThrows(ProjectExistsException.class, () -> manager.createProject("demo"));
    }

    @Test
    void testSetGate() throws Exception {
        manager.createProject("Demo");

        var updated = manager.setGate("demo", "b", GateState.YES, "Ship it?");
        var gate = updated.gates().get(1);
        assertEquals("B", gate.letter());
        assertEquals(GateState.YES, gate.state());
        assertEquals("Ship it?", gate.question());

        updated = manager.setGate("demo", "B", GateState.HALF, null);
        assertEquals("Ship it?", updated.gates().get(1).question());
        assertEquals(GateState.HALF, store.load("demo").gates().get(1).state());

        assertThrows(IllegalArgumentException.class, () -> manager.setGate("demo", "Z", GateState.NO, null));
    }

    @Test
    void testFindProjectId() throws Exception {
        manager.createProject("Alpha Project");
        var dir = store.projectDir("alpha-project");
        assertEquals("alpha-project", manager.findProjectId(dir.resolve("worktrees")));
        // a single project is the fallback from anywhere
        assertEquals("alpha-project", manager.findProjectId(Path.of("/")));

        manager.createProject("Beta");
        assertNull(manager.findProjectId(Path.of("/")));
        assertEquals("beta", manager.findProjectId(store.projectDir("beta")));
        assertEquals(java.util.List.of("alpha-project", "beta"), manager.listProjects());
    }
}
