package ai.gently.project;

import ai.gently.git.GitRepoFactory;
import ai.gently.git.IGitBackend;
import ai.gently.model.Gate;
import ai.gently.model.GateState;
import ai.gently.model.ProjectConfig;
import ai.gently.model.SchemaVersion;
import ai.gently.model.Window;
import ai.gently.util.Slugs;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.eclipse.jgit.api.errors.GitAPIException;
import org.jetbrains.annotations.Nullable;

/** Creates projects and edits their project-level settings. */
public class ProjectManager {
    private static final Logger logger = LogManager.getLogger(ProjectManager.class);

    private final ProjectStore store;
    private final IGitBackend git;
    private final Clock clock;

    public ProjectManager(ProjectStore store, IGitBackend git, Clock clock) {
        this.store = store;
        this.git = git;
        this.clock = clock;
    }

    /**
     * Creates the project directory layout, initializes its repository on {@code main}, writes the initial
     * {@code gently.json} (five open gates, no clans, the root window) and commits it.
     *
     * @throws ProjectExistsException if a project with the same id already exists
     */
    public ProjectConfig createProject(String name) throws IOException, GitAPIException {
        var id = Slugs.slugify(name);
        if (id.isEmpty()) {
            throw new IllegalArgumentException("Project name must not be blank");
        }
        if (store.exists(id)) {
            throw new ProjectExistsException("Project '" + id + "' already exists at " + store.projectDir(id));
        }

        var dir = store.projectDir(id);
        Files.createDirectories(dir);
        for (var sub : ProjectStore.LAYOUT_DIRS) {
            Files.createDirectories(dir.resolve(sub));
        }

        var initHash = git.initialize(dir);
        logger.debug("Initialized {} at {}", dir, initHash);

        var config = new ProjectConfig(
                SchemaVersion.CURRENT,
                0,
                id,
                name,
                Instant.now(clock).toString(),
                Gate.template(),
                List.of(),
                List.of(Window.root(name, GitRepoFactory.INITIAL_BRANCH)),
                Window.ROOT_ID);
        var saved = store.create(config);

        var hash = git.commit(dir, "init: gently project created", List.of(ProjectConfig.FILE_NAME, ".gitignore"));
        logger.info("Created project {} at {} ({})", id, dir, hash);
        return saved;
    }

    /** Sets the state (and optionally the question) of one of the project's gates. */
    public ProjectConfig setGate(String projectId, String letter, GateState state, @Nullable String question)
            throws IOException {
        var config = store.load(projectId);
        var normalized = letter.trim().toUpperCase(Locale.ROOT);
        var gates = new ArrayList<Gate>();
        boolean found = false;
        for (var g : config.gates()) {
            if (g.letter().equals(normalized)) {
                gates.add(g.withState(state).withQuestion(question));
                found = true;
            } else {
                gates.add(g);
            }
        }
        if (!found) {
            throw new IllegalArgumentException("Gate " + letter + " not found in project " + projectId);
        }
        var saved = store.save(config.withGates(gates));
        logger.info("Gate {} of {} set to {}", normalized, projectId, state.wireName());
        return saved;
    }

    public List<String> listProjects() throws IOException {
        return store.listProjectIds();
    }

    /**
     * Finds the project containing {@code start} by walking up to the nearest {@code gently.json}. Falls back to the
     * only project in the projects directory when exactly one exists.
     *
     * @return the project id, or null if none could be determined
     */
    public @Nullable String findProjectId(Path start) throws IOException {
        var dir = start.toAbsolutePath().normalize();
        while (dir != null) {
            if (Files.exists(dir.resolve(ProjectConfig.FILE_NAME))
                    && dir.getParent() != null
                    && dir.getParent().equals(store.getProjectsDir().toAbsolutePath().normalize())) {
                return dir.getFileName().toString();
            }
            dir = dir.getParent();
        }
        var ids = store.listProjectIds();
        return ids.size() == 1 ? ids.get(0) : null;
    }
}
