package ai.gently.project;

import ai.gently.model.ClanState;
import ai.gently.model.Constant;
import ai.gently.model.ProjectConfig;
import ai.gently.model.SchemaVersion;
import ai.gently.util.AtomicWrites;
import ai.gently.util.Json;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Stream;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * File-backed storage for the Gently documents.
 *
 * <p>Layout:
 *
 * <ul>
 *   <li>{projectsDir}/{projectId}/gently.json - the project document, rewritten whole on every change
 *   <li>{projectsDir}/{projectId}/constants/{clanId}.json - one document per frozen clan, written once
 *   <li>{worktree}/state.json and {worktree}/context.md - per-clan working state
 * </ul>
 *
 * <p>Writes are atomic (write-then-rename). Project saves are version-checked: the copy being saved must carry the
 * version currently on disk, otherwise {@link StaleProjectException} is thrown and nothing is written.
 */
public final class ProjectStore {
    private static final Logger logger = LogManager.getLogger(ProjectStore.class);

    public static final String CONTEXT_FILE_NAME = "context.md";
    public static final String WORKTREES_DIR = "worktrees";
    public static final String CONSTANTS_DIR = "constants";
    public static final String ARTIFACTS_DIR = "artifacts";
    public static final String STAMPS_DIR = "stamps";
    public static final List<String> LAYOUT_DIRS = List.of(WORKTREES_DIR, CONSTANTS_DIR, ARTIFACTS_DIR, STAMPS_DIR);

    private final Path projectsDir;

    public ProjectStore(Path projectsDir) {
        this.projectsDir = projectsDir;
    }

    public Path getProjectsDir() {
        return projectsDir;
    }

    public Path projectDir(String projectId) {
        return projectsDir.resolve(projectId);
    }

    public Path projectFile(String projectId) {
        return projectDir(projectId).resolve(ProjectConfig.FILE_NAME);
    }

    public Path constantFile(String projectId, String clanId) {
        return projectDir(projectId).resolve(CONSTANTS_DIR).resolve(clanId + ".json");
    }

    public boolean exists(String projectId) {
        return Files.exists(projectFile(projectId));
    }

    /** Lists the ids of all directories under the projects directory that hold a project document. */
    public List<String> listProjectIds() throws IOException {
        if (!Files.isDirectory(projectsDir)) {
            return List.of();
        }
        try (Stream<Path> children = Files.list(projectsDir)) {
            return children.filter(p -> Files.exists(p.resolve(ProjectConfig.FILE_NAME)))
                    .map(p -> p.getFileName().toString())
                    .sorted()
                    .toList();
        }
    }

    public ProjectConfig load(String projectId) throws IOException {
        var file = projectFile(projectId);
        if (!Files.exists(file)) {
            throw new NoSuchFileException(file.toString(), null, "No project '" + projectId + "'");
        }
        var config = Json.fromJson(Files.readString(file, StandardCharsets.UTF_8), ProjectConfig.class);
        checkSchema(file, config.schemaVersion());
        return config;
    }

    /**
     * Writes the first version of a project document.
     *
     * @return the document as written, with version 1
     */
    public ProjectConfig create(ProjectConfig config) throws IOException {
        var file = projectFile(config.id());
        if (Files.exists(file)) {
            throw new ProjectExistsException("Project '" + config.id() + "' already exists at " + file.getParent());
        }
        Files.createDirectories(file.getParent());
        var saved = config.withVersion(1);
        AtomicWrites.atomicOverwrite(file, Json.toJson(saved));
        logger.debug("Created project document {}", file);
        return saved;
    }

    /**
     * Rewrites the whole project document.
     *
     * @return the document as written, with its version incremented
     * @throws StaleProjectException if the document on disk is not at {@code config.version()}
     */
    public synchronized ProjectConfig save(ProjectConfig config) throws IOException {
        var onDisk = load(config.id());
        if (onDisk.version() != config.version()) {
            throw new StaleProjectException(config.id(), config.version(), onDisk.version());
        }
        var saved = config.withVersion(config.version() + 1);
        AtomicWrites.atomicOverwrite(projectFile(config.id()), Json.toJson(saved));
        logger.debug("Saved project {} at version {}", config.id(), saved.version());
        return saved;
    }

    public ClanState readClanState(Path worktree) throws IOException {
        var file = worktree.resolve(ClanState.FILE_NAME);
        var state = Json.fromJson(Files.readString(file, StandardCharsets.UTF_8), ClanState.class);
        checkSchema(file, state.schemaVersion());
        return state;
    }

    public void writeClanState(Path worktree, ClanState state) throws IOException {
        AtomicWrites.atomicOverwrite(worktree.resolve(ClanState.FILE_NAME), Json.toJson(state));
    }

    public void writeContext(Path worktree, String context) throws IOException {
        AtomicWrites.atomicOverwrite(worktree.resolve(CONTEXT_FILE_NAME), context);
    }

    public void writeConstant(String projectId, String clanId, Constant constant) throws IOException {
        var file = constantFile(projectId, clanId);
        Files.createDirectories(file.getParent());
        AtomicWrites.atomicOverwrite(file, Json.toJson(constant));
    }

    public Constant readConstant(String projectId, String clanId) throws IOException {
        var file = constantFile(projectId, clanId);
        var constant = Json.fromJson(Files.readString(file, StandardCharsets.UTF_8), Constant.class);
        checkSchema(file, constant.schemaVersion());
        return constant;
    }

    private static void checkSchema(Path file, int schemaVersion) throws UnsupportedSchemaException {
        if (schemaVersion > SchemaVersion.CURRENT) {
            throw new UnsupportedSchemaException(file, schemaVersion, SchemaVersion.CURRENT);
        }
    }
}
