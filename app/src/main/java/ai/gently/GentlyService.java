package ai.gently;

import ai.gently.clan.ClanManager;
import ai.gently.collapse.CollapseEngine;
import ai.gently.git.GitBackend;
import ai.gently.git.IGitBackend;
import ai.gently.model.Clan;
import ai.gently.model.ClanState;
import ai.gently.model.CollapseResult;
import ai.gently.model.GateState;
import ai.gently.model.ProjectConfig;
import ai.gently.project.GentlyConfig;
import ai.gently.project.ProjectManager;
import ai.gently.project.ProjectStore;
import ai.gently.stamp.StampFormatter;
import ai.gently.stamp.StatusRenderer;
import ai.gently.util.SerialByKeyExecutor;
import ai.gently.util.Slugs;
import java.io.IOException;
import java.io.InterruptedIOException;
import java.nio.file.Path;
import java.time.Clock;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.eclipse.jgit.api.errors.GitAPIException;
import org.jetbrains.annotations.Nullable;

/**
 * Entry point for every project operation. Writes to a project are serialized: two calls against the same project id
 * never run at the same time within this process, while different projects proceed independently.
 */
public class GentlyService implements AutoCloseable {
    private static final Logger logger = LogManager.getLogger(GentlyService.class);

    private final ProjectStore store;
    private final IGitBackend git;
    private final ProjectManager projects;
    private final ClanManager clans;
    private final CollapseEngine collapses;
    private final StampFormatter stamps;
    private final StatusRenderer status;
    private final ExecutorService writerPool;
    private final SerialByKeyExecutor writers;

    public GentlyService(GentlyConfig config) {
        this(new ProjectStore(config.getProjectsDir()), new GitBackend(), Clock.systemUTC());
    }

    public GentlyService(ProjectStore store, IGitBackend git, Clock clock) {
        this.store = store;
        this.git = git;
        this.projects = new ProjectManager(store, git, clock);
        this.clans = new ClanManager(store, git);
        this.collapses = new CollapseEngine(store, git, clock);
        this.stamps = new StampFormatter(store, git, clock);
        this.status = new StatusRenderer(store, git);
        this.writerPool = Executors.newFixedThreadPool(2, r -> {
            var t = Executors.defaultThreadFactory().newThread(r);
            t.setDaemon(true);
            t.setName("gently-writer-" + t.getId());
            return t;
        });
        this.writers = new SerialByKeyExecutor(writerPool);
    }

    public ProjectStore getStore() {
        return store;
    }

    public ProjectConfig createProject(String name) throws IOException, GitAPIException {
        // keyed by the id the project will get, so names differing only in case share one writer
        return write(Slugs.slugify(name), () -> projects.createProject(name));
    }

    public Clan addClan(String projectId, String name, String context) throws IOException, GitAPIException {
        return write(projectId, () -> clans.addClan(projectId, name, context));
    }

    public @Nullable CollapseResult collapse(String projectId, List<String> clanIds, String windowName)
            throws IOException, GitAPIException {
        return write(projectId, () -> collapses.collapseClans(projectId, clanIds, windowName));
    }

    public String getStamp(String projectId, String clanId) throws IOException {
        return stamps.generateStamp(projectId, clanId);
    }

    /** Short hash of HEAD in any directory, {@link IGitBackend#UNKNOWN_HASH} outside a repository. */
    public String getHash(Path dir) {
        return git.resolveShortHash(dir);
    }

    public ProjectConfig setProjectGate(String projectId, String letter, GateState state, @Nullable String question)
            throws IOException, GitAPIException {
        return write(projectId, () -> projects.setGate(projectId, letter, state, question));
    }

    public ClanState setClanGate(String projectId, String clanId, String letter, GateState state)
            throws IOException, GitAPIException {
        return write(projectId, () -> clans.setGate(projectId, clanId, letter, state));
    }

    public ClanState setPin(String projectId, String clanId, String pin) throws IOException, GitAPIException {
        return write(projectId, () -> clans.setPin(projectId, clanId, pin));
    }

    public ClanState descend(String projectId, String clanId) throws IOException, GitAPIException {
        return write(projectId, () -> clans.descend(projectId, clanId));
    }

    public String checkpoint(String projectId, String clanId, String message) throws IOException, GitAPIException {
        return write(projectId, () -> clans.checkpoint(projectId, clanId, message));
    }

    public ProjectConfig load(String projectId) throws IOException {
        return store.load(projectId);
    }

    public String status(String projectId) throws IOException {
        return status.renderStatus(projectId);
    }

    public String windows(String projectId) throws IOException {
        return status.renderWindows(projectId);
    }

    /** @return the most recent {@code maxCount} commits across all clan and window branches */
    public List<String> log(String projectId, int maxCount) throws GitAPIException {
        return git.log(store.projectDir(projectId), maxCount);
    }

    public @Nullable String findProjectId(Path start) throws IOException {
        return projects.findProjectId(start);
    }

    /**
     * Resolves a clan reference: an exact id, or else the first clan whose id contains {@code ref} or whose name
     * contains it ignoring case. A null ref picks the first active clan.
     */
    public Optional<Clan> resolveClan(String projectId, @Nullable String ref) throws IOException {
        var config = store.load(projectId);
        if (ref == null || ref.isBlank()) {
            return config.clans().stream().filter(Clan::isActive).findFirst();
        }
        var exact = config.findClan(ref);
        if (exact.isPresent()) {
            return exact;
        }
        var needle = ref.toLowerCase(Locale.ROOT);
        return config.clans().stream()
                .filter(c -> c.id().contains(ref) || c.name().toLowerCase(Locale.ROOT).contains(needle))
                .findFirst();
    }

    @FunctionalInterface
    private interface WriteTask<T> {
        T run() throws IOException, GitAPIException;
    }

    private <T> T write(String key, WriteTask<T> task) throws IOException, GitAPIException {
        try {
            return writers.call(key, task::run, Exception.class);
        } catch (IOException | GitAPIException | RuntimeException e) {
            throw e;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new InterruptedIOException("Interrupted waiting for write to " + key);
        } catch (Exception e) {
            throw new IllegalStateException(e);
        }
    }

    @Override
    public void close() {
        writerPool.shutdown();
        try {
            if (!writerPool.awaitTermination(30, TimeUnit.SECONDS)) {
                logger.warn("Pending project writes did not finish in 30 seconds, forcing shutdown.");
                writerPool.shutdownNow();
            }
        } catch (InterruptedException e) {
            writerPool.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
