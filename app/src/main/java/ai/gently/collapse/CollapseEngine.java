package ai.gently.collapse;

import ai.gently.git.GitRepo;
import ai.gently.git.IGitBackend;
import ai.gently.model.Clan;
import ai.gently.model.ClanState;
import ai.gently.model.ClanStatus;
import ai.gently.model.CollapseResult;
import ai.gently.model.Constant;
import ai.gently.model.ProjectConfig;
import ai.gently.model.Window;
import ai.gently.project.ProjectStore;
import ai.gently.util.Slugs;
import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.stream.Collectors;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.eclipse.jgit.api.errors.GitAPIException;
import org.jetbrains.annotations.Nullable;

/**
 * Freezes a group of active clans into constants and folds them into a new window.
 *
 * <p>Per clan, in project order: the state file is rewritten as frozen and committed, the commit is tagged
 * {@code const/<clanId>} and the constant is written to {@code constants/<clanId>.json}. Then a {@code window/<slug>}
 * branch is created at the project root, {@code constants/} is committed there, and the new window (parent's constants
 * followed by the new ones) becomes the project's active window.
 *
 * <p>Nothing is written before every source clan's state has been read and validated. The project document is saved
 * only at the end, so if a git call fails midway the clans still read as active; running the same collapse again
 * picks up the tags already made instead of failing on them.
 */
public class CollapseEngine {
    private static final Logger logger = LogManager.getLogger(CollapseEngine.class);

    static final int MIN_SOURCES = 2;

    private final ProjectStore store;
    private final IGitBackend git;
    private final Clock clock;

    public CollapseEngine(ProjectStore store, IGitBackend git, Clock clock) {
        this.store = store;
        this.git = git;
        this.clock = clock;
    }

    /**
     * Collapses the active clans among {@code clanIds} into a window named {@code newWindowName}.
     *
     * @return the new window's id, its full constant list, the synthesis prompt and the collapse commit; or null if
     *     fewer than two of the ids name active clans, in which case nothing is changed
     */
    public @Nullable CollapseResult collapseClans(String projectId, List<String> clanIds, String newWindowName)
            throws IOException, GitAPIException {
        var config = store.load(projectId);

        var requested = new HashSet<>(clanIds);
        var sources = config.clans().stream()
                .filter(c -> requested.contains(c.id()) && c.isActive())
                .toList();
        if (sources.size() < MIN_SOURCES) {
            logger.info(
                    "Collapse into '{}' skipped: {} of {} requested clans are active in {}",
                    newWindowName,
                    sources.size(),
                    clanIds.size(),
                    projectId);
            return null;
        }

        var windowSlug = Slugs.slugify(newWindowName);
        if (windowSlug.isEmpty()) {
            throw new IllegalArgumentException("Window name must not be blank");
        }
        var windowBranch = "window/" + windowSlug;
        if (!GitRepo.isValidBranchName(windowBranch)) {
            throw new IllegalArgumentException(
                    "Window name '" + newWindowName + "' does not make a valid branch: " + windowBranch);
        }

        // read every source state up front so a bad state file fails before any commit or tag
        var states = new LinkedHashMap<String, ClanState>();
        for (var clan : sources) {
            states.put(clan.id(), store.readClanState(clan.worktree()));
        }

        var projectDir = store.projectDir(projectId);
        var newConstants = new ArrayList<Constant>();
        for (var clan : sources) {
            var constant = freeze(projectId, clan, states.get(clan.id()), newWindowName);
            newConstants.add(constant);
        }

        if (git.hasBranch(projectDir, windowBranch)) {
            logger.warn("Window branch {} already exists, reusing it", windowBranch);
            git.checkout(projectDir, windowBranch);
        } else {
            git.branch(projectDir, windowBranch);
        }
        var names = sources.stream().map(Clan::name).collect(Collectors.joining(" + "));
        var mergeHash = git.commit(
                projectDir,
                "COLLAPSE: " + names + " → " + newWindowName,
                List.of(ProjectStore.CONSTANTS_DIR + "/"));

        var parent = config.currentWindow();
        var allConstants = new ArrayList<Constant>();
        parent.ifPresent(w -> allConstants.addAll(w.constants()));
        allConstants.addAll(newConstants);

        var window = new Window(
                nextWindowId(config),
                newWindowName,
                config.activeWindow(),
                allConstants,
                windowBranch,
                mergeHash);

        var frozenIds = sources.stream().map(Clan::id).collect(Collectors.toSet());
        var clans = config.clans().stream()
                .map(c -> frozenIds.contains(c.id()) ? c.frozen() : c)
                .toList();
        store.save(config.withClans(clans).withWindowActivated(window));

        logger.info(
                "Collapsed {} into window {} ({}) on {} @ {}; {} constants total",
                names,
                window.id(),
                newWindowName,
                windowBranch,
                mergeHash,
                allConstants.size());

        var prompt = SynthesisPrompt.build(newWindowName, allConstants, windowBranch, mergeHash);
        return new CollapseResult(window.id(), allConstants, prompt, mergeHash);
    }

    private Constant freeze(String projectId, Clan clan, ClanState state, String windowName)
            throws IOException, GitAPIException {
        Path worktree = clan.worktree();
        var tag = Constant.tagFor(clan.id());

        String hash = git.tagCommit(worktree, tag);
        if (hash != null) {
            logger.warn("Clan {} was already frozen at {} ({}), resuming", clan.id(), hash, tag);
        } else {
            store.writeClanState(worktree, state.withState(ClanStatus.FROZEN));
            hash = git.commit(worktree, "FROZEN: collapsed into " + windowName, List.of(ClanState.FILE_NAME));
            git.tag(worktree, tag);
            logger.debug("Froze clan {} at {} as {}", clan.id(), hash, tag);
        }

        var constant = Constant.freeze(clan, state, hash);
        store.writeConstant(projectId, clan.id(), constant);
        return constant;
    }

    private String nextWindowId(ProjectConfig config) {
        long millis = clock.millis();
        var id = "win-" + millis;
        while (config.findWindow(id).isPresent()) {
            id = "win-" + ++millis;
        }
        return id;
    }
}
