package ai.gently.clan;

import ai.gently.git.GitRepo;
import ai.gently.git.IGitBackend;
import ai.gently.model.Clan;
import ai.gently.model.ClanState;
import ai.gently.model.ClanStatus;
import ai.gently.model.GateMark;
import ai.gently.model.GateState;
import ai.gently.model.ProjectConfig;
import ai.gently.project.ProjectStore;
import ai.gently.util.Slugs;
import java.io.IOException;
import java.util.List;
import java.util.Locale;
import java.util.function.UnaryOperator;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.eclipse.jgit.api.errors.GitAPIException;

/**
 * Creates clans and edits their working state.
 *
 * <p>Each clan is a branch {@code clan/<id>} checked out in its own worktree under {@code worktrees/}, so clans can
 * be worked on side by side without switching the project checkout. Once a clan has been frozen by a collapse, every
 * write through this class is refused with {@link FrozenClanException}.
 */
public class ClanManager {
    private static final Logger logger = LogManager.getLogger(ClanManager.class);

    private final ProjectStore store;
    private final IGitBackend git;

    public ClanManager(ProjectStore store, IGitBackend git) {
        this.store = store;
        this.git = git;
    }

    /**
     * Creates a clan: attaches its worktree, writes {@code context.md} and an initial {@code state.json}, commits both
     * and appends the clan to the project document.
     *
     * @return the clan as recorded in the project
     */
    public Clan addClan(String projectId, String clanName, String context) throws IOException, GitAPIException {
        var config = store.load(projectId);
        var slug = Slugs.slugify(clanName);
        if (slug.isEmpty()) {
            throw new IllegalArgumentException("Clan name must not be blank");
        }

        // the ordinal keeps ids unique without a separate counter
        var clanId = "clan-" + config.clans().size() + "-" + slug;
        var branch = Clan.branchFor(clanId);
        if (!GitRepo.isValidBranchName(branch)) {
            throw new IllegalArgumentException("Clan name '" + clanName + "' does not make a valid branch: " + branch);
        }
        var projectDir = store.projectDir(projectId).toAbsolutePath().normalize();
        var worktree = projectDir.resolve(ProjectStore.WORKTREES_DIR).resolve(clanId);

        git.attachWorktree(projectDir, worktree, branch);

        var effectiveContext = context.isBlank() ? "Independent exploration: " + clanName : context;
        store.writeContext(worktree, effectiveContext);
        store.writeClanState(worktree, ClanState.initial(clanId, clanName));
        var hash = git.commit(
                worktree, "clan-start: " + clanName, List.of(ProjectStore.CONTEXT_FILE_NAME, ClanState.FILE_NAME));

        var clan = new Clan(clanId, clanName, branch, worktree, ClanStatus.ACTIVE, "chat-" + clanId);
        store.save(config.withClanAppended(clan));
        logger.info("Created clan {} on {} at {} ({})", clanId, branch, worktree, hash);
        return clan;
    }

    public ClanState readState(String projectId, String clanId) throws IOException {
        return store.readClanState(requireClan(store.load(projectId), clanId).worktree());
    }

    public ClanState setPin(String projectId, String clanId, String pin) throws IOException {
        return updateState(projectId, clanId, s -> s.withPin(pin));
    }

    /** Moves the clan one level deeper. */
    public ClanState descend(String projectId, String clanId) throws IOException {
        return updateState(projectId, clanId, s -> s.withDepth(s.depth() + 1));
    }

    /** Adds or updates one entry of the clan's own gate checklist. */
    public ClanState setGate(String projectId, String clanId, String letter, GateState gateState)
            throws IOException {
        var normalized = letter.trim().toUpperCase(Locale.ROOT);
        if (!normalized.matches("[A-Z]")) {
            throw new IllegalArgumentException("Gate letter must be a single letter: " + letter);
        }
        return updateState(projectId, clanId, s -> s.withGate(new GateMark(normalized, gateState)));
    }

    /**
     * Commits the clan's worktree.
     *
     * @return the short hash of the new commit
     */
    public String checkpoint(String projectId, String clanId, String message) throws IOException, GitAPIException {
        var clan = requireWritable(store.load(projectId), clanId);
        return git.commit(clan.worktree(), message, List.of(ClanState.FILE_NAME));
    }

    private ClanState updateState(String projectId, String clanId, UnaryOperator<ClanState> change)
            throws IOException {
        var clan = requireWritable(store.load(projectId), clanId);
        var current = store.readClanState(clan.worktree());
        if (current.isFrozen()) {
            throw new FrozenClanException(clanId);
        }
        var updated = change.apply(current);
        store.writeClanState(clan.worktree(), updated);
        logger.debug("Updated state of clan {}: depth={} pin='{}'", clanId, updated.depth(), updated.pin());
        return updated;
    }

    private static Clan requireWritable(ProjectConfig config, String clanId) {
        var clan = requireClan(config, clanId);
        if (!clan.isActive()) {
            throw new FrozenClanException(clanId);
        }
        return clan;
    }

    static Clan requireClan(ProjectConfig config, String clanId) {
        return config.findClan(clanId)
                .orElseThrow(() -> new IllegalArgumentException(
                        "No clan '" + clanId + "' in project " + config.id()));
    }
}
