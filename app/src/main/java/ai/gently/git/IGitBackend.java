package ai.gently.git;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import org.eclipse.jgit.api.errors.GitAPIException;
import org.jetbrains.annotations.Nullable;

/**
 * The version-control primitives the project, clan and collapse operations are built on. Every call is synchronous
 * and addresses a working directory: a project root or one of its clan worktrees.
 */
public interface IGitBackend {

    /** Returned by {@link #resolveShortHash(Path)} when a directory has no history. Not a valid reference. */
    String UNKNOWN_HASH = "00000000";

    /** Creates a repository in {@code dir} with an empty first commit and returns that commit's short hash. */
    String initialize(Path dir) throws GitAPIException, IOException;

    /** Creates {@code name} at HEAD and checks it out. */
    void branch(Path dir, String name) throws GitAPIException;

    /** Checks out an existing branch. */
    void checkout(Path dir, String name) throws GitAPIException;

    /**
     * Attaches a worktree at {@code worktreePath} for {@code branch}, creating the branch when it does not exist.
     * Idempotent for a branch that is already attached at that path.
     */
    void attachWorktree(Path dir, Path worktreePath, String branch) throws GitAPIException;

    /**
     * Touches each listed file (an entry ending in {@code /} is a directory), stages the listed paths and commits,
     * allowing empty commits.
     *
     * @return the short hash of the new commit
     */
    String commit(Path dir, String message, List<String> files) throws GitAPIException, IOException;

    default String commit(Path dir, String message) throws GitAPIException, IOException {
        return commit(dir, message, List.of());
    }

    /** Creates a lightweight tag at HEAD. */
    void tag(Path dir, String name) throws GitAPIException;

    /** @return the short hash of HEAD, or {@link #UNKNOWN_HASH} when there is none */
    String resolveShortHash(Path dir);

    /** @return the short hash a tag points at, or null when the tag does not exist */
    @Nullable
    String tagCommit(Path dir, String tagName) throws GitAPIException;

    boolean hasBranch(Path dir, String branch) throws GitAPIException;

    /** @return up to {@code maxCount} commits reachable from any branch or tag, newest first, as "hash subject" */
    List<String> log(Path dir, int maxCount) throws GitAPIException;
}
