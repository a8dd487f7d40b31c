package ai.gently.git;

import static java.util.Objects.requireNonNull;

import ai.gently.git.GitRepo.WorktreeInfo;
import ai.gently.util.Environment;
import com.google.common.base.Splitter;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.eclipse.jgit.api.errors.GitAPIException;
import org.eclipse.jgit.api.errors.RefAlreadyExistsException;

/**
 * Worktree operations for a {@link GitRepo}. JGit cannot create linked worktrees, so these run the git executable in
 * the repository's top-level directory.
 */
public class GitRepoWorktrees {
    private static final Logger logger = LogManager.getLogger(GitRepoWorktrees.class);

    private final GitRepo repo;

    public GitRepoWorktrees(GitRepo repo) {
        this.repo = repo;
    }

    /** Lists the worktrees whose directories still exist, the main checkout included. */
    public List<WorktreeInfo> listWorktrees() throws GitAPIException {
        try {
            var output = Environment.instance.runCommand(
                    List.of("git", "worktree", "list", "--porcelain"),
                    repo.getGitTopLevel(),
                    out -> {},
                    Environment.GIT_TIMEOUT_SECONDS);
            var worktrees = new ArrayList<WorktreeInfo>();
            var lines = Splitter.on(Pattern.compile("\\R")).splitToList(output);

            Path currentPath = null;
            String currentHead = null;
            String currentBranch = null;

            for (var line : lines) {
                if (line.startsWith("worktree ")) {
                    if (currentPath != null) {
                        worktrees.add(new WorktreeInfo(currentPath, currentBranch, requireNonNull(currentHead)));
                    }
                    currentHead = null;
                    currentBranch = null;

                    var pathStr = line.substring("worktree ".length());
                    try {
                        currentPath = Path.of(pathStr).toRealPath();
                    } catch (NoSuchFileException e) {
                        logger.warn("Worktree path does not exist: {}", pathStr);
                        currentPath = null;
                    } catch (IOException e) {
                        throw new GitRepo.GitRepoException("Failed to resolve worktree path: " + pathStr, e);
                    }
                } else if (line.startsWith("HEAD ") && currentPath != null) {
                    currentHead = line.substring("HEAD ".length());
                } else if (line.startsWith("branch ") && currentPath != null) {
                    currentBranch = line.substring("branch ".length()).replaceFirst("^refs/heads/", "");
                }
            }
            if (currentPath != null) {
                worktrees.add(new WorktreeInfo(currentPath, currentBranch, requireNonNull(currentHead)));
            }
            return worktrees;
        } catch (Environment.SubprocessException e) {
            throw new GitRepo.GitRepoException("Failed to list worktrees: " + e.getOutput(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new GitRepo.GitRepoException("Listing worktrees was interrupted", e);
        }
    }

    /**
     * Attaches a worktree at {@code path} for {@code branch}, creating the branch at HEAD first when it does not exist
     * yet. An existing branch is not an error, and if that branch is already attached at that path the call does
     * nothing, so clan setup can be re-run without manual cleanup.
     */
    public void addWorktree(String branch, Path path) throws GitAPIException {
        var absolutePath = path.toAbsolutePath().normalize();

        if (!GitRepo.isValidBranchName(branch)) {
            throw new GitRepo.GitStateException("Invalid branch name: " + branch);
        }
        if (isAttached(branch, absolutePath)) {
            logger.debug("Worktree for {} already attached at {}", branch, absolutePath);
            return;
        }

        try {
            repo.getGit().branchCreate().setName(branch).call();
            logger.debug("Created branch {} for worktree", branch);
        } catch (RefAlreadyExistsException e) {
            logger.debug("Branch {} already exists, attaching it", branch);
        }

        try {
            Environment.instance.runCommand(
                    List.of("git", "worktree", "add", absolutePath.toString(), branch),
                    repo.getGitTopLevel(),
                    out -> {},
                    Environment.GIT_TIMEOUT_SECONDS);
            logger.info("Attached worktree {} for branch {}", absolutePath, branch);
        } catch (Environment.SubprocessException e) {
            throw new GitRepo.GitRepoException(
                    "Failed to add worktree at " + path + " for branch " + branch + ": " + e.getOutput(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new GitRepo.GitRepoException(
                    "Adding worktree at " + path + " for branch " + branch + " was interrupted", e);
        }
    }

    private boolean isAttached(String branch, Path absolutePath) throws GitAPIException {
        if (!Files.isDirectory(absolutePath)) {
            return false;
        }
        Path realPath;
        try {
            realPath = absolutePath.toRealPath();
        } catch (IOException e) {
            return false;
        }
        return listWorktrees().stream()
                .anyMatch(wt -> wt.path().equals(realPath) && branch.equals(wt.branch()));
    }

    /** Returns true if git is available to run worktree commands. */
    public boolean supportsWorktrees() {
        try {
            Environment.instance.runCommand(
                    List.of("git", "--version"), repo.getGitTopLevel(), output -> {}, Environment.GIT_TIMEOUT_SECONDS);
            return true;
        } catch (Environment.SubprocessException e) {
            logger.warn("Git executable not found or 'git --version' failed: {}", e.getMessage());
            return false;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.warn("Interrupted while checking for git executable", e);
            return false;
        }
    }
}
