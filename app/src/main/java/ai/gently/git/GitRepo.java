package ai.gently.git;

import static java.util.Objects.requireNonNull;

import java.io.Closeable;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.eclipse.jgit.api.Git;
import org.eclipse.jgit.api.errors.EmptyCommitException;
import org.eclipse.jgit.api.errors.GitAPIException;
import org.eclipse.jgit.lib.Constants;
import org.eclipse.jgit.lib.ObjectId;
import org.eclipse.jgit.lib.Repository;
import org.eclipse.jgit.revwalk.RevWalk;
import org.eclipse.jgit.storage.file.FileRepositoryBuilder;
import org.jetbrains.annotations.Nullable;

/**
 * A Git repository abstraction using JGit.
 *
 * <p>A GitRepo is opened on a working directory, which is either the main checkout of a repository or one of its
 * linked worktrees. Worktree-specific operations that JGit does not cover are delegated to {@link GitRepoWorktrees},
 * which shells out to the git executable.
 */
public class GitRepo implements Closeable {
    private static final Logger logger = LogManager.getLogger(GitRepo.class);

    private final Path workDir;
    private final Path gitTopLevel; // top-level directory of the main checkout, even when opened on a worktree
    private final Repository repository;
    private final Git git;
    private final GitRepoWorktrees worktrees;

    public record WorktreeInfo(Path path, @Nullable String branch, String commitId) {}

    public GitRepo(Path workDir) {
        this.workDir = workDir;
        try {
            var builder = new FileRepositoryBuilder().setWorkTree(workDir.toFile()).findGitDir(workDir.toFile());
            if (builder.getGitDir() == null) {
                throw new RuntimeException("No git repo found at or above " + workDir);
            }
            repository = builder.build();
            git = new Git(repository);
            gitTopLevel = resolveTopLevel(repository);
            worktrees = new GitRepoWorktrees(this);
            logger.trace("Git dir for {} is {}, gitTopLevel is {}", workDir, repository.getDirectory(), gitTopLevel);
        } catch (IOException e) {
            throw new RuntimeException("Failed to open repository at " + workDir, e);
        }
    }

    /**
     * For a linked worktree the git dir is {@code <main>/.git/worktrees/<name>} and its {@code commondir} file points
     * back at the main {@code .git}; the top level is that directory's parent.
     */
    private static Path resolveTopLevel(Repository repository) throws IOException {
        Path gitDir = repository.getDirectory().toPath();
        Path commondirFile = gitDir.resolve("commondir");
        if (Files.exists(commondirFile)) {
            String commonDirContent =
                    Files.readString(commondirFile, StandardCharsets.UTF_8).trim();
            Path commonDir = gitDir.resolve(commonDirContent).normalize();
            return requireNonNull(commonDir.getParent(), "Parent of git common-dir should not be null: " + commonDir)
                    .normalize();
        }
        return gitDir.getParent().normalize();
    }

    public GitRepoWorktrees worktrees() {
        return worktrees;
    }

    /** Get the JGit instance for direct API access */
    public Git getGit() {
        return git;
    }

    public Path getGitTopLevel() {
        return gitTopLevel;
    }

    /** @return true if the repository has at least one commit reachable from HEAD */
    public boolean hasHead() {
        try {
            return repository.resolve(Constants.HEAD) != null;
        } catch (IOException e) {
            logger.debug("Unable to resolve HEAD in {}: {}", workDir, e.getMessage());
            return false;
        }
    }

    /** Get the current commit ID (HEAD) */
    public String getCurrentCommitId() throws GitAPIException {
        return resolveToCommit(Constants.HEAD).getName();
    }

    /**
     * Returns an abbreviated (short) hash for the given revision. JGit abbreviates to a unique short id of at least
     * seven characters.
     */
    public String shortHash(String rev) throws GitAPIException {
        var id = resolveToCommit(rev);
        try (var reader = repository.newObjectReader()) {
            return reader.abbreviate(id).name();
        } catch (IOException e) {
            throw new GitWrappedIOException(e);
        }
    }

    public ObjectId resolveToCommit(String revstr) throws GitAPIException {
        try {
            var id = repository.resolve(revstr);
            if (id == null) {
                throw new GitOperationException("Unable to resolve " + revstr + " in " + workDir);
            }
            try (var revWalk = new RevWalk(repository)) {
                return revWalk.parseCommit(id).getId();
            }
        } catch (IOException e) {
            throw new GitWrappedIOException(e);
        }
    }

    /**
     * Stages the given paths (relative to this working directory; a directory stages everything beneath it) and
     * commits. Empty commits are allowed, so every call produces a new commit.
     *
     * @return the full id of the new commit
     */
    public synchronized String commitPaths(String message, List<String> paths) throws GitAPIException {
        if (!paths.isEmpty()) {
            var addCommand = git.add();
            for (var p : paths) {
                addCommand.addFilepattern(p);
            }
            addCommand.call();
        }

        try {
            var commit = git.commit()
                    .setMessage(message)
                    .setAllowEmpty(true)
                    .setSign(false)
                    .call();
            logger.debug("Committed {} in {}: {}", commit.getName(), workDir, message);
            return commit.getName();
        } catch (EmptyCommitException e) {
            logger.debug("Nothing to commit in {}: {}", workDir, e.getMessage());
            return getCurrentCommitId();
        }
    }

    /** Creates a lightweight tag at HEAD. Fails if the tag already exists. */
    public void tagHead(String tagName) throws GitAPIException {
        try (var revWalk = new RevWalk(repository)) {
            var head = revWalk.parseCommit(resolveToCommit(Constants.HEAD));
            git.tag().setName(tagName).setAnnotated(false).setObjectId(head).call();
            logger.debug("Tagged {} as {} in {}", head.getName(), tagName, workDir);
        } catch (IOException e) {
            throw new GitWrappedIOException(e);
        }
    }

    /** @return the commit a tag points at, or null if there is no such tag */
    public @Nullable ObjectId getTagTarget(String tagName) throws GitAPIException {
        try {
            var ref = repository.exactRef(Constants.R_TAGS + tagName);
            if (ref == null) {
                return null;
            }
            var peeled = repository.getRefDatabase().peel(ref);
            return peeled.getPeeledObjectId() != null ? peeled.getPeeledObjectId() : ref.getObjectId();
        } catch (IOException e) {
            throw new GitWrappedIOException(e);
        }
    }

    /** @return true if {@code branchName} is acceptable to git as a local branch name */
    public static boolean isValidBranchName(String branchName) {
        return Repository.isValidRefName(Constants.R_HEADS + branchName);
    }

    /**
     * Walks history reachable from every ref, newest first.
     *
     * @return one line per commit: short hash and subject
     */
    public List<String> logAll(int maxCount) throws GitAPIException {
        try {
            var lines = new ArrayList<String>();
            try (var reader = repository.newObjectReader()) {
                for (var commit : git.log().all().setMaxCount(maxCount).call()) {
                    lines.add(reader.abbreviate(commit).name() + " " + commit.getShortMessage());
                }
            }
            return lines;
        } catch (IOException e) {
            throw new GitWrappedIOException(e);
        }
    }

    /** List all local branches */
    public List<String> listLocalBranches() throws GitAPIException {
        var branches = new ArrayList<String>();
        for (var ref : git.branchList().call()) {
            branches.add(ref.getName().replaceFirst("^refs/heads/", ""));
        }
        return branches;
    }

    public boolean isLocalBranch(String branchName) throws GitAPIException {
        return listLocalBranches().contains(branchName);
    }

    /** Create a new branch at HEAD and check it out */
    public void createAndCheckoutBranch(String newBranchName) throws GitAPIException {
        if (isLocalBranch(newBranchName)) {
            throw new GitStateException("Branch '" + newBranchName + "' already exists");
        }
        git.checkout().setCreateBranch(true).setName(newBranchName).call();
        logger.debug("Created and checked out branch '{}' in {}", newBranchName, workDir);
    }

    /** Checkout a specific branch */
    public void checkout(String branchName) throws GitAPIException {
        git.checkout().setName(branchName).call();
    }

    public String getCurrentBranch() throws GitAPIException {
        try {
            return repository.getBranch();
        } catch (IOException e) {
            throw new GitWrappedIOException(e);
        }
    }

    @Override
    public void close() {
        git.close();
        repository.close();
    }

    public static class GitRepoException extends GitAPIException {
        public GitRepoException(String message, Throwable cause) {
            super(message, cause);
        }
    }

    public static class GitStateException extends GitAPIException {
        public GitStateException(String message) {
            super(message);
        }
    }

    static class GitWrappedIOException extends GitAPIException {
        public GitWrappedIOException(IOException e) {
            this(e.getMessage() != null ? e.getMessage() : e.toString(), e);
        }

        public GitWrappedIOException(String message, IOException e) {
            super(message, e);
        }
    }
}
