package ai.gently.git;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.eclipse.jgit.api.errors.GitAPIException;
import org.jetbrains.annotations.Nullable;

/** {@link IGitBackend} over JGit, opening a {@link GitRepo} for the duration of each call. */
public class GitBackend implements IGitBackend {
    private static final Logger logger = LogManager.getLogger(GitBackend.class);

    @Override
    public String initialize(Path dir) throws GitAPIException, IOException {
        GitRepoFactory.initRepo(dir);
        try (var repo = new GitRepo(dir)) {
            return repo.shortHash("HEAD");
        }
    }

    @Override
    public void branch(Path dir, String name) throws GitAPIException {
        try (var repo = new GitRepo(dir)) {
            repo.createAndCheckoutBranch(name);
        }
    }

    @Override
    public void checkout(Path dir, String name) throws GitAPIException {
        try (var repo = new GitRepo(dir)) {
            repo.checkout(name);
        }
    }

    @Override
    public void attachWorktree(Path dir, Path worktreePath, String branch) throws GitAPIException {
        try (var repo = new GitRepo(dir)) {
            repo.worktrees().addWorktree(branch, worktreePath);
        }
    }

    @Override
    public String commit(Path dir, String message, List<String> files) throws GitAPIException, IOException {
        var patterns = new ArrayList<String>(files.size());
        for (var f : files) {
            if (f.endsWith("/")) {
                Files.createDirectories(dir.resolve(f));
                patterns.add(f.substring(0, f.length() - 1));
            } else {
                var fp = dir.resolve(f);
                if (fp.getParent() != null) {
                    Files.createDirectories(fp.getParent());
                }
                if (!Files.exists(fp)) {
                    Files.createFile(fp);
                }
                patterns.add(f);
            }
        }

        try (var repo = new GitRepo(dir)) {
            repo.commitPaths(message, patterns);
            return repo.shortHash("HEAD");
        }
    }

    @Override
    public void tag(Path dir, String name) throws GitAPIException {
        try (var repo = new GitRepo(dir)) {
            repo.tagHead(name);
        }
    }

    @Override
    public String resolveShortHash(Path dir) {
        if (!Files.isDirectory(dir) || !GitRepoFactory.hasGitRepo(dir)) {
            return UNKNOWN_HASH;
        }
        try (var repo = new GitRepo(dir)) {
            return repo.hasHead() ? repo.shortHash("HEAD") : UNKNOWN_HASH;
        } catch (GitAPIException | RuntimeException e) {
            logger.debug("No resolvable HEAD in {}: {}", dir, e.getMessage());
            return UNKNOWN_HASH;
        }
    }

    @Override
    public @Nullable String tagCommit(Path dir, String tagName) throws GitAPIException {
        try (var repo = new GitRepo(dir)) {
            var target = repo.getTagTarget(tagName);
            return target == null ? null : repo.shortHash(target.getName());
        }
    }

    @Override
    public boolean hasBranch(Path dir, String branch) throws GitAPIException {
        try (var repo = new GitRepo(dir)) {
            return repo.isLocalBranch(branch);
        }
    }

    @Override
    public List<String> log(Path dir, int maxCount) throws GitAPIException {
        try (var repo = new GitRepo(dir)) {
            return repo.logAll(maxCount);
        }
    }
}
