package ai.gently.git;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.List;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.eclipse.jgit.api.Git;
import org.eclipse.jgit.api.errors.GitAPIException;
import org.eclipse.jgit.storage.file.FileRepositoryBuilder;

public class GitRepoFactory {
    private static final Logger logger = LogManager.getLogger(GitRepoFactory.class);

    public static final String INITIAL_BRANCH = "main";
    static final String WORKTREES_IGNORE_ENTRY = "worktrees/";

    /**
     * Returns true if the directory (or one of its parents) holds a readable repository with at least one local
     * branch, i.e. at least one commit.
     */
    public static boolean hasGitRepo(Path dir) {
        try {
            var builder = new FileRepositoryBuilder().findGitDir(dir.toFile());
            if (builder.getGitDir() == null) {
                return false;
            }
            try (var repo = builder.build()) {
                return !repo.getRefDatabase().getRefsByPrefix("refs/heads/").isEmpty();
            }
        } catch (IOException e) {
            logger.warn("Could not read git repo at {}: {}", dir, e.getMessage());
            return false;
        }
    }

    /**
     * Initializes a new repository in {@code root} on branch {@code main} and creates an empty first commit, so a
     * hash always exists to branch from. Writes a .gitignore that keeps the clan worktrees out of the main checkout.
     *
     * @return the full id of the first commit
     */
    public static String initRepo(Path root) throws GitAPIException, IOException {
        logger.info("Initializing new Git repository at {}", root);
        try (var git = Git.init()
                .setDirectory(root.toFile())
                .setInitialBranch(INITIAL_BRANCH)
                .call()) {
            ensureWorktreesIgnored(root);
            var commit = git.commit()
                    .setAllowEmpty(true)
                    .setMessage("init: project created")
                    .setSign(false)
                    .call();
            logger.info("Git repository initialized at {} with {}", root, commit.getName());
            return commit.getName();
        }
    }

    private static void ensureWorktreesIgnored(Path root) throws IOException {
        Path gitignorePath = root.resolve(".gitignore");

        if (!Files.exists(gitignorePath)) {
            Files.writeString(gitignorePath, WORKTREES_IGNORE_ENTRY + "\n", StandardCharsets.UTF_8);
            logger.debug("Created .gitignore with '{}' at {}", WORKTREES_IGNORE_ENTRY, gitignorePath);
            return;
        }

        List<String> lines = Files.readAllLines(gitignorePath, StandardCharsets.UTF_8);
        boolean entryExists = lines.stream()
                .map(String::trim)
                .anyMatch(line -> line.equals(WORKTREES_IGNORE_ENTRY) || line.equals("worktrees"));
        if (!entryExists) {
            String contentToAppend = (lines.isEmpty() || lines.get(lines.size() - 1).isBlank())
                    ? WORKTREES_IGNORE_ENTRY + "\n"
                    : "\n" + WORKTREES_IGNORE_ENTRY + "\n";
            Files.writeString(gitignorePath, contentToAppend, StandardCharsets.UTF_8, StandardOpenOption.APPEND);
            logger.debug("Appended '{}' to existing .gitignore at {}", WORKTREES_IGNORE_ENTRY, gitignorePath);
        }
    }
}
