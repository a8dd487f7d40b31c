package ai.gently.git;

import org.eclipse.jgit.api.errors.GitAPIException;

/** A git call that completed but could not do what was asked, such as resolving a missing revision. */
public class GitOperationException extends GitAPIException {
    public GitOperationException(String message) {
        super(message);
    }
}
