package ai.gently.project;

import java.io.IOException;

/** Thrown when a project document is saved from a copy that is older than the one on disk. */
public class StaleProjectException extends IOException {
    private final long expectedVersion;
    private final long actualVersion;

    public StaleProjectException(String projectId, long expectedVersion, long actualVersion) {
        super("Project '%s' was modified concurrently: expected version %d on disk but found %d"
                .formatted(projectId, expectedVersion, actualVersion));
        this.expectedVersion = expectedVersion;
        this.actualVersion = actualVersion;
    }

    public long getExpectedVersion() {
        return expectedVersion;
    }

    public long getActualVersion() {
        return actualVersion;
    }
}
