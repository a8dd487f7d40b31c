package ai.gently.project;

import java.io.IOException;

public class ProjectExistsException extends IOException {
    public ProjectExistsException(String message) {
        super(message);
    }
}
