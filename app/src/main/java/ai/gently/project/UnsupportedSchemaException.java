package ai.gently.project;

import java.io.IOException;
import java.nio.file.Path;

public class UnsupportedSchemaException extends IOException {
    public UnsupportedSchemaException(Path document, int schemaVersion, int supported) {
        super("%s has schema version %d; this build reads up to %d".formatted(document, schemaVersion, supported));
    }
}
