package ai.gently.project;

import static org.junit.jupiter.api.Assertions.*;

import java.nio.file.Path;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

public class GentlyConfigTest {
    @TempDir
    Path tempDir;

    @AfterEach
    void tearDown() {
        System.clearProperty(GentlyConfig.PROJECTS_DIR_PROPERTY);
    }

    @Test
    void testPropertiesFileAndSystemPropertyOverride() throws Exception {
        var config = new GentlyConfig(tempDir.resolve("conf").resolve("gently.properties"));
        var stored = tempDir.resolve("stored-projects");

        config.setProjectsDir(stored);
        if (System.getenv(GentlyConfig.PROJECTS_DIR_ENV) == null) {
            assertEquals(stored.toAbsolutePath(), config.getProjectsDir());
        }

        var override = tempDir.resolve("override");
        System.setProperty(GentlyConfig.PROJECTS_DIR_PROPERTY, override.toString());
        assertEquals(override, config.getProjectsDir());
    }

    @Test
    void testClearingStoredDirectory() throws Exception {
        var file = tempDir.resolve("gently.properties");
        var config = new GentlyConfig(file);
        config.setProjectsDir(tempDir.resolve("x"));
        config.setProjectsDir(null);

        assertNull(config.loadProperties().getProperty(GentlyConfig.PROJECTS_DIR_KEY));
    }
}
