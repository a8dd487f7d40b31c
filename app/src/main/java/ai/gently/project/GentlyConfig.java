package ai.gently.project;

import ai.gently.util.AtomicWrites;
import ai.gently.util.Environment;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Properties;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

/**
 * Global settings, read from {@code ~/.config/gently/gently.properties}.
 *
 * <p>The projects directory resolves, in order, from the {@code gently.projects.dir} system property, the
 * {@code GENTLY_PROJECTS_DIR} environment variable, the {@code projects.dir} property, and finally {@code ~/projects}.
 */
public class GentlyConfig {
    private static final Logger logger = LogManager.getLogger(GentlyConfig.class);

    public static final String PROJECTS_DIR_PROPERTY = "gently.projects.dir";
    public static final String PROJECTS_DIR_ENV = "GENTLY_PROJECTS_DIR";
    static final String PROJECTS_DIR_KEY = "projects.dir";

    private final Path propertiesPath;

    public GentlyConfig() {
        this(configDir().resolve("gently.properties"));
    }

    public GentlyConfig(Path propertiesPath) {
        this.propertiesPath = propertiesPath;
    }

    public static Path configDir() {
        return Environment.getHomePath().resolve(".config").resolve("gently");
    }

    public Properties loadProperties() {
        var props = new Properties();
        if (Files.exists(propertiesPath)) {
            try (var reader = Files.newBufferedReader(propertiesPath)) {
                props.load(reader);
            } catch (IOException e) {
                logger.warn("Unable to read {}: {}", propertiesPath, e.getMessage());
            }
        }
        return props;
    }

    public Path getProjectsDir() {
        var fromSystem = System.getProperty(PROJECTS_DIR_PROPERTY);
        if (fromSystem != null && !fromSystem.isBlank()) {
            return Path.of(fromSystem);
        }
        var fromEnv = System.getenv(PROJECTS_DIR_ENV);
        if (fromEnv != null && !fromEnv.isBlank()) {
            return Path.of(fromEnv);
        }
        var fromFile = loadProperties().getProperty(PROJECTS_DIR_KEY);
        if (fromFile != null && !fromFile.isBlank()) {
            return Path.of(fromFile);
        }
        return Environment.getHomePath().resolve("projects");
    }

    public void setProjectsDir(@Nullable Path dir) throws IOException {
        var props = loadProperties();
        if (dir == null) {
            props.remove(PROJECTS_DIR_KEY);
        } else {
            props.setProperty(PROJECTS_DIR_KEY, dir.toAbsolutePath().toString());
        }
        AtomicWrites.atomicSaveProperties(propertiesPath, props, "Gently global configuration");
    }
}
