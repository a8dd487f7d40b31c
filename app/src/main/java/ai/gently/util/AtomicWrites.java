package ai.gently.util;

import java.io.IOException;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Properties;

public class AtomicWrites {
    /**
     * Overwrites the content of a file with the provided text.
     *
     * <p>The content goes to a temporary file in the target's directory which is then moved over the target,
     * atomically where the filesystem allows it. Readers never observe a half-written document.
     *
     * @param targetPath the file to overwrite; its parent directory must exist
     * @param content the text content to write
     * @throws IOException if writing or moving fails
     */
    public static void atomicOverwrite(Path targetPath, String content) throws IOException {
        Path tempFile = Files.createTempFile(targetPath.getParent(), "temp-", ".tmp");

        try {
            Files.write(tempFile, content.getBytes(StandardCharsets.UTF_8));

            try {
                Files.move(
                        tempFile, targetPath, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tempFile, targetPath, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            Files.deleteIfExists(tempFile);
            throw e;
        }
    }

    /**
     * Atomically saves a Properties object to a file, creating parent directories as needed.
     *
     * @param path the path to the target file
     * @param properties the Properties to save
     * @param comment comment for the properties file header
     * @throws IOException if an I/O error occurs
     */
    public static void atomicSaveProperties(Path path, Properties properties, String comment) throws IOException {
        Files.createDirectories(path.getParent());

        StringWriter writer = new StringWriter();
        properties.store(writer, comment);

        atomicOverwrite(path, writer.toString());
    }
}
