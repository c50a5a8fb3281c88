package ai.aerof.deck.writer;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes rendered decks to disk, creating parent directories and replacing any existing file.
 */
public class DocumentWriter {

    private static final Logger LOGGER = LoggerFactory.getLogger(DocumentWriter.class);

    public void write(Path target, String content) {
        if (target == null || content == null) {
            throw new IllegalArgumentException("target and content must be provided");
        }
        try {
            Path parent = target.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.writeString(target, content, StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING, StandardOpenOption.WRITE);
            LOGGER.info("Wrote {} characters to {}", content.length(), target);
        } catch (IOException ex) {
            throw new UncheckedIOException("Failed to write deck: " + target, ex);
        }
    }
}
