package com.buildfarm.pipeline.codegen.util;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.buildfarm.pipeline.codegen.exception.OutputWriteException;

/**
 * Single-writer file output that never leaves a partial file at the target.
 *
 * Content goes to a temporary file in the target's directory first and is
 * then moved over the target. On any failure the temporary file is deleted
 * and the target is left as it was.
 */
public class AtomicFileWriter {
    private static final Logger log = LoggerFactory.getLogger(AtomicFileWriter.class);

    private AtomicFileWriter() {
        // Utility class
    }

    /**
     * Writes content to a file, creating parent directories if needed.
     *
     * @throws OutputWriteException if any step fails
     */
    public static void writeString(Path target, String content) {
        Path absolute = target.toAbsolutePath().normalize();
        Path parentDir = absolute.getParent();
        Path temp = null;
        try {
            if (parentDir != null) {
                Files.createDirectories(parentDir);
            }
            temp = Files.createTempFile(parentDir, "." + absolute.getFileName() + ".", ".tmp");
            Files.writeString(temp, content, StandardCharsets.UTF_8);
            move(temp, absolute);
            temp = null;
            log.debug("Wrote {} ({} chars)", absolute, content.length());
        } catch (IOException e) {
            throw new OutputWriteException(absolute, e);
        } finally {
            if (temp != null) {
                discard(temp);
            }
        }
    }

    private static void move(Path source, Path target) throws IOException {
        try {
            Files.move(source, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            log.debug("Atomic move not supported for {}, falling back to replace", target);
            Files.move(source, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private static void discard(Path temp) {
        try {
            Files.deleteIfExists(temp);
        } catch (IOException e) {
            log.warn("Could not delete temporary file {}", temp, e);
        }
    }
}
