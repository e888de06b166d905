package org.urbanscope.datapipeline.utils;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.UUID;

/**
 * Write-temp-then-rename helpers. Readers of the target path see either the previous
 * content or the new content, never a partial file.
 */
public final class AtomicFiles {

    private static final Logger log = LoggerFactory.getLogger(AtomicFiles.class);

    private AtomicFiles() {
    }

    /**
     * Atomically replaces {@code target} with {@code data}, creating parent directories as needed.
     *
     * @throws IOException if the temp file cannot be written or moved into place
     */
    public static void write(Path target, byte[] data) throws IOException {
        Path parent = target.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        // Suffix keeps temp files next to the target so the rename stays on one file system
        Path temp = parent.resolve(target.getFileName() + "." + UUID.randomUUID() + ".tmp");
        Files.write(temp, data);
        try {
            try {
                Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                log.debug("Atomic move not supported for {}, falling back to replace", target);
                Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            try {
                Files.deleteIfExists(temp);
            } catch (IOException cleanupEx) {
                log.warn("Failed to clean up temp file after move failure: {}", temp);
                e.addSuppressed(cleanupEx);
            }
            throw e;
        }
    }
}
