package com.scenepilot.orchestrator.assets;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.UUID;

/**
 * Write-then-rename helpers. The temporary file lives in the target's own
 * directory so the final rename never crosses a filesystem, and readers see
 * either the old file or the complete new one.
 */
final class AtomicFiles {

    private static final Logger log = LoggerFactory.getLogger(AtomicFiles.class);

    private AtomicFiles() {}

    static long write(Path target, InputStream content) throws IOException {
        Path tmp = tempSibling(target);
        try {
            long bytes = Files.copy(content, tmp, StandardCopyOption.REPLACE_EXISTING);
            moveIntoPlace(tmp, target);
            return bytes;
        } finally {
            Files.deleteIfExists(tmp);
        }
    }

    static void write(Path target, byte[] content) throws IOException {
        Path tmp = tempSibling(target);
        try {
            Files.write(tmp, content);
            moveIntoPlace(tmp, target);
        } finally {
            Files.deleteIfExists(tmp);
        }
    }

    /** Names starting with '.' and ending in '.tmp' are never published assets. */
    static boolean isTemporary(Path p) {
        String name = p.getFileName().toString();
        return name.startsWith(".") && name.endsWith(".tmp");
    }

    private static Path tempSibling(Path target) throws IOException {
        Files.createDirectories(target.getParent());
        return target.resolveSibling("." + target.getFileName() + "." + UUID.randomUUID() + ".tmp");
    }

    private static void moveIntoPlace(Path tmp, Path target) throws IOException {
        try {
            Files.move(tmp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            log.warn("Atomic rename not supported for {}, falling back to replace", target);
            Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }
}
