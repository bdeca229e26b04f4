package com.heatlite.aggregator.io;

import com.heatlite.aggregator.error.HeatmapException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.attribute.PosixFileAttributeView;
import java.nio.file.attribute.PosixFilePermission;
import java.nio.file.attribute.PosixFilePermissions;
import java.util.Set;

/**
 * Writes the artifact through a temp file in the target directory and renames it
 * into place, so readers never see a half-written file.
 */
public final class ArtifactWriter {

    private static final Logger log = LoggerFactory.getLogger(ArtifactWriter.class);

    /** Temp files are created owner-only; the published artifact is readable by everyone. */
    static final Set<PosixFilePermission> ARTIFACT_PERMISSIONS = PosixFilePermissions.fromString("rw-r--r--");

    private ArtifactWriter() {}

    public static void write(Path target, byte[] bytes) {
        Path absolute = target.toAbsolutePath();
        Path dir = absolute.getParent();
        Path tmp = null;
        try {
            Files.createDirectories(dir);
            tmp = Files.createTempFile(dir, absolute.getFileName().toString(), ".tmp");
            Files.write(tmp, bytes);
            makeReadable(tmp);
            try {
                Files.move(tmp, absolute, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tmp, absolute, StandardCopyOption.REPLACE_EXISTING);
            }
            log.info("Output written to {}", target);
        } catch (IOException e) {
            deleteQuietly(tmp);
            throw new HeatmapException("Failed to write " + target + ": " + e.getMessage(), e);
        }
    }

    private static void makeReadable(Path file) throws IOException {
        if (Files.getFileAttributeView(file, PosixFileAttributeView.class) != null) {
            Files.setPosixFilePermissions(file, ARTIFACT_PERMISSIONS);
        }
    }

    private static void deleteQuietly(Path tmp) {
        if (tmp == null) {
            return;
        }
        try {
            Files.deleteIfExists(tmp);
        } catch (IOException e) {
            log.warn("Could not remove temp file {}", tmp, e);
        }
    }
}
