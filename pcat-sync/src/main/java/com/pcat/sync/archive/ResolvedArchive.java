package com.pcat.sync.archive;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/**
 * A locally readable archive. When the archive was downloaded, {@link #close()} deletes the temporary file;
 * a local archive supplied by the caller is never touched.
 */
public final class ResolvedArchive implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ResolvedArchive.class);

    private final Path path;
    private final boolean temporary;

    private ResolvedArchive(Path path, boolean temporary) {
        this.path = Objects.requireNonNull(path, "path");
        this.temporary = temporary;
    }

    static ResolvedArchive local(Path path) {
        return new ResolvedArchive(path, false);
    }

    static ResolvedArchive temporary(Path path) {
        return new ResolvedArchive(path, true);
    }

    public Path getPath() {
        return path;
    }

    /** True when this archive was downloaded and is owned (and deleted) by this handle. */
    public boolean isTemporary() {
        return temporary;
    }

    @Override
    public void close() {
        if (!temporary) {
            return;
        }
        try {
            Files.deleteIfExists(path);
            log.debug("Removed temporary archive {}", path);
        } catch (IOException e) {
            log.warn("Could not remove temporary archive {}: {}", path, e.getMessage());
        }
    }
}
