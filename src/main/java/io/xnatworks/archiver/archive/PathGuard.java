/*
 * DICOM Archiver
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 *
 * This software is distributed under the terms described in the LICENSE file.
 */
package io.xnatworks.archiver.archive;

import io.xnatworks.archiver.ArchiveException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.util.function.Consumer;

/**
 * Decides whether an output path may be written under the run's overwrite policy,
 * and creates year bucket directories.
 *
 * <p>The check is a single point-in-time read of the filesystem. Two runs writing
 * the same paths at the same moment can both pass it.</p>
 */
public class PathGuard {
    private static final Logger log = LoggerFactory.getLogger(PathGuard.class);

    private final boolean overwrite;
    private final Consumer<String> warnings;

    /**
     * @param overwrite whether existing paths may be reused
     * @param warnings  receives one message per overwritten path
     */
    public PathGuard(boolean overwrite, Consumer<String> warnings) {
        this.overwrite = overwrite;
        this.warnings = warnings;
    }

    /**
     * Approve creation of {@code path}.
     *
     * @throws ArchiveException {@code TARGET_EXISTS} if the path exists and overwriting is off
     */
    public void guard(Path path) throws ArchiveException {
        if (!Files.exists(path, LinkOption.NOFOLLOW_LINKS)) {
            return;
        }
        if (!overwrite) {
            throw new ArchiveException(ArchiveException.Kind.TARGET_EXISTS,
                    "File or directory '" + path + "' already exists. " +
                    "Use option '--overwrite' to overwrite it.");
        }
        warnings.accept("Overwriting '" + path + "'");
    }

    /**
     * Make sure {@code dir} exists as a writable directory, creating it if missing.
     *
     * @throws ArchiveException {@code DIRECTORY_UNUSABLE} if the path exists but is not a
     *                          writable directory, {@code IO_FAILURE} if creation fails
     */
    public void ensureDirectory(Path dir) throws ArchiveException {
        if (!Files.exists(dir)) {
            log.info("Creating directory '{}'", dir);
            try {
                Files.createDirectory(dir);
            } catch (IOException e) {
                throw new ArchiveException(ArchiveException.Kind.IO_FAILURE,
                        "Could not create directory '" + dir + "': " + e.getMessage(), e);
            }
            return;
        }
        if (!Files.isDirectory(dir) || !Files.isWritable(dir)) {
            throw new ArchiveException(ArchiveException.Kind.DIRECTORY_UNUSABLE,
                    "Path '" + dir + "' exists but is not a writable directory.");
        }
    }
}
