/*
 * DICOM Archiver
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 *
 * This software is distributed under the terms described in the LICENSE file.
 */
package io.xnatworks.archiver.archive;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.function.Consumer;

/**
 * Removes the intermediate artifacts once the archive is sealed.
 *
 * <p>The archive is already committed when this runs, so a file that cannot be
 * removed only produces a warning.</p>
 */
public class IntermediateCleanup {
    private static final Logger log = LoggerFactory.getLogger(IntermediateCleanup.class);

    private final Consumer<String> warnings;

    public IntermediateCleanup(Consumer<String> warnings) {
        this.warnings = warnings;
    }

    /**
     * Delete the tar, zip, summary and log files of {@code bundle}.
     *
     * @return number of files actually deleted
     * @throws IllegalStateException if the archive has not been sealed
     */
    public int cleanup(ArchiveBundle bundle) {
        Path archivePath = bundle.getArchivePath();
        if (archivePath == null || !Files.isRegularFile(archivePath)) {
            throw new IllegalStateException("Refusing to clean up before the archive is sealed: " + archivePath);
        }

        int deleted = 0;
        for (Path intermediate : bundle.getIntermediates()) {
            try {
                if (Files.deleteIfExists(intermediate)) {
                    deleted++;
                    log.debug("Deleted {}", intermediate);
                } else {
                    warnings.accept("Temporary file '" + intermediate + "' was already removed");
                }
            } catch (IOException e) {
                warnings.accept("Could not remove temporary file '" + intermediate + "': " + e.getMessage());
            }
        }
        return deleted;
    }
}
