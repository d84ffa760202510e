/*
 * DICOM Archiver
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 *
 * This software is distributed under the terms described in the LICENSE file.
 */
package io.xnatworks.archiver.archive;

import java.nio.file.Path;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Where the final archive goes: its directory, its file name, and the advisories
 * produced while resolving them.
 */
public final class ArchiveDestination {

    private final Path directory;
    private final String fileName;
    private final boolean yearBucket;
    private final List<String> advisories;

    ArchiveDestination(Path directory, String fileName, boolean yearBucket, List<String> advisories) {
        this.directory = directory;
        this.fileName = fileName;
        this.yearBucket = yearBucket;
        this.advisories = Collections.unmodifiableList(advisories);
    }

    public Path getDirectory() { return directory; }
    public String getFileName() { return fileName; }

    /**
     * True when {@link #getDirectory()} is a year subdirectory that may still need creating.
     */
    public boolean isYearBucket() { return yearBucket; }

    public List<String> getAdvisories() { return advisories; }

    public Path getArchivePath() {
        return directory.resolve(fileName);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ArchiveDestination)) return false;
        ArchiveDestination that = (ArchiveDestination) o;
        return yearBucket == that.yearBucket
                && directory.equals(that.directory)
                && fileName.equals(that.fileName)
                && advisories.equals(that.advisories);
    }

    @Override
    public int hashCode() {
        return Objects.hash(directory, fileName, yearBucket, advisories);
    }

    @Override
    public String toString() {
        return getArchivePath().toString();
    }
}
