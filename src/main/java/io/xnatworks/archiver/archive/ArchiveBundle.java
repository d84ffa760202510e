/*
 * DICOM Archiver
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 *
 * This software is distributed under the terms described in the LICENSE file.
 */
package io.xnatworks.archiver.archive;

import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;

/**
 * Artifact paths of one run.
 *
 * <p>The four intermediates live in the target directory and are named after the
 * source base name. The final archive path is unknown until the scan date has been
 * read, so it is attached later with {@link #withArchivePath(Path)}.</p>
 */
public final class ArchiveBundle {

    public static final String TAR_EXTENSION = ".tar";
    public static final String ZIP_EXTENSION = ".tar.gz";
    public static final String SUMMARY_EXTENSION = ".meta";
    public static final String LOG_EXTENSION = ".log";

    private final Path tarPath;
    private final Path zipPath;
    private final Path summaryPath;
    private final Path logPath;
    private final Path archivePath;

    private ArchiveBundle(Path tarPath, Path zipPath, Path summaryPath, Path logPath, Path archivePath) {
        this.tarPath = tarPath;
        this.zipPath = zipPath;
        this.summaryPath = summaryPath;
        this.logPath = logPath;
        this.archivePath = archivePath;
    }

    /**
     * Intermediate paths for {@code baseName} inside {@code target}.
     */
    public static ArchiveBundle intermediates(Path target, String baseName) {
        return new ArchiveBundle(
                target.resolve(baseName + TAR_EXTENSION),
                target.resolve(baseName + ZIP_EXTENSION),
                target.resolve(baseName + SUMMARY_EXTENSION),
                target.resolve(baseName + LOG_EXTENSION),
                null);
    }

    /**
     * Copy of this bundle with the final archive path set.
     *
     * @throws IllegalArgumentException if the archive path collides with an intermediate
     */
    public ArchiveBundle withArchivePath(Path archivePath) {
        Path normalized = archivePath.toAbsolutePath().normalize();
        for (Path intermediate : getIntermediates()) {
            if (intermediate.toAbsolutePath().normalize().equals(normalized)) {
                throw new IllegalArgumentException(
                        "Archive path '" + archivePath + "' collides with intermediate '" + intermediate + "'");
            }
        }
        return new ArchiveBundle(tarPath, zipPath, summaryPath, logPath, archivePath);
    }

    /**
     * The intermediates in creation order: tar, zip, summary, log.
     */
    public List<Path> getIntermediates() {
        return Arrays.asList(tarPath, zipPath, summaryPath, logPath);
    }

    public Path getTarPath() { return tarPath; }
    public Path getZipPath() { return zipPath; }
    public Path getSummaryPath() { return summaryPath; }
    public Path getLogPath() { return logPath; }

    /**
     * The sealed archive path, or null before it has been resolved.
     */
    public Path getArchivePath() { return archivePath; }

    @Override
    public String toString() {
        return "ArchiveBundle{tar=" + tarPath + ", zip=" + zipPath + ", summary=" + summaryPath +
                ", log=" + logPath + ", archive=" + archivePath + "}";
    }
}
