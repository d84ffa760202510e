/*
 * DICOM Archiver
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 *
 * This software is distributed under the terms described in the LICENSE file.
 */
package io.xnatworks.archiver.archive;

import java.nio.file.Path;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;

/**
 * Derives the final archive location from the source base name and the scan date.
 *
 * <pre>
 * {target}/DCM_{yyyy-MM-dd}_{base}.tar          scan date known
 * {target}/{yyyy}/DCM_{yyyy-MM-dd}_{base}.tar   scan date known, year bucket requested
 * {target}/DCM_{base}.tar                       no scan date
 * </pre>
 *
 * <p>Resolution does no I/O. Creating the year directory is left to {@link PathGuard}.</p>
 */
public final class ArchiveNaming {

    public static final String ARCHIVE_PREFIX = "DCM_";
    public static final String ARCHIVE_EXTENSION = ".tar";

    static final DateTimeFormatter SCAN_DATE_FORMAT = DateTimeFormatter.ISO_LOCAL_DATE;

    static final String NO_SCAN_DATE_ADVISORY =
            "No scan date was found in the DICOMs, " +
            "consider using argument '--today' to use today's date as the scan date.";

    static final String YEAR_IGNORED_ADVISORY =
            "Argument '--year' was provided but no scan date was found in the DICOMs, " +
            "the argument will be ignored.";

    private ArchiveNaming() {
    }

    /**
     * Resolve the archive destination.
     *
     * @param target     the target directory of the run
     * @param baseName   base name of the source directory
     * @param scanDate   scan date from the summary, may be null
     * @param today      the current date when {@code --today} was given, otherwise null;
     *                   used only when {@code scanDate} is null
     * @param yearBucket whether to place the archive under a year subdirectory
     */
    public static ArchiveDestination resolve(Path target, String baseName, LocalDate scanDate,
                                             LocalDate today, boolean yearBucket) {
        List<String> advisories = new ArrayList<>();
        LocalDate date = scanDate != null ? scanDate : today;

        if (date == null) {
            advisories.add(NO_SCAN_DATE_ADVISORY);
        }

        Path directory = target;
        boolean bucketed = false;
        if (yearBucket) {
            if (date == null) {
                advisories.add(YEAR_IGNORED_ADVISORY);
            } else {
                directory = target.resolve(String.valueOf(date.getYear()));
                bucketed = true;
            }
        }

        return new ArchiveDestination(directory, fileName(baseName, date), bucketed, advisories);
    }

    /**
     * Archive file name for a base name and an optional date.
     */
    public static String fileName(String baseName, LocalDate date) {
        if (date == null) {
            return ARCHIVE_PREFIX + baseName + ARCHIVE_EXTENSION;
        }
        return ARCHIVE_PREFIX + SCAN_DATE_FORMAT.format(date) + "_" + baseName + ARCHIVE_EXTENSION;
    }
}
