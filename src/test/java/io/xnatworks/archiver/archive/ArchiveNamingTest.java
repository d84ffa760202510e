/*
 * DICOM Archiver
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 */
package io.xnatworks.archiver.archive;

import org.junit.jupiter.api.*;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.LocalDate;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for ArchiveNaming.
 */
@DisplayName("ArchiveNaming Tests")
class ArchiveNamingTest {

    private static final Path TARGET = Paths.get("/data/archive");
    private static final LocalDate SCAN_DATE = LocalDate.of(2024, 8, 27);

    @Test
    @DisplayName("Should name the archive after base name only when no date is known")
    void resolve_NoDate_ShouldUseBaseName() {
        ArchiveDestination destination = ArchiveNaming.resolve(TARGET, "Subj01", null, null, false);

        assertEquals(TARGET.resolve("DCM_Subj01.tar"), destination.getArchivePath());
        assertFalse(destination.isYearBucket());
        assertEquals(List.of(ArchiveNaming.NO_SCAN_DATE_ADVISORY), destination.getAdvisories());
    }

    @Test
    @DisplayName("Should prefix the scan date in ISO form")
    void resolve_ScanDate_ShouldPrefixDate() {
        ArchiveDestination destination = ArchiveNaming.resolve(TARGET, "FooBar", SCAN_DATE, null, false);

        assertEquals("DCM_2024-08-27_FooBar.tar", destination.getFileName());
        assertEquals(TARGET, destination.getDirectory());
        assertTrue(destination.getAdvisories().isEmpty());
    }

    @Test
    @DisplayName("Should place the archive under the year directory")
    void resolve_YearBucket_ShouldUseYearDirectory() {
        ArchiveDestination destination = ArchiveNaming.resolve(TARGET, "FooBar", SCAN_DATE, null, true);

        assertEquals(TARGET.resolve("2024").resolve("DCM_2024-08-27_FooBar.tar"), destination.getArchivePath());
        assertTrue(destination.isYearBucket());
        assertTrue(destination.getAdvisories().isEmpty());
    }

    @Test
    @DisplayName("Should ignore the year directory with both advisories when no date is known")
    void resolve_YearBucketWithoutDate_ShouldIgnoreYear() {
        ArchiveDestination destination = ArchiveNaming.resolve(TARGET, "Subj01", null, null, true);

        assertEquals(TARGET.resolve("DCM_Subj01.tar"), destination.getArchivePath());
        assertFalse(destination.isYearBucket());
        assertEquals(List.of(ArchiveNaming.NO_SCAN_DATE_ADVISORY, ArchiveNaming.YEAR_IGNORED_ADVISORY),
                destination.getAdvisories());
    }

    @Test
    @DisplayName("Should fall back to today's date when no scan date is known")
    void resolve_TodayFallback_ShouldUseToday() {
        LocalDate today = LocalDate.of(2025, 1, 15);

        ArchiveDestination destination = ArchiveNaming.resolve(TARGET, "Subj01", null, today, true);

        assertEquals(TARGET.resolve("2025").resolve("DCM_2025-01-15_Subj01.tar"), destination.getArchivePath());
        assertTrue(destination.getAdvisories().isEmpty());
    }

    @Test
    @DisplayName("Should prefer the scan date over today's date")
    void resolve_ScanDateAndToday_ShouldPreferScanDate() {
        ArchiveDestination destination = ArchiveNaming.resolve(TARGET, "FooBar", SCAN_DATE,
                LocalDate.of(2025, 1, 15), false);

        assertEquals("DCM_2024-08-27_FooBar.tar", destination.getFileName());
    }

    @Test
    @DisplayName("Should return equal results for equal inputs")
    void resolve_SameInputs_ShouldBeEqual() {
        ArchiveDestination first = ArchiveNaming.resolve(TARGET, "FooBar", SCAN_DATE, null, true);
        ArchiveDestination second = ArchiveNaming.resolve(TARGET, "FooBar", SCAN_DATE, null, true);

        assertEquals(first, second);
        assertEquals(first.hashCode(), second.hashCode());
    }
}
