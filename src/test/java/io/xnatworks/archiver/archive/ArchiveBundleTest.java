/*
 * DICOM Archiver
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 */
package io.xnatworks.archiver.archive;

import org.junit.jupiter.api.*;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for ArchiveBundle.
 */
@DisplayName("ArchiveBundle Tests")
class ArchiveBundleTest {

    private static final Path TARGET = Paths.get("/data/archive");

    @Test
    @DisplayName("Should derive the four intermediates from the base name")
    void intermediates_ShouldUseBaseName() {
        ArchiveBundle bundle = ArchiveBundle.intermediates(TARGET, "Subj01");

        assertEquals(List.of(
                TARGET.resolve("Subj01.tar"),
                TARGET.resolve("Subj01.tar.gz"),
                TARGET.resolve("Subj01.meta"),
                TARGET.resolve("Subj01.log")), bundle.getIntermediates());
        assertNull(bundle.getArchivePath());
    }

    @Test
    @DisplayName("Should keep the intermediates when the archive path is set")
    void withArchivePath_ShouldKeepIntermediates() {
        ArchiveBundle bundle = ArchiveBundle.intermediates(TARGET, "Subj01");

        ArchiveBundle resolved = bundle.withArchivePath(TARGET.resolve("DCM_Subj01.tar"));

        assertEquals(bundle.getIntermediates(), resolved.getIntermediates());
        assertEquals(TARGET.resolve("DCM_Subj01.tar"), resolved.getArchivePath());
        assertNull(bundle.getArchivePath());
    }

    @Test
    @DisplayName("Should reject an archive path equal to an intermediate")
    void withArchivePath_Collision_ShouldThrow() {
        ArchiveBundle bundle = ArchiveBundle.intermediates(TARGET, "DCM_Subj01");

        assertThrows(IllegalArgumentException.class,
                () -> bundle.withArchivePath(TARGET.resolve("DCM_Subj01.tar")));
    }
}
