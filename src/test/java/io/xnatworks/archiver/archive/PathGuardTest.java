/*
 * DICOM Archiver
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 */
package io.xnatworks.archiver.archive;

import io.xnatworks.archiver.ArchiveException;
import org.junit.jupiter.api.*;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for PathGuard.
 */
@DisplayName("PathGuard Tests")
class PathGuardTest {

    @TempDir
    Path tempDir;

    private final List<String> warnings = new ArrayList<>();

    @Nested
    @DisplayName("Guard Tests")
    class GuardTests {

        @Test
        @DisplayName("Should approve a missing path without warnings")
        void guard_MissingPath_ShouldPass() throws Exception {
            new PathGuard(false, warnings::add).guard(tempDir.resolve("Subj01.tar"));

            assertTrue(warnings.isEmpty());
        }

        @Test
        @DisplayName("Should refuse an existing file when overwrite is off")
        void guard_ExistingFile_ShouldFail() throws Exception {
            Path existing = Files.writeString(tempDir.resolve("Subj01.tar"), "old");

            ArchiveException ex = assertThrows(ArchiveException.class,
                    () -> new PathGuard(false, warnings::add).guard(existing));

            assertEquals(ArchiveException.Kind.TARGET_EXISTS, ex.getKind());
            assertTrue(ex.getMessage().contains("--overwrite"));
            assertTrue(ex.getMessage().contains(existing.toString()));
            assertEquals("old", Files.readString(existing));
        }

        @Test
        @DisplayName("Should refuse an existing directory when overwrite is off")
        void guard_ExistingDirectory_ShouldFail() throws Exception {
            Path dir = Files.createDirectory(tempDir.resolve("Subj01.meta"));

            ArchiveException ex = assertThrows(ArchiveException.class,
                    () -> new PathGuard(false, warnings::add).guard(dir));

            assertEquals(ArchiveException.Kind.TARGET_EXISTS, ex.getKind());
        }

        @Test
        @DisplayName("Should emit exactly one warning per overwritten path")
        void guard_ExistingFileWithOverwrite_ShouldWarnOnce() throws Exception {
            Path existing = Files.writeString(tempDir.resolve("Subj01.tar"), "old");

            new PathGuard(true, warnings::add).guard(existing);

            assertEquals(1, warnings.size());
            assertTrue(warnings.get(0).contains(existing.toString()));
            assertTrue(Files.exists(existing), "guard never deletes");
        }
    }

    @Nested
    @DisplayName("Directory Tests")
    class DirectoryTests {

        @Test
        @DisplayName("Should create a missing directory")
        void ensureDirectory_Missing_ShouldCreate() throws Exception {
            Path year = tempDir.resolve("2024");

            new PathGuard(false, message -> { }).ensureDirectory(year);

            assertTrue(Files.isDirectory(year));
        }

        @Test
        @DisplayName("Should accept an existing directory")
        void ensureDirectory_Existing_ShouldPass() throws Exception {
            Path year = Files.createDirectory(tempDir.resolve("2024"));

            assertDoesNotThrow(() -> new PathGuard(false, message -> { }).ensureDirectory(year));
        }

        @Test
        @DisplayName("Should refuse a file standing where the directory should be")
        void ensureDirectory_FileInTheWay_ShouldFail() throws Exception {
            Path year = Files.writeString(tempDir.resolve("2024"), "not a directory");

            ArchiveException ex = assertThrows(ArchiveException.class,
                    () -> new PathGuard(false, message -> { }).ensureDirectory(year));

            assertEquals(ArchiveException.Kind.DIRECTORY_UNUSABLE, ex.getKind());
        }
    }
}
