/*
 * DICOM Archiver
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 */
package io.xnatworks.archiver;

import io.xnatworks.archiver.registry.RegistryAction;
import org.junit.jupiter.api.*;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for ArchiveOptions.
 */
@DisplayName("ArchiveOptions Tests")
class ArchiveOptionsTest {

    @TempDir
    Path tempDir;

    private Path source;
    private Path target;

    @BeforeEach
    void setUp() throws Exception {
        source = Files.createDirectory(tempDir.resolve("Subj01"));
        target = Files.createDirectory(tempDir.resolve("out"));
    }

    @Test
    @DisplayName("Should default to no registry action")
    void builder_Defaults() {
        ArchiveOptions options = ArchiveOptions.builder().source(source).target(target).build();

        assertEquals(RegistryAction.NONE, options.getRegistryAction());
        assertFalse(options.hasProfile());
        assertFalse(options.isOverwrite());
        assertEquals("Subj01", options.getBaseName());
    }

    @Test
    @DisplayName("Should normalize the source path")
    void builder_ShouldNormalizePaths() {
        ArchiveOptions options = ArchiveOptions.builder()
                .source(target.resolve("..").resolve("Subj01"))
                .target(target)
                .build();

        assertEquals(source.toAbsolutePath().normalize(), options.getSource());
        assertEquals("Subj01", options.getBaseName());
    }

    @Test
    @DisplayName("Should require source and target")
    void builder_MissingPaths_ShouldThrow() {
        assertThrows(IllegalStateException.class, () -> ArchiveOptions.builder().source(source).build());
    }

    @Nested
    @DisplayName("Validation Tests")
    class ValidationTests {

        @Test
        @DisplayName("Should accept readable source and writable target")
        void validate_Valid_ShouldPass() {
            ArchiveOptions options = ArchiveOptions.builder().source(source).target(target).build();

            assertDoesNotThrow(options::validate);
        }

        @Test
        @DisplayName("Should require a profile for a registry action")
        void validate_DbActionWithoutProfile_ShouldFail() {
            ArchiveOptions options = ArchiveOptions.builder()
                    .source(source).target(target).registryAction(RegistryAction.INSERT).build();

            ArchiveException ex = assertThrows(ArchiveException.class, options::validate);

            assertEquals(ArchiveException.Kind.INVALID_ARGUMENT, ex.getKind());
            assertEquals("Argument '--profile' must be set when a '--db-*' argument is set.", ex.getMessage());
        }

        @Test
        @DisplayName("Should reject a missing source directory")
        void validate_MissingSource_ShouldFail() {
            ArchiveOptions options = ArchiveOptions.builder()
                    .source(tempDir.resolve("nope")).target(target).build();

            ArchiveException ex = assertThrows(ArchiveException.class, options::validate);

            assertEquals(ArchiveException.Kind.INVALID_ARGUMENT, ex.getKind());
            assertTrue(ex.getMessage().contains("--source"));
        }

        @Test
        @DisplayName("Should reject a target that is a file")
        void validate_TargetIsFile_ShouldFail() throws Exception {
            Path file = Files.writeString(tempDir.resolve("file"), "x");
            ArchiveOptions options = ArchiveOptions.builder().source(source).target(file).build();

            ArchiveException ex = assertThrows(ArchiveException.class, options::validate);

            assertTrue(ex.getMessage().contains("--target"));
        }
    }
}
