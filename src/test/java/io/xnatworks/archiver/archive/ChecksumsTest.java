/*
 * DICOM Archiver
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 */
package io.xnatworks.archiver.archive;

import org.junit.jupiter.api.*;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.MessageDigest;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for Checksums.
 */
@DisplayName("Checksums Tests")
class ChecksumsTest {

    @TempDir
    Path tempDir;

    @Test
    @DisplayName("Should hash an empty file")
    void md5_EmptyFile() throws Exception {
        Path empty = Files.createFile(tempDir.resolve("empty"));

        assertEquals("d41d8cd98f00b204e9800998ecf8427e", Checksums.md5(empty));
    }

    @Test
    @DisplayName("Should hash file content as lower-case hex")
    void md5_KnownContent() throws Exception {
        Path file = Files.writeString(tempDir.resolve("hello.txt"), "hello");

        assertEquals("5d41402abc4b2a76b9719d911017c592", Checksums.md5(file));
    }

    @Test
    @DisplayName("Should hash files larger than one read buffer")
    void md5_LargeFile() throws Exception {
        byte[] content = "DICOM archive content\n".repeat(2000).getBytes(StandardCharsets.UTF_8);
        Path file = Files.write(tempDir.resolve("content.bin"), content);

        StringBuilder expected = new StringBuilder();
        for (byte b : MessageDigest.getInstance("MD5").digest(content)) {
            expected.append(String.format("%02x", b));
        }
        assertEquals(expected.toString(), Checksums.md5(file));
    }
}
