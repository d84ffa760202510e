/*
 * DICOM Archiver
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 *
 * This software is distributed under the terms described in the LICENSE file.
 */
package io.xnatworks.archiver.archive;

import io.xnatworks.archiver.ArchiveException;
import org.apache.commons.compress.archivers.tar.TarArchiveEntry;
import org.apache.commons.compress.archivers.tar.TarArchiveOutputStream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import java.util.zip.GZIPOutputStream;

/**
 * Builds the containers of an archive run: the uncompressed DICOM tar, its gzip,
 * and the sealed archive holding the gzip, the summary and the log.
 *
 * <p>Every stage is synchronous and closes its streams before returning, so a
 * checksum taken afterwards sees the complete file. A failing stage leaves the
 * artifacts of earlier stages on disk.</p>
 *
 * Layout of the sealed archive:
 * <pre>
 * DCM_{date}_{base}.tar
 *   ├── {base}.tar.gz   - gzip of the DICOM tar ({base}/... entries)
 *   ├── {base}.meta     - study summary
 *   └── {base}.log      - provenance log
 * </pre>
 */
public class ArchiveAssembler {
    private static final Logger log = LoggerFactory.getLogger(ArchiveAssembler.class);

    private static final int BUFFER_SIZE = 64 * 1024;

    /**
     * Pack every entry found directly under {@code sourceDir} into an uncompressed tar
     * at {@code tarPath}. Entries are named {@code {base}/{entry}} and sorted by name;
     * subdirectories are added with their content.
     *
     * @return number of regular files packed
     */
    public int pack(Path sourceDir, Path tarPath) throws ArchiveException {
        String root = sourceDir.getFileName().toString();
        try (TarArchiveOutputStream tos = openTar(tarPath)) {
            int files = 0;
            for (Path entry : sortedChildren(sourceDir)) {
                files += addRecursively(tos, entry, root + "/" + entry.getFileName());
            }
            tos.finish();
            log.debug("Packed {} files from {} into {}", files, sourceDir, tarPath);
            return files;
        } catch (IOException e) {
            throw stageFailure("pack", tarPath, e);
        }
    }

    /**
     * Stream-compress {@code tarPath} into {@code zipPath} with gzip.
     */
    public void compress(Path tarPath, Path zipPath) throws ArchiveException {
        try (InputStream in = Files.newInputStream(tarPath);
             OutputStream out = new GZIPOutputStream(
                     new BufferedOutputStream(Files.newOutputStream(zipPath), BUFFER_SIZE), BUFFER_SIZE)) {
            long bytes = in.transferTo(out);
            log.debug("Compressed {} bytes from {} into {}", bytes, tarPath, zipPath);
        } catch (IOException e) {
            throw stageFailure("compress", zipPath, e);
        }
    }

    /**
     * Seal the final archive: the gzip, the summary and the log, each stored under its
     * base name only.
     *
     * @throws IllegalStateException if the bundle has no archive path yet
     */
    public void seal(ArchiveBundle bundle) throws ArchiveException {
        Path archivePath = bundle.getArchivePath();
        if (archivePath == null) {
            throw new IllegalStateException("Archive path not resolved");
        }
        try (TarArchiveOutputStream tos = openTar(archivePath)) {
            for (Path member : List.of(bundle.getZipPath(), bundle.getSummaryPath(), bundle.getLogPath())) {
                addFile(tos, member, member.getFileName().toString());
            }
            tos.finish();
        } catch (IOException e) {
            throw stageFailure("seal", archivePath, e);
        }
        log.debug("Sealed archive {}", archivePath);
    }

    private TarArchiveOutputStream openTar(Path path) throws IOException {
        TarArchiveOutputStream tos = new TarArchiveOutputStream(
                new BufferedOutputStream(Files.newOutputStream(path), BUFFER_SIZE));
        tos.setLongFileMode(TarArchiveOutputStream.LONGFILE_POSIX);
        tos.setBigNumberMode(TarArchiveOutputStream.BIGNUMBER_POSIX);
        return tos;
    }

    private int addRecursively(TarArchiveOutputStream tos, Path path, String entryName) throws IOException {
        if (!Files.isDirectory(path)) {
            addFile(tos, path, entryName);
            return 1;
        }

        TarArchiveEntry dirEntry = new TarArchiveEntry(entryName + "/");
        dirEntry.setModTime(Files.getLastModifiedTime(path).toMillis());
        tos.putArchiveEntry(dirEntry);
        tos.closeArchiveEntry();

        int files = 0;
        for (Path child : sortedChildren(path)) {
            files += addRecursively(tos, child, entryName + "/" + child.getFileName());
        }
        return files;
    }

    /**
     * Entries carry name, size, mode and modification time only. Access and change times
     * would be written as PAX headers and differ between two packs of the same files.
     */
    private void addFile(TarArchiveOutputStream tos, Path file, String entryName) throws IOException {
        TarArchiveEntry entry = new TarArchiveEntry(entryName);
        entry.setSize(Files.size(file));
        entry.setMode(TarArchiveEntry.DEFAULT_FILE_MODE);
        entry.setModTime(Files.getLastModifiedTime(file).toMillis());
        tos.putArchiveEntry(entry);
        Files.copy(file, tos);
        tos.closeArchiveEntry();
        log.trace("Added {} as {}", file, entryName);
    }

    private static List<Path> sortedChildren(Path dir) throws IOException {
        try (Stream<Path> children = Files.list(dir)) {
            return children
                    .sorted((a, b) -> a.getFileName().toString().compareTo(b.getFileName().toString()))
                    .collect(Collectors.toList());
        }
    }

    private static ArchiveException stageFailure(String stage, Path path, IOException e) {
        return new ArchiveException(ArchiveException.Kind.IO_FAILURE,
                "Failed to " + stage + " '" + path + "': " + e.getMessage(), e);
    }
}
