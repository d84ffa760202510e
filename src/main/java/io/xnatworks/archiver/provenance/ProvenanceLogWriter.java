/*
 * DICOM Archiver
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 *
 * This software is distributed under the terms described in the LICENSE file.
 */
package io.xnatworks.archiver.provenance;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.xnatworks.archiver.archive.ArchiveBundle;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.format.DateTimeFormatter;

/**
 * Renderings of a {@link ProvenanceLog}: the text shown with {@code --verbose} and
 * stored as the {@code .log} archive member, and the JSON kept by the registry.
 *
 * <p>Checksum lines use the {@code md5sum} layout so they can be pasted into
 * {@code md5sum -c}.</p>
 */
public final class ProvenanceLogWriter {

    private static final DateTimeFormatter DATE_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .enable(SerializationFeature.INDENT_OUTPUT)
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

    private ProvenanceLogWriter() {
    }

    public static void writeToFile(Path path, ProvenanceLog provenance) throws IOException {
        Files.writeString(path, writeToString(provenance), StandardCharsets.UTF_8);
    }

    public static String writeToString(ProvenanceLog provenance) {
        String baseName = Paths.get(provenance.getSourcePath()).getFileName().toString();
        String archiveName = Paths.get(provenance.getTargetPath()).getFileName().toString();

        StringBuilder sb = new StringBuilder();
        line(sb, "Taken from dir", provenance.getSourcePath());
        line(sb, "Archive target location", provenance.getTargetPath());
        line(sb, "Name of creating host", provenance.getCreatingHost());
        line(sb, "Name of host OS", provenance.getCreatingOs());
        line(sb, "Created by user", provenance.getCreatingUser());
        line(sb, "Archived on", provenance.getArchiveDate() != null
                ? DATE_FORMAT.format(provenance.getArchiveDate()) : null);
        line(sb, "dicomSummary version", String.valueOf(provenance.getSummaryVersion()));
        line(sb, "dicomTar version", String.valueOf(provenance.getArchiveVersion()));
        line(sb, "md5sum for DICOM tarball", checksum(provenance.getTarballChecksum(),
                baseName + ArchiveBundle.TAR_EXTENSION));
        line(sb, "md5sum for DICOM tarball gzipped", checksum(provenance.getZipballChecksum(),
                baseName + ArchiveBundle.ZIP_EXTENSION));
        line(sb, "md5sum for complete archive", checksum(provenance.getArchiveChecksum(), archiveName));
        return sb.toString();
    }

    /**
     * JSON form stored in the registry, including the archive checksum.
     */
    public static String toJson(ProvenanceLog provenance) {
        try {
            return MAPPER.writeValueAsString(provenance);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Could not serialize provenance log", e);
        }
    }

    private static void line(StringBuilder sb, String label, String value) {
        sb.append(String.format("* %-33s:    %s\n", label, value != null ? value : ""));
    }

    private static String checksum(String md5, String fileName) {
        return md5 != null ? md5 + "  " + fileName : null;
    }
}
