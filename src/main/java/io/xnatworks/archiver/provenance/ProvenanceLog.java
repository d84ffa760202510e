/*
 * DICOM Archiver
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 *
 * This software is distributed under the terms described in the LICENSE file.
 */
package io.xnatworks.archiver.provenance;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.xnatworks.archiver.summary.SummaryWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.InetAddress;
import java.net.UnknownHostException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.temporal.ChronoUnit;

/**
 * Record of what was archived, where, and with which checksums.
 *
 * <p>Built once the DICOM tar and its gzip have been hashed. The archive checksum is
 * the only field set afterwards, once the archive file is sealed and closed; the
 * on-disk log inside the archive never carries it, the registry copy does.</p>
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class ProvenanceLog {
    private static final Logger log = LoggerFactory.getLogger(ProvenanceLog.class);

    public static final int ARCHIVE_VERSION = 2;

    @JsonProperty("source_path")
    private final String sourcePath;

    @JsonProperty("target_path")
    private final String targetPath;

    @JsonProperty("creating_host")
    private final String creatingHost;

    @JsonProperty("creating_os")
    private final String creatingOs;

    @JsonProperty("creating_user")
    private final String creatingUser;

    @JsonProperty("archive_date")
    private final LocalDateTime archiveDate;

    @JsonProperty("summary_version")
    private final int summaryVersion;

    @JsonProperty("archive_version")
    private final int archiveVersion;

    @JsonProperty("tarball_md5")
    private final String tarballChecksum;

    @JsonProperty("zipball_md5")
    private final String zipballChecksum;

    @JsonProperty("archive_md5")
    private String archiveChecksum;

    @JsonCreator
    public ProvenanceLog(@JsonProperty("source_path") String sourcePath,
                         @JsonProperty("target_path") String targetPath,
                         @JsonProperty("creating_host") String creatingHost,
                         @JsonProperty("creating_os") String creatingOs,
                         @JsonProperty("creating_user") String creatingUser,
                         @JsonProperty("archive_date") LocalDateTime archiveDate,
                         @JsonProperty("summary_version") int summaryVersion,
                         @JsonProperty("archive_version") int archiveVersion,
                         @JsonProperty("tarball_md5") String tarballChecksum,
                         @JsonProperty("zipball_md5") String zipballChecksum,
                         @JsonProperty("archive_md5") String archiveChecksum) {
        this.sourcePath = sourcePath;
        this.targetPath = targetPath;
        this.creatingHost = creatingHost;
        this.creatingOs = creatingOs;
        this.creatingUser = creatingUser;
        this.archiveDate = archiveDate;
        this.summaryVersion = summaryVersion;
        this.archiveVersion = archiveVersion;
        this.tarballChecksum = tarballChecksum;
        this.zipballChecksum = zipballChecksum;
        this.archiveChecksum = archiveChecksum;
    }

    /**
     * New log for an archive about to be sealed, stamped with this host, user and time.
     *
     * @param source          the source directory
     * @param target          the final archive path
     * @param tarballChecksum checksum of the uncompressed DICOM tar
     * @param zipballChecksum checksum of the gzipped DICOM tar
     * @param clock           source of the archive date
     */
    public static ProvenanceLog create(Path source, Path target, String tarballChecksum,
                                       String zipballChecksum, Clock clock) {
        return new ProvenanceLog(
                source.toString(),
                target.toString(),
                hostName(),
                System.getProperty("os.name", "") + " " + System.getProperty("os.version", ""),
                System.getProperty("user.name", ""),
                LocalDateTime.now(clock).truncatedTo(ChronoUnit.SECONDS),
                SummaryWriter.SUMMARY_VERSION,
                ARCHIVE_VERSION,
                tarballChecksum,
                zipballChecksum,
                null);
    }

    private static String hostName() {
        try {
            return InetAddress.getLocalHost().getHostName();
        } catch (UnknownHostException e) {
            log.debug("Could not resolve local host name: {}", e.getMessage());
            return "unknown";
        }
    }

    public String getSourcePath() { return sourcePath; }
    public String getTargetPath() { return targetPath; }
    public String getCreatingHost() { return creatingHost; }
    public String getCreatingOs() { return creatingOs; }
    public String getCreatingUser() { return creatingUser; }
    public LocalDateTime getArchiveDate() { return archiveDate; }
    public int getSummaryVersion() { return summaryVersion; }
    public int getArchiveVersion() { return archiveVersion; }
    public String getTarballChecksum() { return tarballChecksum; }
    public String getZipballChecksum() { return zipballChecksum; }

    /**
     * Checksum of the sealed archive, null until it has been computed.
     */
    public String getArchiveChecksum() { return archiveChecksum; }

    /**
     * Record the checksum of the sealed archive. Allowed once.
     */
    public void setArchiveChecksum(String archiveChecksum) {
        if (this.archiveChecksum != null) {
            throw new IllegalStateException("Archive checksum already set for " + targetPath);
        }
        this.archiveChecksum = archiveChecksum;
    }
}
