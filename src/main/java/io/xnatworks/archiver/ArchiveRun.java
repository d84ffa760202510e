/*
 * DICOM Archiver
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 *
 * This software is distributed under the terms described in the LICENSE file.
 */
package io.xnatworks.archiver;

import io.xnatworks.archiver.archive.ArchiveAssembler;
import io.xnatworks.archiver.archive.ArchiveBundle;
import io.xnatworks.archiver.archive.ArchiveDestination;
import io.xnatworks.archiver.archive.ArchiveNaming;
import io.xnatworks.archiver.archive.Checksums;
import io.xnatworks.archiver.archive.IntermediateCleanup;
import io.xnatworks.archiver.archive.PathGuard;
import io.xnatworks.archiver.provenance.ProvenanceLog;
import io.xnatworks.archiver.provenance.ProvenanceLogWriter;
import io.xnatworks.archiver.registry.ArchiveRegistry;
import io.xnatworks.archiver.registry.RegistryAction;
import io.xnatworks.archiver.registry.RegistrySynchronizer;
import io.xnatworks.archiver.summary.DicomSummary;
import io.xnatworks.archiver.summary.SummaryExtractor;
import io.xnatworks.archiver.summary.SummaryWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Path;
import java.time.Clock;
import java.time.LocalDate;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * One archiving run, from option checks to the registry write.
 *
 * <p>Stages run strictly in order and each one completes before the next starts:
 * <ol>
 *   <li>guard the four intermediate paths</li>
 *   <li>extract the study summary</li>
 *   <li>check the registry precondition (before anything is written)</li>
 *   <li>pack the source into a tar and hash it, gzip the tar and hash it</li>
 *   <li>resolve and guard the final archive path</li>
 *   <li>build the provenance log, write the summary and log files</li>
 *   <li>seal the archive, then hash it</li>
 *   <li>remove the intermediates</li>
 *   <li>insert or update the registry record</li>
 * </ol>
 * Any failure aborts the run; files written by earlier stages are left in place.</p>
 */
public class ArchiveRun {
    private static final Logger log = LoggerFactory.getLogger(ArchiveRun.class);

    private final ArchiveOptions options;
    private final SummaryExtractor extractor;
    private final Optional<ArchiveRegistry> registry;
    private final Clock clock;
    private final Consumer<String> warnings;
    private final PrintStream out;
    private final ArchiveAssembler assembler = new ArchiveAssembler();

    public ArchiveRun(ArchiveOptions options, SummaryExtractor extractor, Optional<ArchiveRegistry> registry) {
        this(options, extractor, registry, Clock.systemDefaultZone(), message -> { }, System.out);
    }

    /**
     * @param registry present only when a connection profile was given
     * @param clock    supplies the date used with {@code --today} and the log's archive date
     * @param warnings receives every non-fatal advisory of the run, in addition to the log
     * @param out      where {@code --verbose} prints the provenance log
     */
    public ArchiveRun(ArchiveOptions options, SummaryExtractor extractor, Optional<ArchiveRegistry> registry,
                      Clock clock, Consumer<String> warnings, PrintStream out) {
        this.options = options;
        this.extractor = extractor;
        this.registry = registry;
        this.clock = clock;
        this.warnings = message -> {
            log.warn(message);
            warnings.accept(message);
        };
        this.out = out;
    }

    public Result execute() throws ArchiveException {
        options.validate();
        if (options.getRegistryAction() != RegistryAction.NONE && registry.isEmpty()) {
            throw new ArchiveException(ArchiveException.Kind.INVALID_ARGUMENT,
                    "Argument '--db-" + options.getRegistryAction().name().toLowerCase() +
                    "' requires a registry connection.");
        }

        Path source = options.getSource();
        String baseName = options.getBaseName();
        PathGuard guard = new PathGuard(options.isOverwrite(), warnings);

        ArchiveBundle bundle = ArchiveBundle.intermediates(options.getTarget(), baseName);
        for (Path intermediate : bundle.getIntermediates()) {
            guard.guard(intermediate);
        }

        log.info("Extracting DICOM information (may take a long time)");
        DicomSummary summary = extractor.extract(source);

        Optional<RegistrySynchronizer> synchronizer = registry.map(
                r -> new RegistrySynchronizer(r, options.getRegistryAction()));
        if (synchronizer.isPresent()) {
            synchronizer.get().checkPrecondition(summary);
        }

        log.info("Copying into DICOM tar");
        int fileCount = assembler.pack(source, bundle.getTarPath());
        log.debug("{} files packed", fileCount);

        log.info("Calculating DICOM tar MD5 sum");
        String tarballChecksum = checksum(bundle.getTarPath());

        log.info("Zipping DICOM tar (may take a long time)");
        assembler.compress(bundle.getTarPath(), bundle.getZipPath());

        log.info("Calculating DICOM zip MD5 sum");
        String zipballChecksum = checksum(bundle.getZipPath());

        log.info("Getting DICOM scan date");
        ArchiveDestination destination = ArchiveNaming.resolve(options.getTarget(), baseName,
                summary.getScanDate(), options.isToday() ? LocalDate.now(clock) : null, options.isYearBucket());
        destination.getAdvisories().forEach(warnings);
        if (destination.isYearBucket()) {
            guard.ensureDirectory(destination.getDirectory());
        }

        bundle = bundle.withArchivePath(destination.getArchivePath());
        guard.guard(bundle.getArchivePath());

        ProvenanceLog provenance = ProvenanceLog.create(source, bundle.getArchivePath(),
                tarballChecksum, zipballChecksum, clock);

        if (options.isVerbose()) {
            out.println("The archive will be created with the following arguments:");
            out.println(ProvenanceLogWriter.writeToString(provenance));
        }

        log.info("Writing summary file");
        try {
            SummaryWriter.writeToFile(bundle.getSummaryPath(), summary);
        } catch (IOException e) {
            throw ioFailure("write summary file", bundle.getSummaryPath(), e);
        }

        log.info("Writing log file");
        try {
            ProvenanceLogWriter.writeToFile(bundle.getLogPath(), provenance);
        } catch (IOException e) {
            throw ioFailure("write log file", bundle.getLogPath(), e);
        }

        log.info("Copying into DICOM archive");
        assembler.seal(bundle);

        log.info("Calculating DICOM archive MD5 sum");
        provenance.setArchiveChecksum(checksum(bundle.getArchivePath()));

        log.info("Removing temporary files");
        new IntermediateCleanup(warnings).cleanup(bundle);

        if (synchronizer.isPresent()) {
            synchronizer.get().commit(provenance, summary);
        }

        log.info("Success: {}", bundle.getArchivePath());
        return new Result(bundle.getArchivePath(), provenance, summary);
    }

    private static String checksum(Path path) throws ArchiveException {
        try {
            return Checksums.md5(path);
        } catch (IOException e) {
            throw ioFailure("hash", path, e);
        }
    }

    private static ArchiveException ioFailure(String action, Path path, IOException e) {
        return new ArchiveException(ArchiveException.Kind.IO_FAILURE,
                "Failed to " + action + " '" + path + "': " + e.getMessage(), e);
    }

    /**
     * Outcome of a successful run.
     */
    public static class Result {
        private final Path archivePath;
        private final ProvenanceLog provenance;
        private final DicomSummary summary;

        Result(Path archivePath, ProvenanceLog provenance, DicomSummary summary) {
            this.archivePath = archivePath;
            this.provenance = provenance;
            this.summary = summary;
        }

        public Path getArchivePath() { return archivePath; }
        public ProvenanceLog getProvenance() { return provenance; }
        public DicomSummary getSummary() { return summary; }
    }
}
