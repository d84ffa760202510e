/*
 * DICOM Archiver
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 *
 * This software is distributed under the terms described in the LICENSE file.
 */
package io.xnatworks.archiver;

import ch.qos.logback.classic.Level;
import io.xnatworks.archiver.config.ArchiveProfile;
import io.xnatworks.archiver.config.ProfileLoader;
import io.xnatworks.archiver.registry.ArchiveRegistry;
import io.xnatworks.archiver.registry.JdbcArchiveRegistry;
import io.xnatworks.archiver.registry.RegistryAction;
import io.xnatworks.archiver.summary.DicomSummaryExtractor;
import io.xnatworks.archiver.summary.SummaryExtractor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.*;

import java.io.File;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Callable;

/**
 * DICOM Archiver - Main Application
 *
 * Reads a DICOM study directory, packs it into a checksummed, compressed archive
 * and optionally records the archive in the registry:
 * - Refuses to overwrite existing files unless asked to
 * - Names the archive after the scan date (optionally under a year directory)
 * - Inserts or updates the study record when a connection profile is given
 *
 * This class only turns command line options into {@link ArchiveOptions} and maps
 * failures to exit codes; the run itself is {@link ArchiveRun}.
 */
@Command(name = "dicom-archiver",
        mixinStandardHelpOptions = true,
        version = "1.0.0",
        exitCodeOnInvalidInput = 2,
        description = "Read a DICOM directory, process it into a structured and compressed archive, " +
                      "and insert it or update it in the archive registry.")
public class DicomArchiver implements Callable<Integer> {
    private static final Logger log = LoggerFactory.getLogger(DicomArchiver.class);

    @Option(names = {"--profile"}, description = "The registry connection profile (usually 'database.yaml')")
    private String profile;

    @Option(names = {"--verbose"}, description = "Print the provenance log before writing and enable debug logging")
    private boolean verbose;

    @Option(names = {"--today"},
            description = "Use today's date for the archive name when no scan date is found")
    private boolean today;

    @Option(names = {"--year"},
            description = "Create the archive in a year subdirectory (example: 2024/DCM_2024-08-27_FooBar.tar)")
    private boolean year;

    @Option(names = {"--overwrite"}, description = "Overwrite the DICOM archive file if it already exists")
    private boolean overwrite;

    @ArgGroup(exclusive = true, multiplicity = "0..1")
    private DbAction dbAction;

    @Option(names = {"--source"}, paramLabel = "<source>", description = "The source DICOM directory")
    private File sourceOption;

    @Option(names = {"--target"}, paramLabel = "<target>", description = "The target directory for the DICOM archive")
    private File targetOption;

    @Parameters(arity = "0..2", paramLabel = "<source> <target>",
            description = "The source DICOM directory and the target directory, unless given as options")
    private List<File> positionals = new ArrayList<>();

    @Spec
    private Model.CommandSpec spec;

    private final SummaryExtractor extractor;

    static class DbAction {
        @Option(names = {"--db-insert"}, required = true,
                description = "Insert the created DICOM archive in the registry (requires the archive " +
                              "to not be already inserted)")
        boolean insert;

        @Option(names = {"--db-update"}, required = true,
                description = "Update the DICOM archive in the registry (requires the archive to be " +
                              "already inserted), generally used with '--overwrite'")
        boolean update;
    }

    public DicomArchiver() {
        this(new DicomSummaryExtractor());
    }

    DicomArchiver(SummaryExtractor extractor) {
        this.extractor = extractor;
    }

    public static void main(String[] args) {
        int exitCode = newCommandLine(new DicomArchiver()).execute(args);
        System.exit(exitCode);
    }

    static CommandLine newCommandLine(DicomArchiver archiver) {
        return new CommandLine(archiver)
                .setExecutionExceptionHandler(DicomArchiver::handleExecutionException);
    }

    @Override
    public Integer call() throws Exception {
        ArchiveOptions options = toOptions();
        if (options.isVerbose()) {
            enableDebugLogging();
        }
        log.debug("Options: {}", options);
        options.validate();

        ArchiveRegistry registry = null;
        try {
            if (options.hasProfile()) {
                ArchiveProfile archiveProfile = new ProfileLoader().load(options.getProfile());
                ArchiveProfile.RegistryConfig db = archiveProfile.getRegistry();
                registry = JdbcArchiveRegistry.connect(db.getUrl(), db.getUsername(), db.getPassword());
            }

            ArchiveRun.Result result = new ArchiveRun(options, extractor, Optional.ofNullable(registry)).execute();
            spec.commandLine().getOut().println("Success: " + result.getArchivePath());
            return 0;
        } finally {
            if (registry != null) {
                registry.close();
            }
        }
    }

    /**
     * Build the run options from the parsed command line.
     */
    ArchiveOptions toOptions() throws ArchiveException {
        Deque<File> remaining = new ArrayDeque<>(positionals);
        File source = sourceOption != null ? sourceOption : remaining.pollFirst();
        File target = targetOption != null ? targetOption : remaining.pollFirst();
        if (!remaining.isEmpty()) {
            throw new ArchiveException(ArchiveException.Kind.INVALID_ARGUMENT,
                    "Unexpected parameter '" + remaining.peekFirst() + "'.");
        }
        if (source == null || target == null) {
            throw new ArchiveException(ArchiveException.Kind.INVALID_ARGUMENT,
                    "Argument '" + (source == null ? "source" : "target") + "' is required.");
        }

        RegistryAction action = RegistryAction.NONE;
        if (dbAction != null) {
            action = dbAction.insert ? RegistryAction.INSERT : RegistryAction.UPDATE;
        }

        return ArchiveOptions.builder()
                .source(source.toPath())
                .target(target.toPath())
                .profile(profile)
                .verbose(verbose)
                .today(today)
                .yearBucket(year)
                .overwrite(overwrite)
                .registryAction(action)
                .build();
    }

    private static void enableDebugLogging() {
        Logger root = LoggerFactory.getLogger("io.xnatworks.archiver");
        if (root instanceof ch.qos.logback.classic.Logger) {
            ((ch.qos.logback.classic.Logger) root).setLevel(Level.DEBUG);
        }
    }

    private static int handleExecutionException(Exception ex, CommandLine commandLine, ParseResult parseResult) {
        if (ex instanceof ArchiveException) {
            ArchiveException archiveException = (ArchiveException) ex;
            commandLine.getErr().println("ERROR: " + archiveException.getMessage());
            log.debug("Run failed ({})", archiveException.getKind(), archiveException);
            return archiveException.getExitCode();
        }
        log.error("Unexpected error: {}", ex.getMessage(), ex);
        commandLine.getErr().println("ERROR: " + ex.getMessage());
        return CommandLine.ExitCode.SOFTWARE;
    }
}
