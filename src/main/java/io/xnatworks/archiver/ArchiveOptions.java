/*
 * DICOM Archiver
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 *
 * This software is distributed under the terms described in the LICENSE file.
 */
package io.xnatworks.archiver;

import io.xnatworks.archiver.registry.RegistryAction;

import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Immutable settings of one archiving run.
 *
 * <p>Built once by whatever parses the options (the picocli command, a test) and
 * passed explicitly to every component that needs a flag.</p>
 */
public final class ArchiveOptions {

    private final Path source;
    private final Path target;
    private final String profile;
    private final boolean verbose;
    private final boolean today;
    private final boolean yearBucket;
    private final boolean overwrite;
    private final RegistryAction registryAction;

    private ArchiveOptions(Builder builder) {
        this.source = builder.source.toAbsolutePath().normalize();
        this.target = builder.target.toAbsolutePath().normalize();
        this.profile = builder.profile;
        this.verbose = builder.verbose;
        this.today = builder.today;
        this.yearBucket = builder.yearBucket;
        this.overwrite = builder.overwrite;
        this.registryAction = builder.registryAction;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Check the option combination and the source and target directories.
     *
     * @throws ArchiveException with kind {@code INVALID_ARGUMENT} on the first problem found
     */
    public void validate() throws ArchiveException {
        if (registryAction != RegistryAction.NONE && profile == null) {
            throw new ArchiveException(ArchiveException.Kind.INVALID_ARGUMENT,
                    "Argument '--profile' must be set when a '--db-*' argument is set.");
        }
        if (!Files.isDirectory(source) || !Files.isReadable(source)) {
            throw new ArchiveException(ArchiveException.Kind.INVALID_ARGUMENT,
                    "Argument '--source' must be a readable directory path.");
        }
        if (!Files.isDirectory(target) || !Files.isWritable(target)) {
            throw new ArchiveException(ArchiveException.Kind.INVALID_ARGUMENT,
                    "Argument '--target' must be a writable directory path.");
        }
    }

    /**
     * Base name of the source directory, the stem of every artifact name.
     */
    public String getBaseName() {
        Path fileName = source.getFileName();
        return fileName != null ? fileName.toString() : source.toString();
    }

    public Path getSource() { return source; }
    public Path getTarget() { return target; }
    public String getProfile() { return profile; }
    public boolean isVerbose() { return verbose; }
    public boolean isToday() { return today; }
    public boolean isYearBucket() { return yearBucket; }
    public boolean isOverwrite() { return overwrite; }
    public RegistryAction getRegistryAction() { return registryAction; }

    public boolean hasProfile() {
        return profile != null;
    }

    @Override
    public String toString() {
        return "ArchiveOptions{source=" + source + ", target=" + target + ", profile=" + profile +
                ", today=" + today + ", year=" + yearBucket + ", overwrite=" + overwrite +
                ", registryAction=" + registryAction + "}";
    }

    public static final class Builder {
        private Path source;
        private Path target;
        private String profile;
        private boolean verbose;
        private boolean today;
        private boolean yearBucket;
        private boolean overwrite;
        private RegistryAction registryAction = RegistryAction.NONE;

        private Builder() {
        }

        public Builder source(Path source) { this.source = source; return this; }
        public Builder target(Path target) { this.target = target; return this; }
        public Builder profile(String profile) { this.profile = profile; return this; }
        public Builder verbose(boolean verbose) { this.verbose = verbose; return this; }
        public Builder today(boolean today) { this.today = today; return this; }
        public Builder yearBucket(boolean yearBucket) { this.yearBucket = yearBucket; return this; }
        public Builder overwrite(boolean overwrite) { this.overwrite = overwrite; return this; }

        public Builder registryAction(RegistryAction registryAction) {
            this.registryAction = registryAction != null ? registryAction : RegistryAction.NONE;
            return this;
        }

        public ArchiveOptions build() {
            if (source == null || target == null) {
                throw new IllegalStateException("source and target are required");
            }
            return new ArchiveOptions(this);
        }
    }
}
