/*
 * DICOM Archiver
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 *
 * This software is distributed under the terms described in the LICENSE file.
 */
package io.xnatworks.archiver;

/**
 * Fatal condition that ends an archiving run.
 *
 * <p>Every failure carries a {@link Kind}; the command line boundary turns the kind
 * into the process exit status. Nothing below {@link DicomArchiver} exits the JVM.</p>
 */
public class ArchiveException extends Exception {

    /**
     * Failure categories, each with its own exit status.
     */
    public enum Kind {
        INVALID_ARGUMENT(2),
        MISSING_CONFIGURATION(3),
        TARGET_EXISTS(4),
        DIRECTORY_UNUSABLE(5),
        INSERT_CONFLICT(6),
        UPDATE_CONFLICT(7),
        IO_FAILURE(8),
        REGISTRY_FAILURE(9);

        private final int exitCode;

        Kind(int exitCode) {
            this.exitCode = exitCode;
        }

        public int getExitCode() {
            return exitCode;
        }
    }

    private final Kind kind;

    public ArchiveException(Kind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public ArchiveException(Kind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public Kind getKind() {
        return kind;
    }

    public int getExitCode() {
        return kind.getExitCode();
    }
}
