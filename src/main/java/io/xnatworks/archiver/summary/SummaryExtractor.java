/*
 * DICOM Archiver
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 *
 * This software is distributed under the terms described in the LICENSE file.
 */
package io.xnatworks.archiver.summary;

import io.xnatworks.archiver.ArchiveException;

import java.nio.file.Path;

/**
 * Reads the DICOM headers of a source directory into a {@link DicomSummary}.
 */
public interface SummaryExtractor {

    /**
     * @param sourceDir the study directory, read only
     * @throws ArchiveException {@code INVALID_ARGUMENT} when no study can be identified,
     *                          {@code IO_FAILURE} when the directory cannot be read
     */
    DicomSummary extract(Path sourceDir) throws ArchiveException;
}
