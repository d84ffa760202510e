/*
 * DICOM Archiver
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 *
 * This software is distributed under the terms described in the LICENSE file.
 */
package io.xnatworks.archiver.registry;

import io.xnatworks.archiver.ArchiveException;
import io.xnatworks.archiver.provenance.ProvenanceLog;
import io.xnatworks.archiver.summary.DicomSummary;

import java.util.Optional;

/**
 * Persistent store of archived studies, keyed by Study Instance UID.
 *
 * <p>Records are created only by {@link #insert} and changed only by {@link #update};
 * lookups never create anything.</p>
 */
public interface ArchiveRegistry extends AutoCloseable {

    /**
     * Find the record of a study.
     *
     * @throws ArchiveException {@code REGISTRY_FAILURE} if the store cannot be queried
     */
    Optional<StudyRecord> lookup(String studyUid) throws ArchiveException;

    /**
     * Create the record of a newly archived study.
     *
     * @throws ArchiveException {@code INSERT_CONFLICT} if the study is already registered,
     *                          {@code REGISTRY_FAILURE} on any other store error
     */
    void insert(ProvenanceLog provenance, DicomSummary summary) throws ArchiveException;

    /**
     * Replace the record of a study that was archived again.
     *
     * @throws ArchiveException {@code UPDATE_CONFLICT} if the record no longer exists,
     *                          {@code REGISTRY_FAILURE} on any other store error
     */
    void update(StudyRecord existing, ProvenanceLog provenance, DicomSummary summary) throws ArchiveException;

    @Override
    void close();
}
