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
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * Applies the insert / update policy of a run against the registry.
 *
 * <p>{@link #checkPrecondition} runs before any archive byte is written and fails fast;
 * {@link #commit} runs after the archive is sealed and its checksum known. The two
 * steps are not one transaction: a crash in between leaves a sealed archive with no
 * registry record.</p>
 */
public class RegistrySynchronizer {
    private static final Logger log = LoggerFactory.getLogger(RegistrySynchronizer.class);

    private final ArchiveRegistry registry;
    private final RegistryAction action;

    private boolean checked;
    private StudyRecord existing;

    public RegistrySynchronizer(ArchiveRegistry registry, RegistryAction action) {
        this.registry = registry;
        this.action = action;
    }

    /**
     * Look the study up and verify the requested action can proceed.
     *
     * @return the existing record, if any
     * @throws ArchiveException {@code INSERT_CONFLICT} when inserting a registered study (the
     *                          message quotes the previous log), {@code UPDATE_CONFLICT} when
     *                          updating an unknown one
     */
    public Optional<StudyRecord> checkPrecondition(DicomSummary summary) throws ArchiveException {
        String studyUid = summary.getStudyUid();
        log.info("Checking database presence");

        Optional<StudyRecord> found = registry.lookup(studyUid);

        if (action == RegistryAction.INSERT && found.isPresent()) {
            throw new ArchiveException(ArchiveException.Kind.INSERT_CONFLICT,
                    insertConflictMessage(studyUid, found.get()));
        }
        if (action == RegistryAction.UPDATE && found.isEmpty()) {
            throw new ArchiveException(ArchiveException.Kind.UPDATE_CONFLICT,
                    "No study '" + studyUid + "' found in the database");
        }
        if (action == RegistryAction.NONE && found.isPresent()) {
            log.warn("Study '{}' is already archived at '{}'; the registry will not be changed",
                    studyUid, found.get().getArchiveLocation());
        }

        checked = true;
        existing = found.orElse(null);
        return found;
    }

    /**
     * Perform the insert or update with the completed provenance log.
     *
     * @throws IllegalStateException if the precondition was not checked or the archive
     *                               checksum is missing
     */
    public void commit(ProvenanceLog provenance, DicomSummary summary) throws ArchiveException {
        if (!checked) {
            throw new IllegalStateException("Registry precondition not checked for " + summary.getStudyUid());
        }
        if (action == RegistryAction.NONE) {
            return;
        }
        if (provenance.getArchiveChecksum() == null) {
            throw new IllegalStateException("Archive checksum not computed for " + provenance.getTargetPath());
        }

        if (action == RegistryAction.INSERT) {
            registry.insert(provenance, summary);
        } else {
            registry.update(existing, provenance, summary);
        }
    }

    static String insertConflictMessage(String studyUid, StudyRecord existing) {
        return "Study '" + studyUid + "' is already inserted in the database\n" +
               "Previous archiving log:\n" +
               existing.getProvenanceLog();
    }
}
