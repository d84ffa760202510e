/*
 * DICOM Archiver
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 *
 * This software is distributed under the terms described in the LICENSE file.
 */
package io.xnatworks.archiver.registry;

/**
 * Registry entry of an archived study, as read back by {@link ArchiveRegistry#lookup(String)}.
 */
public class StudyRecord {
    private final long id;
    private final String studyUid;
    private final String archiveLocation;
    private final String provenanceLog;
    private final String dateFirstArchived;
    private final String dateLastArchived;

    public StudyRecord(long id, String studyUid, String archiveLocation, String provenanceLog,
                       String dateFirstArchived, String dateLastArchived) {
        this.id = id;
        this.studyUid = studyUid;
        this.archiveLocation = archiveLocation;
        this.provenanceLog = provenanceLog;
        this.dateFirstArchived = dateFirstArchived;
        this.dateLastArchived = dateLastArchived;
    }

    public long getId() { return id; }
    public String getStudyUid() { return studyUid; }
    public String getArchiveLocation() { return archiveLocation; }

    /**
     * Text rendering of the provenance log stored with the last insert or update.
     */
    public String getProvenanceLog() { return provenanceLog; }

    public String getDateFirstArchived() { return dateFirstArchived; }
    public String getDateLastArchived() { return dateLastArchived; }

    @Override
    public String toString() {
        return "StudyRecord{id=" + id + ", studyUid=" + studyUid + ", archiveLocation=" + archiveLocation + "}";
    }
}
