/*
 * DICOM Archiver
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 */
package io.xnatworks.archiver.registry;

import io.xnatworks.archiver.ArchiveException;
import io.xnatworks.archiver.provenance.ProvenanceLog;
import io.xnatworks.archiver.summary.DicomSummary;
import org.junit.jupiter.api.*;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for RegistrySynchronizer.
 */
@DisplayName("RegistrySynchronizer Tests")
class RegistrySynchronizerTest {

    /**
     * Registry kept in memory that records the writes it receives.
     */
    static class RecordingRegistry implements ArchiveRegistry {
        final Map<String, StudyRecord> records = new HashMap<>();
        final List<String> writes = new ArrayList<>();

        @Override
        public Optional<StudyRecord> lookup(String studyUid) {
            return Optional.ofNullable(records.get(studyUid));
        }

        @Override
        public void insert(ProvenanceLog provenance, DicomSummary summary) {
            writes.add("insert " + summary.getStudyUid());
            records.put(summary.getStudyUid(), new StudyRecord(records.size() + 1, summary.getStudyUid(),
                    provenance.getTargetPath(), "log", "first", "last"));
        }

        @Override
        public void update(StudyRecord existing, ProvenanceLog provenance, DicomSummary summary) {
            writes.add("update " + existing.getId());
        }

        @Override
        public void close() {
        }
    }

    private final RecordingRegistry registry = new RecordingRegistry();
    private final DicomSummary summary = DicomSummary.builder("1.2.3").build();

    private ProvenanceLog sealedLog() {
        ProvenanceLog log = JdbcArchiveRegistryTest.provenance("/data/archive/DCM_Subj01.tar", null);
        log.setArchiveChecksum("md5a");
        return log;
    }

    private void register(String studyUid) {
        registry.records.put(studyUid, new StudyRecord(7, studyUid, "/data/archive/old.tar",
                "* Taken from dir : /old", "first", "last"));
    }

    @Nested
    @DisplayName("Precondition Tests")
    class PreconditionTests {

        @Test
        @DisplayName("Should refuse to insert a registered study and quote its log")
        void insert_Registered_ShouldConflict() {
            register("1.2.3");
            RegistrySynchronizer synchronizer = new RegistrySynchronizer(registry, RegistryAction.INSERT);

            ArchiveException ex = assertThrows(ArchiveException.class,
                    () -> synchronizer.checkPrecondition(summary));

            assertEquals(ArchiveException.Kind.INSERT_CONFLICT, ex.getKind());
            assertTrue(ex.getMessage().startsWith("Study '1.2.3' is already inserted in the database"));
            assertTrue(ex.getMessage().endsWith("* Taken from dir : /old"));
        }

        @Test
        @DisplayName("Should refuse to update an unknown study")
        void update_Unknown_ShouldConflict() {
            RegistrySynchronizer synchronizer = new RegistrySynchronizer(registry, RegistryAction.UPDATE);

            ArchiveException ex = assertThrows(ArchiveException.class,
                    () -> synchronizer.checkPrecondition(summary));

            assertEquals(ArchiveException.Kind.UPDATE_CONFLICT, ex.getKind());
        }

        @Test
        @DisplayName("Should only look up when no action is requested")
        void none_Registered_ShouldPass() throws Exception {
            register("1.2.3");
            RegistrySynchronizer synchronizer = new RegistrySynchronizer(registry, RegistryAction.NONE);

            Optional<StudyRecord> found = synchronizer.checkPrecondition(summary);

            assertTrue(found.isPresent());
            synchronizer.commit(sealedLog(), summary);
            assertTrue(registry.writes.isEmpty());
        }
    }

    @Nested
    @DisplayName("Commit Tests")
    class CommitTests {

        @Test
        @DisplayName("Should insert after a passing precondition")
        void commit_Insert_ShouldInsert() throws Exception {
            RegistrySynchronizer synchronizer = new RegistrySynchronizer(registry, RegistryAction.INSERT);
            synchronizer.checkPrecondition(summary);

            synchronizer.commit(sealedLog(), summary);

            assertEquals(List.of("insert 1.2.3"), registry.writes);
        }

        @Test
        @DisplayName("Should update the record found by the precondition")
        void commit_Update_ShouldUpdateExisting() throws Exception {
            register("1.2.3");
            RegistrySynchronizer synchronizer = new RegistrySynchronizer(registry, RegistryAction.UPDATE);
            synchronizer.checkPrecondition(summary);

            synchronizer.commit(sealedLog(), summary);

            assertEquals(List.of("update 7"), registry.writes);
        }

        @Test
        @DisplayName("Should refuse to commit before the precondition")
        void commit_WithoutPrecondition_ShouldThrow() {
            RegistrySynchronizer synchronizer = new RegistrySynchronizer(registry, RegistryAction.INSERT);

            assertThrows(IllegalStateException.class, () -> synchronizer.commit(sealedLog(), summary));
            assertTrue(registry.writes.isEmpty());
        }

        @Test
        @DisplayName("Should refuse to commit without the archive checksum")
        void commit_WithoutChecksum_ShouldThrow() throws Exception {
            RegistrySynchronizer synchronizer = new RegistrySynchronizer(registry, RegistryAction.INSERT);
            synchronizer.checkPrecondition(summary);
            ProvenanceLog unsealed = JdbcArchiveRegistryTest.provenance("/data/archive/DCM_Subj01.tar", null);

            assertThrows(IllegalStateException.class, () -> synchronizer.commit(unsealed, summary));
            assertTrue(registry.writes.isEmpty());
        }
    }
}
