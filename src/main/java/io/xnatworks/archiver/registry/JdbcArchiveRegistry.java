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
import io.xnatworks.archiver.provenance.ProvenanceLogWriter;
import io.xnatworks.archiver.summary.DicomSummary;
import io.xnatworks.archiver.summary.SummaryWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.*;
import java.time.Instant;
import java.time.LocalDate;
import java.util.Optional;

/**
 * {@link ArchiveRegistry} backed by a JDBC database (SQLite by default).
 *
 * <p>Tables:
 * <ul>
 *   <li>{@code dicom_archive} - one row per study, {@code study_uid} is UNIQUE</li>
 *   <li>{@code dicom_archive_series} - acquisitions of an archived study</li>
 *   <li>{@code dicom_archive_file} - files of an archived study with their MD5</li>
 * </ul>
 * </p>
 *
 * <p>The UNIQUE constraint is what stops two concurrent runs from both inserting the
 * same study: the loser's insert fails and is reported as an insert conflict.</p>
 */
public class JdbcArchiveRegistry implements ArchiveRegistry {
    private static final Logger log = LoggerFactory.getLogger(JdbcArchiveRegistry.class);

    /**
     * Columns written by both insert and update, in bind order.
     */
    private static final String[] ARCHIVE_COLUMNS = {
            "patient_id", "patient_name", "patient_sex", "patient_birth_date",
            "scan_date", "modality", "institution_name",
            "scanner_manufacturer", "scanner_model", "scanner_serial_number", "scanner_software_version",
            "source_location", "archive_location",
            "md5_tarball", "md5_zipball", "md5_archive",
            "creating_user", "summary_version", "archive_version",
            "dicom_file_count", "other_file_count", "acquisition_count",
            "date_last_archived", "provenance_log", "provenance_json", "summary_text"
    };

    private final Connection connection;

    /**
     * Wrap an open connection, creating the tables if needed. The connection is closed
     * when the tables cannot be created.
     */
    public JdbcArchiveRegistry(Connection connection) throws ArchiveException {
        this.connection = connection;
        try {
            createTables();
        } catch (SQLException e) {
            ArchiveException failure = new ArchiveException(ArchiveException.Kind.REGISTRY_FAILURE,
                    "Failed to initialize archive registry: " + e.getMessage(), e);
            try {
                connection.close();
            } catch (SQLException closeError) {
                failure.addSuppressed(closeError);
            }
            throw failure;
        }
    }

    /**
     * Connect to the registry database.
     *
     * @param url      JDBC URL, e.g. {@code jdbc:sqlite:/var/lib/dicom-archiver/registry.db}
     * @param username may be null
     * @param password may be null
     */
    public static JdbcArchiveRegistry connect(String url, String username, String password)
            throws ArchiveException {
        try {
            Connection connection = username != null
                    ? DriverManager.getConnection(url, username, password)
                    : DriverManager.getConnection(url);
            log.debug("Connected to archive registry {}", url);
            return new JdbcArchiveRegistry(connection);
        } catch (SQLException e) {
            throw new ArchiveException(ArchiveException.Kind.REGISTRY_FAILURE,
                    "Could not connect to archive registry '" + url + "': " + e.getMessage(), e);
        }
    }

    private void createTables() throws SQLException {
        try (Statement stmt = connection.createStatement()) {
            stmt.execute(
                "CREATE TABLE IF NOT EXISTS dicom_archive (" +
                "    id INTEGER PRIMARY KEY AUTOINCREMENT," +
                "    study_uid TEXT NOT NULL UNIQUE," +
                "    patient_id TEXT," +
                "    patient_name TEXT," +
                "    patient_sex TEXT," +
                "    patient_birth_date TEXT," +
                "    scan_date TEXT," +
                "    modality TEXT," +
                "    institution_name TEXT," +
                "    scanner_manufacturer TEXT," +
                "    scanner_model TEXT," +
                "    scanner_serial_number TEXT," +
                "    scanner_software_version TEXT," +
                "    source_location TEXT NOT NULL," +
                "    archive_location TEXT NOT NULL," +
                "    md5_tarball TEXT NOT NULL," +
                "    md5_zipball TEXT NOT NULL," +
                "    md5_archive TEXT NOT NULL," +
                "    creating_user TEXT," +
                "    summary_version INTEGER," +
                "    archive_version INTEGER," +
                "    dicom_file_count INTEGER DEFAULT 0," +
                "    other_file_count INTEGER DEFAULT 0," +
                "    acquisition_count INTEGER DEFAULT 0," +
                "    date_first_archived TEXT NOT NULL," +
                "    date_last_archived TEXT NOT NULL," +
                "    provenance_log TEXT NOT NULL," +
                "    provenance_json TEXT," +
                "    summary_text TEXT" +
                ")");

            stmt.execute(
                "CREATE TABLE IF NOT EXISTS dicom_archive_series (" +
                "    id INTEGER PRIMARY KEY AUTOINCREMENT," +
                "    archive_id INTEGER NOT NULL," +
                "    series_uid TEXT NOT NULL," +
                "    series_number INTEGER," +
                "    series_description TEXT," +
                "    modality TEXT," +
                "    file_count INTEGER DEFAULT 0," +
                "    FOREIGN KEY (archive_id) REFERENCES dicom_archive(id)" +
                ")");

            stmt.execute(
                "CREATE TABLE IF NOT EXISTS dicom_archive_file (" +
                "    id INTEGER PRIMARY KEY AUTOINCREMENT," +
                "    archive_id INTEGER NOT NULL," +
                "    file_name TEXT NOT NULL," +
                "    md5 TEXT NOT NULL," +
                "    series_uid TEXT," +
                "    FOREIGN KEY (archive_id) REFERENCES dicom_archive(id)" +
                ")");

            stmt.execute("CREATE INDEX IF NOT EXISTS idx_archive_series_archive ON dicom_archive_series(archive_id)");
            stmt.execute("CREATE INDEX IF NOT EXISTS idx_archive_file_archive ON dicom_archive_file(archive_id)");
        }
    }

    @Override
    public Optional<StudyRecord> lookup(String studyUid) throws ArchiveException {
        String sql = "SELECT id, study_uid, archive_location, provenance_log, date_first_archived, " +
                     "date_last_archived FROM dicom_archive WHERE study_uid = ?";
        try (PreparedStatement stmt = connection.prepareStatement(sql)) {
            stmt.setString(1, studyUid);
            try (ResultSet rs = stmt.executeQuery()) {
                if (rs.next()) {
                    return Optional.of(new StudyRecord(
                            rs.getLong("id"),
                            rs.getString("study_uid"),
                            rs.getString("archive_location"),
                            rs.getString("provenance_log"),
                            rs.getString("date_first_archived"),
                            rs.getString("date_last_archived")));
                }
                return Optional.empty();
            }
        } catch (SQLException e) {
            throw new ArchiveException(ArchiveException.Kind.REGISTRY_FAILURE,
                    "Failed to look up study '" + studyUid + "': " + e.getMessage(), e);
        }
    }

    @Override
    public void insert(ProvenanceLog provenance, DicomSummary summary) throws ArchiveException {
        StringBuilder sql = new StringBuilder("INSERT INTO dicom_archive (study_uid, date_first_archived");
        StringBuilder values = new StringBuilder(" VALUES (?, ?");
        for (String column : ARCHIVE_COLUMNS) {
            sql.append(", ").append(column);
            values.append(", ?");
        }
        sql.append(")").append(values).append(")");

        String now = Instant.now().toString();
        try {
            connection.setAutoCommit(false);
            try (PreparedStatement stmt = connection.prepareStatement(sql.toString())) {
                stmt.setString(1, summary.getStudyUid());
                stmt.setString(2, now);
                bindArchiveColumns(stmt, 3, provenance, summary, now);
                stmt.executeUpdate();
            }
            long archiveId = archiveId(summary.getStudyUid());
            insertChildren(archiveId, summary);
            connection.commit();
            log.info("Inserted study {} into the archive registry (id {})", summary.getStudyUid(), archiveId);
        } catch (SQLException e) {
            rollback();
            Optional<StudyRecord> existing = lookup(summary.getStudyUid());
            if (existing.isPresent()) {
                throw new ArchiveException(ArchiveException.Kind.INSERT_CONFLICT,
                        RegistrySynchronizer.insertConflictMessage(summary.getStudyUid(), existing.get()), e);
            }
            throw new ArchiveException(ArchiveException.Kind.REGISTRY_FAILURE,
                    "Failed to insert study '" + summary.getStudyUid() + "': " + e.getMessage(), e);
        } finally {
            restoreAutoCommit();
        }
    }

    @Override
    public void update(StudyRecord existing, ProvenanceLog provenance, DicomSummary summary)
            throws ArchiveException {
        StringBuilder sql = new StringBuilder("UPDATE dicom_archive SET ");
        for (int i = 0; i < ARCHIVE_COLUMNS.length; i++) {
            if (i > 0) {
                sql.append(", ");
            }
            sql.append(ARCHIVE_COLUMNS[i]).append(" = ?");
        }
        sql.append(" WHERE id = ?");

        try {
            connection.setAutoCommit(false);
            int updated;
            try (PreparedStatement stmt = connection.prepareStatement(sql.toString())) {
                int next = bindArchiveColumns(stmt, 1, provenance, summary, Instant.now().toString());
                stmt.setLong(next, existing.getId());
                updated = stmt.executeUpdate();
            }
            if (updated == 0) {
                connection.rollback();
                throw new ArchiveException(ArchiveException.Kind.UPDATE_CONFLICT,
                        "No study '" + summary.getStudyUid() + "' found in the database");
            }
            deleteChildren(existing.getId());
            insertChildren(existing.getId(), summary);
            connection.commit();
            log.info("Updated study {} in the archive registry (id {})", summary.getStudyUid(), existing.getId());
        } catch (SQLException e) {
            rollback();
            throw new ArchiveException(ArchiveException.Kind.REGISTRY_FAILURE,
                    "Failed to update study '" + summary.getStudyUid() + "': " + e.getMessage(), e);
        } finally {
            restoreAutoCommit();
        }
    }

    /**
     * Bind {@link #ARCHIVE_COLUMNS} starting at {@code index}.
     *
     * @return the next free parameter index
     */
    private int bindArchiveColumns(PreparedStatement stmt, int index, ProvenanceLog provenance,
                                   DicomSummary summary, String now) throws SQLException {
        DicomSummary.PatientInfo patient = summary.getPatient();
        DicomSummary.ScannerInfo scanner = summary.getScanner();

        stmt.setString(index++, patient.getId());
        stmt.setString(index++, patient.getName());
        stmt.setString(index++, patient.getSex());
        stmt.setString(index++, date(patient.getBirthDate()));
        stmt.setString(index++, date(summary.getScanDate()));
        stmt.setString(index++, summary.getModality());
        stmt.setString(index++, summary.getInstitution());
        stmt.setString(index++, scanner.getManufacturer());
        stmt.setString(index++, scanner.getModel());
        stmt.setString(index++, scanner.getSerialNumber());
        stmt.setString(index++, scanner.getSoftwareVersion());
        stmt.setString(index++, provenance.getSourcePath());
        stmt.setString(index++, provenance.getTargetPath());
        stmt.setString(index++, provenance.getTarballChecksum());
        stmt.setString(index++, provenance.getZipballChecksum());
        stmt.setString(index++, provenance.getArchiveChecksum());
        stmt.setString(index++, provenance.getCreatingUser());
        stmt.setInt(index++, provenance.getSummaryVersion());
        stmt.setInt(index++, provenance.getArchiveVersion());
        stmt.setInt(index++, summary.getDicomFiles().size());
        stmt.setInt(index++, summary.getOtherFiles().size());
        stmt.setInt(index++, summary.getAcquisitions().size());
        stmt.setString(index++, now);
        stmt.setString(index++, ProvenanceLogWriter.writeToString(provenance));
        stmt.setString(index++, ProvenanceLogWriter.toJson(provenance));
        stmt.setString(index++, SummaryWriter.writeToString(summary));
        return index;
    }

    private long archiveId(String studyUid) throws SQLException {
        try (PreparedStatement stmt = connection.prepareStatement(
                "SELECT id FROM dicom_archive WHERE study_uid = ?")) {
            stmt.setString(1, studyUid);
            try (ResultSet rs = stmt.executeQuery()) {
                if (!rs.next()) {
                    throw new SQLException("Inserted study not found: " + studyUid);
                }
                return rs.getLong(1);
            }
        }
    }

    private void insertChildren(long archiveId, DicomSummary summary) throws SQLException {
        String seriesSql = "INSERT INTO dicom_archive_series (archive_id, series_uid, series_number, " +
                           "series_description, modality, file_count) VALUES (?, ?, ?, ?, ?, ?)";
        try (PreparedStatement stmt = connection.prepareStatement(seriesSql)) {
            for (DicomSummary.Acquisition acquisition : summary.getAcquisitions()) {
                stmt.setLong(1, archiveId);
                stmt.setString(2, acquisition.getSeriesUid());
                if (acquisition.getSeriesNumber() != null) {
                    stmt.setInt(3, acquisition.getSeriesNumber());
                } else {
                    stmt.setNull(3, Types.INTEGER);
                }
                stmt.setString(4, acquisition.getSeriesDescription());
                stmt.setString(5, acquisition.getModality());
                stmt.setInt(6, acquisition.getFileCount());
                stmt.addBatch();
            }
            stmt.executeBatch();
        }

        String fileSql = "INSERT INTO dicom_archive_file (archive_id, file_name, md5, series_uid) " +
                         "VALUES (?, ?, ?, ?)";
        try (PreparedStatement stmt = connection.prepareStatement(fileSql)) {
            for (DicomSummary.DicomFileEntry file : summary.getDicomFiles()) {
                stmt.setLong(1, archiveId);
                stmt.setString(2, file.getFileName());
                stmt.setString(3, file.getMd5());
                stmt.setString(4, file.getSeriesUid());
                stmt.addBatch();
            }
            for (DicomSummary.OtherFileEntry file : summary.getOtherFiles()) {
                stmt.setLong(1, archiveId);
                stmt.setString(2, file.getFileName());
                stmt.setString(3, file.getMd5());
                stmt.setNull(4, Types.VARCHAR);
                stmt.addBatch();
            }
            stmt.executeBatch();
        }
    }

    private void deleteChildren(long archiveId) throws SQLException {
        for (String table : new String[]{"dicom_archive_series", "dicom_archive_file"}) {
            try (PreparedStatement stmt = connection.prepareStatement(
                    "DELETE FROM " + table + " WHERE archive_id = ?")) {
                stmt.setLong(1, archiveId);
                stmt.executeUpdate();
            }
        }
    }

    private void rollback() {
        try {
            connection.rollback();
        } catch (SQLException e) {
            log.error("Failed to roll back registry transaction: {}", e.getMessage(), e);
        }
    }

    private void restoreAutoCommit() {
        try {
            connection.setAutoCommit(true);
        } catch (SQLException e) {
            log.error("Failed to restore auto-commit: {}", e.getMessage(), e);
        }
    }

    private static String date(LocalDate date) {
        return date != null ? date.toString() : null;
    }

    @Override
    public void close() {
        try {
            if (connection != null && !connection.isClosed()) {
                connection.close();
                log.debug("Archive registry closed");
            }
        } catch (SQLException e) {
            log.error("Error closing archive registry: {}", e.getMessage(), e);
        }
    }
}
