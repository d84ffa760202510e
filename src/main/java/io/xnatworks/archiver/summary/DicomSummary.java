/*
 * DICOM Archiver
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 *
 * This software is distributed under the terms described in the LICENSE file.
 */
package io.xnatworks.archiver.summary;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Description of the study found in a source directory.
 *
 * <p>Produced once per run by a {@link SummaryExtractor} and never modified afterwards.
 * Only {@link #getStudyUid()} and {@link #getScanDate()} drive the archiving itself;
 * the rest is written to the summary file and the registry.</p>
 */
public final class DicomSummary {

    private final String studyUid;
    private final LocalDate scanDate;
    private final PatientInfo patient;
    private final ScannerInfo scanner;
    private final String institution;
    private final String modality;
    private final List<DicomFileEntry> dicomFiles;
    private final List<OtherFileEntry> otherFiles;
    private final List<Acquisition> acquisitions;

    private DicomSummary(Builder b) {
        this.studyUid = Objects.requireNonNull(b.studyUid, "studyUid");
        this.scanDate = b.scanDate;
        this.patient = b.patient != null ? b.patient : new PatientInfo(null, null, null, null);
        this.scanner = b.scanner != null ? b.scanner : new ScannerInfo(null, null, null, null);
        this.institution = b.institution;
        this.modality = b.modality;
        this.dicomFiles = Collections.unmodifiableList(new ArrayList<>(b.dicomFiles));
        this.otherFiles = Collections.unmodifiableList(new ArrayList<>(b.otherFiles));
        this.acquisitions = Collections.unmodifiableList(new ArrayList<>(b.acquisitions));
    }

    public static Builder builder(String studyUid) {
        return new Builder(studyUid);
    }

    public String getStudyUid() { return studyUid; }

    /**
     * Scan date of the study, or null when the DICOM headers carry none.
     */
    public LocalDate getScanDate() { return scanDate; }

    public PatientInfo getPatient() { return patient; }
    public ScannerInfo getScanner() { return scanner; }
    public String getInstitution() { return institution; }
    public String getModality() { return modality; }
    public List<DicomFileEntry> getDicomFiles() { return dicomFiles; }
    public List<OtherFileEntry> getOtherFiles() { return otherFiles; }
    public List<Acquisition> getAcquisitions() { return acquisitions; }

    public static final class Builder {
        private final String studyUid;
        private LocalDate scanDate;
        private PatientInfo patient;
        private ScannerInfo scanner;
        private String institution;
        private String modality;
        private final List<DicomFileEntry> dicomFiles = new ArrayList<>();
        private final List<OtherFileEntry> otherFiles = new ArrayList<>();
        private final List<Acquisition> acquisitions = new ArrayList<>();

        private Builder(String studyUid) {
            this.studyUid = studyUid;
        }

        public Builder scanDate(LocalDate scanDate) { this.scanDate = scanDate; return this; }
        public Builder patient(PatientInfo patient) { this.patient = patient; return this; }
        public Builder scanner(ScannerInfo scanner) { this.scanner = scanner; return this; }
        public Builder institution(String institution) { this.institution = institution; return this; }
        public Builder modality(String modality) { this.modality = modality; return this; }
        public Builder addDicomFile(DicomFileEntry file) { this.dicomFiles.add(file); return this; }
        public Builder addOtherFile(OtherFileEntry file) { this.otherFiles.add(file); return this; }
        public Builder addAcquisition(Acquisition acquisition) { this.acquisitions.add(acquisition); return this; }

        public DicomSummary build() {
            return new DicomSummary(this);
        }
    }

    public static final class PatientInfo {
        private final String id;
        private final String name;
        private final String sex;
        private final LocalDate birthDate;

        public PatientInfo(String id, String name, String sex, LocalDate birthDate) {
            this.id = id;
            this.name = name;
            this.sex = sex;
            this.birthDate = birthDate;
        }

        public String getId() { return id; }
        public String getName() { return name; }
        public String getSex() { return sex; }
        public LocalDate getBirthDate() { return birthDate; }
    }

    public static final class ScannerInfo {
        private final String manufacturer;
        private final String model;
        private final String softwareVersion;
        private final String serialNumber;

        public ScannerInfo(String manufacturer, String model, String softwareVersion, String serialNumber) {
            this.manufacturer = manufacturer;
            this.model = model;
            this.softwareVersion = softwareVersion;
            this.serialNumber = serialNumber;
        }

        public String getManufacturer() { return manufacturer; }
        public String getModel() { return model; }
        public String getSoftwareVersion() { return softwareVersion; }
        public String getSerialNumber() { return serialNumber; }
    }

    /**
     * One DICOM file of the source directory. {@code fileName} is relative to the source.
     */
    public static final class DicomFileEntry {
        private final String fileName;
        private final String md5;
        private final String seriesUid;
        private final Integer seriesNumber;
        private final String seriesDescription;
        private final Integer instanceNumber;
        private final Double echoTime;

        public DicomFileEntry(String fileName, String md5, String seriesUid, Integer seriesNumber,
                              String seriesDescription, Integer instanceNumber, Double echoTime) {
            this.fileName = fileName;
            this.md5 = md5;
            this.seriesUid = seriesUid;
            this.seriesNumber = seriesNumber;
            this.seriesDescription = seriesDescription;
            this.instanceNumber = instanceNumber;
            this.echoTime = echoTime;
        }

        public String getFileName() { return fileName; }
        public String getMd5() { return md5; }
        public String getSeriesUid() { return seriesUid; }
        public Integer getSeriesNumber() { return seriesNumber; }
        public String getSeriesDescription() { return seriesDescription; }
        public Integer getInstanceNumber() { return instanceNumber; }
        public Double getEchoTime() { return echoTime; }
    }

    /**
     * A file of the source directory that is not DICOM.
     */
    public static final class OtherFileEntry {
        private final String fileName;
        private final String md5;

        public OtherFileEntry(String fileName, String md5) {
            this.fileName = fileName;
            this.md5 = md5;
        }

        public String getFileName() { return fileName; }
        public String getMd5() { return md5; }
    }

    /**
     * DICOM files sharing one series instance UID.
     */
    public static final class Acquisition {
        private final String seriesUid;
        private final Integer seriesNumber;
        private final String seriesDescription;
        private final String modality;
        private final int fileCount;

        public Acquisition(String seriesUid, Integer seriesNumber, String seriesDescription,
                           String modality, int fileCount) {
            this.seriesUid = seriesUid;
            this.seriesNumber = seriesNumber;
            this.seriesDescription = seriesDescription;
            this.modality = modality;
            this.fileCount = fileCount;
        }

        public String getSeriesUid() { return seriesUid; }
        public Integer getSeriesNumber() { return seriesNumber; }
        public String getSeriesDescription() { return seriesDescription; }
        public String getModality() { return modality; }
        public int getFileCount() { return fileCount; }
    }
}
