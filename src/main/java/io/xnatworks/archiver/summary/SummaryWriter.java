/*
 * DICOM Archiver
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 *
 * This software is distributed under the terms described in the LICENSE file.
 */
package io.xnatworks.archiver.summary;

import io.xnatworks.archiver.summary.DicomSummary.Acquisition;
import io.xnatworks.archiver.summary.DicomSummary.DicomFileEntry;
import io.xnatworks.archiver.summary.DicomSummary.OtherFileEntry;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;

/**
 * Plain text rendering of a {@link DicomSummary}, the {@code .meta} member of an archive.
 */
public final class SummaryWriter {

    public static final int SUMMARY_VERSION = 2;

    private static final DateTimeFormatter DATE_FORMAT = DateTimeFormatter.ISO_LOCAL_DATE;

    private SummaryWriter() {
    }

    public static void writeToFile(Path path, DicomSummary summary) throws IOException {
        Files.writeString(path, writeToString(summary), StandardCharsets.UTF_8);
    }

    public static String writeToString(DicomSummary summary) {
        StringBuilder sb = new StringBuilder();

        sb.append("<STUDY_INFO>\n");
        field(sb, "Unique Study ID", summary.getStudyUid());
        field(sb, "Patient ID", summary.getPatient().getId());
        field(sb, "Patient Name", summary.getPatient().getName());
        field(sb, "Patient Sex", summary.getPatient().getSex());
        field(sb, "Patient Date of Birth", date(summary.getPatient().getBirthDate()));
        field(sb, "Scan Date", date(summary.getScanDate()));
        field(sb, "Modality", summary.getModality());
        field(sb, "Institution Name", summary.getInstitution());
        field(sb, "Scanner Manufacturer", summary.getScanner().getManufacturer());
        field(sb, "Scanner Model Name", summary.getScanner().getModel());
        field(sb, "Scanner Serial Number", summary.getScanner().getSerialNumber());
        field(sb, "Scanner Software Version", summary.getScanner().getSoftwareVersion());
        sb.append("</STUDY_INFO>\n");

        sb.append("<FILES>\n");
        sb.append("SN | FN | EN | Series | md5sum | File name\n");
        for (DicomFileEntry file : summary.getDicomFiles()) {
            sb.append(value(file.getSeriesNumber())).append(" | ")
              .append(value(file.getInstanceNumber())).append(" | ")
              .append(value(file.getEchoTime())).append(" | ")
              .append(value(file.getSeriesDescription())).append(" | ")
              .append(file.getMd5()).append(" | ")
              .append(file.getFileName()).append('\n');
        }
        sb.append("</FILES>\n");

        if (!summary.getOtherFiles().isEmpty()) {
            sb.append("<OTHERS>\n");
            sb.append("md5sum | File name\n");
            for (OtherFileEntry file : summary.getOtherFiles()) {
                sb.append(file.getMd5()).append(" | ").append(file.getFileName()).append('\n');
            }
            sb.append("</OTHERS>\n");
        }

        sb.append("<ACQUISITIONS>\n");
        sb.append("Series (SN) | Name of protocol | Modality | Files | Series UID\n");
        for (Acquisition acquisition : summary.getAcquisitions()) {
            sb.append(value(acquisition.getSeriesNumber())).append(" | ")
              .append(value(acquisition.getSeriesDescription())).append(" | ")
              .append(value(acquisition.getModality())).append(" | ")
              .append(acquisition.getFileCount()).append(" | ")
              .append(acquisition.getSeriesUid()).append('\n');
        }
        sb.append("</ACQUISITIONS>\n");

        sb.append("<SUMMARY>\n");
        field(sb, "Total number of files", String.valueOf(
                summary.getDicomFiles().size() + summary.getOtherFiles().size()));
        field(sb, "DICOM files", String.valueOf(summary.getDicomFiles().size()));
        field(sb, "Other files", String.valueOf(summary.getOtherFiles().size()));
        field(sb, "Acquisitions", String.valueOf(summary.getAcquisitions().size()));
        field(sb, "Summary version", String.valueOf(SUMMARY_VERSION));
        sb.append("</SUMMARY>\n");

        return sb.toString();
    }

    private static void field(StringBuilder sb, String label, String value) {
        sb.append(String.format("* %-25s: %s\n", label, value(value)));
    }

    private static String date(LocalDate date) {
        return date != null ? DATE_FORMAT.format(date) : null;
    }

    private static String value(Object value) {
        return value != null ? value.toString() : "";
    }
}
