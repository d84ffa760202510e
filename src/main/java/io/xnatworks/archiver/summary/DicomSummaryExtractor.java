/*
 * DICOM Archiver
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 *
 * This software is distributed under the terms described in the LICENSE file.
 */
package io.xnatworks.archiver.summary;

import io.xnatworks.archiver.ArchiveException;
import io.xnatworks.archiver.archive.Checksums;
import io.xnatworks.archiver.summary.DicomSummary.Acquisition;
import io.xnatworks.archiver.summary.DicomSummary.DicomFileEntry;
import io.xnatworks.archiver.summary.DicomSummary.OtherFileEntry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.io.RandomAccessFile;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * {@link SummaryExtractor} reading DICOM headers with a {@link DicomHeaderReader}.
 *
 * <p>Walks the source directory recursively in name order. Files carrying the
 * {@code DICM} preamble are parsed; anything else, or a DICOM file that fails to
 * parse, is listed as a non-DICOM file. Study level fields come from the first
 * DICOM file that has a Study Instance UID.</p>
 */
public class DicomSummaryExtractor implements SummaryExtractor {
    private static final Logger log = LoggerFactory.getLogger(DicomSummaryExtractor.class);

    private static final DateTimeFormatter DICOM_DATE_FORMAT = DateTimeFormatter.ofPattern("yyyyMMdd");

    private final DicomHeaderReader headerReader = new DicomHeaderReader(DicomTags.INSTANCE_NUMBER);

    @Override
    public DicomSummary extract(Path sourceDir) throws ArchiveException {
        List<Path> files = listFiles(sourceDir);

        DicomSummary.Builder builder = null;
        Map<String, AcquisitionCounter> acquisitions = new LinkedHashMap<>();
        List<OtherFileEntry> others = new ArrayList<>();
        List<DicomFileEntry> dicoms = new ArrayList<>();

        for (Path file : files) {
            String relativeName = relativeName(sourceDir, file);
            String md5 = checksum(file);

            DicomHeader header = isDicomFile(file.toFile()) ? readHeader(file) : null;
            if (header == null) {
                others.add(new OtherFileEntry(relativeName, md5));
                continue;
            }

            if (builder == null && header.getString(DicomTags.STUDY_INSTANCE_UID) != null) {
                builder = studyInfo(header);
            }

            String seriesUid = header.getString(DicomTags.SERIES_INSTANCE_UID);
            Integer seriesNumber = intOrNull(header, DicomTags.SERIES_NUMBER);
            String seriesDescription = header.getString(DicomTags.SERIES_DESCRIPTION);
            dicoms.add(new DicomFileEntry(relativeName, md5, seriesUid, seriesNumber, seriesDescription,
                    intOrNull(header, DicomTags.INSTANCE_NUMBER), doubleOrNull(header, DicomTags.ECHO_TIME)));

            if (seriesUid != null) {
                acquisitions.computeIfAbsent(seriesUid, uid -> new AcquisitionCounter(
                        uid, seriesNumber, seriesDescription, header.getString(DicomTags.MODALITY))).count++;
            }
        }

        if (builder == null) {
            throw new ArchiveException(ArchiveException.Kind.INVALID_ARGUMENT,
                    "No DICOM study found in '" + sourceDir + "' (no file with a Study Instance UID)");
        }

        dicoms.forEach(builder::addDicomFile);
        others.forEach(builder::addOtherFile);
        for (AcquisitionCounter counter : acquisitions.values()) {
            builder.addAcquisition(new Acquisition(counter.seriesUid, counter.seriesNumber,
                    counter.seriesDescription, counter.modality, counter.count));
        }

        DicomSummary summary = builder.build();
        log.info("Found study {} ({} DICOM files, {} other files, {} acquisitions)",
                summary.getStudyUid(), dicoms.size(), others.size(), acquisitions.size());
        return summary;
    }

    private DicomSummary.Builder studyInfo(DicomHeader header) {
        LocalDate scanDate = dateOrNull(header, DicomTags.STUDY_DATE);
        if (scanDate == null) {
            scanDate = dateOrNull(header, DicomTags.SERIES_DATE);
        }
        if (scanDate == null) {
            scanDate = dateOrNull(header, DicomTags.ACQUISITION_DATE);
        }

        return DicomSummary.builder(header.getString(DicomTags.STUDY_INSTANCE_UID))
                .scanDate(scanDate)
                .patient(new DicomSummary.PatientInfo(
                        header.getString(DicomTags.PATIENT_ID),
                        header.getString(DicomTags.PATIENT_NAME),
                        header.getString(DicomTags.PATIENT_SEX),
                        dateOrNull(header, DicomTags.PATIENT_BIRTH_DATE)))
                .scanner(new DicomSummary.ScannerInfo(
                        header.getString(DicomTags.MANUFACTURER),
                        header.getString(DicomTags.MANUFACTURER_MODEL_NAME),
                        header.getString(DicomTags.SOFTWARE_VERSIONS),
                        header.getString(DicomTags.DEVICE_SERIAL_NUMBER)))
                .institution(header.getString(DicomTags.INSTITUTION_NAME))
                .modality(header.getString(DicomTags.MODALITY));
    }

    private static List<Path> listFiles(Path sourceDir) throws ArchiveException {
        try (Stream<Path> paths = Files.walk(sourceDir)) {
            return paths.filter(Files::isRegularFile)
                    .sorted()
                    .collect(Collectors.toList());
        } catch (IOException e) {
            throw new ArchiveException(ArchiveException.Kind.IO_FAILURE,
                    "Could not list '" + sourceDir + "': " + e.getMessage(), e);
        }
    }

    private static String checksum(Path file) throws ArchiveException {
        try {
            return Checksums.md5(file);
        } catch (IOException e) {
            throw new ArchiveException(ArchiveException.Kind.IO_FAILURE,
                    "Could not read '" + file + "': " + e.getMessage(), e);
        }
    }

    private static String relativeName(Path sourceDir, Path file) {
        return sourceDir.relativize(file).toString().replace(File.separatorChar, '/');
    }

    /**
     * Read the header of a DICOM file, or null if it does not parse.
     */
    private DicomHeader readHeader(Path file) {
        try {
            DicomHeader header = headerReader.read(file);
            log.trace("Read header of {} ({})", file, header.getTransferSyntaxUid());
            return header;
        } catch (IOException e) {
            log.warn("Could not parse DICOM file {}, listing it as a non-DICOM file: {}", file, e.getMessage());
            return null;
        }
    }

    /**
     * Check the DICM magic bytes after the 128 byte preamble.
     */
    static boolean isDicomFile(File file) {
        if (file.length() <= 132) {
            return false;
        }
        try (RandomAccessFile raf = new RandomAccessFile(file, "r")) {
            raf.seek(128);
            byte[] magic = new byte[4];
            raf.readFully(magic);
            return magic[0] == 'D' && magic[1] == 'I' && magic[2] == 'C' && magic[3] == 'M';
        } catch (IOException e) {
            log.debug("Could not read preamble of {}: {}", file, e.getMessage());
            return false;
        }
    }

    private static LocalDate dateOrNull(DicomHeader header, int tag) {
        String value = header.getString(tag);
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return LocalDate.parse(value.trim(), DICOM_DATE_FORMAT);
        } catch (DateTimeParseException e) {
            log.debug("Ignoring malformed date '{}' in tag {}", value, DicomTags.toString(tag));
            return null;
        }
    }

    private static Integer intOrNull(DicomHeader header, int tag) {
        String value = header.getString(tag);
        if (value == null) {
            return null;
        }
        try {
            return Integer.valueOf(value);
        } catch (NumberFormatException e) {
            log.debug("Ignoring malformed integer '{}' in tag {}", value, DicomTags.toString(tag));
            return null;
        }
    }

    private static Double doubleOrNull(DicomHeader header, int tag) {
        String value = header.getString(tag);
        if (value == null) {
            return null;
        }
        try {
            return Double.valueOf(value);
        } catch (NumberFormatException e) {
            log.debug("Ignoring malformed decimal '{}' in tag {}", value, DicomTags.toString(tag));
            return null;
        }
    }

    private static final class AcquisitionCounter {
        final String seriesUid;
        final Integer seriesNumber;
        final String seriesDescription;
        final String modality;
        int count;

        AcquisitionCounter(String seriesUid, Integer seriesNumber, String seriesDescription, String modality) {
            this.seriesUid = seriesUid;
            this.seriesNumber = seriesNumber;
            this.seriesDescription = seriesDescription;
            this.modality = modality;
        }
    }
}
