/*
 * DICOM Archiver
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 */
package io.xnatworks.archiver.summary;

import org.junit.jupiter.api.*;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for SummaryWriter.
 */
@DisplayName("SummaryWriter Tests")
class SummaryWriterTest {

    @TempDir
    Path tempDir;

    private DicomSummary summary(boolean withOthers) {
        DicomSummary.Builder builder = DicomSummary.builder("1.2.3")
                .scanDate(LocalDate.of(2024, 8, 27))
                .patient(new DicomSummary.PatientInfo("P001", "Doe^Jane", "F", LocalDate.of(1980, 1, 2)))
                .scanner(new DicomSummary.ScannerInfo("Siemens", "Prisma", "VE11C", "12345"))
                .institution("Montreal Neurological Institute")
                .modality("MR")
                .addDicomFile(new DicomSummary.DicomFileEntry("1.dcm", "aaa", "1.2.3.1", 1, "T1", 1, null))
                .addDicomFile(new DicomSummary.DicomFileEntry("2.dcm", "bbb", "1.2.3.1", 1, "T1", 2, 2.5))
                .addAcquisition(new DicomSummary.Acquisition("1.2.3.1", 1, "T1", "MR", 2));
        if (withOthers) {
            builder.addOtherFile(new DicomSummary.OtherFileEntry("notes.txt", "ccc"));
        }
        return builder.build();
    }

    private static List<String> lines(String text) {
        return text.lines().collect(Collectors.toList());
    }

    @Test
    @DisplayName("Should write the sections in order")
    void writeToString_ShouldOrderSections() {
        String text = SummaryWriter.writeToString(summary(true));

        int study = text.indexOf("<STUDY_INFO>");
        int files = text.indexOf("<FILES>");
        int others = text.indexOf("<OTHERS>");
        int acquisitions = text.indexOf("<ACQUISITIONS>");
        int totals = text.indexOf("<SUMMARY>");

        assertEquals(0, study);
        assertTrue(study < files && files < others && others < acquisitions && acquisitions < totals);
        assertTrue(text.endsWith("</SUMMARY>\n"));
    }

    @Test
    @DisplayName("Should omit the other files section when there are none")
    void writeToString_NoOthers_ShouldOmitSection() {
        String text = SummaryWriter.writeToString(summary(false));

        assertFalse(text.contains("<OTHERS>"));
    }

    @Test
    @DisplayName("Should write study fields with aligned labels")
    void writeToString_ShouldWriteStudyFields() {
        List<String> lines = lines(SummaryWriter.writeToString(summary(true)));

        assertTrue(lines.stream().anyMatch(l -> l.matches("\\* Unique Study ID\\s+: 1\\.2\\.3")));
        assertTrue(lines.stream().anyMatch(l -> l.matches("\\* Patient Name\\s+: Doe\\^Jane")));
        assertTrue(lines.stream().anyMatch(l -> l.matches("\\* Scan Date\\s+: 2024-08-27")));
        assertTrue(lines.stream().anyMatch(l -> l.matches("\\* Summary version\\s+: 2")));
    }

    @Test
    @DisplayName("Should write one line per file and acquisition")
    void writeToString_ShouldListFiles() {
        List<String> lines = lines(SummaryWriter.writeToString(summary(true)));

        assertTrue(lines.contains("1 | 1 |  | T1 | aaa | 1.dcm"));
        assertTrue(lines.contains("1 | 2 | 2.5 | T1 | bbb | 2.dcm"));
        assertTrue(lines.contains("ccc | notes.txt"));
        assertTrue(lines.contains("1 | T1 | MR | 2 | 1.2.3.1"));
        assertTrue(lines.stream().anyMatch(l -> l.matches("\\* Total number of files\\s+: 3")));
    }

    @Test
    @DisplayName("Should leave unknown values empty")
    void writeToString_MissingValues_ShouldBeEmpty() {
        String text = SummaryWriter.writeToString(DicomSummary.builder("9.9").build());

        assertTrue(lines(text).stream().anyMatch(l -> l.matches("\\* Scan Date\\s+: ")));
        assertFalse(text.contains("null"));
    }

    @Test
    @DisplayName("Should write the same text to a file")
    void writeToFile_ShouldMatchString() throws Exception {
        Path file = tempDir.resolve("Subj01.meta");

        SummaryWriter.writeToFile(file, summary(true));

        assertEquals(SummaryWriter.writeToString(summary(true)), Files.readString(file));
    }
}
