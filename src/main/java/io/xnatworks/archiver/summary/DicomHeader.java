/*
 * DICOM Archiver
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 *
 * This software is distributed under the terms described in the LICENSE file.
 */
package io.xnatworks.archiver.summary;

import java.util.Collections;
import java.util.Map;

/**
 * Text values of the header elements of one DICOM file, first value only, with
 * padding removed. Binary elements, sequences and bulk data are not kept.
 */
public class DicomHeader {

    private final String transferSyntaxUid;
    private final Map<Integer, String> values;

    public DicomHeader(String transferSyntaxUid, Map<Integer, String> values) {
        this.transferSyntaxUid = transferSyntaxUid;
        this.values = Collections.unmodifiableMap(values);
    }

    public String getTransferSyntaxUid() {
        return transferSyntaxUid;
    }

    /**
     * Value of {@code tag}, or null if the element is absent or empty.
     */
    public String getString(int tag) {
        return values.get(tag);
    }
}
