/*
 * DICOM Archiver
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 *
 * This software is distributed under the terms described in the LICENSE file.
 */
package io.xnatworks.archiver.summary;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedInputStream;
import java.io.EOFException;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.Map;
import java.util.Set;
import java.util.zip.Inflater;
import java.util.zip.InflaterInputStream;

/**
 * Reads the header of a DICOM Part 10 file: the 128 byte preamble, the {@code DICM}
 * prefix, the file meta group, then top-level dataset elements up to a last tag.
 *
 * <p>Implicit and explicit VR little endian, explicit VR big endian and deflated
 * explicit VR little endian datasets are read. Every encapsulated syntax stores its
 * header as explicit VR little endian, so JPEG and RLE files read the same way.
 * Sequences are skipped, including undefined length ones. Reading stops at the first
 * element past the last tag, so pixel data is never loaded.</p>
 */
public class DicomHeaderReader {
    private static final Logger log = LoggerFactory.getLogger(DicomHeaderReader.class);

    static final String IMPLICIT_VR_LITTLE_ENDIAN = "1.2.840.10008.1.2";
    static final String EXPLICIT_VR_BIG_ENDIAN = "1.2.840.10008.1.2.2";
    static final String DEFLATED_EXPLICIT_VR_LITTLE_ENDIAN = "1.2.840.10008.1.2.1.99";

    private static final int PREAMBLE_LENGTH = 128;
    private static final int META_GROUP = 0x0002;
    private static final int META_GROUP_LENGTH = 0x00020000;
    private static final int ITEM = 0xFFFEE000;
    private static final int ITEM_DELIMITATION = 0xFFFEE00D;
    private static final int SEQUENCE_DELIMITATION = 0xFFFEE0DD;
    private static final long UNDEFINED_LENGTH = 0xFFFFFFFFL;

    /** Longer values are skipped; no summary field comes close. */
    private static final int MAX_VALUE_LENGTH = 4096;

    /** VRs with a 2 byte reserved field and a 4 byte length in explicit encoding. */
    private static final Set<String> LONG_VRS = Set.of(
            "OB", "OD", "OF", "OL", "OV", "OW", "SQ", "SV", "UC", "UN", "UR", "UT", "UV");

    private static final Set<String> BINARY_VRS = Set.of(
            "AT", "FD", "FL", "OB", "OD", "OF", "OL", "OV", "OW", "SL", "SQ", "SS", "SV", "UL", "UN", "US", "UV");

    private final int lastTag;

    /**
     * @param lastTag elements after this tag are not read
     */
    public DicomHeaderReader(int lastTag) {
        this.lastTag = lastTag;
    }

    /**
     * Read the header of {@code file}.
     *
     * @throws IOException if the file cannot be read or is not a well-formed Part 10 file
     */
    public DicomHeader read(Path file) throws IOException {
        try (InputStream in = new BufferedInputStream(Files.newInputStream(file))) {
            ElementInput meta = new ElementInput(in, false);
            meta.skip(PREAMBLE_LENGTH);
            if (!"DICM".equals(new String(meta.readBytes(4), StandardCharsets.US_ASCII))) {
                throw new IOException("Missing DICM prefix after the preamble");
            }

            String transferSyntax = readMetaGroup(meta);
            if (transferSyntax == null) {
                throw new IOException("File meta information has no transfer syntax");
            }

            boolean explicitVr = !IMPLICIT_VR_LITTLE_ENDIAN.equals(transferSyntax);
            boolean bigEndian = EXPLICIT_VR_BIG_ENDIAN.equals(transferSyntax);
            if (DEFLATED_EXPLICIT_VR_LITTLE_ENDIAN.equals(transferSyntax)) {
                Inflater inflater = new Inflater(true);
                try {
                    return readDataset(new ElementInput(new InflaterInputStream(in, inflater), false),
                            true, transferSyntax);
                } finally {
                    inflater.end();
                }
            }
            return readDataset(new ElementInput(in, bigEndian), explicitVr, transferSyntax);
        }
    }

    /**
     * Read group 0002, always explicit VR little endian, and return the transfer syntax UID.
     * The group ends where its group length says, or at the first element of another group
     * when the length is missing.
     */
    private String readMetaGroup(ElementInput meta) throws IOException {
        String transferSyntax = null;
        long end = -1;
        while (end >= 0 ? meta.position() < end : meta.peekGroup() == META_GROUP) {
            ElementHeader header = meta.readHeader(true);
            if (header.length == UNDEFINED_LENGTH || header.length > MAX_VALUE_LENGTH) {
                throw new IOException("Malformed file meta element " + DicomTags.toString(header.tag));
            }
            byte[] value = meta.readBytes((int) header.length);
            if (header.tag == META_GROUP_LENGTH && value.length == 4) {
                long groupLength = (value[0] & 0xFFL) | (value[1] & 0xFFL) << 8
                        | (value[2] & 0xFFL) << 16 | (value[3] & 0xFFL) << 24;
                end = meta.position() + groupLength;
            } else if (header.tag == DicomTags.TRANSFER_SYNTAX_UID) {
                transferSyntax = firstValue(new String(value, StandardCharsets.US_ASCII));
            }
        }
        return transferSyntax;
    }

    private DicomHeader readDataset(ElementInput in, boolean explicitVr, String transferSyntax) throws IOException {
        Map<Integer, String> values = new HashMap<>();
        Charset charset = StandardCharsets.ISO_8859_1;

        while (!in.atEnd()) {
            ElementHeader header = in.readHeader(explicitVr);
            if (Integer.compareUnsigned(header.tag, lastTag) > 0) {
                break;
            }
            if (header.length == UNDEFINED_LENGTH) {
                skipSequence(in, explicitVr && !"UN".equals(header.vr));
                continue;
            }
            if (header.length > MAX_VALUE_LENGTH || (header.vr != null && BINARY_VRS.contains(header.vr))) {
                in.skip(header.length);
                continue;
            }

            byte[] raw = in.readBytes((int) header.length);
            if (header.tag == DicomTags.SPECIFIC_CHARACTER_SET) {
                charset = charsetOf(firstValue(new String(raw, StandardCharsets.US_ASCII)));
            }
            String value = firstValue(new String(raw, charset));
            if (value != null) {
                values.put(header.tag, value);
            }
        }

        log.trace("Read {} header values ({})", values.size(), transferSyntax);
        return new DicomHeader(transferSyntax, values);
    }

    /**
     * Skip the items of an undefined length sequence up to its delimitation item.
     */
    private static void skipSequence(ElementInput in, boolean explicitVr) throws IOException {
        while (true) {
            ElementHeader item = in.readHeader(explicitVr);
            if (item.tag == SEQUENCE_DELIMITATION) {
                return;
            }
            if (item.tag != ITEM) {
                throw new IOException("Expected a sequence item, found " + DicomTags.toString(item.tag));
            }
            if (item.length == UNDEFINED_LENGTH) {
                skipItem(in, explicitVr);
            } else {
                in.skip(item.length);
            }
        }
    }

    private static void skipItem(ElementInput in, boolean explicitVr) throws IOException {
        while (true) {
            ElementHeader element = in.readHeader(explicitVr);
            if (element.tag == ITEM_DELIMITATION) {
                return;
            }
            if (element.length == UNDEFINED_LENGTH) {
                skipSequence(in, explicitVr && !"UN".equals(element.vr));
            } else {
                in.skip(element.length);
            }
        }
    }

    /**
     * First of the backslash separated values, trimmed of padding; null when empty.
     */
    static String firstValue(String value) {
        int separator = value.indexOf('\\');
        String first = (separator >= 0 ? value.substring(0, separator) : value)
                .replace("\0", "")
                .trim();
        return first.isEmpty() ? null : first;
    }

    static Charset charsetOf(String specificCharacterSet) {
        if (specificCharacterSet == null) {
            return StandardCharsets.ISO_8859_1;
        }
        switch (specificCharacterSet) {
            case "ISO_IR 192":
                return StandardCharsets.UTF_8;
            case "GB18030":
                return Charset.forName("GB18030");
            default:
                return StandardCharsets.ISO_8859_1;
        }
    }

    private static final class ElementHeader {
        final int tag;
        final String vr;
        final long length;

        ElementHeader(int tag, String vr, long length) {
            this.tag = tag;
            this.vr = vr;
            this.length = length;
        }
    }

    /**
     * Element level reads over a stream in one byte order.
     */
    private static final class ElementInput {
        private final InputStream in;
        private final boolean bigEndian;
        private long position;

        ElementInput(InputStream in, boolean bigEndian) {
            this.in = in.markSupported() ? in : new BufferedInputStream(in);
            this.bigEndian = bigEndian;
        }

        /**
         * Element header. Item and delimitation tags never carry a VR.
         */
        ElementHeader readHeader(boolean explicitVr) throws IOException {
            int group = readUnsignedShort();
            int tag = (group << 16) | readUnsignedShort();
            if (!explicitVr || group == 0xFFFE) {
                return new ElementHeader(tag, null, readUnsignedInt());
            }
            String vr = new String(readBytes(2), StandardCharsets.US_ASCII);
            if (LONG_VRS.contains(vr)) {
                readUnsignedShort();
                return new ElementHeader(tag, vr, readUnsignedInt());
            }
            return new ElementHeader(tag, vr, readUnsignedShort());
        }

        /**
         * Group number of the next element in little endian, without consuming it; -1 at the end.
         */
        int peekGroup() throws IOException {
            in.mark(2);
            int b0 = in.read();
            int b1 = in.read();
            in.reset();
            return b0 < 0 || b1 < 0 ? -1 : (b1 << 8) | b0;
        }

        boolean atEnd() throws IOException {
            in.mark(1);
            int b = in.read();
            in.reset();
            return b < 0;
        }

        long position() {
            return position;
        }

        byte[] readBytes(int length) throws IOException {
            byte[] bytes = in.readNBytes(length);
            position += bytes.length;
            if (bytes.length < length) {
                throw new EOFException("Unexpected end of file, " + (length - bytes.length) + " bytes missing");
            }
            return bytes;
        }

        void skip(long length) throws IOException {
            long remaining = length;
            while (remaining > 0) {
                long skipped = in.skip(remaining);
                if (skipped <= 0) {
                    readByte();
                } else {
                    position += skipped;
                }
                remaining -= Math.max(skipped, 1);
            }
        }

        private int readByte() throws IOException {
            int b = in.read();
            if (b < 0) {
                throw new EOFException("Unexpected end of file");
            }
            position++;
            return b;
        }

        private int readUnsignedShort() throws IOException {
            int b0 = readByte();
            int b1 = readByte();
            return bigEndian ? (b0 << 8) | b1 : (b1 << 8) | b0;
        }

        private long readUnsignedInt() throws IOException {
            long s0 = readUnsignedShort();
            long s1 = readUnsignedShort();
            return bigEndian ? (s0 << 16) | s1 : (s1 << 16) | s0;
        }
    }
}
