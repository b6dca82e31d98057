package com.pdfseal.pdf;

import com.pdfseal.error.UnparsableDocumentException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;

/**
 * Byte-level checks on the end of a PDF: the final {@code %%EOF}, the {@code startxref} before it
 * and the cross-reference section it points to.
 * <p>
 * Works on raw bytes so it can run before any PDF library gets to repair the file.
 */
public final class PdfTailLocator {

    private static final Logger log = LoggerFactory.getLogger(PdfTailLocator.class);

    private static final byte[] HEADER = "%PDF-".getBytes(StandardCharsets.US_ASCII);
    private static final byte[] EOF_MARKER = "%%EOF".getBytes(StandardCharsets.US_ASCII);
    private static final byte[] STARTXREF = "startxref".getBytes(StandardCharsets.US_ASCII);
    private static final int SCAN_WINDOW = 128 * 1024;

    private PdfTailLocator() {
    }

    public static TailInfo locate(byte[] data) throws UnparsableDocumentException {
        if (data == null || data.length < 16) {
            throw new UnparsableDocumentException("Not a PDF: document is too small");
        }
        if (!matchesAt(data, HEADER, 0)) {
            throw new UnparsableDocumentException("Not a PDF: header '%PDF-' missing at byte 0");
        }
        int eofIndex = lastIndexOf(data, EOF_MARKER, data.length);
        if (eofIndex < 0) {
            throw new UnparsableDocumentException("Not a PDF: no %%EOF marker, the file may be truncated");
        }
        long declaredOffset = parseStartxref(data, eofIndex);
        TailType type = identifyTailType(data, declaredOffset);
        if (type != null) {
            return new TailInfo(declaredOffset, declaredOffset, type, eofIndex);
        }

        int start = Math.max(0, eofIndex - SCAN_WINDOW);
        int xrefTable = findLastXrefKeyword(data, start, eofIndex);
        int xrefStream = findLastXrefStreamObjectStart(data, start, eofIndex);
        if (xrefTable < 0 && xrefStream < 0) {
            throw new UnparsableDocumentException("Not a PDF: startxref " + declaredOffset
                    + " does not point to a cross-reference section");
        }
        TailInfo scanned = xrefStream > xrefTable
                ? new TailInfo(declaredOffset, xrefStream, TailType.XREF_STREAM, eofIndex)
                : new TailInfo(declaredOffset, xrefTable, TailType.XREF_TABLE, eofIndex);
        log.warn("[tail] startxref declared {} but using scanned {} at {}", declaredOffset,
                scanned.getType(), scanned.getActualOffset());
        return scanned;
    }

    /**
     * Counts {@code %%EOF} markers at or after {@code from}; each one closes a revision.
     */
    public static int countEofMarkers(byte[] data, int from) {
        int count = 0;
        int pos = indexOf(data, EOF_MARKER, Math.max(0, from));
        while (pos >= 0) {
            count++;
            pos = indexOf(data, EOF_MARKER, pos + EOF_MARKER.length);
        }
        return count;
    }

    /**
     * Number of bytes other than CR or LF after the last {@code %%EOF}. Zero for a cleanly ended file.
     */
    public static int countBytesAfterFinalEof(byte[] data) {
        int eofIndex = lastIndexOf(data, EOF_MARKER, data.length);
        if (eofIndex < 0) {
            return 0;
        }
        int count = 0;
        for (int i = eofIndex + EOF_MARKER.length; i < data.length; i++) {
            if (data[i] != '\r' && data[i] != '\n') {
                count++;
            }
        }
        return count;
    }

    /**
     * Finds the indirect dictionary whose {@code /Type} is {@code typeName} inside the final revision,
     * after the second-to-last {@code %%EOF} (if any) and before the last one, without parsing anything else.
     *
     * @return offset of the dictionary's {@code <<}, or -1 if the final revision has no such object
     */
    static int findTypedDictionaryInFinalRevision(byte[] data, String typeName) {
        int lastEof = lastIndexOf(data, EOF_MARKER, data.length);
        if (lastEof < 0) {
            return -1;
        }
        int previousEof = lastIndexOf(data, EOF_MARKER, lastEof);
        byte[] type = "/Type".getBytes(StandardCharsets.US_ASCII);
        byte[] name = ("/" + typeName).getBytes(StandardCharsets.US_ASCII);
        for (int i = lastEof - type.length; i > previousEof; i--) {
            if (!matchesAt(data, type, i)) {
                continue;
            }
            int value = skipWhitespaceForward(data, i + type.length, lastEof);
            if (value < 0 || !matchesAt(data, name, value) || !endsName(data, value + name.length)) {
                continue;
            }
            int header = findObjectHeaderStart(data, i);
            if (header <= previousEof) {
                continue;
            }
            int objKeyword = indexOf(data, "obj".getBytes(StandardCharsets.US_ASCII), header);
            int dictStart = skipWhitespaceForward(data, objKeyword + 3, i);
            if (dictStart >= 0 && matchesAt(data, "<<".getBytes(StandardCharsets.US_ASCII), dictStart)) {
                return dictStart;
            }
        }
        return -1;
    }

    private static boolean endsName(byte[] data, int pos) {
        if (pos >= data.length || isWhitespace(data[pos])) {
            return true;
        }
        return "/<>[]()%".indexOf((char) data[pos]) >= 0;
    }

    private static long parseStartxref(byte[] data, int eofIndex) throws UnparsableDocumentException {
        int startxrefIndex = lastIndexOf(data, STARTXREF, eofIndex);
        if (startxrefIndex < 0) {
            throw new UnparsableDocumentException("Not a PDF: startxref not found before %%EOF");
        }
        int numberStart = skipWhitespaceForward(data, startxrefIndex + STARTXREF.length, eofIndex);
        if (numberStart < 0) {
            throw new UnparsableDocumentException("Not a PDF: startxref has no offset");
        }
        int numberEnd = numberStart;
        while (numberEnd < eofIndex && Character.isDigit((char) data[numberEnd])) {
            numberEnd++;
        }
        String digits = new String(data, numberStart, numberEnd - numberStart, StandardCharsets.US_ASCII);
        long offset;
        try {
            offset = Long.parseLong(digits);
        } catch (NumberFormatException e) {
            throw new UnparsableDocumentException("Not a PDF: startxref offset is not a number: '" + digits + "'", e);
        }
        if (offset <= 0 || offset >= data.length) {
            throw new UnparsableDocumentException("Not a PDF: startxref offset out of range: " + offset);
        }
        return offset;
    }

    private static TailType identifyTailType(byte[] data, long offset) {
        int pos = skipWhitespaceForward(data, (int) offset, data.length);
        if (pos < 0) {
            return null;
        }
        if (matchesAt(data, "xref".getBytes(StandardCharsets.US_ASCII), pos)) {
            return TailType.XREF_TABLE;
        }
        String dict = extractDictionarySnippet(data, pos);
        if (dict != null && isXrefStreamDictionary(dict)) {
            return TailType.XREF_STREAM;
        }
        return null;
    }

    private static boolean isXrefStreamDictionary(String dict) {
        String compact = dict.replaceAll("\\s+", "");
        return compact.contains("/Type/XRef");
    }

    private static String extractDictionarySnippet(byte[] data, int objectStart) {
        int objKeyword = indexOf(data, "obj".getBytes(StandardCharsets.US_ASCII), objectStart);
        if (objKeyword < 0 || objKeyword - objectStart > 32) {
            return null;
        }
        int dictStart = indexOf(data, "<<".getBytes(StandardCharsets.US_ASCII), objKeyword);
        if (dictStart < 0) {
            return null;
        }
        int depth = 0;
        for (int i = dictStart; i < data.length - 1; i++) {
            if (data[i] == '<' && data[i + 1] == '<') {
                depth++;
                i++;
            } else if (data[i] == '>' && data[i + 1] == '>') {
                depth--;
                i++;
                if (depth == 0) {
                    return new String(data, dictStart, (i + 1) - dictStart, StandardCharsets.US_ASCII);
                }
            }
        }
        return null;
    }

    private static int findLastXrefKeyword(byte[] data, int start, int end) {
        byte[] keyword = "xref".getBytes(StandardCharsets.US_ASCII);
        for (int i = end - keyword.length; i >= start; i--) {
            // "startxref" also ends in xref
            if (matchesAt(data, keyword, i) && (i == 0 || isWhitespace(data[i - 1]))) {
                return i;
            }
        }
        return -1;
    }

    private static int findLastXrefStreamObjectStart(byte[] data, int start, int end) {
        byte[] type = "/Type".getBytes(StandardCharsets.US_ASCII);
        byte[] xref = "/XRef".getBytes(StandardCharsets.US_ASCII);
        for (int i = end - type.length; i >= start; i--) {
            if (!matchesAt(data, type, i)) {
                continue;
            }
            int j = skipWhitespaceForward(data, i + type.length, end);
            if (j >= 0 && matchesAt(data, xref, j)) {
                int headerStart = findObjectHeaderStart(data, i);
                if (headerStart >= 0) {
                    return headerStart;
                }
            }
        }
        return -1;
    }

    private static int findObjectHeaderStart(byte[] data, int startPos) {
        byte[] obj = "obj".getBytes(StandardCharsets.US_ASCII);
        for (int i = startPos; i >= 0; i--) {
            if (!matchesAt(data, obj, i)) {
                continue;
            }
            int j = i - 1;
            while (j >= 0 && isWhitespace(data[j])) {
                j--;
            }
            while (j >= 0 && Character.isDigit((char) data[j])) {
                j--;
            }
            if (j < 0 || !isWhitespace(data[j])) {
                continue;
            }
            while (j >= 0 && isWhitespace(data[j])) {
                j--;
            }
            while (j >= 0 && Character.isDigit((char) data[j])) {
                j--;
            }
            return j + 1;
        }
        return -1;
    }

    private static int skipWhitespaceForward(byte[] data, int pos, int end) {
        for (int i = pos; i < end; i++) {
            if (!isWhitespace(data[i])) {
                return i;
            }
        }
        return -1;
    }

    private static boolean isWhitespace(byte b) {
        return b == '\r' || b == '\n' || b == '\t' || b == '\f' || b == ' ' || b == 0;
    }

    private static int indexOf(byte[] data, byte[] needle, int start) {
        for (int i = Math.max(0, start); i <= data.length - needle.length; i++) {
            if (matchesAt(data, needle, i)) {
                return i;
            }
        }
        return -1;
    }

    private static int lastIndexOf(byte[] haystack, byte[] needle, int before) {
        for (int i = Math.min(before, haystack.length) - needle.length; i >= 0; i--) {
            if (matchesAt(haystack, needle, i)) {
                return i;
            }
        }
        return -1;
    }

    private static boolean matchesAt(byte[] haystack, byte[] needle, int pos) {
        if (pos < 0 || pos + needle.length > haystack.length) {
            return false;
        }
        for (int i = 0; i < needle.length; i++) {
            if (haystack[pos + i] != needle[i]) {
                return false;
            }
        }
        return true;
    }

    public enum TailType {
        XREF_TABLE,
        XREF_STREAM
    }

    public static final class TailInfo {
        private final long declaredOffset;
        private final long actualOffset;
        private final TailType type;
        private final int eofOffset;

        private TailInfo(long declaredOffset, long actualOffset, TailType type, int eofOffset) {
            this.declaredOffset = declaredOffset;
            this.actualOffset = actualOffset;
            this.type = type;
            this.eofOffset = eofOffset;
        }

        public long getDeclaredOffset() {
            return declaredOffset;
        }

        public long getActualOffset() {
            return actualOffset;
        }

        public TailType getType() {
            return type;
        }

        public int getEofOffset() {
            return eofOffset;
        }

        public boolean isDeclaredOffsetValid() {
            return declaredOffset == actualOffset;
        }
    }
}
