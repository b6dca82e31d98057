package com.pdfseal.pdf;

import com.itextpdf.io.font.PdfEncodings;
import com.itextpdf.io.source.PdfTokenizer;
import com.itextpdf.io.source.RandomAccessFileOrArray;
import com.itextpdf.io.source.RandomAccessSourceFactory;
import com.itextpdf.kernel.pdf.PdfArray;
import com.itextpdf.kernel.pdf.PdfDictionary;
import com.itextpdf.kernel.pdf.PdfDocument;
import com.itextpdf.kernel.pdf.PdfName;
import com.itextpdf.kernel.pdf.PdfNumber;
import com.itextpdf.kernel.pdf.PdfObject;
import com.itextpdf.kernel.pdf.PdfString;
import com.itextpdf.kernel.pdf.canvas.parser.util.PdfCanvasParser;
import com.pdfseal.crypto.Algorithms;
import org.bouncycastle.util.encoders.DecoderException;
import org.bouncycastle.util.encoders.Hex;

import java.io.IOException;
import java.time.Instant;
import java.time.format.DateTimeParseException;

/**
 * Maps a {@link SignatureRecord} to and from the PDF dictionary that carries it.
 * <pre>
 * &lt;&lt; /Type /PdfSealRecord /V 1
 *    /Name (signer, UTF-16BE) /M (ISO-8601 instant) /Extra (optional, UTF-16BE)
 *    /DigestMethod (SHA-256) /SignatureMethod (RSASSA-PSS-SHA256)
 *    /Digest &lt;hex&gt; /KeyId (hex) /ByteRange [0 L] /Contents &lt;hex&gt; &gt;&gt;
 * </pre>
 * The dictionary is an indirect object referenced from the catalog under {@link #CATALOG_KEY}.
 */
public final class SealRecordCodec {

    public static final PdfName CATALOG_KEY = new PdfName("PdfSealRecord");
    public static final PdfName RECORD_TYPE = new PdfName("PdfSealRecord");

    static final PdfName NAME = new PdfName("Name");
    static final PdfName SIGN_TIME = new PdfName("M");
    static final PdfName EXTRA = new PdfName("Extra");
    static final PdfName DIGEST_METHOD = new PdfName("DigestMethod");
    static final PdfName SIGNATURE_METHOD = new PdfName("SignatureMethod");
    static final PdfName DIGEST = new PdfName("Digest");
    static final PdfName KEY_ID = new PdfName("KeyId");

    private SealRecordCodec() {
    }

    public static PdfDictionary encode(SignatureRecord record, PdfDocument pdf) {
        SealedAttributes attributes = record.getAttributes();
        PdfDictionary dict = new PdfDictionary();
        dict.put(PdfName.Type, RECORD_TYPE);
        dict.put(PdfName.V, new PdfNumber(attributes.getVersion()));
        dict.put(NAME, new PdfString(attributes.getSignerName(), PdfEncodings.UNICODE_BIG));
        dict.put(SIGN_TIME, new PdfString(attributes.getTimestamp()));
        if (attributes.getExtra() != null) {
            dict.put(EXTRA, new PdfString(attributes.getExtra(), PdfEncodings.UNICODE_BIG));
        }
        dict.put(DIGEST_METHOD, new PdfString(attributes.getDigestAlgorithm()));
        dict.put(SIGNATURE_METHOD, new PdfString(attributes.getSignatureAlgorithm()));
        dict.put(DIGEST, new PdfString(attributes.getContentDigest()).setHexWriting(true));
        dict.put(KEY_ID, new PdfString(attributes.getKeyId()));
        dict.put(PdfName.ByteRange, new PdfArray(new int[]{0, attributes.getSealedLength()}));
        dict.put(PdfName.Contents, new PdfString(record.getSignature()).setHexWriting(true));
        dict.makeIndirect(pdf);
        return dict;
    }

    /**
     * Parses the direct dictionary starting at {@code offset} straight from the bytes, without a cross-reference
     * table. A record holds no indirect references, so this reads it as fully as a document load would.
     */
    static PdfDictionary parseDictionary(byte[] data, int offset) throws IOException {
        try (PdfTokenizer tokenizer = new PdfTokenizer(
                new RandomAccessFileOrArray(new RandomAccessSourceFactory().createSource(data)))) {
            tokenizer.seek(offset);
            PdfObject object = new PdfCanvasParser(tokenizer).readObject();
            if (!(object instanceof PdfDictionary)) {
                throw new IOException("No dictionary at offset " + offset);
            }
            return (PdfDictionary) object;
        }
    }

    /**
     * Reads {@code /ByteRange} on its own: the verifier needs the range even when other entries are damaged.
     */
    static long[] readByteRange(PdfDictionary dict) throws MalformedRecordException {
        PdfArray byteRange = dict.getAsArray(PdfName.ByteRange);
        if (byteRange == null || byteRange.size() != 2) {
            throw new MalformedRecordException("/ByteRange must be an array of two numbers");
        }
        PdfNumber start = byteRange.getAsNumber(0);
        PdfNumber length = byteRange.getAsNumber(1);
        if (start == null || length == null) {
            throw new MalformedRecordException("/ByteRange must be an array of two numbers");
        }
        return new long[]{start.longValue(), length.longValue()};
    }

    static SignatureRecord decode(PdfDictionary dict, int sealedLength) throws MalformedRecordException {
        if (!RECORD_TYPE.equals(dict.getAsName(PdfName.Type))) {
            throw new MalformedRecordException("/Type is not /" + RECORD_TYPE.getValue());
        }
        PdfNumber version = dict.getAsNumber(PdfName.V);
        if (version == null || version.intValue() != SealedAttributes.CURRENT_VERSION) {
            throw new MalformedRecordException("Unsupported record version " + version);
        }
        String signerName = requireText(dict, NAME);
        if (signerName.isBlank()) {
            throw new MalformedRecordException("/Name is blank");
        }
        String timestamp = requireText(dict, SIGN_TIME);
        try {
            Instant.parse(timestamp);
        } catch (DateTimeParseException e) {
            throw new MalformedRecordException("/M is not an ISO-8601 instant: " + timestamp, e);
        }
        PdfString extraString = dict.getAsString(EXTRA);
        String extra = extraString == null ? null : extraString.toUnicodeString();

        String digestAlgorithm = requireText(dict, DIGEST_METHOD);
        if (Algorithms.digest(digestAlgorithm).isEmpty()) {
            throw new MalformedRecordException("Unknown digest algorithm '" + digestAlgorithm + "'");
        }
        String signatureAlgorithm = requireText(dict, SIGNATURE_METHOD);
        if (Algorithms.signatureScheme(signatureAlgorithm).isEmpty()) {
            throw new MalformedRecordException("Unknown signature algorithm '" + signatureAlgorithm + "'");
        }
        byte[] digest = requireBytes(dict, DIGEST);
        String keyId = requireText(dict, KEY_ID);
        try {
            Hex.decode(keyId);
        } catch (DecoderException e) {
            throw new MalformedRecordException("/KeyId is not hex", e);
        }
        byte[] signature = requireBytes(dict, PdfName.Contents);

        SealedAttributes attributes = new SealedAttributes(version.intValue(), digestAlgorithm, signatureAlgorithm,
                digest, sealedLength, keyId, signerName, timestamp, extra);
        return new SignatureRecord(attributes, signature);
    }

    private static String requireText(PdfDictionary dict, PdfName key) throws MalformedRecordException {
        PdfString value = dict.getAsString(key);
        if (value == null) {
            throw new MalformedRecordException("Missing /" + key.getValue());
        }
        return value.toUnicodeString();
    }

    private static byte[] requireBytes(PdfDictionary dict, PdfName key) throws MalformedRecordException {
        PdfString value = dict.getAsString(key);
        if (value == null) {
            throw new MalformedRecordException("Missing /" + key.getValue());
        }
        byte[] bytes = value.getValueBytes();
        if (bytes.length == 0) {
            throw new MalformedRecordException("/" + key.getValue() + " is empty");
        }
        return bytes;
    }
}
