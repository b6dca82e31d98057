package com.pdfseal.pdf;

import com.itextpdf.io.font.constants.StandardFonts;
import com.itextpdf.kernel.font.PdfFont;
import com.itextpdf.kernel.font.PdfFontFactory;
import com.itextpdf.kernel.geom.PageSize;
import com.itextpdf.kernel.pdf.CompressionConstants;
import com.itextpdf.kernel.pdf.PdfDocument;
import com.itextpdf.kernel.pdf.PdfPage;
import com.itextpdf.kernel.pdf.PdfReader;
import com.itextpdf.kernel.pdf.PdfWriter;
import com.itextpdf.kernel.pdf.StampingProperties;
import com.itextpdf.kernel.pdf.WriterProperties;
import com.itextpdf.kernel.pdf.canvas.PdfCanvas;
import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.text.PDFTextStripper;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;

/**
 * Fixture documents for tests. Page content is written uncompressed so tests can find and alter it
 * at the byte level without breaking the file structure.
 */
public final class TestPdfs {

    private TestPdfs() {
    }

    public static String bodyText(int page) {
        return "Page " + page + " body";
    }

    /** Classic cross-reference table. */
    public static byte[] simple(int pages) {
        return create(pages, false);
    }

    /** Cross-reference stream and object streams. */
    public static byte[] withXrefStream(int pages) {
        return create(pages, true);
    }

    private static byte[] create(int pages, boolean fullCompression) {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        WriterProperties properties = new WriterProperties().setCompressionLevel(CompressionConstants.NO_COMPRESSION);
        if (fullCompression) {
            properties.setFullCompressionMode(true);
        }
        try (PdfDocument pdf = new PdfDocument(new PdfWriter(out, properties))) {
            PdfFont font = PdfFontFactory.createFont(StandardFonts.HELVETICA);
            for (int i = 1; i <= pages; i++) {
                PdfPage page = pdf.addNewPage(PageSize.A4);
                new PdfCanvas(page)
                        .beginText()
                        .setFontAndSize(font, 12)
                        .moveText(72, 700)
                        .showText(bodyText(i))
                        .endText();
            }
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        return out.toByteArray();
    }

    /** Appends an ordinary incremental update that changes the document title. */
    public static byte[] appendRevision(byte[] pdfBytes, String title) {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        try (PdfDocument pdf = new PdfDocument(new PdfReader(new ByteArrayInputStream(pdfBytes)), new PdfWriter(out),
                new StampingProperties().useAppendMode())) {
            pdf.getDocumentInfo().setTitle(title);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        return out.toByteArray();
    }

    public static String extractText(byte[] pdfBytes, int page) {
        try (PDDocument doc = Loader.loadPDF(pdfBytes)) {
            PDFTextStripper stripper = new PDFTextStripper();
            stripper.setStartPage(page);
            stripper.setEndPage(page);
            return stripper.getText(doc);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    public static int indexOf(byte[] data, String needle, int from) {
        byte[] pattern = needle.getBytes(StandardCharsets.ISO_8859_1);
        outer:
        for (int i = Math.max(0, from); i <= data.length - pattern.length; i++) {
            for (int j = 0; j < pattern.length; j++) {
                if (data[i + j] != pattern[j]) {
                    continue outer;
                }
            }
            return i;
        }
        return -1;
    }

    /**
     * Copy of {@code data} with the first occurrence of {@code target} at or after {@code from} overwritten
     * by {@code replacement}, which must have the same length.
     */
    public static byte[] replace(byte[] data, String target, String replacement, int from) {
        if (target.length() != replacement.length()) {
            throw new IllegalArgumentException("Replacement must keep the length");
        }
        int at = indexOf(data, target, from);
        if (at < 0) {
            throw new IllegalArgumentException("'" + target + "' not found after " + from);
        }
        byte[] copy = Arrays.copyOf(data, data.length);
        byte[] bytes = replacement.getBytes(StandardCharsets.ISO_8859_1);
        System.arraycopy(bytes, 0, copy, at, bytes.length);
        return copy;
    }
}
