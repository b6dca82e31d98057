package com.pdfseal.pdf;

import com.itextpdf.io.font.PdfEncodings;
import com.itextpdf.io.font.constants.StandardFonts;
import com.itextpdf.kernel.colors.DeviceRgb;
import com.itextpdf.kernel.font.PdfFont;
import com.itextpdf.kernel.font.PdfFontFactory;
import com.itextpdf.kernel.geom.Rectangle;
import com.itextpdf.kernel.pdf.PdfDocument;
import com.itextpdf.kernel.pdf.PdfPage;
import com.itextpdf.kernel.pdf.canvas.PdfCanvas;
import com.pdfseal.error.InvalidInputException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Draws the visible attestation of a seal: a small text block in the top-left corner of the first page
 * (or every page), layered over the existing page content.
 * <p>
 * The watermark only displays record fields. It is written inside the seal's own update, so it is never
 * part of the signed range and verification does not read it back: the record is authoritative.
 * Every character must have a glyph in the chosen font, otherwise rendering fails instead of dropping it.
 */
public final class WatermarkRenderer {

    private static final Logger log = LoggerFactory.getLogger(WatermarkRenderer.class);

    public static final String HEADLINE_PREFIX = "Digitally signed by ";
    public static final float DEFAULT_FONT_SIZE = 8f;

    static final float ANCHOR_X = 10f;
    static final float ANCHOR_TOP_OFFSET = 15f;
    private static final int SIGNATURE_PREVIEW_CHARS = 16;
    private static final DateTimeFormatter DISPLAY_TIME =
            DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss 'UTC'").withZone(ZoneOffset.UTC);
    private static final DeviceRgb INK = new DeviceRgb(0, 0, 140);

    private final float fontSize;
    private final Path fontPath;
    private final boolean allPages;

    public WatermarkRenderer() {
        this(DEFAULT_FONT_SIZE, null, false);
    }

    /**
     * @param fontSize point size of the text; leading is 1.25 times this
     * @param fontPath optional TrueType/OpenType font embedded for signer names outside WinAnsi, else Helvetica
     * @param allPages stamp every page instead of only the first
     */
    public WatermarkRenderer(float fontSize, Path fontPath, boolean allPages) {
        if (fontSize <= 0f) {
            throw new IllegalArgumentException("Watermark font size must be positive");
        }
        if (fontPath != null && !Files.isRegularFile(fontPath)) {
            throw new IllegalArgumentException("Watermark font not found or not a file: " + fontPath);
        }
        this.fontSize = fontSize;
        this.fontPath = fontPath;
        this.allPages = allPages;
    }

    public List<String> composeLines(SignatureRecord record) {
        List<String> lines = new ArrayList<>();
        lines.add(HEADLINE_PREFIX + record.getSignerName());
        lines.add(DISPLAY_TIME.format(record.getInstant()));
        record.getExtra().ifPresent(extra -> {
            for (String line : extra.split("\\R")) {
                if (!line.isBlank()) {
                    lines.add(line);
                }
            }
        });
        String signatureHex = record.getSignatureHex();
        String preview = signatureHex.length() > SIGNATURE_PREVIEW_CHARS
                ? signatureHex.substring(0, SIGNATURE_PREVIEW_CHARS) + "..."
                : signatureHex;
        lines.add("Signature: " + preview);
        return Collections.unmodifiableList(lines);
    }

    public void render(PdfDocument pdf, List<String> lines) throws IOException, InvalidInputException {
        if (pdf.getNumberOfPages() == 0) {
            throw new IllegalStateException("Document has no pages to carry a watermark");
        }
        PdfFont font = createFont();
        requireGlyphs(font, lines);
        int lastPage = allPages ? pdf.getNumberOfPages() : 1;
        for (int pageNumber = 1; pageNumber <= lastPage; pageNumber++) {
            renderOnPage(pdf.getPage(pageNumber), font, lines);
        }
        log.debug("[watermark] {} line(s) on {} page(s), font={} {}pt", lines.size(), lastPage, fontName(), fontSize);
    }

    private void requireGlyphs(PdfFont font, List<String> lines) throws InvalidInputException {
        for (String line : lines) {
            int missing = line.codePoints().filter(codePoint -> !font.containsGlyph(codePoint)).findFirst().orElse(-1);
            if (missing >= 0) {
                String hint = fontPath == null ? ", configure a Unicode watermark font" : "";
                throw new InvalidInputException(String.format("Watermark font %s has no glyph for '%s' (U+%04X)%s",
                        fontName(), new String(Character.toChars(missing)), missing, hint));
            }
        }
    }

    private void renderOnPage(PdfPage page, PdfFont font, List<String> lines) {
        Rectangle box = page.getCropBox();
        float x = box.getLeft() + ANCHOR_X;
        float y = box.getTop() - ANCHOR_TOP_OFFSET;

        // wraps the existing content in q/Q so its graphics state cannot leak into the watermark
        PdfCanvas canvas = new PdfCanvas(page, true);
        canvas.saveState()
                .setFillColor(INK)
                .beginText()
                .setFontAndSize(font, fontSize)
                .setLeading(fontSize * 1.25f)
                .moveText(x, y);
        for (int i = 0; i < lines.size(); i++) {
            if (i > 0) {
                canvas.newlineText();
            }
            canvas.showText(lines.get(i));
        }
        canvas.endText().restoreState();
        page.setModified();
    }

    private String fontName() {
        return fontPath == null ? StandardFonts.HELVETICA : fontPath.getFileName().toString();
    }

    private PdfFont createFont() throws IOException {
        if (fontPath == null) {
            return PdfFontFactory.createFont(StandardFonts.HELVETICA);
        }
        return PdfFontFactory.createFont(fontPath.toAbsolutePath().toString(), PdfEncodings.IDENTITY_H,
                PdfFontFactory.EmbeddingStrategy.PREFER_EMBEDDED);
    }
}
