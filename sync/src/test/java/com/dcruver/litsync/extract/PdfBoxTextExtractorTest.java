package com.dcruver.litsync.extract;

import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.pdmodel.PDPageContentStream;
import org.apache.pdfbox.pdmodel.font.PDType1Font;
import org.apache.pdfbox.pdmodel.font.Standard14Fonts;
import org.apache.pdfbox.pdmodel.graphics.image.LosslessFactory;
import org.apache.pdfbox.pdmodel.graphics.image.PDImageXObject;
import org.junit.jupiter.api.Test;

import java.awt.image.BufferedImage;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class PdfBoxTextExtractorTest {

    private static final List<String> LINES = List.of(
        "Deep learning allows computational models that are composed of multiple",
        "processing layers to learn representations of data with multiple levels",
        "of abstraction. These methods have dramatically improved the state of the",
        "art in speech recognition, visual object recognition and object detection.");

    private final PdfBoxTextExtractor extractor = new PdfBoxTextExtractor(5);

    @Test
    void testExtractsReadableText() throws Exception {
        ExtractionResult result = extractor.extractText(pdf(false));

        assertFalse(result.isFallback());
        assertTrue(result.getText().contains("Deep learning allows computational models"));
        assertTrue(result.getConfidence() > 0);
    }

    @Test
    void testBrokenPayloadFallsBack() {
        ExtractionResult result = extractor.extractText("not a pdf".getBytes(StandardCharsets.UTF_8));

        assertTrue(result.isFallback());
        assertEquals("", result.getText());
        assertNotNull(result.getReason());
        assertTrue(extractor.extractImages("not a pdf".getBytes(StandardCharsets.UTF_8)).isEmpty());
    }

    @Test
    void testKeepsFiguresAndSkipsLogos() throws Exception {
        List<ImageBlob> images = extractor.extractImages(pdf(true));

        assertEquals(1, images.size());
        ImageBlob figure = images.get(0);
        assertEquals(2, figure.getPage());
        assertEquals(300, figure.getWidth());
        assertEquals("image/png", figure.getMimeType());
        assertTrue(figure.getName().endsWith(".png"));
        assertTrue(figure.getData().length > 0);
    }

    @Test
    void testImageLimitZeroExtractsNothing() throws Exception {
        assertTrue(new PdfBoxTextExtractor(0).extractImages(pdf(true)).isEmpty());
    }

    private static byte[] pdf(boolean withImages) throws IOException {
        try (PDDocument document = new PDDocument()) {
            PDPage first = new PDPage();
            document.addPage(first);
            try (PDPageContentStream content = new PDPageContentStream(document, first)) {
                content.beginText();
                content.setFont(new PDType1Font(Standard14Fonts.FontName.HELVETICA), 11);
                content.newLineAtOffset(50, 700);
                for (String line : LINES) {
                    content.showText(line);
                    content.newLineAtOffset(0, -14);
                }
                content.endText();
                if (withImages) {
                    // Header-sized image on the title page
                    content.drawImage(image(document, 300, 300), 50, 300, 150, 150);
                }
            }

            if (withImages) {
                PDPage second = new PDPage();
                document.addPage(second);
                try (PDPageContentStream content = new PDPageContentStream(document, second)) {
                    content.drawImage(image(document, 300, 240), 50, 300, 300, 240);
                    content.drawImage(image(document, 40, 40), 50, 100, 40, 40);
                }
            }

            ByteArrayOutputStream out = new ByteArrayOutputStream();
            document.save(out);
            return out.toByteArray();
        }
    }

    private static PDImageXObject image(PDDocument document, int width, int height) throws IOException {
        BufferedImage image = new BufferedImage(width, height, BufferedImage.TYPE_INT_RGB);
        for (int x = 0; x < width; x++) {
            for (int y = 0; y < height; y++) {
                image.setRGB(x, y, (x * 7 + y * 3) & 0xFFFFFF);
            }
        }
        return LosslessFactory.createFromImage(document, image);
    }
}
