package com.dcruver.litsync.extract;

import lombok.extern.slf4j.Slf4j;
import org.apache.pdfbox.Loader;
import org.apache.pdfbox.cos.COSName;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.pdmodel.PDResources;
import org.apache.pdfbox.pdmodel.graphics.PDXObject;
import org.apache.pdfbox.pdmodel.graphics.image.PDImageXObject;
import org.apache.pdfbox.text.PDFTextStripper;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * PDF extraction with Apache PDFBox.
 * Small, first-page header and strip-shaped images are skipped as logos and rules.
 */
@Slf4j
public class PdfBoxTextExtractor implements TextExtractor {

    private static final int MIN_IMAGE_SIDE = 200;
    private static final int MIN_FIRST_PAGE_HEIGHT = 400;

    private final int maxImages;

    public PdfBoxTextExtractor(int maxImages) {
        this.maxImages = maxImages;
    }

    @Override
    public ExtractionResult extractText(byte[] payload) {
        try (PDDocument document = Loader.loadPDF(payload)) {
            PDFTextStripper stripper = new PDFTextStripper();
            stripper.setSortByPosition(true);
            String text = stripper.getText(document);

            String rejection = TextQualityCheck.rejectionReason(text);
            if (rejection != null) {
                log.warn("PDF text unusable: {}", rejection);
                return ExtractionResult.fallback(rejection);
            }
            log.info("Extracted {} chars from {} pages", text.length(), document.getNumberOfPages());
            return ExtractionResult.of(text.strip(), TextQualityCheck.confidence(text));
        } catch (IOException e) {
            log.warn("PDF extraction error: {}", e.getMessage());
            return ExtractionResult.fallback("extraction error: " + e.getMessage());
        }
    }

    @Override
    public List<ImageBlob> extractImages(byte[] payload) {
        List<ImageBlob> images = new ArrayList<>();
        if (maxImages <= 0) {
            return images;
        }

        try (PDDocument document = Loader.loadPDF(payload)) {
            int pageIndex = 0;
            for (PDPage page : document.getPages()) {
                PDResources resources = page.getResources();
                if (resources != null) {
                    for (COSName name : resources.getXObjectNames()) {
                        PDXObject xObject = resources.getXObject(name);
                        if (!(xObject instanceof PDImageXObject)) {
                            continue;
                        }
                        PDImageXObject image = (PDImageXObject) xObject;
                        if (keep(image, pageIndex)) {
                            images.add(toBlob(image, pageIndex, images.size()));
                            if (images.size() >= maxImages) {
                                return images;
                            }
                        }
                    }
                }
                pageIndex++;
            }
        } catch (IOException e) {
            log.warn("PDF image extraction error: {}", e.getMessage());
        }
        return images;
    }

    private static boolean keep(PDImageXObject image, int pageIndex) {
        int width = image.getWidth();
        int height = image.getHeight();
        if (width < MIN_IMAGE_SIDE || height < MIN_IMAGE_SIDE) {
            return false;
        }
        if (pageIndex == 0 && height < MIN_FIRST_PAGE_HEIGHT) {
            return false;
        }
        double aspect = (double) width / height;
        return aspect >= 0.2 && aspect <= 5;
    }

    private static ImageBlob toBlob(PDImageXObject image, int pageIndex, int index) throws IOException {
        BufferedImage buffered = image.getImage();
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        ImageIO.write(buffered, "png", out);
        return ImageBlob.builder()
            .name(String.format("page%d_img%d.png", pageIndex + 1, index + 1))
            .mimeType("image/png")
            .page(pageIndex + 1)
            .width(image.getWidth())
            .height(image.getHeight())
            .data(out.toByteArray())
            .build();
    }
}
