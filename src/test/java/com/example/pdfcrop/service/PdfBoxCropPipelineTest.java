package com.example.pdfcrop.service;

import com.example.pdfcrop.model.CropPolicy;
import com.example.pdfcrop.model.CropResult;
import com.example.pdfcrop.model.PageBox;
import com.example.pdfcrop.model.PageRaster;
import com.example.pdfcrop.model.RetainCurve;
import com.example.pdfcrop.model.SideValues;
import org.apache.pdfbox.cos.COSName;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.pdmodel.PDPageContentStream;
import org.apache.pdfbox.pdmodel.common.PDRectangle;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * PDFBox 渲染 + OpenCV 检测的完整流程
 */
class PdfBoxCropPipelineTest {

    private static final double TOLERANCE = 1.5;
    private static final PageBox CONTENT = PageBox.of(100, 200, 400, 600);

    private PDDocument document;
    private ExecutorService executor;

    @BeforeAll
    static void loadOpenCv() {
        nu.pattern.OpenCV.loadLocally();
    }

    @BeforeEach
    void setUp() throws IOException {
        document = new PDDocument();
        document.addPage(pageWithBlock(0));
        document.addPage(pageWithBlock(90));
        executor = Executors.newFixedThreadPool(2);
    }

    @AfterEach
    void tearDown() throws IOException {
        executor.shutdownNow();
        document.close();
    }

    private PDPage pageWithBlock(int rotation) throws IOException {
        PDPage page = new PDPage(PDRectangle.LETTER);
        page.setRotation(rotation);
        try (PDPageContentStream content = new PDPageContentStream(document, page)) {
            content.addRect((float) CONTENT.getLeft(), (float) CONTENT.getBottom(),
                    (float) CONTENT.getWidth(), (float) CONTENT.getHeight());
            content.fill();
        }
        return page;
    }

    private static void assertBoxClose(PageBox expected, PageBox actual) {
        assertEquals(expected.getLeft(), actual.getLeft(), TOLERANCE, "left " + actual);
        assertEquals(expected.getBottom(), actual.getBottom(), TOLERANCE, "bottom " + actual);
        assertEquals(expected.getRight(), actual.getRight(), TOLERANCE, "right " + actual);
        assertEquals(expected.getTop(), actual.getTop(), TOLERANCE, "top " + actual);
    }

    @Test
    void detectsBlockOnUprightAndRotatedPages() {
        PdfBoxPageRasterizer rasterizer = new PdfBoxPageRasterizer(document);
        BoundingBoxDetector detector = new BoundingBoxDetector(2);
        PageBox letter = PageBox.of(0, 0, 612, 792);

        for (int page = 0; page < 2; page++) {
            PageRaster raster = rasterizer.render(page, letter, 72f);
            assertBoxClose(CONTENT, detector.detect(raster, 191, 0, 0).getContentBox());
        }
    }

    @Test
    void renderingLeavesPageBoxesUntouched() {
        PdfBoxPageRasterizer rasterizer = new PdfBoxPageRasterizer(document);

        PageRaster raster = rasterizer.render(0, PageBox.of(50, 50, 450, 650), 72f);

        assertEquals(400, raster.getImage().getWidth());
        assertEquals(600, raster.getImage().getHeight());
        assertFalse(document.getPage(0).getCOSObject().containsKey(COSName.CROP_BOX));
    }

    @Test
    void cropsToContentAndRestoresOriginal() {
        PdfBoxDocumentBoxStore store = new PdfBoxDocumentBoxStore(document);
        CropEngine engine = new CropEngine(new PdfBoxPageRasterizer(document), store,
                new BoundingBoxDetector(2), new MarginAggregator(RetainCurve.LINEAR),
                new OffsetRatioResolver(), new CropBoxBuilder(), executor, 72f, 4_000_000L);

        CropResult cropped = engine.computeCrop(CropPolicy.builder().percentRetain(SideValues.all(0)).build());
        cropped.getPageBoxes().forEach(store::writeBox);

        for (int page = 0; page < 2; page++) {
            assertBoxClose(CONTENT, PdfBoxDocumentBoxStore.toPageBox(document.getPage(page).getCropBox()));
        }

        CropPolicy restore = CropPolicy.builder().restore(true).build();
        for (int round = 0; round < 2; round++) {
            CropResult restored = engine.computeCrop(restore);
            restored.getPageBoxes().keySet().forEach(store::restoreOriginal);

            assertTrue(restored.isRestored());
            assertTrue(store.isMarked());
            for (int page = 0; page < 2; page++) {
                assertEquals(PageBox.of(0, 0, 612, 792), restored.getPageBox(page));
                assertEquals(PageBox.of(0, 0, 612, 792),
                        PdfBoxDocumentBoxStore.toPageBox(document.getPage(page).getCropBox()));
                assertEquals(PageBox.of(0, 0, 612, 792), store.readOriginalBox(page));
            }
        }
    }
}
