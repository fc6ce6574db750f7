package com.example.pdfcrop.service;

import com.example.pdfcrop.exception.CropBusyException;
import com.example.pdfcrop.exception.CropParseException;
import com.example.pdfcrop.exception.SessionNotFoundException;
import com.example.pdfcrop.model.CropOutcome;
import com.example.pdfcrop.model.CropPolicy;
import com.example.pdfcrop.model.PageBox;
import com.example.pdfcrop.model.SideValues;
import org.apache.pdfbox.cos.COSName;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.pdmodel.PDPageContentStream;
import org.apache.pdfbox.pdmodel.common.PDRectangle;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.core.io.Resource;
import org.springframework.mock.web.MockMultipartFile;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@SpringBootTest
class CropSessionServiceTest {

    @Autowired
    private CropSessionService cropSessionService;

    private static MockMultipartFile samplePdf(String name) throws IOException {
        try (PDDocument document = new PDDocument()) {
            for (int i = 0; i < 2; i++) {
                PDPage page = new PDPage(PDRectangle.LETTER);
                document.addPage(page);
                try (PDPageContentStream content = new PDPageContentStream(document, page)) {
                    content.addRect(100, 200, 300, 400);
                    content.fill();
                }
            }
            ByteArrayOutputStream out = new ByteArrayOutputStream();
            document.save(out);
            return new MockMultipartFile("file", name, "application/pdf", out.toByteArray());
        }
    }

    private PageBox cropBoxOf(String fileName, int page) throws IOException {
        Resource resource = cropSessionService.loadFileAsResource(fileName);
        try (InputStream in = resource.getInputStream(); PDDocument document = PDDocument.load(in)) {
            return PdfBoxDocumentBoxStore.toPageBox(document.getPage(page).getCropBox());
        }
    }

    private boolean hasOwnCropBox(String fileName, int page) throws IOException {
        Resource resource = cropSessionService.loadFileAsResource(fileName);
        try (InputStream in = resource.getInputStream(); PDDocument document = PDDocument.load(in)) {
            return document.getPage(page).getCOSObject().containsKey(COSName.CROP_BOX);
        }
    }

    @Test
    void uploadCropAndRestore() throws IOException {
        CropSession session = cropSessionService.upload(samplePdf("report.pdf"));
        assertEquals(2, session.getPageCount());

        cropSessionService.updatePolicy(session.getId(), Map.of("percentRetain", "0"));
        CropOutcome cropped = cropSessionService.crop(session.getId());

        assertTrue(cropped.getFileName().startsWith("report_cropped_"));
        PageBox box = cropBoxOf(cropped.getFileName(), 1);
        assertEquals(100, box.getLeft(), 1.5);
        assertEquals(600, box.getTop(), 1.5);

        for (int round = 0; round < 2; round++) {
            CropOutcome restored = cropSessionService.restore(session.getId());
            assertTrue(restored.getResult().isRestored());
            assertEquals(PageBox.of(0, 0, 612, 792), cropBoxOf(restored.getFileName(), 1));
            assertFalse(hasOwnCropBox(restored.getFileName(), 1));
        }
        assertEquals(PageBox.of(0, 0, 612, 792), cropSessionService.originalBoxes(session.getId()).get(0));
        assertEquals(2, cropSessionService.originalBoxes(session.getId()).size());

        cropSessionService.closeSession(session.getId());
    }

    @Test
    void invalidFieldKeepsLastGoodValue() throws IOException {
        CropSession session = cropSessionService.upload(samplePdf("policy.pdf"));
        Map<String, String> edits = new LinkedHashMap<>();
        edits.put("threshold", "300");
        edits.put("setPageRatios", "3:-4");

        CropParseException e = assertThrows(CropParseException.class,
                () -> cropSessionService.updatePolicy(session.getId(), edits));

        CropPolicy policy = cropSessionService.getSession(session.getId()).getPolicy();
        assertEquals("setPageRatios", e.getParameter());
        assertEquals(255, policy.getThreshold());
        assertNull(policy.getPageRatio());
        assertEquals(SideValues.all(10), policy.getPercentRetain());

        cropSessionService.closeSession(session.getId());
    }

    @Test
    void unknownSessionAndEscapingFileNamesAreRejected() {
        assertThrows(SessionNotFoundException.class, () -> cropSessionService.crop("missing"));
        assertThrows(IOException.class, () -> cropSessionService.loadFileAsResource("../pom.xml"));
    }

    @Test
    void oldestSessionIsEvictedAtLimit() throws IOException {
        CropSession first = cropSessionService.upload(samplePdf("a.pdf"));
        CropSession last = first;
        for (int i = 0; i < 4; i++) {
            last = cropSessionService.upload(samplePdf("b" + i + ".pdf"));
        }

        String firstId = first.getId();
        assertThrows(SessionNotFoundException.class, () -> cropSessionService.getSession(firstId));
        assertEquals(last, cropSessionService.getSession(last.getId()));
    }

    /**
     * 在另一个线程持有会话锁，模拟正在裁剪或保存的会话
     */
    private static final class HeldLock implements AutoCloseable {
        private final ExecutorService holder = Executors.newSingleThreadExecutor();
        private final CountDownLatch release = new CountDownLatch(1);

        HeldLock(CropSession session) throws InterruptedException {
            CountDownLatch locked = new CountDownLatch(1);
            holder.submit(() -> {
                session.getLock().lock();
                try {
                    locked.countDown();
                    release.await();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                } finally {
                    session.getLock().unlock();
                }
            });
            assertTrue(locked.await(5, TimeUnit.SECONDS));
        }

        @Override
        public void close() throws InterruptedException {
            release.countDown();
            holder.shutdown();
            assertTrue(holder.awaitTermination(5, TimeUnit.SECONDS));
        }
    }

    @Test
    void closingABusySessionIsRejectedAndLeavesItOpen() throws Exception {
        CropSession session = cropSessionService.upload(samplePdf("busy.pdf"));

        try (HeldLock ignored = new HeldLock(session)) {
            assertThrows(CropBusyException.class, () -> cropSessionService.closeSession(session.getId()));
            assertFalse(session.isClosed());
            assertEquals(session, cropSessionService.getSession(session.getId()));
        }

        cropSessionService.closeSession(session.getId());
        assertTrue(session.isClosed());
        assertThrows(SessionNotFoundException.class, () -> cropSessionService.getSession(session.getId()));
    }

    @Test
    void evictionSkipsSessionsThatAreBeingProcessed() throws Exception {
        CropSession held = cropSessionService.upload(samplePdf("held.pdf"));
        CropSession next = null;

        try (HeldLock ignored = new HeldLock(held)) {
            for (int i = 0; i < 4; i++) {
                CropSession uploaded = cropSessionService.upload(samplePdf("c" + i + ".pdf"));
                if (next == null) {
                    next = uploaded;
                }
            }
        }

        assertFalse(held.isClosed());
        assertEquals(held, cropSessionService.getSession(held.getId()));
        assertTrue(next.isClosed());
        String nextId = next.getId();
        assertThrows(SessionNotFoundException.class, () -> cropSessionService.getSession(nextId));
        cropSessionService.closeSession(held.getId());
    }
}
