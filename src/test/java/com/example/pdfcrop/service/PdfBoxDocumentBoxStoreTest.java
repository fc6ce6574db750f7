package com.example.pdfcrop.service;

import com.example.pdfcrop.model.PageBox;
import com.example.pdfcrop.model.PageInfo;
import org.apache.pdfbox.cos.COSName;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.pdmodel.common.PDRectangle;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class PdfBoxDocumentBoxStoreTest {

    private PDDocument document;
    private PdfBoxDocumentBoxStore store;

    @BeforeEach
    void setUp() {
        document = new PDDocument();
        document.addPage(new PDPage(PDRectangle.LETTER));
        PDPage second = new PDPage(PDRectangle.LETTER);
        second.setCropBox(PdfBoxDocumentBoxStore.toRectangle(PageBox.of(18, 18, 594, 774)));
        second.setRotation(90);
        document.addPage(second);
        store = new PdfBoxDocumentBoxStore(document);
    }

    @AfterEach
    void tearDown() throws IOException {
        document.close();
    }

    @Test
    void readsMediaAndCropBoxes() {
        PageInfo first = store.readPage(0);
        PageInfo second = store.readPage(1);

        assertEquals(2, store.getPageCount());
        assertNull(first.getCropBox());
        assertEquals(PageBox.of(0, 0, 612, 792), first.getOriginalBox());
        assertEquals(PageBox.of(18, 18, 594, 774), second.getOriginalBox());
        assertEquals(90, second.getRotation());
    }

    @Test
    void firstWriteRecordsOriginalAndLaterWritesKeepIt() {
        assertFalse(store.isMarked());

        store.writeBox(1, PageBox.of(50, 50, 500, 700));
        store.writeBox(1, PageBox.of(60, 60, 400, 600));

        assertTrue(store.isMarked());
        assertEquals(PageBox.of(18, 18, 594, 774), store.readOriginalBox(1));
        assertEquals(PageBox.of(60, 60, 400, 600),
                PdfBoxDocumentBoxStore.toPageBox(document.getPage(1).getCropBox()));
    }

    @Test
    void recordSurvivesSaveAndReload() throws IOException {
        store.writeBox(0, PageBox.of(100, 100, 300, 300));

        ByteArrayOutputStream out = new ByteArrayOutputStream();
        document.save(out);

        try (PDDocument reloaded = PDDocument.load(new ByteArrayInputStream(out.toByteArray()))) {
            PdfBoxDocumentBoxStore reloadedStore = new PdfBoxDocumentBoxStore(reloaded);
            assertTrue(reloadedStore.isMarked());
            assertEquals(PageBox.of(0, 0, 612, 792), reloadedStore.readOriginalBox(0));
        }
    }

    private PageBox cropBoxOf(int page) {
        return PdfBoxDocumentBoxStore.toPageBox(document.getPage(page).getCropBox());
    }

    @Test
    void repeatedRestoreGivesTheSameBoxesAndKeepsTheRecord() {
        store.writeBox(1, PageBox.of(50, 50, 500, 700));

        store.restoreOriginal(1);
        PageBox once = cropBoxOf(1);
        store.restoreOriginal(1);

        assertEquals(PageBox.of(18, 18, 594, 774), once);
        assertEquals(once, cropBoxOf(1));
        assertTrue(store.isMarked());
        assertEquals(PageBox.of(18, 18, 594, 774), store.readOriginalBox(1));

        store.writeBox(1, PageBox.of(60, 60, 400, 600));
        assertEquals(PageBox.of(18, 18, 594, 774), store.readOriginalBox(1));
    }

    @Test
    void restoreRemovesCropBoxThatThePageNeverHad() {
        PDPage page = document.getPage(0);
        store.writeBox(0, PageBox.of(100, 100, 300, 300));
        assertTrue(page.getCOSObject().containsKey(COSName.CROP_BOX));

        store.restoreOriginal(0);
        store.restoreOriginal(0);

        assertFalse(page.getCOSObject().containsKey(COSName.CROP_BOX));
        assertEquals(PageBox.of(0, 0, 612, 792), store.readOriginalBox(0));
    }

    @Test
    void inheritedCropBoxIsRecordedWithoutCopyingItOntoThePage() {
        PageBox inherited = PageBox.of(20, 20, 592, 772);
        document.getPages().getCOSObject().setItem(COSName.CROP_BOX,
                PdfBoxDocumentBoxStore.toRectangle(inherited).getCOSArray());
        assertEquals(inherited, cropBoxOf(0));

        store.writeBox(0, PageBox.of(100, 100, 300, 300));
        assertEquals(inherited, store.readOriginalBox(0));

        store.restoreOriginal(0);

        assertFalse(document.getPage(0).getCOSObject().containsKey(COSName.CROP_BOX));
        assertEquals(inherited, cropBoxOf(0));
    }

    @Test
    void restoringAnUntouchedPageChangesNothing() {
        store.restoreOriginal(0);

        assertFalse(document.getPage(0).getCOSObject().containsKey(COSName.CROP_BOX));
        assertFalse(store.isMarked());
    }
}
