package com.example.pdfcrop.service;

import com.example.pdfcrop.model.PageBox;
import com.example.pdfcrop.model.PageInfo;
import lombok.extern.slf4j.Slf4j;
import org.apache.pdfbox.cos.COSArray;
import org.apache.pdfbox.cos.COSBase;
import org.apache.pdfbox.cos.COSDictionary;
import org.apache.pdfbox.cos.COSName;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.pdmodel.common.PDRectangle;

/**
 * 基于 PDFBox 的页面框读写
 *
 * <p>第一次写入某页时，把该页字典中原来的 /CropBox 项原样记录在
 * {@value #ORIGINAL_BOX_KEY} 键下（页面自身没有 /CropBox 时记为 /{@value #ABSENT_KEY}），
 * 并在文档信息中打上标记。恢复时写回原来的项，或删除页面上的 /CropBox。
 */
@Slf4j
public class PdfBoxDocumentBoxStore implements DocumentBoxStore {

    static final String ORIGINAL_BOX_KEY = "PdfCropMarginsOriginal";
    static final String RESTORE_MARKER_KEY = "PdfCropMarginsRestore";
    static final String ABSENT_KEY = "None";

    private static final COSName ORIGINAL_BOX = COSName.getPDFName(ORIGINAL_BOX_KEY);
    private static final COSName ABSENT = COSName.getPDFName(ABSENT_KEY);

    private final PDDocument document;

    public PdfBoxDocumentBoxStore(PDDocument document) {
        this.document = document;
    }

    @Override
    public int getPageCount() {
        synchronized (document) {
            return document.getNumberOfPages();
        }
    }

    @Override
    public PageInfo readPage(int pageIndex) {
        synchronized (document) {
            PDPage page = document.getPage(pageIndex);
            PageBox mediaBox = toPageBox(page.getMediaBox());

            PageBox cropBox;
            COSBase recorded = page.getCOSObject().getDictionaryObject(ORIGINAL_BOX);
            if (recorded instanceof COSArray) {
                cropBox = toPageBox(new PDRectangle((COSArray) recorded));
            } else if (ABSENT.equals(recorded)) {
                cropBox = toPageBox(inheritedCropBox(page));
            } else {
                cropBox = toPageBox(page.getCropBox());
            }
            if (cropBox.equals(mediaBox)) {
                cropBox = null;
            }
            return new PageInfo(pageIndex, mediaBox, cropBox, page.getRotation());
        }
    }

    @Override
    public void writeBox(int pageIndex, PageBox box) {
        synchronized (document) {
            PDPage page = document.getPage(pageIndex);
            if (!page.getCOSObject().containsKey(ORIGINAL_BOX)) {
                COSBase own = page.getCOSObject().getDictionaryObject(COSName.CROP_BOX);
                page.getCOSObject().setItem(ORIGINAL_BOX, own instanceof COSArray ? copy((COSArray) own) : ABSENT);
                document.getDocumentInformation().setCustomMetadataValue(RESTORE_MARKER_KEY, "true");
                log.trace("第 {} 页原始框已记录", pageIndex + 1);
            }
            page.setCropBox(toRectangle(box));
        }
    }

    /**
     * 写回记录的原始 /CropBox 项；原来没有时删除页面上的 /CropBox，恢复继承关系。
     * 没有记录的页面不做修改。记录本身保留，重复恢复结果相同。
     */
    @Override
    public void restoreOriginal(int pageIndex) {
        synchronized (document) {
            PDPage page = document.getPage(pageIndex);
            COSBase recorded = page.getCOSObject().getDictionaryObject(ORIGINAL_BOX);
            if (recorded instanceof COSArray) {
                page.getCOSObject().setItem(COSName.CROP_BOX, copy((COSArray) recorded));
            } else if (ABSENT.equals(recorded)) {
                page.getCOSObject().removeItem(COSName.CROP_BOX);
            } else {
                log.trace("第 {} 页没有原始框记录，保持不变", pageIndex + 1);
            }
        }
    }

    /**
     * 文档是否已经被裁剪过（存在原始框记录）
     */
    public boolean isMarked() {
        synchronized (document) {
            return "true".equals(document.getDocumentInformation()
                    .getCustomMetadataValue(RESTORE_MARKER_KEY));
        }
    }

    /**
     * 页面自身的 /CropBox 之外，从页面树上层继承的 CropBox；都没有时为 MediaBox
     */
    private static PDRectangle inheritedCropBox(PDPage page) {
        COSBase node = page.getCOSObject().getDictionaryObject(COSName.PARENT);
        while (node instanceof COSDictionary) {
            COSBase inherited = ((COSDictionary) node).getDictionaryObject(COSName.CROP_BOX);
            if (inherited instanceof COSArray) {
                return new PDRectangle((COSArray) inherited);
            }
            node = ((COSDictionary) node).getDictionaryObject(COSName.PARENT);
        }
        return page.getMediaBox();
    }

    private static COSArray copy(COSArray array) {
        COSArray copy = new COSArray();
        copy.addAll(array);
        return copy;
    }

    static PDRectangle toRectangle(PageBox box) {
        PDRectangle rect = new PDRectangle();
        rect.setLowerLeftX((float) box.getLeft());
        rect.setLowerLeftY((float) box.getBottom());
        rect.setUpperRightX((float) box.getRight());
        rect.setUpperRightY((float) box.getTop());
        return rect;
    }

    static PageBox toPageBox(PDRectangle rect) {
        return PageBox.of(rect.getLowerLeftX(), rect.getLowerLeftY(),
                rect.getUpperRightX(), rect.getUpperRightY());
    }
}
