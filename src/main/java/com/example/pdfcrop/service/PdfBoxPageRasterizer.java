package com.example.pdfcrop.service;

import com.example.pdfcrop.exception.RasterException;
import com.example.pdfcrop.model.PageBox;
import com.example.pdfcrop.model.PageRaster;
import lombok.extern.slf4j.Slf4j;
import org.apache.pdfbox.cos.COSBase;
import org.apache.pdfbox.cos.COSName;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.rendering.ImageType;
import org.apache.pdfbox.rendering.PDFRenderer;

import java.awt.image.BufferedImage;
import java.io.IOException;

/**
 * 基于 PDFBox 的页面渲染
 *
 * <p>渲染前把页面的 CropBox 临时设为目标区域，渲染完成后恢复原值。
 * PDDocument 不是线程安全的，渲染在文档上串行执行。
 */
@Slf4j
public class PdfBoxPageRasterizer implements PageRasterizer {

    private final PDDocument document;

    public PdfBoxPageRasterizer(PDDocument document) {
        this.document = document;
    }

    @Override
    public PageRaster render(int pageIndex, PageBox region, float resolution) {
        synchronized (document) {
            if (pageIndex < 0 || pageIndex >= document.getNumberOfPages()) {
                throw new RasterException(pageIndex, "pageIndex", "页面索引超出范围: " + pageIndex);
            }
            PDPage page = document.getPage(pageIndex);
            COSBase savedCropBox = page.getCOSObject().getItem(COSName.CROP_BOX);

            try {
                page.setCropBox(PdfBoxDocumentBoxStore.toRectangle(region));

                PDFRenderer renderer = new PDFRenderer(document);
                renderer.setSubsamplingAllowed(false);
                BufferedImage image = renderer.renderImageWithDPI(pageIndex, resolution, ImageType.GRAY);

                log.trace("页面 {} 渲染完成 (DPI: {}, {}×{})",
                        pageIndex + 1, resolution, image.getWidth(), image.getHeight());
                return new PageRaster(pageIndex, image, region, resolution / 72.0, page.getRotation());

            } catch (IOException e) {
                throw new RasterException(pageIndex, "raster",
                        "渲染第 " + (pageIndex + 1) + " 页失败: " + e.getMessage(), e);
            } finally {
                if (savedCropBox == null) {
                    page.getCOSObject().removeItem(COSName.CROP_BOX);
                } else {
                    page.getCOSObject().setItem(COSName.CROP_BOX, savedCropBox);
                }
            }
        }
    }
}
