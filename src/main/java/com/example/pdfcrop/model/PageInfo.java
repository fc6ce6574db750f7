package com.example.pdfcrop.model;

/**
 * 页面几何信息
 * 包含页面索引、原始 MediaBox、原始 CropBox（可为空）、旋转角度和最近一次渲染使用的分辨率
 */
public class PageInfo {
    private final int pageIndex;
    private final PageBox mediaBox;
    private final PageBox cropBox;
    private final int rotation;
    private final float resolution;

    public PageInfo(int pageIndex, PageBox mediaBox, PageBox cropBox, int rotation) {
        this(pageIndex, mediaBox, cropBox, rotation, 0f);
    }

    private PageInfo(int pageIndex, PageBox mediaBox, PageBox cropBox, int rotation, float resolution) {
        this.pageIndex = pageIndex;
        this.mediaBox = mediaBox;
        this.cropBox = cropBox;
        this.rotation = rotation;
        this.resolution = resolution;
    }

    public int getPageIndex() {
        return pageIndex;
    }

    public PageBox getMediaBox() {
        return mediaBox;
    }

    public PageBox getCropBox() {
        return cropBox;
    }

    public int getRotation() {
        return rotation;
    }

    public float getResolution() {
        return resolution;
    }

    /**
     * 裁剪的基准框：CropBox 与 MediaBox 的交集，没有 CropBox 时为 MediaBox
     */
    public PageBox getOriginalBox() {
        return cropBox == null ? mediaBox : cropBox.clampTo(mediaBox);
    }

    public PageInfo withResolution(float dpi) {
        return new PageInfo(pageIndex, mediaBox, cropBox, rotation, dpi);
    }

    /**
     * 1基页码是否为偶数
     */
    public boolean isEvenPageNumber() {
        return (pageIndex + 1) % 2 == 0;
    }
}
