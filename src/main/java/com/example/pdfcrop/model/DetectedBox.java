package com.example.pdfcrop.model;

/**
 * 页面内容边界框检测结果
 *
 * <p>同时保存全部前景的边界框和忽略孤立小噪点后的"文本"边界框，
 * 切换 percentText 时无需重新检测。空白页的边界框是位于页面中心的零面积矩形。
 */
public class DetectedBox {
    private final int pageIndex;
    private final PageBox contentBox;
    private final PageBox textBox;
    private final boolean blank;
    private final float resolution;

    public DetectedBox(int pageIndex, PageBox contentBox, PageBox textBox,
                       boolean blank, float resolution) {
        this.pageIndex = pageIndex;
        this.contentBox = contentBox;
        this.textBox = textBox;
        this.blank = blank;
        this.resolution = resolution;
    }

    public int getPageIndex() {
        return pageIndex;
    }

    public PageBox getContentBox() {
        return contentBox;
    }

    public PageBox getTextBox() {
        return textBox;
    }

    public boolean isBlank() {
        return blank;
    }

    public float getResolution() {
        return resolution;
    }

    /**
     * 按 percentText 选择参与统计的边界框
     */
    public PageBox boxFor(boolean percentText) {
        return percentText ? textBox : contentBox;
    }

    public DetectedBox withResolution(float dpi) {
        return new DetectedBox(pageIndex, contentBox, textBox, blank, dpi);
    }
}
