package com.example.pdfcrop.model;

import java.awt.image.BufferedImage;

/**
 * 页面渲染结果
 * 包含页面索引、灰度图像、渲染区域（点）、每点像素数以及渲染时的页面旋转角度
 */
public class PageRaster {
    private final int pageIndex;
    private final BufferedImage image;
    private final PageBox region;
    private final double pixelsPerPoint;
    private final int rotation;

    public PageRaster(int pageIndex, BufferedImage image, PageBox region,
                      double pixelsPerPoint, int rotation) {
        this.pageIndex = pageIndex;
        this.image = image;
        this.region = region;
        this.pixelsPerPoint = pixelsPerPoint;
        this.rotation = ((rotation % 360) + 360) % 360;
    }

    public int getPageIndex() {
        return pageIndex;
    }

    public BufferedImage getImage() {
        return image;
    }

    public PageBox getRegion() {
        return region;
    }

    public double getPixelsPerPoint() {
        return pixelsPerPoint;
    }

    public int getRotation() {
        return rotation;
    }

    /**
     * 像素矩形 [x0, x1) × [y0, y1) 转换为用户空间矩形
     *
     * <p>渲染图像已按页面旋转角度顺时针旋转，这里反向映射回未旋转的用户空间。
     */
    public PageBox toUserSpace(double x0, double y0, double x1, double y1) {
        double[] a = toUserSpace(x0, y0);
        double[] b = toUserSpace(x1, y1);
        return PageBox.of(Math.min(a[0], b[0]), Math.min(a[1], b[1]),
                Math.max(a[0], b[0]), Math.max(a[1], b[1]));
    }

    private double[] toUserSpace(double px, double py) {
        double u = px / pixelsPerPoint;
        double v = py / pixelsPerPoint;
        switch (rotation) {
            case 90:
                return new double[]{region.getLeft() + v, region.getBottom() + u};
            case 180:
                return new double[]{region.getRight() - u, region.getBottom() + v};
            case 270:
                return new double[]{region.getRight() - v, region.getTop() - u};
            default:
                return new double[]{region.getLeft() + u, region.getTop() - v};
        }
    }
}
