package com.example.pdfcrop.service;

import com.example.pdfcrop.exception.RasterException;
import com.example.pdfcrop.model.DetectedBox;
import com.example.pdfcrop.model.PageBox;
import com.example.pdfcrop.model.PageRaster;
import lombok.extern.slf4j.Slf4j;
import org.opencv.core.Core;
import org.opencv.core.CvType;
import org.opencv.core.Mat;
import org.opencv.core.MatOfPoint;
import org.opencv.core.Rect;
import org.opencv.core.Size;
import org.opencv.imgproc.Imgproc;

import java.awt.image.BufferedImage;
import java.awt.image.Raster;

/**
 * 页面内容边界框检测
 *
 * <p>检测流程：
 * <ol>
 *   <li>numBlurs 次 3×3 均值模糊</li>
 *   <li>numSmooths 次 3×3 中值滤波，去除扫描和压缩噪点</li>
 *   <li>按阈值二值化：灰度 ≤ threshold 为前景</li>
 *   <li>前景像素的最小外接矩形</li>
 *   <li>连通域过滤：忽略尺寸低于下限的孤立小点，得到"文本"边界框</li>
 * </ol>
 *
 * <p>调用前必须已加载 OpenCV 本地库。
 */
@Slf4j
public class BoundingBoxDetector {

    private static final int KERNEL_SIZE = 3;

    private final int textMinComponentPx;

    public BoundingBoxDetector(int textMinComponentPx) {
        this.textMinComponentPx = Math.max(1, textMinComponentPx);
    }

    /**
     * 检测单页的内容边界框
     *
     * @param raster     页面灰度栅格
     * @param threshold  二值化阈值 (0-255)
     * @param numBlurs   模糊次数
     * @param numSmooths 中值滤波次数
     * @return 用户空间中的边界框
     * @throws RasterException 栅格为空或尺寸非法
     */
    public DetectedBox detect(PageRaster raster, int threshold, int numBlurs, int numSmooths) {
        validate(raster);
        int pageIndex = raster.getPageIndex();

        Mat gray = null;
        Mat binary = null;
        MatOfPoint foreground = null;

        try {
            // 1. 转换为单通道灰度矩阵
            gray = toGrayMat(raster.getImage());

            // 2. 模糊与平滑
            for (int i = 0; i < numBlurs; i++) {
                Imgproc.blur(gray, gray, new Size(KERNEL_SIZE, KERNEL_SIZE));
            }
            for (int i = 0; i < numSmooths; i++) {
                Imgproc.medianBlur(gray, gray, KERNEL_SIZE);
            }

            // 3. 二值化：src > threshold 为背景(0)，其余为前景(255)
            binary = new Mat();
            Imgproc.threshold(gray, binary, threshold, 255, Imgproc.THRESH_BINARY_INV);

            // 4. 前景外接矩形
            foreground = new MatOfPoint();
            Core.findNonZero(binary, foreground);
            if (foreground.empty()) {
                log.trace("第 {} 页为空白页", pageIndex + 1);
                return blankBox(raster);
            }
            Rect content = Imgproc.boundingRect(foreground);

            // 5. 文本边界框
            Rect text = textBoundingRect(binary);
            if (text == null) {
                text = content;
            }

            PageBox contentBox = toPageBox(raster, content);
            PageBox textBox = toPageBox(raster, text);
            log.trace("第 {} 页边界框: {} (文本: {})", pageIndex + 1, contentBox, textBox);

            return new DetectedBox(pageIndex, contentBox, textBox, false,
                    (float) (raster.getPixelsPerPoint() * 72.0));

        } finally {
            releaseMat(gray, binary, foreground);
        }
    }

    /**
     * 连通域过滤后剩余前景的外接矩形，全部被过滤时返回 null
     */
    private Rect textBoundingRect(Mat binary) {
        Mat labels = new Mat();
        Mat stats = new Mat();
        Mat centroids = new Mat();

        try {
            int count = Imgproc.connectedComponentsWithStats(
                    binary, labels, stats, centroids, 8, CvType.CV_32S);

            int minX = Integer.MAX_VALUE;
            int minY = Integer.MAX_VALUE;
            int maxX = Integer.MIN_VALUE;
            int maxY = Integer.MIN_VALUE;
            int kept = 0;

            // 标签 0 是背景
            for (int label = 1; label < count; label++) {
                int x = (int) stats.get(label, Imgproc.CC_STAT_LEFT)[0];
                int y = (int) stats.get(label, Imgproc.CC_STAT_TOP)[0];
                int w = (int) stats.get(label, Imgproc.CC_STAT_WIDTH)[0];
                int h = (int) stats.get(label, Imgproc.CC_STAT_HEIGHT)[0];

                if (w < textMinComponentPx && h < textMinComponentPx) {
                    continue;
                }
                minX = Math.min(minX, x);
                minY = Math.min(minY, y);
                maxX = Math.max(maxX, x + w);
                maxY = Math.max(maxY, y + h);
                kept++;
            }

            log.trace("连通域筛选: 总数={}, 保留={}", count - 1, kept);
            return kept == 0 ? null : new Rect(minX, minY, maxX - minX, maxY - minY);

        } finally {
            releaseMat(labels, stats, centroids);
        }
    }

    private void validate(PageRaster raster) {
        if (raster == null) {
            throw new RasterException(-1, "raster", "页面栅格为空");
        }
        BufferedImage image = raster.getImage();
        if (image == null || image.getWidth() <= 0 || image.getHeight() <= 0) {
            throw new RasterException(raster.getPageIndex(), "raster",
                    "第 " + (raster.getPageIndex() + 1) + " 页的栅格为空");
        }
        if (!(raster.getPixelsPerPoint() > 0)) {
            throw new RasterException(raster.getPageIndex(), "resolution",
                    "第 " + (raster.getPageIndex() + 1) + " 页的分辨率非法: " + raster.getPixelsPerPoint());
        }
        if (raster.getRegion() == null) {
            throw new RasterException(raster.getPageIndex(), "raster",
                    "第 " + (raster.getPageIndex() + 1) + " 页缺少渲染区域");
        }
    }

    /**
     * 空白页：页面中心处的零面积矩形
     */
    private DetectedBox blankBox(PageRaster raster) {
        PageBox region = raster.getRegion();
        PageBox center = PageBox.centered(region.getCenterX(), region.getCenterY(), 0, 0);
        return new DetectedBox(raster.getPageIndex(), center, center, true,
                (float) (raster.getPixelsPerPoint() * 72.0));
    }

    private PageBox toPageBox(PageRaster raster, Rect rect) {
        return raster.toUserSpace(rect.x, rect.y, rect.x + rect.width, rect.y + rect.height)
                .clampTo(raster.getRegion());
    }

    /**
     * BufferedImage 转单通道灰度 Mat
     */
    private Mat toGrayMat(BufferedImage image) {
        int width = image.getWidth();
        int height = image.getHeight();
        byte[] pixels = new byte[width * height];

        if (image.getType() == BufferedImage.TYPE_BYTE_GRAY) {
            Raster data = image.getRaster();
            int[] row = new int[width];
            for (int y = 0; y < height; y++) {
                data.getSamples(0, y, width, 1, 0, row);
                for (int x = 0; x < width; x++) {
                    pixels[y * width + x] = (byte) row[x];
                }
            }
        } else {
            for (int y = 0; y < height; y++) {
                for (int x = 0; x < width; x++) {
                    int rgb = image.getRGB(x, y);
                    int r = (rgb >> 16) & 0xFF;
                    int g = (rgb >> 8) & 0xFF;
                    int b = rgb & 0xFF;
                    pixels[y * width + x] = (byte) Math.round(0.299 * r + 0.587 * g + 0.114 * b);
                }
            }
        }

        Mat mat = new Mat(height, width, CvType.CV_8UC1);
        mat.put(0, 0, pixels);
        return mat;
    }

    /**
     * 释放Mat资源
     */
    private void releaseMat(Mat... mats) {
        for (Mat mat : mats) {
            if (mat != null && !mat.empty()) {
                mat.release();
            }
        }
    }
}
