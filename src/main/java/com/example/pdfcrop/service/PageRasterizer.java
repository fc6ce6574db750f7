package com.example.pdfcrop.service;

import com.example.pdfcrop.model.PageBox;
import com.example.pdfcrop.model.PageRaster;

/**
 * 页面栅格化
 */
public interface PageRasterizer {

    /**
     * 把页面中 region 范围内的内容渲染为灰度图像
     *
     * @param pageIndex  页面索引（0基）
     * @param region     渲染区域（用户空间，点），已扣除 absolutePreCrop
     * @param resolution 分辨率 (DPI)
     * @return 渲染结果
     * @throws com.example.pdfcrop.exception.RasterException 渲染失败
     */
    PageRaster render(int pageIndex, PageBox region, float resolution);
}
