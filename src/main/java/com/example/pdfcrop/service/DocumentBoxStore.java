package com.example.pdfcrop.service;

import com.example.pdfcrop.model.PageBox;
import com.example.pdfcrop.model.PageInfo;

/**
 * 文档页面框的读写
 *
 * <p>第一次写入某页时记录该页的原始框，之后的写入不会覆盖记录，
 * 因此恢复操作总能回到第一次裁剪之前的状态。
 */
public interface DocumentBoxStore {

    int getPageCount();

    /**
     * 读取页面信息；CropBox 为记录的原始值（若已记录）
     */
    PageInfo readPage(int pageIndex);

    /**
     * 第一次裁剪之前的页面框
     */
    default PageBox readOriginalBox(int pageIndex) {
        return readPage(pageIndex).getOriginalBox();
    }

    void writeBox(int pageIndex, PageBox box);

    /**
     * 把页面恢复到第一次裁剪之前的状态
     */
    default void restoreOriginal(int pageIndex) {
        writeBox(pageIndex, readOriginalBox(pageIndex));
    }
}
