package com.example.pdfcrop.service;

import com.example.pdfcrop.model.PageBox;
import com.example.pdfcrop.model.PageInfo;
import com.example.pdfcrop.model.SideValues;
import lombok.extern.slf4j.Slf4j;

import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * 根据最终裁剪量生成每页的裁剪框
 */
@Slf4j
public class CropBoxBuilder {

    /**
     * 基准框按裁剪量向内收缩；负裁剪量向外扩展，但不超出 MediaBox
     */
    public PageBox build(PageInfo page, SideValues margins) {
        return page.getOriginalBox().shrink(margins).clampTo(page.getMediaBox());
    }

    /**
     * 生成选中页面的裁剪框
     *
     * @param pages        选中页面的几何信息
     * @param margins      每页最终裁剪量
     * @param contentBoxes 每页检测到的内容框，仅 cropSafe 时使用，可为空
     * @param samePageSize 是否统一所有页面的尺寸
     */
    public SortedMap<Integer, PageBox> buildAll(Map<Integer, PageInfo> pages,
                                                Map<Integer, SideValues> margins,
                                                Map<Integer, PageBox> contentBoxes,
                                                boolean samePageSize) {

        SortedMap<Integer, PageBox> boxes = new TreeMap<>();
        pages.forEach((index, page) -> boxes.put(index, build(page, margins.get(index))));

        if (samePageSize && !boxes.isEmpty()) {
            normalizeSizes(pages, boxes, contentBoxes);
        }
        return boxes;
    }

    /**
     * 取所有页面的最小宽度和最小高度，把每页的框以原中心重新居中到该尺寸。
     * cropSafe 时尺寸至少为最大的内容尺寸，并平移以包含本页内容；MediaBox 优先。
     */
    private void normalizeSizes(Map<Integer, PageInfo> pages,
                                SortedMap<Integer, PageBox> boxes,
                                Map<Integer, PageBox> contentBoxes) {

        double width = boxes.values().stream().mapToDouble(PageBox::getWidth).min().orElse(0);
        double height = boxes.values().stream().mapToDouble(PageBox::getHeight).min().orElse(0);

        if (contentBoxes != null) {
            for (PageBox content : contentBoxes.values()) {
                width = Math.max(width, content.getWidth());
                height = Math.max(height, content.getHeight());
            }
        }
        log.debug("统一页面尺寸: {} × {}", String.format("%.2f", width), String.format("%.2f", height));

        for (Map.Entry<Integer, PageBox> entry : boxes.entrySet()) {
            PageBox box = entry.getValue();
            PageBox resized = PageBox.centered(box.getCenterX(), box.getCenterY(), width, height);

            PageBox content = contentBoxes == null ? null : contentBoxes.get(entry.getKey());
            if (content != null) {
                resized = resized.slideToContain(content);
            }
            entry.setValue(resized.fitInto(pages.get(entry.getKey()).getMediaBox()));
        }
    }
}
