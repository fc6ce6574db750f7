package com.example.pdfcrop.model;

import lombok.EqualsAndHashCode;
import lombok.Getter;

/**
 * 目标页面宽高比 width:height
 */
@Getter
@EqualsAndHashCode
public final class PageRatio {
    private final double width;
    private final double height;

    public PageRatio(double width, double height) {
        if (!(width > 0) || !(height > 0)) {
            throw new IllegalArgumentException("宽高比的两个分量都必须为正数");
        }
        this.width = width;
        this.height = height;
    }

    public double getRatio() {
        return width / height;
    }

    @Override
    public String toString() {
        return width + ":" + height;
    }
}
