package com.example.pdfcrop.model;

import lombok.EqualsAndHashCode;
import lombok.Getter;

/**
 * PDF用户空间中的矩形（单位：点，y轴向上）
 * 不变式：left ≤ right，bottom ≤ top
 */
@Getter
@EqualsAndHashCode
public final class PageBox {

    private static final double EPSILON = 1e-6;

    private final double left;
    private final double bottom;
    private final double right;
    private final double top;

    private PageBox(double left, double bottom, double right, double top) {
        this.left = left;
        this.bottom = bottom;
        this.right = right;
        this.top = top;
    }

    public static PageBox of(double left, double bottom, double right, double top) {
        if (left > right || bottom > top) {
            throw new IllegalArgumentException(String.format(
                    "非法矩形: [%.2f, %.2f, %.2f, %.2f]", left, bottom, right, top));
        }
        return new PageBox(left, bottom, right, top);
    }

    /**
     * 以中心点和尺寸构造矩形
     */
    public static PageBox centered(double centerX, double centerY, double width, double height) {
        return of(centerX - width / 2.0, centerY - height / 2.0,
                centerX + width / 2.0, centerY + height / 2.0);
    }

    public double getWidth() {
        return right - left;
    }

    public double getHeight() {
        return top - bottom;
    }

    public double getCenterX() {
        return (left + right) / 2.0;
    }

    public double getCenterY() {
        return (bottom + top) / 2.0;
    }

    public double edge(Side side) {
        switch (side) {
            case LEFT:
                return left;
            case BOTTOM:
                return bottom;
            case RIGHT:
                return right;
            default:
                return top;
        }
    }

    /**
     * 各边向内收缩指定距离，负值表示向外扩展
     */
    public PageBox shrink(SideValues margins) {
        return of(left + margins.getLeft(), bottom + margins.getBottom(),
                right - margins.getRight(), top - margins.getTop());
    }

    /**
     * 把矩形的每条边限制在 bounds 内
     */
    public PageBox clampTo(PageBox bounds) {
        double l = clamp(left, bounds.left, bounds.right);
        double r = clamp(right, bounds.left, bounds.right);
        double b = clamp(bottom, bounds.bottom, bounds.top);
        double t = clamp(top, bounds.bottom, bounds.top);
        return of(l, b, Math.max(l, r), Math.max(b, t));
    }

    /**
     * 平移矩形，使其落在 bounds 内；尺寸超出 bounds 的轴直接取 bounds
     */
    public PageBox fitInto(PageBox bounds) {
        double l = left;
        double r = right;
        if (getWidth() >= bounds.getWidth()) {
            l = bounds.left;
            r = bounds.right;
        } else if (l < bounds.left) {
            r += bounds.left - l;
            l = bounds.left;
        } else if (r > bounds.right) {
            l -= r - bounds.right;
            r = bounds.right;
        }

        double b = bottom;
        double t = top;
        if (getHeight() >= bounds.getHeight()) {
            b = bounds.bottom;
            t = bounds.top;
        } else if (b < bounds.bottom) {
            t += bounds.bottom - b;
            b = bounds.bottom;
        } else if (t > bounds.top) {
            b -= t - bounds.top;
            t = bounds.top;
        }
        return of(l, b, r, t);
    }

    /**
     * 平移矩形（保持尺寸），尽量把 content 包含进来
     */
    public PageBox slideToContain(PageBox content) {
        double dx = 0.0;
        if (content.left < left) {
            dx = content.left - left;
        } else if (content.right > right) {
            dx = content.right - right;
        }
        double dy = 0.0;
        if (content.bottom < bottom) {
            dy = content.bottom - bottom;
        } else if (content.top > top) {
            dy = content.top - top;
        }
        return of(left + dx, bottom + dy, right + dx, top + dy);
    }

    /**
     * 是否完整包含 other（允许浮点误差）
     */
    public boolean contains(PageBox other) {
        return other.left >= left - EPSILON && other.right <= right + EPSILON
                && other.bottom >= bottom - EPSILON && other.top <= top + EPSILON;
    }

    private static double clamp(double value, double min, double max) {
        return Math.max(min, Math.min(max, value));
    }

    @Override
    public String toString() {
        return String.format("[%.2f, %.2f, %.2f, %.2f]", left, bottom, right, top);
    }
}
