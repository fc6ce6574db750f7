package com.example.pdfcrop.model;

/**
 * 页边距离：从基准框的每条边到内容边的距离，均为非负
 */
public class MarginDelta {
    private final int pageIndex;
    private final SideValues values;

    public MarginDelta(int pageIndex, SideValues values) {
        this.pageIndex = pageIndex;
        this.values = values;
    }

    /**
     * 计算 outer 的各边到 content 对应边的距离
     */
    public static MarginDelta between(int pageIndex, PageBox outer, PageBox content) {
        return new MarginDelta(pageIndex, SideValues.of(
                Math.max(0.0, content.getLeft() - outer.getLeft()),
                Math.max(0.0, content.getBottom() - outer.getBottom()),
                Math.max(0.0, outer.getRight() - content.getRight()),
                Math.max(0.0, outer.getTop() - content.getTop())));
    }

    public int getPageIndex() {
        return pageIndex;
    }

    public double get(Side side) {
        return values.get(side);
    }

    public SideValues getValues() {
        return values;
    }
}
