package com.example.pdfcrop.model;

import java.util.Collections;
import java.util.List;

/**
 * 页面分组：页边统计在组内进行，结果广播给组内每一页
 */
public class PageGroup {

    public enum Kind {
        ALL_PAGES,
        EVEN_PAGES,
        ODD_PAGES,
        SINGLE_PAGE
    }

    private final Kind kind;
    private final List<Integer> pageIndices;

    public PageGroup(Kind kind, List<Integer> pageIndices) {
        this.kind = kind;
        this.pageIndices = Collections.unmodifiableList(pageIndices);
    }

    public Kind getKind() {
        return kind;
    }

    public List<Integer> getPageIndices() {
        return pageIndices;
    }

    public boolean isEmpty() {
        return pageIndices.isEmpty();
    }

    @Override
    public String toString() {
        return kind + pageIndices.toString();
    }
}
