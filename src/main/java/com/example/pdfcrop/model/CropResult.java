package com.example.pdfcrop.model;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;

/**
 * 裁剪结果
 * 包含每页最终的裁剪框、各边页边最小的页面（每个分组一项）以及提示信息
 */
public class CropResult {
    private final SortedMap<Integer, PageBox> pageBoxes;
    private final Map<Side, List<Integer>> deltaPageNums;
    private final List<CropWarning> warnings;
    private final boolean restored;
    private final boolean cacheHit;

    public CropResult(SortedMap<Integer, PageBox> pageBoxes,
                      Map<Side, List<Integer>> deltaPageNums,
                      List<CropWarning> warnings,
                      boolean restored,
                      boolean cacheHit) {
        this.pageBoxes = Collections.unmodifiableSortedMap(pageBoxes);
        Map<Side, List<Integer>> nums = new EnumMap<>(Side.class);
        deltaPageNums.forEach((side, pages) -> nums.put(side, List.copyOf(pages)));
        this.deltaPageNums = Collections.unmodifiableMap(nums);
        this.warnings = List.copyOf(warnings);
        this.restored = restored;
        this.cacheHit = cacheHit;
    }

    public SortedMap<Integer, PageBox> getPageBoxes() {
        return pageBoxes;
    }

    public PageBox getPageBox(int pageIndex) {
        return pageBoxes.get(pageIndex);
    }

    public Map<Side, List<Integer>> getDeltaPageNums() {
        return deltaPageNums;
    }

    public List<CropWarning> getWarnings() {
        return warnings;
    }

    public boolean isRestored() {
        return restored;
    }

    public boolean isCacheHit() {
        return cacheHit;
    }
}
