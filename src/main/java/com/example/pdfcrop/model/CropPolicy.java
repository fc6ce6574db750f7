package com.example.pdfcrop.model;

import lombok.Builder;
import lombok.Getter;

import java.util.Collections;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * 裁剪策略：所有可调参数的不可变快照
 *
 * <p>四元组参数一律按 左、下、右、上 存储为 {@link SideValues}。
 * 调用方通过 {@link #toBuilder()} 逐项修改并得到新的快照。
 */
@Getter
@Builder(toBuilder = true)
public class CropPolicy {

    public static final int DEFAULT_THRESHOLD = 191;
    public static final double DEFAULT_PERCENT_RETAIN = 10.0;

    @Builder.Default
    private final SideValues percentRetain = SideValues.all(DEFAULT_PERCENT_RETAIN);

    @Builder.Default
    private final SideValues absoluteOffset = SideValues.zero();

    /** 0 表示该边未设置顺序统计量 */
    @Builder.Default
    private final SideValues uniformOrderStat = SideValues.zero();

    @Builder.Default
    private final SideValues absolutePreCrop = SideValues.zero();

    @Builder.Default
    private final SideValues pageRatioWeights = SideValues.all(1.0);

    private final boolean uniform;
    private final boolean evenodd;
    private final boolean percentText;
    private final boolean cropSafe;
    private final boolean samePageSize;
    private final boolean restore;

    @Builder.Default
    private final int threshold = DEFAULT_THRESHOLD;

    private final int numBlurs;
    private final int numSmooths;

    /** setPageRatios，为空表示不调整宽高比 */
    private final PageRatio pageRatio;

    /** 选中的页面（0基索引），为空表示全部页面 */
    private final Set<Integer> pageSubset;

    public static CropPolicy defaults() {
        return builder().build();
    }

    /**
     * 某一边的顺序统计量 k（0基）
     */
    public int orderStat(Side side) {
        return (int) Math.round(uniformOrderStat.get(side));
    }

    /**
     * evenodd 和非零的 uniformOrderStat 都隐含 uniform
     */
    public boolean isEffectivelyUniform() {
        if (uniform || evenodd) {
            return true;
        }
        for (Side side : Side.values()) {
            if (orderStat(side) > 0) {
                return true;
            }
        }
        return false;
    }

    /**
     * 解析选中页面集合，未指定时为全部页面；超出文档范围的索引被忽略
     */
    public SortedSet<Integer> selectedPages(int pageCount) {
        SortedSet<Integer> selected = new TreeSet<>();
        for (int i = 0; i < pageCount; i++) {
            if (pageSubset == null || pageSubset.contains(i)) {
                selected.add(i);
            }
        }
        return Collections.unmodifiableSortedSet(selected);
    }

    public DetectionFingerprint fingerprint(int pageCount) {
        return new DetectionFingerprint(threshold, numBlurs, numSmooths,
                absolutePreCrop, selectedPages(pageCount));
    }
}
