package com.example.pdfcrop.model;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.util.Set;

/**
 * 影响边界框检测的参数子集
 * 指纹相同则检测结果相同；任何一项变化都会使缓存的全部边界框失效
 */
@Getter
@ToString
@EqualsAndHashCode
public final class DetectionFingerprint {
    private final int threshold;
    private final int numBlurs;
    private final int numSmooths;
    private final SideValues absolutePreCrop;
    private final Set<Integer> pages;

    public DetectionFingerprint(int threshold, int numBlurs, int numSmooths,
                                SideValues absolutePreCrop, Set<Integer> pages) {
        this.threshold = threshold;
        this.numBlurs = numBlurs;
        this.numSmooths = numSmooths;
        this.absolutePreCrop = absolutePreCrop;
        this.pages = Set.copyOf(pages);
    }
}
