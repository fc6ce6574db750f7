package com.example.pdfcrop.service;

import com.example.pdfcrop.model.CropPolicy;
import com.example.pdfcrop.model.CropWarning;
import com.example.pdfcrop.model.MarginDelta;
import com.example.pdfcrop.model.PageGroup;
import com.example.pdfcrop.model.RetainCurve;
import com.example.pdfcrop.model.Side;
import com.example.pdfcrop.model.SideValues;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 页边统计：把每页的页边距离归约为每个分组、每条边的裁剪量
 *
 * <p>裁剪量表示该边要裁掉多少点；percentRetain 是保留的空白页边百分比。
 * <ul>
 *   <li>非 uniform：每页单独成组，裁剪量 = 本页距离 × curve(percentRetain)</li>
 *   <li>uniform：组内距离升序排列（相同时按页码）；设置了 uniformOrderStat=k 的边
 *       直接取第 k+1 小的距离，否则取最小距离 × curve(percentRetain)</li>
 *   <li>evenodd：奇数页、偶数页分别成组独立统计</li>
 * </ul>
 * 空白页不参与组内统计。
 */
@Slf4j
public class MarginAggregator {

    private final RetainCurve retainCurve;

    public MarginAggregator(RetainCurve retainCurve) {
        this.retainCurve = retainCurve;
    }

    /**
     * @param deltas     选中页面的页边距离，按页码升序
     * @param blankPages 检测为空白的页面
     * @param policy     裁剪策略
     */
    public Aggregation aggregate(List<MarginDelta> deltas, Set<Integer> blankPages, CropPolicy policy) {
        Map<Integer, MarginDelta> byPage = new LinkedHashMap<>();
        for (MarginDelta delta : deltas) {
            byPage.put(delta.getPageIndex(), delta);
        }

        List<PageGroup> groups = partition(new ArrayList<>(byPage.keySet()), policy);
        Aggregation result = new Aggregation(groups);

        if (policy.isEffectivelyUniform()) {
            for (PageGroup group : groups) {
                aggregateUniform(group, byPage, blankPages, policy, result);
            }
        } else {
            aggregateSinglePages(byPage, blankPages, policy, result);
        }

        log.debug("页边统计完成: 分组={}, 页数={}, 提示={}",
                groups.size(), byPage.size(), result.warnings.size());
        return result;
    }

    /**
     * 按 uniform/evenodd 划分页面组
     */
    List<PageGroup> partition(List<Integer> pages, CropPolicy policy) {
        List<PageGroup> groups = new ArrayList<>();
        if (!policy.isEffectivelyUniform()) {
            for (Integer page : pages) {
                groups.add(new PageGroup(PageGroup.Kind.SINGLE_PAGE, List.of(page)));
            }
        } else if (policy.isEvenodd()) {
            List<Integer> even = new ArrayList<>();
            List<Integer> odd = new ArrayList<>();
            for (Integer page : pages) {
                // 按1基页码区分奇偶
                if ((page + 1) % 2 == 0) {
                    even.add(page);
                } else {
                    odd.add(page);
                }
            }
            groups.add(new PageGroup(PageGroup.Kind.EVEN_PAGES, even));
            groups.add(new PageGroup(PageGroup.Kind.ODD_PAGES, odd));
        } else {
            groups.add(new PageGroup(PageGroup.Kind.ALL_PAGES, pages));
        }
        return groups;
    }

    private void aggregateUniform(PageGroup group,
                                  Map<Integer, MarginDelta> byPage,
                                  Set<Integer> blankPages,
                                  CropPolicy policy,
                                  Aggregation result) {

        List<MarginDelta> members = new ArrayList<>();
        for (Integer page : group.getPageIndices()) {
            if (!blankPages.contains(page)) {
                members.add(byPage.get(page));
            }
        }

        if (members.isEmpty()) {
            log.warn("分组 {} 没有可统计的页面，页边按 0 处理", group.getKind());
            result.warnings.add(new CropWarning(CropWarning.Kind.EMPTY_GROUP, null, "pages",
                    "分组 " + group.getKind() + " 没有非空白页面，裁剪量为 0"));
            for (Integer page : group.getPageIndices()) {
                result.cropMargins.put(page, SideValues.zero());
            }
            return;
        }

        SideValues margins = SideValues.zero();
        for (Side side : Side.values()) {
            List<MarginDelta> sorted = new ArrayList<>(members);
            sorted.sort(Comparator.<MarginDelta>comparingDouble(d -> d.get(side))
                    .thenComparingInt(MarginDelta::getPageIndex));

            double crop;
            int k = policy.orderStat(side);
            if (k > 0) {
                if (k >= sorted.size()) {
                    result.warnings.add(new CropWarning(CropWarning.Kind.ORDER_STAT_CLAMPED, null,
                            "uniformOrderStat",
                            String.format("%s 边的顺序统计量 %d 超出分组 %s 的页数 %d，按 %d 处理",
                                    side, k, group.getKind(), sorted.size(), sorted.size() - 1)));
                    k = sorted.size() - 1;
                }
                crop = sorted.get(k).get(side);
            } else {
                crop = sorted.get(0).get(side)
                        * retainCurve.cropFraction(policy.getPercentRetain().get(side));
            }

            margins = margins.with(side, crop);
            result.deltaPageNums.get(side).add(sorted.get(0).getPageIndex());
        }

        log.debug("分组 {} ({} 页) 裁剪量: {}", group.getKind(), members.size(), margins);
        for (Integer page : group.getPageIndices()) {
            result.cropMargins.put(page, margins);
        }
    }

    private void aggregateSinglePages(Map<Integer, MarginDelta> byPage,
                                      Set<Integer> blankPages,
                                      CropPolicy policy,
                                      Aggregation result) {

        for (MarginDelta delta : byPage.values()) {
            int page = delta.getPageIndex();
            if (blankPages.contains(page)) {
                result.warnings.add(new CropWarning(CropWarning.Kind.BLANK_PAGE, page, "threshold",
                        "第 " + (page + 1) + " 页未检测到内容，保持原样"));
                result.cropMargins.put(page, SideValues.zero());
                continue;
            }

            SideValues margins = SideValues.zero();
            for (Side side : Side.values()) {
                double fraction = retainCurve.cropFraction(policy.getPercentRetain().get(side));
                margins = margins.with(side, delta.get(side) * fraction);
                // 每页自成一组，组内最小距离的页面就是它自己
                result.deltaPageNums.get(side).add(page);
            }
            result.cropMargins.put(page, margins);
        }
    }

    /**
     * 统计结果：每页的裁剪量、各边距离最小的页面（每组一项）和提示信息
     */
    public static class Aggregation {
        private final List<PageGroup> groups;
        private final Map<Integer, SideValues> cropMargins = new LinkedHashMap<>();
        private final Map<Side, List<Integer>> deltaPageNums = new EnumMap<>(Side.class);
        private final List<CropWarning> warnings = new ArrayList<>();

        Aggregation(List<PageGroup> groups) {
            this.groups = groups;
            for (Side side : Side.values()) {
                deltaPageNums.put(side, new ArrayList<>());
            }
        }

        public List<PageGroup> getGroups() {
            return groups;
        }

        public Map<Integer, SideValues> getCropMargins() {
            return cropMargins;
        }

        public SideValues getCropMargins(int pageIndex) {
            return cropMargins.get(pageIndex);
        }

        public Map<Side, List<Integer>> getDeltaPageNums() {
            return deltaPageNums;
        }

        public List<CropWarning> getWarnings() {
            return warnings;
        }
    }
}
