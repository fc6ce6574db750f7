package com.example.pdfcrop.service;

import com.example.pdfcrop.exception.RatioUnsatisfiableException;
import com.example.pdfcrop.model.CropPolicy;
import com.example.pdfcrop.model.CropWarning;
import com.example.pdfcrop.model.MarginDelta;
import com.example.pdfcrop.model.PageBox;
import com.example.pdfcrop.model.PageRatio;
import com.example.pdfcrop.model.Side;
import com.example.pdfcrop.model.SideValues;
import lombok.extern.slf4j.Slf4j;

import java.util.List;

/**
 * 在统计得到的裁剪量上依次应用：绝对偏移、MediaBox 限制、最小尺寸限制、目标宽高比、cropSafe
 */
@Slf4j
public class OffsetRatioResolver {

    /** 裁剪后每个方向至少保留的尺寸（点） */
    static final double MIN_EXTENT = 1.0;

    private static final double RATIO_TOLERANCE = 1e-9;

    /**
     * @param pageIndex   页面索引
     * @param originalBox 裁剪基准框
     * @param mediaBox    页面的 MediaBox，向外扩展不能超出它
     * @param margins     统计得到的裁剪量
     * @param ownDelta    本页自己的（未经统计的）页边距离
     * @param policy      裁剪策略
     * @param warnings    提示信息输出
     * @return 最终裁剪量
     */
    public SideValues resolve(int pageIndex,
                              PageBox originalBox,
                              PageBox mediaBox,
                              SideValues margins,
                              MarginDelta ownDelta,
                              CropPolicy policy,
                              List<CropWarning> warnings) {

        // 1. 绝对偏移：正值多裁
        SideValues resolved = margins.plus(policy.getAbsoluteOffset());

        // 2. 负裁剪量不能把边推出 MediaBox，否则最小尺寸会在 MediaBox 之外
        resolved = limitToMediaBox(resolved, originalBox, mediaBox);

        // 3. 每个方向至少保留 MIN_EXTENT
        resolved = clampAxis(resolved, Side.LEFT, originalBox.getWidth());
        resolved = clampAxis(resolved, Side.BOTTOM, originalBox.getHeight());

        // 4. 目标宽高比
        if (policy.getPageRatio() != null) {
            try {
                resolved = adjustToRatio(pageIndex, originalBox, resolved,
                        policy.getPageRatio(), policy.getPageRatioWeights());
            } catch (RatioUnsatisfiableException e) {
                log.warn("第 {} 页无法满足宽高比 {}: {}", pageIndex + 1, policy.getPageRatio(), e.getMessage());
                warnings.add(new CropWarning(CropWarning.Kind.RATIO_UNSATISFIABLE, pageIndex,
                        e.getParameter(), e.getMessage()));
            }
        }

        // 5. cropSafe：任何一边都不能裁进本页的内容
        if (policy.isCropSafe()) {
            for (Side side : Side.values()) {
                if (resolved.get(side) > ownDelta.get(side)) {
                    log.trace("第 {} 页 {} 边裁剪量 {} 回退到 {}",
                            pageIndex + 1, side, resolved.get(side), ownDelta.get(side));
                    resolved = resolved.with(side, ownDelta.get(side));
                }
            }
        }

        return resolved;
    }

    /**
     * 每条边的负裁剪量至多为基准框该边到 MediaBox 对应边的距离
     */
    SideValues limitToMediaBox(SideValues margins, PageBox originalBox, PageBox mediaBox) {
        SideValues limited = margins;
        for (Side side : Side.values()) {
            double room = Math.abs(mediaBox.edge(side) - originalBox.edge(side));
            if (limited.get(side) < -room) {
                limited = limited.with(side, room > 0 ? -room : 0.0);
            }
        }
        return limited;
    }

    /**
     * 调整一个方向上的裁剪量，使盒子在该方向上至少保留 MIN_EXTENT；
     * 超出部分按两边正裁剪量的比例扣除
     */
    SideValues clampAxis(SideValues margins, Side first, double extent) {
        Side second = first.opposite();
        double a = margins.get(first);
        double b = margins.get(second);
        double excess = a + b - (extent - MIN_EXTENT);
        if (excess <= 0) {
            return margins;
        }

        double positive = Math.max(a, 0) + Math.max(b, 0);
        if (positive <= 0) {
            return margins;
        }
        double newA = a - excess * Math.max(a, 0) / positive;
        double newB = b - excess * Math.max(b, 0) / positive;
        return margins.with(first, newA).with(second, newB);
    }

    /**
     * 只放大不缩小：太窄则加宽，太矮则加高，所需增量按权重分配到该方向的两边
     *
     * @throws RatioUnsatisfiableException 需要调整的方向上两边权重都为 0
     */
    SideValues adjustToRatio(int pageIndex,
                             PageBox originalBox,
                             SideValues margins,
                             PageRatio ratio,
                             SideValues weights) {

        double width = originalBox.getWidth() - margins.getLeft() - margins.getRight();
        double height = originalBox.getHeight() - margins.getBottom() - margins.getTop();
        double target = ratio.getRatio();
        double current = width / height;

        Side first;
        double needed;
        if (current < target - RATIO_TOLERANCE) {
            first = Side.LEFT;
            needed = target * height - width;
        } else if (current > target + RATIO_TOLERANCE) {
            first = Side.BOTTOM;
            needed = width / target - height;
        } else {
            return margins;
        }

        Side second = first.opposite();
        double wa = Math.max(0.0, weights.get(first));
        double wb = Math.max(0.0, weights.get(second));
        if (wa + wb <= 0) {
            throw new RatioUnsatisfiableException(pageIndex, String.format(
                    "第 %d 页需要调整 %s/%s 方向，但这两边的 pageRatioWeights 都为 0",
                    pageIndex + 1, first, second));
        }

        log.trace("第 {} 页宽高比调整: {} {} 增加 {}", pageIndex + 1, first, second, needed);
        return margins
                .with(first, margins.get(first) - needed * wa / (wa + wb))
                .with(second, margins.get(second) - needed * wb / (wa + wb));
    }
}
