package com.example.pdfcrop.service;

import com.example.pdfcrop.exception.CropBusyException;
import com.example.pdfcrop.exception.CropException;
import com.example.pdfcrop.exception.RasterException;
import com.example.pdfcrop.model.CropPolicy;
import com.example.pdfcrop.model.CropResult;
import com.example.pdfcrop.model.CropWarning;
import com.example.pdfcrop.model.DetectedBox;
import com.example.pdfcrop.model.DetectionFingerprint;
import com.example.pdfcrop.model.MarginDelta;
import com.example.pdfcrop.model.PageBox;
import com.example.pdfcrop.model.PageInfo;
import com.example.pdfcrop.model.SideValues;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.SortedMap;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

/**
 * 裁剪计算的唯一入口
 *
 * <p>处理流程：
 * <ol>
 *   <li>比较检测指纹，变化时丢弃全部缓存的边界框</li>
 *   <li>并行渲染并检测选中页面的边界框，全部完成后才进入下一步</li>
 *   <li>页边统计</li>
 *   <li>偏移、宽高比、cropSafe</li>
 *   <li>生成裁剪框</li>
 * </ol>
 * 第 3-5 步每次调用都完整执行。同一时刻只允许一次计算，并发调用直接抛出
 * {@link CropBusyException}。每个实例独占自己的缓存，不同文档不能共用同一实例。
 */
@Slf4j
public class CropEngine {

    private final PageRasterizer rasterizer;
    private final DocumentBoxStore boxStore;
    private final BoundingBoxDetector detector;
    private final MarginAggregator aggregator;
    private final OffsetRatioResolver resolver;
    private final CropBoxBuilder builder;
    private final ExecutorService executorService;
    private final float renderDpi;
    private final long maxRasterPixels;

    private final BoundingBoxCache cache = new BoundingBoxCache();
    private final AtomicBoolean running = new AtomicBoolean(false);
    private final Map<Integer, PageInfo> pages = new TreeMap<>();

    private volatile Consumer<String> progressListener = message -> { };

    public CropEngine(PageRasterizer rasterizer,
                      DocumentBoxStore boxStore,
                      BoundingBoxDetector detector,
                      MarginAggregator aggregator,
                      OffsetRatioResolver resolver,
                      CropBoxBuilder builder,
                      ExecutorService executorService,
                      float renderDpi,
                      long maxRasterPixels) {
        this.rasterizer = rasterizer;
        this.boxStore = boxStore;
        this.detector = detector;
        this.aggregator = aggregator;
        this.resolver = resolver;
        this.builder = builder;
        this.executorService = executorService;
        this.renderDpi = renderDpi;
        this.maxRasterPixels = maxRasterPixels;
    }

    public void setProgressListener(Consumer<String> progressListener) {
        this.progressListener = progressListener;
    }

    /**
     * 计算裁剪结果
     *
     * @param policy 当前裁剪策略
     * @return 新的裁剪结果
     * @throws CropBusyException 已有计算在进行
     * @throws RasterException   任意一页检测失败（整次计算作废）
     */
    public CropResult computeCrop(CropPolicy policy) {
        if (!running.compareAndSet(false, true)) {
            log.warn("拒绝并发的裁剪请求");
            throw new CropBusyException();
        }

        long startTime = System.currentTimeMillis();
        try {
            int pageCount = boxStore.getPageCount();
            if (policy.isRestore()) {
                return restore(pageCount);
            }

            SortedSet<Integer> selected = policy.selectedPages(pageCount);
            log.info("开始计算裁剪: 总页数={}, 选中={}", pageCount, selected.size());
            refreshPages(pageCount);

            // 1. 缓存检查
            DetectionFingerprint fingerprint = policy.fingerprint(pageCount);
            boolean cacheHit = cache.matches(fingerprint);
            Map<Integer, DetectedBox> detected;
            if (cacheHit) {
                log.debug("检测指纹未变化，使用缓存的 {} 个边界框", cache.getBoxes().size());
                detected = cache.getBoxes();
            } else {
                log.debug("检测指纹变化，重新检测: {}", fingerprint);
                cache.invalidate();
                long detectStart = System.currentTimeMillis();
                detected = detectBoundingBoxes(selected, policy);
                cache.store(fingerprint, detected);
                log.debug("  - 边界框检测完成: {}ms", System.currentTimeMillis() - detectStart);
            }
            detected.forEach((index, box) ->
                    pages.put(index, pages.get(index).withResolution(box.getResolution())));

            // 2. 页边距离
            List<MarginDelta> deltas = new ArrayList<>();
            Map<Integer, MarginDelta> ownDeltas = new LinkedHashMap<>();
            Set<Integer> blankPages = new HashSet<>();
            for (Integer index : selected) {
                PageBox original = pages.get(index).getOriginalBox();
                DetectedBox box = detected.get(index);
                deltas.add(MarginDelta.between(index, original, box.boxFor(policy.isPercentText())));
                ownDeltas.put(index, MarginDelta.between(index, original, box.getContentBox()));
                if (box.isBlank()) {
                    blankPages.add(index);
                }
            }

            // 3. 页边统计
            MarginAggregator.Aggregation aggregation = aggregator.aggregate(deltas, blankPages, policy);
            List<CropWarning> warnings = new ArrayList<>(aggregation.getWarnings());

            // 4. 偏移、宽高比、cropSafe
            Map<Integer, SideValues> margins = new LinkedHashMap<>();
            Map<Integer, PageInfo> selectedPages = new LinkedHashMap<>();
            Map<Integer, PageBox> contentBoxes = policy.isCropSafe() ? new LinkedHashMap<>() : null;
            for (Integer index : selected) {
                PageInfo page = pages.get(index);
                selectedPages.put(index, page);
                margins.put(index, resolver.resolve(index, page.getOriginalBox(), page.getMediaBox(),
                        aggregation.getCropMargins(index), ownDeltas.get(index), policy, warnings));
                if (contentBoxes != null) {
                    contentBoxes.put(index, detected.get(index).getContentBox());
                }
            }

            // 5. 生成裁剪框，未选中的页面保持原样
            SortedMap<Integer, PageBox> boxes = builder.buildAll(
                    selectedPages, margins, contentBoxes, policy.isSamePageSize());
            for (int i = 0; i < pageCount; i++) {
                if (!boxes.containsKey(i)) {
                    boxes.put(i, pages.get(i).getOriginalBox());
                }
            }

            log.info("裁剪计算完成: 用时 {}ms, 缓存命中={}, 提示={}",
                    System.currentTimeMillis() - startTime, cacheHit, warnings.size());
            return new CropResult(boxes, aggregation.getDeltaPageNums(), warnings, false, cacheHit);

        } finally {
            running.set(false);
        }
    }

    /**
     * 恢复：每页的框设为第一次裁剪前记录的原始框，不经过检测与统计
     */
    private CropResult restore(int pageCount) {
        SortedMap<Integer, PageBox> boxes = new TreeMap<>();
        for (int i = 0; i < pageCount; i++) {
            boxes.put(i, boxStore.readOriginalBox(i));
        }
        log.info("恢复 {} 页的原始页面框", pageCount);
        return new CropResult(boxes, Collections.emptyMap(), List.of(), true, false);
    }

    private void refreshPages(int pageCount) {
        for (int i = 0; i < pageCount; i++) {
            PageInfo fresh = boxStore.readPage(i);
            PageInfo previous = pages.get(i);
            pages.put(i, previous == null ? fresh : fresh.withResolution(previous.getResolution()));
        }
        pages.keySet().removeIf(index -> index >= pageCount);
    }

    /**
     * 多线程并行渲染并检测边界框；任意一页失败则取消其余任务并中止
     */
    private Map<Integer, DetectedBox> detectBoundingBoxes(SortedSet<Integer> selected, CropPolicy policy) {
        Map<Integer, Future<DetectedBox>> futures = new LinkedHashMap<>();

        for (Integer index : selected) {
            PageBox region = preCropRegion(pages.get(index), policy.getAbsolutePreCrop());
            float dpi = adaptResolution(region);
            futures.put(index, executorService.submit(() -> detector.detect(
                    rasterizer.render(index, region, dpi),
                    policy.getThreshold(), policy.getNumBlurs(), policy.getNumSmooths())));
        }

        Map<Integer, DetectedBox> results = new TreeMap<>();
        int done = 0;
        for (Map.Entry<Integer, Future<DetectedBox>> entry : futures.entrySet()) {
            int index = entry.getKey();
            try {
                results.put(index, entry.getValue().get());
                done++;
                progressListener.accept(String.format("边界框检测 %d/%d", done, futures.size()));

            } catch (ExecutionException e) {
                cancelAll(futures.values());
                Throwable cause = e.getCause();
                log.error("检测第 {} 页失败", index + 1, cause);
                if (cause instanceof CropException) {
                    throw (CropException) cause;
                }
                throw new RasterException(index, "raster",
                        "检测第 " + (index + 1) + " 页失败: " + cause.getMessage(), cause);

            } catch (InterruptedException e) {
                cancelAll(futures.values());
                Thread.currentThread().interrupt();
                throw new RasterException(index, "raster", "边界框检测被中断", e);
            }
        }
        return results;
    }

    /**
     * 基准框按 absolutePreCrop 收缩后的渲染区域
     */
    private PageBox preCropRegion(PageInfo page, SideValues preCrop) {
        PageBox original = page.getOriginalBox();
        double left = original.getLeft() + preCrop.getLeft();
        double bottom = original.getBottom() + preCrop.getBottom();
        double right = original.getRight() - preCrop.getRight();
        double top = original.getTop() - preCrop.getTop();
        if (left >= right || bottom >= top) {
            throw new RasterException(page.getPageIndex(), "absolutePreCrop",
                    "第 " + (page.getPageIndex() + 1) + " 页预裁剪后区域为空: " + preCrop);
        }
        return PageBox.of(left, bottom, right, top).clampTo(page.getMediaBox());
    }

    /**
     * 根据页面面积调整渲染分辨率，限制栅格像素总数
     */
    private float adaptResolution(PageBox region) {
        double area = region.getWidth() * region.getHeight();
        double scale = renderDpi / 72.0;
        if (area <= 0 || maxRasterPixels <= 0 || area * scale * scale <= maxRasterPixels) {
            return renderDpi;
        }
        return (float) (72.0 * Math.sqrt(maxRasterPixels / area));
    }

    private void cancelAll(Iterable<Future<DetectedBox>> futures) {
        for (Future<DetectedBox> future : futures) {
            future.cancel(true);
        }
    }

    /**
     * 最近一次计算使用的页面信息（含渲染分辨率）
     */
    public Map<Integer, PageInfo> getPages() {
        return Collections.unmodifiableMap(pages);
    }

    public BoundingBoxCache getCache() {
        return cache;
    }
}
