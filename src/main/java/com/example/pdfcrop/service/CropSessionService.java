package com.example.pdfcrop.service;

import com.example.pdfcrop.exception.CropBusyException;
import com.example.pdfcrop.exception.SessionNotFoundException;
import com.example.pdfcrop.model.CropOutcome;
import com.example.pdfcrop.model.CropPolicy;
import com.example.pdfcrop.model.CropResult;
import com.example.pdfcrop.model.CropWarning;
import com.example.pdfcrop.model.PageBox;
import com.example.pdfcrop.model.RetainCurve;
import com.example.pdfcrop.parse.CropPolicyEditor;
import com.example.pdfcrop.parse.PolicyEdit;
import lombok.extern.slf4j.Slf4j;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.io.Resource;
import org.springframework.core.io.UrlResource;
import org.springframework.stereotype.Service;
import org.springframework.web.multipart.MultipartFile;

import javax.annotation.PostConstruct;
import javax.annotation.PreDestroy;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.UUID;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionHandler;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * PDF页边裁剪服务
 *
 * 核心功能：
 *   上传文档后建立编辑会话，每个会话独占一个裁剪引擎和边界框缓存
 *   按字段编辑裁剪策略，格式错误时保持原值
 *   计算裁剪框、写回文档并另存为新文件
 *   恢复到第一次裁剪前的页面框
 *
 * 技术特点：
 *   PDFBox 渲染 + OpenCV 阈值化检测边界框
 *   多线程并行检测，渲染在文档上串行
 *   检测参数不变时复用缓存，只重新统计
 */
@Service
@Slf4j
public class CropSessionService {

    // ==================== 配置参数 ====================

    @Value("${file.upload-dir:uploads}")
    private String uploadDir;

    @Value("${pdf.crop.dpi:72}")
    private float renderDpi;

    @Value("${pdf.crop.max-raster-pixels:4000000}")
    private long maxRasterPixels;

    @Value("${pdf.crop.text-min-component-px:2}")
    private int textMinComponentPx;

    @Value("${pdf.crop.retain-curve:LINEAR}")
    private RetainCurve retainCurve;

    @Value("${pdf.crop.session-limit:16}")
    private int sessionLimit;

    private static final AtomicInteger POOL_NUMBER = new AtomicInteger(1);

    // ==================== 依赖组件 ====================

    private final ExecutorService executorService;
    private final Map<String, CropSession> sessions = new ConcurrentHashMap<>();
    private Path uploadPath;

    private BoundingBoxDetector detector;
    private MarginAggregator aggregator;
    private final OffsetRatioResolver resolver = new OffsetRatioResolver();
    private final CropBoxBuilder builder = new CropBoxBuilder();

    @Autowired
    private ProgressService progressService;

    // ==================== 构造与初始化 ====================

    /**
     * 构造函数：初始化线程池
     */
    public CropSessionService() {
        this.executorService = createThreadPool();
        log.info("PDF裁剪服务线程池已创建");
    }

    /**
     * 创建检测线程池：有界队列，队列满时由调用线程执行
     */
    private ExecutorService createThreadPool() {
        int corePoolSize = Runtime.getRuntime().availableProcessors();
        BlockingQueue<Runnable> workQueue = new ArrayBlockingQueue<>(8);

        int poolNumber = POOL_NUMBER.getAndIncrement();
        AtomicInteger threadNumber = new AtomicInteger(1);
        ThreadFactory threadFactory = r -> {
            Thread t = new Thread(r,
                    "pdf-crop-pool-" + poolNumber + "-thread-" + threadNumber.getAndIncrement());
            t.setDaemon(false);
            t.setPriority(Thread.NORM_PRIORITY);
            return t;
        };

        RejectedExecutionHandler handler = new ThreadPoolExecutor.CallerRunsPolicy();

        return new ThreadPoolExecutor(
                corePoolSize,
                corePoolSize,
                60L,
                TimeUnit.SECONDS,
                workQueue,
                threadFactory,
                handler
        );
    }

    /**
     * 服务初始化
     */
    @PostConstruct
    public void init() {
        nu.pattern.OpenCV.loadLocally();
        log.info("OpenCV库加载成功");

        uploadPath = Paths.get(uploadDir).toAbsolutePath().normalize();
        try {
            Files.createDirectories(uploadPath);
            log.info("上传目录创建成功: {}", uploadPath);
        } catch (IOException e) {
            throw new IllegalStateException("无法创建上传目录: " + uploadPath, e);
        }

        detector = new BoundingBoxDetector(textMinComponentPx);
        aggregator = new MarginAggregator(retainCurve);

        log.info("PDF裁剪服务初始化完成 - dpi={}, 最大像素={}, 保留曲线={}",
                renderDpi, maxRasterPixels, retainCurve);
    }

    /**
     * 服务销毁：关闭所有会话和线程池
     */
    @PreDestroy
    public void shutdown() {
        log.info("正在关闭 {} 个会话...", sessions.size());
        for (CropSession session : new ArrayList<>(sessions.values())) {
            session.getLock().lock();
            try {
                sessions.remove(session.getId(), session);
                closeResource(session);
            } finally {
                session.getLock().unlock();
            }
        }

        log.info("正在关闭线程池...");
        executorService.shutdown();
        try {
            if (!executorService.awaitTermination(10, TimeUnit.SECONDS)) {
                log.warn("线程池未能在10秒内关闭，强制关闭");
                executorService.shutdownNow();
            }
        } catch (InterruptedException e) {
            log.error("线程池关闭被中断", e);
            executorService.shutdownNow();
            Thread.currentThread().interrupt();
        }
        log.info("PDF裁剪服务已关闭");
    }

    // ==================== 会话管理 ====================

    /**
     * 上传PDF并建立编辑会话
     *
     * @param file 上传的PDF文件
     * @return 新会话
     * @throws IOException 文件无法保存或不是合法的PDF
     */
    public CropSession upload(MultipartFile file) throws IOException {
        log.info("========== 上传PDF文件 ==========");
        log.info("文件名: {}", file.getOriginalFilename());
        log.info("文件大小: {} KB", file.getSize() / 1024);

        String sessionId = UUID.randomUUID().toString();
        Path tempInputPath = uploadPath.resolve("temp_input_" + sessionId + ".pdf");
        file.transferTo(tempInputPath.toFile());
        log.debug("临时文件已创建: {}", tempInputPath);

        PDDocument document;
        try {
            document = PDDocument.load(tempInputPath.toFile());
        } catch (IOException e) {
            deleteFile(tempInputPath);
            throw e;
        }

        PdfBoxDocumentBoxStore boxStore = new PdfBoxDocumentBoxStore(document);
        CropEngine engine = new CropEngine(
                new PdfBoxPageRasterizer(document), boxStore,
                detector, aggregator, resolver, builder,
                executorService, renderDpi, maxRasterPixels);
        engine.setProgressListener(progressService::sendProgress);

        CropSession session = new CropSession(sessionId, file.getOriginalFilename(),
                tempInputPath, document, boxStore, engine);

        register(session);

        log.info("会话 {} 已创建, PDF总页数: {}", sessionId, session.getPageCount());
        if (boxStore.isMarked()) {
            log.info("文档含有先前裁剪记录的原始页面框，可以直接恢复");
        }
        progressService.sendProgress("已加载 " + session.getPageCount() + " 页PDF");
        return session;
    }

    public CropSession getSession(String sessionId) {
        CropSession session = sessions.get(sessionId);
        if (session == null) {
            throw new SessionNotFoundException(sessionId);
        }
        session.touch();
        return session;
    }

    /**
     * 关闭会话；会话正在裁剪或保存时拒绝关闭
     *
     * @throws CropBusyException 会话正在处理
     */
    public void closeSession(String sessionId) {
        CropSession session = sessions.get(sessionId);
        if (session == null) {
            return;
        }
        if (!session.getLock().tryLock()) {
            log.warn("会话 {} 正在处理，暂不能关闭", sessionId);
            throw new CropBusyException();
        }
        try {
            sessions.remove(sessionId, session);
            closeResource(session);
        } finally {
            session.getLock().unlock();
        }
    }

    /**
     * 注册新会话；会话数达到上限时先关闭最久未访问的空闲会话
     */
    private void register(CropSession session) {
        synchronized (sessions) {
            evictIfFull();
            sessions.put(session.getId(), session);
        }
    }

    /**
     * 正在处理的会话不回收；全部忙时允许暂时超出上限
     */
    private void evictIfFull() {
        if (sessionLimit <= 0) {
            return;
        }
        List<CropSession> candidates = new ArrayList<>(sessions.values());
        candidates.sort(Comparator.comparingLong(CropSession::getLastAccess));
        for (CropSession oldest : candidates) {
            if (sessions.size() < sessionLimit) {
                return;
            }
            if (!oldest.getLock().tryLock()) {
                log.debug("会话 {} 正在处理，跳过回收", oldest.getId());
                continue;
            }
            try {
                log.info("会话数已达上限 {}，回收会话 {}", sessionLimit, oldest.getId());
                sessions.remove(oldest.getId(), oldest);
                closeResource(oldest);
            } finally {
                oldest.getLock().unlock();
            }
        }
        if (sessions.size() >= sessionLimit) {
            log.warn("所有会话都在处理中，会话数暂时超出上限 {}", sessionLimit);
        }
    }

    // ==================== 策略编辑 ====================

    /**
     * 按字段编辑策略；出错的字段保持原值，之前成功的字段保留
     *
     * @throws com.example.pdfcrop.exception.CropParseException 某个字段格式错误
     */
    public CropPolicy updatePolicy(String sessionId, Map<String, String> edits) {
        CropSession session = getSession(sessionId);
        PolicyEdit edit = CropPolicyEditor.applyAll(session.getPolicy(), edits, session.getPageCount());
        session.setPolicy(edit.getPolicy());
        if (!edit.isSuccess()) {
            throw edit.getError();
        }
        return edit.getPolicy();
    }

    // ==================== 裁剪与恢复 ====================

    /**
     * 按当前策略裁剪并另存为新文件
     */
    public CropOutcome crop(String sessionId) throws IOException {
        CropSession session = getSession(sessionId);
        return apply(session, session.getPolicy(), "cropped");
    }

    /**
     * 恢复所有页面到第一次裁剪前的页面框并另存为新文件
     */
    public CropOutcome restore(String sessionId) throws IOException {
        CropSession session = getSession(sessionId);
        return apply(session, session.getPolicy().toBuilder().restore(true).build(), "restored");
    }

    private CropOutcome apply(CropSession session, CropPolicy policy, String suffix) throws IOException {
        if (!session.getLock().tryLock()) {
            log.warn("会话 {} 正在处理，拒绝新的请求", session.getId());
            throw new CropBusyException();
        }

        long startTime = System.currentTimeMillis();
        try {
            if (session.isClosed()) {
                throw new SessionNotFoundException(session.getId());
            }

            // 1. 计算裁剪框
            progressService.sendProgress(policy.isRestore() ? "正在恢复原始页面框..." : "开始计算裁剪框...");
            CropResult result = session.getEngine().computeCrop(policy);

            // 2. 写回文档；恢复时写回原始的 /CropBox 项
            PdfBoxDocumentBoxStore boxStore = session.getBoxStore();
            if (result.isRestored()) {
                result.getPageBoxes().keySet().forEach(boxStore::restoreOriginal);
            } else {
                result.getPageBoxes().forEach(boxStore::writeBox);
            }
            logWarnings(result.getWarnings());

            // 3. 保存结果
            progressService.sendProgress("正在保存文件...");
            String outputName = extractBaseName(session.getOriginalFileName())
                    + "_" + suffix + "_" + UUID.randomUUID() + ".pdf";
            Path outputPath = uploadPath.resolve(outputName);
            PDDocument document = session.getDocument();
            synchronized (document) {
                document.save(outputPath.toFile());
            }
            session.setLastResult(result, outputName);

            long totalTime = System.currentTimeMillis() - startTime;
            log.info("========== 处理完成 ==========");
            log.info("总耗时: {}秒", String.format("%.2f", totalTime / 1000.0));
            log.info("输出文件: {}", outputName);

            progressService.sendProgress(String.format("处理完成，总用时: %.2fs", totalTime / 1000.0));
            progressService.sendCropFinished(session.getId(), outputName);
            return new CropOutcome(session.getId(), outputName, result, totalTime);

        } finally {
            session.getLock().unlock();
        }
    }

    /**
     * 每页第一次裁剪之前的页面框，不修改文档
     */
    public SortedMap<Integer, PageBox> originalBoxes(String sessionId) {
        CropSession session = getSession(sessionId);
        SortedMap<Integer, PageBox> boxes = new TreeMap<>();
        for (int i = 0; i < session.getPageCount(); i++) {
            boxes.put(i, session.getBoxStore().readOriginalBox(i));
        }
        return boxes;
    }

    private void logWarnings(List<CropWarning> warnings) {
        for (CropWarning warning : warnings) {
            log.warn("裁剪提示: {}", warning);
            progressService.sendProgress("提示: " + warning.getMessage());
        }
    }

    // ==================== 工具方法 ====================

    /**
     * 提取文件基础名(不含扩展名)
     */
    private String extractBaseName(String fileName) {
        if (fileName == null) return "output";
        int idx = fileName.lastIndexOf('.');
        return idx > 0 ? fileName.substring(0, idx) : fileName;
    }

    private void deleteFile(Path path) {
        if (path != null) {
            try {
                Files.deleteIfExists(path);
                log.trace("临时文件已删除: {}", path);
            } catch (IOException e) {
                log.warn("删除文件失败: {}", path, e);
            }
        }
    }

    private void closeResource(AutoCloseable resource) {
        try {
            resource.close();
        } catch (Exception e) {
            log.warn("关闭资源失败", e);
        }
    }

    /**
     * 加载输出文件资源，只允许访问上传目录内的文件
     */
    public Resource loadFileAsResource(String fileName) throws IOException {
        Path filePath = uploadPath.resolve(fileName).normalize();
        if (!filePath.startsWith(uploadPath)) {
            throw new IOException("非法的文件名: " + fileName);
        }
        Resource resource = new UrlResource(filePath.toUri());

        if (!resource.exists()) {
            throw new IOException("文件未找到: " + fileName);
        }

        log.debug("文件资源已加载: {}", fileName);
        return resource;
    }

    Path getUploadPath() {
        return uploadPath;
    }
}
