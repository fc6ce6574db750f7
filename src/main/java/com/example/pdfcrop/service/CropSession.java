package com.example.pdfcrop.service;

import com.example.pdfcrop.model.CropPolicy;
import com.example.pdfcrop.model.CropResult;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.apache.pdfbox.pdmodel.PDDocument;

import java.io.Closeable;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.locks.ReentrantLock;

/**
 * 一个已上传文档的编辑会话
 * 持有打开的文档、独立的裁剪引擎（含边界框缓存）和当前策略
 */
@Slf4j
@Getter
public class CropSession implements Closeable {

    private final String id;
    private final String originalFileName;
    private final Path inputPath;
    private final PDDocument document;
    private final PdfBoxDocumentBoxStore boxStore;
    private final CropEngine engine;
    private final int pageCount;

    /** 裁剪写入和保存期间持有，避免两次裁剪交错修改同一文档 */
    private final ReentrantLock lock = new ReentrantLock();

    private volatile CropPolicy policy = CropPolicy.defaults();
    private volatile CropResult lastResult;
    private volatile String lastOutputFile;
    private volatile long lastAccess = System.nanoTime();
    private volatile boolean closed;

    public CropSession(String id,
                       String originalFileName,
                       Path inputPath,
                       PDDocument document,
                       PdfBoxDocumentBoxStore boxStore,
                       CropEngine engine) {
        this.id = id;
        this.originalFileName = originalFileName;
        this.inputPath = inputPath;
        this.document = document;
        this.boxStore = boxStore;
        this.engine = engine;
        this.pageCount = boxStore.getPageCount();
    }

    void setPolicy(CropPolicy policy) {
        this.policy = policy;
    }

    void setLastResult(CropResult lastResult, String outputFile) {
        this.lastResult = lastResult;
        this.lastOutputFile = outputFile;
    }

    void touch() {
        this.lastAccess = System.nanoTime();
    }

    @Override
    public void close() throws IOException {
        closed = true;
        try {
            document.close();
        } finally {
            Files.deleteIfExists(inputPath);
            log.debug("会话 {} 已关闭", id);
        }
    }
}
