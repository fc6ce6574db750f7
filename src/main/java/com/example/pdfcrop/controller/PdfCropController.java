package com.example.pdfcrop.controller;

import com.example.pdfcrop.model.CropOutcome;
import com.example.pdfcrop.model.CropPolicy;
import com.example.pdfcrop.model.CropResult;
import com.example.pdfcrop.model.CropWarning;
import com.example.pdfcrop.model.PageBox;
import com.example.pdfcrop.model.Side;
import com.example.pdfcrop.parse.CropPolicyEditor;
import com.example.pdfcrop.service.CropSession;
import com.example.pdfcrop.service.CropSessionService;
import com.example.pdfcrop.service.ProgressService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.core.io.Resource;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.CrossOrigin;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

@Slf4j
@RestController
@RequestMapping("/api/pdf")
@CrossOrigin(origins = "*")
public class PdfCropController {

    @Autowired
    private CropSessionService cropSessionService;

    @Autowired
    private ProgressService progressService;

    @PostMapping("/upload")
    public ResponseEntity<SessionResponse> uploadPdf(@RequestParam("file") MultipartFile file) {
        if (file.isEmpty()) {
            return ResponseEntity.badRequest().body(SessionResponse.failure("文件不能为空"));
        }

        String name = file.getOriginalFilename();
        if (name == null || !name.toLowerCase().endsWith(".pdf")) {
            return ResponseEntity.badRequest().body(SessionResponse.failure("只支持PDF文件"));
        }

        try {
            CropSession session = cropSessionService.upload(file);
            return ResponseEntity.ok(new SessionResponse(true, "PDF上传成功", session.getId(),
                    session.getPageCount(), CropPolicyEditor.describe(session.getPolicy())));
        } catch (IOException e) {
            log.error("无法读取上传的PDF: {}", name, e);
            return ResponseEntity.badRequest().body(SessionResponse.failure("无法读取PDF: " + e.getMessage()));
        }
    }

    @GetMapping("/sessions/{sessionId}/policy")
    public ResponseEntity<SessionResponse> getPolicy(@PathVariable String sessionId) {
        CropSession session = cropSessionService.getSession(sessionId);
        return ResponseEntity.ok(new SessionResponse(true, "当前策略", sessionId,
                session.getPageCount(), CropPolicyEditor.describe(session.getPolicy())));
    }

    /**
     * 请求体为 字段名 -> 输入文本，例如 {"percentRetain": "5", "pages": "1-3"}
     */
    @PatchMapping("/sessions/{sessionId}/policy")
    public ResponseEntity<SessionResponse> updatePolicy(@PathVariable String sessionId,
                                                        @RequestBody Map<String, String> edits) {
        CropPolicy policy = cropSessionService.updatePolicy(sessionId, edits);
        CropSession session = cropSessionService.getSession(sessionId);
        return ResponseEntity.ok(new SessionResponse(true, "策略已更新", sessionId,
                session.getPageCount(), CropPolicyEditor.describe(policy)));
    }

    @PostMapping("/sessions/{sessionId}/crop")
    public ResponseEntity<CropResponse> crop(@PathVariable String sessionId) throws IOException {
        CropOutcome outcome = cropSessionService.crop(sessionId);
        return ResponseEntity.ok(CropResponse.of("PDF裁剪成功", outcome));
    }

    @PostMapping("/sessions/{sessionId}/restore")
    public ResponseEntity<CropResponse> restore(@PathVariable String sessionId) throws IOException {
        CropOutcome outcome = cropSessionService.restore(sessionId);
        return ResponseEntity.ok(CropResponse.of("已恢复原始页面框", outcome));
    }

    /**
     * 每页第一次裁剪之前的页面框，用于预览恢复效果
     */
    @GetMapping("/sessions/{sessionId}/original")
    public ResponseEntity<OriginalResponse> original(@PathVariable String sessionId) {
        List<PageBoxView> pageBoxes = new ArrayList<>();
        cropSessionService.originalBoxes(sessionId)
                .forEach((index, box) -> pageBoxes.add(new PageBoxView(index, box)));
        return ResponseEntity.ok(new OriginalResponse(sessionId, pageBoxes));
    }

    /**
     * 会话正在裁剪或保存时返回 409
     */
    @DeleteMapping("/sessions/{sessionId}")
    public ResponseEntity<Void> closeSession(@PathVariable String sessionId) {
        cropSessionService.closeSession(sessionId);
        return ResponseEntity.noContent().build();
    }

    @GetMapping("/download/{fileName}")
    public ResponseEntity<Resource> downloadCroppedPdf(@PathVariable String fileName) {
        try {
            Resource resource = cropSessionService.loadFileAsResource(fileName);

            String encodedFileName = URLEncoder.encode(resource.getFilename(), StandardCharsets.UTF_8);
            return ResponseEntity.ok()
                    .contentType(MediaType.APPLICATION_PDF)
                    .header(HttpHeaders.CONTENT_DISPOSITION,
                            "attachment; filename*=UTF-8''" + encodedFileName)
                    .body(resource);

        } catch (IOException e) {
            log.warn("下载失败: {}", e.getMessage());
            return ResponseEntity.notFound()
                    .header("error-message", URLEncoder.encode(e.getMessage(), StandardCharsets.UTF_8))
                    .build();
        }
    }

    @GetMapping("/progress")
    public SseEmitter progress() {
        return progressService.createEmitter();
    }

    static class SessionResponse {
        private final boolean success;
        private final String message;
        private final String sessionId;
        private final int pageCount;
        private final Map<String, Object> policy;

        SessionResponse(boolean success, String message, String sessionId, int pageCount,
                        Map<String, Object> policy) {
            this.success = success;
            this.message = message;
            this.sessionId = sessionId;
            this.pageCount = pageCount;
            this.policy = policy;
        }

        static SessionResponse failure(String message) {
            return new SessionResponse(false, message, null, 0, null);
        }

        public boolean isSuccess() {
            return success;
        }

        public String getMessage() {
            return message;
        }

        public String getSessionId() {
            return sessionId;
        }

        public int getPageCount() {
            return pageCount;
        }

        public Map<String, Object> getPolicy() {
            return policy;
        }
    }

    static class CropResponse {
        private final boolean success;
        private final String message;
        private final String fileName;
        private final List<PageBoxView> pageBoxes;
        private final Map<Side, List<Integer>> deltaPageNums;
        private final List<CropWarning> warnings;
        private final boolean restored;
        private final boolean cacheHit;
        private final long totalTime;

        private CropResponse(String message, CropOutcome outcome) {
            CropResult result = outcome.getResult();
            this.success = true;
            this.message = message;
            this.fileName = outcome.getFileName();
            this.pageBoxes = new ArrayList<>();
            result.getPageBoxes().forEach((index, box) -> pageBoxes.add(new PageBoxView(index, box)));
            this.deltaPageNums = result.getDeltaPageNums();
            this.warnings = result.getWarnings();
            this.restored = result.isRestored();
            this.cacheHit = result.isCacheHit();
            this.totalTime = outcome.getTotalTime();
        }

        static CropResponse of(String message, CropOutcome outcome) {
            return new CropResponse(message, outcome);
        }

        public boolean isSuccess() {
            return success;
        }

        public String getMessage() {
            return message;
        }

        public String getFileName() {
            return fileName;
        }

        public List<PageBoxView> getPageBoxes() {
            return pageBoxes;
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

        public long getTotalTime() {
            return totalTime;
        }
    }

    static class OriginalResponse {
        private final String sessionId;
        private final List<PageBoxView> pageBoxes;

        OriginalResponse(String sessionId, List<PageBoxView> pageBoxes) {
            this.sessionId = sessionId;
            this.pageBoxes = pageBoxes;
        }

        public boolean isSuccess() {
            return true;
        }

        public String getSessionId() {
            return sessionId;
        }

        public List<PageBoxView> getPageBoxes() {
            return pageBoxes;
        }
    }

    /**
     * 单页裁剪框，页面索引为0基
     */
    static class PageBoxView {
        private final int pageIndex;
        private final double left;
        private final double bottom;
        private final double right;
        private final double top;

        PageBoxView(int pageIndex, PageBox box) {
            this.pageIndex = pageIndex;
            this.left = box.getLeft();
            this.bottom = box.getBottom();
            this.right = box.getRight();
            this.top = box.getTop();
        }

        public int getPageIndex() {
            return pageIndex;
        }

        public double getLeft() {
            return left;
        }

        public double getBottom() {
            return bottom;
        }

        public double getRight() {
            return right;
        }

        public double getTop() {
            return top;
        }
    }
}
