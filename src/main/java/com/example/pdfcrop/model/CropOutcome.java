package com.example.pdfcrop.model;

/**
 * 一次裁剪或恢复的输出
 * 包含会话 ID、输出文件名、裁剪结果和处理时间
 */
public class CropOutcome {
    private final String sessionId;
    private final String fileName;
    private final CropResult result;
    private final long totalTime;

    public CropOutcome(String sessionId, String fileName, CropResult result, long totalTime) {
        this.sessionId = sessionId;
        this.fileName = fileName;
        this.result = result;
        this.totalTime = totalTime;
    }

    public String getSessionId() {
        return sessionId;
    }

    public String getFileName() {
        return fileName;
    }

    public CropResult getResult() {
        return result;
    }

    public long getTotalTime() {
        return totalTime;
    }
}
