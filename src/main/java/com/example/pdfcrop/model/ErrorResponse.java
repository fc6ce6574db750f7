package com.example.pdfcrop.model;

import java.time.Instant;

/**
 * 接口错误信息，pageIndex 和 parameter 指出出错的页面和参数（可为空）
 */
public class ErrorResponse {
    private final Instant timestamp;
    private final int status;
    private final String error;
    private final String message;
    private final Integer pageIndex;
    private final String parameter;
    private final String path;

    public ErrorResponse(Instant timestamp, int status, String error, String message,
                         Integer pageIndex, String parameter, String path) {
        this.timestamp = timestamp;
        this.status = status;
        this.error = error;
        this.message = message;
        this.pageIndex = pageIndex;
        this.parameter = parameter;
        this.path = path;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public int getStatus() {
        return status;
    }

    public String getError() {
        return error;
    }

    public String getMessage() {
        return message;
    }

    public Integer getPageIndex() {
        return pageIndex;
    }

    public String getParameter() {
        return parameter;
    }

    public String getPath() {
        return path;
    }
}
