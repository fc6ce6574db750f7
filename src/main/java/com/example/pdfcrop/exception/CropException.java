package com.example.pdfcrop.exception;

/**
 * 裁剪相关异常的基类，携带页面索引（可为空）和出错的参数名
 */
public class CropException extends RuntimeException {
    private final Integer pageIndex;
    private final String parameter;

    public CropException(String message, Integer pageIndex, String parameter) {
        this(message, pageIndex, parameter, null);
    }

    public CropException(String message, Integer pageIndex, String parameter, Throwable cause) {
        super(message, cause);
        this.pageIndex = pageIndex;
        this.parameter = parameter;
    }

    public Integer getPageIndex() {
        return pageIndex;
    }

    public String getParameter() {
        return parameter;
    }
}
