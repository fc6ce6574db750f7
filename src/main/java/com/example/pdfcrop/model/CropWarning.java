package com.example.pdfcrop.model;

/**
 * 不中断计算的提示信息，带页面索引（可为空）和相关参数名
 */
public class CropWarning {

    public enum Kind {
        EMPTY_GROUP,
        RATIO_UNSATISFIABLE,
        ORDER_STAT_CLAMPED,
        BLANK_PAGE
    }

    private final Kind kind;
    private final Integer pageIndex;
    private final String parameter;
    private final String message;

    public CropWarning(Kind kind, Integer pageIndex, String parameter, String message) {
        this.kind = kind;
        this.pageIndex = pageIndex;
        this.parameter = parameter;
        this.message = message;
    }

    public Kind getKind() {
        return kind;
    }

    public Integer getPageIndex() {
        return pageIndex;
    }

    public String getParameter() {
        return parameter;
    }

    public String getMessage() {
        return message;
    }

    @Override
    public String toString() {
        return kind + (pageIndex == null ? "" : "(page " + (pageIndex + 1) + ")") + ": " + message;
    }
}
