package com.example.pdfcrop.exception;

/**
 * 页面选择器、宽高比或数值字段格式错误
 * 只影响被编辑的字段，该字段保持上一次的合法值
 */
public class CropParseException extends CropException {

    public CropParseException(String parameter, String message) {
        super(message, null, parameter);
    }

    public CropParseException(String parameter, String message, Throwable cause) {
        super(message, null, parameter, cause);
    }
}
