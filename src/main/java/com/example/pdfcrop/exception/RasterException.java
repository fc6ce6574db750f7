package com.example.pdfcrop.exception;

/**
 * 页面栅格不可用（为空、尺寸非法或渲染失败）
 * 整次裁剪计算中止，不会跳过单页继续
 */
public class RasterException extends CropException {

    public RasterException(int pageIndex, String parameter, String message) {
        super(message, pageIndex, parameter);
    }

    public RasterException(int pageIndex, String parameter, String message, Throwable cause) {
        super(message, pageIndex, parameter, cause);
    }
}
