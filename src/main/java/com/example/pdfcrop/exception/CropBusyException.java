package com.example.pdfcrop.exception;

/**
 * 已有一次裁剪计算在进行中，新的请求被直接拒绝（不排队）
 */
public class CropBusyException extends CropException {

    public CropBusyException() {
        super("已有裁剪计算正在进行，请稍后重试", null, null);
    }
}
