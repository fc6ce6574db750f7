package com.example.pdfcrop.exception;

/**
 * 目标宽高比所需调整的轴上两边权重都为 0，无法满足
 */
public class RatioUnsatisfiableException extends CropException {

    public RatioUnsatisfiableException(int pageIndex, String message) {
        super(message, pageIndex, "pageRatioWeights");
    }
}
