package com.example.pdfcrop.parse;

import com.example.pdfcrop.exception.CropParseException;
import com.example.pdfcrop.model.CropPolicy;

/**
 * 一次字段编辑的结果：编辑后的策略，失败时为原策略并附带错误
 */
public class PolicyEdit {
    private final CropPolicy policy;
    private final CropParseException error;

    PolicyEdit(CropPolicy policy, CropParseException error) {
        this.policy = policy;
        this.error = error;
    }

    public CropPolicy getPolicy() {
        return policy;
    }

    public CropParseException getError() {
        return error;
    }

    public boolean isSuccess() {
        return error == null;
    }
}
