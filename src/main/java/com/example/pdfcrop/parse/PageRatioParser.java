package com.example.pdfcrop.parse;

import com.example.pdfcrop.exception.CropParseException;
import com.example.pdfcrop.model.PageRatio;

/**
 * 宽高比解析：{@code W:H} 或单个小数（W/H）
 */
public final class PageRatioParser {

    public static final String PARAMETER = "setPageRatios";

    private PageRatioParser() {
    }

    public static PageRatio parse(String text) {
        if (text == null || text.isBlank()) {
            throw new CropParseException(PARAMETER, "宽高比不能为空");
        }

        String[] parts = text.trim().split(":", -1);
        if (parts.length > 2) {
            throw new CropParseException(PARAMETER, "宽高比格式应为 W:H: \"" + text + "\"");
        }
        double width = component(parts[0], text);
        double height = parts.length == 2 ? component(parts[1], text) : 1.0;
        return new PageRatio(width, height);
    }

    private static double component(String part, String text) {
        double value;
        try {
            value = Double.parseDouble(part.trim());
        } catch (NumberFormatException e) {
            throw new CropParseException(PARAMETER, "宽高比包含非数字部分: \"" + text + "\"", e);
        }
        if (!(value > 0) || Double.isInfinite(value)) {
            throw new CropParseException(PARAMETER, "宽高比的各部分必须为正数: \"" + text + "\"");
        }
        return value;
    }
}
