package com.example.pdfcrop.parse;

import com.example.pdfcrop.exception.CropParseException;

import java.util.Collections;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * 页面选择器解析
 *
 * <p>逗号分隔的1基页码和范围：{@code 3}、{@code 2-5}、{@code 7-}（到最后一页）、
 * {@code -4}（从第一页）。空白文本表示全部页面。结果为0基索引。
 */
public final class PageSelectorParser {

    public static final String PARAMETER = "pages";

    private PageSelectorParser() {
    }

    /**
     * @param text      选择器文本
     * @param pageCount 文档页数，合法页码为 1..pageCount
     * @return 选中页面的0基索引
     * @throws CropParseException 格式错误或页码超出范围
     */
    public static SortedSet<Integer> parse(String text, int pageCount) {
        SortedSet<Integer> pages = new TreeSet<>();
        if (text == null || text.isBlank()) {
            for (int i = 0; i < pageCount; i++) {
                pages.add(i);
            }
            return Collections.unmodifiableSortedSet(pages);
        }

        for (String raw : text.split(",")) {
            String token = raw.trim();
            if (token.isEmpty()) {
                throw new CropParseException(PARAMETER, "页面选择器中有空项: \"" + text + "\"");
            }

            int dash = token.indexOf('-');
            int first;
            int last;
            if (dash < 0) {
                first = pageNumber(token, text);
                last = first;
            } else {
                if (token.indexOf('-', dash + 1) >= 0) {
                    throw new CropParseException(PARAMETER, "无法解析的页面范围: \"" + token + "\"");
                }
                String from = token.substring(0, dash).trim();
                String to = token.substring(dash + 1).trim();
                if (from.isEmpty() && to.isEmpty()) {
                    throw new CropParseException(PARAMETER, "无法解析的页面范围: \"" + token + "\"");
                }
                first = from.isEmpty() ? 1 : pageNumber(from, text);
                last = to.isEmpty() ? pageCount : pageNumber(to, text);
            }

            if (first > last) {
                throw new CropParseException(PARAMETER, "页面范围起点大于终点: \"" + token + "\"");
            }
            if (first < 1 || last > pageCount) {
                throw new CropParseException(PARAMETER,
                        String.format("页码超出范围 1-%d: \"%s\"", pageCount, token));
            }
            for (int page = first; page <= last; page++) {
                pages.add(page - 1);
            }
        }
        return Collections.unmodifiableSortedSet(pages);
    }

    private static int pageNumber(String token, String text) {
        try {
            return Integer.parseInt(token);
        } catch (NumberFormatException e) {
            throw new CropParseException(PARAMETER,
                    "页码不是整数: \"" + token + "\"（选择器 \"" + text + "\"）", e);
        }
    }
}
