package com.example.pdfcrop.parse;

import com.example.pdfcrop.exception.CropParseException;
import com.example.pdfcrop.model.CropPolicy;
import com.example.pdfcrop.model.Side;
import com.example.pdfcrop.model.SideValues;
import lombok.extern.slf4j.Slf4j;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.TreeSet;
import java.util.function.BiFunction;
import java.util.function.Function;

/**
 * 按字段名编辑裁剪策略
 *
 * <p>四元组字段有两种写法：{@code percentRetain} 设置四条边为同一值，
 * {@code percentRetain4} 依次给出 左 下 右 上 四个值（空格或逗号分隔）。
 * 单值写法输入 "N/A" 时保持原值不变。解析失败时返回原策略和错误，不抛出异常。
 */
@Slf4j
public final class CropPolicyEditor {

    private CropPolicyEditor() {
    }

    /**
     * @param policy    当前策略
     * @param field     字段名
     * @param text      用户输入
     * @param pageCount 文档页数，用于页面选择器和顺序统计量的范围
     */
    public static PolicyEdit apply(CropPolicy policy, String field, String text, int pageCount) {
        try {
            CropPolicy edited = edit(policy, field, text == null ? "" : text.trim(), pageCount);
            log.debug("策略字段 {} 已更新为 \"{}\"", field, text);
            return new PolicyEdit(edited, null);
        } catch (CropParseException e) {
            log.warn("策略字段 {} 的输入 \"{}\" 无效，保持原值: {}", field, text, e.getMessage());
            return new PolicyEdit(policy, e);
        }
    }

    private static CropPolicy edit(CropPolicy policy, String field, String text, int pageCount) {
        CropPolicy.CropPolicyBuilder builder = policy.toBuilder();
        switch (field) {
            case "percentRetain":
                return builder.percentRetain(single(field, text, policy.getPercentRetain(), v -> v)).build();
            case "percentRetain4":
                return builder.percentRetain(quad(field, text, v -> v)).build();
            case "absoluteOffset":
                return builder.absoluteOffset(single(field, text, policy.getAbsoluteOffset(), v -> v)).build();
            case "absoluteOffset4":
                return builder.absoluteOffset(quad(field, text, v -> v)).build();
            case "uniformOrderStat":
                return builder.uniformOrderStat(single(field, text, policy.getUniformOrderStat(),
                        v -> clampOrderStat(v, pageCount))).build();
            case "uniformOrderStat4":
                return builder.uniformOrderStat(quad(field, text, v -> clampOrderStat(v, pageCount))).build();
            case "absolutePreCrop":
                return builder.absolutePreCrop(single(field, text, policy.getAbsolutePreCrop(), v -> v)).build();
            case "absolutePreCrop4":
                return builder.absolutePreCrop(quad(field, text, v -> v)).build();
            case "pageRatioWeights":
                return builder.pageRatioWeights(quad(field, text, v -> Math.max(0.0, v))).build();
            case "uniform":
                return builder.uniform(bool(field, text)).build();
            case "evenodd":
                return builder.evenodd(bool(field, text)).build();
            case "percentText":
                return builder.percentText(bool(field, text)).build();
            case "cropSafe":
                return builder.cropSafe(bool(field, text)).build();
            case "samePageSize":
                return builder.samePageSize(bool(field, text)).build();
            case "restore":
                return builder.restore(bool(field, text)).build();
            case "threshold":
                return builder.threshold(clamp(integer(field, text), 0, 255)).build();
            case "numBlurs":
                return builder.numBlurs(Math.max(0, integer(field, text))).build();
            case "numSmooths":
                return builder.numSmooths(Math.max(0, integer(field, text))).build();
            case "setPageRatios":
                return builder.pageRatio(text.isEmpty() ? null : PageRatioParser.parse(text)).build();
            case "pages":
                return builder.pageSubset(text.isEmpty() ? null : PageSelectorParser.parse(text, pageCount)).build();
            default:
                throw new CropParseException(field, "未知的策略字段: " + field);
        }
    }

    /**
     * 应用一组编辑，遇到第一个错误即停止；已成功的编辑保留
     */
    public static PolicyEdit applyAll(CropPolicy policy, Map<String, String> edits, int pageCount) {
        CropPolicy current = policy;
        for (Map.Entry<String, String> entry : edits.entrySet()) {
            PolicyEdit edit = apply(current, entry.getKey(), entry.getValue(), pageCount);
            if (!edit.isSuccess()) {
                return new PolicyEdit(current, edit.getError());
            }
            current = edit.getPolicy();
        }
        return new PolicyEdit(current, null);
    }

    /**
     * 策略的字段视图，四元组字段同时给出单值形式（不一致时为 "N/A"）
     */
    public static Map<String, Object> describe(CropPolicy policy) {
        Map<String, Object> view = new LinkedHashMap<>();
        quadView(view, "percentRetain", policy.getPercentRetain());
        quadView(view, "absoluteOffset", policy.getAbsoluteOffset());
        quadView(view, "uniformOrderStat", policy.getUniformOrderStat());
        quadView(view, "absolutePreCrop", policy.getAbsolutePreCrop());
        view.put("pageRatioWeights", toArray(policy.getPageRatioWeights()));
        view.put("uniform", policy.isUniform());
        view.put("evenodd", policy.isEvenodd());
        view.put("percentText", policy.isPercentText());
        view.put("cropSafe", policy.isCropSafe());
        view.put("samePageSize", policy.isSamePageSize());
        view.put("restore", policy.isRestore());
        view.put("threshold", policy.getThreshold());
        view.put("numBlurs", policy.getNumBlurs());
        view.put("numSmooths", policy.getNumSmooths());
        view.put("setPageRatios", policy.getPageRatio() == null ? "" : policy.getPageRatio().toString());
        view.put("pages", policy.getPageSubset() == null ? "" : formatPages(new TreeSet<>(policy.getPageSubset())));
        return view;
    }

    // ==================== 字段解析 ====================

    private static SideValues single(String field, String text, SideValues current,
                                     Function<Double, Double> normalize) {
        if (SideValues.NOT_APPLICABLE.equalsIgnoreCase(text)) {
            return current;
        }
        return SideValues.all(normalize.apply(number(field, text)));
    }

    private static SideValues quad(String field, String text, Function<Double, Double> normalize) {
        String[] parts = text.split("[\\s,]+");
        if (parts.length != 4) {
            throw new CropParseException(field, "需要 4 个数值（左 下 右 上）: \"" + text + "\"");
        }
        SideValues values = SideValues.zero();
        for (Side side : Side.values()) {
            values = values.with(side, normalize.apply(number(field, parts[side.ordinal()])));
        }
        return values;
    }

    private static double number(String field, String text) {
        try {
            double value = Double.parseDouble(text);
            if (Double.isNaN(value) || Double.isInfinite(value)) {
                throw new CropParseException(field, "不是有限数值: \"" + text + "\"");
            }
            return value;
        } catch (NumberFormatException e) {
            throw new CropParseException(field, "不是数值: \"" + text + "\"", e);
        }
    }

    private static int integer(String field, String text) {
        try {
            return Integer.parseInt(text);
        } catch (NumberFormatException e) {
            throw new CropParseException(field, "不是整数: \"" + text + "\"", e);
        }
    }

    private static boolean bool(String field, String text) {
        switch (text.toLowerCase()) {
            case "true":
            case "1":
            case "on":
            case "yes":
                return true;
            case "false":
            case "0":
            case "off":
            case "no":
                return false;
            default:
                throw new CropParseException(field, "不是布尔值: \"" + text + "\"");
        }
    }

    private static double clampOrderStat(double value, int pageCount) {
        return clamp((int) Math.round(value), 0, Math.max(0, pageCount - 1));
    }

    private static int clamp(int value, int min, int max) {
        return Math.max(min, Math.min(max, value));
    }

    // ==================== 视图 ====================

    private static void quadView(Map<String, Object> view, String field, SideValues values) {
        view.put(field, values.getSingle());
        view.put(field + "4", toArray(values));
    }

    private static double[] toArray(SideValues values) {
        return new double[]{values.getLeft(), values.getBottom(), values.getRight(), values.getTop()};
    }

    /**
     * 把0基索引集合格式化为1基选择器文本，连续页合并为范围
     */
    static String formatPages(Iterable<Integer> pages) {
        StringBuilder sb = new StringBuilder();
        BiFunction<Integer, Integer, String> range = (a, b) ->
                a.equals(b) ? String.valueOf(a + 1) : (a + 1) + "-" + (b + 1);
        Integer start = null;
        Integer prev = null;
        for (Integer page : pages) {
            if (start == null) {
                start = page;
            } else if (page != prev + 1) {
                sb.append(sb.length() == 0 ? "" : ",").append(range.apply(start, prev));
                start = page;
            }
            prev = page;
        }
        if (start != null) {
            sb.append(sb.length() == 0 ? "" : ",").append(range.apply(start, prev));
        }
        return sb.toString();
    }
}
