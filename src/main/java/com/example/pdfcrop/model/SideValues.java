package com.example.pdfcrop.model;

import java.util.Arrays;

/**
 * 按边存储的四个数值（左、下、右、上）
 *
 * <p>四元组是唯一的数据来源；单值形式只是派生视图：
 * 四个值相同时为该值，否则显示为 "N/A"。
 */
public final class SideValues {

    public static final String NOT_APPLICABLE = "N/A";

    private final double[] values;

    private SideValues(double[] values) {
        this.values = values;
    }

    public static SideValues of(double left, double bottom, double right, double top) {
        return new SideValues(new double[]{left, bottom, right, top});
    }

    public static SideValues all(double value) {
        return of(value, value, value, value);
    }

    public static SideValues zero() {
        return all(0.0);
    }

    public double get(Side side) {
        return values[side.ordinal()];
    }

    public SideValues with(Side side, double value) {
        double[] copy = values.clone();
        copy[side.ordinal()] = value;
        return new SideValues(copy);
    }

    public SideValues plus(SideValues other) {
        double[] sum = new double[4];
        for (int i = 0; i < 4; i++) {
            sum[i] = values[i] + other.values[i];
        }
        return new SideValues(sum);
    }

    /**
     * 四个值是否完全一致
     */
    public boolean isUniform() {
        return values[0] == values[1] && values[1] == values[2] && values[2] == values[3];
    }

    /**
     * 单值视图：一致时返回该值，否则返回 "N/A"
     */
    public String getSingle() {
        return isUniform() ? format(values[0]) : NOT_APPLICABLE;
    }

    public double getLeft() {
        return get(Side.LEFT);
    }

    public double getBottom() {
        return get(Side.BOTTOM);
    }

    public double getRight() {
        return get(Side.RIGHT);
    }

    public double getTop() {
        return get(Side.TOP);
    }

    private static String format(double value) {
        if (value == Math.rint(value) && !Double.isInfinite(value)) {
            return String.valueOf((long) value);
        }
        return String.valueOf(value);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SideValues)) return false;
        return Arrays.equals(values, ((SideValues) o).values);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(values);
    }

    @Override
    public String toString() {
        return "[" + format(values[0]) + ", " + format(values[1]) + ", "
                + format(values[2]) + ", " + format(values[3]) + "]";
    }
}
