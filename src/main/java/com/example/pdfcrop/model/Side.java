package com.example.pdfcrop.model;

/**
 * 页面四边，所有四元组参数都按此顺序：左、下、右、上
 */
public enum Side {
    LEFT,
    BOTTOM,
    RIGHT,
    TOP;

    /**
     * 是否为水平方向上的边（左/右）
     */
    public boolean isHorizontal() {
        return this == LEFT || this == RIGHT;
    }

    /**
     * 同一轴上的另一边
     */
    public Side opposite() {
        switch (this) {
            case LEFT:
                return RIGHT;
            case RIGHT:
                return LEFT;
            case BOTTOM:
                return TOP;
            default:
                return BOTTOM;
        }
    }
}
