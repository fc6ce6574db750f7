package com.example.pdfcrop.model;

/**
 * percentRetain 到裁剪比例的插值曲线
 *
 * <p>返回值是应裁掉的页边比例：0% 保留时为 1（裁到内容边），100% 保留时为 0（不裁）。
 * 两个端点对所有曲线都固定，中间单调。
 */
public enum RetainCurve {

    LINEAR {
        @Override
        public double cropFraction(double percentRetain) {
            return 1.0 - percentRetain / 100.0;
        }
    },

    EASE_OUT {
        @Override
        public double cropFraction(double percentRetain) {
            double f = 1.0 - percentRetain / 100.0;
            return f * Math.abs(f);
        }
    };

    public abstract double cropFraction(double percentRetain);
}
