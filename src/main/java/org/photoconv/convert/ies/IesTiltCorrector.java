package org.photoconv.convert.ies;

import org.photoconv.convert.ies.model.IesTilt;

import java.util.List;

/**
 * TILT=INCLUDE 修正：对每个垂直角在倾斜表上线性插值得到倍率，再按列缩放光强矩阵。
 * <p>
 * 倾斜表角度假定升序；表外取首/尾倍率（clamp）。
 */
public final class IesTiltCorrector {

    private static final double EPSILON = 1e-12;

    private IesTiltCorrector() {
    }

    /**
     * 为每个垂直角计算倍率。
     */
    public static double[] verticalMultipliers(List<Double> verticalAngles, IesTilt tilt) {
        if (!tilt.isInclude()) {
            throw new IllegalArgumentException("只有 TILT=INCLUDE 才有倾斜表");
        }
        double[] result = new double[verticalAngles.size()];
        for (int i = 0; i < result.length; i++) {
            result[i] = interpolateClamped(tilt.angles(), tilt.multipliers(), verticalAngles.get(i));
        }
        return result;
    }

    /**
     * 原地修正：{@code values[h][v] *= multipliers[v]}。
     */
    public static void apply(double[][] values, double[] multipliers) {
        for (double[] plane : values) {
            if (plane.length != multipliers.length) {
                throw new IllegalArgumentException("倍率个数与光强矩阵列数不一致");
            }
            for (int v = 0; v < plane.length; v++) {
                plane[v] *= multipliers[v];
            }
        }
    }

    /**
     * 倾斜表角度是否非降序。
     */
    public static boolean isAscending(List<Double> angles) {
        for (int i = 1; i < angles.size(); i++) {
            if (angles.get(i) < angles.get(i - 1)) {
                return false;
            }
        }
        return true;
    }

    static double interpolateClamped(List<Double> xs, List<Double> ys, double x) {
        int last = xs.size() - 1;
        if (x <= xs.get(0)) {
            return ys.get(0);
        }
        if (x >= xs.get(last)) {
            return ys.get(last);
        }
        // 线性扫描即可：倾斜表通常只有十几项
        for (int i = 0; i < last; i++) {
            double x0 = xs.get(i);
            double x1 = xs.get(i + 1);
            if (x >= x0 && x <= x1) {
                double y0 = ys.get(i);
                if (Math.abs(x1 - x0) < EPSILON) {
                    return y0;
                }
                double t = (x - x0) / (x1 - x0);
                return y0 + (ys.get(i + 1) - y0) * t;
            }
        }
        // 非升序表可能找不到包含 x 的区间
        return ys.get(last);
    }
}
