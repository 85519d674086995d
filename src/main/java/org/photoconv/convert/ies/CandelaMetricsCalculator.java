package org.photoconv.convert.ies;

import java.util.List;

/**
 * 峰值光强与 50% 光束角计算。
 * <p>
 * 光束角只在全局峰值所在的那个 C 平面上计算：从峰值列向左/右寻找光强跨越半峰值的相邻两点，
 * 在两点间按光强线性插值出角度；找不到跨越点时取首/尾垂直角。
 */
public final class CandelaMetricsCalculator {

    private static final double EPSILON = 1e-12;

    private CandelaMetricsCalculator() {
    }

    /**
     * @param peakCandela       峰值光强
     * @param peakPlaneIndex    峰值所在水平面下标
     * @param peakVerticalIndex 峰值所在垂直角下标
     * @param beamAngle         50% 光束角（度，≥0）
     */
    public record Metrics(double peakCandela, int peakPlaneIndex, int peakVerticalIndex, double beamAngle) {
    }

    public static Metrics compute(double[][] values, List<Double> verticalAngles) {
        int nh = values.length;
        int nv = nh == 0 ? 0 : values[0].length;
        if (nh == 0 || nv == 0) {
            throw new IllegalArgumentException("光强矩阵为空");
        }
        if (verticalAngles.size() != nv) {
            throw new IllegalArgumentException("垂直角数量与光强矩阵列数不一致");
        }

        // 严格大于：并列时保留先出现的（h 小优先，其次 v 小）
        double peak = values[0][0];
        int peakPlane = 0;
        int peakV = 0;
        for (int h = 0; h < nh; h++) {
            for (int v = 0; v < nv; v++) {
                if (values[h][v] > peak) {
                    peak = values[h][v];
                    peakPlane = h;
                    peakV = v;
                }
            }
        }

        double half = peak * 0.5;
        double[] plane = values[peakPlane];

        Double left = null;
        for (int i = peakV; i > 0; i--) {
            if (plane[i] >= half && plane[i - 1] < half) {
                left = interpolateAngle(verticalAngles.get(i - 1), verticalAngles.get(i), plane[i - 1], plane[i], half);
                break;
            }
        }

        Double right = null;
        for (int i = peakV; i < nv - 1; i++) {
            if (plane[i] >= half && plane[i + 1] < half) {
                right = interpolateAngle(verticalAngles.get(i), verticalAngles.get(i + 1), plane[i], plane[i + 1], half);
                break;
            }
        }

        double leftAngle = left != null ? left : verticalAngles.get(0);
        double rightAngle = right != null ? right : verticalAngles.get(nv - 1);
        double beam = Math.max(0.0, rightAngle - leftAngle);

        return new Metrics(peak, peakPlane, peakV, beam);
    }

    static double interpolateAngle(double a1, double a2, double c1, double c2, double target) {
        double dc = c2 - c1;
        if (Math.abs(dc) < EPSILON) {
            return a1;
        }
        return a1 + (target - c1) * (a2 - a1) / dc;
    }
}
