package org.photoconv.convert.ies.model;

import java.util.Arrays;

/**
 * 光强矩阵 {@code values[h][v]}：行是水平角（C 平面），列是垂直角（Gamma）。
 * <p>
 * 峰值与光束角在解析阶段由最终（已做 TILT 修正的）矩阵一次性算出，之后不再变化。
 * 矩阵在进出时都会复制，调用方拿不到内部数组。
 */
public final class CandelaMatrix {

    private final double[][] values;
    private final double peakCandela;
    private final int peakPlaneIndex;
    private final int peakVerticalIndex;
    private final double peakVerticalAngle;
    private final double peakHorizontalAngle;
    private final double beamAngle;

    public CandelaMatrix(
            double[][] values,
            double peakCandela,
            int peakPlaneIndex,
            int peakVerticalIndex,
            double peakVerticalAngle,
            double peakHorizontalAngle,
            double beamAngle
    ) {
        this.values = copy(values);
        this.peakCandela = peakCandela;
        this.peakPlaneIndex = peakPlaneIndex;
        this.peakVerticalIndex = peakVerticalIndex;
        this.peakVerticalAngle = peakVerticalAngle;
        this.peakHorizontalAngle = peakHorizontalAngle;
        this.beamAngle = beamAngle;
    }

    public int horizontalCount() {
        return values.length;
    }

    public int verticalCount() {
        return values.length == 0 ? 0 : values[0].length;
    }

    public double get(int horizontalIndex, int verticalIndex) {
        return values[horizontalIndex][verticalIndex];
    }

    /**
     * 返回某个 C 平面的光强（副本）。
     */
    public double[] plane(int horizontalIndex) {
        return values[horizontalIndex].clone();
    }

    public double[][] toArray() {
        return copy(values);
    }

    public double peakCandela() {
        return peakCandela;
    }

    public int peakPlaneIndex() {
        return peakPlaneIndex;
    }

    public int peakVerticalIndex() {
        return peakVerticalIndex;
    }

    public double peakVerticalAngle() {
        return peakVerticalAngle;
    }

    public double peakHorizontalAngle() {
        return peakHorizontalAngle;
    }

    public double beamAngle() {
        return beamAngle;
    }

    private static double[][] copy(double[][] source) {
        double[][] out = new double[source.length][];
        for (int h = 0; h < source.length; h++) {
            out[h] = source[h].clone();
        }
        return out;
    }

    @Override
    public String toString() {
        return "CandelaMatrix[" + horizontalCount() + "x" + verticalCount()
                + ", peak=" + peakCandela + " @plane " + peakPlaneIndex
                + ", beam=" + beamAngle + ", values=" + Arrays.deepToString(values) + "]";
    }
}
