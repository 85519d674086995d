package org.photoconv.convert.tm33;

/**
 * TM-33 光强矩阵：行是水平角，列是垂直角。
 */
public final class Tm33CandelaMatrix {

    private final double[][] values;

    public Tm33CandelaMatrix(double[][] values) {
        this.values = copy(values);
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

    public double[][] toArray() {
        return copy(values);
    }

    private static double[][] copy(double[][] source) {
        double[][] out = new double[source.length][];
        for (int h = 0; h < source.length; h++) {
            out[h] = source[h].clone();
        }
        return out;
    }
}
