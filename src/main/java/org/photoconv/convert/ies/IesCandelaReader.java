package org.photoconv.convert.ies;

import java.util.ArrayList;
import java.util.List;

/**
 * 读取垂直角表、水平角表与光强表。
 * <p>
 * 光强表按“水平优先”展开：外层循环 C 平面（h），内层循环 Gamma 角（v），
 * 即第 k 个 token 对应 {@code raw[k / Nv][k % Nv]}。顺序一旦读反，矩阵会被静默转置，
 * 后续所有计算都会出错且不会报错。
 */
final class IesCandelaReader {

    private IesCandelaReader() {
    }

    static List<Double> readAngles(IesTokenStream stream, int count, String what) {
        Integer line = stream.lineNumber();
        List<String> tokens;
        try {
            tokens = stream.readTokens(count, what);
        } catch (TruncatedInputException e) {
            throw new AngleCountMismatchException(what, e.getExpected(), e.getActual(), e.getLineNumber());
        }
        List<Double> out = new ArrayList<>(count);
        for (String token : tokens) {
            out.add(IesNumbers.parseDouble(token, what, line));
        }
        return out;
    }

    /**
     * 读取 Nh×Nv 个光强值，每个值乘以 {@code candelaMultiplier}（只乘一次）。
     *
     * @return {@code values[h][v]}
     */
    static double[][] readCandela(IesTokenStream stream, int nh, int nv, double candelaMultiplier) {
        Integer line = stream.lineNumber();
        List<String> tokens = stream.readTokens(Math.multiplyExact(nh, nv), "光强表");
        double[][] values = new double[nh][nv];
        int k = 0;
        for (int h = 0; h < nh; h++) {
            for (int v = 0; v < nv; v++) {
                values[h][v] = IesNumbers.parseDouble(tokens.get(k++), "光强表", line) * candelaMultiplier;
            }
        }
        return values;
    }
}
