package org.photoconv.convert.tm33;

/**
 * @param manufacturer  制造商
 * @param model         型号（来自 IES {@code [LUMCAT]}）
 * @param catalogNumber 目录号（空则不输出）
 * @param inputWatts    输入功率
 * @param totalLumens   总光通量
 */
public record Tm33Luminaire(
        String manufacturer,
        String model,
        String catalogNumber,
        double inputWatts,
        double totalLumens
) {
}
