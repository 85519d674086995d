package org.photoconv.convert.tm33;

/**
 * TM-33 {@code MeasurementUnits} 块（TM-33-18 必填）。
 *
 * @param lengthUnit    长度单位：{@code meter} 或 {@code foot}
 * @param angleUnit     角度单位（固定 {@code degree}）
 * @param intensityUnit 光强单位（固定 {@code candela}）
 * @param fluxUnit      光通量单位（固定 {@code lumen}）
 * @param powerUnit     功率单位（固定 {@code watt}）
 */
public record Tm33Measurement(
        String lengthUnit,
        String angleUnit,
        String intensityUnit,
        String fluxUnit,
        String powerUnit
) {

    public static Tm33Measurement withLengthUnit(String lengthUnit) {
        return new Tm33Measurement(lengthUnit, "degree", "candela", "lumen", "watt");
    }
}
