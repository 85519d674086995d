package org.photoconv.convert.ies.model;

/**
 * LM-63 数值头记录（13 个固定位置字段）。
 *
 * @param lampCount            灯数（≥1）
 * @param lumensPerLamp        单灯光通量（绝对光度测量时为 -1）
 * @param candelaMultiplier    光强倍率
 * @param verticalAngleCount   垂直角数量 Nv
 * @param horizontalAngleCount 水平角数量 Nh
 * @param photometricType      光度类型
 * @param unitsType            尺寸单位
 * @param width                灯具宽
 * @param length               灯具长
 * @param height               灯具高
 * @param ballastFactor        镇流器系数（缺省 1.0）
 * @param futureUse            保留字段（缺省 0.0，不参与计算）
 * @param inputWatts           输入功率
 * @param fieldCount           文件实际提供的字段数（10..13）
 */
public record PhotometricHeaderFields(
        int lampCount,
        double lumensPerLamp,
        double candelaMultiplier,
        int verticalAngleCount,
        int horizontalAngleCount,
        PhotometricType photometricType,
        UnitsType unitsType,
        double width,
        double length,
        double height,
        double ballastFactor,
        double futureUse,
        double inputWatts,
        int fieldCount
) {

    public double totalLumens() {
        return lampCount * lumensPerLamp;
    }

    public boolean isAbsolutePhotometry() {
        return lumensPerLamp < 0;
    }

    public LuminaireDimensions dimensions() {
        return new LuminaireDimensions(width, length, height, unitsType);
    }
}
