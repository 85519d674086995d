package org.photoconv.convert.dto;

import java.util.List;
import java.util.Map;

/**
 * {@code ies_read_info} / {@code ies_parse_text} 的返回结果。
 * <p>
 * 光强值均已乘光强倍率；TILT=INCLUDE 时已做倾斜修正。
 *
 * @param rootId               根目录标识（内联文本为 {@code null}）
 * @param path                 统一后的路径（使用 '/' 分隔；内联文本为 {@code null}）
 * @param decodedWith          文件字节流的解码字符集（内联文本为 {@code null}）
 * @param version              IES 版本行（例如 {@code IESNA:LM-63-2002}）
 * @param manufacturer         {@code [MANUFAC]}
 * @param luminaire            {@code [LUMCAT]}
 * @param catalogNumber        {@code [CATALOGNUMBER]}
 * @param lamp                 {@code [LAMPCAT]}
 * @param testLaboratory       {@code [TESTLAB]}
 * @param testReport           {@code [TEST]}
 * @param notes                {@code [MORE]}（多行以换行拼接）
 * @param keywords             出现过的全部关键字（保持原顺序）
 * @param tilt                 TILT 段摘要
 * @param lampCount            灯数
 * @param lumensPerLamp        单灯光通量（-1 表示绝对光度测量）
 * @param totalLumens          总光通量
 * @param candelaMultiplier    光强倍率
 * @param ballastFactor        镇流器系数
 * @param inputWatts           输入功率
 * @param photometricType      光度类型（C/B/A）
 * @param unitsType            尺寸单位（FEET/METERS）
 * @param width                宽度
 * @param length               长度
 * @param height               高度
 * @param headerFieldCount     数值头实际提供的字段数（10~13）
 * @param verticalAngleCount   垂直角数量
 * @param horizontalAngleCount 水平角数量
 * @param verticalAngles       垂直角
 * @param horizontalAngles     水平角
 * @param peakCandela          峰值光强
 * @param peakVerticalAngle    峰值所在垂直角
 * @param peakHorizontalAngle  峰值所在水平角（C 平面）
 * @param beamAngle            50% 光束角（峰值所在 C 平面）
 * @param candela              可选：完整光强矩阵 {@code [h][v]}
 * @param warnings             非致命告警
 */
public record IesFileInfoResult(
        String rootId,
        String path,
        String decodedWith,
        String version,
        String manufacturer,
        String luminaire,
        String catalogNumber,
        String lamp,
        String testLaboratory,
        String testReport,
        String notes,
        Map<String, String> keywords,
        IesTiltInfo tilt,
        int lampCount,
        double lumensPerLamp,
        double totalLumens,
        double candelaMultiplier,
        double ballastFactor,
        double inputWatts,
        String photometricType,
        String unitsType,
        double width,
        double length,
        double height,
        int headerFieldCount,
        int verticalAngleCount,
        int horizontalAngleCount,
        List<Double> verticalAngles,
        List<Double> horizontalAngles,
        double peakCandela,
        double peakVerticalAngle,
        double peakHorizontalAngle,
        double beamAngle,
        double[][] candela,
        List<String> warnings
) {
}
