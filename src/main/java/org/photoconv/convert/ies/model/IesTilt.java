package org.photoconv.convert.ies.model;

import java.util.List;
import java.util.Objects;

/**
 * IES TILT 定义。
 * <p>
 * 三种形态：
 * <ul>
 *   <li>{@link TiltType#NONE}：无修正。</li>
 *   <li>{@link TiltType#INCLUDE}：内联倾斜表，{@code angles} 与 {@code multipliers} 一一对应。</li>
 *   <li>{@link TiltType#FILE}：外部倾斜文件名（不解析）。</li>
 * </ul>
 *
 * @param type                    TILT 类型
 * @param fileName                外部倾斜文件名（仅 FILE）
 * @param lampToLuminaireGeometry 灯-灯具几何关系编码（仅 INCLUDE，读取但不参与计算）
 * @param angles                  倾斜角（度，仅 INCLUDE）
 * @param multipliers             对应倍率（仅 INCLUDE）
 */
public record IesTilt(
        TiltType type,
        String fileName,
        Integer lampToLuminaireGeometry,
        List<Double> angles,
        List<Double> multipliers
) {

    private static final IesTilt NONE = new IesTilt(TiltType.NONE, null, null, List.of(), List.of());

    public IesTilt {
        Objects.requireNonNull(type, "type");
        angles = angles == null ? List.of() : List.copyOf(angles);
        multipliers = multipliers == null ? List.of() : List.copyOf(multipliers);
        if (type == TiltType.INCLUDE) {
            if (angles.isEmpty() || angles.size() != multipliers.size()) {
                throw new IllegalArgumentException("TILT=INCLUDE 的角度数与倍率数必须一致且大于 0");
            }
        }
    }

    public static IesTilt none() {
        return NONE;
    }

    public static IesTilt include(int lampToLuminaireGeometry, List<Double> angles, List<Double> multipliers) {
        return new IesTilt(TiltType.INCLUDE, null, lampToLuminaireGeometry, angles, multipliers);
    }

    public static IesTilt file(String fileName) {
        return new IesTilt(TiltType.FILE, fileName, null, List.of(), List.of());
    }

    public boolean isInclude() {
        return type == TiltType.INCLUDE;
    }
}
