package org.photoconv.convert.dto;

import java.util.List;

/**
 * TILT 段摘要。
 *
 * @param type                    NONE / INCLUDE / FILE
 * @param fileName                {@code TILT=<file>} 引用的文件名（未解析）
 * @param lampToLuminaireGeometry INCLUDE 时的灯具几何编码
 * @param angles                  INCLUDE 时的倾斜角
 * @param multipliers             INCLUDE 时对应的倍率
 */
public record IesTiltInfo(
        String type,
        String fileName,
        Integer lampToLuminaireGeometry,
        List<Double> angles,
        List<Double> multipliers
) {
}
