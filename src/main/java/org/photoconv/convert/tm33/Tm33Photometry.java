package org.photoconv.convert.tm33;

/**
 * TM-33 光度数据块。
 *
 * @param type                     光度类型（C/B/A）
 * @param numberOfVerticalAngles   垂直角数量
 * @param numberOfHorizontalAngles 水平角数量
 * @param symmetry                 对称性
 * @param angles                   角度表
 * @param candela                  光强矩阵
 */
public record Tm33Photometry(
        String type,
        int numberOfVerticalAngles,
        int numberOfHorizontalAngles,
        Tm33Symmetry symmetry,
        Tm33Angles angles,
        Tm33CandelaMatrix candela
) {
}
