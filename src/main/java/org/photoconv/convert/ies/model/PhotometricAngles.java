package org.photoconv.convert.ies.model;

import java.util.List;

/**
 * 光度角度定义。
 *
 * @param vertical   垂直角（Gamma），长度 Nv
 * @param horizontal 水平角（C 平面），长度 Nh
 * @param type       角度类型标签 {@code "C"}/{@code "B"}/{@code "A"}
 */
public record PhotometricAngles(List<Double> vertical, List<Double> horizontal, String type) {

    public PhotometricAngles {
        vertical = List.copyOf(vertical);
        horizontal = List.copyOf(horizontal);
    }
}
