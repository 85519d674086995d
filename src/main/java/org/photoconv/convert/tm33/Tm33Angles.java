package org.photoconv.convert.tm33;

import java.util.List;

/**
 * @param vertical   垂直角（Gamma）
 * @param horizontal 水平角（C 平面）
 */
public record Tm33Angles(List<Double> vertical, List<Double> horizontal) {

    public Tm33Angles {
        vertical = List.copyOf(vertical);
        horizontal = List.copyOf(horizontal);
    }
}
