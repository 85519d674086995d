package org.photoconv.convert.ies.model;

/**
 * 灯具外形尺寸，单位与文件声明的 {@link UnitsType} 一致（不做换算）。
 */
public record LuminaireDimensions(double width, double length, double height, UnitsType units) {
}
