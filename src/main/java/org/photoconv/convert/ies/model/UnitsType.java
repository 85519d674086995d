package org.photoconv.convert.ies.model;

/**
 * IES 尺寸单位（LM-63 数值头第 7 个字段：1=英尺，2=米）。
 */
public enum UnitsType {
    FEET(1),
    METERS(2);

    private final int code;

    UnitsType(int code) {
        this.code = code;
    }

    public int code() {
        return code;
    }

    public static UnitsType fromCode(int code) {
        return code == 1 ? FEET : METERS;
    }
}
