package org.photoconv.convert.ies.model;

/**
 * IES 光度类型（LM-63 数值头第 6 个字段）。
 * <p>
 * 未知编码按 Type C 处理（绝大多数灯具文件为 Type C）。
 */
public enum PhotometricType {
    C(1),
    B(2),
    A(3);

    private final int code;

    PhotometricType(int code) {
        this.code = code;
    }

    public int code() {
        return code;
    }

    /**
     * 角度类型标签：{@code "C"}/{@code "B"}/{@code "A"}。
     */
    public String label() {
        return name();
    }

    public static PhotometricType fromCode(int code) {
        for (PhotometricType type : values()) {
            if (type.code == code) {
                return type;
            }
        }
        return C;
    }

    public static boolean isKnownCode(int code) {
        return code >= 1 && code <= 3;
    }
}
