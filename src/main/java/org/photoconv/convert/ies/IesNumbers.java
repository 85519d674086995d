package org.photoconv.convert.ies;

import java.util.regex.Pattern;

/**
 * 与区域设置无关的数值解析：小数点固定为 {@code .}，不支持千分位。
 * <p>
 * {@link Double#parseDouble} 还会接受 {@code NaN}/{@code Infinity}/十六进制浮点/{@code 1d} 等写法，
 * 这些在 IES 文件里都不合法，因此先用正则限定为普通十进制（可带指数）。
 */
final class IesNumbers {

    private static final Pattern DECIMAL = Pattern.compile("[+-]?(\\d+\\.?\\d*|\\.\\d+)([eE][+-]?\\d+)?");

    private IesNumbers() {
    }

    static boolean isDecimal(String token) {
        return token != null && DECIMAL.matcher(token).matches();
    }

    /**
     * @return 解析结果；token 不是合法十进制数时返回 {@code null}
     */
    static Double tryParseDouble(String token) {
        if (!isDecimal(token)) {
            return null;
        }
        double value = Double.parseDouble(token);
        return Double.isFinite(value) ? value : null;
    }

    /**
     * 整数字段允许写成 {@code 2} 或 {@code 2.0}，但不允许 {@code 2.5}。
     *
     * @return 解析结果；不是整数时返回 {@code null}
     */
    static Integer tryParseInt(String token) {
        Double value = tryParseDouble(token);
        if (value == null || value != Math.rint(value) || Math.abs(value) > Integer.MAX_VALUE) {
            return null;
        }
        return (int) value.doubleValue();
    }

    static double parseDouble(String token, String what, Integer lineNumber) {
        Double value = tryParseDouble(token);
        if (value == null) {
            throw new InvalidNumberException(what, token, lineNumber);
        }
        return value;
    }
}
