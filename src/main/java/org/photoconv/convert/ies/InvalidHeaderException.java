package org.photoconv.convert.ies;

/**
 * 数值头记录无效：字段不足 10 个、数值无法解析、整数字段不是整数，或灯数小于 1。
 */
public class InvalidHeaderException extends IesParseException {

    public InvalidHeaderException(String message, Integer lineNumber) {
        super(message, lineNumber);
    }

    public InvalidHeaderException(String message, Integer lineNumber, Throwable cause) {
        super(message, lineNumber, cause);
    }
}
