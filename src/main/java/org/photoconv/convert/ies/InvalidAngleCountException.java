package org.photoconv.convert.ies;

/**
 * 数值头声明的 Nv 或 Nh 不大于 0（或 Nv×Nh 溢出）。
 */
public class InvalidAngleCountException extends IesParseException {

    public InvalidAngleCountException(String message, Integer lineNumber) {
        super(message, lineNumber);
    }
}
