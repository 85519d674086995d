package org.photoconv.convert.ies;

/**
 * TILT=INCLUDE 倾斜表无效：表长度 ≤ 0 或不是整数，或角度/倍率个数不一致。
 */
public class InvalidTiltTableException extends IesParseException {

    public InvalidTiltTableException(String message, Integer lineNumber) {
        super(message, lineNumber);
    }
}
