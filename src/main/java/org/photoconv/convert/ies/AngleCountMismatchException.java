package org.photoconv.convert.ies;

/**
 * 角度表的值个数少于数值头声明的 Nv / Nh。
 */
public class AngleCountMismatchException extends TruncatedInputException {

    public AngleCountMismatchException(String what, int expected, int actual, Integer lineNumber) {
        super(what, expected, actual, lineNumber);
    }
}
