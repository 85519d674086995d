package org.photoconv.convert.ies;

/**
 * 数据流在凑够所需数量的 token 之前就结束了（角度表、光强表、倾斜表）。
 */
public class TruncatedInputException extends IesParseException {

    private final int expected;
    private final int actual;

    public TruncatedInputException(String what, int expected, int actual, Integer lineNumber) {
        super(what + "数据不完整：期望 " + expected + " 个值，实际只有 " + actual + " 个", lineNumber);
        this.expected = expected;
        this.actual = actual;
    }

    public int getExpected() {
        return expected;
    }

    public int getActual() {
        return actual;
    }
}
