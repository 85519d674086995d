package org.photoconv.convert.ies;

/**
 * IES 解析失败的基类。所有解析错误都会中止本次解析，不返回部分结果。
 * <p>
 * 继承 {@link IllegalArgumentException}：对调用方（MCP 工具层）而言，格式错误的文件与非法参数同属“输入问题”。
 */
public class IesParseException extends IllegalArgumentException {

    private final Integer lineNumber;

    public IesParseException(String message) {
        this(message, null, null);
    }

    public IesParseException(String message, Integer lineNumber) {
        this(message, lineNumber, null);
    }

    public IesParseException(String message, Integer lineNumber, Throwable cause) {
        super(lineNumber == null ? message : message + "（第 " + lineNumber + " 行）", cause);
        this.lineNumber = lineNumber;
    }

    /**
     * 出错位置（1-based 非空行号）；无法定位时为 {@code null}。
     */
    public Integer getLineNumber() {
        return lineNumber;
    }
}
