package org.photoconv.convert.ies;

/**
 * 输入为空或只含空白。
 */
public class EmptyInputException extends IesParseException {

    public EmptyInputException() {
        super("IES 内容为空，无法解析");
    }
}
