package org.photoconv.convert.ies;

/**
 * 角度/光强/倾斜表中出现无法解析为十进制数的 token。
 */
public class InvalidNumberException extends IesParseException {

    private final String token;

    public InvalidNumberException(String what, String token, Integer lineNumber) {
        super(what + "中存在非法数值：'" + token + "'", lineNumber);
        this.token = token;
    }

    public String getToken() {
        return token;
    }
}
