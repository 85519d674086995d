package org.photoconv.convert.ies;

/**
 * 缺少必需的行/段落：版本行、{@code TILT=} 行或数值头记录。
 */
public class MissingSectionException extends IesParseException {

    public MissingSectionException(String message) {
        super(message);
    }
}
