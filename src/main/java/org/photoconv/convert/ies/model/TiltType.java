package org.photoconv.convert.ies.model;

/**
 * {@code TILT=} 行的取值类型。
 */
public enum TiltType {
    /** 无倾斜修正。 */
    NONE,
    /** 倾斜表紧随 TILT 行内联给出。 */
    INCLUDE,
    /** 引用外部倾斜文件（本解析器不解析该文件）。 */
    FILE
}
