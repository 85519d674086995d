package org.photoconv.convert.tm33;

import java.time.Instant;

/**
 * TM-33 {@code FileInformation} 块（TM-33-18 必填）：描述文件本身，不含光度数据。
 *
 * @param creator        生成软件名称
 * @param creatorVersion 生成软件版本
 * @param created        生成时间（UTC，精确到秒）
 * @param sourceFile     源文件名（可为 {@code null}）
 */
public record Tm33FileInformation(
        String creator,
        String creatorVersion,
        Instant created,
        String sourceFile
) {
}
