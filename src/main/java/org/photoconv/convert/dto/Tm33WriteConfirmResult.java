package org.photoconv.convert.dto;

import java.time.Instant;
import java.util.List;

/**
 * {@code pm_confirm_write} 的返回结果。取消时 {@code written=false}、{@code bytesWritten=0}。
 *
 * @param token        prepare 阶段发放的 token
 * @param rootId       目标根目录标识
 * @param path         写入的 TM-33 文件路径
 * @param sourcePath   生成该 XML 的 IES 文件路径
 * @param confirmed    调用方是否确认
 * @param written      XML 是否已落盘
 * @param bytesWritten 落盘字节数
 * @param sha256       落盘 XML 的 sha256
 * @param wroteAt      落盘时间（取消时为 {@code null}）
 * @param warnings     提示信息
 */
public record Tm33WriteConfirmResult(
        String token,
        String rootId,
        String path,
        String sourcePath,
        boolean confirmed,
        boolean written,
        long bytesWritten,
        String sha256,
        Instant wroteAt,
        List<String> warnings
) {
}
