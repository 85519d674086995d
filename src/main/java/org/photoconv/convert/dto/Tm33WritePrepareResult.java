package org.photoconv.convert.dto;

import java.time.Instant;
import java.util.List;

/**
 * {@code ies_prepare_write_tm33} 的返回结果（仅准备，不会真的写入）。
 *
 * @param token          用于 {@code pm_confirm_write} 的 token
 * @param rootId         目标根目录标识
 * @param path           目标路径（统一使用 / 分隔）
 * @param sourcePath     源 IES 文件路径
 * @param exists         目标文件是否已存在
 * @param overwrite      是否允许覆盖
 * @param bytes          待写入字节数
 * @param expectedSha256 已存在目标文件的 sha256（确认时校验是否被外部修改）
 * @param newSha256      待写入 XML 的 sha256
 * @param expiresAt      token 过期时间
 * @param warnings       解析告警与写入风险提示
 */
public record Tm33WritePrepareResult(
        String token,
        String rootId,
        String path,
        String sourcePath,
        boolean exists,
        boolean overwrite,
        long bytes,
        String expectedSha256,
        String newSha256,
        Instant expiresAt,
        List<String> warnings
) {
}
