package org.photoconv.convert.ies.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * IES 专有头信息：版本行、TILT、数值头，以及原始关键字表。
 *
 * @param version    第一行版本串（例如 {@code IESNA:LM-63-2002}）
 * @param tilt       TILT 定义
 * @param photometry 数值头记录
 * @param keywords   文件中出现的全部 {@code [KEY]value}（保持出现顺序；{@code MORE} 以换行拼接）
 */
public record IesFileHeader(
        String version,
        IesTilt tilt,
        PhotometricHeaderFields photometry,
        Map<String, String> keywords
) {

    public IesFileHeader {
        keywords = keywords == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(keywords));
    }
}
