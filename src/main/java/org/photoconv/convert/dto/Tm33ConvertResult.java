package org.photoconv.convert.dto;

import java.util.List;

/**
 * {@code ies_convert_to_tm33} / {@code ies_convert_text_to_tm33} 的返回结果。
 *
 * @param rootId      根目录标识（内联文本为 {@code null}）
 * @param path        源 IES 文件路径（内联文本为 {@code null}）
 * @param decodedWith 源文件解码字符集（内联文本为 {@code null}）
 * @param symmetry    推断出的对称性（None/Axial/Bilateral）
 * @param peakCandela 峰值光强
 * @param beamAngle   50% 光束角
 * @param bytes       XML 的 UTF-8 字节数
 * @param sha256      XML 的 sha256
 * @param xml         TM-33 XML 文本
 * @param warnings    非致命告警
 */
public record Tm33ConvertResult(
        String rootId,
        String path,
        String decodedWith,
        String symmetry,
        double peakCandela,
        double beamAngle,
        long bytes,
        String sha256,
        String xml,
        List<String> warnings
) {
}
