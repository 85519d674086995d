package org.photoconv.convert.ies.model;

import java.util.List;

/**
 * 解析一个 IES 文件得到的完整结果。
 *
 * @param commonHeader 通用灯具元信息
 * @param fileHeader   IES 专有头（版本/TILT/数值头/关键字）
 * @param angles       垂直/水平角
 * @param candela      光强矩阵与峰值/光束角
 * @param warnings     非致命告警（例如数值头字段不足、存在多余数据等）；无告警时为空列表
 */
public record IesParseResult(
        CommonHeader commonHeader,
        IesFileHeader fileHeader,
        PhotometricAngles angles,
        CandelaMatrix candela,
        List<String> warnings
) {

    public IesParseResult {
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
    }

    public PhotometricHeaderFields photometry() {
        return fileHeader.photometry();
    }
}
