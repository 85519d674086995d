package org.photoconv.convert.ies;

import org.photoconv.convert.ies.model.PhotometricHeaderFields;
import org.photoconv.convert.ies.model.PhotometricType;
import org.photoconv.convert.ies.model.UnitsType;

import java.util.ArrayList;
import java.util.List;

/**
 * LM-63 数值头记录解析。
 * <p>
 * 字段顺序固定：
 * <pre>
 * lampCount lumensPerLamp candelaMultiplier Nv Nh photometricType unitsType width length height
 * ballastFactor futureUse inputWatts
 * </pre>
 * 至少需要 10 个字段；缺失的尾部字段取默认值：ballastFactor=1.0，futureUse=0.0，
 * inputWatts 取“实际出现的最后一个字段”（部分厂商省略镇流器/保留字段，但行尾总是功率）。
 * <p>
 * 标准 LM-63 把后 3 个字段单独放在下一行。前 10 个字段读完后，若下一行恰好补齐缺失字段，
 * 再比较“合并/不合并”两种读法能否容纳角度表与光强表，见 {@link #continuesOnNextLine}。
 */
final class IesPhotometricHeaderReader {

    static final int MIN_FIELDS = 10;
    static final int FULL_FIELDS = 13;

    private IesPhotometricHeaderReader() {
    }

    static PhotometricHeaderFields read(IesTokenStream stream, List<String> warnings) {
        if (!stream.hasMoreLines()) {
            throw new MissingSectionException("缺少光度数值头记录");
        }
        Integer line = stream.lineNumber();
        List<String> tokens = new ArrayList<>(stream.readRecord(MIN_FIELDS));
        if (tokens.size() < MIN_FIELDS) {
            throw new InvalidHeaderException("光度数值头字段不足：期望至少 " + MIN_FIELDS + " 个，实际 " + tokens.size() + " 个", line);
        }

        int lampCount = parseInt(tokens, 0, "灯数", line);
        double lumensPerLamp = parseDouble(tokens, 1, "单灯光通量", line);
        double candelaMultiplier = parseDouble(tokens, 2, "光强倍率", line);
        int nv = parseInt(tokens, 3, "垂直角数量", line);
        int nh = parseInt(tokens, 4, "水平角数量", line);
        int photometricTypeCode = parseInt(tokens, 5, "光度类型", line);
        int unitsTypeCode = parseInt(tokens, 6, "单位类型", line);
        double width = parseDouble(tokens, 7, "宽度", line);
        double length = parseDouble(tokens, 8, "长度", line);
        double height = parseDouble(tokens, 9, "高度", line);

        if (lampCount < 1) {
            throw new InvalidHeaderException("灯数必须 ≥ 1：" + lampCount, line);
        }
        if (nv <= 0 || nh <= 0) {
            throw new InvalidAngleCountException("角度数量无效：Nv=" + nv + "，Nh=" + nh, line);
        }
        long cells = (long) nv * nh;
        if (cells > Integer.MAX_VALUE) {
            throw new InvalidAngleCountException("角度数量过大：Nv×Nh=" + cells, line);
        }

        if (tokens.size() < FULL_FIELDS && continuesOnNextLine(stream, FULL_FIELDS - tokens.size(), nv, nh, cells)) {
            tokens.addAll(stream.readTokens(FULL_FIELDS - tokens.size(), "光度数值头"));
        }
        if (tokens.size() > FULL_FIELDS) {
            warnings.add("光度数值头多出 " + (tokens.size() - FULL_FIELDS) + " 个值，已忽略");
        }

        int fieldCount = Math.min(tokens.size(), FULL_FIELDS);
        double ballastFactor = fieldCount > 10 ? parseDouble(tokens, 10, "镇流器系数", line) : 1.0;
        double futureUse = fieldCount > 11 ? parseDouble(tokens, 11, "保留字段", line) : 0.0;
        double inputWatts = fieldCount > 12
                ? parseDouble(tokens, 12, "输入功率", line)
                : parseDouble(tokens, fieldCount - 1, "输入功率", line);
        if (fieldCount < FULL_FIELDS) {
            warnings.add("光度数值头只有 " + fieldCount + " 个字段，输入功率取最后一个字段（" + tokens.get(fieldCount - 1) + "）");
        }
        if (!PhotometricType.isKnownCode(photometricTypeCode)) {
            warnings.add("未知光度类型 " + photometricTypeCode + "，按 Type C 处理");
        }

        return new PhotometricHeaderFields(
                lampCount,
                lumensPerLamp,
                candelaMultiplier,
                nv,
                nh,
                PhotometricType.fromCode(photometricTypeCode),
                UnitsType.fromCode(unitsTypeCode),
                width,
                length,
                height,
                ballastFactor,
                futureUse,
                inputWatts,
                fieldCount
        );
    }

    /**
     * 两种读法都按整行语义模拟角度表与光强表：不合并读不完时合并；两种都读得完时，
     * 合并读法更“整齐”（恰好读到文件末尾，或每个数据块都在行尾结束）才合并，否则按 10~12 字段处理。
     */
    static boolean continuesOnNextLine(IesTokenStream stream, int missing, int nv, int nh, long cells) {
        String next = stream.peekLine();
        if (next == null || stream.peekLineTokenCount() != missing) {
            return false;
        }
        for (String token : IesTokenStream.tokenize(next)) {
            if (!IesNumbers.isDecimal(token)) {
                return false;
            }
        }
        IesTokenStream.BlockLayout merged = stream.layoutBlocks(1, nv, nh, cells);
        if (!merged.fits()) {
            return false;
        }
        IesTokenStream.BlockLayout unmerged = stream.layoutBlocks(0, nv, nh, cells);
        if (!unmerged.fits()) {
            return true;
        }
        if (merged.exact() != unmerged.exact()) {
            return merged.exact();
        }
        return merged.lineAligned() && !unmerged.lineAligned();
    }

    private static double parseDouble(List<String> tokens, int index, String field, Integer line) {
        Double value = IesNumbers.tryParseDouble(tokens.get(index));
        if (value == null) {
            throw new InvalidHeaderException("光度数值头字段“" + field + "”不是合法数值：'" + tokens.get(index) + "'", line);
        }
        return value;
    }

    private static int parseInt(List<String> tokens, int index, String field, Integer line) {
        Integer value = IesNumbers.tryParseInt(tokens.get(index));
        if (value == null) {
            throw new InvalidHeaderException("光度数值头字段“" + field + "”不是整数：'" + tokens.get(index) + "'", line);
        }
        return value;
    }
}
