package org.photoconv.convert.ies;

import org.photoconv.convert.ies.model.CandelaMatrix;
import org.photoconv.convert.ies.model.CommonHeader;
import org.photoconv.convert.ies.model.IesFileHeader;
import org.photoconv.convert.ies.model.IesParseResult;
import org.photoconv.convert.ies.model.IesTilt;
import org.photoconv.convert.ies.model.PhotometricAngles;
import org.photoconv.convert.ies.model.PhotometricHeaderFields;
import org.photoconv.convert.ies.model.TiltType;

import java.util.ArrayList;
import java.util.List;

/**
 * IES LM-63 解析器（无状态，线程安全）。
 * <p>
 * 解析顺序：
 * <ol>
 *   <li>第一行：版本串</li>
 *   <li>关键字段，直到 {@code TILT=} 行</li>
 *   <li>TILT 行；{@code TILT=INCLUDE} 时读取倾斜表（位于数值头之前）</li>
 *   <li>数值头记录（10~13 个字段）</li>
 *   <li>Nv 个垂直角、Nh 个水平角、Nh×Nv 个光强值（已乘光强倍率）</li>
 *   <li>TILT=INCLUDE 修正（按垂直角插值倍率）</li>
 *   <li>峰值与 50% 光束角</li>
 * </ol>
 * 任一步骤失败都会抛出 {@link IesParseException} 的子类并中止解析，不返回部分结果。
 * 非致命情况（字段不足取默认值、多余数据被忽略等）记录在 {@link IesParseResult#warnings()}。
 */
public final class IesReader {

    private IesReader() {
    }

    public static IesParseResult parse(String iesText) {
        if (iesText == null || iesText.isBlank()) {
            throw new EmptyInputException();
        }

        List<String> warnings = new ArrayList<>();
        IesTokenStream stream = new IesTokenStream(iesText, warnings);

        // 1) 版本行
        String version = stream.nextLine();
        if (version == null) {
            throw new MissingSectionException("缺少 IES 版本行");
        }

        // 2) 关键字段
        IesKeywordReader.Keywords keywords = IesKeywordReader.read(stream);

        // 3) TILT
        IesTilt tilt = IesTiltReader.read(stream);
        if (tilt.isInclude() && !IesTiltCorrector.isAscending(tilt.angles())) {
            warnings.add("TILT 倾斜表角度不是升序，插值结果可能不可靠");
        }

        // 4) 数值头
        PhotometricHeaderFields photometry = IesPhotometricHeaderReader.read(stream, warnings);
        int nv = photometry.verticalAngleCount();
        int nh = photometry.horizontalAngleCount();
        if (photometry.isAbsolutePhotometry()) {
            warnings.add("单灯光通量为 " + photometry.lumensPerLamp() + "（绝对光度），总光通量按灯数相乘后为负值");
        }

        // 5) 角度与光强
        List<Double> vertical = IesCandelaReader.readAngles(stream, nv, "垂直角");
        List<Double> horizontal = IesCandelaReader.readAngles(stream, nh, "水平角");
        double[][] values = IesCandelaReader.readCandela(stream, nh, nv, photometry.candelaMultiplier());

        int trailing = stream.remainingTokenCount();
        if (trailing > 0) {
            warnings.add("光强表之后还有 " + trailing + " 个值，已忽略");
        }

        // 6) TILT 修正必须在计算峰值之前完成
        if (tilt.isInclude()) {
            IesTiltCorrector.apply(values, IesTiltCorrector.verticalMultipliers(vertical, tilt));
        } else if (tilt.type() == TiltType.FILE) {
            warnings.add("TILT 引用外部文件 " + tilt.fileName() + "，未应用倾斜修正");
        }

        // 7) 峰值 + 光束角
        CandelaMetricsCalculator.Metrics metrics = CandelaMetricsCalculator.compute(values, vertical);
        CandelaMatrix candela = new CandelaMatrix(
                values,
                metrics.peakCandela(),
                metrics.peakPlaneIndex(),
                metrics.peakVerticalIndex(),
                vertical.get(metrics.peakVerticalIndex()),
                horizontal.get(metrics.peakPlaneIndex()),
                metrics.beamAngle()
        );

        CommonHeader common = new CommonHeader(
                keywords.manufacturer(),
                keywords.luminaire(),
                keywords.catalogNumber(),
                keywords.lamp(),
                keywords.testLaboratory(),
                keywords.testReport(),
                keywords.notes(),
                photometry.inputWatts(),
                photometry.totalLumens()
        );

        return new IesParseResult(
                common,
                new IesFileHeader(version, tilt, photometry, keywords.raw()),
                new PhotometricAngles(vertical, horizontal, photometry.photometricType().label()),
                candela,
                warnings
        );
    }
}
