package org.photoconv.convert.tm33;

import org.photoconv.convert.ies.model.CommonHeader;
import org.photoconv.convert.ies.model.IesParseResult;
import org.photoconv.convert.ies.model.PhotometricAngles;
import org.photoconv.convert.ies.model.UnitsType;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.Objects;

/**
 * 把 IES 解析结果映射为 TM-33-18 文档（核心字段 + 必填块）。
 * <p>
 * 纯转录：不重新计算光度数据，光强矩阵直接取自解析结果（已做 TILT 修正）。
 */
public final class IesToTm33Mapper {

    public static final String DEFAULT_CREATOR = "Photometric Tools";
    public static final String DEFAULT_CREATOR_VERSION = "1.0";

    private final Clock clock;
    private final String creator;
    private final String creatorVersion;

    public IesToTm33Mapper() {
        this(Clock.systemUTC(), DEFAULT_CREATOR, DEFAULT_CREATOR_VERSION);
    }

    public IesToTm33Mapper(Clock clock, String creator, String creatorVersion) {
        this.clock = Objects.requireNonNull(clock, "clock");
        this.creator = isBlank(creator) ? DEFAULT_CREATOR : creator;
        this.creatorVersion = isBlank(creatorVersion) ? DEFAULT_CREATOR_VERSION : creatorVersion;
    }

    public Tm33Document map(IesParseResult ies) {
        return map(ies, null, null);
    }

    /**
     * @param ies            解析结果
     * @param sourceFileName 源文件名（可为 {@code null}）
     * @param testDate       测试日期（IES 不携带，可为 {@code null}）
     */
    public Tm33Document map(IesParseResult ies, String sourceFileName, LocalDate testDate) {
        Objects.requireNonNull(ies, "ies");

        PhotometricAngles angles = ies.angles();
        CommonHeader common = ies.commonHeader();
        int nv = angles.vertical().size();
        int nh = angles.horizontal().size();

        String lengthUnit = ies.photometry().unitsType() == UnitsType.FEET ? "foot" : "meter";
        Instant created = clock.instant().truncatedTo(ChronoUnit.SECONDS);

        return new Tm33Document(
                new Tm33FileInformation(creator, creatorVersion, created, blankToNull(sourceFileName)),
                Tm33Measurement.withLengthUnit(lengthUnit),
                new Tm33Header(Tm33Header.STANDARD, common.testLaboratory(), common.testReport(), testDate),
                new Tm33Luminaire(
                        common.manufacturer(),
                        common.luminaire(),
                        common.catalogNumber(),
                        common.inputWatts(),
                        common.totalLumens()
                ),
                new Tm33Photometry(
                        angles.type(),
                        nv,
                        nh,
                        Tm33Symmetry.fromHorizontalCount(nh),
                        new Tm33Angles(angles.vertical(), angles.horizontal()),
                        new Tm33CandelaMatrix(ies.candela().toArray())
                )
        );
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    private static String blankToNull(String value) {
        return isBlank(value) ? null : value.trim();
    }
}
