package org.photoconv.convert.tm33;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.dataformat.xml.XmlMapper;
import com.fasterxml.jackson.dataformat.xml.annotation.JacksonXmlElementWrapper;
import com.fasterxml.jackson.dataformat.xml.annotation.JacksonXmlProperty;
import com.fasterxml.jackson.dataformat.xml.annotation.JacksonXmlRootElement;
import com.fasterxml.jackson.dataformat.xml.ser.ToXmlGenerator;

import java.math.BigDecimal;
import java.math.MathContext;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * TM-33 XML 输出（结构与 TM-33-18 对齐，不做完整 XSD 校验）。
 * <p>
 * 元素顺序：
 * <pre>
 * TM33PhotometricData@standard
 *   FileInformation   Creator, CreatorVersion, Created, SourceFile?
 *   MeasurementUnits  LengthUnit, AngleUnit, IntensityUnit, FluxUnit, PowerUnit
 *   TestInformation   Laboratory?, ReportNumber?, TestDate?
 *   Luminaire         Manufacturer, Model, CatalogNumber?, InputWatts, TotalLumens
 *   PhotometricData   PhotometricType, NumberOfVerticalAngles, NumberOfHorizontalAngles,
 *                     Symmetry@type, Angles, CandelaValues
 * </pre>
 * 光强按 C 平面分组：每个 {@code HorizontalPlane@angle} 下按垂直角顺序输出 {@code Candela}。
 * <p>
 * 数值与区域设置无关：保留 15 位有效数字，不用科学计数法，去掉末尾 0，{@code -0} 输出为 {@code 0}。
 */
public final class Tm33XmlWriter {

    private static final DateTimeFormatter CREATED_FORMAT =
            DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss'Z'").withZone(ZoneOffset.UTC);
    private static final DateTimeFormatter DATE_FORMAT = DateTimeFormatter.ISO_LOCAL_DATE;
    private static final MathContext SIGNIFICANT_DIGITS = new MathContext(15);

    private static final XmlMapper XML_MAPPER = createMapper();

    private Tm33XmlWriter() {
    }

    public static String writeToString(Tm33Document doc) {
        Objects.requireNonNull(doc, "doc");
        try {
            return XML_MAPPER.writeValueAsString(toXml(doc));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("生成 TM-33 XML 失败：" + e.getOriginalMessage(), e);
        }
    }

    /**
     * 不受区域设置影响的数值格式化。
     */
    static String formatNumber(double value) {
        if (!Double.isFinite(value)) {
            throw new IllegalArgumentException("无法输出非有限数值：" + value);
        }
        BigDecimal rounded = new BigDecimal(value).round(SIGNIFICANT_DIGITS);
        if (rounded.signum() == 0) {
            return "0";
        }
        return rounded.stripTrailingZeros().toPlainString();
    }

    private static XmlMapper createMapper() {
        XmlMapper mapper = new XmlMapper();
        mapper.configure(ToXmlGenerator.Feature.WRITE_XML_DECLARATION, true);
        mapper.enable(SerializationFeature.INDENT_OUTPUT);
        return mapper;
    }

    private static RootXml toXml(Tm33Document doc) {
        Tm33FileInformation fi = doc.fileInformation();
        Tm33Measurement m = doc.measurement();
        Tm33Header h = doc.header();
        Tm33Luminaire l = doc.luminaire();

        return new RootXml(
                h.standard() == null ? Tm33Header.STANDARD : h.standard(),
                new FileInformationXml(
                        nullToEmpty(fi.creator()),
                        nullToEmpty(fi.creatorVersion()),
                        fi.created() == null ? "" : CREATED_FORMAT.format(fi.created()),
                        blankToNull(fi.sourceFile())
                ),
                new MeasurementUnitsXml(m.lengthUnit(), m.angleUnit(), m.intensityUnit(), m.fluxUnit(), m.powerUnit()),
                new TestInformationXml(
                        blankToNull(h.laboratory()),
                        blankToNull(h.reportNumber()),
                        h.testDate() == null ? null : DATE_FORMAT.format(h.testDate())
                ),
                new LuminaireXml(
                        nullToEmpty(l.manufacturer()),
                        nullToEmpty(l.model()),
                        blankToNull(l.catalogNumber()),
                        formatNumber(l.inputWatts()),
                        formatNumber(l.totalLumens())
                ),
                toXml(doc.photometry())
        );
    }

    private static PhotometricDataXml toXml(Tm33Photometry p) {
        List<Double> horizontal = p.angles().horizontal();
        Tm33CandelaMatrix candela = p.candela();
        int nh = candela.horizontalCount();
        int nv = candela.verticalCount();

        List<HorizontalPlaneXml> planes = new ArrayList<>(nh);
        for (int hi = 0; hi < nh; hi++) {
            double planeAngle = hi < horizontal.size() ? horizontal.get(hi) : hi;
            List<String> values = new ArrayList<>(nv);
            for (int vi = 0; vi < nv; vi++) {
                values.add(formatNumber(candela.get(hi, vi)));
            }
            planes.add(new HorizontalPlaneXml(formatNumber(planeAngle), values));
        }

        Tm33Symmetry symmetry = p.symmetry() == null ? Tm33Symmetry.NONE : p.symmetry();
        return new PhotometricDataXml(
                p.type(),
                p.numberOfVerticalAngles(),
                p.numberOfHorizontalAngles(),
                new SymmetryXml(symmetry.label()),
                new AnglesXml(new AngleListXml(formatAll(p.angles().vertical())), new AngleListXml(formatAll(horizontal))),
                new CandelaValuesXml(nh, nv, planes)
        );
    }

    private static List<String> formatAll(List<Double> values) {
        List<String> out = new ArrayList<>(values.size());
        for (Double v : values) {
            out.add(formatNumber(v));
        }
        return out;
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value;
    }

    // ---------------------------------------------------------------------
    // XML 视图（只用于序列化）
    // ---------------------------------------------------------------------

    @JacksonXmlRootElement(localName = "TM33PhotometricData")
    @JsonPropertyOrder({"standard", "FileInformation", "MeasurementUnits", "TestInformation", "Luminaire", "PhotometricData"})
    record RootXml(
            @JacksonXmlProperty(isAttribute = true, localName = "standard") String standard,
            @JacksonXmlProperty(localName = "FileInformation") FileInformationXml fileInformation,
            @JacksonXmlProperty(localName = "MeasurementUnits") MeasurementUnitsXml measurementUnits,
            @JacksonXmlProperty(localName = "TestInformation") TestInformationXml testInformation,
            @JacksonXmlProperty(localName = "Luminaire") LuminaireXml luminaire,
            @JacksonXmlProperty(localName = "PhotometricData") PhotometricDataXml photometricData
    ) {
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    @JsonPropertyOrder({"Creator", "CreatorVersion", "Created", "SourceFile"})
    record FileInformationXml(
            @JacksonXmlProperty(localName = "Creator") String creator,
            @JacksonXmlProperty(localName = "CreatorVersion") String creatorVersion,
            @JacksonXmlProperty(localName = "Created") String created,
            @JacksonXmlProperty(localName = "SourceFile") String sourceFile
    ) {
    }

    @JsonPropertyOrder({"LengthUnit", "AngleUnit", "IntensityUnit", "FluxUnit", "PowerUnit"})
    record MeasurementUnitsXml(
            @JacksonXmlProperty(localName = "LengthUnit") String lengthUnit,
            @JacksonXmlProperty(localName = "AngleUnit") String angleUnit,
            @JacksonXmlProperty(localName = "IntensityUnit") String intensityUnit,
            @JacksonXmlProperty(localName = "FluxUnit") String fluxUnit,
            @JacksonXmlProperty(localName = "PowerUnit") String powerUnit
    ) {
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    @JsonPropertyOrder({"Laboratory", "ReportNumber", "TestDate"})
    record TestInformationXml(
            @JacksonXmlProperty(localName = "Laboratory") String laboratory,
            @JacksonXmlProperty(localName = "ReportNumber") String reportNumber,
            @JacksonXmlProperty(localName = "TestDate") String testDate
    ) {
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    @JsonPropertyOrder({"Manufacturer", "Model", "CatalogNumber", "InputWatts", "TotalLumens"})
    record LuminaireXml(
            @JacksonXmlProperty(localName = "Manufacturer") String manufacturer,
            @JacksonXmlProperty(localName = "Model") String model,
            @JacksonXmlProperty(localName = "CatalogNumber") String catalogNumber,
            @JacksonXmlProperty(localName = "InputWatts") String inputWatts,
            @JacksonXmlProperty(localName = "TotalLumens") String totalLumens
    ) {
    }

    @JsonPropertyOrder({"PhotometricType", "NumberOfVerticalAngles", "NumberOfHorizontalAngles", "Symmetry", "Angles", "CandelaValues"})
    record PhotometricDataXml(
            @JacksonXmlProperty(localName = "PhotometricType") String photometricType,
            @JacksonXmlProperty(localName = "NumberOfVerticalAngles") int numberOfVerticalAngles,
            @JacksonXmlProperty(localName = "NumberOfHorizontalAngles") int numberOfHorizontalAngles,
            @JacksonXmlProperty(localName = "Symmetry") SymmetryXml symmetry,
            @JacksonXmlProperty(localName = "Angles") AnglesXml angles,
            @JacksonXmlProperty(localName = "CandelaValues") CandelaValuesXml candelaValues
    ) {
    }

    record SymmetryXml(@JacksonXmlProperty(isAttribute = true, localName = "type") String type) {
    }

    @JsonPropertyOrder({"VerticalAngles", "HorizontalAngles"})
    record AnglesXml(
            @JacksonXmlProperty(localName = "VerticalAngles") AngleListXml vertical,
            @JacksonXmlProperty(localName = "HorizontalAngles") AngleListXml horizontal
    ) {
    }

    record AngleListXml(
            @JacksonXmlElementWrapper(useWrapping = false)
            @JacksonXmlProperty(localName = "Angle")
            List<String> angles
    ) {
    }

    @JsonPropertyOrder({"horizontalCount", "verticalCount", "HorizontalPlane"})
    record CandelaValuesXml(
            @JacksonXmlProperty(isAttribute = true, localName = "horizontalCount") int horizontalCount,
            @JacksonXmlProperty(isAttribute = true, localName = "verticalCount") int verticalCount,
            @JacksonXmlElementWrapper(useWrapping = false)
            @JacksonXmlProperty(localName = "HorizontalPlane")
            List<HorizontalPlaneXml> planes
    ) {
    }

    @JsonPropertyOrder({"angle", "Candela"})
    record HorizontalPlaneXml(
            @JacksonXmlProperty(isAttribute = true, localName = "angle") String angle,
            @JacksonXmlElementWrapper(useWrapping = false)
            @JacksonXmlProperty(localName = "Candela")
            List<String> candela
    ) {
    }
}
