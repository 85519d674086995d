package org.photoconv.convert.ies;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * 关键字段解析：从版本行之后一直读到 {@code TILT=} 行（不消费 TILT 行）。
 * <p>
 * {@code [KEY]value} 形式的行按固定映射表写入通用头；未知关键字不报错（向前兼容），
 * 但仍保留在原始关键字表中。非方括号行（LM-63-1986 的自由文本）直接跳过。
 * 这里不做任何数值解析。
 */
final class IesKeywordReader {

    private IesKeywordReader() {
    }

    static Keywords read(IesTokenStream stream) {
        String manufacturer = "";
        String luminaire = "";
        String catalogNumber = "";
        String lamp = "";
        String testLaboratory = "";
        String testReport = "";
        String notes = "";
        Map<String, String> raw = new LinkedHashMap<>();

        while (stream.hasMoreLines()) {
            String line = stream.peekLine();
            if (isTiltLine(line)) {
                break;
            }
            stream.nextLine();

            int end = line.indexOf(']');
            if (!line.startsWith("[") || end < 0) {
                continue;
            }
            String key = line.substring(1, end).trim().toUpperCase(Locale.ROOT);
            String value = line.substring(end + 1).trim();

            switch (key) {
                case "MANUFAC" -> manufacturer = value;
                case "LUMCAT" -> luminaire = value;
                case "CATALOGNUMBER" -> catalogNumber = value;
                case "LAMPCAT" -> lamp = value;
                case "TESTLAB" -> testLaboratory = value;
                case "TEST" -> testReport = value;
                case "MORE" -> notes = appendLine(notes, value);
            }
            if ("MORE".equals(key)) {
                raw.merge(key, value, IesKeywordReader::appendLine);
            } else {
                raw.put(key, value);
            }
        }

        return new Keywords(manufacturer, luminaire, catalogNumber, lamp, testLaboratory, testReport, notes, raw);
    }

    static boolean isTiltLine(String line) {
        return line != null && line.regionMatches(true, 0, "TILT=", 0, 5);
    }

    private static String appendLine(String existing, String value) {
        return existing == null || existing.isBlank() ? value : existing + "\n" + value;
    }

    record Keywords(
            String manufacturer,
            String luminaire,
            String catalogNumber,
            String lamp,
            String testLaboratory,
            String testReport,
            String notes,
            Map<String, String> raw
    ) {
    }
}
