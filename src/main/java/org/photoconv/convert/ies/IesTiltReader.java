package org.photoconv.convert.ies;

import org.photoconv.convert.ies.model.IesTilt;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * 解析 {@code TILT=} 行，并在 {@code TILT=INCLUDE} 时读取紧随其后的倾斜表。
 * <p>
 * 倾斜表位于数值头记录之前，结构为：
 * <pre>
 * &lt;灯-灯具几何关系&gt;
 * &lt;表长度 n&gt;            （也可与几何关系同行）
 * &lt;n 个角度&gt;
 * &lt;n 个倍率&gt;
 * </pre>
 * 各部分都可能跨行，因此统一走 {@link IesTokenStream#readTokens(int, String)}。
 */
final class IesTiltReader {

    private static final String NONE = "NONE";
    private static final String INCLUDE = "INCLUDE";

    private IesTiltReader() {
    }

    /**
     * 消费 TILT 行；若为 INCLUDE，继续消费倾斜表。
     *
     * @throws MissingSectionException 当前位置不是 TILT 行
     */
    static IesTilt read(IesTokenStream stream) {
        String line = stream.peekLine();
        if (!IesKeywordReader.isTiltLine(line)) {
            throw new MissingSectionException("缺少 TILT= 行");
        }
        Integer tiltLineNumber = stream.lineNumber();
        stream.nextLine();

        String value = line.substring(5).trim();
        if (value.isEmpty() || NONE.equals(value.toUpperCase(Locale.ROOT))) {
            return IesTilt.none();
        }
        if (!INCLUDE.equals(value.toUpperCase(Locale.ROOT))) {
            return IesTilt.file(value);
        }

        if (!stream.hasMoreLines()) {
            throw new TruncatedInputException("TILT=INCLUDE 倾斜表", 2, 0, tiltLineNumber);
        }

        // 几何关系与表长度可以写在同一行
        Integer headLine = stream.lineNumber();
        boolean sameLine = stream.peekLineTokenCount() >= 2;
        List<String> head = sameLine
                ? stream.readTokens(2, "TILT 灯-灯具几何关系与表长度")
                : stream.readTokens(1, "TILT 灯-灯具几何关系");
        Integer geometry = IesNumbers.tryParseInt(head.get(0));
        if (geometry == null) {
            throw new InvalidTiltTableException("TILT 灯-灯具几何关系不是整数：'" + head.get(0) + "'", headLine);
        }

        Integer countLine = sameLine ? headLine : stream.lineNumber();
        String countToken = sameLine ? head.get(1) : stream.readTokens(1, "TILT 表长度").get(0);
        Integer n = IesNumbers.tryParseInt(countToken);
        if (n == null || n <= 0) {
            throw new InvalidTiltTableException("TILT 表长度无效：'" + countToken + "'", countLine);
        }

        // 两个列表都恰好读 n 个，长度一致由 IesTilt 构造器保证
        List<Double> angles = readDoubles(stream, n, "TILT 角度");
        List<Double> multipliers = readDoubles(stream, n, "TILT 倍率");
        return IesTilt.include(geometry, angles, multipliers);
    }

    private static List<Double> readDoubles(IesTokenStream stream, int count, String what) {
        Integer line = stream.lineNumber();
        List<String> tokens = stream.readTokens(count, what);
        List<Double> out = new ArrayList<>(tokens.size());
        for (String token : tokens) {
            out.add(IesNumbers.parseDouble(token, what, line));
        }
        return out;
    }
}
