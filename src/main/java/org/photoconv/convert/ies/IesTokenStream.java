package org.photoconv.convert.ies;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * IES 文本的行/Token 游标。
 * <p>
 * 厂商导出的 IES 文件会在任意列宽处折行，因此数值块不能按“一行一组”读取：
 * {@link #readTokens(int, String)} 会跨越连续多行累积 token，直到凑够所需数量。
 * <p>
 * 约定：
 * <ul>
 *   <li>换行统一为 {@code \n}，空白行直接丢弃；行号保留原始物理行号，便于报错定位。</li>
 *   <li>token 以空白或逗号分隔。</li>
 *   <li>读取 token 时，被“部分消费”的最后一行也算消费完毕；该行剩余 token 丢弃并记入 warnings。</li>
 * </ul>
 */
public final class IesTokenStream {

    private static final Pattern SEPARATORS = Pattern.compile("[\\s,]+");

    private final List<Line> lines;
    private final List<String> warnings;
    private int cursor;

    public IesTokenStream(String text) {
        this(text, null);
    }

    /**
     * @param text     完整文件文本
     * @param warnings 非致命告警的收集列表（可为 {@code null}）
     */
    public IesTokenStream(String text, List<String> warnings) {
        this.lines = splitLines(text == null ? "" : text);
        this.warnings = warnings;
        this.cursor = 0;
    }

    public boolean hasMoreLines() {
        return cursor < lines.size();
    }

    /**
     * 当前行（未消费）的内容，已去除首尾空白；没有更多行时返回 {@code null}。
     */
    public String peekLine() {
        return hasMoreLines() ? lines.get(cursor).text() : null;
    }

    /**
     * 取出当前行并前进一行；没有更多行时返回 {@code null}。
     */
    public String nextLine() {
        if (!hasMoreLines()) {
            return null;
        }
        return lines.get(cursor++).text();
    }

    /**
     * 当前游标所在行的物理行号（1-based）；流已结束时返回最后一行的行号（空流为 {@code null}）。
     */
    public Integer lineNumber() {
        if (lines.isEmpty()) {
            return null;
        }
        return lines.get(Math.min(cursor, lines.size() - 1)).number();
    }

    /**
     * 读取恰好 {@code count} 个 token，可跨多行。
     *
     * @param count 需要的 token 数
     * @param what  用于报错的数据块名称（例如“垂直角”）
     * @throws TruncatedInputException 流结束前没有凑够 {@code count} 个 token
     */
    public List<String> readTokens(int count, String what) {
        List<String> out = new ArrayList<>(Math.min(count, 4096));
        Integer startLine = lineNumber();
        while (out.size() < count && hasMoreLines()) {
            Line line = lines.get(cursor++);
            String[] tokens = tokenize(line.text());
            int take = Math.min(tokens.length, count - out.size());
            for (int i = 0; i < take; i++) {
                out.add(tokens[i]);
            }
            if (take < tokens.length) {
                warn("第 " + line.number() + " 行在读取" + what + "后还剩 " + (tokens.length - take) + " 个值，已忽略");
            }
        }
        if (out.size() < count) {
            throw new TruncatedInputException(what, count, out.size(), startLine);
        }
        return out;
    }

    /**
     * 按整行读取，直到累积到至少 {@code minTokens} 个 token 或流结束；返回这些行的全部 token。
     */
    public List<String> readRecord(int minTokens) {
        List<String> out = new ArrayList<>();
        while (out.size() < minTokens && hasMoreLines()) {
            for (String token : tokenize(lines.get(cursor++).text())) {
                out.add(token);
            }
        }
        return out;
    }

    /**
     * 当前行的 token 数（不消费）；没有更多行时返回 0。
     */
    public int peekLineTokenCount() {
        return hasMoreLines() ? tokenize(lines.get(cursor).text()).length : 0;
    }

    /**
     * 从当前行开始（含）剩余的 token 总数。
     */
    public int remainingTokenCount() {
        return remainingTokenCount(0);
    }

    /**
     * 跳过当前行之后 {@code skipLines} 行，再统计剩余 token 总数。
     */
    public int remainingTokenCount(int skipLines) {
        return Math.toIntExact(remainingFrom(cursor + Math.max(0, skipLines)));
    }

    /**
     * 从当前行之后第 {@code skipLines} 行开始，按 {@link #readTokens(int, String)} 的整行语义
     * 依次模拟读取各数据块，不移动游标。
     *
     * @return 模拟结果；凑不够 token 时 {@link BlockLayout#fits()} 为 {@code false}
     */
    public BlockLayout layoutBlocks(int skipLines, long... blockSizes) {
        int index = cursor + Math.max(0, skipLines);
        long discarded = 0;
        for (long size : blockSizes) {
            long taken = 0;
            while (taken < size && index < lines.size()) {
                int available = tokenize(lines.get(index++).text()).length;
                long take = Math.min(available, size - taken);
                taken += take;
                discarded += available - take;
            }
            if (taken < size) {
                return new BlockLayout(false, discarded, 0);
            }
        }
        return new BlockLayout(true, discarded, remainingFrom(index));
    }

    private long remainingFrom(int index) {
        long total = 0;
        for (int i = index; i < lines.size(); i++) {
            total += tokenize(lines.get(i).text()).length;
        }
        return total;
    }

    static String[] tokenize(String line) {
        String trimmed = line.trim();
        if (trimmed.isEmpty()) {
            return new String[0];
        }
        return SEPARATORS.split(trimmed);
    }

    private void warn(String message) {
        if (warnings != null) {
            warnings.add(message);
        }
    }

    private static List<Line> splitLines(String text) {
        String normalized = text.replace("\r\n", "\n").replace('\r', '\n');
        if (!normalized.isEmpty() && normalized.charAt(0) == '\uFEFF') {
            normalized = normalized.substring(1);
        }
        String[] raw = normalized.split("\n", -1);
        List<Line> result = new ArrayList<>(raw.length);
        for (int i = 0; i < raw.length; i++) {
            String trimmed = raw[i].trim();
            if (!trimmed.isEmpty()) {
                result.add(new Line(i + 1, trimmed));
            }
        }
        return result;
    }

    private record Line(int number, String text) {
    }

    /**
     * @param fits      所有数据块是否都能凑够
     * @param discarded 各数据块末行被丢弃的 token 数之和
     * @param trailing  最后一个数据块之后剩余的 token 数
     */
    public record BlockLayout(boolean fits, long discarded, long trailing) {

        /**
         * 每个数据块都恰好在行尾结束。
         */
        public boolean lineAligned() {
            return fits && discarded == 0;
        }

        /**
         * 恰好读到文件末尾，且没有丢弃任何 token。
         */
        public boolean exact() {
            return lineAligned() && trailing == 0;
        }
    }
}
