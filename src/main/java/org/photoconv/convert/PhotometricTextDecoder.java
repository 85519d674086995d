package org.photoconv.convert;

import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.Charset;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Locale;

/**
 * IES 文件字节流解码。
 * <p>
 * 厂商导出的 IES 文件多为 ASCII，带 °、µ 等字符时常见 UTF-8 与 Windows-1252 两种编码：
 * 严格 UTF-8 校验通过则按 UTF-8 解码，否则按 Windows-1252 解码并追加一条告警。
 */
public final class PhotometricTextDecoder {

    static final Charset FALLBACK_CHARSET = Charset.forName("windows-1252");

    private PhotometricTextDecoder() {
    }

    public static DecodedText decode(byte[] bytes, List<String> warnings) {
        if (bytes == null || bytes.length == 0) {
            return new DecodedText("", "utf-8");
        }
        try {
            String text = StandardCharsets.UTF_8.newDecoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT)
                    .decode(ByteBuffer.wrap(bytes))
                    .toString();
            return new DecodedText(text, "utf-8");
        } catch (CharacterCodingException e) {
            String text = new String(bytes, FALLBACK_CHARSET);
            if (warnings != null) {
                warnings.add("文件不是有效 UTF-8，已使用 " + FALLBACK_CHARSET.name() + " 解码");
            }
            return new DecodedText(text, FALLBACK_CHARSET.name().toLowerCase(Locale.ROOT));
        }
    }

    /**
     * @param text        解码后的文本
     * @param decodedWith 实际使用的字符集（小写）
     */
    public record DecodedText(String text, String decodedWith) {

        public boolean isFallback() {
            return !"utf-8".equals(decodedWith);
        }
    }
}
