package org.photoconv.convert;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * sha256 指纹（十六进制小写）。
 * <p>
 * 转换结果附带 XML 的 sha256；写入确认时用旧文件的 sha256 判断目标是否在 prepare 之后被外部修改。
 * 文件哈希采用流式读取。
 */
public final class HashingUtils {

    private static final HexFormat HEX = HexFormat.of();
    private static final int BUFFER_SIZE = 8192;

    private HashingUtils() {
    }

    public static String sha256Hex(byte[] bytes) {
        return HEX.formatHex(newDigest().digest(bytes));
    }

    public static String sha256Hex(Path file) throws IOException {
        MessageDigest digest = newDigest();
        try (InputStream in = Files.newInputStream(file)) {
            byte[] buffer = new byte[BUFFER_SIZE];
            int read;
            while ((read = in.read(buffer)) >= 0) {
                digest.update(buffer, 0, read);
            }
        }
        return HEX.formatHex(digest.digest());
    }

    private static MessageDigest newDigest() {
        try {
            return MessageDigest.getInstance("SHA-256");
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("当前运行环境不支持 SHA-256 摘要算法", e);
        }
    }
}
