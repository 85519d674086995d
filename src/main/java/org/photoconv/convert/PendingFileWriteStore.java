package org.photoconv.convert;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 待确认的 TM-33 写入请求（内存版）。
 * <p>
 * {@code ies_prepare_write_tm33} 把转换好的 XML 暂存在这里并返回 token；
 * {@code pm_confirm_write} 凭 token 取出并落盘，或取消丢弃。
 * 每条记录有 TTL 和字节上限；仅适用于单进程。
 */
public class PendingFileWriteStore {

    private final Duration ttl;
    private final long maxBytesPerItem;
    private final Clock clock;
    private final ConcurrentHashMap<String, PendingFileWrite> store = new ConcurrentHashMap<>();

    public PendingFileWriteStore(Duration ttl, long maxBytesPerItem) {
        this(ttl, maxBytesPerItem, Clock.systemUTC());
    }

    public PendingFileWriteStore(Duration ttl, long maxBytesPerItem, Clock clock) {
        this.ttl = ttl;
        this.maxBytesPerItem = maxBytesPerItem;
        this.clock = clock;
    }

    public PendingFileWrite create(
            String rootId,
            String displayPath,
            Path targetFile,
            String sourcePath,
            byte[] bytes,
            boolean overwrite,
            boolean createParents,
            boolean expectExists,
            String expectedSha256,
            String newSha256
    ) {
        cleanupExpired();
        if (bytes.length > maxBytesPerItem) {
            throw new IllegalArgumentException("待确认写入内容过大：" + bytes.length + " 字节（上限 " + maxBytesPerItem + "）");
        }
        Instant now = clock.instant();
        PendingFileWrite pending = new PendingFileWrite(
                UUID.randomUUID().toString(),
                rootId,
                displayPath,
                targetFile,
                sourcePath,
                bytes,
                overwrite,
                createParents,
                expectExists,
                expectedSha256,
                newSha256,
                now,
                now.plus(ttl)
        );
        store.put(pending.token(), pending);
        return pending;
    }

    /**
     * 查看但不移除；不存在或已过期返回 {@code null}。
     */
    public PendingFileWrite get(String token) {
        if (token == null || token.isBlank()) {
            return null;
        }
        PendingFileWrite pending = store.get(token);
        if (pending == null) {
            return null;
        }
        if (pending.isExpiredAt(clock.instant())) {
            store.remove(token);
            return null;
        }
        return pending;
    }

    public PendingFileWrite remove(String token) {
        if (token == null || token.isBlank()) {
            return null;
        }
        PendingFileWrite pending = store.remove(token);
        if (pending == null || pending.isExpiredAt(clock.instant())) {
            return null;
        }
        return pending;
    }

    int size() {
        return store.size();
    }

    private void cleanupExpired() {
        Instant now = clock.instant();
        store.values().removeIf(p -> p.isExpiredAt(now));
    }

    /**
     * @param sourcePath 生成该内容的 IES 文件（展示路径），用于日志与结果回显
     */
    public record PendingFileWrite(
            String token,
            String rootId,
            String displayPath,
            Path targetFile,
            String sourcePath,
            byte[] bytes,
            boolean overwrite,
            boolean createParents,
            boolean expectExists,
            String expectedSha256,
            String newSha256,
            Instant createdAt,
            Instant expiresAt
    ) {
        public boolean isExpiredAt(Instant now) {
            return now.isAfter(expiresAt);
        }
    }
}
