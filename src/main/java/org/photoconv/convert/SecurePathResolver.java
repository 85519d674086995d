package org.photoconv.convert;

import org.photoconv.convert.dto.AllowedRoot;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * 把工具参数里的路径解析成根目录白名单内的绝对路径。
 * <p>
 * 规则：
 * <ul>
 *   <li>相对路径从 {@code rootId} 指定的根目录解析；{@code rootId} 为空时使用 root0。</li>
 *   <li>绝对路径匹配层级最深的根目录；路径穿越（{@code ../}）越界直接拒绝。</li>
 *   <li>逐级校验 realPath，默认拒绝符号链接，防止经由链接/junction 逃逸出根目录。</li>
 *   <li>写入目标可以尚不存在，此时只校验已存在的父目录链路。</li>
 * </ul>
 */
public class SecurePathResolver {

    private final boolean allowSymlink;
    private final List<Root> roots;

    public SecurePathResolver(List<String> configuredRoots, boolean allowSymlink) {
        this.allowSymlink = allowSymlink;
        this.roots = normalizeRoots(configuredRoots);
    }

    public List<AllowedRoot> listRoots() {
        List<AllowedRoot> result = new ArrayList<>(roots.size());
        for (Root root : roots) {
            result.add(new AllowedRoot(root.id(), root.rootPath().toString()));
        }
        return result;
    }

    public ResolvedPath resolve(String rootId, String inputPath, boolean requireExists) {
        if (roots.isEmpty()) {
            throw new IllegalStateException("未配置允许访问的根目录（app.photometric.roots）");
        }

        Path rawPath = toPath(inputPath);
        Root selectedRoot;
        Path absolute;
        if (rawPath != null && rawPath.isAbsolute()) {
            absolute = rawPath.normalize();
            selectedRoot = isBlank(rootId) ? findBestRootForAbsolute(absolute) : findRootById(rootId);
        } else {
            selectedRoot = isBlank(rootId) ? roots.get(0) : findRootById(rootId);
            absolute = rawPath == null ? selectedRoot.rootPath() : selectedRoot.rootPath().resolve(rawPath).normalize();
        }

        if (!absolute.startsWith(selectedRoot.rootPath())) {
            throw new IllegalArgumentException("路径不在允许访问的根目录范围内：" + inputPath);
        }

        validateWithinRoot(selectedRoot, absolute, requireExists);
        return new ResolvedPath(selectedRoot.id(), selectedRoot.rootPath(), absolute, displayPath(selectedRoot, absolute));
    }

    public ResolvedPath resolveForWrite(String rootId, String inputPath) {
        return resolve(rootId, inputPath, false);
    }

    public boolean isAllowSymlink() {
        return allowSymlink;
    }

    private void validateWithinRoot(Root root, Path absolute, boolean requireExists) {
        Path rootReal;
        try {
            rootReal = root.rootPath().toRealPath();
        } catch (IOException e) {
            throw new IllegalStateException("根目录不存在或无法解析：" + root.rootPath(), e);
        }

        if (requireExists && !Files.exists(absolute, LinkOption.NOFOLLOW_LINKS)) {
            throw new IllegalArgumentException("路径不存在：" + displayPath(root, absolute));
        }

        // 中间任一级是链接都可能逃逸，逐级检查
        Path current = root.rootPath();
        for (Path segment : root.rootPath().relativize(absolute)) {
            current = current.resolve(segment);
            if (!Files.exists(current, LinkOption.NOFOLLOW_LINKS)) {
                break;
            }
            if (!allowSymlink && Files.isSymbolicLink(current)) {
                throw new IllegalArgumentException("不允许访问符号链接路径：" + displayPath(root, current));
            }
            ensureRealPathWithin(current, rootReal);
        }

        if (requireExists) {
            ensureRealPathWithin(absolute, rootReal);
        }
    }

    private static void ensureRealPathWithin(Path path, Path rootReal) {
        Path real;
        try {
            real = path.toRealPath();
        } catch (IOException e) {
            throw new IllegalArgumentException("路径无法解析：" + path, e);
        }
        if (!real.startsWith(rootReal)) {
            throw new IllegalArgumentException("路径通过链接/junction 逃逸出根目录：" + path);
        }
    }

    private Root findRootById(String rootId) {
        for (Root root : roots) {
            if (root.id().equals(rootId)) {
                return root;
            }
        }
        throw new IllegalArgumentException("未知的 rootId：" + rootId);
    }

    private Root findBestRootForAbsolute(Path absolute) {
        return roots.stream()
                .filter(r -> absolute.startsWith(r.rootPath()))
                .max(Comparator.comparingInt(r -> r.rootPath().getNameCount()))
                .orElseThrow(() -> new IllegalArgumentException("路径不在允许访问的根目录范围内：" + absolute));
    }

    private static Path toPath(String inputPath) {
        if (isBlank(inputPath)) {
            return null;
        }
        try {
            return Path.of(inputPath.trim());
        } catch (InvalidPathException e) {
            throw new IllegalArgumentException("路径格式无效：" + inputPath, e);
        }
    }

    private static List<Root> normalizeRoots(List<String> configured) {
        if (configured == null || configured.isEmpty()) {
            return List.of();
        }
        List<Root> result = new ArrayList<>(configured.size());
        for (int i = 0; i < configured.size(); i++) {
            String value = Objects.requireNonNull(configured.get(i), "配置项 app.photometric.roots[" + i + "] 不能为空");
            result.add(new Root("root" + i, Path.of(value).toAbsolutePath().normalize()));
        }
        return List.copyOf(result);
    }

    /**
     * 相对根目录的展示路径，统一使用 {@code /} 分隔。
     */
    private static String displayPath(Root root, Path absolute) {
        return root.rootPath().relativize(absolute).toString().replace('\\', '/');
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    private record Root(String id, Path rootPath) {
    }

    /**
     * @param rootId       根目录标识
     * @param rootPath     根目录绝对路径
     * @param absolutePath 解析后的绝对路径
     * @param displayPath  相对根目录的路径（{@code /} 分隔；根目录本身为空串）
     */
    public record ResolvedPath(String rootId, Path rootPath, Path absolutePath, String displayPath) {
    }
}
