package org.photoconv.mcp;

import org.photoconv.convert.HashingUtils;
import org.photoconv.convert.PendingFileWriteStore;
import org.photoconv.convert.PhotometricServerProperties;
import org.photoconv.convert.PhotometricTextDecoder;
import org.photoconv.convert.SecurePathResolver;
import org.photoconv.convert.dto.AllowedRootsResult;
import org.photoconv.convert.dto.IesFileInfoResult;
import org.photoconv.convert.dto.IesTiltInfo;
import org.photoconv.convert.dto.Tm33ConvertResult;
import org.photoconv.convert.dto.Tm33WriteConfirmResult;
import org.photoconv.convert.dto.Tm33WritePrepareResult;
import org.photoconv.convert.ies.IesReader;
import org.photoconv.convert.ies.model.CandelaMatrix;
import org.photoconv.convert.ies.model.CommonHeader;
import org.photoconv.convert.ies.model.IesParseResult;
import org.photoconv.convert.ies.model.IesTilt;
import org.photoconv.convert.ies.model.PhotometricHeaderFields;
import org.photoconv.convert.tm33.IesToTm33Mapper;
import org.photoconv.convert.tm33.Tm33Document;
import org.photoconv.convert.tm33.Tm33XmlWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.tool.annotation.Tool;
import org.springframework.ai.tool.annotation.ToolParam;
import org.springframework.stereotype.Component;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Instant;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * 光度文件 MCP 工具集合。
 * <p>
 * 提供能力：
 * <ul>
 *   <li>列出根目录白名单（{@code pm_list_roots}）。</li>
 *   <li>解析 IES 文件/文本，返回头信息、角度、峰值与光束角（{@code ies_read_info}、{@code ies_parse_text}）。</li>
 *   <li>IES 转 TM-33 XML 并内联返回（{@code ies_convert_to_tm33}、{@code ies_convert_text_to_tm33}）。</li>
 *   <li>把转换结果写入文件（{@code ies_prepare_write_tm33} -> {@code pm_confirm_write} 两段式确认）。</li>
 * </ul>
 * <p>
 * 解析错误以 {@link IllegalArgumentException}（{@code IesParseException} 及其子类）抛出，消息中带行号；
 * 环境问题（读写失败、禁止写入）以 {@link IllegalStateException} 抛出。
 */
@Component
public class PhotometricMcpTools {

    private static final Logger log = LoggerFactory.getLogger(PhotometricMcpTools.class);

    private static final int MAX_WARNINGS = 50;

    private final PhotometricServerProperties properties;
    private final SecurePathResolver pathResolver;
    private final PendingFileWriteStore pendingWriteStore;
    private final IesToTm33Mapper mapper;

    public PhotometricMcpTools(
            PhotometricServerProperties properties,
            SecurePathResolver pathResolver,
            PendingFileWriteStore pendingWriteStore,
            IesToTm33Mapper mapper
    ) {
        this.properties = properties;
        this.pathResolver = pathResolver;
        this.pendingWriteStore = pendingWriteStore;
        this.mapper = mapper;
    }

    @Tool(
            name = "pm_list_roots",
            description = "列出允许访问的根目录（rootId + path）。读取 IES 与写入 TM-33 都只能在这些目录内进行。"
    )
    public AllowedRootsResult listRoots() {
        return new AllowedRootsResult(pathResolver.listRoots());
    }

    @Tool(
            name = "ies_read_info",
            description = "解析 IES LM-63 光度文件（.ies）：返回关键字段、TILT、数值头、角度表、峰值光强与 50% 光束角；可选返回完整光强矩阵。"
    )
    public IesFileInfoResult readIesInfo(
            @ToolParam(required = false, description = "rootId（可从 pm_list_roots 获取；为空默认 root0）") String rootId,
            @ToolParam(description = "IES 文件路径（.ies，相对 rootId 或绝对路径）") String path,
            @ToolParam(required = false, description = "是否返回完整光强矩阵（默认 app.photometric.include-candela-by-default）") Boolean includeCandela
    ) {
        LoadedIes loaded = loadIesFile(rootId, path);
        IesParseResult result = IesReader.parse(loaded.text());
        log.info("解析 IES：{}/{}，{}x{}，峰值 {} cd", loaded.rootId(), loaded.path(),
                result.photometry().horizontalAngleCount(), result.photometry().verticalAngleCount(),
                result.candela().peakCandela());
        return toInfo(loaded.rootId(), loaded.path(), loaded.decodedWith(), result, loaded.warnings(), includeCandela);
    }

    @Tool(
            name = "ies_parse_text",
            description = "解析内联的 IES LM-63 文本，返回内容同 ies_read_info。"
    )
    public IesFileInfoResult parseIesText(
            @ToolParam(description = "完整的 IES 文件文本") String content,
            @ToolParam(required = false, description = "是否返回完整光强矩阵（默认 app.photometric.include-candela-by-default）") Boolean includeCandela
    ) {
        if (content == null) {
            throw new IllegalArgumentException("参数错误：content 不能为空");
        }
        IesParseResult result = IesReader.parse(content);
        return toInfo(null, null, null, result, new ArrayList<>(), includeCandela);
    }

    @Tool(
            name = "ies_convert_to_tm33",
            description = "把 IES 文件（.ies）转换为 TM-33-18 XML 并内联返回（附 sha256）；不会写入任何文件。"
    )
    public Tm33ConvertResult convertToTm33(
            @ToolParam(required = false, description = "rootId（可从 pm_list_roots 获取；为空默认 root0）") String rootId,
            @ToolParam(description = "IES 文件路径（.ies，相对 rootId 或绝对路径）") String path,
            @ToolParam(required = false, description = "可选：测试日期（yyyy-MM-dd），写入 TestInformation/TestDate") String testDate
    ) {
        LocalDate resolvedTestDate = parseTestDate(testDate);
        LoadedIes loaded = loadIesFile(rootId, path);
        Converted converted = convert(loaded.text(), fileName(loaded.path()), resolvedTestDate, loaded.warnings());
        log.info("转换 TM-33：{}/{}，{} 字节", loaded.rootId(), loaded.path(), converted.bytes().length);
        return toConvertResult(loaded.rootId(), loaded.path(), loaded.decodedWith(), converted);
    }

    @Tool(
            name = "ies_convert_text_to_tm33",
            description = "把内联的 IES 文本转换为 TM-33-18 XML 并内联返回（附 sha256）。"
    )
    public Tm33ConvertResult convertTextToTm33(
            @ToolParam(description = "完整的 IES 文件文本") String content,
            @ToolParam(required = false, description = "可选：源文件名，写入 FileInformation/SourceFile") String sourceFileName,
            @ToolParam(required = false, description = "可选：测试日期（yyyy-MM-dd），写入 TestInformation/TestDate") String testDate
    ) {
        if (content == null) {
            throw new IllegalArgumentException("参数错误：content 不能为空");
        }
        LocalDate resolvedTestDate = parseTestDate(testDate);
        Converted converted = convert(content, sourceFileName, resolvedTestDate, new ArrayList<>());
        log.info("转换 TM-33（内联文本）：{} 字节", converted.bytes().length);
        return toConvertResult(null, null, null, converted);
    }

    /**
     * 准备写入（第一阶段）：只做转换、校验与暂存，不落盘。
     * <p>
     * 目标路径为空时写到源文件旁边，扩展名换成 {@code .xml}。目标文件已存在且不超过
     * {@code app.photometric.hash-max-bytes} 时记录其 sha256，确认阶段据此判断是否被外部修改。
     */
    @Tool(
            name = "ies_prepare_write_tm33",
            description = "把 IES 文件转换为 TM-33 XML 并准备写入（不直接写入）：返回 token + 风险提示；需再调用 pm_confirm_write 才会真正写入。"
    )
    public Tm33WritePrepareResult prepareWriteTm33(
            @ToolParam(required = false, description = "源文件 rootId（为空默认 root0）") String rootId,
            @ToolParam(description = "IES 文件路径（.ies，相对 rootId 或绝对路径）") String path,
            @ToolParam(required = false, description = "目标 rootId（为空则与源文件相同）") String targetRootId,
            @ToolParam(required = false, description = "目标 XML 路径（为空则为源文件同目录同名 .xml）") String targetPath,
            @ToolParam(required = false, description = "可选：测试日期（yyyy-MM-dd）") String testDate,
            @ToolParam(required = false, description = "是否覆盖已存在文件（默认 false）") Boolean overwrite,
            @ToolParam(required = false, description = "是否自动创建父目录（默认 false）") Boolean createParents
    ) {
        if (!properties.isAllowWrite()) {
            throw new IllegalStateException("已禁止写入：配置 app.photometric.allow-write=false");
        }
        LocalDate resolvedTestDate = parseTestDate(testDate);
        LoadedIes loaded = loadIesFile(rootId, path);

        String resolvedTargetRoot = isBlank(targetRootId) ? loaded.rootId() : targetRootId;
        String resolvedTargetPath = isBlank(targetPath) ? defaultTargetPath(loaded.path()) : targetPath;
        SecurePathResolver.ResolvedPath resolved = pathResolver.resolveForWrite(resolvedTargetRoot, resolvedTargetPath);
        Path target = resolved.absolutePath();

        boolean overwriteResolved = Boolean.TRUE.equals(overwrite);
        boolean createParentsResolved = Boolean.TRUE.equals(createParents);

        Path parent = target.getParent();
        if (parent == null) {
            throw new IllegalArgumentException("目标路径无效：" + resolved.displayPath());
        }
        boolean parentExists = Files.exists(parent, LinkOption.NOFOLLOW_LINKS);
        if (parentExists && !Files.isDirectory(parent, LinkOption.NOFOLLOW_LINKS)) {
            throw new IllegalArgumentException("父路径不是目录：" + resolved.displayPath());
        }
        if (!parentExists && !createParentsResolved) {
            throw new IllegalArgumentException("父目录不存在；请设置 createParents=true 自动创建：" + resolved.displayPath());
        }

        List<String> warnings = loaded.warnings();
        Converted converted = convert(loaded.text(), fileName(loaded.path()), resolvedTestDate, warnings);
        if (!resolved.displayPath().toLowerCase(Locale.ROOT).endsWith(".xml")) {
            addWarningLimited(warnings, "目标文件扩展名不是 .xml：" + resolved.displayPath());
        }

        boolean exists = Files.exists(target, LinkOption.NOFOLLOW_LINKS);
        String expectedSha256 = null;
        if (exists) {
            if (Files.isDirectory(target, LinkOption.NOFOLLOW_LINKS)) {
                throw new IllegalArgumentException("目标路径是目录，无法写入文件：" + resolved.displayPath());
            }
            if (!overwriteResolved) {
                throw new IllegalArgumentException("目标文件已存在；请设置 overwrite=true 以覆盖：" + resolved.displayPath());
            }
            addWarningLimited(warnings, "目标文件已存在，确认后将覆盖。");
            expectedSha256 = existingSha256(target, warnings);
        } else {
            addWarningLimited(warnings, "目标文件不存在，确认后将创建。");
        }

        PendingFileWriteStore.PendingFileWrite pending = pendingWriteStore.create(
                resolved.rootId(),
                resolved.displayPath(),
                target,
                loaded.path(),
                converted.bytes(),
                overwriteResolved,
                createParentsResolved,
                exists,
                expectedSha256,
                converted.sha256()
        );
        log.info("准备写入 TM-33：{}/{} -> {}/{}，token={}", loaded.rootId(), loaded.path(),
                pending.rootId(), pending.displayPath(), pending.token());

        return new Tm33WritePrepareResult(
                pending.token(),
                pending.rootId(),
                pending.displayPath(),
                loaded.path(),
                exists,
                overwriteResolved,
                converted.bytes().length,
                expectedSha256,
                converted.sha256(),
                pending.expiresAt(),
                warnings.isEmpty() ? null : warnings
        );
    }

    @Tool(
            name = "pm_confirm_write",
            description = "确认或取消 ies_prepare_write_tm33 准备的写入：confirm=true 才会写入；confirm=false 则取消并丢弃 token。"
    )
    public Tm33WriteConfirmResult confirmWrite(
            @ToolParam(description = "ies_prepare_write_tm33 返回的 token") String token,
            @ToolParam(required = false, description = "是否确认写入（true 写入 / false 取消；默认 false）") Boolean confirm
    ) {
        PendingFileWriteStore.PendingFileWrite peek = pendingWriteStore.get(token);
        if (peek == null) {
            throw new IllegalArgumentException("token 无效或已过期");
        }
        if (!Boolean.TRUE.equals(confirm)) {
            pendingWriteStore.remove(token);
            log.info("取消写入：{}/{}", peek.rootId(), peek.displayPath());
            return new Tm33WriteConfirmResult(
                    peek.token(),
                    peek.rootId(),
                    peek.displayPath(),
                    peek.sourcePath(),
                    false,
                    false,
                    0,
                    null,
                    null,
                    List.of("已取消写入（confirm=false）")
            );
        }

        // 取出即删除，避免重复确认
        PendingFileWriteStore.PendingFileWrite pending = pendingWriteStore.remove(token);
        if (pending == null) {
            throw new IllegalArgumentException("token 无效或已过期");
        }

        // 重新解析一次，确保仍在白名单内
        SecurePathResolver.ResolvedPath resolvedNow = pathResolver.resolveForWrite(pending.rootId(), pending.targetFile().toString());
        Path target = resolvedNow.absolutePath();
        List<String> warnings = new ArrayList<>();

        if (!pathResolver.isAllowSymlink() && Files.isSymbolicLink(target)) {
            throw new IllegalArgumentException("不允许写入到符号链接目标路径：" + pending.displayPath());
        }
        if (pending.expectExists()) {
            if (!Files.exists(target, LinkOption.NOFOLLOW_LINKS)) {
                throw new IllegalStateException("确认失败：目标文件在 prepare 后发生变化（原本应存在）");
            }
            if (pending.expectedSha256() != null) {
                String currentSha;
                try {
                    currentSha = HashingUtils.sha256Hex(target);
                } catch (IOException e) {
                    throw new IllegalStateException("确认失败：无法校验目标文件 sha256：" + pending.displayPath(), e);
                }
                if (!pending.expectedSha256().equalsIgnoreCase(currentSha)) {
                    throw new IllegalStateException("确认失败：目标文件内容已被修改（sha256 不一致）");
                }
            }
        } else if (Files.exists(target, LinkOption.NOFOLLOW_LINKS)) {
            throw new IllegalStateException("确认失败：目标文件在 prepare 后发生变化（现在已存在）");
        }

        Path parent = target.getParent();
        if (pending.createParents()) {
            try {
                Files.createDirectories(parent);
            } catch (IOException e) {
                throw new IllegalStateException("创建父目录失败：" + parent, e);
            }
        } else if (!Files.isDirectory(parent, LinkOption.NOFOLLOW_LINKS)) {
            throw new IllegalStateException("父目录不存在：" + pending.displayPath());
        }

        try {
            writeAtomically(target, pending.bytes(), pending.overwrite());
        } catch (IOException e) {
            throw new IllegalStateException("写入文件失败：" + pending.displayPath(), e);
        }
        log.info("已写入 TM-33：{}/{}（{} 字节，来源 {}）", pending.rootId(), pending.displayPath(),
                pending.bytes().length, pending.sourcePath());

        return new Tm33WriteConfirmResult(
                pending.token(),
                pending.rootId(),
                pending.displayPath(),
                pending.sourcePath(),
                true,
                true,
                pending.bytes().length,
                pending.newSha256(),
                Instant.now(),
                warnings.isEmpty() ? null : warnings
        );
    }

    // ---------------------------------------------------------------------
    // 读取与转换
    // ---------------------------------------------------------------------

    private LoadedIes loadIesFile(String rootId, String path) {
        if (isBlank(path)) {
            throw new IllegalArgumentException("参数错误：path 不能为空");
        }
        SecurePathResolver.ResolvedPath resolved = pathResolver.resolve(rootId, path, true);
        Path file = resolved.absolutePath();
        if (!Files.isRegularFile(file, LinkOption.NOFOLLOW_LINKS)) {
            throw new IllegalArgumentException("不是普通文件：" + resolved.displayPath());
        }
        if (!resolved.displayPath().toLowerCase(Locale.ROOT).endsWith(".ies")) {
            throw new IllegalArgumentException("不是 IES 文件（仅支持 .ies）：" + resolved.displayPath());
        }

        // 光强表被截断就无法得到正确结果，超限直接拒绝而不是截断解析
        long maxBytes = properties.getReadMaxBytes().toBytes();
        byte[] bytes = readUpTo(file, maxBytes + 1);
        if (bytes.length > maxBytes) {
            throw new IllegalArgumentException("IES 文件过大（上限 " + maxBytes + " 字节，见 app.photometric.read-max-bytes）：" + resolved.displayPath());
        }

        List<String> warnings = new ArrayList<>();
        PhotometricTextDecoder.DecodedText decoded = PhotometricTextDecoder.decode(bytes, warnings);
        if (decoded.isFallback()) {
            log.warn("{}/{} 不是有效 UTF-8，已按 {} 解码", resolved.rootId(), resolved.displayPath(), decoded.decodedWith());
        }
        return new LoadedIes(resolved.rootId(), resolved.displayPath(), decoded.text(), decoded.decodedWith(), warnings);
    }

    private Converted convert(String iesText, String sourceFileName, LocalDate testDate, List<String> warnings) {
        IesParseResult result = IesReader.parse(iesText);
        for (String warning : result.warnings()) {
            addWarningLimited(warnings, warning);
        }
        Tm33Document doc = mapper.map(result, sourceFileName, testDate);
        String xml = Tm33XmlWriter.writeToString(doc);
        byte[] bytes = xml.getBytes(StandardCharsets.UTF_8);
        return new Converted(result, doc, xml, bytes, HashingUtils.sha256Hex(bytes), warnings);
    }

    private IesFileInfoResult toInfo(
            String rootId,
            String path,
            String decodedWith,
            IesParseResult result,
            List<String> warnings,
            Boolean includeCandela
    ) {
        for (String warning : result.warnings()) {
            addWarningLimited(warnings, warning);
        }
        CommonHeader common = result.commonHeader();
        PhotometricHeaderFields photometry = result.photometry();
        CandelaMatrix candela = result.candela();
        IesTilt tilt = result.fileHeader().tilt();
        boolean withCandela = includeCandela == null ? properties.isIncludeCandelaByDefault() : includeCandela;

        return new IesFileInfoResult(
                rootId,
                path,
                decodedWith,
                result.fileHeader().version(),
                common.manufacturer(),
                common.luminaire(),
                common.catalogNumber(),
                common.lamp(),
                common.testLaboratory(),
                common.testReport(),
                common.notes(),
                result.fileHeader().keywords(),
                new IesTiltInfo(
                        tilt.type().name(),
                        tilt.fileName(),
                        tilt.lampToLuminaireGeometry(),
                        tilt.isInclude() ? tilt.angles() : null,
                        tilt.isInclude() ? tilt.multipliers() : null
                ),
                photometry.lampCount(),
                photometry.lumensPerLamp(),
                common.totalLumens(),
                photometry.candelaMultiplier(),
                photometry.ballastFactor(),
                common.inputWatts(),
                result.angles().type(),
                photometry.unitsType().name(),
                photometry.width(),
                photometry.length(),
                photometry.height(),
                photometry.fieldCount(),
                photometry.verticalAngleCount(),
                photometry.horizontalAngleCount(),
                result.angles().vertical(),
                result.angles().horizontal(),
                candela.peakCandela(),
                candela.peakVerticalAngle(),
                candela.peakHorizontalAngle(),
                candela.beamAngle(),
                withCandela ? candela.toArray() : null,
                warnings.isEmpty() ? null : warnings
        );
    }

    private static Tm33ConvertResult toConvertResult(String rootId, String path, String decodedWith, Converted converted) {
        List<String> warnings = converted.warnings();
        return new Tm33ConvertResult(
                rootId,
                path,
                decodedWith,
                converted.document().photometry().symmetry().label(),
                converted.result().candela().peakCandela(),
                converted.result().candela().beamAngle(),
                converted.bytes().length,
                converted.sha256(),
                converted.xml(),
                warnings.isEmpty() ? null : warnings
        );
    }

    private String existingSha256(Path target, List<String> warnings) {
        try {
            if (Files.size(target) > properties.getHashMaxBytes().toBytes()) {
                addWarningLimited(warnings, "现有文件过大，跳过 sha256 校验。");
                return null;
            }
            return HashingUtils.sha256Hex(target);
        } catch (IOException e) {
            addWarningLimited(warnings, "计算现有文件 sha256 失败，跳过校验：" + e.getMessage());
            return null;
        }
    }

    static LocalDate parseTestDate(String testDate) {
        if (isBlank(testDate)) {
            return null;
        }
        try {
            return LocalDate.parse(testDate.trim());
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException("参数错误：testDate 必须是 yyyy-MM-dd 格式：" + testDate, e);
        }
    }

    static String defaultTargetPath(String iesDisplayPath) {
        int dot = iesDisplayPath.lastIndexOf('.');
        int slash = iesDisplayPath.lastIndexOf('/');
        String base = dot > slash ? iesDisplayPath.substring(0, dot) : iesDisplayPath;
        return base + ".xml";
    }

    private static String fileName(String displayPath) {
        if (displayPath == null) {
            return null;
        }
        int slash = displayPath.lastIndexOf('/');
        return slash < 0 ? displayPath : displayPath.substring(slash + 1);
    }

    private static byte[] readUpTo(Path file, long maxBytes) {
        try (InputStream in = Files.newInputStream(file)) {
            ByteArrayOutputStream out = new ByteArrayOutputStream((int) Math.min(maxBytes, 1024 * 1024));
            byte[] buffer = new byte[8192];
            long remaining = maxBytes;
            int read;
            while (remaining > 0 && (read = in.read(buffer, 0, (int) Math.min(buffer.length, remaining))) >= 0) {
                out.write(buffer, 0, read);
                remaining -= read;
            }
            return out.toByteArray();
        } catch (IOException e) {
            throw new IllegalStateException("读取文件失败：" + file, e);
        }
    }

    /**
     * 先写同目录临时文件，再 move 替换；不支持 ATOMIC_MOVE 时降级为普通 move。
     */
    private static void writeAtomically(Path target, byte[] bytes, boolean overwrite) throws IOException {
        Path tmp = Files.createTempFile(target.getParent(), "tm33-write-", ".tmp");
        try {
            Files.write(tmp, bytes);
            try {
                if (overwrite) {
                    Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
                } else {
                    Files.move(tmp, target, StandardCopyOption.ATOMIC_MOVE);
                }
            } catch (AtomicMoveNotSupportedException e) {
                if (overwrite) {
                    Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
                } else {
                    Files.move(tmp, target);
                }
            }
        } finally {
            try {
                Files.deleteIfExists(tmp);
            } catch (IOException e) {
                log.warn("删除临时文件失败：{}", tmp, e);
            }
        }
    }

    private static void addWarningLimited(List<String> warnings, String message) {
        if (warnings.size() < MAX_WARNINGS) {
            warnings.add(message);
        } else if (warnings.size() == MAX_WARNINGS) {
            warnings.add("告警过多，已省略后续告警…");
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    private record LoadedIes(String rootId, String path, String text, String decodedWith, List<String> warnings) {
    }

    private record Converted(
            IesParseResult result,
            Tm33Document document,
            String xml,
            byte[] bytes,
            String sha256,
            List<String> warnings
    ) {
    }
}
