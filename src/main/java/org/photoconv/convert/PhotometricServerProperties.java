package org.photoconv.convert;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.util.unit.DataSize;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.List;

/**
 * 光度转换 MCP Server 的业务配置（{@code app.photometric.*}）。
 * <p>
 * 重点：
 * <ul>
 *   <li>通过 {@link #roots} 指定允许访问的根目录白名单，IES 读取与 TM-33 写入都只在这些目录内进行。</li>
 *   <li>通过 {@link #readMaxBytes} 等上限控制单次读取/暂存的内存占用。</li>
 *   <li>{@link #creator}/{@link #creatorVersion} 写入 TM-33 的 {@code FileInformation} 块。</li>
 * </ul>
 */
@Validated
@ConfigurationProperties(prefix = "app.photometric")
public class PhotometricServerProperties {

    /**
     * 允许访问的根目录白名单。
     * <p>
     * 每个 root 会自动分配一个 {@code rootId}（root0、root1...）；工具调用时可传入 rootId + 相对路径，
     * 或直接传入绝对路径（会自动匹配到最合适的 root）。
     */
    @NotNull
    private List<String> roots = List.of(".");

    /**
     * 读取 IES 文件的最大字节数；超过则拒绝解析（IES 光强表被截断后无法得到正确结果）。
     */
    @NotNull
    private DataSize readMaxBytes = DataSize.ofMegabytes(8);

    /**
     * 是否允许写入 TM-33 文件。即使为 true，也必须走 prepare -> confirm 两段式确认。
     */
    private boolean allowWrite = true;

    /**
     * 是否允许访问符号链接（默认 false，防止路径逃逸）。
     */
    private boolean allowSymlink = false;

    /**
     * prepare 阶段对“已存在目标文件”计算 sha256 的最大文件大小。
     */
    @NotNull
    private DataSize hashMaxBytes = DataSize.ofMegabytes(32);

    /**
     * 单次待写入内容（pending token）的最大字节数。
     */
    @NotNull
    private DataSize pendingWriteMaxBytes = DataSize.ofMegabytes(16);

    /**
     * 待写入 token 的有效期。
     */
    @NotNull
    private Duration pendingWriteTtl = Duration.ofMinutes(10);

    /**
     * TM-33 {@code FileInformation/Creator}。
     */
    @NotBlank
    private String creator = "Photometric Tools";

    /**
     * TM-33 {@code FileInformation/CreatorVersion}。
     */
    @NotBlank
    private String creatorVersion = "1.0";

    /**
     * {@code ies_read_info}/{@code ies_parse_text} 是否默认返回完整光强矩阵。
     * <p>
     * 光强矩阵可能有上万个值，默认只返回摘要。
     */
    private boolean includeCandelaByDefault = false;

    public List<String> getRoots() {
        return roots;
    }

    public void setRoots(List<String> roots) {
        this.roots = roots;
    }

    public DataSize getReadMaxBytes() {
        return readMaxBytes;
    }

    public void setReadMaxBytes(DataSize readMaxBytes) {
        this.readMaxBytes = readMaxBytes;
    }

    public boolean isAllowWrite() {
        return allowWrite;
    }

    public void setAllowWrite(boolean allowWrite) {
        this.allowWrite = allowWrite;
    }

    public boolean isAllowSymlink() {
        return allowSymlink;
    }

    public void setAllowSymlink(boolean allowSymlink) {
        this.allowSymlink = allowSymlink;
    }

    public DataSize getHashMaxBytes() {
        return hashMaxBytes;
    }

    public void setHashMaxBytes(DataSize hashMaxBytes) {
        this.hashMaxBytes = hashMaxBytes;
    }

    public DataSize getPendingWriteMaxBytes() {
        return pendingWriteMaxBytes;
    }

    public void setPendingWriteMaxBytes(DataSize pendingWriteMaxBytes) {
        this.pendingWriteMaxBytes = pendingWriteMaxBytes;
    }

    public Duration getPendingWriteTtl() {
        return pendingWriteTtl;
    }

    public void setPendingWriteTtl(Duration pendingWriteTtl) {
        this.pendingWriteTtl = pendingWriteTtl;
    }

    public String getCreator() {
        return creator;
    }

    public void setCreator(String creator) {
        this.creator = creator;
    }

    public String getCreatorVersion() {
        return creatorVersion;
    }

    public void setCreatorVersion(String creatorVersion) {
        this.creatorVersion = creatorVersion;
    }

    public boolean isIncludeCandelaByDefault() {
        return includeCandelaByDefault;
    }

    public void setIncludeCandelaByDefault(boolean includeCandelaByDefault) {
        this.includeCandelaByDefault = includeCandelaByDefault;
    }
}
