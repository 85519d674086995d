package org.photoconv.mcp;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.photoconv.convert.HashingUtils;
import org.photoconv.convert.PendingFileWriteStore;
import org.photoconv.convert.PhotometricServerProperties;
import org.photoconv.convert.SecurePathResolver;
import org.photoconv.convert.dto.IesFileInfoResult;
import org.photoconv.convert.dto.Tm33ConvertResult;
import org.photoconv.convert.dto.Tm33WriteConfirmResult;
import org.photoconv.convert.dto.Tm33WritePrepareResult;
import org.photoconv.convert.ies.IesParseException;
import org.photoconv.convert.tm33.IesToTm33Mapper;
import org.springframework.util.unit.DataSize;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PhotometricMcpToolsTest {

    private static final String IES = """
            IESNA:LM-63-2002
            [TEST]R-7
            [MANUFAC]Acme
            [LUMCAT]Spot 20
            TILT=NONE
            1 1000 1 3 1 1 2 0 0 0 1 0 20
            0 30 60
            0
            1000 500 0
            """;

    @TempDir
    Path tempDir;

    private PhotometricServerProperties properties;
    private PhotometricMcpTools tools;

    @BeforeEach
    void setUp() {
        properties = new PhotometricServerProperties();
        properties.setRoots(List.of(tempDir.toString()));
        tools = createTools();
    }

    private PhotometricMcpTools createTools() {
        SecurePathResolver resolver = new SecurePathResolver(properties.getRoots(), properties.isAllowSymlink());
        PendingFileWriteStore store = new PendingFileWriteStore(
                properties.getPendingWriteTtl(), properties.getPendingWriteMaxBytes().toBytes());
        Clock clock = Clock.fixed(Instant.parse("2026-05-06T07:08:09Z"), ZoneOffset.UTC);
        IesToTm33Mapper mapper = new IesToTm33Mapper(clock, properties.getCreator(), properties.getCreatorVersion());
        return new PhotometricMcpTools(properties, resolver, store, mapper);
    }

    @Test
    void listRoots_returnsConfiguredRoots() {
        assertThat(tools.listRoots().roots()).hasSize(1);
        assertThat(tools.listRoots().roots().get(0).id()).isEqualTo("root0");
    }

    @Test
    void readIesInfo_returnsHeaderAnglesAndMetrics() throws Exception {
        Files.writeString(tempDir.resolve("spot.ies"), IES);

        IesFileInfoResult info = tools.readIesInfo(null, "spot.ies", null);

        assertThat(info.rootId()).isEqualTo("root0");
        assertThat(info.path()).isEqualTo("spot.ies");
        assertThat(info.decodedWith()).isEqualTo("utf-8");
        assertThat(info.version()).isEqualTo("IESNA:LM-63-2002");
        assertThat(info.manufacturer()).isEqualTo("Acme");
        assertThat(info.tilt().type()).isEqualTo("NONE");
        assertThat(info.totalLumens()).isEqualTo(1000.0);
        assertThat(info.inputWatts()).isEqualTo(20.0);
        assertThat(info.photometricType()).isEqualTo("C");
        assertThat(info.unitsType()).isEqualTo("METERS");
        assertThat(info.verticalAngles()).containsExactly(0.0, 30.0, 60.0);
        assertThat(info.peakCandela()).isEqualTo(1000.0);
        assertThat(info.beamAngle()).isEqualTo(30.0);
        assertThat(info.candela()).isNull();
        assertThat(info.warnings()).isNull();
    }

    @Test
    void parseIesText_canIncludeCandela() {
        IesFileInfoResult info = tools.parseIesText(IES, true);

        assertThat(info.rootId()).isNull();
        assertThat(info.candela()).hasDimensions(1, 3);
        assertThat(info.candela()[0]).containsExactly(1000.0, 500.0, 0.0);
    }

    @Test
    void readIesInfo_rejectsNonIesFile() throws Exception {
        Files.writeString(tempDir.resolve("spot.txt"), IES);

        assertThatThrownBy(() -> tools.readIesInfo(null, "spot.txt", null))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("不是 IES 文件");
    }

    @Test
    void readIesInfo_rejectsOversizedFile() throws Exception {
        Files.writeString(tempDir.resolve("spot.ies"), IES);
        properties.setReadMaxBytes(DataSize.ofBytes(10));

        assertThatThrownBy(() -> tools.readIesInfo(null, "spot.ies", null))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("IES 文件过大");
    }

    @Test
    void readIesInfo_propagatesParseErrors() throws Exception {
        Files.writeString(tempDir.resolve("bad.ies"), "IESNA:LM-63-2002\n[TEST]x\n");

        assertThatThrownBy(() -> tools.readIesInfo(null, "bad.ies", null))
                .isInstanceOf(IesParseException.class)
                .hasMessageContaining("TILT");
    }

    @Test
    void readIesInfo_fallsBackToWindows1252() throws Exception {
        byte[] bytes = IES.replace("[LUMCAT]Spot 20", "[LUMCAT]Spot 20°").getBytes(StandardCharsets.ISO_8859_1);
        Files.write(tempDir.resolve("legacy.ies"), bytes);

        IesFileInfoResult info = tools.readIesInfo(null, "legacy.ies", null);

        assertThat(info.decodedWith()).isEqualTo("windows-1252");
        assertThat(info.luminaire()).isEqualTo("Spot 20°");
        assertThat(info.warnings()).anySatisfy(w -> assertThat(w).contains("windows-1252"));
    }

    @Test
    void convertToTm33_returnsXmlWithHash() throws Exception {
        Files.writeString(tempDir.resolve("spot.ies"), IES);

        Tm33ConvertResult result = tools.convertToTm33("root0", "spot.ies", "2025-01-31");

        assertThat(result.symmetry()).isEqualTo("Axial");
        assertThat(result.xml())
                .contains("<TM33PhotometricData standard=\"TM-33-18\">")
                .contains("<SourceFile>spot.ies</SourceFile>")
                .contains("<TestDate>2025-01-31</TestDate>")
                .contains("<Created>2026-05-06T07:08:09Z</Created>");
        byte[] xmlBytes = result.xml().getBytes(StandardCharsets.UTF_8);
        assertThat(result.bytes()).isEqualTo(xmlBytes.length);
        assertThat(result.sha256()).isEqualTo(HashingUtils.sha256Hex(xmlBytes));
    }

    @Test
    void convertTextToTm33_rejectsBadTestDate() {
        assertThatThrownBy(() -> tools.convertTextToTm33(IES, null, "31/01/2025"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("testDate");
    }

    @Test
    void prepareAndConfirm_writesSiblingXml() throws Exception {
        Files.createDirectories(tempDir.resolve("lib"));
        Files.writeString(tempDir.resolve("lib/spot.ies"), IES);

        Tm33WritePrepareResult prepared = tools.prepareWriteTm33(null, "lib/spot.ies", null, null, null, null, null);

        assertThat(prepared.path()).isEqualTo("lib/spot.xml");
        assertThat(prepared.sourcePath()).isEqualTo("lib/spot.ies");
        assertThat(prepared.exists()).isFalse();
        assertThat(prepared.warnings()).contains("目标文件不存在，确认后将创建。");
        assertThat(Files.exists(tempDir.resolve("lib/spot.xml"))).isFalse();

        Tm33WriteConfirmResult confirmed = tools.confirmWrite(prepared.token(), true);

        assertThat(confirmed.written()).isTrue();
        assertThat(confirmed.sourcePath()).isEqualTo("lib/spot.ies");
        assertThat(confirmed.sha256()).isEqualTo(prepared.newSha256());
        byte[] written = Files.readAllBytes(tempDir.resolve("lib/spot.xml"));
        assertThat(HashingUtils.sha256Hex(written)).isEqualTo(prepared.newSha256());
        assertThat(new String(written, StandardCharsets.UTF_8)).contains("<Model>Spot 20</Model>");

        assertThatThrownBy(() -> tools.confirmWrite(prepared.token(), true))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("token 无效或已过期");
    }

    @Test
    void prepare_rejectsExistingTargetWithoutOverwrite() throws Exception {
        Files.writeString(tempDir.resolve("spot.ies"), IES);
        Files.writeString(tempDir.resolve("spot.xml"), "old");

        assertThatThrownBy(() -> tools.prepareWriteTm33(null, "spot.ies", null, null, null, false, null))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("overwrite=true");
    }

    @Test
    void confirm_detectsTargetModifiedAfterPrepare() throws Exception {
        Files.writeString(tempDir.resolve("spot.ies"), IES);
        Files.writeString(tempDir.resolve("spot.xml"), "old");

        Tm33WritePrepareResult prepared = tools.prepareWriteTm33(null, "spot.ies", null, null, null, true, null);
        assertThat(prepared.expectedSha256()).isEqualTo(HashingUtils.sha256Hex("old".getBytes(StandardCharsets.UTF_8)));
        Files.writeString(tempDir.resolve("spot.xml"), "changed");

        assertThatThrownBy(() -> tools.confirmWrite(prepared.token(), true))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("sha256");
        assertThat(Files.readString(tempDir.resolve("spot.xml"))).isEqualTo("changed");
    }

    @Test
    void prepare_createsParentsWhenRequested() throws Exception {
        Files.writeString(tempDir.resolve("spot.ies"), IES);

        assertThatThrownBy(() -> tools.prepareWriteTm33(null, "spot.ies", null, "out/spot.tm33", null, null, false))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("createParents=true");

        Tm33WritePrepareResult prepared = tools.prepareWriteTm33(null, "spot.ies", null, "out/spot.tm33", null, null, true);
        assertThat(prepared.warnings()).anySatisfy(w -> assertThat(w).contains("扩展名不是 .xml"));

        tools.confirmWrite(prepared.token(), true);

        assertThat(Files.isRegularFile(tempDir.resolve("out/spot.tm33"))).isTrue();
    }

    @Test
    void confirm_falseCancelsWithoutWriting() throws Exception {
        Files.writeString(tempDir.resolve("spot.ies"), IES);
        Tm33WritePrepareResult prepared = tools.prepareWriteTm33(null, "spot.ies", null, null, null, null, null);

        Tm33WriteConfirmResult cancelled = tools.confirmWrite(prepared.token(), false);

        assertThat(cancelled.confirmed()).isFalse();
        assertThat(cancelled.written()).isFalse();
        assertThat(cancelled.warnings()).containsExactly("已取消写入（confirm=false）");
        assertThat(Files.exists(tempDir.resolve("spot.xml"))).isFalse();
        assertThatThrownBy(() -> tools.confirmWrite(prepared.token(), true))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void prepare_rejectedWhenWritesDisabled() throws Exception {
        Files.writeString(tempDir.resolve("spot.ies"), IES);
        properties.setAllowWrite(false);

        assertThatThrownBy(() -> tools.prepareWriteTm33(null, "spot.ies", null, null, null, null, null))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("allow-write=false");
    }

    @Test
    void defaultTargetPath_replacesExtension() {
        assertThat(PhotometricMcpTools.defaultTargetPath("a/b.c/spot.IES")).isEqualTo("a/b.c/spot.xml");
        assertThat(PhotometricMcpTools.defaultTargetPath("a.b/spot")).isEqualTo("a.b/spot.xml");
        assertThat(PhotometricMcpTools.parseTestDate(" ")).isNull();
    }
}
