package org.photoconv.convert.ies;

import org.junit.jupiter.api.Test;
import org.photoconv.convert.ies.model.CandelaMatrix;
import org.photoconv.convert.ies.model.IesParseResult;
import org.photoconv.convert.ies.model.PhotometricHeaderFields;
import org.photoconv.convert.ies.model.PhotometricType;
import org.photoconv.convert.ies.model.TiltType;
import org.photoconv.convert.ies.model.UnitsType;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class IesReaderTest {

    private static final String BASIC = """
            IESNA:LM-63-2002
            [TEST]ABC
            TILT=NONE
            1 1000 1 2 2 1 2 0 0 0 1 0 100
            0 90
            0 180
            500 100 600 120
            """;

    @Test
    void parse_basicFileBuildsHorizontalMajorMatrix() {
        IesParseResult result = IesReader.parse(BASIC);

        assertThat(result.fileHeader().version()).isEqualTo("IESNA:LM-63-2002");
        assertThat(result.commonHeader().testReport()).isEqualTo("ABC");
        assertThat(result.fileHeader().tilt().type()).isEqualTo(TiltType.NONE);
        assertThat(result.angles().vertical()).containsExactly(0.0, 90.0);
        assertThat(result.angles().horizontal()).containsExactly(0.0, 180.0);
        assertThat(result.angles().type()).isEqualTo("C");

        CandelaMatrix candela = result.candela();
        assertThat(candela.horizontalCount()).isEqualTo(2);
        assertThat(candela.verticalCount()).isEqualTo(2);
        assertThat(candela.plane(0)).containsExactly(500.0, 100.0);
        assertThat(candela.plane(1)).containsExactly(600.0, 120.0);
        assertThat(candela.peakCandela()).isEqualTo(600.0);
        assertThat(candela.peakPlaneIndex()).isEqualTo(1);
        assertThat(candela.peakVerticalIndex()).isZero();
        assertThat(candela.peakHorizontalAngle()).isEqualTo(180.0);
        assertThat(result.warnings()).isEmpty();
    }

    @Test
    void parse_appliesCandelaMultiplierExactlyOnce() {
        String ies = BASIC.replace("1 1000 1 2 2", "1 1000 2 2 2");

        CandelaMatrix candela = IesReader.parse(ies).candela();

        assertThat(candela.plane(0)).containsExactly(1000.0, 200.0);
        assertThat(candela.plane(1)).containsExactly(1200.0, 240.0);
        assertThat(candela.peakCandela()).isEqualTo(1200.0);
    }

    @Test
    void parse_tiltIncludeScalesColumnsByInterpolatedMultiplier() {
        String ies = """
                IESNA:LM-63-2002
                [MANUFAC]Acme
                TILT=INCLUDE
                1
                2
                0 90
                1 0.5
                1 1000 1 2 2 1 2 0 0 0 1 0 100
                0 90
                0 180
                500 100 600 120
                """;

        IesParseResult result = IesReader.parse(ies);

        assertThat(result.fileHeader().tilt().type()).isEqualTo(TiltType.INCLUDE);
        assertThat(result.fileHeader().tilt().lampToLuminaireGeometry()).isEqualTo(1);
        assertThat(result.fileHeader().tilt().multipliers()).containsExactly(1.0, 0.5);
        assertThat(result.candela().plane(0)).containsExactly(500.0, 50.0);
        assertThat(result.candela().plane(1)).containsExactly(600.0, 60.0);
    }

    @Test
    void parse_tiltTableMaySpanLines() {
        String ies = """
                IESNA:LM-63-2002
                TILT=INCLUDE
                1
                3
                0 45
                90
                1
                1 1
                1 1000 1 1 1 1 2 0 0 0 1 0 100
                0
                0
                10
                """;

        IesParseResult result = IesReader.parse(ies);

        assertThat(result.fileHeader().tilt().angles()).containsExactly(0.0, 45.0, 90.0);
        assertThat(result.fileHeader().tilt().multipliers()).containsExactly(1.0, 1.0, 1.0);
        assertThat(result.candela().get(0, 0)).isEqualTo(10.0);
    }

    @Test
    void parse_tenFieldHeaderUsesLastTokenAsInputWatts() {
        String ies = """
                IESNA:LM-63-2002
                TILT=NONE
                1 1000 1 2 2 1 2 0.5 0.6 0.7
                0 90
                0 180
                500 100 600 120
                """;

        IesParseResult result = IesReader.parse(ies);
        PhotometricHeaderFields photometry = result.photometry();

        assertThat(photometry.fieldCount()).isEqualTo(10);
        assertThat(photometry.ballastFactor()).isEqualTo(1.0);
        assertThat(photometry.futureUse()).isEqualTo(0.0);
        assertThat(photometry.inputWatts()).isEqualTo(0.7);
        assertThat(result.commonHeader().inputWatts()).isEqualTo(0.7);
        assertThat(result.warnings()).anySatisfy(w -> assertThat(w).contains("10 个字段"));
    }

    @Test
    void parse_tenFieldHeaderFollowedByTrailingDataKeepsAngleLines() {
        String ies = """
                IESNA:LM-63-2002
                TILT=NONE
                1 1000 1 3 1 1 2 0.5 0.6 0.7
                0 45 90
                0
                100 1000 100
                1 2 3
                """;

        IesParseResult result = IesReader.parse(ies);

        assertThat(result.photometry().fieldCount()).isEqualTo(10);
        assertThat(result.photometry().inputWatts()).isEqualTo(0.7);
        assertThat(result.angles().vertical()).containsExactly(0.0, 45.0, 90.0);
        assertThat(result.angles().horizontal()).containsExactly(0.0);
        assertThat(result.candela().plane(0)).containsExactly(100.0, 1000.0, 100.0);
        assertThat(result.warnings()).anySatisfy(w -> assertThat(w).contains("光强表之后还有 3 个值"));
    }

    @Test
    void parse_twoLineHeaderIsRecombinedEvenWithTrailingData() {
        String ies = """
                IESNA:LM-63-2002
                TILT=NONE
                1 1000 1 3 1 1 2 0 0 0
                1 1 25
                0 45 90
                0
                100 1000 100
                """;

        IesParseResult result = IesReader.parse(ies + "7 8\n");

        assertThat(result.photometry().fieldCount()).isEqualTo(13);
        assertThat(result.photometry().inputWatts()).isEqualTo(25.0);
        assertThat(result.angles().vertical()).containsExactly(0.0, 45.0, 90.0);
        assertThat(result.candela().plane(0)).containsExactly(100.0, 1000.0, 100.0);
    }

    @Test
    void parse_tiltGeometryAndCountMayShareALine() {
        String ies = """
                IESNA:LM-63-2002
                TILT=INCLUDE
                1 2
                0 90
                1 0.5
                1 1000 1 2 1 1 2 0 0 0 1 0 100
                0 90
                0
                100 100
                """;

        IesParseResult result = IesReader.parse(ies);

        assertThat(result.fileHeader().tilt().lampToLuminaireGeometry()).isEqualTo(1);
        assertThat(result.fileHeader().tilt().angles()).containsExactly(0.0, 90.0);
        assertThat(result.fileHeader().tilt().multipliers()).containsExactly(1.0, 0.5);
        assertThat(result.candela().plane(0)).containsExactly(100.0, 50.0);
    }

    @Test
    void parse_standardTwoLineHeaderIsRecombined() {
        String ies = """
                IESNA:LM-63-2002
                [TEST]R-1
                [TESTLAB]Lab
                [LUMCAT]Model X
                TILT=NONE
                2 1500 1 3 1 1 1 0.5 1.2 0.1
                0.9 1 42.5
                0 45 90
                0
                1000 500 100
                """;

        IesParseResult result = IesReader.parse(ies);
        PhotometricHeaderFields photometry = result.photometry();

        assertThat(photometry.fieldCount()).isEqualTo(13);
        assertThat(photometry.ballastFactor()).isEqualTo(0.9);
        assertThat(photometry.inputWatts()).isEqualTo(42.5);
        assertThat(photometry.unitsType()).isEqualTo(UnitsType.FEET);
        assertThat(photometry.photometricType()).isEqualTo(PhotometricType.C);
        assertThat(photometry.dimensions().length()).isEqualTo(1.2);
        assertThat(result.commonHeader().totalLumens()).isEqualTo(3000.0);
        assertThat(result.commonHeader().luminaire()).isEqualTo("Model X");
        assertThat(result.commonHeader().testLaboratory()).isEqualTo("Lab");
        assertThat(result.angles().vertical()).containsExactly(0.0, 45.0, 90.0);
        assertThat(result.candela().plane(0)).containsExactly(1000.0, 500.0, 100.0);
        assertThat(result.warnings()).isEmpty();
    }

    @Test
    void parse_keywordsAreCaseInsensitiveAndMoreLinesJoined() {
        String ies = """
                IESNA:LM-63-2002
                [manufac] Acme Lighting
                [CatalogNumber]CAT-7
                [MORE]first note
                [MORE]second note
                [_CUSTOM]kept
                free text without brackets
                tilt=none
                1 1000 1 2 2 1 2 0 0 0 1 0 100
                0 90
                0 180
                500 100 600 120
                """;

        IesParseResult result = IesReader.parse(ies);

        assertThat(result.commonHeader().manufacturer()).isEqualTo("Acme Lighting");
        assertThat(result.commonHeader().catalogNumber()).isEqualTo("CAT-7");
        assertThat(result.commonHeader().notes()).isEqualTo("first note\nsecond note");
        assertThat(result.fileHeader().keywords())
                .containsEntry("_CUSTOM", "kept")
                .containsEntry("MORE", "first note\nsecond note")
                .containsKeys("MANUFAC", "CATALOGNUMBER");
    }

    @Test
    void parse_tiltFileIsRecordedButNotResolved() {
        IesParseResult result = IesReader.parse(BASIC.replace("TILT=NONE", "TILT=lamp_tilt.dat"));

        assertThat(result.fileHeader().tilt().type()).isEqualTo(TiltType.FILE);
        assertThat(result.fileHeader().tilt().fileName()).isEqualTo("lamp_tilt.dat");
        assertThat(result.warnings()).anySatisfy(w -> assertThat(w).contains("lamp_tilt.dat"));
    }

    @Test
    void parse_wrappedCandelaValuesAcrossManyLines() {
        String ies = """
                IESNA:LM-63-2002
                TILT=NONE
                1 1000 1 3 2 1 2 0 0 0 1 0 100
                0
                45 90
                0 90
                100
                200 300 400
                500
                600
                """;

        CandelaMatrix candela = IesReader.parse(ies).candela();

        assertThat(candela.plane(0)).containsExactly(100.0, 200.0, 300.0);
        assertThat(candela.plane(1)).containsExactly(400.0, 500.0, 600.0);
    }

    @Test
    void parse_trailingValuesAreIgnoredWithWarning() {
        IesParseResult result = IesReader.parse(BASIC + "999 999\n");

        assertThat(result.candela().plane(1)).containsExactly(600.0, 120.0);
        assertThat(result.warnings()).anySatisfy(w -> assertThat(w).contains("2 个值"));
    }

    @Test
    void parse_beamAngleInterpolatesHalfPeakCrossings() {
        String ies = """
                IESNA:LM-63-2002
                TILT=NONE
                1 1000 1 3 1 1 2 0 0 0 1 0 100
                0 45 90
                0
                100 1000 100
                """;

        CandelaMatrix candela = IesReader.parse(ies).candela();

        assertThat(candela.peakCandela()).isEqualTo(1000.0);
        assertThat(candela.peakVerticalAngle()).isEqualTo(45.0);
        assertThat(candela.beamAngle()).isCloseTo(50.0, within(1e-9));
    }

    @Test
    void parse_rejectsBlankInput() {
        assertThatThrownBy(() -> IesReader.parse("  \n\t"))
                .isInstanceOf(EmptyInputException.class);
    }

    @Test
    void parse_rejectsMissingTiltLine() {
        String ies = """
                IESNA:LM-63-2002
                [TEST]ABC
                """;

        assertThatThrownBy(() -> IesReader.parse(ies))
                .isInstanceOf(MissingSectionException.class)
                .hasMessageContaining("TILT");
    }

    @Test
    void parse_rejectsMissingNumericHeader() {
        assertThatThrownBy(() -> IesReader.parse("IESNA:LM-63-2002\nTILT=NONE\n"))
                .isInstanceOf(MissingSectionException.class);
    }

    @Test
    void parse_rejectsZeroVerticalAngles() {
        String ies = BASIC.replace("1 1000 1 2 2", "1 1000 1 0 2");

        assertThatThrownBy(() -> IesReader.parse(ies))
                .isInstanceOf(InvalidAngleCountException.class)
                .satisfies(e -> assertThat(((IesParseException) e).getLineNumber()).isEqualTo(4));
    }

    @Test
    void parse_rejectsShortHeader() {
        String ies = """
                IESNA:LM-63-2002
                TILT=NONE
                1 1000 1 2 2 1 2 0 0
                """;

        assertThatThrownBy(() -> IesReader.parse(ies))
                .isInstanceOf(InvalidHeaderException.class)
                .hasMessageContaining("9");
    }

    @Test
    void parse_rejectsNonIntegralAngleCount() {
        String ies = BASIC.replace("1 1000 1 2 2", "1 1000 1 2.5 2");

        assertThatThrownBy(() -> IesReader.parse(ies))
                .isInstanceOf(InvalidHeaderException.class)
                .hasMessageContaining("2.5");
    }

    @Test
    void parse_rejectsZeroLampCount() {
        String ies = BASIC.replace("1 1000 1 2 2", "0 1000 1 2 2");

        assertThatThrownBy(() -> IesReader.parse(ies))
                .isInstanceOf(InvalidHeaderException.class);
    }

    @Test
    void parse_reportsMissingHorizontalAnglesAsAngleCountMismatch() {
        String ies = """
                IESNA:LM-63-2002
                TILT=NONE
                1 1000 1 2 2 1 2 0 0 0 1 0 100
                0 90
                """;

        assertThatThrownBy(() -> IesReader.parse(ies))
                .isInstanceOf(AngleCountMismatchException.class)
                .isInstanceOf(TruncatedInputException.class)
                .hasMessageContaining("水平角");
    }

    @Test
    void parse_reportsShortCandelaTableAsTruncated() {
        String ies = BASIC.replace("500 100 600 120", "500 100 600");

        assertThatThrownBy(() -> IesReader.parse(ies))
                .isInstanceOf(TruncatedInputException.class)
                .isNotInstanceOf(AngleCountMismatchException.class)
                .satisfies(e -> {
                    TruncatedInputException t = (TruncatedInputException) e;
                    assertThat(t.getExpected()).isEqualTo(4);
                    assertThat(t.getActual()).isEqualTo(3);
                });
    }

    @Test
    void parse_rejectsNonNumericCandela() {
        String ies = BASIC.replace("500 100 600 120", "500 abc 600 120");

        assertThatThrownBy(() -> IesReader.parse(ies))
                .isInstanceOf(InvalidNumberException.class)
                .satisfies(e -> assertThat(((InvalidNumberException) e).getToken()).isEqualTo("abc"));
    }

    @Test
    void parse_rejectsInvalidTiltTableLength() {
        String ies = """
                IESNA:LM-63-2002
                TILT=INCLUDE
                1
                0
                1 1000 1 2 2 1 2 0 0 0 1 0 100
                """;

        assertThatThrownBy(() -> IesReader.parse(ies))
                .isInstanceOf(InvalidTiltTableException.class);
    }

    @Test
    void parse_rejectsTruncatedTiltTable() {
        String ies = """
                IESNA:LM-63-2002
                TILT=INCLUDE
                1
                3
                0 45 90
                1 1
                """;

        assertThatThrownBy(() -> IesReader.parse(ies))
                .isInstanceOf(TruncatedInputException.class);
    }

    @Test
    void parse_unknownPhotometricTypeFallsBackToTypeCWithWarning() {
        String ies = BASIC.replace("1 1000 1 2 2 1 2", "1 1000 1 2 2 7 2");

        IesParseResult result = IesReader.parse(ies);

        assertThat(result.photometry().photometricType()).isEqualTo(PhotometricType.C);
        assertThat(result.warnings()).anySatisfy(w -> assertThat(w).contains("未知光度类型 7"));
    }

    @Test
    void parse_absolutePhotometryKeepsNegativeLumensWithWarning() {
        String ies = BASIC.replace("1 1000 1 2 2", "2 -1 1 2 2");

        IesParseResult result = IesReader.parse(ies);

        assertThat(result.photometry().isAbsolutePhotometry()).isTrue();
        assertThat(result.commonHeader().totalLumens()).isEqualTo(-2.0);
        assertThat(result.warnings()).anySatisfy(w -> assertThat(w).contains("绝对光度"));
    }
}
