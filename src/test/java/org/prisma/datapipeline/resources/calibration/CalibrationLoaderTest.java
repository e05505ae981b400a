package org.prisma.datapipeline.resources.calibration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import java.nio.file.Files;
import java.nio.file.Path;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.prisma.datapipeline.api.job.DetectorParameters;
import org.prisma.datapipeline.job.JobSpecificationException;

@Tag("unit")
class CalibrationLoaderTest {

    @TempDir
    Path tempDir;

    @Test
    void readsGeometryAndIgnoresUnknownKeys() throws Exception {
        Path control = write("""
            # exported control file
            center:[204.5, 211.25]
            distance:1002.3
            wavelength:0.1722
            pixelSize:[200.0, 200.0]
            azmthOff:0.5
            tilt:0.12
            """);

        Calibration calibration = CalibrationLoader.load(control, DetectorParameters.DEFAULT);

        assertThat(calibration.centerX()).isEqualTo(204.5);
        assertThat(calibration.centerY()).isEqualTo(211.25);
        assertThat(calibration.distance()).isEqualTo(1002.3);
        assertThat(calibration.wavelength()).isEqualTo(0.1722);
        assertThat(calibration.pixelSizeX()).isEqualTo(200.0);
        assertThat(calibration.azimuthOffset()).isEqualTo(0.5);
    }

    @Test
    void recipeDetectorFillsMissingValues() throws Exception {
        Path control = write("center:[10, 10]\ndistance:500\n");

        Calibration calibration = CalibrationLoader.load(control, DetectorParameters.DEFAULT);

        assertThat(calibration.wavelength()).isEqualTo(0.240);
        assertThat(calibration.pixelSizeX()).isEqualTo(172.0);
        assertThat(calibration.azimuthOffset()).isZero();
    }

    @Test
    void missingDistanceIsAConfigurationError() throws Exception {
        Path control = write("center:[10, 10]\n");

        assertThatThrownBy(() -> CalibrationLoader.load(control, DetectorParameters.DEFAULT))
            .isInstanceOf(JobSpecificationException.class)
            .hasMessageContaining("distance");
    }

    @Test
    void braggLaw() {
        Calibration calibration = new Calibration(0, 0, 1000, 0.240, 172, 172, 0);

        assertThat(calibration.dSpacing(8.46)).isCloseTo(0.240 / (2 * Math.sin(Math.toRadians(4.23))), within(1e-12));
        assertThat(calibration.dSpacing(0.0)).isNaN();
    }

    private Path write(String content) throws Exception {
        return Files.writeString(tempDir.resolve("calibration.imctrl"), content);
    }
}
