package org.prisma.datapipeline.job;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.nio.file.Files;
import java.nio.file.Path;

import org.prisma.datapipeline.api.job.DetectorParameters;
import org.prisma.datapipeline.api.job.FrameRange;
import org.prisma.datapipeline.api.job.JobSpecification;
import org.prisma.datapipeline.api.job.PeakDefinition;
import org.prisma.datapipeline.api.job.Stage;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;

@Tag("unit")
class JobSpecificationLoaderTest {

    private static final String RECIPE = """
        {
          "sample": "S1",
          "setting": "Standard",
          "stage": "cont",
          "home_dir": "home",
          "images_path": "raw/S1",
          "control_file": "calib.imctrl",
          "active_peaks": [
            {"name": "Martensite 110", "miller_index": 110, "position": 8.5, "limits": [8.2, 8.8]},
            {"name": "Austenite 200", "miller_index": 200, "position": 9.6, "limits": [9.3, 9.9]}
          ],
          "available_peaks": {"Carbide": 9.1, "Austenite 111": 7.4},
          "az_start": -90,
          "az_end": 90,
          "spacing": 5,
          "frame_start": 0,
          "frame_end": 100,
          "step": 5
        }
        """;

    @TempDir
    Path tempDir;

    private static Config recipe(String overrides) {
        return ConfigFactory.parseString(overrides).withFallback(ConfigFactory.parseString(RECIPE));
    }

    private static void assertRejected(Config recipe, String field) {
        assertThatThrownBy(() -> JobSpecificationLoader.parse(recipe, Path.of("/recipes")))
            .isInstanceOf(JobSpecificationException.class)
            .satisfies(e -> assertThat(((JobSpecificationException) e).getField()).isEqualTo(field))
            .hasMessageContaining(field);
    }

    @Test
    void parsesCompleteRecipe() {
        JobSpecification job = JobSpecificationLoader.parse(recipe("{}"), Path.of("/recipes"));

        assertThat(job.sample()).isEqualTo("S1");
        assertThat(job.stage()).isEqualTo(Stage.CONT);
        assertThat(job.homeDirectory()).isEqualTo(Path.of("/recipes/home"));
        assertThat(job.imagesPath()).isEqualTo(Path.of("/recipes/raw/S1"));
        assertThat(job.reference()).isEmpty();
        assertThat(job.exposure()).isEqualTo("019");
        assertThat(job.peakCount()).isEqualTo(2);
        assertThat(job.activePeaks().get(1).millerIndex()).isEqualTo(200);
        assertThat(job.binning().binCount()).isEqualTo(36);
        assertThat(job.frames()).isEqualTo(new FrameRange(0, 100, 5));
        assertThat(job.frames().expectedCount()).isEqualTo(20);
        assertThat(job.detector()).isEqualTo(DetectorParameters.DEFAULT);
        assertThat(job.availablePeaks()).extracting(PeakDefinition::name).containsExactly("Austenite 111", "Carbide");
        assertThat(job.backgroundCandidates()).extracting(PeakDefinition::name).containsExactly("Carbide");
    }

    @Test
    void defaultsToAllFramesAndAcceptsLegacyImageKey() {
        Config legacy = ConfigFactory.parseString(RECIPE).withoutPath("images_path").withoutPath("frame_end")
            .withoutPath("step").withFallback(ConfigFactory.parseString("image_folder = \"/data/raw\""));

        JobSpecification job = JobSpecificationLoader.parse(legacy, Path.of("/recipes"));

        assertThat(job.imagesPath()).isEqualTo(Path.of("/data/raw"));
        assertThat(job.frames()).isEqualTo(new FrameRange(0, FrameRange.ALL, 1));
    }

    @Test
    void readsDetectorParameters() {
        JobSpecification job = JobSpecificationLoader.parse(
            recipe("{\"detector_params\": {\"wavelength\": 0.1907, \"pixel_size\": [200, 200]}}"), null);

        assertThat(job.detector().wavelength()).isEqualTo(0.1907);
        assertThat(job.detector().pixelSizeX()).isEqualTo(200.0);
        assertThat(job.detector().columns()).isEqualTo(DetectorParameters.DEFAULT.columns());
    }

    @ParameterizedTest
    @CsvSource(delimiter = '|', value = {
        "{\"stage\": \"later\"}                        | stage",
        "{\"sample\": \"a/b\"}                         | sample",
        "{\"spacing\": 7}                              | spacing",
        "{\"az_end\": -90}                             | az_end",
        "{\"frame_end\": 0}                            | frame_end",
        "{\"step\": 0}                                 | step",
        "{\"frame_start\": -1}                         | frame_start",
        "{\"active_peaks\": []}                        | active_peaks",
        "{\"active_peaks\": [{\"name\": \"p\", \"miller_index\": 1, \"position\": 5, \"limits\": [6, 7]}]} | active_peaks[0].position",
        "{\"active_peaks\": [{\"name\": \"p\", \"miller_index\": 1, \"position\": 5, \"limits\": [4, 5, 6]}]} | active_peaks[0].limits",
        "{\"active_peaks\": [{\"name\": \"p\", \"position\": 5, \"limits\": [4, 6]}]} | active_peaks[0].miller_index",
        "{\"detector_params\": {\"wavelength\": -1}}   | detector_params.wavelength"
    })
    void rejectsInvalidField(String overrides, String field) {
        assertRejected(recipe(overrides), field);
    }

    @Test
    void rejectsMissingRequiredField() {
        assertRejected(ConfigFactory.parseString(RECIPE).withoutPath("control_file"), "control_file");
        assertRejected(ConfigFactory.parseString(RECIPE).withoutPath("images_path"), "images_path");
        assertRejected(ConfigFactory.parseString(RECIPE).withoutPath("spacing"), "spacing");
    }

    @Test
    void loadVerifiesReferencedInputs() throws Exception {
        Path recipeFile = tempDir.resolve("recipe.json");
        Files.writeString(recipeFile, RECIPE);

        assertThatThrownBy(() -> JobSpecificationLoader.load(recipeFile))
            .isInstanceOf(JobSpecificationException.class)
            .hasMessageContaining("images_path");

        Files.createDirectories(tempDir.resolve("raw/S1"));
        Files.writeString(tempDir.resolve("calib.imctrl"), "");
        JobSpecification job = JobSpecificationLoader.load(recipeFile);

        assertThat(job.imagesPath()).isEqualTo(tempDir.resolve("raw/S1").toAbsolutePath().normalize());
    }

    @Test
    void loadRejectsMissingOrMalformedRecipe() throws Exception {
        assertThatThrownBy(() -> JobSpecificationLoader.load(tempDir.resolve("absent.json")))
            .isInstanceOf(JobSpecificationException.class)
            .satisfies(e -> assertThat(((JobSpecificationException) e).getField()).isEqualTo("recipe"));

        Path broken = tempDir.resolve("broken.json");
        Files.writeString(broken, "{ \"sample\": ");
        assertThatThrownBy(() -> JobSpecificationLoader.load(broken))
            .isInstanceOf(JobSpecificationException.class)
            .hasMessageContaining("not a valid JSON document");
    }
}
