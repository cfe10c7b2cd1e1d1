package org.example.cryoingest.analysis;

import org.example.cryoingest.model.AcquisitionSoftware;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

class FileClassifierTest {

    @Test
    void foilHoleMoviesAreEpu() {
        Path movie = Path.of("Images-Disc1/GridSquare_1/Data/FoilHole_2_Data_3_4_20240101_120000_fractions.tiff");

        assertThat(FileClassifier.classify(movie)).contains(AcquisitionSoftware.EPU);
    }

    @Test
    void positionMoviesAreTomo() {
        assertThat(FileClassifier.classify(Path.of("Position_1_001[30.00]_fractions.tiff")))
                .contains(AcquisitionSoftware.TOMO);
        assertThat(FileClassifier.classify(Path.of("Position12_3_-30.00_EER.eer")))
                .contains(AcquisitionSoftware.TOMO);
    }

    @Test
    void plainMoviesAreSerialEm(@TempDir Path dir) throws IOException {
        Path movie = Files.createFile(dir.resolve("tomo_12_-20.0.mrc"));

        assertThat(FileClassifier.classify(movie)).contains(AcquisitionSoftware.SERIALEM);
    }

    @Test
    void moviesWithPreviewImageAreNotSerialEm(@TempDir Path dir) throws IOException {
        Path movie = Files.createFile(dir.resolve("overview_3.mrc"));
        Files.createFile(dir.resolve("overview_3.jpg"));

        assertThat(FileClassifier.classify(movie)).isEmpty();
    }

    @Test
    void averagedDuplicatesAreNotSerialEm(@TempDir Path dir) throws IOException {
        Path movie = Files.createFile(dir.resolve("grid_7.mrc"));
        Files.createFile(dir.resolve("grid_7.mrc_avg.mrc"));

        assertThat(FileClassifier.classify(movie)).isEmpty();
    }

    @Test
    void searchMapsAndOtherSuffixesAreUnclassified() {
        assertThat(FileClassifier.classify(Path.of("Batch/tomo_1_0.0.mrc"))).isEmpty();
        assertThat(FileClassifier.classify(Path.of("SearchMaps/map_1.mrc"))).isEmpty();
        assertThat(FileClassifier.classify(Path.of("notes_1.txt"))).isEmpty();
    }

    @Test
    void withSuffix_replacesLastSuffix() {
        assertThat(FileClassifier.withSuffix(Path.of("a/b.c.mrc"), ".mdoc")).isEqualTo(Path.of("a/b.c.mdoc"));
        assertThat(FileClassifier.suffix(Path.of("a/b"))).isEmpty();
    }
}
