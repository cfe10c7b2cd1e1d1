package org.example.cryoingest.context;

import org.junit.jupiter.api.Test;

import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SerialEmFileNamingTest {

    private final SerialEmFileNaming naming = SerialEmFileNaming.INSTANCE;

    @Test
    void splitsOnUnderscores() {
        Path movie = Path.of("/data/grid1/tomo_12_-20.0.mrc");

        assertThat(naming.series(movie)).isEqualTo("12");
        assertThat(naming.angle(movie)).isEqualTo("-20.0");
        assertThat(naming.tag(movie)).isEmpty();
    }

    @Test
    void fallsBackToDashes() {
        Path movie = Path.of("tomo-3-15.0.tif");

        assertThat(naming.series(movie)).isEqualTo("3");
        assertThat(naming.angle(movie)).isEqualTo("15.0");
    }

    @Test
    void requiresANumericPart() {
        assertThatThrownBy(() -> naming.series(Path.of("tomo_a_b.mrc")))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
