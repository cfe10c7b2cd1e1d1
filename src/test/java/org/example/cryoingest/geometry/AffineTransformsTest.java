package org.example.cryoingest.geometry;

import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class AffineTransformsTest {

    private static final Matrix2 ROTATION = new Matrix2(0, -1, 1, 0);

    @Test
    void inverse_undoesMultiplication() {
        Matrix2 m = new Matrix2(2, 1, 1, 1);

        assertThat(m.multiply(m.inverse())).isEqualTo(Matrix2.IDENTITY);
    }

    @Test
    void inverse_rejectsSingularMatrix() {
        assertThatThrownBy(() -> new Matrix2(1, 2, 2, 4).inverse()).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void fromMap_requiresAllElements() {
        assertThat(Matrix2.fromMap(Map.of("m11", 1.0, "m12", 0.0, "m21", 0.0, "m22", 1.0))).isEqualTo(Matrix2.IDENTITY);
        assertThatThrownBy(() -> Matrix2.fromMap(Map.of("m11", 1.0))).hasMessageContaining("m12");
    }

    @Test
    void corrected_withIdentityCorrectionIsUnchanged() {
        Vector2 v = new Vector2(3, 4);

        assertThat(AffineTransforms.corrected(ROTATION, Matrix2.IDENTITY, v)).isEqualTo(v);
    }

    @Test
    void corrected_appliesCorrectionInReferenceFrame() {
        Matrix2 stretchX = new Matrix2(2, 0, 0, 1);

        Vector2 result = AffineTransforms.corrected(ROTATION, stretchX, new Vector2(0, 1));

        // the rotation maps y onto -x, so stretching x stretches the original y
        assertThat(result.getX()).isCloseTo(0, within(1e-9));
        assertThat(result.getY()).isCloseTo(2, within(1e-9));
    }

    @Test
    void relativeOffset_isDisplacementWithoutCorrections() {
        Vector2 offset = AffineTransforms.relativeOffset(ROTATION, Matrix2.IDENTITY, Matrix2.IDENTITY,
                new Vector2(1, 1), new Vector2(4, -1));

        assertThat(offset.getX()).isCloseTo(3, within(1e-9));
        assertThat(offset.getY()).isCloseTo(-2, within(1e-9));
    }

    @Test
    void cameraOrientation_flipsConfiguredAxis() {
        assertThat(CameraOrientation.fromConfig("k3_flipy").apply(new Vector2(1, 2))).isEqualTo(new Vector2(1, -2));
        assertThat(CameraOrientation.fromConfig("unknown")).isEqualTo(CameraOrientation.NONE);
        assertThat(CameraOrientation.fromConfig(null)).isEqualTo(CameraOrientation.NONE);
    }
}
