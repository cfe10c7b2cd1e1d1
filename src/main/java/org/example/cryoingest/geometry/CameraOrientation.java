package org.example.cryoingest.geometry;

import java.util.Locale;

/**
 * Orientation of the detector relative to the stage axes. K3 cameras can be mounted
 * with either axis flipped on the overview image; Falcon cameras need no flip.
 */
public enum CameraOrientation {
    FALCON(Matrix2.IDENTITY),
    K3_FLIPY(new Matrix2(1, 0, 0, -1)),
    K3_FLIPX(new Matrix2(-1, 0, 0, 1)),
    NONE(Matrix2.IDENTITY);

    private final Matrix2 flip;

    CameraOrientation(Matrix2 flip) {
        this.flip = flip;
    }

    public Vector2 apply(Vector2 v) {
        return flip.apply(v);
    }

    public static CameraOrientation fromConfig(String camera) {
        if (camera == null || camera.isBlank()) return NONE;
        try {
            return valueOf(camera.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return NONE;
        }
    }
}
