package org.example.cryoingest.model;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

/**
 * Centre of a grid square on the atlas image, in atlas pixels, and its stage
 * position in nanometres.
 */
@Getter
@AllArgsConstructor
@ToString
public class AtlasPosition {
    private final int xPixel;
    private final int yPixel;
    private final double xStage;
    private final double yStage;
}
