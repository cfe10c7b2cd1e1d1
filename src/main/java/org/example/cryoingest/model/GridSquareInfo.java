package org.example.cryoingest.model;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

@Getter
@Builder(toBuilder = true)
@ToString
public class GridSquareInfo {
    private final int id;
    private final Integer readoutAreaX;
    private final Integer readoutAreaY;
    private final Integer thumbnailSizeX;
    private final Integer thumbnailSizeY;
    private final Double pixelSize;
    private final String image;
    private final Integer xLocation;
    private final Integer yLocation;
    private final Double xStagePosition;
    private final Double yStagePosition;
}
