package org.example.cryoingest.model;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

@Getter
@Builder(toBuilder = true)
@ToString
public class FoilHoleInfo {
    private final int id;
    private final int gridSquareId;
    private final Double xLocation;
    private final Double yLocation;
    private final Double xStagePosition;
    private final Double yStagePosition;
    private final Integer readoutAreaX;
    private final Integer readoutAreaY;
    private final Double pixelSize;
    private final Double diameter;
    private final String image;
}
