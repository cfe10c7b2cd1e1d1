package org.example.cryoingest.model;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

@Getter
@Builder(toBuilder = true)
@ToString
public class BatchPositionInfo {
    private final String name;
    private final String searchMapName;
    private final double xStagePosition;
    private final double yStagePosition;
    private final double xBeamshift;
    private final double yBeamshift;
    private final Integer xLocation;
    private final Integer yLocation;
}
