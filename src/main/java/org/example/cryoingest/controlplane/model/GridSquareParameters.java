package org.example.cryoingest.controlplane.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Grid square registration. Location fields are atlas pixels and are left out until the atlas is known.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class GridSquareParameters {
    private String tag;
    private Integer readoutAreaX;
    private Integer readoutAreaY;
    private Integer thumbnailSizeX;
    private Integer thumbnailSizeY;
    private Double pixelSize;
    private String image;
    @JsonProperty("x_location")
    private Integer xLocation;
    @JsonProperty("y_location")
    private Integer yLocation;
    @JsonProperty("x_stage_position")
    private Double xStagePosition;
    @JsonProperty("y_stage_position")
    private Double yStagePosition;
}
