package org.example.cryoingest.controlplane.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class FoilHoleParameters {
    private String tag;
    private Integer name;
    @JsonProperty("x_location")
    private Double xLocation;
    @JsonProperty("y_location")
    private Double yLocation;
    @JsonProperty("x_stage_position")
    private Double xStagePosition;
    @JsonProperty("y_stage_position")
    private Double yStagePosition;
    private Integer readoutAreaX;
    private Integer readoutAreaY;
    private Integer thumbnailSizeX;
    private Integer thumbnailSizeY;
    private Double pixelSize;
    private Double diameter;
    private String image;
}
