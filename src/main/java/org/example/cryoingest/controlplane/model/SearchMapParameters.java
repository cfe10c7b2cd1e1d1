package org.example.cryoingest.controlplane.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * Partial updates are expected: each Tomo file contributes some of these fields.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class SearchMapParameters {
    private String tag;
    @JsonProperty("x_stage_position")
    private Double xStagePosition;
    @JsonProperty("y_stage_position")
    private Double yStagePosition;
    private Double pixelSize;
    private String image;
    private Double binning;
    private Map<String, Double> referenceMatrix;
    private Map<String, Double> stageCorrection;
    private Map<String, Double> imageShiftCorrection;
    private Integer height;
    private Integer width;
    @JsonProperty("x_location")
    private Integer xLocation;
    @JsonProperty("y_location")
    private Integer yLocation;
    private Integer heightOnAtlas;
    private Integer widthOnAtlas;
}
