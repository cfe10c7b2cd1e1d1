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
public class BatchPositionParameters {
    private String tag;
    @JsonProperty("x_stage_position")
    private Double xStagePosition;
    @JsonProperty("y_stage_position")
    private Double yStagePosition;
    @JsonProperty("x_beamshift")
    private Double xBeamshift;
    @JsonProperty("y_beamshift")
    private Double yBeamshift;
    private String searchMapName;
    @JsonProperty("x_location")
    private Integer xLocation;
    @JsonProperty("y_location")
    private Integer yLocation;
}
