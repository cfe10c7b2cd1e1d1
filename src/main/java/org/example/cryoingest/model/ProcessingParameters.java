package org.example.cryoingest.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Processing parameters a user registers for a session label before the
 * multigrid watcher starts.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class ProcessingParameters {
    private String gainRef;
    private Double dosePerFrame;
    private Boolean extractDownscale;
    private Double particleDiameter;
    private String symmetry;
    private Integer eerFractionation;
}
