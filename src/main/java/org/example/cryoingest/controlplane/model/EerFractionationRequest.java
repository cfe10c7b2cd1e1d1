package org.example.cryoingest.controlplane.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Either {@code eerPath} or {@code numFrames} identifies the frame count; the control plane writes the file and answers with its path.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class EerFractionationRequest {
    private String eerPath;
    private Integer numFrames;
    private Integer fractionation;
    private Double dosePerFrame;
    private String fractionationFileName;
}
