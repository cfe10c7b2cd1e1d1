package org.example.cryoingest.controlplane.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Start of one data collection: a whole SPA source, or one tilt series.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class DataCollectionRequest {
    private String experimentType;
    private String fileExtension;
    private String acquisitionSoftware;
    private String imageDirectory;
    private String tag;
    private String source;
    private Double voltage;
    private Double pixelSizeOnImage;
    private Integer imageSizeX;
    private Integer imageSizeY;
    private Integer magnification;
    private Double totalExposedDose;
    private String c2aperture;
    private Double exposureTime;
    private Double slitWidth;
    private Boolean phasePlate;
}
