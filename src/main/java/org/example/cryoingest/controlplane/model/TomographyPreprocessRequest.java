package org.example.cryoingest.controlplane.model;

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
public class TomographyPreprocessRequest {
    private String path;
    private String description;
    private Long size;
    private Double timestamp;
    private Integer imageNumber;
    private Double pixelSize;
    private Long mcUuid;
    private Double dosePerFrame;
    private Integer mcBinning;
    private String gainRef;
    private String eerFractionationFile;
    private String tag;
    private String source;
}
