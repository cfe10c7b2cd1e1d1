package org.example.cryoingest.controlplane.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Motion correction and CTF request for one single-particle movie. A null foil hole id means the position lookup failed.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class SpaPreprocessRequest {
    private String path;
    private String description;
    private Integer imageNumber;
    private Double pixelSize;
    private Double dosePerFrame;
    private Integer mcBinning;
    private String gainRef;
    private Boolean extractDownscale;
    private String eerFractionationFile;
    private String tag;
    private Integer foilHoleId;
    private Long mcUuid;
}
