package org.example.cryoingest.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Acquisition parameters harvested from the first metadata file of a source and
 * completed with defaults or user-supplied processing parameters. Serialised with
 * snake_case names for control-plane payloads.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class DataCollectionParameters {

    private String source;
    private String experimentType;
    private String acquisitionSoftware;
    private String fileExtension;

    private Double voltage;
    private Double pixelSizeOnImage;
    private Integer imageSizeX;
    private Integer imageSizeY;
    private Integer magnification;
    private Integer motionCorrBinning;

    private String gainRef;
    private String gainRefSuperres;
    private Double dosePerFrame;
    private Integer eerFractionation;
    private Integer numEerFrames;

    private String symmetry;
    private Double particleDiameter;
    private Boolean estimateParticleDiameter;
    private Boolean useCryolo;
    private Integer maskDiameter;
    private Integer boxsize;
    private Boolean downscale;
    private Integer smallBoxsize;

    private Double totalExposedDose;
    private String c2aperture;
    private Double exposureTime;
    private Double slitWidth;
    private Boolean phasePlate;

    private Integer manualTiltOffset;
    private Double tiltAxis;
    private Integer frameCount;

    /**
     * Overlays the user's processing parameters. Only values the user actually set
     * replace harvested or default ones.
     */
    public DataCollectionParameters withProcessingParameters(ProcessingParameters user) {
        if (user == null) return this;
        DataCollectionParametersBuilder b = toBuilder();
        if (user.getGainRef() != null && !user.getGainRef().isBlank()) b.gainRef(user.getGainRef());
        if (user.getDosePerFrame() != null) b.dosePerFrame(user.getDosePerFrame());
        if (user.getSymmetry() != null) b.symmetry(user.getSymmetry());
        if (user.getEerFractionation() != null) b.eerFractionation(user.getEerFractionation());
        if (user.getExtractDownscale() != null) b.downscale(user.getExtractDownscale());
        if (user.getParticleDiameter() != null) {
            b.particleDiameter(user.getParticleDiameter());
            b.estimateParticleDiameter(user.getParticleDiameter() <= 0);
        }
        return b.build();
    }
}
