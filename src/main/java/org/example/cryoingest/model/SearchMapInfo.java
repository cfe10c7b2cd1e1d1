package org.example.cryoingest.model;

import lombok.Data;
import org.example.cryoingest.geometry.Matrix2;

/**
 * Accumulated knowledge about one tomography search map. Fields arrive from
 * different files and in any order.
 */
@Data
public class SearchMapInfo {
    private final String name;
    private Double xStagePosition;
    private Double yStagePosition;
    private Double pixelSize;
    private Double binning;
    private Integer width;
    private Integer height;
    private String image;
    private Matrix2 reference;
    private Matrix2 stageCorrection;
    private Matrix2 imageShiftCorrection;
    private Integer xLocation;
    private Integer yLocation;
    private Integer atlasWidth;
    private Integer atlasHeight;

    public boolean placementInputsKnown() {
        return xStagePosition != null && yStagePosition != null
                && pixelSize != null && width != null && height != null
                && reference != null && stageCorrection != null;
    }

    public boolean batchInputsKnown() {
        return placementInputsKnown() && imageShiftCorrection != null;
    }
}
