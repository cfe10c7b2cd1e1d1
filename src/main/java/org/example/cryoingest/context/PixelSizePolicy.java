package org.example.cryoingest.context;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;
import org.example.cryoingest.controlplane.MachineConfig;

/**
 * Pixel size and binning derivation shared by the acquisition contexts.
 * <p>
 * The raw pixel size from the metadata is replaced by the magnification calibration
 * when one exists. Cameras capable of super-resolution that record in counting mode
 * report a binning of 2 relative to the super-resolution gain reference, and the
 * motion correction binning passed downstream is the inverse of the XML binning.
 */
public final class PixelSizePolicy {

    static final double ANGSTROM = 1e-10;

    private PixelSizePolicy() {
    }

    @Getter
    @AllArgsConstructor
    @ToString
    public static class Geometry {
        private final double pixelSize;
        private final int imageSizeX;
        private final int imageSizeY;
        private final int motionCorrBinning;
    }

    public static int motionCorrectionBinning(int binningXml) {
        return binningXml == 2 ? 1 : 2;
    }

    /**
     * EPU movie geometry.
     *
     * @param pixelSize     pixel size in metres as written in the XML
     * @param magnification nominal magnification, 0 when unknown
     */
    public static Geometry spa(MachineConfig machine,
                               boolean sessionSuperres,
                               int binningXml,
                               double pixelSize,
                               int magnification,
                               int imageSizeX,
                               int imageSizeY) {
        int binningFactor = 1;
        boolean countingOnSuperresCamera = machine.isSuperres() && !sessionSuperres;
        if (countingOnSuperresCamera) {
            binningFactor = 2;
        } else if (!machine.isSuperres()) {
            binningXml = 2;
        }

        double derived = pixelSize;
        if (magnification != 0) {
            Double calibrated = machine.magnificationPixelSize(magnification);
            if (calibrated != null) {
                derived = calibrated * ANGSTROM;
                // movies saved unbinned on a super-resolution camera have half the calibrated pixel size
                if (countingOnSuperresCamera) {
                    derived /= binningXml == 2 ? 1 : 2;
                }
            } else {
                derived /= binningFactor;
            }
        }
        return new Geometry(derived,
                imageSizeX * binningFactor,
                imageSizeY * binningFactor,
                motionCorrectionBinning(binningXml));
    }

    /**
     * Tomography geometry from an mdoc. Only super-resolution recordings on a
     * super-resolution camera are binned by 2 in motion correction.
     *
     * @param pixelSpacing pixel spacing in Angstrom from the mdoc
     */
    public static Geometry tomography(MachineConfig machine,
                                      boolean sessionSuperres,
                                      int mdocBinning,
                                      double pixelSpacing,
                                      int magnification,
                                      int imageSizeX,
                                      int imageSizeY) {
        int binningFactor = machine.isSuperres() && mdocBinning == 1 && sessionSuperres ? 2 : 1;
        Double calibrated = machine.magnificationPixelSize(magnification);
        double angstrom = calibrated != null ? calibrated : pixelSpacing;
        return new Geometry(angstrom * ANGSTROM / binningFactor, imageSizeX, imageSizeY, binningFactor);
    }
}
