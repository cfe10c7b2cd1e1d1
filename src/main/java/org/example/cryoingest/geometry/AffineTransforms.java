package org.example.cryoingest.geometry;

/**
 * 2x2 affine helpers used to place sub-images on a parent overview image.
 */
public final class AffineTransforms {

    private AffineTransforms() {
    }

    /**
     * Applies the reference transform, the correction, then undoes the reference:
     * {@code R^-1 . (S . (R . v))}.
     */
    public static Vector2 corrected(Matrix2 reference, Matrix2 correction, Vector2 v) {
        return reference.inverse().apply(correction.apply(reference.apply(v)));
    }

    /**
     * Stage displacement of {@code target} from {@code origin} expressed in the parent
     * image frame: {@code R^-1 . S1^-1 . S2^-1 . R . (target - origin)}.
     */
    public static Vector2 relativeOffset(Matrix2 reference,
                                         Matrix2 stageCorrection,
                                         Matrix2 imageShiftCorrection,
                                         Vector2 origin,
                                         Vector2 target) {
        Matrix2 chain = reference.inverse()
                .multiply(stageCorrection.inverse())
                .multiply(imageShiftCorrection.inverse())
                .multiply(reference);
        return chain.apply(target.minus(origin));
    }
}
