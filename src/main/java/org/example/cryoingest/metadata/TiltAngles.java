package org.example.cryoingest.metadata;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

public final class TiltAngles {

    private TiltAngles() {
    }

    /**
     * Central angle of a tilt scheme. Returns 0 when the central angle or the one
     * after it is exactly zero, which is the case for symmetric schemes.
     */
    public static int midpoint(List<Double> angles) {
        if (angles == null || angles.isEmpty()) return 0;
        if (angles.size() <= 2) return (int) Math.rint(angles.get(0));
        List<Double> sorted = new ArrayList<>(angles);
        Collections.sort(sorted);
        int mid = sorted.size() / 2;
        double centre = sorted.get(mid);
        double next = sorted.get(mid + 1);
        if (centre == 0.0 || next == 0.0) return 0;
        return (int) Math.rint(centre);
    }
}
