package org.example.cryoingest.context;

import java.nio.file.Path;

final class TiltSeriesNames {

    private TiltSeriesNames() {
    }

    /**
     * Tilt series name from its tag and number. The joining underscore is kept
     * only when the file name itself contains it.
     */
    static String of(String tag, String series, Path movie) {
        if (tag == null || tag.isEmpty()) return series;
        String joined = tag + "_" + series;
        return movie.getFileName().toString().contains(joined) ? joined : tag + series;
    }
}
