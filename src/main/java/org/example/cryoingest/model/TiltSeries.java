package org.example.cryoingest.model;

import lombok.Getter;
import lombok.Setter;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Movies of one tilt series in arrival order. Mutated only by the owning
 * tomography context.
 */
@Getter
public class TiltSeries {

    private final String tag;
    private final List<Path> movies = new ArrayList<>();
    private final List<Double> angles = new ArrayList<>();

    @Setter
    private Integer expectedLength;

    @Setter
    private boolean completed;

    public TiltSeries(String tag) {
        this.tag = tag;
    }

    public boolean contains(Path movie) {
        return movies.contains(movie);
    }

    public boolean hasAngle(double angle) {
        return angles.contains(angle);
    }

    public void append(Path movie, double angle) {
        movies.add(movie);
        angles.add(angle);
    }

    public int size() {
        return movies.size();
    }

    public List<Path> getMovies() {
        return Collections.unmodifiableList(movies);
    }

    public List<Double> getAngles() {
        return Collections.unmodifiableList(angles);
    }
}
