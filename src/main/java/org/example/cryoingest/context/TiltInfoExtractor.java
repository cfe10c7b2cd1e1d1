package org.example.cryoingest.context;

import java.nio.file.Path;

/**
 * Reads the tilt series number, tilt angle and series tag encoded in a movie's file
 * name. Implementations throw {@link IllegalArgumentException} for names that do
 * not follow their scheme.
 */
public interface TiltInfoExtractor {

    String series(Path movie);

    String angle(Path movie);

    String tag(Path movie);
}
