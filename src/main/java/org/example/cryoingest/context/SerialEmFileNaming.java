package org.example.cryoingest.context;

import java.nio.file.Path;
import java.util.regex.Pattern;

/**
 * SerialEM movies carry the series number as the first all-digit part and the tilt
 * angle as the last part. Parts are split on {@code _} when the name contains more
 * than one, otherwise on {@code -}. There is no tag.
 */
public final class SerialEmFileNaming implements TiltInfoExtractor {

    public static final SerialEmFileNaming INSTANCE = new SerialEmFileNaming();

    private SerialEmFileNaming() {
    }

    @Override
    public String series(Path movie) {
        String name = movie.getFileName().toString();
        String delimiter = delimiter(name);
        for (String s : name.split(Pattern.quote(delimiter))) {
            if (TomoFileNaming.isNumeric(s)) return s;
        }
        throw new IllegalArgumentException("No digits found in " + name + " after splitting on " + delimiter);
    }

    @Override
    public String angle(Path movie) {
        String name = movie.getFileName().toString();
        String last = name.substring(name.lastIndexOf(delimiter(name)) + 1);
        int dot = last.lastIndexOf('.');
        return dot < 0 ? "" : last.substring(0, dot);
    }

    @Override
    public String tag(Path movie) {
        return "";
    }

    static String delimiter(String name) {
        for (String d : new String[]{"_", "-"}) {
            if (count(name, d.charAt(0)) > 1) return d;
        }
        return "_";
    }

    private static int count(String s, char c) {
        int n = 0;
        for (int i = 0; i < s.length(); i++) {
            if (s.charAt(i) == c) n++;
        }
        return n;
    }
}
