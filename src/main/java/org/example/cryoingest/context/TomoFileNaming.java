package org.example.cryoingest.context;

import java.nio.file.Path;
import java.util.Arrays;

/**
 * File name schemes of the Tomo acquisition software by version.
 * <ul>
 *     <li>5.7: {@code Position_1_001[30.00]_fractions.tiff}</li>
 *     <li>5.11: {@code Position12_3_-30.00_fractions.tiff}</li>
 *     <li>5.12: {@code Position_1_2_003_30.00_fractions.tiff}</li>
 * </ul>
 */
public enum TomoFileNaming implements TiltInfoExtractor {

    V5_7("5.7") {
        @Override
        public String series(Path movie) {
            return part(movie, 1);
        }

        @Override
        public String angle(Path movie) {
            String name = movie.getFileName().toString();
            int open = name.indexOf('[');
            int close = name.indexOf(']', open + 1);
            if (open < 0 || close < 0) {
                throw new IllegalArgumentException("No bracketed tilt angle in " + name);
            }
            return name.substring(open + 1, close);
        }

        @Override
        public String tag(Path movie) {
            return part(movie, 0);
        }
    },

    V5_11("5.11") {
        @Override
        public String series(Path movie) {
            String tag = part(movie, 0);
            return tag.substring(numericSuffixStart(tag));
        }

        @Override
        public String angle(Path movie) {
            String third = part(movie, 2);
            int dot = third.lastIndexOf('.');
            return dot < 0 ? "" : third.substring(0, dot);
        }

        @Override
        public String tag(Path movie) {
            String tag = part(movie, 0);
            return tag.substring(0, numericSuffixStart(tag));
        }
    },

    V5_12("5.12") {
        @Override
        public String series(Path movie) {
            String[] parts = split(movie);
            int angle = angleIndex(parts);
            return isNumeric(parts[angle - 2]) ? parts[angle - 2] : "0";
        }

        @Override
        public String angle(Path movie) {
            String[] parts = split(movie);
            return parts[angleIndex(parts)];
        }

        @Override
        public String tag(Path movie) {
            String[] parts = split(movie);
            int angle = angleIndex(parts);
            int end = isNumeric(parts[angle - 2]) ? angle - 2 : angle - 1;
            return String.join("_", Arrays.copyOfRange(parts, 0, end));
        }
    };

    private final String version;

    TomoFileNaming(String version) {
        this.version = version;
    }

    public String version() {
        return version;
    }

    /**
     * Scheme for a configured version; 5.7 when none is configured.
     */
    public static TomoFileNaming forVersion(String version) {
        if (version == null || version.isBlank()) return V5_7;
        for (TomoFileNaming naming : values()) {
            if (naming.version.equals(version.trim())) return naming;
        }
        throw new UnknownSoftwareVersionException("TFS Tomo", version);
    }

    static String[] split(Path movie) {
        return movie.getFileName().toString().split("_", -1);
    }

    static String part(Path movie, int index) {
        String[] parts = split(movie);
        if (index >= parts.length) {
            throw new IllegalArgumentException("Unexpected file name " + movie.getFileName());
        }
        return parts[index];
    }

    static boolean isNumeric(String s) {
        return !s.isEmpty() && s.chars().allMatch(Character::isDigit);
    }

    /**
     * Start of the trailing run of digits in {@code tag}.
     */
    static int numericSuffixStart(String tag) {
        int i = tag.length();
        while (i > 0 && Character.isDigit(tag.charAt(i - 1))) i--;
        if (i == tag.length() || i == 0) {
            throw new IllegalArgumentException("The file tag " + tag
                    + " does not end in numeric characters or is entirely numeric: cannot parse");
        }
        return i;
    }

    /**
     * The first underscore-separated part containing a dot holds the angle.
     */
    static int angleIndex(String[] parts) {
        for (int i = 0; i < parts.length; i++) {
            if (parts[i].contains(".")) {
                if (i < 2) break;
                return i;
            }
        }
        throw new IllegalArgumentException("No tilt angle found in " + String.join("_", parts));
    }
}
