package org.example.cryoingest.context;

/**
 * Thrown when no tilt naming scheme is known for the configured software version.
 */
public class UnknownSoftwareVersionException extends RuntimeException {

    public UnknownSoftwareVersionException(String software, String version) {
        super("Extraction routines for " + software + " version " + version + " unknown");
    }
}
