package org.example.cryoingest.model;

/**
 * What a source directory produces: detector movies, or microscope-side metadata
 * and overview images.
 */
public enum Role {
    DETECTOR,
    MICROSCOPE
}
