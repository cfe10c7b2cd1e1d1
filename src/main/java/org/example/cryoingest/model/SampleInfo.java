package org.example.cryoingest.model;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

import java.nio.file.Path;

/**
 * Atlas location (relative to the visit directory) and sample slot of one source.
 */
@Getter
@AllArgsConstructor
@ToString
public class SampleInfo {
    private final Path atlas;
    private final int sample;
}
