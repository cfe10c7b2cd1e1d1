package org.example.cryoingest.model;

import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.nio.file.Path;

/**
 * A file the directory watcher has seen settle.
 */
@Getter
@AllArgsConstructor
@EqualsAndHashCode
@ToString
public class WatchedFile {
    private final Path path;
    private final long size;
    private final long modifiedMillis;
}
