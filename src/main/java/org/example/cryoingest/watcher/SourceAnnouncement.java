package org.example.cryoingest.watcher;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.nio.file.Path;

/**
 * A directory found by the multigrid watcher that should get its own transfer
 * pipeline.
 */
@Getter
@Builder
@ToString
public class SourceAnnouncement {

    public static final String ATLAS = "atlas";
    public static final String METADATA = "metadata";
    public static final String FRACTIONS = "fractions";

    private final Path source;
    private final String tag;

    /** Extra path element appended to the suggested destination, if any. */
    private final String extraDirectory;

    private final boolean analyse;

    /** Metadata directories are analysed for metadata files only. */
    private final boolean limited;

    private final boolean removeFiles;

    @Builder.Default
    private final boolean useSuggestedPath = true;
}
