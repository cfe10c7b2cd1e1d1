package org.example.cryoingest.multigrid;

import lombok.Builder;
import lombok.Getter;

import java.nio.file.Path;

/**
 * Timings and transfer mode shared by every pipeline of a controller.
 */
@Getter
@Builder
public class PipelineSettings {

    public enum TransferMode {
        RSYNC, LOCAL
    }

    @Builder.Default
    private final long settlingSeconds = 30;
    @Builder.Default
    private final long scanIntervalSeconds = 15;
    @Builder.Default
    private final long multigridScanIntervalSeconds = 15;
    @Builder.Default
    private final int batchSize = 100;
    @Builder.Default
    private final int maxBackoffSeconds = 120;
    @Builder.Default
    private final TransferMode transferMode = TransferMode.RSYNC;

    /** Destination root in local mode. */
    private final Path localRoot;

    /** rsync daemon host used when the machine configuration has no rsync URL. */
    private final String defaultRsyncHost;

    /** Whether files are actually copied; false only reports them as transferred. */
    @Builder.Default
    private final boolean doTransfer = true;
}
