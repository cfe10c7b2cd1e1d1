package org.example.cryoingest.model;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.nio.file.Path;

/**
 * Result of copying one file. {@code filePath} is relative to {@code basePath}, the
 * source directory of the transfer engine that produced it.
 */
@Getter
@Builder
@ToString
public class TransferOutcome {
    private final Path filePath;
    private final Path basePath;
    private final long fileSize;
    private final TransferResult outcome;
    private final long transferTotal;
    private final int queueSize;

    public boolean isSuccess() {
        return outcome == TransferResult.SUCCESS;
    }

    public Path absolutePath() {
        return basePath.resolve(filePath);
    }

    /**
     * Wraps a file that reached the analyser without being copied, as happens when
     * transfer is disabled for the instrument.
     */
    public static TransferOutcome untransferred(Path basePath, Path absolute) {
        return TransferOutcome.builder()
                .basePath(basePath)
                .filePath(basePath.relativize(absolute))
                .fileSize(0)
                .outcome(TransferResult.SUCCESS)
                .build();
    }
}
