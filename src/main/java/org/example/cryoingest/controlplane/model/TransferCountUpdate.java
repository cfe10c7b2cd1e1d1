package org.example.cryoingest.controlplane.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * File and byte counters for one source, reported after each scan or transfer batch.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class TransferCountUpdate {
    private String source;
    private String destination;
    private Long sessionId;
    private Integer incrementCount;
    private Long bytes;
    private Integer incrementDataCount;
    private Long dataBytes;
}
