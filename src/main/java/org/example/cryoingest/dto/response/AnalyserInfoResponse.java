package org.example.cryoingest.dto.response;

import lombok.Builder;
import lombok.Data;

@Data
@Builder
public class AnalyserInfoResponse {
    private String source;
    private int numFilesInQueue;
    private boolean alive;
    private boolean stopping;
}
