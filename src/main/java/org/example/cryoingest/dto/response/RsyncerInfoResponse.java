package org.example.cryoingest.dto.response;

import lombok.Builder;
import lombok.Data;

@Data
@Builder
public class RsyncerInfoResponse {
    private String source;
    private long numFilesTransferred;
    private int numFilesInQueue;
    private boolean alive;
    private boolean stopping;
    private int numFilesSkipped;
    private String status;
}
