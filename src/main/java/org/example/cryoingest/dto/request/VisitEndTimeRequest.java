package org.example.cryoingest.dto.request;

import jakarta.validation.constraints.NotNull;
import lombok.Getter;
import lombok.Setter;

import java.time.Instant;

@Getter
@Setter
public class VisitEndTimeRequest {
    @NotNull(message = "end_time is required")
    private Instant endTime;
}
