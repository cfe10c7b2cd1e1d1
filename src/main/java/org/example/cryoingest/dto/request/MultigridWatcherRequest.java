package org.example.cryoingest.dto.request;

import jakarta.validation.constraints.NotBlank;
import lombok.Getter;
import lombok.Setter;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

/**
 * Session directory to watch and how its sources are set up.
 */
@Getter
@Setter
public class MultigridWatcherRequest {
    @NotBlank(message = "source must not be empty")
    private String source;

    @NotBlank(message = "visit must not be empty")
    private String visit;

    /** Falls back to the configured instrument name. */
    private String instrumentName;

    /** Processing parameter label registered earlier for this session. */
    private String label;

    private boolean skipExistingProcessing;

    /** Source directory to destination, bypassing the suggested path. */
    private Map<String, String> destinationOverrides = new HashMap<>();

    private Instant visitEndTime;
}
