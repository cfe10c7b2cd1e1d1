package org.example.cryoingest.dto.request;

import jakarta.validation.constraints.NotBlank;
import lombok.Getter;
import lombok.Setter;

@Getter
@Setter
public class RsyncerSourceRequest {
    @NotBlank(message = "source must not be empty")
    private String source;
}
