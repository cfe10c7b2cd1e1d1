package org.example.cryoingest.dto.request;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Getter;
import lombok.Setter;
import org.example.cryoingest.model.ProcessingParameters;

@Getter
@Setter
public class ProcessingParametersRequest {
    @NotBlank(message = "label must not be empty")
    private String label;

    @Valid
    @NotNull(message = "params are required")
    private ProcessingParameters params;
}
