package org.example.cryoingest.controlplane;

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;

/**
 * Builds control-plane clients bound to a token received during a handshake.
 */
@Component
@RequiredArgsConstructor
public class ControlPlaneClientFactory {

    private final RestClient.Builder restClientBuilder;
    private final ObjectMapper objectMapper;

    @Value("${ingest.control-plane.url}")
    private String controlPlaneUrl;

    public ControlPlaneClient create(String token) {
        return new RestControlPlaneClient(restClientBuilder.clone(), controlPlaneUrl, token, objectMapper);
    }
}
