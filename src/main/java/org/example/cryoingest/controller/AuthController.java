package org.example.cryoingest.controller;

import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.example.cryoingest.dto.request.TokenRequest;
import org.example.cryoingest.dto.response.TokenResponse;
import org.example.cryoingest.security.JwtService;
import org.example.cryoingest.service.InstrumentService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
public class AuthController {

    private final InstrumentService instrumentService;
    private final JwtService jwtService;

    @GetMapping("/health")
    public boolean health() {
        return true;
    }

    @PostMapping("/token")
    public ResponseEntity<TokenResponse> token(@Valid @RequestBody TokenRequest req) {
        if (!instrumentService.handshake(req.getToken())) {
            return ResponseEntity.status(401).build();
        }
        return ResponseEntity.ok(new TokenResponse(jwtService.generateInstrumentToken(), "bearer"));
    }

    @PostMapping("/sessions/{sessionId}/token")
    public ResponseEntity<TokenResponse> sessionToken(@PathVariable long sessionId,
                                                      @Valid @RequestBody TokenRequest req) {
        if (!instrumentService.sessionHandshake(sessionId, req.getToken())) {
            return ResponseEntity.status(401).build();
        }
        return ResponseEntity.ok(new TokenResponse(jwtService.generateSessionToken(sessionId), "bearer"));
    }

    @GetMapping("/sessions/{sessionId}/check_token")
    public Map<String, Boolean> checkToken(@PathVariable long sessionId) {
        return Map.of("token_valid", true);
    }
}
