package org.example.cryoingest.security;

import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Control-plane tokens received during handshakes. Session tokens take precedence
 * over the instrument-wide one.
 */
@Component
public class TokenStore {

    private final Map<Long, String> sessionTokens = new ConcurrentHashMap<>();
    private volatile String instrumentToken;

    public void putInstrumentToken(String token) {
        this.instrumentToken = token;
    }

    public void putSessionToken(long sessionId, String token) {
        sessionTokens.put(sessionId, token);
    }

    public Optional<String> tokenFor(long sessionId) {
        String token = sessionTokens.get(sessionId);
        return Optional.ofNullable(token != null ? token : instrumentToken);
    }
}
