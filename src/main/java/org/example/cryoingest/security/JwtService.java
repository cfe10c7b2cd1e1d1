package org.example.cryoingest.security;

import io.jsonwebtoken.Claims;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.security.Keys;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import javax.crypto.SecretKey;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.Date;

/**
 * Issues and checks the tokens the control plane presents to this server.
 */
@Service
public class JwtService {

    public static final String SESSION_CLAIM = "session";
    static final String INSTRUMENT_SUBJECT = "instrument";

    @Value("${app.jwt.secret}")
    private String secret;

    @Value("${app.jwt.ttl-seconds:86400}")
    private long ttlSeconds;

    private SecretKey key() {
        return Keys.hmacShaKeyFor(secret.getBytes(StandardCharsets.UTF_8));
    }

    public String generateInstrumentToken() {
        Instant now = Instant.now();
        return Jwts.builder()
                .subject(INSTRUMENT_SUBJECT)
                .issuedAt(Date.from(now))
                .expiration(Date.from(now.plusSeconds(ttlSeconds)))
                .signWith(key())
                .compact();
    }

    public String generateSessionToken(long sessionId) {
        Instant now = Instant.now();
        return Jwts.builder()
                .subject(INSTRUMENT_SUBJECT)
                .claim(SESSION_CLAIM, sessionId)
                .issuedAt(Date.from(now))
                .expiration(Date.from(now.plusSeconds(ttlSeconds)))
                .signWith(key())
                .compact();
    }

    public Claims parseAndValidate(String token) {
        return Jwts.parser()
                .verifyWith(key())
                .build()
                .parseSignedClaims(token)
                .getPayload();
    }
}
