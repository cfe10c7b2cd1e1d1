package org.example.cryoingest.security;

import io.jsonwebtoken.Claims;
import io.jsonwebtoken.JwtException;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.security.web.authentication.WebAuthenticationDetailsSource;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Authenticates bearer tokens. A request below {@code /api/sessions/{id}} is only
 * authenticated when the token was issued for that session.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class JwtAuthFilter extends OncePerRequestFilter {

    private static final Pattern SESSION_PATH = Pattern.compile("^/sessions/(\\d+)(/.*)?$");

    private final JwtService jwtService;

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        String normalized = normalizedPath(request);
        String method = request.getMethod();

        return normalized.equals("/health")
                || (normalized.equals("/token") && method.equals("POST"))
                || (normalized.matches("/sessions/\\d+/token") && method.equals("POST"));
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request,
                                    HttpServletResponse response,
                                    FilterChain filterChain)
            throws ServletException, IOException {

        final String authHeader = request.getHeader("Authorization");
        if (authHeader == null || !authHeader.startsWith("Bearer ")) {
            filterChain.doFilter(request, response);
            return;
        }

        final String token = authHeader.substring(7);
        try {
            Claims claims = jwtService.parseAndValidate(token);
            String path = normalizedPath(request);
            Matcher m = SESSION_PATH.matcher(path);
            Long tokenSession = claims.get(JwtService.SESSION_CLAIM, Long.class);

            boolean allowed = !m.matches()
                    || (tokenSession != null && tokenSession == Long.parseLong(m.group(1)));
            if (allowed && SecurityContextHolder.getContext().getAuthentication() == null) {
                String principal = tokenSession == null ? claims.getSubject() : "session:" + tokenSession;
                var authToken = new UsernamePasswordAuthenticationToken(
                        principal, null, List.of(new SimpleGrantedAuthority("ROLE_INSTRUMENT")));
                authToken.setDetails(new WebAuthenticationDetailsSource().buildDetails(request));
                SecurityContextHolder.getContext().setAuthentication(authToken);
            } else if (!allowed) {
                log.debug("Token for session {} rejected on {}", tokenSession, path);
            }
        } catch (JwtException | IllegalArgumentException e) {
            log.debug("Invalid bearer token: {}", e.getMessage());
        }

        filterChain.doFilter(request, response);
    }

    private static String normalizedPath(HttpServletRequest request) {
        String path = request.getRequestURI().substring(request.getContextPath().length());
        return path.startsWith("/api") ? path.substring(4) : path;
    }
}
