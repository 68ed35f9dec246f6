package com.deepansh.sectools.auth;

import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.lang.NonNull;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.Map;

/**
 * Shared-secret bearer authentication in front of every endpoint.
 *
 * | Configured token | Authorization header    | Decision      |
 * |------------------|-------------------------|---------------|
 * | empty            | anything / absent       | AUTHENTICATED |
 * | set              | absent or not "Bearer " | UNAUTHORIZED  |
 * | set              | Bearer &lt;other&gt;          | FORBIDDEN     |
 * | set              | Bearer &lt;token&gt;          | AUTHENTICATED |
 *
 * The token comparison is constant-time. Neither the expected nor the
 * presented token is ever logged.
 */
@Slf4j
public class BearerAuthFilter extends OncePerRequestFilter {

    private static final String BEARER_PREFIX = "Bearer ";

    private final byte[] expectedToken;
    private final ObjectMapper objectMapper;

    public BearerAuthFilter(String authToken, ObjectMapper objectMapper) {
        this.expectedToken = authToken == null || authToken.isBlank()
                ? null
                : authToken.getBytes(StandardCharsets.UTF_8);
        this.objectMapper = objectMapper;
    }

    public boolean isEnabled() {
        return expectedToken != null;
    }

    public AuthDecision evaluate(String authorizationHeader) {
        if (expectedToken == null) {
            return AuthDecision.AUTHENTICATED;
        }
        if (authorizationHeader == null || !authorizationHeader.startsWith(BEARER_PREFIX)) {
            return AuthDecision.UNAUTHORIZED;
        }
        byte[] presented = authorizationHeader.substring(BEARER_PREFIX.length())
                .getBytes(StandardCharsets.UTF_8);
        return MessageDigest.isEqual(presented, expectedToken)
                ? AuthDecision.AUTHENTICATED
                : AuthDecision.FORBIDDEN;
    }

    @Override
    protected void doFilterInternal(
            @NonNull HttpServletRequest  request,
            @NonNull HttpServletResponse response,
            @NonNull FilterChain         chain) throws ServletException, IOException {

        AuthDecision decision = evaluate(request.getHeader(HttpHeaders.AUTHORIZATION));
        if (decision == AuthDecision.AUTHENTICATED) {
            chain.doFilter(request, response);
            return;
        }

        log.warn("[AUTH] Rejected {} {} from {}: {}",
                request.getMethod(), request.getRequestURI(), request.getRemoteAddr(), decision.kind());
        response.setStatus(decision.status().value());
        response.setContentType(MediaType.APPLICATION_JSON_VALUE);
        response.setCharacterEncoding(StandardCharsets.UTF_8.name());
        objectMapper.writeValue(response.getWriter(), Map.of("error", decision.message()));
    }
}
