package com.wcoptimizer.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.time.Instant;
import java.util.Arrays;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Stamps every API request with an {@code X-Request-ID} and, when enabled,
 * rejects callers without a configured API key.
 */
@Slf4j
@Component
public class RequestGuardFilter extends OncePerRequestFilter {

    static final String REQUEST_ID_HEADER = "X-Request-ID";

    @Value("${wc.security.api-key.enabled:false}")
    private boolean apiKeyEnabled;

    @Value("${wc.security.api-key.header:X-API-Key}")
    private String apiKeyHeader;

    @Value("${wc.security.api-key.values:}")
    private String apiKeyValues;

    private final ObjectMapper mapper = new ObjectMapper();

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        return !request.getRequestURI().startsWith("/api/");
    }

    @Override
    protected void doFilterInternal(
            HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
            throws ServletException, IOException {

        String requestId = resolveRequestId(request);
        response.setHeader(REQUEST_ID_HEADER, requestId);

        if (apiKeyEnabled && !isValidApiKey(request.getHeader(apiKeyHeader))) {
            writeError(response, HttpServletResponse.SC_UNAUTHORIZED,
                    "Unauthorized", "Missing or invalid API key", request.getRequestURI(), requestId);
            return;
        }

        filterChain.doFilter(request, response);
    }

    private boolean isValidApiKey(String provided) {
        if (provided == null || provided.isBlank()) {
            return false;
        }
        Set<String> allowed = Arrays.stream(apiKeyValues.split(","))
                .map(String::trim)
                .filter(v -> !v.isBlank())
                .collect(Collectors.toSet());
        return !allowed.isEmpty() && allowed.contains(provided);
    }

    private String resolveRequestId(HttpServletRequest request) {
        String existing = request.getHeader(REQUEST_ID_HEADER);
        return (existing != null && !existing.isBlank()) ? existing : UUID.randomUUID().toString();
    }

    private void writeError(HttpServletResponse response, int status, String error, String message,
                            String path, String requestId) throws IOException {
        response.setStatus(status);
        response.setContentType(MediaType.APPLICATION_JSON_VALUE);
        Map<String, Object> body = Map.of(
                "status", status,
                "error", error,
                "code", "UNAUTHORIZED",
                "message", message,
                "path", path,
                "request_id", requestId,
                "timestamp", Instant.now().toString()
        );
        mapper.writeValue(response.getWriter(), body);
        log.warn("{} | status={} | path={} | requestId={}", message, status, path, requestId);
    }
}
