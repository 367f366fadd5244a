package com.driftops.config;

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
 * Stamps every API response with an {@code X-Request-ID} and, when enabled, requires an
 * operator API key on state-changing calls (rollback, resume, manual cycles, data uploads).
 * Read-only dashboard and routing queries stay open.
 */
@Slf4j
@Component
public class OperatorGuardFilter extends OncePerRequestFilter {

    public static final String REQUEST_ID_HEADER = "X-Request-ID";
    private static final String REQUEST_ID_ATTRIBUTE = OperatorGuardFilter.class.getName() + ".requestId";

    @Value("${security.operator-key.enabled:false}")
    private boolean keyEnabled;

    @Value("${security.operator-key.header:X-API-Key}")
    private String keyHeader;

    @Value("${security.operator-key.values:}")
    private String keyValues;

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
        request.setAttribute(REQUEST_ID_ATTRIBUTE, requestId);
        response.setHeader(REQUEST_ID_HEADER, requestId);

        if (keyEnabled && requiresOperator(request) && !isValidKey(request.getHeader(keyHeader))) {
            writeError(response, request.getRequestURI(), requestId);
            return;
        }
        filterChain.doFilter(request, response);
    }

    static boolean requiresOperator(HttpServletRequest request) {
        String method = request.getMethod();
        if ("GET".equals(method) || "HEAD".equals(method) || "OPTIONS".equals(method)) {
            return false;
        }
        // serving traffic reports routes and outcomes without operator rights
        return !request.getRequestURI().startsWith("/api/v1/routing/");
    }

    private boolean isValidKey(String provided) {
        if (provided == null || provided.isBlank()) {
            return false;
        }
        Set<String> allowed = Arrays.stream(keyValues.split(","))
                .map(String::trim)
                .filter(v -> !v.isBlank())
                .collect(Collectors.toSet());
        return allowed.contains(provided);
    }

    public static String resolveRequestId(HttpServletRequest request) {
        Object assigned = request.getAttribute(REQUEST_ID_ATTRIBUTE);
        if (assigned != null) {
            return assigned.toString();
        }
        String id = request.getHeader(REQUEST_ID_HEADER);
        return (id != null && !id.isBlank()) ? id : UUID.randomUUID().toString();
    }

    private void writeError(HttpServletResponse response, String path, String requestId) throws IOException {
        response.setStatus(HttpServletResponse.SC_UNAUTHORIZED);
        response.setContentType(MediaType.APPLICATION_JSON_VALUE);
        Map<String, Object> body = Map.of(
                "status", HttpServletResponse.SC_UNAUTHORIZED,
                "error", "Unauthorized",
                "code", "OPERATOR_KEY_REQUIRED",
                "message", "Missing or invalid operator API key",
                "path", path,
                "requestId", requestId,
                "timestamp", Instant.now().toString()
        );
        mapper.writeValue(response.getWriter(), body);
        log.warn("Operator key rejected | path={} | requestId={}", path, requestId);
    }
}
