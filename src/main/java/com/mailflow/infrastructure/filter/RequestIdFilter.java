package com.mailflow.infrastructure.filter;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.mailflow.adapter.in.web.ErrorResponse;
import com.mailflow.infrastructure.config.AppProperties;
import com.mailflow.infrastructure.context.RequestContext;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.UUID;

/**
 * Tags every request with an {@code X-Request-Id}. Push deliveries must also carry the shared
 * {@code token} query parameter when {@code app.pubsub.push-token} is set.
 */
@Component
@Order(1)
public class RequestIdFilter extends OncePerRequestFilter {

    private static final Logger log = LoggerFactory.getLogger(RequestIdFilter.class);

    private static final String REQUEST_ID_HEADER = "X-Request-Id";
    private static final String PUSH_PATH = "/api/v1/push";
    private static final String PUSH_TOKEN_PARAM = "token";

    private final AppProperties appProperties;
    private final ObjectMapper objectMapper;

    public RequestIdFilter(AppProperties appProperties, ObjectMapper objectMapper) {
        this.appProperties = appProperties;
        this.objectMapper = objectMapper;
    }

    @Override
    protected void doFilterInternal(
            HttpServletRequest request,
            HttpServletResponse response,
            FilterChain filterChain) throws ServletException, IOException {

        String requestId = getOrGenerateRequestId(request);
        response.setHeader(REQUEST_ID_HEADER, requestId);

        String path = request.getRequestURI();
        if (path.startsWith(PUSH_PATH) && !hasValidPushToken(request)) {
            log.warn("Rejected push delivery with missing or wrong token: requestId={}", requestId);
            response.setStatus(HttpServletResponse.SC_UNAUTHORIZED);
            response.setContentType("application/json");
            objectMapper.writeValue(response.getWriter(),
                new ErrorResponse("UNAUTHORIZED", "Invalid push token", requestId));
            return;
        }

        RequestContext.set(requestId);
        try {
            filterChain.doFilter(request, response);
        } finally {
            RequestContext.clear();
        }
    }

    private boolean hasValidPushToken(HttpServletRequest request) {
        String expected = appProperties.getPubsub().getPushToken();
        if (expected == null || expected.isBlank()) {
            return true;
        }
        String supplied = request.getParameter(PUSH_TOKEN_PARAM);
        return supplied != null && MessageDigest.isEqual(
            expected.getBytes(StandardCharsets.UTF_8), supplied.getBytes(StandardCharsets.UTF_8));
    }

    private String getOrGenerateRequestId(HttpServletRequest request) {
        String requestId = request.getHeader(REQUEST_ID_HEADER);
        if (requestId == null || requestId.isBlank()) {
            requestId = UUID.randomUUID().toString();
        }
        return requestId;
    }
}
