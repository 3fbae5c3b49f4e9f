package com.shortly.backend.global.web;

import java.io.IOException;
import java.util.UUID;
import java.util.concurrent.TimeUnit;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.lang.NonNull;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Correlates log lines of a single exchange and writes one access line when it completes.
 * Health probes are not logged.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class RequestIdFilter extends OncePerRequestFilter {

    private static final Logger log = LoggerFactory.getLogger(RequestIdFilter.class);

    public static final String REQUEST_ID_HEADER = "X-Request-Id";
    static final String REQUEST_ID_MDC_KEY = "requestId";
    private static final int MAX_INBOUND_ID_LENGTH = 64;
    private static final String HEALTH_PATH = "/actuator/health";

    @Override
    protected void doFilterInternal(@NonNull HttpServletRequest request,
                                    @NonNull HttpServletResponse response,
                                    @NonNull FilterChain filterChain) throws ServletException, IOException {
        String correlationId = inboundOrGenerated(request);
        long startedAt = System.nanoTime();
        MDC.put(REQUEST_ID_MDC_KEY, correlationId);
        response.setHeader(REQUEST_ID_HEADER, correlationId);
        try {
            filterChain.doFilter(request, response);
        } finally {
            if (!request.getRequestURI().startsWith(HEALTH_PATH)) {
                long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startedAt);
                log.info("{} {} -> {} ({} ms)", request.getMethod(), request.getRequestURI(),
                        response.getStatus(), elapsedMs);
            }
            MDC.remove(REQUEST_ID_MDC_KEY);
        }
    }

    private String inboundOrGenerated(HttpServletRequest request) {
        String inbound = request.getHeader(REQUEST_ID_HEADER);
        if (!StringUtils.hasText(inbound)) {
            return UUID.randomUUID().toString();
        }
        String trimmed = inbound.trim();
        return trimmed.length() <= MAX_INBOUND_ID_LENGTH ? trimmed : UUID.randomUUID().toString();
    }
}
