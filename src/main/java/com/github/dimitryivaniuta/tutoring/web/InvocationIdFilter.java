package com.github.dimitryivaniuta.tutoring.web;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.util.Optional;
import java.util.UUID;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Tags every HTTP invocation with an id for the logs and logs its outcome and duration.
 *
 * <p>Header: {@code X-Request-Id}. If missing, a new UUID is generated and echoed back.</p>
 */
@Slf4j
@Component
public class InvocationIdFilter extends OncePerRequestFilter {

    /**
     * Header carrying the invocation id.
     */
    public static final String REQUEST_ID_HEADER = "X-Request-Id";

    /**
     * MDC key, shared with the queue listener.
     */
    public static final String MDC_KEY = "invocationId";

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
            throws ServletException, IOException {

        String invocationId = Optional.ofNullable(request.getHeader(REQUEST_ID_HEADER))
                .filter(v -> !v.isBlank())
                .orElse(UUID.randomUUID().toString());

        MDC.put(MDC_KEY, invocationId);
        response.setHeader(REQUEST_ID_HEADER, invocationId);

        long t0 = System.nanoTime();
        try {
            filterChain.doFilter(request, response);
        } finally {
            long ms = (System.nanoTime() - t0) / 1_000_000;
            log.info("HTTP {} {} -> {} in {}ms", request.getMethod(), request.getRequestURI(), response.getStatus(), ms);
            MDC.remove(MDC_KEY);
        }
    }
}
