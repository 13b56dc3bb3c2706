package com.warden.engine.infrastructure.web;

import com.warden.engine.domain.metrics.ApiCall;
import com.warden.engine.domain.metrics.ApiMetricsStore;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.time.Clock;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Records an {@link ApiCall} for every request under {@code /api/}. Recording is best-effort and
 * never changes the response.
 */
public class ApiMetricsFilter extends OncePerRequestFilter {

    private static final Logger log = LoggerFactory.getLogger(ApiMetricsFilter.class);

    static final String API_PREFIX = "/api/";

    private final ApiMetricsStore store;
    private final Clock clock;

    public ApiMetricsFilter(ApiMetricsStore store, Clock clock) {
        this.store = store;
        this.clock = clock;
    }

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        return !request.getRequestURI().startsWith(API_PREFIX);
    }

    @Override
    protected void doFilterInternal(
            HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
            throws ServletException, IOException {
        long start = System.nanoTime();
        try {
            filterChain.doFilter(request, response);
        } finally {
            long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);
            try {
                store.record(new ApiCall(
                        request.getRequestURI(), request.getMethod(), response.getStatus(), elapsedMs, clock.instant()));
            } catch (RuntimeException e) {
                log.warn("Failed to record API metrics for {} {}: {}",
                        request.getMethod(), request.getRequestURI(), e.getMessage());
            }
        }
    }
}
