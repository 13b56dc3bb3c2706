package com.warden.engine.infrastructure.web;

import com.warden.observability.CorrelationContext;
import com.warden.observability.CorrelationContextHolder;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Opens an {@code http} correlation context for every API request.
 *
 * <p>A caller-supplied {@code X-Correlation-ID} is reused when it looks like an identifier;
 * anything else (too long, or containing characters that would corrupt log lines) is replaced
 * with a generated id. The id in effect is echoed back on the response.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class CorrelationIdFilter extends OncePerRequestFilter {

    private static final Logger log = LoggerFactory.getLogger(CorrelationIdFilter.class);

    public static final String CORRELATION_ID_HEADER = "X-Correlation-ID";
    public static final String ORIGIN = "http";

    static final int MAX_ID_LENGTH = 128;
    private static final Pattern ACCEPTED_ID = Pattern.compile("[A-Za-z0-9._:-]+");

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain chain)
            throws ServletException, IOException {
        CorrelationContext context = contextFor(request.getHeader(CORRELATION_ID_HEADER));
        response.setHeader(CORRELATION_ID_HEADER, context.correlationId());
        CorrelationContextHolder.set(context);
        try {
            chain.doFilter(request, response);
        } finally {
            CorrelationContextHolder.clear();
        }
    }

    static CorrelationContext contextFor(String inbound) {
        if (inbound == null || inbound.isBlank()) {
            return CorrelationContext.generate(ORIGIN);
        }
        String candidate = inbound.trim();
        if (candidate.length() > MAX_ID_LENGTH || !ACCEPTED_ID.matcher(candidate).matches()) {
            log.debug("Ignoring unusable {} header of length {}", CORRELATION_ID_HEADER, candidate.length());
            return CorrelationContext.generate(ORIGIN);
        }
        return new CorrelationContext(candidate, ORIGIN);
    }
}
