package com.aegis.authservice.infrastructure.web;

import com.aegis.observability.CorrelationContext;
import com.aegis.observability.CorrelationContextHolder;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.util.UUID;
import java.util.regex.Pattern;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Propagates or generates a correlation ID for every HTTP request.
 *
 * <p>A client-supplied {@code X-Correlation-ID} is reused when it is a short token of safe
 * characters; anything else is replaced by a fresh UUID. The id is echoed on the response and
 * placed in {@link CorrelationContextHolder}, which copies it into the SLF4J MDC. Controllers
 * add the user and tenant once the bearer token has been validated.
 *
 * <p>Runs at {@link Ordered#HIGHEST_PRECEDENCE} so the context exists for every later filter
 * and handler.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class CorrelationIdFilter extends OncePerRequestFilter {

    public static final String CORRELATION_ID_HEADER = "X-Correlation-ID";

    private static final Pattern SAFE_ID = Pattern.compile("[A-Za-z0-9._:-]{1,64}");

    @Override
    protected void doFilterInternal(
            HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
            throws ServletException, IOException {

        String correlationId = request.getHeader(CORRELATION_ID_HEADER);
        if (correlationId == null || !SAFE_ID.matcher(correlationId).matches()) {
            correlationId = UUID.randomUUID().toString();
        }

        CorrelationContextHolder.set(
                CorrelationContext.anonymous(correlationId, UUID.randomUUID().toString()));
        response.setHeader(CORRELATION_ID_HEADER, correlationId);

        try {
            filterChain.doFilter(request, response);
        } finally {
            // pooled threads
            CorrelationContextHolder.clear();
        }
    }
}
