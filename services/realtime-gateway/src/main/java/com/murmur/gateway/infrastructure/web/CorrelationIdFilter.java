package com.murmur.gateway.infrastructure.web;

import com.murmur.observability.CorrelationContext;
import com.murmur.observability.CorrelationContextHolder;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Establishes the correlation context for each HTTP request from {@code X-Correlation-ID}, or a
 * fresh id when the header is missing, and echoes it on the response. Events published while
 * handling the request inherit it.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class CorrelationIdFilter extends OncePerRequestFilter {

    public static final String CORRELATION_ID_HEADER = "X-Correlation-ID";

    @Override
    protected void doFilterInternal(
            HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
            throws ServletException, IOException {
        CorrelationContext context = CorrelationContext.ofNullable(request.getHeader(CORRELATION_ID_HEADER));
        CorrelationContextHolder.set(context);
        response.setHeader(CORRELATION_ID_HEADER, context.correlationId());
        try {
            filterChain.doFilter(request, response);
        } finally {
            // Tomcat reuses request threads
            CorrelationContextHolder.clear();
        }
    }
}
