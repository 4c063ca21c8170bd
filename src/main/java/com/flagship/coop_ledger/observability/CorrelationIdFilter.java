package com.flagship.coop_ledger.observability;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.MDC;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;

/**
 * Puts the correlation id and tenant of each request into MDC and echoes the
 * correlation id back in the response.
 *
 * Runs first so every other filter and handler logs with both values. Clears
 * the day book and settlement keys the services add along the way.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class CorrelationIdFilter extends OncePerRequestFilter {

    @Override
    protected void doFilterInternal(HttpServletRequest request,
                                    HttpServletResponse response,
                                    FilterChain filterChain)
            throws ServletException, IOException {

        try {
            String correlationId = request.getHeader(CorrelationContext.CORRELATION_ID_HEADER);
            CorrelationContext.setCorrelationId(correlationId);
            String effectiveId = CorrelationContext.getCorrelationId();

            MDC.put(CorrelationContext.CORRELATION_ID_MDC_KEY, effectiveId);
            String tenantId = request.getHeader(CorrelationContext.TENANT_ID_HEADER);
            if (tenantId != null && !tenantId.isBlank()) {
                MDC.put(CorrelationContext.TENANT_ID_MDC_KEY, tenantId);
            }

            response.setHeader(CorrelationContext.CORRELATION_ID_HEADER, effectiveId);

            filterChain.doFilter(request, response);

        } finally {
            CorrelationContext.clear();
            MDC.remove(CorrelationContext.CORRELATION_ID_MDC_KEY);
            MDC.remove(CorrelationContext.TENANT_ID_MDC_KEY);
            MDC.remove(CorrelationContext.DAY_BOOK_ID_MDC_KEY);
            MDC.remove(CorrelationContext.SETTLEMENT_ID_MDC_KEY);
        }
    }

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        return request.getRequestURI().startsWith("/actuator");
    }
}
