package org.erpsuite.currency.http;

import java.io.IOException;
import java.util.UUID;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;

import org.slf4j.MDC;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Puts the request's correlation id and tenant id into the logging MDC.
 *
 * <p>The correlation id is taken from the {@value TenantHeaders#CORRELATION_ID} header, or
 * generated when absent, and echoed on the response.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class CorrelationIdFilter extends OncePerRequestFilter {

  public static final String CORRELATION_ID_MDC_KEY = "correlationId";
  public static final String TENANT_ID_MDC_KEY = "tenantId";

  @Override
  protected void doFilterInternal(
      HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
      throws ServletException, IOException {
    var correlationId = request.getHeader(TenantHeaders.CORRELATION_ID);
    if (correlationId == null || correlationId.isBlank()) {
      correlationId = UUID.randomUUID().toString();
    }

    MDC.put(CORRELATION_ID_MDC_KEY, correlationId);
    var tenantId = request.getHeader(TenantHeaders.TENANT_ID);
    if (tenantId != null) {
      MDC.put(TENANT_ID_MDC_KEY, tenantId);
    }
    response.setHeader(TenantHeaders.CORRELATION_ID, correlationId);

    try {
      filterChain.doFilter(request, response);
    } finally {
      MDC.remove(CORRELATION_ID_MDC_KEY);
      MDC.remove(TENANT_ID_MDC_KEY);
    }
  }
}
