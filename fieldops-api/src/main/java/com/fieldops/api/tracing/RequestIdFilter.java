package com.fieldops.api.tracing;

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
import java.util.UUID;
import java.util.regex.Pattern;

/**
 * Correlation id for every HTTP request: taken from {@code X-Request-Id} or {@code X-Correlation-Id} when the
 * caller sends a usable one, generated otherwise. Available as MDC {@code requestId} and through
 * {@link RequestContext} (audit rows, error bodies) and echoed in the response.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class RequestIdFilter extends OncePerRequestFilter {

  public static final String HDR_REQUEST_ID = "X-Request-Id";
  public static final String HDR_CORRELATION_ID = "X-Correlation-Id";
  public static final String MDC_REQUEST_ID = "requestId";

  // ids end up in log lines and audit rows
  private static final Pattern USABLE = Pattern.compile("[A-Za-z0-9._:-]{1,128}");

  @Override
  protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain chain)
      throws ServletException, IOException {
    String requestId = resolve(request);
    response.setHeader(HDR_REQUEST_ID, requestId);
    MDC.put(MDC_REQUEST_ID, requestId);
    RequestContext.set(requestId);
    try {
      chain.doFilter(request, response);
    } finally {
      RequestContext.clear();
      MDC.remove(MDC_REQUEST_ID);
    }
  }

  static String resolve(HttpServletRequest request) {
    for (String header : new String[] {HDR_REQUEST_ID, HDR_CORRELATION_ID}) {
      String value = request.getHeader(header);
      if (value == null) continue;
      value = value.trim();
      if (USABLE.matcher(value).matches()) return value;
    }
    return UUID.randomUUID().toString();
  }
}
