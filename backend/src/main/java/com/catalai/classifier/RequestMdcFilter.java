package com.catalai.classifier;

import java.io.IOException;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.slf4j.MDC;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;

/** Puts the caller, the correlation id and the case id of the request into the MDC. */
@Component
@Order(1)
public class RequestMdcFilter extends OncePerRequestFilter {

  static final String USERNAME_MDC_KEY = "username";
  static final String CORRELATION_ID_MDC_KEY = "correlationId";
  static final String CASE_ID_MDC_KEY = "caseId";

  private static final String USERNAME_HEADER = "X-Username";
  private static final String CORRELATION_ID_HEADER = "X-Correlation-Id";
  private static final String DEFAULT_USERNAME = "anonymous";

  private static final Pattern CASE_PATH = Pattern.compile("^/api/process/([A-Za-z0-9-]+)(/.*)?$");

  @Override
  protected void doFilterInternal(
      HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
      throws ServletException, IOException {
    try {
      String username = request.getHeader(USERNAME_HEADER);
      MDC.put(USERNAME_MDC_KEY, username == null || username.isBlank() ? DEFAULT_USERNAME : username);

      String correlationId = request.getHeader(CORRELATION_ID_HEADER);
      if (correlationId != null && !correlationId.isBlank()) {
        MDC.put(CORRELATION_ID_MDC_KEY, correlationId);
      }

      Matcher matcher = CASE_PATH.matcher(request.getRequestURI());
      if (matcher.matches() && !"submit".equals(matcher.group(1))) {
        MDC.put(CASE_ID_MDC_KEY, matcher.group(1));
      }

      filterChain.doFilter(request, response);
    } finally {
      MDC.remove(USERNAME_MDC_KEY);
      MDC.remove(CORRELATION_ID_MDC_KEY);
      MDC.remove(CASE_ID_MDC_KEY);
    }
  }
}
