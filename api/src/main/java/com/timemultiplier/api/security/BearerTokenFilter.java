package com.timemultiplier.api.security;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.timemultiplier.api.model.ApiResponse;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.Set;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Checks {@code Authorization: Bearer <secret>} against the shared dashboard secret. Only
 * {@code /api/**} is guarded; health checks and CORS preflights pass through.
 */
@Slf4j
@Component
@Order(Ordered.HIGHEST_PRECEDENCE + 10)
public class BearerTokenFilter extends OncePerRequestFilter {

  private static final String API_PREFIX = "/api/";
  private static final String BEARER_PREFIX = "Bearer ";
  private static final Set<String> PUBLIC_PATHS = Set.of("/api/health");

  private final byte[] secret;
  private final ObjectMapper objectMapper;

  public BearerTokenFilter(
      @Value("${dashboard.secret:your-secret-key}") String secret, ObjectMapper objectMapper) {
    this.secret = secret.getBytes(StandardCharsets.UTF_8);
    this.objectMapper = objectMapper;
  }

  @Override
  protected boolean shouldNotFilter(HttpServletRequest request) {
    String path = request.getRequestURI().substring(request.getContextPath().length());
    return !path.startsWith(API_PREFIX)
        || PUBLIC_PATHS.contains(path)
        || HttpMethod.OPTIONS.matches(request.getMethod());
  }

  @Override
  protected void doFilterInternal(
      HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
      throws ServletException, IOException {
    String header = request.getHeader(HttpHeaders.AUTHORIZATION);
    if (header == null || !header.startsWith(BEARER_PREFIX)) {
      reject(request, response, "missing bearer token");
      return;
    }

    byte[] token = header.substring(BEARER_PREFIX.length()).trim().getBytes(StandardCharsets.UTF_8);
    if (!MessageDigest.isEqual(secret, token)) {
      reject(request, response, "token mismatch");
      return;
    }

    filterChain.doFilter(request, response);
  }

  private void reject(HttpServletRequest request, HttpServletResponse response, String reason)
      throws IOException {
    log.warn("Rejected {} {}: {}", request.getMethod(), request.getRequestURI(), reason);
    response.setStatus(HttpStatus.FORBIDDEN.value());
    response.setContentType(MediaType.APPLICATION_JSON_VALUE);
    response.setCharacterEncoding(StandardCharsets.UTF_8.name());
    objectMapper.writeValue(response.getWriter(), ApiResponse.error("Invalid authentication"));
  }
}
