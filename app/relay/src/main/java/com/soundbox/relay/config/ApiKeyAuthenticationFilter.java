package com.soundbox.relay.config;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Authenticates the cashier integration and operators by shared key headers.
 *
 * <p>Device polls are not handled here: their credential is per store and is checked by the
 * claim protocol itself.
 */
public class ApiKeyAuthenticationFilter extends OncePerRequestFilter {

  private static final Logger logger = LoggerFactory.getLogger(ApiKeyAuthenticationFilter.class);
  static final String CASHIER_ROLE = "ROLE_CASHIER";
  static final String ADMIN_ROLE = "ROLE_ADMIN";

  private final RelayApiProperties properties;

  public ApiKeyAuthenticationFilter(RelayApiProperties properties) {
    this.properties = properties;
  }

  @Override
  protected boolean shouldNotFilter(HttpServletRequest request) {
    return !isCashierRequest(request) && !isAdminRequest(request);
  }

  @Override
  protected void doFilterInternal(
      HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
      throws ServletException, IOException {
    final UsernamePasswordAuthenticationToken authentication = resolveAuthentication(request);
    if (authentication != null) {
      SecurityContextHolder.getContext().setAuthentication(authentication);
    } else {
      logger.debug("api key authentication not established for path={}", request.getRequestURI());
    }
    filterChain.doFilter(request, response);
  }

  private UsernamePasswordAuthenticationToken resolveAuthentication(HttpServletRequest request) {
    if (isAdminRequest(request)
        && matches(request.getHeader(properties.adminKeyHeaderName()), properties.adminKey())) {
      return new UsernamePasswordAuthenticationToken(
          "operator", "N/A", List.of(new SimpleGrantedAuthority(ADMIN_ROLE)));
    }
    if (isCashierRequest(request)
        && matches(request.getHeader(properties.apiKeyHeaderName()), properties.apiKey())) {
      return new UsernamePasswordAuthenticationToken(
          "cashier", "N/A", List.of(new SimpleGrantedAuthority(CASHIER_ROLE)));
    }
    return null;
  }

  private boolean isCashierRequest(HttpServletRequest request) {
    return "POST".equals(request.getMethod()) && "/qris".equals(request.getRequestURI());
  }

  private boolean isAdminRequest(HttpServletRequest request) {
    final String uri = request.getRequestURI();
    return uri != null && uri.startsWith("/admin/");
  }

  private boolean matches(String actual, String expected) {
    if (actual == null || expected.isBlank()) {
      return false;
    }
    return MessageDigest.isEqual(
        actual.getBytes(StandardCharsets.UTF_8), expected.getBytes(StandardCharsets.UTF_8));
  }
}
