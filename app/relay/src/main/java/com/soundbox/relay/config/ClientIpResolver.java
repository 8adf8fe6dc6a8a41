/*
 * Where: Relay web infrastructure
 * What: Resolves the network origin of a request
 * Why: Requests arrive through proxies, so the first forwarded hop is the device address
 */
package com.soundbox.relay.config;

import jakarta.servlet.http.HttpServletRequest;

public final class ClientIpResolver {

  private ClientIpResolver() {}

  public static String resolve(HttpServletRequest request) {
    final String xForwardedFor = request.getHeader("X-Forwarded-For");
    if (xForwardedFor == null || xForwardedFor.isBlank()) {
      return request.getRemoteAddr();
    }
    final int commaIndex = xForwardedFor.indexOf(',');
    if (commaIndex < 0) {
      return xForwardedFor.trim();
    }
    return xForwardedFor.substring(0, commaIndex).trim();
  }
}
