package com.example.auth.security;

import jakarta.servlet.http.HttpServletRequest;

/** Resolves the calling client's address, preferring the first {@code X-Forwarded-For} hop. */
public final class ClientAddresses {

  private ClientAddresses() {}

  public static String resolve(HttpServletRequest request) {
    final String xForwardedFor = request.getHeader("X-Forwarded-For");
    if (xForwardedFor == null || xForwardedFor.isBlank()) {
      return request.getRemoteAddr();
    }
    final int commaIndex = xForwardedFor.indexOf(',');
    final String first =
        commaIndex < 0 ? xForwardedFor.trim() : xForwardedFor.substring(0, commaIndex).trim();
    return first.isEmpty() ? request.getRemoteAddr() : first;
  }
}
