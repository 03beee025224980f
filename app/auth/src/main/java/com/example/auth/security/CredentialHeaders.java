package com.example.auth.security;

import jakarta.servlet.http.HttpServletRequest;

/** The two credential headers a request may carry, as received. */
public record CredentialHeaders(String apiKey, String authorization) {

  public static CredentialHeaders from(HttpServletRequest request, String apiKeyHeaderName) {
    return new CredentialHeaders(
        request.getHeader(apiKeyHeaderName), request.getHeader("Authorization"));
  }

  public static CredentialHeaders none() {
    return new CredentialHeaders(null, null);
  }
}
