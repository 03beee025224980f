package com.example.auth.model;

import java.time.Instant;

/**
 * Access and refresh token issued together for one identity. {@code accessExpiresAt} reports the
 * access token's expiry only.
 */
public record TokenPair(
    String accessToken, String refreshToken, Instant accessExpiresAt, String tokenType) {

  public static final String BEARER = "Bearer";

  public TokenPair(String accessToken, String refreshToken, Instant accessExpiresAt) {
    this(accessToken, refreshToken, accessExpiresAt, BEARER);
  }
}
