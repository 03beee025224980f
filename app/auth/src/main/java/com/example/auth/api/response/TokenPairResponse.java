package com.example.auth.api.response;

import com.example.auth.model.TokenPair;
import java.time.Instant;

public record TokenPairResponse(
    String accessToken, String refreshToken, Instant expiresAt, String tokenType) {

  public static TokenPairResponse from(TokenPair pair) {
    return new TokenPairResponse(
        pair.accessToken(), pair.refreshToken(), pair.accessExpiresAt(), pair.tokenType());
  }
}
