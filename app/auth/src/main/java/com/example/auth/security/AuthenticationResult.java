package com.example.auth.security;

import com.example.auth.api.AuthErrorCode;
import com.example.auth.model.AuthenticatedIdentity;

public record AuthenticationResult(
    AuthenticationState state,
    AuthenticatedIdentity identity,
    AuthErrorCode errorCode,
    String message) {

  public static AuthenticationResult session(AuthenticatedIdentity identity) {
    return new AuthenticationResult(
        AuthenticationState.AUTHENTICATED_SESSION, identity, null, null);
  }

  public static AuthenticationResult apiKey(AuthenticatedIdentity identity) {
    return new AuthenticationResult(
        AuthenticationState.AUTHENTICATED_API_KEY, identity, null, null);
  }

  public static AuthenticationResult rejected(AuthErrorCode errorCode, String message) {
    return new AuthenticationResult(AuthenticationState.REJECTED, null, errorCode, message);
  }

  public boolean authenticated() {
    return state != AuthenticationState.REJECTED;
  }

  public int status() {
    return errorCode == null ? 200 : errorCode.status().value();
  }
}
