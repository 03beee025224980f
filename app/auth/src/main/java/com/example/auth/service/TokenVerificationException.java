package com.example.auth.service;

public class TokenVerificationException extends RuntimeException {

  public enum Reason {
    INVALID_TOKEN,
    EXPIRED_TOKEN
  }

  private final Reason reason;

  public TokenVerificationException(Reason reason, String message) {
    super(message);
    this.reason = reason;
  }

  public TokenVerificationException(Reason reason, String message, Throwable cause) {
    super(message, cause);
    this.reason = reason;
  }

  public Reason reason() {
    return reason;
  }

  static TokenVerificationException invalid(Throwable cause) {
    return new TokenVerificationException(Reason.INVALID_TOKEN, "invalid token", cause);
  }

  static TokenVerificationException invalid() {
    return new TokenVerificationException(Reason.INVALID_TOKEN, "invalid token");
  }

  static TokenVerificationException expired(Throwable cause) {
    return new TokenVerificationException(Reason.EXPIRED_TOKEN, "token has expired", cause);
  }
}
