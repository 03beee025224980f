package com.example.auth.service;

public class ApiKeyValidationException extends RuntimeException {

  public enum Reason {
    NOT_FOUND,
    EXPIRED,
    REVOKED,
    INTERNAL
  }

  private final Reason reason;

  public ApiKeyValidationException(Reason reason, String message) {
    super(message);
    this.reason = reason;
  }

  public ApiKeyValidationException(Reason reason, String message, Throwable cause) {
    super(message, cause);
    this.reason = reason;
  }

  public Reason reason() {
    return reason;
  }
}
