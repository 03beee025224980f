package com.example.auth.api;

import org.springframework.http.HttpStatus;

/** Machine-readable codes returned in {@link ApiErrorResponse#code()}. */
public enum AuthErrorCode {
  UNAUTHORIZED(HttpStatus.UNAUTHORIZED),
  INVALID_TOKEN(HttpStatus.UNAUTHORIZED),
  EXPIRED_TOKEN(HttpStatus.UNAUTHORIZED),
  INVALID_API_KEY(HttpStatus.UNAUTHORIZED),
  FORBIDDEN(HttpStatus.FORBIDDEN),
  BAD_REQUEST(HttpStatus.BAD_REQUEST),
  NOT_FOUND(HttpStatus.NOT_FOUND),
  RATE_LIMITED(HttpStatus.TOO_MANY_REQUESTS),
  INTERNAL_ERROR(HttpStatus.INTERNAL_SERVER_ERROR);

  private final HttpStatus status;

  AuthErrorCode(HttpStatus status) {
    this.status = status;
  }

  public HttpStatus status() {
    return status;
  }
}
