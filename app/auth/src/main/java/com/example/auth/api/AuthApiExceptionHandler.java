package com.example.auth.api;

import com.example.auth.service.ApiKeyNotFoundException;
import com.example.auth.service.InvalidApiKeyRequestException;
import com.example.auth.service.TokenVerificationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@RestControllerAdvice
public class AuthApiExceptionHandler {

  private static final Logger logger = LoggerFactory.getLogger(AuthApiExceptionHandler.class);

  @ExceptionHandler(TokenVerificationException.class)
  public ResponseEntity<ApiErrorResponse> handleTokenVerification(TokenVerificationException ex) {
    final AuthErrorCode code =
        switch (ex.reason()) {
          case EXPIRED_TOKEN -> AuthErrorCode.EXPIRED_TOKEN;
          case INVALID_TOKEN -> AuthErrorCode.INVALID_TOKEN;
        };
    final String message =
        switch (ex.reason()) {
          case EXPIRED_TOKEN -> "token has expired";
          case INVALID_TOKEN -> "invalid token";
        };
    return error(code, message);
  }

  @ExceptionHandler(InvalidApiKeyRequestException.class)
  public ResponseEntity<ApiErrorResponse> handleInvalidApiKeyRequest(
      InvalidApiKeyRequestException ex) {
    return error(AuthErrorCode.BAD_REQUEST, ex.getMessage());
  }

  @ExceptionHandler({MethodArgumentNotValidException.class, HttpMessageNotReadableException.class})
  public ResponseEntity<ApiErrorResponse> handleValidation(Exception ex) {
    return error(AuthErrorCode.BAD_REQUEST, "request validation failed");
  }

  @ExceptionHandler(ApiKeyNotFoundException.class)
  public ResponseEntity<ApiErrorResponse> handleNotFound(ApiKeyNotFoundException ex) {
    return error(AuthErrorCode.NOT_FOUND, "api key not found");
  }

  @ExceptionHandler(RuntimeException.class)
  public ResponseEntity<ApiErrorResponse> handleRuntime(RuntimeException ex) {
    logger.error("unhandled auth api error", ex);
    return error(AuthErrorCode.INTERNAL_ERROR, "internal error");
  }

  private static ResponseEntity<ApiErrorResponse> error(AuthErrorCode code, String message) {
    return ResponseEntity.status(code.status()).body(new ApiErrorResponse(code.name(), message));
  }
}
