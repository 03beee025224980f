package com.example.auth.security;

import com.example.auth.api.AuthErrorCode;
import com.example.auth.model.ApiKeyRecord;
import com.example.auth.model.AuthenticatedIdentity;
import com.example.auth.model.TokenClaims;
import com.example.auth.service.ApiKeyValidationException;
import com.example.auth.service.ApiKeyValidator;
import com.example.auth.service.AuthMetrics;
import com.example.auth.service.TokenCodec;
import com.example.auth.service.TokenVerificationException;
import java.util.Locale;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Picks exactly one credential scheme per request and turns it into an {@link
 * AuthenticationResult}. An API key header wins over an Authorization header; the session path is
 * never attempted once an API key was presented.
 */
@Component
@RequiredArgsConstructor
public class CredentialDispatcher {

  private static final Logger logger = LoggerFactory.getLogger(CredentialDispatcher.class);

  static final String MESSAGE_AUTHENTICATION_REQUIRED = "authentication required";

  private final TokenCodec tokenCodec;
  private final ApiKeyValidator apiKeyValidator;
  private final AuthMetrics metrics;

  public AuthenticationResult dispatch(CredentialHeaders headers) {
    final CredentialScheme scheme = CredentialScheme.select(headers);
    final AuthenticationResult result =
        switch (scheme) {
          case API_KEY -> authenticateApiKey(headers.apiKey().trim());
          case BEARER -> authenticateSession(CredentialScheme.bearerToken(headers.authorization()));
          case NONE ->
              AuthenticationResult.rejected(
                  AuthErrorCode.UNAUTHORIZED, MESSAGE_AUTHENTICATION_REQUIRED);
        };
    metrics.recordCredentialOutcome(methodTag(scheme), resultTag(result));
    return result;
  }

  private AuthenticationResult authenticateApiKey(String rawKey) {
    try {
      final ApiKeyRecord record = apiKeyValidator.validate(rawKey);
      return AuthenticationResult.apiKey(AuthenticatedIdentity.apiKey(record));
    } catch (ApiKeyValidationException ex) {
      return switch (ex.reason()) {
        case NOT_FOUND ->
            AuthenticationResult.rejected(AuthErrorCode.INVALID_API_KEY, "invalid API key");
        case REVOKED ->
            AuthenticationResult.rejected(
                AuthErrorCode.INVALID_API_KEY, "API key has been revoked");
        case EXPIRED ->
            AuthenticationResult.rejected(AuthErrorCode.EXPIRED_TOKEN, "API key has expired");
        case INTERNAL ->
            AuthenticationResult.rejected(AuthErrorCode.INTERNAL_ERROR, "authentication error");
      };
    }
  }

  private AuthenticationResult authenticateSession(String token) {
    try {
      final TokenClaims claims = tokenCodec.verifyAccess(token);
      return AuthenticationResult.session(AuthenticatedIdentity.session(claims));
    } catch (TokenVerificationException ex) {
      return switch (ex.reason()) {
        case EXPIRED_TOKEN ->
            AuthenticationResult.rejected(AuthErrorCode.EXPIRED_TOKEN, "token has expired");
        case INVALID_TOKEN ->
            AuthenticationResult.rejected(AuthErrorCode.INVALID_TOKEN, "invalid token");
      };
    } catch (RuntimeException ex) {
      logger.error("session token verification failed unexpectedly", ex);
      return AuthenticationResult.rejected(AuthErrorCode.INTERNAL_ERROR, "authentication error");
    }
  }

  private static String methodTag(CredentialScheme scheme) {
    return switch (scheme) {
      case API_KEY -> "api_key";
      case BEARER -> "session";
      case NONE -> "none";
    };
  }

  private static String resultTag(AuthenticationResult result) {
    return result.authenticated()
        ? "authenticated"
        : result.errorCode().name().toLowerCase(Locale.ROOT);
  }
}
