/*
 * どこで: Auth セキュリティ層
 * 何を: リクエストヘッダから認証方式を一つだけ選ぶ
 * なぜ: X-API-Key を Authorization より優先する順序を一箇所で固定し、単体で検証できるようにするため
 */
package com.example.auth.security;

import java.util.Locale;

public enum CredentialScheme {
  API_KEY,
  BEARER,
  NONE;

  private static final String BEARER_PREFIX = "bearer";

  public static CredentialScheme select(CredentialHeaders headers) {
    // 空白のみの値も「送られた」とみなし、API キー検証で INVALID_API_KEY にする
    if (headers.apiKey() != null && !headers.apiKey().isEmpty()) {
      return API_KEY;
    }
    if (isBearer(headers.authorization())) {
      return BEARER;
    }
    return NONE;
  }

  /** Token part of a bearer header; empty when only the scheme name was sent. */
  public static String bearerToken(String authorization) {
    final String trimmed = authorization.trim();
    return trimmed.substring(BEARER_PREFIX.length()).trim();
  }

  private static boolean isBearer(String authorization) {
    if (!hasText(authorization)) {
      return false;
    }
    final String trimmed = authorization.trim();
    if (!trimmed.toLowerCase(Locale.ROOT).startsWith(BEARER_PREFIX)) {
      return false;
    }
    return trimmed.length() == BEARER_PREFIX.length()
        || Character.isWhitespace(trimmed.charAt(BEARER_PREFIX.length()));
  }

  private static boolean hasText(String value) {
    return value != null && !value.isBlank();
  }
}
