/*
 * どこで: app/auth/src/main/java/com/example/auth/model/AuthenticatedIdentity.java
 * 何を: 認証済みリクエストの主体 (userId / email / role / 認証方式 / API キー)
 * なぜ: 下流ハンドラが認証方式に依存せず同じ形で主体を参照できるようにするため
 */
package com.example.auth.model;

public record AuthenticatedIdentity(
    String userId, String email, String role, AuthMethod authMethod, ApiKeyRecord apiKey) {

  public static final String REQUEST_ATTRIBUTE = AuthenticatedIdentity.class.getName();

  public static AuthenticatedIdentity session(TokenClaims claims) {
    return new AuthenticatedIdentity(
        claims.userId(), claims.email(), claims.role(), AuthMethod.SESSION, null);
  }

  public static AuthenticatedIdentity apiKey(ApiKeyRecord record) {
    return new AuthenticatedIdentity(record.ownerUserId(), null, null, AuthMethod.API_KEY, record);
  }
}
