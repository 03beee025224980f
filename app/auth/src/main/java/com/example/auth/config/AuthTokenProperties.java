/*
 * どこで: Auth アプリの設定バインド
 * 何を: セッショントークンの署名鍵・有効期間・issuer を保持する
 * なぜ: 起動時に一度だけ確定させ、検証時にグローバル参照をしないため
 */
package com.example.auth.config;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "auth.token")
public record AuthTokenProperties(
    String secret, Duration accessTtl, Duration refreshTtl, String issuer) {

  public static final String DEVELOPMENT_SECRET = "messaging-crm-dev-secret-change-in-production";
  private static final int MIN_SECRET_BYTES = 32;

  public AuthTokenProperties {
    secret = secret == null || secret.isBlank() ? DEVELOPMENT_SECRET : secret;
    accessTtl = accessTtl == null ? Duration.ofMinutes(15) : accessTtl;
    refreshTtl = refreshTtl == null ? Duration.ofDays(7) : refreshTtl;
    issuer = issuer == null || issuer.isBlank() ? "messaging-crm" : issuer;

    // HS256 の鍵長 (256bit) 未満は jjwt 側でも拒否される
    if (secret.getBytes(StandardCharsets.UTF_8).length < MIN_SECRET_BYTES) {
      throw new IllegalArgumentException(
          "auth.token.secret must be at least " + MIN_SECRET_BYTES + " bytes");
    }
    if (accessTtl.isNegative() || accessTtl.isZero()) {
      throw new IllegalArgumentException("auth.token.access-ttl must be positive");
    }
    if (refreshTtl.isNegative() || refreshTtl.isZero()) {
      throw new IllegalArgumentException("auth.token.refresh-ttl must be positive");
    }
  }

  public boolean usesDevelopmentSecret() {
    return DEVELOPMENT_SECRET.equals(secret);
  }

  @Override
  public String toString() {
    return "AuthTokenProperties[secret=***, accessTtl="
        + accessTtl
        + ", refreshTtl="
        + refreshTtl
        + ", issuer="
        + issuer
        + "]";
  }
}
