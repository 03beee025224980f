/*
 * どこで: Auth 設定
 * 何を: auth.rate-limit 配下のリクエスト数上限と認証失敗ロックアウトの設定を保持する
 * なぜ: refresh や API キー総当たりの抑止量を環境ごとに調整できるようにするため
 */
package com.example.auth.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "auth.rate-limit")
public record RateLimitProperties(
    Boolean enabled,
    Duration window,
    Integer authLimit,
    Integer defaultLimit,
    Integer apiKeyLimit,
    Integer maxFailures,
    Duration lockout,
    Duration maxLockout,
    Long maxTrackedClients) {

  public RateLimitProperties {
    enabled = enabled == null ? Boolean.TRUE : enabled;
    window = isPositive(window) ? window : Duration.ofMinutes(1);
    authLimit = authLimit == null || authLimit <= 0 ? 20 : authLimit;
    defaultLimit = defaultLimit == null || defaultLimit <= 0 ? 100 : defaultLimit;
    apiKeyLimit = apiKeyLimit == null || apiKeyLimit <= 0 ? 1000 : apiKeyLimit;
    maxFailures = maxFailures == null || maxFailures <= 0 ? 10 : maxFailures;
    lockout = isPositive(lockout) ? lockout : Duration.ofMinutes(5);
    maxLockout = isPositive(maxLockout) ? maxLockout : Duration.ofHours(1);
    if (maxLockout.compareTo(lockout) < 0) {
      maxLockout = lockout;
    }
    maxTrackedClients =
        maxTrackedClients == null || maxTrackedClients <= 0 ? 100_000L : maxTrackedClients;
  }

  private static boolean isPositive(Duration duration) {
    return duration != null && !duration.isNegative() && !duration.isZero();
  }
}
