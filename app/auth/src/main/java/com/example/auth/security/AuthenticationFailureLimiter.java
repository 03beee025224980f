/*
 * どこで: Auth セキュリティ層
 * 何を: クライアントごとの認証失敗回数を数え、上限に達したら一定時間ロックアウトする
 * なぜ: 不正な API キーやトークンの総当たりを、成功リクエストの上限とは別に抑止するため
 */
package com.example.auth.security;

import com.example.auth.config.RateLimitProperties;
import com.google.common.cache.CacheBuilder;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.ConcurrentMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class AuthenticationFailureLimiter {

  private static final Logger logger = LoggerFactory.getLogger(AuthenticationFailureLimiter.class);

  private final Clock clock;
  private final int maxFailures;
  private final Duration failureWindow;
  private final Duration lockout;
  private final Duration maxLockout;
  private final ConcurrentMap<String, FailureTracker> trackers;

  public AuthenticationFailureLimiter(RateLimitProperties properties, Clock clock) {
    this.clock = clock;
    this.maxFailures = properties.maxFailures();
    this.failureWindow = properties.window();
    this.lockout = properties.lockout();
    this.maxLockout = properties.maxLockout();
    this.trackers =
        CacheBuilder.newBuilder()
            .maximumSize(properties.maxTrackedClients())
            .expireAfterAccess(maxLockout.plus(failureWindow))
            .<String, FailureTracker>build()
            .asMap();
  }

  public boolean isLocked(String clientKey) {
    final FailureTracker tracker = trackers.get(clientKey);
    return tracker != null && tracker.isLocked(clock.instant());
  }

  public void recordFailure(String clientKey) {
    final Instant now = clock.instant();
    final Duration lockedFor =
        trackers.computeIfAbsent(clientKey, ignored -> new FailureTracker()).recordFailure(now);
    if (lockedFor != null) {
      logger.warn(
          "client locked out after repeated authentication failures client={} lockout={}",
          clientKey,
          lockedFor);
    }
  }

  private final class FailureTracker {

    private Instant windowStartedAt = Instant.EPOCH;
    private int failures;
    private Instant lockedUntil = Instant.EPOCH;
    // 繰り返しロックアウトされた回数。成功しても戻さない
    private int lockouts;

    /** Returns the lockout duration when this failure triggered one, otherwise null. */
    synchronized Duration recordFailure(Instant now) {
      if (now.isBefore(lockedUntil)) {
        return null;
      }
      if (!now.isBefore(windowStartedAt.plus(failureWindow))) {
        windowStartedAt = now;
        failures = 0;
      }
      failures++;
      if (failures < maxFailures) {
        return null;
      }
      lockouts++;
      final Duration duration = backoff(lockouts);
      lockedUntil = now.plus(duration);
      failures = 0;
      return duration;
    }

    synchronized boolean isLocked(Instant now) {
      return now.isBefore(lockedUntil);
    }

    private Duration backoff(int lockoutCount) {
      // 1x, 2x, 4x ... を maxLockout で頭打ちにする
      final int shift = Math.min(lockoutCount - 1, 20);
      final Duration scaled = lockout.multipliedBy(1L << shift);
      return scaled.compareTo(maxLockout) > 0 ? maxLockout : scaled;
    }
  }
}
