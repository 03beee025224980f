package com.example.auth.security;

import com.example.auth.config.RateLimitProperties;
import com.google.common.annotations.VisibleForTesting;
import com.google.common.cache.Cache;
import com.google.common.cache.CacheBuilder;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.ConcurrentMap;
import org.springframework.stereotype.Component;

/**
 * Counts requests per key in fixed windows of {@code auth.rate-limit.window}.
 *
 * <p>A key's window starts with its first request and resets once the window has elapsed.
 * Counters live in a size-bounded cache; a key evicted under pressure simply starts a new window.
 */
@Component
public class FixedWindowRateLimiter {

  private final Clock clock;
  private final Duration window;
  private final ConcurrentMap<String, Window> windows;

  public FixedWindowRateLimiter(RateLimitProperties properties, Clock clock) {
    this.clock = clock;
    this.window = properties.window();
    final Cache<String, Window> cache =
        CacheBuilder.newBuilder()
            .maximumSize(properties.maxTrackedClients())
            .expireAfterAccess(window.multipliedBy(2))
            .build();
    this.windows = cache.asMap();
  }

  /** Records one request for {@code key}; false once {@code limit} requests were seen. */
  public boolean tryAcquire(String key, int limit) {
    final Instant now = clock.instant();
    return windows.computeIfAbsent(key, ignored -> new Window(now)).tryAcquire(now, limit);
  }

  @VisibleForTesting
  int trackedKeys() {
    return windows.size();
  }

  private final class Window {

    private Instant startedAt;
    private int count;

    private Window(Instant startedAt) {
      this.startedAt = startedAt;
    }

    synchronized boolean tryAcquire(Instant now, int limit) {
      if (!now.isBefore(startedAt.plus(window))) {
        startedAt = now;
        count = 0;
      }
      if (count >= limit) {
        return false;
      }
      count++;
      return true;
    }
  }
}
