/*
 * どこで: Auth サービス層
 * 何を: 認証方式ごとの成否、レート制限による拒否、last_used 更新の取りこぼしを記録する
 * なぜ: 不正キー試行や DB 障害による認証失敗の増加を Prometheus から観測できるようにするため
 */
package com.example.auth.service;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import org.springframework.stereotype.Component;

@Component
@SuppressFBWarnings(
    value = "EI_EXPOSE_REP2",
    justification = "MeterRegistry は Spring 管理の共有コンポーネントで防御的コピーが不可能なため")
public class AuthMetrics {

  private static final String METRIC_CREDENTIAL_OUTCOME = "auth.credential.outcome";
  private static final String METRIC_LAST_USED_DROPPED = "auth.api_key.last_used.dropped";
  private static final String METRIC_RATE_LIMITED = "auth.rate_limit.rejected";

  private final MeterRegistry meterRegistry;
  private final ConcurrentMap<String, Counter> outcomeCounters = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, Counter> rateLimitedCounters = new ConcurrentHashMap<>();
  private final Counter lastUsedDropped;

  public AuthMetrics(MeterRegistry meterRegistry) {
    this.meterRegistry = meterRegistry;
    this.lastUsedDropped =
        Counter.builder(METRIC_LAST_USED_DROPPED)
            .description("API key last_used_at updates dropped because the queue was full")
            .register(meterRegistry);
  }

  /**
   * @param method {@code session}, {@code api_key} or {@code none}
   * @param result {@code success} or an error code in lower case
   */
  public void recordCredentialOutcome(String method, String result) {
    final String key = method + "|" + result;
    outcomeCounters
        .computeIfAbsent(
            key,
            ignored ->
                Counter.builder(METRIC_CREDENTIAL_OUTCOME)
                    .description("Credential dispatch outcomes by method and result")
                    .tags(Tags.of("method", method, "result", result))
                    .register(meterRegistry))
        .increment();
  }

  public void recordLastUsedDropped() {
    lastUsedDropped.increment();
  }

  /**
   * @param limit {@code auth}, {@code default}, {@code api_key} or {@code lockout}
   */
  public void recordRateLimited(String limit) {
    rateLimitedCounters
        .computeIfAbsent(
            limit,
            ignored ->
                Counter.builder(METRIC_RATE_LIMITED)
                    .description("Requests refused with 429 by limit")
                    .tags(Tags.of("limit", limit))
                    .register(meterRegistry))
        .increment();
  }
}
