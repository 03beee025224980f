package com.example.auth.service;

import com.example.auth.config.ApiKeyExecutorConfig;
import com.example.auth.config.ApiKeyProperties;
import com.example.auth.repository.ApiKeyRepository;
import java.time.Instant;
import java.util.concurrent.RejectedExecutionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskExecutor;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;

/**
 * Writes {@code last_used_at} off the request path. Writes that do not fit in the bounded queue
 * are dropped; the repository only ever moves the timestamp forward, so out-of-order writes are
 * harmless.
 */
@Component
public class ApiKeyLastUsedRecorder {

  private static final Logger logger = LoggerFactory.getLogger(ApiKeyLastUsedRecorder.class);

  private final ApiKeyRepository apiKeyRepository;
  private final TaskExecutor executor;
  private final ApiKeyProperties properties;
  private final AuthMetrics metrics;

  public ApiKeyLastUsedRecorder(
      ApiKeyRepository apiKeyRepository,
      @Qualifier(ApiKeyExecutorConfig.TOUCH_EXECUTOR) TaskExecutor executor,
      ApiKeyProperties properties,
      AuthMetrics metrics) {
    this.apiKeyRepository = apiKeyRepository;
    this.executor = executor;
    this.properties = properties;
    this.metrics = metrics;
  }

  public void record(String apiKeyId, Instant usedAt) {
    if (!properties.touchLastUsed()) {
      return;
    }
    try {
      executor.execute(() -> touch(apiKeyId, usedAt));
    } catch (RejectedExecutionException ex) {
      metrics.recordLastUsedDropped();
      logger.debug("api key last_used update dropped id={}", apiKeyId);
    }
  }

  private void touch(String apiKeyId, Instant usedAt) {
    try {
      apiKeyRepository.touchLastUsed(apiKeyId, usedAt);
    } catch (DataAccessException ex) {
      logger.warn("api key last_used update failed id={}", apiKeyId, ex);
    }
  }
}
