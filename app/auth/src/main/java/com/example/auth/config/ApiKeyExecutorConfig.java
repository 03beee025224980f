/*
 * どこで: Auth 設定
 * 何を: API キーの last_used_at 更新専用の有界スレッドプールを定義する
 * なぜ: 認証リクエストの応答を DB 書き込みで待たせず、滞留時は古い更新を捨てるため
 */
package com.example.auth.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

@Configuration
public class ApiKeyExecutorConfig {

  public static final String TOUCH_EXECUTOR = "apiKeyTouchExecutor";

  @Bean(name = TOUCH_EXECUTOR)
  ThreadPoolTaskExecutor apiKeyTouchExecutor(ApiKeyProperties properties) {
    final ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setThreadNamePrefix("api-key-touch-");
    executor.setCorePoolSize(1);
    executor.setMaxPoolSize(2);
    executor.setQueueCapacity(properties.touchQueueCapacity());
    executor.setWaitForTasksToCompleteOnShutdown(true);
    executor.setAwaitTerminationSeconds(5);
    return executor;
  }
}
