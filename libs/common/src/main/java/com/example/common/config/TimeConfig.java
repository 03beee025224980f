/*
 * どこで: Common 共通設定
 * 何を: UTC 固定の Clock を Bean として公開する
 * なぜ: トークン期限や API キー期限の判定をテストで固定時刻に差し替えるため
 */
package com.example.common.config;

import java.time.Clock;
import java.time.ZoneOffset;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class TimeConfig {

  @Bean
  public Clock clock() {
    return Clock.system(ZoneOffset.UTC);
  }
}
