package com.example.auth.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "auth.api-key")
public record ApiKeyProperties(
    String headerName, Boolean touchLastUsed, Integer touchQueueCapacity) {

  public ApiKeyProperties {
    headerName = headerName == null || headerName.isBlank() ? "X-API-Key" : headerName;
    touchLastUsed = touchLastUsed == null ? Boolean.TRUE : touchLastUsed;
    touchQueueCapacity =
        touchQueueCapacity == null || touchQueueCapacity <= 0 ? 1000 : touchQueueCapacity;
  }
}
