package com.example.auth.model;

public enum AuthMethod {
  SESSION("session"),
  API_KEY("api_key");

  private final String tagValue;

  AuthMethod(String tagValue) {
    this.tagValue = tagValue;
  }

  /** Lower-case form used in MDC fields and metric tags. */
  public String tagValue() {
    return tagValue;
  }
}
