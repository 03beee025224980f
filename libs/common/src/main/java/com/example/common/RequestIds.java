package com.example.common;

import java.util.UUID;
import java.util.regex.Pattern;

public final class RequestIds {

  private static final int MAX_LENGTH = 128;
  private static final Pattern ALLOWED = Pattern.compile("[A-Za-z0-9._:-]+");

  private RequestIds() {}

  public static String newRequestId() {
    return UUID.randomUUID().toString();
  }

  /** Returns the caller supplied id when it is safe to log, otherwise a fresh one. */
  public static String resolve(String candidate) {
    if (candidate == null || candidate.isBlank()) {
      return newRequestId();
    }
    final String trimmed = candidate.trim();
    if (trimmed.length() > MAX_LENGTH || !ALLOWED.matcher(trimmed).matches()) {
      return newRequestId();
    }
    return trimmed;
  }
}
