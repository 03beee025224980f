package com.example.auth.service;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/** SHA-256 verifier for raw API keys; the raw key itself is never stored. */
public final class ApiKeyHasher {

  private ApiKeyHasher() {}

  public static String hash(String rawKey) {
    try {
      final MessageDigest digest = MessageDigest.getInstance("SHA-256");
      return HexFormat.of().formatHex(digest.digest(rawKey.getBytes(StandardCharsets.UTF_8)));
    } catch (NoSuchAlgorithmException ex) {
      throw new IllegalStateException("SHA-256 is not available", ex);
    }
  }

  /** Constant-time comparison of two hex verifiers. */
  public static boolean matches(String expectedHash, String actualHash) {
    if (expectedHash == null || actualHash == null) {
      return false;
    }
    return MessageDigest.isEqual(
        expectedHash.getBytes(StandardCharsets.US_ASCII),
        actualHash.getBytes(StandardCharsets.US_ASCII));
  }
}
