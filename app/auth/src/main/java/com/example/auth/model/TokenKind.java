/*
 * どこで: app/auth/src/main/java/com/example/auth/model/TokenKind.java
 * 何を: セッショントークンの種別 (access / refresh)
 * なぜ: payload の type claim と型を一対一で対応させるため
 */
package com.example.auth.model;

import java.util.Optional;

public enum TokenKind {
  ACCESS("access"),
  REFRESH("refresh");

  private final String claimValue;

  TokenKind(String claimValue) {
    this.claimValue = claimValue;
  }

  public String claimValue() {
    return claimValue;
  }

  public static Optional<TokenKind> fromClaimValue(String value) {
    for (TokenKind kind : values()) {
      if (kind.claimValue.equals(value)) {
        return Optional.of(kind);
      }
    }
    return Optional.empty();
  }
}
