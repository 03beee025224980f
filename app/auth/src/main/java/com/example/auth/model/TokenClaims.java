/*
 * どこで: app/auth/src/main/java/com/example/auth/model/TokenClaims.java
 * 何を: 署名済みセッショントークンが主張する claim 一式
 * なぜ: 検証済みの値だけを下流へ渡し、トークン文字列を再解釈させないため
 */
package com.example.auth.model;

import java.time.Instant;

public record TokenClaims(
    String userId,
    String email,
    String role,
    TokenKind kind,
    String issuer,
    String subject,
    Instant issuedAt,
    Instant expiresAt) {}
