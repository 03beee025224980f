/*
 * どこで: Auth API
 * 何を: POST /api/v1/api-keys の入力 DTO
 * なぜ: permissions 省略時は全権限、expiresInDays 省略時は無期限という契約を境界で明示するため
 */
package com.example.auth.api.request;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.Size;
import java.util.List;

public record CreateApiKeyRequest(
    @NotBlank @Size(max = 100) String name,
    List<String> permissions,
    @Positive Integer expiresInDays) {}
