/*
 * どこで: Auth API
 * 何を: リフレッシュトークンの交換と、認証済み主体の参照を提供する
 * なぜ: セッション・API キーどちらの認証結果も同じ形でクライアントへ返すため
 */
package com.example.auth.api;

import com.example.auth.api.request.RefreshRequest;
import com.example.auth.api.response.MeResponse;
import com.example.auth.api.response.TokenPairResponse;
import com.example.auth.model.AuthenticatedIdentity;
import com.example.auth.service.TokenCodec;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/auth")
@RequiredArgsConstructor
public class AuthController {

  private final TokenCodec tokenCodec;

  /**
   * 役割:
   * - リフレッシュトークンを新しいトークンペアへ交換する。
   *
   * 期待動作:
   * - 期限切れは EXPIRED_TOKEN、それ以外の不正は INVALID_TOKEN で 401 を返す。
   * - 提示されたリフレッシュトークン自体は失効させない。
   */
  @PostMapping("/refresh")
  public ResponseEntity<TokenPairResponse> refresh(@Valid @RequestBody RefreshRequest request) {
    return ResponseEntity.ok(TokenPairResponse.from(tokenCodec.refresh(request.refreshToken())));
  }

  @GetMapping("/me")
  public ResponseEntity<MeResponse> me(@AuthenticationPrincipal AuthenticatedIdentity identity) {
    return ResponseEntity.ok(MeResponse.from(identity));
  }
}
