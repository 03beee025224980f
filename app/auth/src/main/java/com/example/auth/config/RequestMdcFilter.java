/*
 * どこで: Auth Web 層 (サーブレットフィルタ)
 * 何を: request_id / http_method / http_path / client_ip を MDC に入れ、応答後に取り除く
 * なぜ: セキュリティチェーン内の拒否ログ (401 / 429) にも相関用の項目を載せるため
 */
package com.example.auth.config;

import com.example.auth.security.ClientAddresses;
import com.example.common.RequestIds;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.util.List;
import org.slf4j.MDC;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class RequestMdcFilter extends OncePerRequestFilter {

  static final List<String> KEYS = List.of("request_id", "http_method", "http_path", "client_ip");

  @Override
  protected void doFilterInternal(
      HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
      throws ServletException, IOException {
    MDC.put("request_id", RequestIds.resolve(request.getHeader("X-Request-Id")));
    MDC.put("http_method", request.getMethod());
    MDC.put("http_path", request.getRequestURI());
    final String clientIp = ClientAddresses.resolve(request);
    if (clientIp != null && !clientIp.isBlank()) {
      MDC.put("client_ip", clientIp);
    }
    try {
      filterChain.doFilter(request, response);
    } finally {
      KEYS.forEach(MDC::remove);
    }
  }
}
