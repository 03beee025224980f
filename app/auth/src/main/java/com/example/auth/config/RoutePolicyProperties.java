/*
 * どこで: Auth アプリの設定バインド
 * 何を: ルートごとに要求する API キー権限を保持する
 * なぜ: ルート定義を持つ外部ハンドラ側と権限表を設定で揃えられるようにするため
 */
package com.example.auth.config;

import java.util.List;
import java.util.Locale;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.http.HttpMethod;

@ConfigurationProperties(prefix = "auth")
public record RoutePolicyProperties(List<RoutePolicy> routePolicies) {

  public RoutePolicyProperties {
    routePolicies = routePolicies == null ? List.of() : List.copyOf(routePolicies);
  }

  public record RoutePolicy(String method, String path, String permission) {

    public RoutePolicy {
      if (path == null || path.isBlank()) {
        throw new IllegalArgumentException("route policy path is required");
      }
      if (permission == null || permission.isBlank()) {
        throw new IllegalArgumentException("route policy permission is required for " + path);
      }
    }

    /** Returns {@code null} when the policy applies to every method. */
    public HttpMethod httpMethod() {
      if (method == null || method.isBlank() || "*".equals(method)) {
        return null;
      }
      return HttpMethod.valueOf(method.trim().toUpperCase(Locale.ROOT));
    }
  }
}
