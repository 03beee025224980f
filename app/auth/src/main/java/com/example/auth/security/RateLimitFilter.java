package com.example.auth.security;

import com.example.auth.api.AuthErrorCode;
import com.example.auth.config.ApiKeyProperties;
import com.example.auth.config.RateLimitProperties;
import com.example.auth.service.AuthMetrics;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.security.web.util.matcher.AntPathRequestMatcher;
import org.springframework.security.web.util.matcher.OrRequestMatcher;
import org.springframework.security.web.util.matcher.RequestMatcher;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Throttles requests before any credential is checked.
 *
 * <ul>
 *   <li>public auth endpoints ({@code /api/v1/auth/refresh}): {@code auth-limit} per client
 *       address.
 *   <li>other public paths: not limited.
 *   <li>protected paths: refused while the client is locked out for failed authentication, then
 *       {@code api-key-limit} per API key prefix when a key is sent, otherwise {@code
 *       default-limit} per client address.
 * </ul>
 */
public class RateLimitFilter extends OncePerRequestFilter {

  private static final Logger logger = LoggerFactory.getLogger(RateLimitFilter.class);

  static final String PUBLIC_AUTH_PATH = "/api/v1/auth/refresh";
  // 表示用プレフィックスと同じ長さ ("crm_" + 8 桁)
  private static final int API_KEY_PREFIX_LENGTH = 12;

  private final FixedWindowRateLimiter rateLimiter;
  private final AuthenticationFailureLimiter failureLimiter;
  private final ApiErrorWriter errorWriter;
  private final AuthMetrics metrics;
  private final RateLimitProperties properties;
  private final ApiKeyProperties apiKeyProperties;
  private final RequestMatcher publicAuthPath = new AntPathRequestMatcher(PUBLIC_AUTH_PATH);
  private final RequestMatcher publicPaths;

  public RateLimitFilter(
      FixedWindowRateLimiter rateLimiter,
      AuthenticationFailureLimiter failureLimiter,
      ApiErrorWriter errorWriter,
      AuthMetrics metrics,
      RateLimitProperties properties,
      ApiKeyProperties apiKeyProperties,
      List<String> publicPathPatterns) {
    this.rateLimiter = rateLimiter;
    this.failureLimiter = failureLimiter;
    this.errorWriter = errorWriter;
    this.metrics = metrics;
    this.properties = properties;
    this.apiKeyProperties = apiKeyProperties;
    this.publicPaths =
        new OrRequestMatcher(
            publicPathPatterns.stream()
                .map(pattern -> (RequestMatcher) new AntPathRequestMatcher(pattern))
                .toList());
  }

  @Override
  protected boolean shouldNotFilter(HttpServletRequest request) {
    return !properties.enabled();
  }

  @Override
  protected void doFilterInternal(
      HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
      throws ServletException, IOException {
    final String clientIp = ClientAddresses.resolve(request);

    if (publicAuthPath.matches(request)) {
      if (!rateLimiter.tryAcquire("auth:ip:" + clientIp, properties.authLimit())) {
        reject(request, response, "auth", properties.authLimit(), "rate limit exceeded");
        return;
      }
      filterChain.doFilter(request, response);
      return;
    }
    if (publicPaths.matches(request)) {
      filterChain.doFilter(request, response);
      return;
    }

    if (failureLimiter.isLocked(failureKey(clientIp))) {
      reject(
          request,
          response,
          "lockout",
          properties.maxFailures(),
          "too many failed authentication attempts");
      return;
    }
    final String apiKey = request.getHeader(apiKeyProperties.headerName());
    if (apiKey != null && !apiKey.isEmpty()) {
      final String prefix =
          apiKey.length() > API_KEY_PREFIX_LENGTH
              ? apiKey.substring(0, API_KEY_PREFIX_LENGTH)
              : apiKey;
      if (!rateLimiter.tryAcquire("apikey:" + prefix, properties.apiKeyLimit())) {
        reject(request, response, "api_key", properties.apiKeyLimit(), "rate limit exceeded");
        return;
      }
    } else if (!rateLimiter.tryAcquire("ip:" + clientIp, properties.defaultLimit())) {
      reject(request, response, "default", properties.defaultLimit(), "rate limit exceeded");
      return;
    }
    filterChain.doFilter(request, response);
  }

  /** Key under which {@link CredentialDispatcherFilter} records failures for an address. */
  static String failureKey(String clientIp) {
    return "ip:" + clientIp;
  }

  private void reject(
      HttpServletRequest request,
      HttpServletResponse response,
      String limitName,
      int limit,
      String message)
      throws IOException {
    logger.info("request rate limited path={} limit={}", request.getRequestURI(), limitName);
    metrics.recordRateLimited(limitName);
    response.setHeader("X-RateLimit-Limit", Integer.toString(limit));
    response.setHeader("X-RateLimit-Remaining", "0");
    errorWriter.write(response, AuthErrorCode.RATE_LIMITED, message);
  }
}
