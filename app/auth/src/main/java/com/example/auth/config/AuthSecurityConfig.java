package com.example.auth.config;

import com.example.auth.api.AuthErrorCode;
import com.example.auth.security.ApiErrorWriter;
import com.example.auth.security.AuthenticationFailureLimiter;
import com.example.auth.security.CredentialDispatcher;
import com.example.auth.security.CredentialDispatcherFilter;
import com.example.auth.security.FixedWindowRateLimiter;
import com.example.auth.security.GateAuthorizationDecision;
import com.example.auth.security.PermissionAuthorizationManager;
import com.example.auth.security.RateLimitFilter;
import com.example.auth.security.RoleAuthorizationManager;
import com.example.auth.security.UserRoles;
import com.example.auth.service.AuthMetrics;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.web.servlet.FilterRegistrationBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.security.authorization.AuthorizationDeniedException;
import org.springframework.security.config.annotation.web.builders.HttpSecurity;
import org.springframework.security.config.http.SessionCreationPolicy;
import org.springframework.security.web.AuthenticationEntryPoint;
import org.springframework.security.web.SecurityFilterChain;
import org.springframework.security.web.access.AccessDeniedHandler;
import org.springframework.security.web.access.intercept.AuthorizationFilter;

@Configuration
@EnableConfigurationProperties({
  AuthTokenProperties.class,
  ApiKeyProperties.class,
  RoutePolicyProperties.class,
  RateLimitProperties.class
})
public class AuthSecurityConfig {

  private static final Logger logger = LoggerFactory.getLogger(AuthSecurityConfig.class);

  static final List<String> PUBLIC_PATHS =
      List.of(
          "/",
          "/error",
          "/actuator/health",
          "/actuator/health/**",
          "/actuator/info",
          "/api/v1/auth/refresh");

  @Bean
  CredentialDispatcherFilter credentialDispatcherFilter(
      CredentialDispatcher dispatcher,
      ApiErrorWriter errorWriter,
      ApiKeyProperties properties,
      AuthenticationFailureLimiter failureLimiter) {
    return new CredentialDispatcherFilter(
        dispatcher, errorWriter, properties, failureLimiter, PUBLIC_PATHS);
  }

  @Bean
  RateLimitFilter rateLimitFilter(
      FixedWindowRateLimiter rateLimiter,
      AuthenticationFailureLimiter failureLimiter,
      ApiErrorWriter errorWriter,
      AuthMetrics metrics,
      RateLimitProperties rateLimitProperties,
      ApiKeyProperties apiKeyProperties) {
    return new RateLimitFilter(
        rateLimiter,
        failureLimiter,
        errorWriter,
        metrics,
        rateLimitProperties,
        apiKeyProperties,
        PUBLIC_PATHS);
  }

  @Bean
  FilterRegistrationBean<RateLimitFilter> rateLimitFilterRegistration(RateLimitFilter filter) {
    final FilterRegistrationBean<RateLimitFilter> registration =
        new FilterRegistrationBean<>(filter);
    registration.setEnabled(false);
    return registration;
  }

  // セキュリティチェーン内でのみ実行し、サーブレットフィルタとしての二重登録を防ぐ
  @Bean
  FilterRegistrationBean<CredentialDispatcherFilter> credentialDispatcherFilterRegistration(
      CredentialDispatcherFilter filter) {
    final FilterRegistrationBean<CredentialDispatcherFilter> registration =
        new FilterRegistrationBean<>(filter);
    registration.setEnabled(false);
    return registration;
  }

  @Bean
  AuthenticationEntryPoint apiAuthenticationEntryPoint(ApiErrorWriter errorWriter) {
    return (request, response, ex) ->
        errorWriter.write(response, AuthErrorCode.UNAUTHORIZED, "authentication required");
  }

  @Bean
  AccessDeniedHandler apiAccessDeniedHandler(ApiErrorWriter errorWriter) {
    return (request, response, ex) -> {
      if (ex instanceof AuthorizationDeniedException denied
          && denied.getAuthorizationResult() instanceof GateAuthorizationDecision decision) {
        if (decision.outcome() == GateAuthorizationDecision.Outcome.UNAUTHENTICATED) {
          errorWriter.write(response, AuthErrorCode.UNAUTHORIZED, decision.message());
          return;
        }
        logger.info(
            "request denied by authorization gate path={} reason={}",
            request.getRequestURI(),
            decision.message());
        errorWriter.write(response, AuthErrorCode.FORBIDDEN, decision.message());
        return;
      }
      errorWriter.write(response, AuthErrorCode.FORBIDDEN, "access denied");
    };
  }

  @Bean
  SecurityFilterChain securityFilterChain(
      HttpSecurity http,
      CredentialDispatcherFilter credentialDispatcherFilter,
      RateLimitFilter rateLimitFilter,
      RoutePolicyProperties routePolicyProperties,
      AuthenticationEntryPoint apiAuthenticationEntryPoint,
      AccessDeniedHandler apiAccessDeniedHandler)
      throws Exception {
    http.csrf(csrf -> csrf.disable())
        .httpBasic(basic -> basic.disable())
        .formLogin(form -> form.disable())
        .sessionManagement(
            session -> session.sessionCreationPolicy(SessionCreationPolicy.STATELESS))
        .exceptionHandling(
            handling ->
                handling
                    .authenticationEntryPoint(apiAuthenticationEntryPoint)
                    .accessDeniedHandler(apiAccessDeniedHandler))
        .addFilterBefore(credentialDispatcherFilter, AuthorizationFilter.class)
        .addFilterBefore(rateLimitFilter, CredentialDispatcherFilter.class)
        .authorizeHttpRequests(
            auth -> {
              auth.requestMatchers(PUBLIC_PATHS.toArray(String[]::new)).permitAll();
              // API キー管理はセッション (role 付き) の主体に限定する
              auth.requestMatchers("/api/v1/api-keys", "/api/v1/api-keys/**")
                  .access(new RoleAuthorizationManager(UserRoles.ADMIN, UserRoles.OPERATOR));
              for (RoutePolicyProperties.RoutePolicy policy :
                  routePolicyProperties.routePolicies()) {
                auth.requestMatchers(policy.httpMethod(), policy.path())
                    .access(new PermissionAuthorizationManager(policy.permission()));
              }
              auth.anyRequest().authenticated();
            });
    return http.build();
  }
}
