package com.example.auth.security;

import com.example.auth.config.ApiKeyProperties;
import com.example.auth.model.AuthenticatedIdentity;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.security.core.context.SecurityContext;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.security.web.util.matcher.AntPathRequestMatcher;
import org.springframework.security.web.util.matcher.OrRequestMatcher;
import org.springframework.security.web.util.matcher.RequestMatcher;
import org.springframework.web.filter.OncePerRequestFilter;

public class CredentialDispatcherFilter extends OncePerRequestFilter {

  private static final Logger logger = LoggerFactory.getLogger(CredentialDispatcherFilter.class);

  private final CredentialDispatcher dispatcher;
  private final ApiErrorWriter errorWriter;
  private final ApiKeyProperties apiKeyProperties;
  private final AuthenticationFailureLimiter failureLimiter;
  private final RequestMatcher publicPaths;

  public CredentialDispatcherFilter(
      CredentialDispatcher dispatcher,
      ApiErrorWriter errorWriter,
      ApiKeyProperties apiKeyProperties,
      AuthenticationFailureLimiter failureLimiter,
      List<String> publicPathPatterns) {
    this.dispatcher = dispatcher;
    this.errorWriter = errorWriter;
    this.apiKeyProperties = apiKeyProperties;
    this.failureLimiter = failureLimiter;
    this.publicPaths =
        new OrRequestMatcher(
            publicPathPatterns.stream()
                .map(pattern -> (RequestMatcher) new AntPathRequestMatcher(pattern))
                .toList());
  }

  @Override
  protected boolean shouldNotFilter(HttpServletRequest request) {
    return publicPaths.matches(request);
  }

  @Override
  protected void doFilterInternal(
      HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
      throws ServletException, IOException {
    final AuthenticationResult result =
        dispatcher.dispatch(CredentialHeaders.from(request, apiKeyProperties.headerName()));
    if (!result.authenticated()) {
      logger.info(
          "request rejected by credential dispatch path={} code={}",
          request.getRequestURI(),
          result.errorCode());
      // 500 (参照失敗) は資格情報の誤りではないため数えない
      if (result.status() == HttpServletResponse.SC_UNAUTHORIZED) {
        failureLimiter.recordFailure(
            RateLimitFilter.failureKey(ClientAddresses.resolve(request)));
      }
      errorWriter.write(response, result.errorCode(), result.message());
      return;
    }

    final AuthenticatedIdentity identity = result.identity();
    final SecurityContext context = SecurityContextHolder.createEmptyContext();
    context.setAuthentication(new IdentityAuthenticationToken(identity));
    SecurityContextHolder.setContext(context);
    request.setAttribute(AuthenticatedIdentity.REQUEST_ATTRIBUTE, identity);
    logger.debug(
        "credential accepted path={} user={} method={}",
        request.getRequestURI(),
        identity.userId(),
        identity.authMethod().tagValue());
    filterChain.doFilter(request, response);
  }
}
