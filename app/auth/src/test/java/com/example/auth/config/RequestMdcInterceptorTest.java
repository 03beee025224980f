package com.example.auth.config;

import static org.assertj.core.api.Assertions.assertThat;

import com.example.auth.model.AuthMethod;
import com.example.auth.model.AuthenticatedIdentity;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;

class RequestMdcInterceptorTest {

  private final RequestMdcInterceptor interceptor = new RequestMdcInterceptor();

  @AfterEach
  void cleanup() {
    MDC.clear();
  }

  @Test
  void putAndRemoveIdentityAroundHandler() {
    final MockHttpServletRequest request =
        new MockHttpServletRequest("GET", "/api/v1/messages/sample");
    request.setAttribute(
        AuthenticatedIdentity.REQUEST_ATTRIBUTE,
        new AuthenticatedIdentity("user-123", null, null, AuthMethod.API_KEY, null));
    final MockHttpServletResponse response = new MockHttpServletResponse();
    MDC.put("request_id", "req-1");

    interceptor.preHandle(request, response, new Object());

    assertThat(MDC.get("user_id")).isEqualTo("user-123");
    assertThat(MDC.get("auth_method")).isEqualTo("api_key");

    interceptor.afterCompletion(request, response, new Object(), null);

    assertThat(MDC.get("user_id")).isNull();
    assertThat(MDC.get("auth_method")).isNull();
    assertThat(MDC.get("request_id")).isEqualTo("req-1");
  }

  @Test
  void anonymousRequestAddsNothing() {
    final MockHttpServletRequest request = new MockHttpServletRequest("GET", "/");

    interceptor.preHandle(request, new MockHttpServletResponse(), new Object());

    assertThat(MDC.get("user_id")).isNull();
    assertThat(MDC.get("auth_method")).isNull();
  }
}
