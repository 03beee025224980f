package com.example.auth.security;

import com.example.auth.model.AuthMethod;
import com.example.auth.model.AuthenticatedIdentity;
import com.example.auth.service.ApiKeyPermissions;
import java.util.function.Supplier;
import org.springframework.security.authorization.AuthorizationDecision;
import org.springframework.security.authorization.AuthorizationManager;
import org.springframework.security.core.Authentication;
import org.springframework.security.web.access.intercept.RequestAuthorizationContext;

/**
 * Requires an API key permission. Session-authenticated principals always pass; API-key
 * principals pass only when their key grants {@code permission}.
 */
public class PermissionAuthorizationManager
    implements AuthorizationManager<RequestAuthorizationContext> {

  static final String MESSAGE_API_KEY_REQUIRED = "API key required";
  static final String MESSAGE_INSUFFICIENT_PERMISSIONS = "insufficient permissions";

  private final String permission;

  public PermissionAuthorizationManager(String permission) {
    this.permission = permission;
  }

  public String permission() {
    return permission;
  }

  @Override
  public AuthorizationDecision check(
      Supplier<Authentication> authentication, RequestAuthorizationContext context) {
    final AuthenticatedIdentity identity = identityOf(authentication.get());
    if (identity != null && identity.authMethod() == AuthMethod.SESSION) {
      return GateAuthorizationDecision.granted();
    }
    if (identity == null || identity.apiKey() == null) {
      return GateAuthorizationDecision.forbidden(MESSAGE_API_KEY_REQUIRED);
    }
    if (!ApiKeyPermissions.grants(identity.apiKey().permissions(), permission)) {
      return GateAuthorizationDecision.forbidden(MESSAGE_INSUFFICIENT_PERMISSIONS);
    }
    return GateAuthorizationDecision.granted();
  }

  static AuthenticatedIdentity identityOf(Authentication auth) {
    if (auth == null || !auth.isAuthenticated()) {
      return null;
    }
    return auth.getPrincipal() instanceof AuthenticatedIdentity identity ? identity : null;
  }
}
