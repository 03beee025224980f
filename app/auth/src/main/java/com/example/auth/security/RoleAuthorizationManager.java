package com.example.auth.security;

import com.example.auth.model.AuthenticatedIdentity;
import java.util.Set;
import java.util.function.Supplier;
import org.springframework.security.authorization.AuthorizationDecision;
import org.springframework.security.authorization.AuthorizationManager;
import org.springframework.security.core.Authentication;
import org.springframework.security.web.access.intercept.RequestAuthorizationContext;

/** Requires a session role out of a fixed set. API-key principals carry no role and are denied. */
public class RoleAuthorizationManager implements AuthorizationManager<RequestAuthorizationContext> {

  static final String MESSAGE_INSUFFICIENT_ROLE = "insufficient role";

  private final Set<String> allowedRoles;

  public RoleAuthorizationManager(String... allowedRoles) {
    this.allowedRoles = Set.of(allowedRoles);
  }

  @Override
  public AuthorizationDecision check(
      Supplier<Authentication> authentication, RequestAuthorizationContext context) {
    final AuthenticatedIdentity identity =
        PermissionAuthorizationManager.identityOf(authentication.get());
    if (identity == null) {
      return GateAuthorizationDecision.unauthenticated();
    }
    if (identity.role() == null || !allowedRoles.contains(identity.role())) {
      return GateAuthorizationDecision.forbidden(MESSAGE_INSUFFICIENT_ROLE);
    }
    return GateAuthorizationDecision.granted();
  }
}
