package com.example.auth.security;

import com.example.auth.model.AuthenticatedIdentity;
import java.util.List;
import java.util.Locale;
import org.springframework.security.authentication.AbstractAuthenticationToken;
import org.springframework.security.core.GrantedAuthority;
import org.springframework.security.core.authority.SimpleGrantedAuthority;

/** Spring Security view of an {@link AuthenticatedIdentity}. */
public class IdentityAuthenticationToken extends AbstractAuthenticationToken {

  private final transient AuthenticatedIdentity identity;

  public IdentityAuthenticationToken(AuthenticatedIdentity identity) {
    super(authorities(identity));
    this.identity = identity;
    setAuthenticated(true);
  }

  public AuthenticatedIdentity identity() {
    return identity;
  }

  @Override
  public Object getPrincipal() {
    return identity;
  }

  @Override
  public Object getCredentials() {
    return "";
  }

  @Override
  public String getName() {
    return identity.userId();
  }

  private static List<GrantedAuthority> authorities(AuthenticatedIdentity identity) {
    if (identity.role() == null || identity.role().isBlank()) {
      return List.of();
    }
    return List.of(new SimpleGrantedAuthority("ROLE_" + identity.role().toUpperCase(Locale.ROOT)));
  }
}
