package com.example.auth.security;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class CredentialSchemeTest {

  @Test
  void apiKeyHeaderTakesPrecedence() {
    assertThat(CredentialScheme.select(new CredentialHeaders("crm_x", "Bearer abc")))
        .isEqualTo(CredentialScheme.API_KEY);
  }

  @Test
  void whitespaceApiKeyStillSelectsApiKey() {
    assertThat(CredentialScheme.select(new CredentialHeaders("  ", "Bearer abc")))
        .isEqualTo(CredentialScheme.API_KEY);
  }

  @Test
  void emptyApiKeyFallsThroughToBearer() {
    assertThat(CredentialScheme.select(new CredentialHeaders("", "Bearer abc")))
        .isEqualTo(CredentialScheme.BEARER);
  }

  @Test
  void bearerPrefixIsCaseInsensitive() {
    assertThat(CredentialScheme.select(new CredentialHeaders(null, "bearer abc")))
        .isEqualTo(CredentialScheme.BEARER);
    assertThat(CredentialScheme.bearerToken("  BEARER   abc  ")).isEqualTo("abc");
    assertThat(CredentialScheme.bearerToken("Bearer")).isEmpty();
  }

  @Test
  void otherSchemesAndMissingHeadersSelectNone() {
    assertThat(CredentialScheme.select(CredentialHeaders.none())).isEqualTo(CredentialScheme.NONE);
    assertThat(CredentialScheme.select(new CredentialHeaders(null, "Basic dXNlcg==")))
        .isEqualTo(CredentialScheme.NONE);
    assertThat(CredentialScheme.select(new CredentialHeaders(null, "Bearerabc")))
        .isEqualTo(CredentialScheme.NONE);
  }
}
