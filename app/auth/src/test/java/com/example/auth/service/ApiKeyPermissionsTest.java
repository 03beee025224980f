package com.example.auth.service;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.Set;
import org.junit.jupiter.api.Test;

class ApiKeyPermissionsTest {

  @Test
  void exactPermissionIsGranted() {
    final Set<String> granted = Set.of("messages:read", "contacts:write");

    assertThat(ApiKeyPermissions.grants(granted, "messages:read")).isTrue();
    assertThat(ApiKeyPermissions.grants(granted, "messages:write")).isFalse();
    assertThat(ApiKeyPermissions.grants(granted, "send_message")).isFalse();
  }

  @Test
  void emptySetGrantsNothing() {
    assertThat(ApiKeyPermissions.grants(Set.of(), "messages:read")).isFalse();
    assertThat(ApiKeyPermissions.grants(null, "messages:read")).isFalse();
  }

  @Test
  void wildcardsGrantAsExpected() {
    assertThat(ApiKeyPermissions.grants(Set.of("*"), "webhooks:manage")).isTrue();
    assertThat(ApiKeyPermissions.grants(Set.of("chats:*"), "chats:write")).isTrue();
    assertThat(ApiKeyPermissions.grants(Set.of("chats:*"), "messages:read")).isFalse();
    assertThat(ApiKeyPermissions.grants(Set.of("chats:*"), "send_message")).isFalse();
  }

  @Test
  void assignablePermissionsAreCatalogueOrKnownWildcards() {
    assertThat(ApiKeyPermissions.isAssignable("messages:read")).isTrue();
    assertThat(ApiKeyPermissions.isAssignable("*")).isTrue();
    assertThat(ApiKeyPermissions.isAssignable("contacts:*")).isTrue();
    assertThat(ApiKeyPermissions.isAssignable("billing:*")).isFalse();
    assertThat(ApiKeyPermissions.isAssignable("messages:delete")).isFalse();
    assertThat(ApiKeyPermissions.isAssignable(" ")).isFalse();
  }
}
