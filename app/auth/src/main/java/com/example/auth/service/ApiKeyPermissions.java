/*
 * どこで: Auth サービス層
 * 何を: API キーに付与できる権限の一覧と判定ロジック
 * なぜ: 空集合は権限なし、"*" と "<resource>:*" はワイルドカードとして一箇所で扱うため
 */
package com.example.auth.service;

import java.util.List;
import java.util.Set;

public final class ApiKeyPermissions {

  public static final String CHATS_READ = "chats:read";
  public static final String CHATS_WRITE = "chats:write";
  public static final String MESSAGES_READ = "messages:read";
  public static final String MESSAGES_WRITE = "messages:write";
  public static final String CONTACTS_READ = "contacts:read";
  public static final String CONTACTS_WRITE = "contacts:write";
  public static final String CONNECTIONS_READ = "connections:read";
  public static final String CONNECTIONS_WRITE = "connections:write";
  public static final String WEBHOOKS_MANAGE = "webhooks:manage";
  public static final String ALL = "*";

  private static final String RESOURCE_WILDCARD_SUFFIX = ":*";

  /** Every concrete permission, in display order. Wildcards are not included. */
  public static final List<String> CATALOGUE =
      List.of(
          CHATS_READ,
          CHATS_WRITE,
          MESSAGES_READ,
          MESSAGES_WRITE,
          CONTACTS_READ,
          CONTACTS_WRITE,
          CONNECTIONS_READ,
          CONNECTIONS_WRITE,
          WEBHOOKS_MANAGE);

  private static final Set<String> CATALOGUE_SET = Set.copyOf(CATALOGUE);

  private ApiKeyPermissions() {}

  /**
   * Membership test against a granted set. Exact match, the global wildcard and the resource
   * wildcard are each a single set lookup.
   */
  public static boolean grants(Set<String> granted, String required) {
    if (granted == null || granted.isEmpty() || required == null || required.isBlank()) {
      return false;
    }
    if (granted.contains(required) || granted.contains(ALL)) {
      return true;
    }
    final int separator = required.indexOf(':');
    return separator > 0
        && granted.contains(required.substring(0, separator) + RESOURCE_WILDCARD_SUFFIX);
  }

  /** Accepts catalogue entries, {@code *} and {@code <resource>:*} for a known resource. */
  public static boolean isAssignable(String permission) {
    if (permission == null || permission.isBlank()) {
      return false;
    }
    if (ALL.equals(permission) || CATALOGUE_SET.contains(permission)) {
      return true;
    }
    if (!permission.endsWith(RESOURCE_WILDCARD_SUFFIX)) {
      return false;
    }
    final String resource =
        permission.substring(0, permission.length() - RESOURCE_WILDCARD_SUFFIX.length());
    return CATALOGUE.stream().anyMatch(p -> p.startsWith(resource + ":"));
  }
}
