package com.example.auth.security;

public final class UserRoles {

  public static final String ADMIN = "admin";
  public static final String OPERATOR = "operator";

  private UserRoles() {}
}
