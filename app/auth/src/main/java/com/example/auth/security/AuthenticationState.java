package com.example.auth.security;

/** Terminal states of credential dispatch for one request. */
public enum AuthenticationState {
  AUTHENTICATED_SESSION,
  AUTHENTICATED_API_KEY,
  REJECTED
}
