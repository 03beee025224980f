package com.example.auth.security;

import org.springframework.security.authorization.AuthorizationDecision;

/** Authorization decision that remembers why a gate said no. */
public class GateAuthorizationDecision extends AuthorizationDecision {

  public enum Outcome {
    GRANTED,
    UNAUTHENTICATED,
    FORBIDDEN
  }

  private final Outcome outcome;
  private final String message;

  private GateAuthorizationDecision(Outcome outcome, String message) {
    super(outcome == Outcome.GRANTED);
    this.outcome = outcome;
    this.message = message;
  }

  public static GateAuthorizationDecision granted() {
    return new GateAuthorizationDecision(Outcome.GRANTED, null);
  }

  public static GateAuthorizationDecision unauthenticated() {
    return new GateAuthorizationDecision(Outcome.UNAUTHENTICATED, "authentication required");
  }

  public static GateAuthorizationDecision forbidden(String message) {
    return new GateAuthorizationDecision(Outcome.FORBIDDEN, message);
  }

  public Outcome outcome() {
    return outcome;
  }

  public String message() {
    return message;
  }

  @Override
  public String toString() {
    return "GateAuthorizationDecision[outcome=" + outcome + ", message=" + message + "]";
  }
}
