package com.example.auth.api.response;

import com.example.auth.model.AuthenticatedIdentity;
import com.fasterxml.jackson.annotation.JsonInclude;
import java.util.List;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record MeResponse(
    String userId,
    String email,
    String role,
    String authMethod,
    String apiKeyId,
    List<String> permissions) {

  public static MeResponse from(AuthenticatedIdentity identity) {
    if (identity.apiKey() == null) {
      return new MeResponse(
          identity.userId(),
          identity.email(),
          identity.role(),
          identity.authMethod().tagValue(),
          null,
          null);
    }
    return new MeResponse(
        identity.userId(),
        null,
        null,
        identity.authMethod().tagValue(),
        identity.apiKey().id(),
        identity.apiKey().permissions().stream().sorted().toList());
  }
}
