package com.example.auth.api.response;

import com.example.auth.service.GeneratedApiKey;
import com.fasterxml.jackson.annotation.JsonUnwrapped;

/** Creation response; {@code key} is the only time the raw key leaves the service. */
public record CreatedApiKeyResponse(@JsonUnwrapped ApiKeyResponse apiKey, String key) {

  public static CreatedApiKeyResponse from(GeneratedApiKey generated) {
    return new CreatedApiKeyResponse(ApiKeyResponse.from(generated.record()), generated.rawKey());
  }
}
