package com.example.auth.service;

import com.example.auth.model.ApiKeyRecord;

/** A freshly created key. {@code rawKey} is returned to the caller once and never persisted. */
public record GeneratedApiKey(String rawKey, ApiKeyRecord record) {}
