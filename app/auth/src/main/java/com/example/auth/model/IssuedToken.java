package com.example.auth.model;

import java.time.Instant;

public record IssuedToken(String token, Instant expiresAt) {}
