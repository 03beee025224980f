package com.example.auth.service;

public class ApiKeyNotFoundException extends RuntimeException {

  public ApiKeyNotFoundException(String message) {
    super(message);
  }
}
