package com.example.auth.service;

public class InvalidApiKeyRequestException extends RuntimeException {

  public InvalidApiKeyRequestException(String message) {
    super(message);
  }
}
