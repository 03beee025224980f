package com.example.auth.security;

import com.example.auth.api.ApiErrorResponse;
import com.example.auth.api.AuthErrorCode;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import lombok.RequiredArgsConstructor;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;

/** Writes {@link ApiErrorResponse} bodies for rejections raised outside of controllers. */
@Component
@RequiredArgsConstructor
public class ApiErrorWriter {

  private final ObjectMapper objectMapper;

  public void write(HttpServletResponse response, AuthErrorCode code, String message)
      throws IOException {
    response.setStatus(code.status().value());
    response.setContentType(MediaType.APPLICATION_JSON_VALUE);
    response.setCharacterEncoding("UTF-8");
    objectMapper.writeValue(response.getOutputStream(), new ApiErrorResponse(code.name(), message));
  }
}
