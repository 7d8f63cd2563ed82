package com.delta.jobmatcher.match.api;

import com.delta.jobmatcher.match.llm.LlmInvocationException;
import java.util.Locale;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@RestControllerAdvice
public class PipelineExceptionHandler {
  private static final Logger log = LoggerFactory.getLogger(PipelineExceptionHandler.class);

  @ExceptionHandler(LlmInvocationException.class)
  public ResponseEntity<Map<String, String>> handleModelFailure(LlmInvocationException ex) {
    log.warn("Model call failed for {}: {}", ex.modelId(), ex.getMessage());
    String error = ex.reasonCode() == null ? "model_error" : ex.reasonCode().toLowerCase(Locale.ROOT);
    return ResponseEntity.status(HttpStatus.BAD_GATEWAY)
        .body(Map.of("error", error, "message", String.valueOf(ex.getMessage())));
  }

  @ExceptionHandler(IllegalArgumentException.class)
  public ResponseEntity<Map<String, String>> handleBadRequest(IllegalArgumentException ex) {
    return ResponseEntity.status(HttpStatus.BAD_REQUEST)
        .body(Map.of("error", "invalid_request", "message", String.valueOf(ex.getMessage())));
  }
}
