package com.delta.jobmatcher.match.util;

import java.util.Locale;

public final class ReasonCodeClassifier {
  public static final String QUOTA_EXCEEDED = "QUOTA_EXCEEDED";
  public static final String PROVIDER_ERROR = "PROVIDER_ERROR";
  public static final String MALFORMED_RESPONSE = "MALFORMED_RESPONSE";
  public static final String VALIDATION_FAILED = "VALIDATION_FAILED";
  public static final String DUPLICATE_ID = "DUPLICATE_ID";
  public static final String UNKNOWN_POSTING_ID = "UNKNOWN_POSTING_ID";
  public static final String NOT_SCORED = "NOT_SCORED";
  public static final String SKIPPED_QUOTA_EXHAUSTED = "SKIPPED_QUOTA_EXHAUSTED";
  public static final String SKIPPED_INTERRUPTED = "SKIPPED_INTERRUPTED";
  public static final String STAGE_FAILED = "STAGE_FAILED";
  public static final String TIMEOUT = "TIMEOUT";
  public static final String HTTP_4XX = "HTTP_4XX";
  public static final String HTTP_5XX = "HTTP_5XX";
  public static final String UNKNOWN = "UNKNOWN";

  private ReasonCodeClassifier() {}

  public static String fromHttpStatus(Integer status) {
    if (status == null || status <= 0) {
      return UNKNOWN;
    }
    if (status == 408) {
      return TIMEOUT;
    }
    if (status == 429) {
      return QUOTA_EXCEEDED;
    }
    if (status >= 400 && status < 500) {
      return HTTP_4XX;
    }
    if (status >= 500 && status < 600) {
      return HTTP_5XX;
    }
    return UNKNOWN;
  }

  /**
   * Classifies free-form provider error text. Providers do not always use status codes
   * for quota errors, so the message is inspected as well.
   */
  public static boolean looksLikeQuotaError(String errorText) {
    if (errorText == null || errorText.isBlank()) {
      return false;
    }
    String lower = errorText.toLowerCase(Locale.ROOT);
    return lower.contains("429")
        || lower.contains("quota")
        || lower.contains("rate limit")
        || lower.contains("resource_exhausted");
  }
}
