package com.civicbiz.catalog.ingest.util;

import com.civicbiz.catalog.ingest.model.HttpFetchResult;
import java.util.Locale;

public final class SourceErrorClassifier {
  public static final String TIMEOUT = "TIMEOUT";
  public static final String IO_ERROR = "IO_ERROR";
  public static final String INVALID_URL = "INVALID_URL";
  public static final String INTERRUPTED = "INTERRUPTED";
  public static final String HTTP_401 = "HTTP_401";
  public static final String HTTP_403_BLOCKED = "HTTP_403_BLOCKED";
  public static final String HTTP_404 = "HTTP_404";
  public static final String HTTP_429_RATE_LIMIT = "HTTP_429_RATE_LIMIT";
  public static final String HTTP_4XX = "HTTP_4XX";
  public static final String HTTP_5XX = "HTTP_5XX";
  public static final String PARSING_FAILED = "PARSING_FAILED";
  public static final String API_STATUS = "API_STATUS";
  public static final String UNKNOWN = "UNKNOWN";

  private SourceErrorClassifier() {}

  public static String classify(HttpFetchResult result) {
    if (result == null) {
      return UNKNOWN;
    }
    if (result.errorCode() != null) {
      return fromErrorCode(result.errorCode());
    }
    return fromHttpStatus(result.statusCode());
  }

  public static String fromHttpStatus(int status) {
    if (status <= 0) {
      return UNKNOWN;
    }
    if (status == 401) {
      return HTTP_401;
    }
    if (status == 403) {
      return HTTP_403_BLOCKED;
    }
    if (status == 404) {
      return HTTP_404;
    }
    if (status == 408) {
      return TIMEOUT;
    }
    if (status == 429) {
      return HTTP_429_RATE_LIMIT;
    }
    if (status >= 500 && status < 600) {
      return HTTP_5XX;
    }
    if (status >= 400) {
      return HTTP_4XX;
    }
    return UNKNOWN;
  }

  public static String fromErrorCode(String errorCode) {
    if (errorCode == null || errorCode.isBlank()) {
      return UNKNOWN;
    }
    String code = errorCode.toLowerCase(Locale.ROOT);
    if (code.contains("timeout")) {
      return TIMEOUT;
    }
    if (code.contains("io_error")) {
      return IO_ERROR;
    }
    if (code.contains("invalid_url")) {
      return INVALID_URL;
    }
    if (code.contains("interrupted")) {
      return INTERRUPTED;
    }
    return UNKNOWN;
  }

  public static boolean isRateLimit(String reasonCode) {
    return HTTP_429_RATE_LIMIT.equals(reasonCode) || HTTP_403_BLOCKED.equals(reasonCode);
  }

  public static boolean isRetryable(String reasonCode) {
    if (reasonCode == null) {
      return false;
    }
    return switch (reasonCode) {
      case TIMEOUT, IO_ERROR, HTTP_429_RATE_LIMIT, HTTP_403_BLOCKED, HTTP_5XX -> true;
      default -> false;
    };
  }
}
