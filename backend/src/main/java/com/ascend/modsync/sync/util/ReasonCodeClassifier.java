package com.ascend.modsync.sync.util;

import com.ascend.modsync.sync.http.UpstreamException;
import com.ascend.modsync.sync.http.UpstreamPermanentException;
import com.ascend.modsync.sync.http.UpstreamRateLimitedException;
import com.ascend.modsync.sync.http.UpstreamTransientException;
import com.ascend.modsync.sync.model.HttpFetchResult;

import java.time.Duration;
import java.util.Locale;

public final class ReasonCodeClassifier {
  public static final String TIMEOUT = "TIMEOUT";
  public static final String IO_ERROR = "IO_ERROR";
  public static final String INTERRUPTED = "INTERRUPTED";
  public static final String MISSING_API_KEY = "MISSING_API_KEY";
  public static final String HTTP_400 = "HTTP_400";
  public static final String HTTP_401_403 = "HTTP_401_403";
  public static final String HTTP_404 = "HTTP_404";
  public static final String HTTP_429_RATE_LIMIT = "HTTP_429_RATE_LIMIT";
  public static final String HTTP_5XX = "HTTP_5XX";
  public static final String PARSING_FAILED = "PARSING_FAILED";
  public static final String UNKNOWN = "UNKNOWN";

  private ReasonCodeClassifier() {}

  public static String fromHttpStatus(Integer status) {
    if (status == null || status <= 0) {
      return UNKNOWN;
    }
    if (status == 400) {
      return HTTP_400;
    }
    if (status == 401 || status == 403) {
      return HTTP_401_403;
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
    if (code.contains("interrupted")) {
      return INTERRUPTED;
    }
    if (code.contains("io_error")) {
      return IO_ERROR;
    }
    return UNKNOWN;
  }

  /**
   * Maps a failed exchange onto the upstream error taxonomy. Transport errors, 408, 429
   * and 5xx are transient; every other non-2xx status is permanent.
   */
  public static UpstreamException toException(HttpFetchResult result) {
    if (result.errorCode() != null) {
      String reason = fromErrorCode(result.errorCode());
      return new UpstreamTransientException(
          reason + ": " + (result.errorMessage() == null ? result.errorCode() : result.errorMessage()),
          0);
    }
    int status = result.statusCode();
    String reason = fromHttpStatus(status);
    if (status == 429) {
      return new UpstreamRateLimitedException(parseRetryAfter(result.retryAfter()));
    }
    if (status == 408 || (status >= 500 && status < 600)) {
      return new UpstreamTransientException(reason + ": HTTP " + status, status);
    }
    return new UpstreamPermanentException(reason + ": HTTP " + status, status);
  }

  public static Duration parseRetryAfter(String header) {
    if (header == null || header.isBlank()) {
      return null;
    }
    try {
      long seconds = Long.parseLong(header.trim());
      return seconds < 0 ? null : Duration.ofSeconds(seconds);
    } catch (NumberFormatException e) {
      return null;
    }
  }
}
