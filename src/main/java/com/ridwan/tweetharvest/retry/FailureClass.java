package com.ridwan.tweetharvest.retry;

import com.ridwan.tweetharvest.exception.AuthExpiredException;
import com.ridwan.tweetharvest.exception.NetworkUnavailableException;
import com.ridwan.tweetharvest.exception.RecordNotFoundException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import org.springframework.web.reactive.function.client.WebClientResponseException;

/**
 * How a failed upstream call should be handled.
 *
 * <p>Usage: {@code FailureClass failure = FailureClass.classify(exception);}
 *
 * <p>Known exception types are matched first, anywhere in the cause chain. Otherwise the
 * messages and class names of the chain are scanned for keywords, and the first class in {@link
 * #KEYWORDS} order that matches wins.
 */
public enum FailureClass {
  RATE_LIMITED("Rate limited"),
  AUTH_EXPIRED("Authentication expired"),
  PAGINATION_GLITCH("Pagination glitch"),
  NETWORK("Network error"),
  UNKNOWN("Unknown error");

  private static final int MAX_CAUSE_DEPTH = 10;

  /** Order matters: first match wins. */
  private static final Map<FailureClass, List<String>> KEYWORDS = new LinkedHashMap<>();

  static {
    KEYWORDS.put(
        RATE_LIMITED,
        List.of(
            "rate limit",
            "too many requests",
            "429",
            "slow down",
            "try again later",
            "throttle",
            "rate_limit"));
    KEYWORDS.put(
        AUTH_EXPIRED,
        List.of(
            "unauthorized",
            "forbidden",
            "authentication",
            "token",
            "expired",
            "401",
            "403",
            "login",
            "credential",
            "invalid cookie",
            "not authenticated"));
    KEYWORDS.put(
        PAGINATION_GLITCH,
        List.of("not found", "404", "no data", "empty response", "cursor", "cannot iterate"));
    KEYWORDS.put(
        NETWORK,
        List.of(
            "timeout",
            "timed out",
            "unreachable",
            "connection reset",
            "connection refused",
            "connection aborted",
            "broken pipe",
            "temporary failure",
            "name resolution",
            "network is down",
            "no route to host",
            "ssl",
            "handshake",
            "eof",
            "socket",
            "500",
            "502",
            "503",
            "504",
            "service unavailable",
            "bad gateway",
            "over capacity"));
  }

  private final String label;

  FailureClass(String label) {
    this.label = label;
  }

  public String getLabel() {
    return label;
  }

  public static FailureClass classify(Throwable exception) {
    if (exception == null) {
      return UNKNOWN;
    }

    Throwable current = exception;
    for (int depth = 0; current != null && depth < MAX_CAUSE_DEPTH; depth++) {
      FailureClass byType = classifyByType(current);
      if (byType != null) {
        return byType;
      }
      current = current.getCause();
    }

    String haystack = describeChain(exception);
    for (Map.Entry<FailureClass, List<String>> entry : KEYWORDS.entrySet()) {
      if (containsAny(haystack, entry.getValue())) {
        return entry.getKey();
      }
    }
    return UNKNOWN;
  }

  private static FailureClass classifyByType(Throwable t) {
    if (t instanceof AuthExpiredException) {
      return AUTH_EXPIRED;
    }
    if (t instanceof RecordNotFoundException) {
      return PAGINATION_GLITCH;
    }
    if (t instanceof NetworkUnavailableException) {
      return NETWORK;
    }
    if (t instanceof WebClientResponseException) {
      return classifyStatus(((WebClientResponseException) t).getStatusCode().value());
    }
    if (t instanceof java.net.SocketTimeoutException
        || t instanceof java.net.ConnectException
        || t instanceof java.net.UnknownHostException
        || t instanceof java.net.NoRouteToHostException
        || t instanceof java.net.SocketException
        || t instanceof java.util.concurrent.TimeoutException) {
      return NETWORK;
    }
    return null;
  }

  private static FailureClass classifyStatus(int status) {
    if (status == 401 || status == 403) {
      return AUTH_EXPIRED;
    }
    if (status == 429) {
      return RATE_LIMITED;
    }
    if (status == 404) {
      return PAGINATION_GLITCH;
    }
    if (status >= 500) {
      return NETWORK;
    }
    return null;
  }

  private static String describeChain(Throwable exception) {
    StringBuilder text = new StringBuilder();
    Throwable current = exception;
    for (int depth = 0; current != null && depth < MAX_CAUSE_DEPTH; depth++) {
      text.append(current.getClass().getSimpleName()).append(' ');
      if (current.getMessage() != null) {
        text.append(current.getMessage()).append(' ');
      }
      current = current.getCause();
    }
    return text.toString().toLowerCase(Locale.ROOT);
  }

  private static boolean containsAny(String text, List<String> keywords) {
    for (String keyword : keywords) {
      if (text.contains(keyword)) {
        return true;
      }
    }
    return false;
  }
}
