package com.ridwan.tweetharvest.output;

import java.text.Normalizer;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;

/** Turns arbitrary text into a worksheet title that spreadsheet applications accept. */
public final class SheetNameSanitizer {

  public static final int MAX_LENGTH = 31;

  private static final DateTimeFormatter FALLBACK_FORMAT =
      DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");

  private SheetNameSanitizer() {}

  /**
   * Sanitizes {@code name}. Disallowed characters become underscores, anything outside letters,
   * digits, spaces, underscores and hyphens is dropped, separator runs collapse to a single
   * underscore and the result is trimmed to 31 characters.
   *
   * @param now used for the {@code Sheet_yyyyMMdd_HHmmss} fallback when nothing survives
   */
  public static String sanitize(String name, LocalDateTime now) {
    String fallback = "Sheet_" + FALLBACK_FORMAT.format(now);
    if (name == null || name.isBlank()) {
      return fallback;
    }

    String cleaned = Normalizer.normalize(name, Normalizer.Form.NFKD);
    cleaned = cleaned.replaceAll("[\\\\/*\\[\\]:?|<>\"'`~!@#$%^&(){}=+;,.]", "_");
    cleaned = cleaned.replaceAll("[^A-Za-z0-9\\s_-]", "");
    cleaned = cleaned.replaceAll("[\\s_-]+", "_");
    cleaned = stripSeparators(cleaned);

    if (cleaned.length() > MAX_LENGTH) {
      cleaned = stripSeparators(cleaned.substring(0, MAX_LENGTH));
    }
    return cleaned.isEmpty() ? fallback : cleaned;
  }

  private static String stripSeparators(String value) {
    return value.replaceAll("^[_\\s-]+|[_\\s-]+$", "");
  }
}
