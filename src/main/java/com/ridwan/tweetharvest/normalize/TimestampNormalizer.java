package com.ridwan.tweetharvest.normalize;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Parses the timestamp shapes seen across upstream payloads and renders them as
 * {@code yyyy-MM-dd HH:mm:ss} in UTC. Values carrying an offset are shifted to UTC; values
 * without one are taken as-is.
 */
@Slf4j
@Component
public class TimestampNormalizer {

  public static final DateTimeFormatter OUTPUT_FORMAT =
      DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

  private static final List<DateTimeFormatter> OFFSET_FORMATS =
      List.of(
          DateTimeFormatter.ofPattern("EEE MMM dd HH:mm:ss Z yyyy", Locale.ENGLISH),
          DateTimeFormatter.ISO_OFFSET_DATE_TIME,
          DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss[.SSSSSS][.SSS]Z"));

  private static final List<DateTimeFormatter> LOCAL_FORMATS =
      List.of(
          OUTPUT_FORMAT,
          DateTimeFormatter.ISO_LOCAL_DATE_TIME,
          DateTimeFormatter.ofPattern("dd/MM/yyyy HH:mm:ss"),
          DateTimeFormatter.ofPattern("MM/dd/yyyy HH:mm:ss"));

  /** Parsed UTC date-time, or empty when no known format matches. */
  public Optional<LocalDateTime> parse(String raw) {
    if (raw == null || raw.isBlank()) {
      return Optional.empty();
    }
    String value = raw.trim();

    if (value.matches("\\d{10}")) {
      return Optional.of(toUtc(Instant.ofEpochSecond(Long.parseLong(value))));
    }
    if (value.matches("\\d{13}")) {
      return Optional.of(toUtc(Instant.ofEpochMilli(Long.parseLong(value))));
    }

    for (DateTimeFormatter format : OFFSET_FORMATS) {
      try {
        return Optional.of(toUtc(OffsetDateTime.parse(value, format).toInstant()));
      } catch (DateTimeParseException ignored) {
        // next format
      }
    }
    for (DateTimeFormatter format : LOCAL_FORMATS) {
      try {
        return Optional.of(LocalDateTime.parse(value, format));
      } catch (DateTimeParseException ignored) {
        // next format
      }
    }
    try {
      return Optional.of(LocalDate.parse(value).atStartOfDay());
    } catch (DateTimeParseException e) {
      log.debug("Unrecognized timestamp format: {}", value);
      return Optional.empty();
    }
  }

  /** Formatted timestamp, or the raw value unchanged when it cannot be parsed. */
  public String format(String raw) {
    return parse(raw).map(OUTPUT_FORMAT::format).orElse(raw == null ? "" : raw);
  }

  private LocalDateTime toUtc(Instant instant) {
    return LocalDateTime.ofInstant(instant, ZoneOffset.UTC);
  }
}
