package com.ridwan.tweetharvest.validation;

import com.ridwan.tweetharvest.exception.MalformedInputException;
import com.ridwan.tweetharvest.model.HarvestSettings;
import java.time.Clock;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/** Rejects malformed requests before any upstream call is made. */
@Component
@Slf4j
public class HarvestRequestValidator {

  private static final int MAX_RECOMMENDED_BATCH = 50;

  private final Clock clock;

  public HarvestRequestValidator(Clock clock) {
    this.clock = clock;
  }

  /**
   * Validates a single-timeline request. An end date in the future is clamped to today on the
   * given settings.
   */
  public void validateTimelineRequest(HarvestSettings settings) {
    log.info("Validating harvest request...");

    if (settings == null) {
      throw new MalformedInputException("Harvest settings are required");
    }
    boolean hasKeywords = settings.getKeywords() != null && !settings.getKeywords().isEmpty();
    if (!settings.hasUsername() && !hasKeywords) {
      throw new MalformedInputException(
          "Either a username or at least one keyword is required.\n"
              + "Example: username=elonmusk or keywords=bitcoin,ethereum");
    }
    if (!settings.hasUsername() && settings.getCleanKeywords().isEmpty()) {
      throw new MalformedInputException("All keywords are blank: " + settings.getKeywords());
    }
    if (settings.hasUsername() && !settings.getUsername().trim().matches("@?\\w{1,50}")) {
      throw new MalformedInputException("Invalid username: " + settings.getUsername());
    }

    validateMaxTweets(settings.getMaxTweets());
    validateDateRange(settings);

    log.debug("Harvest request validation passed");
  }

  public void validateBatchRequest(List<String> usernames, HarvestSettings settings) {
    List<String> cleaned = cleanUsernames(usernames);
    if (cleaned.isEmpty()) {
      throw new MalformedInputException("Batch requires at least one non-blank username");
    }
    if (cleaned.size() > MAX_RECOMMENDED_BATCH) {
      log.warn(
          "Batch is very large: {} users. This will take a long time. Recommended max: {}",
          cleaned.size(),
          MAX_RECOMMENDED_BATCH);
    }
    if (settings != null) {
      validateMaxTweets(settings.getMaxTweets());
      validateDateRange(settings);
    }
    log.debug("Batch request validation passed: {} users", cleaned.size());
  }

  public void validateLinks(List<String> links) {
    if (links == null || links.stream().allMatch(l -> l == null || l.isBlank())) {
      throw new MalformedInputException("No tweet links provided");
    }
  }

  /** Trims, strips a leading {@code @} and drops blank entries. */
  public static List<String> cleanUsernames(List<String> usernames) {
    if (usernames == null) {
      return List.of();
    }
    return usernames.stream()
        .filter(u -> u != null && !u.isBlank())
        .map(u -> u.trim().replaceFirst("^@+", ""))
        .filter(u -> !u.isEmpty())
        .collect(Collectors.toList());
  }

  /**
   * Parses {@code yyyy-MM-dd}, ignoring an {@code _HH:mm:ss_UTC}-style suffix.
   *
   * @throws MalformedInputException when the date cannot be parsed
   */
  public static LocalDate parseDate(String value) {
    String datePart = value.trim();
    int suffix = datePart.indexOf('_');
    if (suffix > 0) {
      datePart = datePart.substring(0, suffix);
    }
    try {
      return LocalDate.parse(datePart);
    } catch (DateTimeParseException e) {
      throw new MalformedInputException("Invalid date (expected yyyy-MM-dd): " + value, e);
    }
  }

  private void validateMaxTweets(Integer maxTweets) {
    if (maxTweets != null && maxTweets <= 0) {
      throw new MalformedInputException("Max tweets must be greater than 0, got: " + maxTweets);
    }
  }

  private void validateDateRange(HarvestSettings settings) {
    LocalDate today = LocalDate.now(clock);
    LocalDate start = isSet(settings.getSince()) ? parseDate(settings.getSince()) : null;
    LocalDate end = isSet(settings.getUntil()) ? parseDate(settings.getUntil()) : null;

    if (end != null && end.isAfter(today)) {
      log.warn("End date {} is in the future, clamping to {}", end, today);
      end = today;
      settings.setUntil(today.toString());
    }
    if (start != null && end != null && start.isAfter(end)) {
      throw new MalformedInputException(
          "Start date " + start + " is after end date " + end);
    }
    if (start != null && start.isAfter(today)) {
      throw new MalformedInputException("Start date " + start + " is in the future");
    }
  }

  private static boolean isSet(String value) {
    return value != null && !value.isBlank();
  }
}
