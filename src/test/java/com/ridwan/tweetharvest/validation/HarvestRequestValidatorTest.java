package com.ridwan.tweetharvest.validation;

import static org.junit.jupiter.api.Assertions.*;

import com.ridwan.tweetharvest.exception.MalformedInputException;
import com.ridwan.tweetharvest.model.HarvestSettings;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.Arrays;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class HarvestRequestValidatorTest {

  private HarvestRequestValidator validator;

  @BeforeEach
  void setUp() {
    Clock clock = Clock.fixed(Instant.parse("2024-06-15T12:00:00Z"), ZoneOffset.UTC);
    validator = new HarvestRequestValidator(clock);
  }

  @Test
  void shouldPassValidationWithUsernameAndDateRange() {
    HarvestSettings settings =
        HarvestSettings.builder()
            .username("@alice")
            .since("2024-01-01")
            .until("2024-02-01")
            .maxTweets(100)
            .build();

    assertDoesNotThrow(() -> validator.validateTimelineRequest(settings));
  }

  @Test
  void shouldFailWithoutUsernameOrKeywords() {
    MalformedInputException exception =
        assertThrows(
            MalformedInputException.class,
            () -> validator.validateTimelineRequest(new HarvestSettings()));

    assertTrue(exception.getMessage().contains("username or at least one keyword"));
  }

  @Test
  void shouldFailWhenAllKeywordsAreBlank() {
    HarvestSettings settings = HarvestSettings.builder().keywords(Arrays.asList(" ", "")).build();

    assertThrows(MalformedInputException.class, () -> validator.validateTimelineRequest(settings));
  }

  @Test
  void shouldFailOnInvalidUsername() {
    HarvestSettings settings = HarvestSettings.builder().username("not a handle!").build();

    MalformedInputException exception =
        assertThrows(
            MalformedInputException.class, () -> validator.validateTimelineRequest(settings));

    assertTrue(exception.getMessage().contains("Invalid username"));
  }

  @Test
  void shouldFailWhenMaxTweetsIsNotPositive() {
    HarvestSettings settings = HarvestSettings.builder().username("alice").maxTweets(0).build();

    MalformedInputException exception =
        assertThrows(
            MalformedInputException.class, () -> validator.validateTimelineRequest(settings));

    assertTrue(exception.getMessage().contains("greater than 0"));
  }

  @Test
  void shouldFailWhenStartIsAfterEnd() {
    HarvestSettings settings =
        HarvestSettings.builder().username("alice").since("2024-03-01").until("2024-02-01").build();

    MalformedInputException exception =
        assertThrows(
            MalformedInputException.class, () -> validator.validateTimelineRequest(settings));

    assertTrue(exception.getMessage().contains("after end date"));
  }

  @Test
  void shouldFailWhenStartIsInTheFuture() {
    HarvestSettings settings = HarvestSettings.builder().username("alice").since("2024-07-01").build();

    assertThrows(MalformedInputException.class, () -> validator.validateTimelineRequest(settings));
  }

  @Test
  void shouldClampFutureEndDateToToday() {
    HarvestSettings settings =
        HarvestSettings.builder().username("alice").since("2024-06-01").until("2025-01-01").build();

    validator.validateTimelineRequest(settings);

    assertEquals("2024-06-15", settings.getUntil());
  }

  @Test
  void shouldFailOnUnparseableDate() {
    HarvestSettings settings = HarvestSettings.builder().username("alice").since("01/02/2024").build();

    assertThrows(MalformedInputException.class, () -> validator.validateTimelineRequest(settings));
  }

  @Test
  void shouldParseDateWithTimeSuffix() {
    assertEquals(
        LocalDate.of(2024, 1, 1), HarvestRequestValidator.parseDate("2024-01-01_00:00:00_UTC"));
  }

  @Test
  void shouldValidateBatchUsernames() {
    assertThrows(
        MalformedInputException.class,
        () -> validator.validateBatchRequest(Arrays.asList(" ", "@", null), null));
    assertDoesNotThrow(() -> validator.validateBatchRequest(List.of("alice", "@bob"), null));
  }

  @Test
  void shouldCleanUsernames() {
    assertEquals(
        List.of("alice", "bob"),
        HarvestRequestValidator.cleanUsernames(Arrays.asList(" @alice ", "", null, "bob")));
  }

  @Test
  void shouldRejectEmptyLinkList() {
    assertThrows(MalformedInputException.class, () -> validator.validateLinks(List.of()));
    assertThrows(MalformedInputException.class, () -> validator.validateLinks(List.of("  ")));
    assertThrows(MalformedInputException.class, () -> validator.validateLinks(null));
  }
}
