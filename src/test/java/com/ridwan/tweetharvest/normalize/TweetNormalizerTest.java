package com.ridwan.tweetharvest.normalize;

import static org.junit.jupiter.api.Assertions.*;

import com.ridwan.tweetharvest.model.TweetRecord;
import com.ridwan.tweetharvest.support.TweetFixtures;
import java.time.LocalDateTime;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class TweetNormalizerTest {

  private TweetNormalizer normalizer;

  @BeforeEach
  void setUp() {
    normalizer = new TweetNormalizer(new TimestampNormalizer());
  }

  @Test
  void shouldNormalizeClassicPayload() {
    TweetRecord record =
        normalizer
            .normalize(
                TweetFixtures.tweet("42", "Hello\nworld", "Mon Jan 15 10:30:00 +0000 2024", "alice"))
            .orElseThrow();

    assertEquals("42", record.getId());
    assertEquals("Hello world", record.getText(), "Newlines should become spaces");
    assertEquals("2024-01-15 10:30:00", record.getTimestamp());
    assertEquals(LocalDateTime.of(2024, 1, 15, 10, 30), record.getCreatedAt());
    assertEquals("alice", record.getUsername());
    assertEquals("ALICE", record.getDisplayName());
    assertEquals(1, record.getRetweets());
    assertEquals(2, record.getLikes());
    assertEquals(3, record.getReplies());
    assertEquals(4, record.getQuotes());
    assertEquals(50, record.getViews());
    assertEquals("https://twitter.com/alice/status/42", record.getUrl());
  }

  @Test
  void shouldProduceSameRecordFromAlternativeFieldNames() {
    String classic =
        "{\"id_str\": \"7\", \"full_text\": \"gm\", \"created_at\": \"2024-02-01T09:00:00Z\","
            + " \"user\": {\"screen_name\": \"bob\", \"name\": \"Bob\"},"
            + " \"retweet_count\": 5, \"favorite_count\": 6, \"reply_count\": 7,"
            + " \"quote_count\": 8, \"views\": {\"count\": \"1,234\"}}";
    String modern =
        "{\"rest_id\": \"7\", \"legacy\": {\"full_text\": \"gm\", \"retweet_count\": 5,"
            + " \"favorite_count\": 6, \"reply_count\": 7, \"quote_count\": 8,"
            + " \"created_at\": \"Thu Feb 01 09:00:00 +0000 2024\"},"
            + " \"author\": {\"username\": \"bob\", \"name\": \"Bob\"}, \"view_count\": 1234}";
    String flat =
        "{\"id\": 7, \"text\": \"gm\", \"date\": \"1706778000\", \"username\": \"bob\","
            + " \"display_name\": \"Bob\", \"retweets\": \"5\", \"likes\": 6, \"replies\": 7,"
            + " \"quotes\": 8, \"views\": 1234}";

    TweetRecord expected = withoutRaw(normalizer.normalize(TweetFixtures.json(classic)));

    assertEquals(expected, withoutRaw(normalizer.normalize(TweetFixtures.json(modern))));
    assertEquals(expected, withoutRaw(normalizer.normalize(TweetFixtures.json(flat))));
    assertEquals(1234, expected.getViews());
    assertEquals("2024-02-01 09:00:00", expected.getTimestamp());
  }

  @Test
  void shouldFallBackWhenFirstCandidateIsBlank() {
    TweetRecord record =
        normalizer
            .normalize(
                TweetFixtures.json(
                    "{\"id_str\": \"\", \"id\": \"9\", \"full_text\": \"  \", \"text\": \"hi\"}"))
            .orElseThrow();

    assertEquals("9", record.getId());
    assertEquals("hi", record.getText());
  }

  @Test
  void shouldDefaultMissingCountersToZeroAndKeepUnparseableTimestamp() {
    TweetRecord record =
        normalizer
            .normalize(
                TweetFixtures.json(
                    "{\"id\": \"1\", \"text\": \"hi\", \"created_at\": \"sometime\","
                        + " \"likes\": \"lots\"}"))
            .orElseThrow();

    assertEquals(0, record.getLikes());
    assertEquals(0, record.getViews());
    assertEquals("sometime", record.getTimestamp());
    assertNull(record.getCreatedAt());
    assertEquals("", record.getUrl(), "No username means no URL");
  }

  @Test
  void shouldRejectPayloadWithoutIdOrText() {
    assertTrue(normalizer.normalize(TweetFixtures.json("{\"text\": \"orphan\"}")).isEmpty());
    assertTrue(normalizer.normalize(TweetFixtures.json("{\"id\": \"1\"}")).isEmpty());
    assertTrue(normalizer.normalize(TweetFixtures.json("[1, 2]")).isEmpty());
    assertTrue(normalizer.normalize(null).isEmpty());
  }

  private static TweetRecord withoutRaw(Optional<TweetRecord> record) {
    TweetRecord r = record.orElseThrow();
    return TweetRecord.builder()
        .id(r.getId())
        .timestamp(r.getTimestamp())
        .createdAt(r.getCreatedAt())
        .username(r.getUsername())
        .displayName(r.getDisplayName())
        .text(r.getText())
        .retweets(r.getRetweets())
        .likes(r.getLikes())
        .replies(r.getReplies())
        .quotes(r.getQuotes())
        .views(r.getViews())
        .url(r.getUrl())
        .build();
  }
}
