package com.ridwan.tweetharvest.normalize;

import com.fasterxml.jackson.databind.JsonNode;
import com.ridwan.tweetharvest.model.TweetRecord;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Maps a raw upstream payload onto {@link TweetRecord}. Every field is resolved from an ordered
 * list of accessors and the first present, non-empty value wins.
 */
@Slf4j
@Component
public class TweetNormalizer {

  static final List<FieldAccessor> ID = accessors("id_str", "id", "rest_id", "tweet_id");
  static final List<FieldAccessor> TEXT =
      accessors("full_text", "text", "legacy.full_text", "content");
  static final List<FieldAccessor> CREATED_AT =
      accessors("created_at", "created_at_datetime", "date", "legacy.created_at");
  static final List<FieldAccessor> USERNAME =
      accessors(
          "username",
          "screen_name",
          "user.screen_name",
          "user.username",
          "author.username",
          "author.screen_name");
  static final List<FieldAccessor> DISPLAY_NAME =
      accessors("display_name", "name", "user.name", "author.name", "author.display_name");
  static final List<FieldAccessor> RETWEETS =
      accessors(
          "retweet_count", "retweets", "public_metrics.retweet_count", "legacy.retweet_count");
  static final List<FieldAccessor> LIKES =
      accessors(
          "favorite_count",
          "like_count",
          "likes",
          "public_metrics.like_count",
          "legacy.favorite_count");
  static final List<FieldAccessor> REPLIES =
      accessors("reply_count", "replies", "public_metrics.reply_count", "legacy.reply_count");
  static final List<FieldAccessor> QUOTES =
      accessors("quote_count", "quotes", "public_metrics.quote_count", "legacy.quote_count");
  static final List<FieldAccessor> VIEWS =
      accessors("view_count", "views.count", "views", "public_metrics.impression_count");

  private final TimestampNormalizer timestampNormalizer;

  public TweetNormalizer(TimestampNormalizer timestampNormalizer) {
    this.timestampNormalizer = timestampNormalizer;
  }

  /**
   * Normalizes one payload.
   *
   * @return the record, or empty when the payload has no usable id or text
   */
  public Optional<TweetRecord> normalize(JsonNode payload) {
    if (payload == null || !payload.isObject()) {
      return Optional.empty();
    }

    String id = text(payload, ID);
    String body = text(payload, TEXT).replace("\r\n", " ").replace('\n', ' ').replace('\r', ' ');
    if (id.isEmpty() || body.trim().isEmpty()) {
      log.debug("Rejecting payload without id or text: {}", payload);
      return Optional.empty();
    }

    String rawTimestamp = text(payload, CREATED_AT);
    Optional<LocalDateTime> createdAt = timestampNormalizer.parse(rawTimestamp);
    String username = text(payload, USERNAME);

    return Optional.of(
        TweetRecord.builder()
            .id(id)
            .timestamp(createdAt.map(TimestampNormalizer.OUTPUT_FORMAT::format).orElse(rawTimestamp))
            .createdAt(createdAt.orElse(null))
            .username(username)
            .displayName(text(payload, DISPLAY_NAME))
            .text(body)
            .retweets(number(payload, RETWEETS))
            .likes(number(payload, LIKES))
            .replies(number(payload, REPLIES))
            .quotes(number(payload, QUOTES))
            .views(number(payload, VIEWS))
            .url(username.isEmpty() ? "" : "https://twitter.com/" + username + "/status/" + id)
            .raw(payload)
            .build());
  }

  private static String text(JsonNode payload, List<FieldAccessor> accessors) {
    for (FieldAccessor accessor : accessors) {
      Optional<JsonNode> value = accessor.lookup(payload);
      if (value.isPresent() && value.get().isValueNode()) {
        return value.get().asText().trim();
      }
    }
    return "";
  }

  private static long number(JsonNode payload, List<FieldAccessor> accessors) {
    for (FieldAccessor accessor : accessors) {
      Optional<JsonNode> value = accessor.lookup(payload);
      if (value.isEmpty()) {
        continue;
      }
      JsonNode node = value.get();
      if (node.isNumber()) {
        return node.asLong();
      }
      if (node.isTextual()) {
        try {
          return Long.parseLong(node.asText().trim().replace(",", ""));
        } catch (NumberFormatException e) {
          log.debug("Ignoring non-numeric {} value: {}", accessor.getName(), node.asText());
        }
      }
    }
    return 0L;
  }

  private static List<FieldAccessor> accessors(String... paths) {
    return Stream.of(paths).map(FieldAccessor::path).collect(Collectors.toList());
  }
}
