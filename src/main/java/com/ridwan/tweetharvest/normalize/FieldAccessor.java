package com.ridwan.tweetharvest.normalize;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.Optional;
import lombok.Value;

/** A named, dotted path into an upstream payload, e.g. {@code user.screen_name}. */
@Value
public class FieldAccessor {

  String name;
  String[] segments;

  public static FieldAccessor path(String dotted) {
    return new FieldAccessor(dotted, dotted.split("\\."));
  }

  /** The value at this path when it exists, is not null and is not an empty string. */
  public Optional<JsonNode> lookup(JsonNode payload) {
    if (payload == null) {
      return Optional.empty();
    }
    JsonNode node = payload;
    for (String segment : segments) {
      node = node.path(segment);
      if (node.isMissingNode() || node.isNull()) {
        return Optional.empty();
      }
    }
    if (node.isTextual() && node.asText().trim().isEmpty()) {
      return Optional.empty();
    }
    return Optional.of(node);
  }
}
