package com.ridwan.tweetharvest.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/** How multiple keywords combine, both in the search query and in the local text filter. */
public enum KeywordOperator {
  AND,
  OR;

  @JsonValue
  public String getValue() {
    return name().toLowerCase();
  }

  @JsonCreator
  public static KeywordOperator fromValue(String value) {
    return value == null ? OR : valueOf(value.trim().toUpperCase());
  }
}
