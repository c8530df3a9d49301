package com.ridwan.tweetharvest.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum SessionMode {
  SINGLE("single", "Single scraping"),
  BATCH("batch", "Batch scraping"),
  LINKS("links", "Link scraping");

  private final String value;
  private final String description;

  SessionMode(String value, String description) {
    this.value = value;
    this.description = description;
  }

  @JsonValue
  public String getValue() {
    return value;
  }

  public String getDescription() {
    return description;
  }

  @JsonCreator
  public static SessionMode fromValue(String value) {
    for (SessionMode mode : values()) {
      if (mode.value.equalsIgnoreCase(value)) {
        return mode;
      }
    }
    throw new IllegalArgumentException("Unknown session mode: " + value);
  }
}
