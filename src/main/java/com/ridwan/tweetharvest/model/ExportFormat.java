package com.ridwan.tweetharvest.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum ExportFormat {
  CSV("csv", "csv"),
  EXCEL("excel", "xlsx");

  private final String value;
  private final String extension;

  ExportFormat(String value, String extension) {
    this.value = value;
    this.extension = extension;
  }

  @JsonValue
  public String getValue() {
    return value;
  }

  public String getExtension() {
    return extension;
  }

  /** Accepts {@code csv}, {@code excel} or {@code xlsx}, case-insensitively. */
  @JsonCreator
  public static ExportFormat fromValue(String value) {
    if (value == null) {
      throw new IllegalArgumentException("Export format must not be null");
    }
    String normalized = value.trim().toLowerCase();
    for (ExportFormat format : values()) {
      if (format.value.equals(normalized) || format.extension.equals(normalized)) {
        return format;
      }
    }
    throw new IllegalArgumentException("Unknown export format: " + value);
  }
}
