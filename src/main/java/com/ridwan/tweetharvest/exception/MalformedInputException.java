package com.ridwan.tweetharvest.exception;

/** Rejected request input: bad query, bad date range, unusable link list or saved state. */
public class MalformedInputException extends HarvestException {

  public MalformedInputException(String message) {
    super(message);
  }

  public MalformedInputException(String message, Throwable cause) {
    super(message, cause);
  }
}
