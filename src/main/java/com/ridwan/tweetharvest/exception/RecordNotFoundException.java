package com.ridwan.tweetharvest.exception;

public class RecordNotFoundException extends HarvestException {

  public RecordNotFoundException(String message) {
    super(message);
  }

  public RecordNotFoundException(String message, Throwable cause) {
    super(message, cause);
  }
}
