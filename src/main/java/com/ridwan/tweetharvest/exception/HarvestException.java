package com.ridwan.tweetharvest.exception;

/** Root of every failure a harvest session can surface to its caller. */
public class HarvestException extends RuntimeException {

  public HarvestException(String message) {
    super(message);
  }

  public HarvestException(String message, Throwable cause) {
    super(message, cause);
  }
}
