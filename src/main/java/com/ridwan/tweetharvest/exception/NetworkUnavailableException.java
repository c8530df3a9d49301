package com.ridwan.tweetharvest.exception;

/** Network retries were exhausted. */
public class NetworkUnavailableException extends HarvestException {

  public NetworkUnavailableException(String message, Throwable cause) {
    super(message, cause);
  }
}
