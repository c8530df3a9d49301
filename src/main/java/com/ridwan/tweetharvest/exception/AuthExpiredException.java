package com.ridwan.tweetharvest.exception;

/**
 * Upstream credentials were rejected and the caller did not supply fresh ones. The session state
 * has already been saved when this reaches the caller.
 */
public class AuthExpiredException extends HarvestException {

  public AuthExpiredException(String message) {
    super(message);
  }

  public AuthExpiredException(String message, Throwable cause) {
    super(message, cause);
  }
}
