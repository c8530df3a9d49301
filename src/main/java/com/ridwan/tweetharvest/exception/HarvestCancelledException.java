package com.ridwan.tweetharvest.exception;

/**
 * Thrown at a yield point once the caller requested a stop. Never escapes a run; the engine turns
 * it into an aborted result.
 */
public class HarvestCancelledException extends HarvestException {

  public HarvestCancelledException(String message) {
    super(message);
  }
}
