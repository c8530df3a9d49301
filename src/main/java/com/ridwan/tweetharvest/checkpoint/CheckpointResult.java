package com.ridwan.tweetharvest.checkpoint;

import com.ridwan.tweetharvest.model.SessionState;
import java.util.Optional;
import lombok.Value;

/** Outcome of a checkpoint store operation. The store never throws; it returns one of these. */
@Value
public class CheckpointResult {

  boolean success;
  String message;
  SessionState state;

  public static CheckpointResult ok(String message) {
    return new CheckpointResult(true, message, null);
  }

  public static CheckpointResult ok(String message, SessionState state) {
    return new CheckpointResult(true, message, state);
  }

  public static CheckpointResult failure(String message) {
    return new CheckpointResult(false, message, null);
  }

  public Optional<SessionState> getStateIfPresent() {
    return Optional.ofNullable(state);
  }
}
