package com.ridwan.tweetharvest.pagination;

public enum EngineState {
  AUTHENTICATING,
  SEARCHING,
  CONSUMING_PAGE,
  ADVANCING_PAGE,
  PROMPT_NEEDED,
  DONE,
  ABORTED;

  public boolean isTerminal() {
    return this == DONE || this == ABORTED;
  }
}
