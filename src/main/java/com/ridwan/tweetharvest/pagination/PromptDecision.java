package com.ridwan.tweetharvest.pagination;

/** Caller's answer when a run keeps getting empty pages. */
public enum PromptDecision {
  /** Keep paging with a fresh empty-page streak. */
  CONTINUE,
  /** End the run now. */
  STOP,
  /** No answer; keep paging until the forced-stop ceiling. */
  UNRESOLVED
}
