package com.ridwan.tweetharvest.pagination;

/** Asked, at most once per empty-page streak, whether a run that has gone quiet should go on. */
@FunctionalInterface
public interface EmptyPagePromptHandler {

  EmptyPagePromptHandler UNRESOLVED = (emptyPages, accepted) -> PromptDecision.UNRESOLVED;

  PromptDecision onEmptyPages(int consecutiveEmptyPages, int acceptedSoFar);
}
