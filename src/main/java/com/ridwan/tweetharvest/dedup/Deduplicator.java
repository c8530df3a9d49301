package com.ridwan.tweetharvest.dedup;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Identifiers already emitted during one session. Seeded from saved state on resume so that
 * re-fetched pages do not produce duplicate rows. Not thread-safe; one per session.
 */
public class Deduplicator {

  private final Set<String> seen;

  public Deduplicator() {
    this.seen = new LinkedHashSet<>();
  }

  public Deduplicator(Collection<String> alreadySeen) {
    this.seen = new LinkedHashSet<>(alreadySeen == null ? Set.of() : alreadySeen);
  }

  /**
   * Records the id.
   *
   * @return true if the id was new, false if it had been seen before
   */
  public boolean markSeen(String id) {
    return seen.add(id);
  }

  public boolean isSeen(String id) {
    return seen.contains(id);
  }

  public int size() {
    return seen.size();
  }

  public Set<String> snapshot() {
    return new LinkedHashSet<>(seen);
  }
}
