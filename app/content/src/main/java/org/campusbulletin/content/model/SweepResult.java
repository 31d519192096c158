/*
 * Where: content domain model
 * What: Per-kind outcome of one cleanup sweep
 * Why: A failed kind is reported next to the kinds that were cleaned
 */
package org.campusbulletin.content.model;

import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

public record SweepResult(Map<ContentKind, Integer> deletedPerKind, Set<ContentKind> failedKinds) {

  public SweepResult {
    deletedPerKind =
        deletedPerKind.isEmpty()
            ? Collections.emptyMap()
            : Collections.unmodifiableMap(new EnumMap<>(deletedPerKind));
    failedKinds =
        failedKinds.isEmpty()
            ? Collections.emptySet()
            : Collections.unmodifiableSet(EnumSet.copyOf(failedKinds));
  }

  public int deleted(ContentKind kind) {
    return deletedPerKind.getOrDefault(kind, 0);
  }

  public int totalDeleted() {
    return deletedPerKind.values().stream().mapToInt(Integer::intValue).sum();
  }
}
