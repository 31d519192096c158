/*
 * Where: content domain model
 * What: Audience definition attached to a notification
 * Why: Persisted as targeting_json so a notification can be re-delivered later
 */
package org.campusbulletin.content.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.UUID;

/**
 * Exactly one of three modes must be populated: {@code allUsers}, any combination of the
 * branch/year/semester filters, or an explicit recipient list. Explicit ids are kept as strings so
 * that malformed entries can be reported instead of failing JSON binding.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record TargetingSpec(
    boolean allUsers, UUID branchId, Integer year, Integer semester, List<String> recipientIds) {

  public TargetingSpec {
    if (recipientIds != null) {
      recipientIds = Collections.unmodifiableList(new ArrayList<>(recipientIds));
    }
  }

  public static TargetingSpec everyone() {
    return new TargetingSpec(true, null, null, null, null);
  }

  public static TargetingSpec filtered(UUID branchId, Integer year, Integer semester) {
    return new TargetingSpec(false, branchId, year, semester, null);
  }

  public static TargetingSpec explicit(List<String> recipientIds) {
    return new TargetingSpec(false, null, null, null, recipientIds);
  }

  public boolean hasFilters() {
    return branchId != null || year != null || semester != null;
  }

  public boolean hasRecipientList() {
    return recipientIds != null && !recipientIds.isEmpty();
  }
}
