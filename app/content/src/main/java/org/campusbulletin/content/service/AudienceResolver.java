/*
 * Where: content service layer
 * What: Turns a targeting specification into the set of recipient ids
 * Why: Fan-out needs a concrete audience computed from current recipient attributes
 */
package org.campusbulletin.content.service;

import java.util.LinkedHashSet;
import java.util.Set;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.campusbulletin.content.api.InvalidSpecException;
import org.campusbulletin.content.model.TargetingMode;
import org.campusbulletin.content.model.TargetingSpec;
import org.campusbulletin.content.repository.RecipientDirectory;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class AudienceResolver {

  private final RecipientDirectory recipientDirectory;

  public Set<UUID> resolve(TargetingSpec spec) {
    final TargetingMode mode = validate(spec);
    return switch (mode) {
      case ALL_USERS -> recipientDirectory.findAllIds();
      case FILTERED ->
          recipientDirectory.findIdsMatching(spec.branchId(), spec.year(), spec.semester());
      // Ids that no longer have an account are dropped silently.
      case EXPLICIT -> recipientDirectory.findExistingIds(parseRecipientIds(spec));
    };
  }

  /**
   * Checks that exactly one targeting mode is populated and that explicit ids are well formed.
   * Does not touch the store.
   */
  public TargetingMode validate(TargetingSpec spec) {
    if (spec == null) {
      throw new InvalidSpecException("targeting is required");
    }
    int populated = 0;
    TargetingMode mode = null;
    if (spec.allUsers()) {
      populated++;
      mode = TargetingMode.ALL_USERS;
    }
    if (spec.hasFilters()) {
      populated++;
      mode = TargetingMode.FILTERED;
    }
    if (spec.hasRecipientList()) {
      populated++;
      mode = TargetingMode.EXPLICIT;
    }
    if (populated == 0) {
      throw new InvalidSpecException(
          "targeting must select all users, branch/year/semester filters or recipient ids");
    }
    if (populated > 1) {
      throw new InvalidSpecException("targeting modes are mutually exclusive");
    }
    if (mode == TargetingMode.FILTERED) {
      requirePositive(spec.year(), "year");
      requirePositive(spec.semester(), "semester");
    }
    if (mode == TargetingMode.EXPLICIT) {
      parseRecipientIds(spec);
    }
    return mode;
  }

  private Set<UUID> parseRecipientIds(TargetingSpec spec) {
    final Set<UUID> ids = new LinkedHashSet<>();
    for (String raw : spec.recipientIds()) {
      if (raw == null || raw.isBlank()) {
        throw new InvalidSpecException("recipient id must not be blank");
      }
      try {
        ids.add(UUID.fromString(raw.trim()));
      } catch (IllegalArgumentException ex) {
        throw new InvalidSpecException("recipient id is not a valid identifier: " + raw);
      }
    }
    return ids;
  }

  private void requirePositive(Integer value, String name) {
    if (value != null && value <= 0) {
      throw new InvalidSpecException(name + " must be positive");
    }
  }
}
