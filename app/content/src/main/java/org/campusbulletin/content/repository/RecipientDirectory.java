/*
 * Where: content data access
 * What: Read-only view of the recipient accounts and their current branch/year/semester
 * Why: Accounts are owned by another system; the audience resolver only needs lookups
 */
package org.campusbulletin.content.repository;

import java.util.Collection;
import java.util.Set;
import java.util.UUID;

public interface RecipientDirectory {

  Set<UUID> findAllIds();

  /** Null arguments place no constraint on that dimension. */
  Set<UUID> findIdsMatching(UUID branchId, Integer year, Integer semester);

  /** Returns the subset of {@code candidateIds} that still has an account. */
  Set<UUID> findExistingIds(Collection<UUID> candidateIds);

  boolean exists(UUID recipientId);
}
