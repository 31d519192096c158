/*
 * Where: content service layer
 * What: Saves and removes opportunity bookmarks and lists a user's live bookmarks
 * Why: Bookmarks are weak references; expired or unpublished opportunities drop out of the list
 */
package org.campusbulletin.content.service;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.campusbulletin.content.api.ContentNotFoundException;
import org.campusbulletin.content.model.OpportunityRecord;
import org.campusbulletin.content.repository.BookmarkRepository;
import org.campusbulletin.content.repository.OpportunityRepository;
import org.campusbulletin.content.repository.RecipientDirectory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class BookmarkService {

  private final BookmarkRepository bookmarkRepository;
  private final OpportunityRepository opportunityRepository;
  private final RecipientDirectory recipientDirectory;
  private final ActiveContentService activeContentService;
  private final ExpirationPolicy expirationPolicy;
  private final Clock clock;

  /** Idempotent; returns {@code true} when a new bookmark was stored. */
  public boolean addBookmark(UUID userId, UUID opportunityId) {
    requireRecipient(userId);
    activeContentService.getLiveOpportunity(opportunityId);
    try {
      return bookmarkRepository.insertIfAbsent(opportunityId, userId, Instant.now(clock));
    } catch (DataIntegrityViolationException ex) {
      // The opportunity or the account vanished after the checks above.
      throw new ContentNotFoundException("opportunity", opportunityId);
    }
  }

  /** Idempotent; removing a missing bookmark is not an error. */
  public boolean removeBookmark(UUID userId, UUID opportunityId) {
    return bookmarkRepository.delete(opportunityId, userId);
  }

  public List<OpportunityRecord> listBookmarks(UUID userId) {
    final Instant now = Instant.now(clock);
    return opportunityRepository.findPublishedBookmarkedBy(userId).stream()
        .filter(opportunity -> expirationPolicy.isLive(opportunity, now))
        .toList();
  }

  private void requireRecipient(UUID userId) {
    if (!recipientDirectory.exists(userId)) {
      throw new ContentNotFoundException("recipient", userId);
    }
  }
}
