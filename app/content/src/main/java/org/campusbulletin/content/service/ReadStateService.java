/*
 * Where: content service layer
 * What: Read/unread state of a recipient's deliveries: mark read, unread count and unread feed
 * Why: Counts and feeds apply the notification live rule at read time, never the sweeper's progress
 */
package org.campusbulletin.content.service;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.campusbulletin.content.api.ContentNotFoundException;
import org.campusbulletin.content.model.InboxEntry;
import org.campusbulletin.content.model.MarkReadResult;
import org.campusbulletin.content.repository.DeliveryRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class ReadStateService {

  private static final Logger logger = LoggerFactory.getLogger(ReadStateService.class);

  private final DeliveryRepository deliveryRepository;
  private final ExpirationPolicy expirationPolicy;
  private final Clock clock;

  /**
   * Marks one delivery as read. The guarded update is the only write; the existence lookup runs
   * only when nothing changed, to tell "already read" from "no such delivery".
   */
  public MarkReadResult markRead(UUID notificationId, UUID recipientId) {
    final int updated = deliveryRepository.markRead(notificationId, recipientId, Instant.now(clock));
    if (updated > 0) {
      return MarkReadResult.MARKED;
    }
    if (deliveryRepository.exists(notificationId, recipientId)) {
      return MarkReadResult.ALREADY_READ;
    }
    throw new ContentNotFoundException(
        "delivery not found: notification=" + notificationId + " recipient=" + recipientId);
  }

  /** Marks every live unread delivery of the recipient; returns how many rows changed. */
  public int markAllRead(UUID recipientId) {
    final int marked = deliveryRepository.markAllLiveRead(recipientId, Instant.now(clock));
    logger.info("deliveries marked read recipientId={} count={}", recipientId, marked);
    return marked;
  }

  public int unreadCount(UUID recipientId) {
    return deliveryRepository.countUnreadLive(recipientId, Instant.now(clock));
  }

  /**
   * Newest notification first; an offset past the end yields an empty list. The query pages on the
   * same live condition the policy applies, and rows are re-checked against the policy.
   */
  public List<InboxEntry> unreadList(UUID recipientId, int limit, int offset) {
    if (limit < 0 || offset < 0) {
      throw new IllegalArgumentException("limit and offset must not be negative");
    }
    final Instant now = Instant.now(clock);
    return deliveryRepository.findUnreadLive(recipientId, now, limit, offset).stream()
        .filter(entry -> expirationPolicy.isLive(entry.notification(), now))
        .toList();
  }
}
