/*
 * Where: content service layer
 * What: Physically deletes expired notifications, events and opportunities with their dependents
 * Why: Keeps the tables the live filters scan small; visibility never depends on it having run
 */
package org.campusbulletin.content.service;

import com.google.common.annotations.VisibleForTesting;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.campusbulletin.content.model.ContentKind;
import org.campusbulletin.content.model.EventRecord;
import org.campusbulletin.content.model.NotificationRecord;
import org.campusbulletin.content.model.OpportunityRecord;
import org.campusbulletin.content.model.SweepResult;
import org.campusbulletin.content.repository.BookmarkRepository;
import org.campusbulletin.content.repository.DeliveryRepository;
import org.campusbulletin.content.repository.EventRepository;
import org.campusbulletin.content.repository.NotificationRepository;
import org.campusbulletin.content.repository.OpportunityRepository;
import org.campusbulletin.content.repository.RsvpRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * One sweep handles each content kind in its own transaction: lock the SQL-narrowed candidates
 * with {@code FOR UPDATE SKIP LOCKED}, keep those {@link ExpirationPolicy#isExpired} confirms,
 * delete their dependents and then the rows themselves. A concurrent sweep skips the locked rows
 * and, once the first commits, finds nothing left. A failure in one kind is logged and recorded
 * without stopping the others.
 */
@Service
@RequiredArgsConstructor
public class CleanupSweepService {

  private static final Logger logger = LoggerFactory.getLogger(CleanupSweepService.class);

  private final NotificationRepository notificationRepository;
  private final DeliveryRepository deliveryRepository;
  private final EventRepository eventRepository;
  private final RsvpRepository rsvpRepository;
  private final OpportunityRepository opportunityRepository;
  private final BookmarkRepository bookmarkRepository;
  private final ExpirationPolicy expirationPolicy;
  private final ContentMetrics metrics;
  private final Clock clock;
  private final PlatformTransactionManager transactionManager;

  public SweepResult sweep() {
    final Instant now = Instant.now(clock);
    final long startedNanos = System.nanoTime();
    final Map<ContentKind, Integer> deleted = new EnumMap<>(ContentKind.class);
    final Set<ContentKind> failed = EnumSet.noneOf(ContentKind.class);
    for (ContentKind kind : ContentKind.values()) {
      try {
        final int count = sweepKind(kind, now);
        deleted.put(kind, count);
        metrics.recordSweepDeleted(kind, count);
      } catch (DataAccessException ex) {
        recordFailure(kind, failed, ex);
      } catch (RuntimeException ex) {
        recordFailure(kind, failed, ex);
      }
    }
    metrics.recordSweepDuration(Duration.ofNanos(System.nanoTime() - startedNanos));
    final SweepResult result = new SweepResult(deleted, failed);
    logger.info(
        "cleanup sweep finished now={} deleted={} failedKinds={}",
        now,
        result.deletedPerKind(),
        result.failedKinds());
    return result;
  }

  @VisibleForTesting
  int sweepKind(ContentKind kind, Instant now) {
    final TransactionTemplate transactionTemplate = new TransactionTemplate(transactionManager);
    final Integer count =
        transactionTemplate.execute(
            status ->
                switch (kind) {
                  case NOTIFICATION -> sweepNotifications(now);
                  case EVENT -> sweepEvents(now);
                  case OPPORTUNITY -> sweepOpportunities(now);
                });
    return count == null ? 0 : count;
  }

  private int sweepNotifications(Instant now) {
    final List<UUID> expiredIds =
        notificationRepository.lockExpiryCandidates(now).stream()
            .filter(notification -> expirationPolicy.isExpired(notification, now))
            .map(NotificationRecord::notificationId)
            .toList();
    if (expiredIds.isEmpty()) {
      return 0;
    }
    final int deliveries = deliveryRepository.deleteByNotificationIds(expiredIds);
    final int notifications = notificationRepository.deleteByIds(expiredIds);
    logger.debug("swept notifications count={} deliveries={}", notifications, deliveries);
    return notifications;
  }

  private int sweepEvents(Instant now) {
    final List<UUID> expiredIds =
        eventRepository.lockExpiryCandidates(expirationPolicy.today(now)).stream()
            .filter(event -> expirationPolicy.isExpired(event, now))
            .map(EventRecord::eventId)
            .toList();
    if (expiredIds.isEmpty()) {
      return 0;
    }
    final int rsvps = rsvpRepository.deleteByEventIds(expiredIds);
    final int events = eventRepository.deleteByIds(expiredIds);
    logger.debug("swept events count={} rsvps={}", events, rsvps);
    return events;
  }

  private int sweepOpportunities(Instant now) {
    final List<UUID> expiredIds =
        opportunityRepository.lockExpiryCandidates(now).stream()
            .filter(opportunity -> expirationPolicy.isExpired(opportunity, now))
            .map(OpportunityRecord::opportunityId)
            .toList();
    if (expiredIds.isEmpty()) {
      return 0;
    }
    final int bookmarks = bookmarkRepository.deleteByOpportunityIds(expiredIds);
    final int opportunities = opportunityRepository.deleteByIds(expiredIds);
    logger.debug("swept opportunities count={} bookmarks={}", opportunities, bookmarks);
    return opportunities;
  }

  private void recordFailure(ContentKind kind, Set<ContentKind> failed, RuntimeException ex) {
    failed.add(kind);
    metrics.recordSweepFailure(kind);
    logger.error("cleanup sweep failed kind={}", kind, ex);
  }
}
