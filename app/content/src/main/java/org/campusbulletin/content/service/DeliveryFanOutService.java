/*
 * Where: content service layer
 * What: Persists a notification, resolves its audience and writes one delivery row per recipient
 * Why: Delivery rows are materialized once at publish time; reads never recompute the audience
 */
package org.campusbulletin.content.service;

import com.google.common.annotations.VisibleForTesting;
import java.time.Clock;
import java.time.Instant;
import java.util.Set;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.campusbulletin.content.model.DeliveryResult;
import org.campusbulletin.content.model.NotificationRecord;
import org.campusbulletin.content.model.TargetingSpec;
import org.campusbulletin.content.repository.DeliveryRepository;
import org.campusbulletin.content.repository.NotificationRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

/**
 * Best-effort broadcast. The notification row is written first and on its own; if that fails no
 * delivery row exists. Each recipient insert is independent and idempotent on (notification,
 * recipient), so a failed recipient is logged and skipped, and re-running the fan-out only fills
 * the gaps.
 */
@Service
@RequiredArgsConstructor
public class DeliveryFanOutService {

  private static final Logger logger = LoggerFactory.getLogger(DeliveryFanOutService.class);

  private final NotificationRepository notificationRepository;
  private final DeliveryRepository deliveryRepository;
  private final AudienceResolver audienceResolver;
  private final ContentMetrics metrics;
  private final Clock clock;

  public DeliveryResult deliver(NotificationRecord notification, TargetingSpec spec) {
    // Reject bad targeting before anything is written.
    audienceResolver.validate(spec);
    notificationRepository.insert(notification);
    return fanOut(notification.notificationId(), spec);
  }

  /** Re-runs fan-out for an already persisted notification. */
  public DeliveryResult redeliver(UUID notificationId, TargetingSpec spec) {
    audienceResolver.validate(spec);
    return fanOut(notificationId, spec);
  }

  @VisibleForTesting
  DeliveryResult fanOut(UUID notificationId, TargetingSpec spec) {
    final Set<UUID> audience = audienceResolver.resolve(spec);
    final Instant now = Instant.now(clock);
    int delivered = 0;
    int duplicates = 0;
    int failed = 0;
    for (UUID recipientId : audience) {
      try {
        if (deliveryRepository.insertIfAbsent(notificationId, recipientId, now)) {
          delivered++;
        } else {
          duplicates++;
        }
      } catch (DataAccessException ex) {
        failed++;
        logRecipientFailure(notificationId, recipientId, ex);
      } catch (RuntimeException ex) {
        failed++;
        logRecipientFailure(notificationId, recipientId, ex);
      }
    }
    metrics.recordFanOut(ContentMetrics.RESULT_DELIVERED, delivered);
    metrics.recordFanOut(ContentMetrics.RESULT_DUPLICATE, duplicates);
    metrics.recordFanOut(ContentMetrics.RESULT_FAILED, failed);
    incrementSendCount(notificationId, delivered);
    logger.info(
        "notification fan-out finished notificationId={} audience={} delivered={} duplicates={} failed={}",
        notificationId,
        audience.size(),
        delivered,
        duplicates,
        failed);
    return new DeliveryResult(notificationId, delivered);
  }

  // send_count is telemetry; losing an increment must not fail the publish.
  private void incrementSendCount(UUID notificationId, int delivered) {
    if (delivered == 0) {
      return;
    }
    try {
      notificationRepository.incrementSendCount(notificationId, delivered);
    } catch (DataAccessException ex) {
      logger.warn(
          "notification send_count update failed notificationId={} delta={}",
          notificationId,
          delivered,
          ex);
    }
  }

  private void logRecipientFailure(UUID notificationId, UUID recipientId, RuntimeException ex) {
    logger.warn(
        "notification delivery skipped notificationId={} recipientId={}",
        notificationId,
        recipientId,
        ex);
  }
}
