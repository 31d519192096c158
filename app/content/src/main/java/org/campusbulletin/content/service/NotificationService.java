/*
 * Where: content service layer
 * What: Notification authoring: create with fan-out, administrative edits and re-delivery
 * Why: Keeps request mapping and JSON serialization out of the fan-out engine
 */
package org.campusbulletin.content.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.time.Clock;
import java.time.Instant;
import java.util.Map;
import java.util.UUID;
import org.campusbulletin.content.api.ContentNotFoundException;
import org.campusbulletin.content.api.request.CreateNotificationRequest;
import org.campusbulletin.content.api.request.PublicationUpdateRequest;
import org.campusbulletin.content.model.DeliveryResult;
import org.campusbulletin.content.model.NotificationPriority;
import org.campusbulletin.content.model.NotificationRecord;
import org.campusbulletin.content.model.TargetingSpec;
import org.campusbulletin.content.repository.NotificationRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
public class NotificationService {

  private static final Logger logger = LoggerFactory.getLogger(NotificationService.class);
  private static final String KIND = "notification";

  private final NotificationRepository notificationRepository;
  private final DeliveryFanOutService fanOutService;
  private final Clock clock;

  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "ObjectMapper is a shared Spring-managed component and cannot be copied")
  private final ObjectMapper objectMapper;

  public NotificationService(
      NotificationRepository notificationRepository,
      DeliveryFanOutService fanOutService,
      Clock clock,
      ObjectMapper objectMapper) {
    this.notificationRepository = notificationRepository;
    this.fanOutService = fanOutService;
    this.clock = clock;
    this.objectMapper = objectMapper;
  }

  public DeliveryResult createNotification(CreateNotificationRequest request) {
    final Instant now = Instant.now(clock);
    if (request.expiresAt() != null && !request.expiresAt().isAfter(now)) {
      throw new IllegalArgumentException("expires_at must be in the future");
    }
    final NotificationRecord record =
        new NotificationRecord(
            UUID.randomUUID(),
            request.title(),
            request.body(),
            request.category(),
            request.priority() == null ? NotificationPriority.NORMAL : request.priority(),
            serializePayload(request.payload()),
            serialize(request.targeting(), "targeting"),
            true,
            request.expiresAt(),
            0,
            request.createdBy(),
            now,
            now);
    final DeliveryResult result = fanOutService.deliver(record, request.targeting());
    logger.info(
        "notification created notificationId={} category={} delivered={}",
        result.notificationId(),
        record.category(),
        result.deliveredCount());
    return result;
  }

  public NotificationRecord updateNotification(
      UUID notificationId, PublicationUpdateRequest request) {
    final NotificationRecord current = requireNotification(notificationId);
    final boolean published = request.publishedOr(current.published());
    final Instant expiresAt = request.expiryOr(current.expiresAt());
    final Instant now = Instant.now(clock);
    final int updated =
        notificationRepository.updatePublication(notificationId, published, expiresAt, now);
    if (updated == 0) {
      // Swept between the read and the update.
      throw new ContentNotFoundException(KIND, notificationId);
    }
    logger.info(
        "notification updated notificationId={} published={} expiresAt={}",
        notificationId,
        published,
        expiresAt);
    return requireNotification(notificationId);
  }

  /**
   * Resolves the stored targeting again and fills in missing delivery rows, for example after a
   * partial fan-out or for recipients who joined a targeted group later.
   */
  public DeliveryResult redeliver(UUID notificationId) {
    final NotificationRecord record = requireNotification(notificationId);
    final TargetingSpec spec = deserializeTargeting(record);
    final DeliveryResult result = fanOutService.redeliver(notificationId, spec);
    logger.info(
        "notification redelivered notificationId={} delivered={}",
        notificationId,
        result.deliveredCount());
    return result;
  }

  private NotificationRecord requireNotification(UUID notificationId) {
    return notificationRepository
        .findById(notificationId)
        .orElseThrow(() -> new ContentNotFoundException(KIND, notificationId));
  }

  private String serializePayload(Map<String, Object> payload) {
    if (payload == null || payload.isEmpty()) {
      return null;
    }
    return serialize(payload, "payload");
  }

  private String serialize(Object value, String field) {
    try {
      return objectMapper.writeValueAsString(value);
    } catch (JsonProcessingException ex) {
      throw new IllegalArgumentException(field + " is not serializable", ex);
    }
  }

  private TargetingSpec deserializeTargeting(NotificationRecord record) {
    try {
      return objectMapper.readValue(record.targetingJson(), TargetingSpec.class);
    } catch (JsonProcessingException ex) {
      throw new IllegalStateException(
          "stored targeting is unreadable notificationId=" + record.notificationId(), ex);
    }
  }
}
