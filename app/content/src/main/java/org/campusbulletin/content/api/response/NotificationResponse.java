package org.campusbulletin.content.api.response;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.time.Instant;
import java.util.UUID;
import org.campusbulletin.content.model.NotificationPriority;
import org.campusbulletin.content.model.NotificationRecord;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record NotificationResponse(
    UUID notificationId,
    String title,
    String category,
    NotificationPriority priority,
    boolean published,
    Instant expiresAt,
    int sendCount,
    Instant createdAt,
    Instant updatedAt) {

  public static NotificationResponse from(NotificationRecord record) {
    return new NotificationResponse(
        record.notificationId(),
        record.title(),
        record.category(),
        record.priority(),
        record.published(),
        record.expiresAt(),
        record.sendCount(),
        record.createdAt(),
        record.updatedAt());
  }
}
