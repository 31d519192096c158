/*
 * Where: content API response model
 * What: One unread notification in a recipient's feed
 * Why: Flattens the delivery and notification join into the shape clients render
 */
package org.campusbulletin.content.api.response;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.time.Instant;
import java.util.UUID;
import org.campusbulletin.content.model.NotificationPriority;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record InboxItem(
    UUID notificationId,
    String title,
    String body,
    String category,
    NotificationPriority priority,
    JsonNode payload,
    boolean read,
    Instant readAt,
    Instant expiresAt,
    Instant createdAt,
    Instant deliveredAt) {}
