/*
 * Where: content domain model
 * What: One recipient's copy of a notification with its read state
 * Why: (notificationId, recipientId) identifies the row; the table enforces it as the primary key
 */
package org.campusbulletin.content.model;

import java.time.Instant;
import java.util.UUID;

public record DeliveryRecord(
    UUID notificationId, UUID recipientId, boolean read, Instant readAt, Instant createdAt) {}
