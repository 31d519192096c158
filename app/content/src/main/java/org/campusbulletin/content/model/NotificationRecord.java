/*
 * Where: content domain model
 * What: Snapshot of a notifications row
 * Why: Shared by fan-out, read-state queries and the sweeper
 */
package org.campusbulletin.content.model;

import java.time.Instant;
import java.util.UUID;

public record NotificationRecord(
    UUID notificationId,
    String title,
    String body,
    String category,
    NotificationPriority priority,
    String payloadJson,
    String targetingJson,
    boolean published,
    Instant expiresAt,
    int sendCount,
    UUID createdBy,
    Instant createdAt,
    Instant updatedAt) {}
