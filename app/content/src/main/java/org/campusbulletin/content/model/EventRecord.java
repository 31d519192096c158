/*
 * Where: content domain model
 * What: Snapshot of an events row
 * Why: expiresAt holds only an explicit override; the derived expiry is computed by ExpirationPolicy
 */
package org.campusbulletin.content.model;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.util.UUID;

public record EventRecord(
    UUID eventId,
    String title,
    String description,
    LocalDate eventDate,
    LocalTime startTime,
    LocalTime endTime,
    String location,
    String organizer,
    Instant registrationDeadline,
    Instant expiresAt,
    boolean published,
    UUID createdBy,
    Instant createdAt,
    Instant updatedAt) {}
