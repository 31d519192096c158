package org.campusbulletin.content.api.response;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.util.UUID;
import org.campusbulletin.content.model.EventRecord;

/** {@code expiresAt} is the effective expiry, derived from the event date when not overridden. */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record EventResponse(
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
    Integer rsvpCount,
    Instant createdAt) {

  public static EventResponse from(EventRecord record, Instant effectiveExpiry, Integer rsvpCount) {
    return new EventResponse(
        record.eventId(),
        record.title(),
        record.description(),
        record.eventDate(),
        record.startTime(),
        record.endTime(),
        record.location(),
        record.organizer(),
        record.registrationDeadline(),
        effectiveExpiry,
        record.published(),
        rsvpCount,
        record.createdAt());
  }
}
