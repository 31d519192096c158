/*
 * Where: content service layer
 * What: Creates events and opportunities and edits their publication state
 * Why: One source-of-truth row per item; natural-key clashes surface as conflicts
 */
package org.campusbulletin.content.service;

import java.time.Clock;
import java.time.Instant;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.campusbulletin.content.api.ContentConflictException;
import org.campusbulletin.content.api.ContentNotFoundException;
import org.campusbulletin.content.api.request.CreateEventRequest;
import org.campusbulletin.content.api.request.CreateOpportunityRequest;
import org.campusbulletin.content.api.request.PublicationUpdateRequest;
import org.campusbulletin.content.model.EventRecord;
import org.campusbulletin.content.model.OpportunityRecord;
import org.campusbulletin.content.repository.EventRepository;
import org.campusbulletin.content.repository.OpportunityRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class ContentAuthoringService {

  private static final Logger logger = LoggerFactory.getLogger(ContentAuthoringService.class);

  private final EventRepository eventRepository;
  private final OpportunityRepository opportunityRepository;
  private final Clock clock;

  public EventRecord createEvent(CreateEventRequest request) {
    if (request.startTime() != null
        && request.endTime() != null
        && request.endTime().isBefore(request.startTime())) {
      throw new IllegalArgumentException("end_time must not be before start_time");
    }
    final Instant now = Instant.now(clock);
    final EventRecord record =
        new EventRecord(
            UUID.randomUUID(),
            request.title(),
            request.description(),
            request.eventDate(),
            request.startTime(),
            request.endTime(),
            request.location(),
            request.organizer(),
            request.registrationDeadline(),
            request.expiresAt(),
            request.published() == null || request.published(),
            request.createdBy(),
            now,
            now);
    try {
      eventRepository.insert(record);
    } catch (DuplicateKeyException ex) {
      throw new ContentConflictException(
          "event already exists: " + request.title() + " on " + request.eventDate(), ex);
    }
    logger.info("event created eventId={} eventDate={}", record.eventId(), record.eventDate());
    return record;
  }

  public OpportunityRecord createOpportunity(CreateOpportunityRequest request) {
    final Instant now = Instant.now(clock);
    final OpportunityRecord record =
        new OpportunityRecord(
            UUID.randomUUID(),
            request.title(),
            request.opportunityType(),
            request.organization(),
            request.description(),
            request.location(),
            request.applicationReference(),
            request.deadline(),
            request.published() == null || request.published(),
            request.createdBy(),
            now,
            now);
    try {
      opportunityRepository.insert(record);
    } catch (DuplicateKeyException ex) {
      throw new ContentConflictException(
          "opportunity already exists: " + request.title() + " at " + request.organization(), ex);
    }
    logger.info(
        "opportunity created opportunityId={} deadline={}",
        record.opportunityId(),
        record.deadline());
    return record;
  }

  public EventRecord updateEvent(UUID eventId, PublicationUpdateRequest request) {
    final EventRecord current =
        eventRepository
            .findById(eventId)
            .orElseThrow(() -> new ContentNotFoundException("event", eventId));
    final boolean published = request.publishedOr(current.published());
    final Instant expiresAt = request.expiryOr(current.expiresAt());
    if (eventRepository.updatePublication(eventId, published, expiresAt, Instant.now(clock)) == 0) {
      throw new ContentNotFoundException("event", eventId);
    }
    logger.info("event updated eventId={} published={} expiresAt={}", eventId, published, expiresAt);
    return eventRepository
        .findById(eventId)
        .orElseThrow(() -> new ContentNotFoundException("event", eventId));
  }

  public OpportunityRecord updateOpportunity(UUID opportunityId, PublicationUpdateRequest request) {
    final OpportunityRecord current =
        opportunityRepository
            .findById(opportunityId)
            .orElseThrow(() -> new ContentNotFoundException("opportunity", opportunityId));
    final boolean published = request.publishedOr(current.published());
    final Instant deadline = request.expiryOr(current.deadline());
    if (opportunityRepository.updatePublication(
            opportunityId, published, deadline, Instant.now(clock))
        == 0) {
      throw new ContentNotFoundException("opportunity", opportunityId);
    }
    logger.info(
        "opportunity updated opportunityId={} published={} deadline={}",
        opportunityId,
        published,
        deadline);
    return opportunityRepository
        .findById(opportunityId)
        .orElseThrow(() -> new ContentNotFoundException("opportunity", opportunityId));
  }
}
