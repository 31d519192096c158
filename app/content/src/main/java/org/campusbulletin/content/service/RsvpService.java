package org.campusbulletin.content.service;

import java.time.Clock;
import java.time.Instant;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.campusbulletin.content.api.ContentNotFoundException;
import org.campusbulletin.content.repository.RecipientDirectory;
import org.campusbulletin.content.repository.RsvpRepository;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;

/** Event attendance registrations. Both directions are idempotent. */
@Service
@RequiredArgsConstructor
public class RsvpService {

  private final RsvpRepository rsvpRepository;
  private final RecipientDirectory recipientDirectory;
  private final ActiveContentService activeContentService;
  private final Clock clock;

  public boolean addRsvp(UUID userId, UUID eventId) {
    if (!recipientDirectory.exists(userId)) {
      throw new ContentNotFoundException("recipient", userId);
    }
    activeContentService.getLiveEvent(eventId);
    try {
      return rsvpRepository.insertIfAbsent(eventId, userId, Instant.now(clock));
    } catch (DataIntegrityViolationException ex) {
      throw new ContentNotFoundException("event", eventId);
    }
  }

  public boolean removeRsvp(UUID userId, UUID eventId) {
    return rsvpRepository.delete(eventId, userId);
  }

  public int rsvpCount(UUID eventId) {
    return rsvpRepository.countByEvent(eventId);
  }
}
