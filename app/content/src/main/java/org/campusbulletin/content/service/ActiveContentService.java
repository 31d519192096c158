/*
 * Where: content service layer
 * What: Merges live events and opportunities into one feed and serves single live items
 * Why: Visibility comes from ExpirationPolicy at read time, whether or not the sweeper has run
 */
package org.campusbulletin.content.service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.campusbulletin.content.api.ContentNotFoundException;
import org.campusbulletin.content.model.ActiveContentItem;
import org.campusbulletin.content.model.ContentKind;
import org.campusbulletin.content.model.EventRecord;
import org.campusbulletin.content.model.FeedFilter;
import org.campusbulletin.content.model.OpportunityRecord;
import org.campusbulletin.content.repository.EventRepository;
import org.campusbulletin.content.repository.OpportunityRepository;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class ActiveContentService {

  // Calendar day ascending (undated last), then newest first, then id for a stable order.
  static final Comparator<ActiveContentItem> FEED_ORDER =
      Comparator.comparing(
              ActiveContentItem::effectiveDate, Comparator.nullsLast(Comparator.naturalOrder()))
          .thenComparing(ActiveContentItem::createdAt, Comparator.reverseOrder())
          .thenComparing(ActiveContentItem::id);

  private final EventRepository eventRepository;
  private final OpportunityRepository opportunityRepository;
  private final ExpirationPolicy expirationPolicy;
  private final Clock clock;

  public List<ActiveContentItem> activeFeed(FeedFilter filter) {
    return activeFeed(filter, Instant.now(clock));
  }

  public List<ActiveContentItem> activeFeed(FeedFilter filter, Instant asOf) {
    final List<ActiveContentItem> items = new ArrayList<>();
    if (filter.includes(ContentKind.EVENT)) {
      for (EventRecord event : eventRepository.findPublishedCandidates(asOf)) {
        if (expirationPolicy.isLive(event, asOf)) {
          items.add(project(event));
        }
      }
    }
    if (filter.includes(ContentKind.OPPORTUNITY)) {
      for (OpportunityRecord opportunity : opportunityRepository.findPublishedCandidates(asOf)) {
        if (expirationPolicy.isLive(opportunity, asOf)) {
          items.add(project(opportunity));
        }
      }
    }
    items.sort(FEED_ORDER);
    return List.copyOf(items);
  }

  /** Live items whose expiry falls within {@code window} from now, soonest first. */
  public List<ActiveContentItem> expiringWithin(Duration window) {
    if (window.isNegative() || window.isZero()) {
      throw new IllegalArgumentException("within must be a positive duration");
    }
    final Instant now = Instant.now(clock);
    final Instant horizon = now.plus(window);
    return activeFeed(FeedFilter.ALL, now).stream()
        .filter(item -> item.expiresAt() != null && !item.expiresAt().isAfter(horizon))
        .sorted(
            Comparator.comparing(ActiveContentItem::expiresAt)
                .thenComparing(ActiveContentItem::id))
        .toList();
  }

  public EventRecord getLiveEvent(UUID eventId) {
    return eventRepository
        .findById(eventId)
        .filter(event -> expirationPolicy.isLive(event, Instant.now(clock)))
        .orElseThrow(() -> new ContentNotFoundException("event", eventId));
  }

  public OpportunityRecord getLiveOpportunity(UUID opportunityId) {
    return opportunityRepository
        .findById(opportunityId)
        .filter(opportunity -> expirationPolicy.isLive(opportunity, Instant.now(clock)))
        .orElseThrow(() -> new ContentNotFoundException("opportunity", opportunityId));
  }

  ActiveContentItem project(EventRecord event) {
    return new ActiveContentItem(
        event.eventId(),
        ContentKind.EVENT,
        event.title(),
        event.description(),
        expirationPolicy.startOf(event.eventDate()),
        event.eventDate(),
        event.location(),
        expirationPolicy.effectiveExpiry(event),
        event.published(),
        event.createdAt());
  }

  ActiveContentItem project(OpportunityRecord opportunity) {
    return new ActiveContentItem(
        opportunity.opportunityId(),
        ContentKind.OPPORTUNITY,
        opportunity.title(),
        opportunity.description(),
        opportunity.deadline(),
        opportunity.deadline() == null ? null : expirationPolicy.dayOf(opportunity.deadline()),
        opportunity.location(),
        opportunity.deadline(),
        opportunity.published(),
        opportunity.createdAt());
  }
}
