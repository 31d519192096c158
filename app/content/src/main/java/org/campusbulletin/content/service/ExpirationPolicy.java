/*
 * Where: content service layer
 * What: Decides whether a notification, event or opportunity is live or expired at a given instant
 * Why: Read paths and the cleanup sweeper call the same predicates, so they cannot disagree
 */
package org.campusbulletin.content.service;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import lombok.RequiredArgsConstructor;
import org.campusbulletin.content.config.ExpirationProperties;
import org.campusbulletin.content.model.EventRecord;
import org.campusbulletin.content.model.NotificationRecord;
import org.campusbulletin.content.model.OpportunityRecord;
import org.springframework.stereotype.Component;

/**
 * Side-effect-free expiry rules for each content kind.
 *
 * <p>{@code isLive} is what every read path filters on: publication flag plus time window. {@code
 * isExpired} is the time component alone and is what the sweeper deletes on. For every item,
 * {@code isExpired(item, now)} implies {@code !isLive(item, now)}, so the sweeper never removes
 * something a reader at the same instant would still show. Unpublished items whose window has not
 * passed are drafts and are neither live nor expired.
 *
 * <p>An event with an explicit expiry also drops out of the live set once its date is behind
 * today. The derived expiry already ends after the grace period, so only overrides need the date
 * check.
 */
@Component
@RequiredArgsConstructor
public class ExpirationPolicy {

  private final ExpirationProperties properties;

  public boolean isLive(NotificationRecord notification, Instant now) {
    return notification.published() && isBeforeExpiry(notification.expiresAt(), now);
  }

  public boolean isLive(EventRecord event, Instant now) {
    if (!event.published() || !effectiveExpiry(event).isAfter(now)) {
      return false;
    }
    return event.expiresAt() == null || !event.eventDate().isBefore(today(now));
  }

  public boolean isLive(OpportunityRecord opportunity, Instant now) {
    return opportunity.published() && isBeforeExpiry(opportunity.deadline(), now);
  }

  public boolean isExpired(NotificationRecord notification, Instant now) {
    return !isBeforeExpiry(notification.expiresAt(), now);
  }

  /** An event is expired once both its date and its effective expiry are in the past. */
  public boolean isExpired(EventRecord event, Instant now) {
    return !effectiveExpiry(event).isAfter(now) && event.eventDate().isBefore(today(now));
  }

  public boolean isExpired(OpportunityRecord opportunity, Instant now) {
    return !isBeforeExpiry(opportunity.deadline(), now);
  }

  /** The explicit override when set, otherwise the start of the event day plus the grace period. */
  public Instant effectiveExpiry(EventRecord event) {
    if (event.expiresAt() != null) {
      return event.expiresAt();
    }
    // Whole days are calendar days so a DST shift keeps the expiry at local midnight.
    final Duration grace = properties.eventGracePeriod();
    final long days = grace.toDays();
    return startOf(event.eventDate().plusDays(days)).plus(grace.minusDays(days));
  }

  public Instant startOf(LocalDate date) {
    return date.atStartOfDay(properties.zone()).toInstant();
  }

  public LocalDate today(Instant now) {
    return dayOf(now);
  }

  /** Calendar day of {@code instant} in the configured zone. */
  public LocalDate dayOf(Instant instant) {
    return LocalDate.ofInstant(instant, properties.zone());
  }

  private boolean isBeforeExpiry(Instant expiry, Instant now) {
    return expiry == null || expiry.isAfter(now);
  }
}
