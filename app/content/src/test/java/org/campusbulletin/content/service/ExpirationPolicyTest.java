/*
 * Where: content expiration rules tests
 * What: Live/expired decisions for notifications, events and opportunities
 * Why: Read paths and the sweeper share these predicates
 */
package org.campusbulletin.content.service;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.UUID;
import org.campusbulletin.content.config.ExpirationProperties;
import org.campusbulletin.content.model.EventRecord;
import org.campusbulletin.content.model.NotificationPriority;
import org.campusbulletin.content.model.NotificationRecord;
import org.campusbulletin.content.model.OpportunityRecord;
import org.junit.jupiter.api.Test;

class ExpirationPolicyTest {

  private static final Instant NOW = Instant.parse("2026-03-10T12:00:00Z");
  private static final LocalDate TODAY = LocalDate.of(2026, 3, 10);

  private final ExpirationPolicy policy =
      new ExpirationPolicy(new ExpirationProperties(Duration.ofDays(7), ZoneOffset.UTC));

  @Test
  void notificationWithoutExpiryIsLiveWhilePublished() {
    assertThat(policy.isLive(notification(true, null), NOW)).isTrue();
    assertThat(policy.isExpired(notification(true, null), NOW)).isFalse();
  }

  @Test
  void notificationExpiresAtItsBoundary() {
    final NotificationRecord atBoundary = notification(true, NOW);
    assertThat(policy.isLive(atBoundary, NOW)).isFalse();
    assertThat(policy.isExpired(atBoundary, NOW)).isTrue();
    assertThat(policy.isLive(notification(true, NOW.plusSeconds(1)), NOW)).isTrue();
  }

  @Test
  void unpublishedNotificationIsNeitherLiveNorExpired() {
    final NotificationRecord draft = notification(false, NOW.plusSeconds(3600));
    assertThat(policy.isLive(draft, NOW)).isFalse();
    assertThat(policy.isExpired(draft, NOW)).isFalse();
  }

  @Test
  void eventStaysLiveDuringGracePeriod() {
    final EventRecord pastEvent = event(TODAY.minusDays(3), null, true);
    assertThat(policy.isLive(pastEvent, NOW)).isTrue();
    assertThat(policy.isExpired(pastEvent, NOW)).isFalse();
    assertThat(policy.effectiveExpiry(pastEvent)).isEqualTo(Instant.parse("2026-03-14T00:00:00Z"));
  }

  @Test
  void eventExpiresOnceGracePeriodHasPassed() {
    final EventRecord oldEvent = event(TODAY.minusDays(8), null, true);
    assertThat(policy.isLive(oldEvent, NOW)).isFalse();
    assertThat(policy.isExpired(oldEvent, NOW)).isTrue();
  }

  @Test
  void explicitEventExpiryOverridesGracePeriod() {
    final EventRecord event = event(TODAY.minusDays(1), NOW.minusSeconds(60), true);
    assertThat(policy.effectiveExpiry(event)).isEqualTo(NOW.minusSeconds(60));
    assertThat(policy.isLive(event, NOW)).isFalse();
    assertThat(policy.isExpired(event, NOW)).isTrue();
  }

  @Test
  void eventDatedTodayIsNeverExpiredEvenWithPastOverride() {
    final EventRecord event = event(TODAY, NOW.minusSeconds(60), true);
    assertThat(policy.isLive(event, NOW)).isFalse();
    assertThat(policy.isExpired(event, NOW)).isFalse();
  }

  @Test
  void explicitExpiryBeyondEventDayStopsAtTheDayBoundary() {
    final EventRecord yesterday = event(TODAY.minusDays(1), NOW.plus(Duration.ofDays(30)), true);
    assertThat(policy.isLive(yesterday, NOW)).isFalse();
    assertThat(policy.isExpired(yesterday, NOW)).isFalse();
    assertThat(policy.isExpired(yesterday, NOW.plus(Duration.ofDays(31)))).isTrue();

    final EventRecord today = event(TODAY, NOW.plus(Duration.ofDays(30)), true);
    assertThat(policy.isLive(today, NOW)).isTrue();
  }

  @Test
  void derivedEventExpiryIsLocalMidnightAcrossDstChange() {
    // New York moves to daylight time on 2026-03-08.
    final ExpirationPolicy newYork =
        new ExpirationPolicy(
            new ExpirationProperties(Duration.ofDays(7), ZoneId.of("America/New_York")));
    final EventRecord beforeShift = event(LocalDate.of(2026, 3, 5), null, true);

    assertThat(newYork.effectiveExpiry(beforeShift))
        .isEqualTo(Instant.parse("2026-03-12T04:00:00Z"));
  }

  @Test
  void partialDayGraceIsAddedAfterCalendarDays() {
    final ExpirationPolicy withHours =
        new ExpirationPolicy(
            new ExpirationProperties(Duration.ofDays(2).plusHours(6), ZoneOffset.UTC));
    assertThat(withHours.effectiveExpiry(event(TODAY, null, true)))
        .isEqualTo(Instant.parse("2026-03-12T06:00:00Z"));
  }

  @Test
  void opportunityDeadlineIsItsExpiry() {
    assertThat(policy.isLive(opportunity(NOW.plusSeconds(60), true), NOW)).isTrue();
    assertThat(policy.isLive(opportunity(NOW, true), NOW)).isFalse();
    assertThat(policy.isExpired(opportunity(NOW, true), NOW)).isTrue();
    assertThat(policy.isLive(opportunity(null, true), NOW)).isTrue();
    assertThat(policy.isExpired(opportunity(null, false), NOW)).isFalse();
  }

  @Test
  void expiredAlwaysImpliesNotLive() {
    for (int days = -10; days <= 10; days++) {
      final Instant at = NOW.plus(Duration.ofDays(days));
      for (boolean published : new boolean[] {true, false}) {
        final EventRecord event = event(TODAY.minusDays(4), null, published);
        final OpportunityRecord opportunity = opportunity(NOW.plusSeconds(30), published);
        final NotificationRecord notification = notification(published, NOW.minusSeconds(30));
        if (policy.isExpired(event, at)) {
          assertThat(policy.isLive(event, at)).isFalse();
        }
        if (policy.isExpired(opportunity, at)) {
          assertThat(policy.isLive(opportunity, at)).isFalse();
        }
        if (policy.isExpired(notification, at)) {
          assertThat(policy.isLive(notification, at)).isFalse();
        }
      }
    }
  }

  @Test
  void calendarDayFollowsConfiguredZone() {
    final ExpirationPolicy tokyo =
        new ExpirationPolicy(new ExpirationProperties(Duration.ofDays(7), ZoneId.of("Asia/Tokyo")));
    assertThat(tokyo.today(Instant.parse("2026-03-10T16:00:00Z"))).isEqualTo(TODAY.plusDays(1));
    assertThat(tokyo.startOf(TODAY)).isEqualTo(Instant.parse("2026-03-09T15:00:00Z"));
  }

  private static NotificationRecord notification(boolean published, Instant expiresAt) {
    return new NotificationRecord(
        UUID.randomUUID(),
        "title",
        "body",
        "general",
        NotificationPriority.NORMAL,
        null,
        "{\"all_users\":true}",
        published,
        expiresAt,
        0,
        null,
        NOW.minusSeconds(3600),
        NOW.minusSeconds(3600));
  }

  private static EventRecord event(LocalDate date, Instant expiresAt, boolean published) {
    return new EventRecord(
        UUID.randomUUID(),
        "event",
        "description",
        date,
        null,
        null,
        null,
        null,
        null,
        expiresAt,
        published,
        null,
        NOW.minusSeconds(3600),
        NOW.minusSeconds(3600));
  }

  private static OpportunityRecord opportunity(Instant deadline, boolean published) {
    return new OpportunityRecord(
        UUID.randomUUID(),
        "opportunity",
        "internship",
        "org",
        "description",
        null,
        null,
        deadline,
        published,
        null,
        NOW.minusSeconds(3600),
        NOW.minusSeconds(3600));
  }
}
