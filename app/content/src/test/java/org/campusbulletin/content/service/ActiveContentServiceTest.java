/*
 * Where: content active feed unit tests
 * What: Merge, filter and ordering of the unified feed
 * Why: Events and opportunities share one ordering rule
 */
package org.campusbulletin.content.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.campusbulletin.content.ContentFixtures;
import org.campusbulletin.content.api.ContentNotFoundException;
import org.campusbulletin.content.config.ExpirationProperties;
import org.campusbulletin.content.model.ActiveContentItem;
import org.campusbulletin.content.model.ContentKind;
import org.campusbulletin.content.model.EventRecord;
import org.campusbulletin.content.model.FeedFilter;
import org.campusbulletin.content.model.OpportunityRecord;
import org.campusbulletin.content.repository.EventRepository;
import org.campusbulletin.content.repository.OpportunityRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class ActiveContentServiceTest {

  private static final Instant FIXED_NOW = Instant.parse("2026-03-10T09:00:00Z");
  private static final LocalDate TODAY = LocalDate.of(2026, 3, 10);

  @Mock private EventRepository eventRepository;
  @Mock private OpportunityRepository opportunityRepository;

  private ActiveContentService service;

  @BeforeEach
  void setUp() {
    final ExpirationPolicy policy =
        new ExpirationPolicy(new ExpirationProperties(Duration.ofDays(7), ZoneOffset.UTC));
    service =
        new ActiveContentService(
            eventRepository, opportunityRepository, policy, Clock.fixed(FIXED_NOW, ZoneOffset.UTC));
  }

  @Test
  void feedMergesKindsByEffectiveDateWithUndatedLast() {
    final EventRecord tomorrow =
        ContentFixtures.event(UUID.randomUUID(), TODAY.plusDays(1), null, true, FIXED_NOW);
    final EventRecord lastWeek =
        ContentFixtures.event(UUID.randomUUID(), TODAY.minusDays(10), null, true, FIXED_NOW);
    final OpportunityRecord dueSoon =
        ContentFixtures.opportunity(
            UUID.randomUUID(), FIXED_NOW.plus(Duration.ofHours(2)), true, FIXED_NOW);
    final OpportunityRecord openEnded =
        ContentFixtures.opportunity(UUID.randomUUID(), null, true, FIXED_NOW);
    when(eventRepository.findPublishedCandidates(FIXED_NOW)).thenReturn(List.of(tomorrow, lastWeek));
    when(opportunityRepository.findPublishedCandidates(FIXED_NOW))
        .thenReturn(List.of(openEnded, dueSoon));

    final List<ActiveContentItem> feed = service.activeFeed(FeedFilter.ALL);

    assertThat(feed)
        .extracting(ActiveContentItem::id)
        .containsExactly(dueSoon.opportunityId(), tomorrow.eventId(), openEnded.opportunityId());
  }

  @Test
  void sameDateOrdersNewestFirst() {
    final EventRecord older =
        ContentFixtures.event(
            UUID.randomUUID(), TODAY, null, true, FIXED_NOW.minus(Duration.ofDays(2)));
    final EventRecord newer =
        ContentFixtures.event(
            UUID.randomUUID(), TODAY, null, true, FIXED_NOW.minus(Duration.ofDays(1)));
    when(eventRepository.findPublishedCandidates(FIXED_NOW)).thenReturn(List.of(older, newer));

    assertThat(service.activeFeed(FeedFilter.EVENT))
        .extracting(ActiveContentItem::id)
        .containsExactly(newer.eventId(), older.eventId());
    verifyNoInteractions(opportunityRepository);
  }

  @Test
  void sameDayOpportunityAndEventOrderByCreationNotTimeOfDay() {
    final EventRecord olderEvent =
        ContentFixtures.event(
            UUID.randomUUID(), TODAY.plusDays(1), null, true, FIXED_NOW.minus(Duration.ofDays(5)));
    final OpportunityRecord newerOpportunity =
        ContentFixtures.opportunity(
            UUID.randomUUID(),
            Instant.parse("2026-03-11T17:00:00Z"),
            true,
            FIXED_NOW.minus(Duration.ofHours(1)));
    final OpportunityRecord earlierDeadlineOlder =
        ContentFixtures.opportunity(
            UUID.randomUUID(),
            Instant.parse("2026-03-11T08:00:00Z"),
            true,
            FIXED_NOW.minus(Duration.ofDays(10)));
    when(eventRepository.findPublishedCandidates(FIXED_NOW)).thenReturn(List.of(olderEvent));
    when(opportunityRepository.findPublishedCandidates(FIXED_NOW))
        .thenReturn(List.of(earlierDeadlineOlder, newerOpportunity));

    assertThat(service.activeFeed(FeedFilter.ALL))
        .extracting(ActiveContentItem::id)
        .containsExactly(
            newerOpportunity.opportunityId(),
            olderEvent.eventId(),
            earlierDeadlineOlder.opportunityId());
  }

  @Test
  void opportunityFilterSkipsEvents() {
    final OpportunityRecord open =
        ContentFixtures.opportunity(UUID.randomUUID(), null, true, FIXED_NOW);
    when(opportunityRepository.findPublishedCandidates(FIXED_NOW)).thenReturn(List.of(open));

    assertThat(service.activeFeed(FeedFilter.OPPORTUNITY))
        .extracting(ActiveContentItem::kind)
        .containsExactly(ContentKind.OPPORTUNITY);
    verifyNoInteractions(eventRepository);
  }

  @Test
  void asOfEvaluatesExpiryAtThatInstant() {
    final Instant asOf = FIXED_NOW.plus(Duration.ofDays(30));
    final EventRecord event =
        ContentFixtures.event(UUID.randomUUID(), TODAY, null, true, FIXED_NOW);
    when(eventRepository.findPublishedCandidates(asOf)).thenReturn(List.of(event));
    when(opportunityRepository.findPublishedCandidates(asOf)).thenReturn(List.of());

    assertThat(service.activeFeed(FeedFilter.ALL, asOf)).isEmpty();
  }

  @Test
  void expiringWithinReturnsSoonestFirst() {
    final OpportunityRecord inOneDay =
        ContentFixtures.opportunity(
            UUID.randomUUID(), FIXED_NOW.plus(Duration.ofDays(1)), true, FIXED_NOW);
    final OpportunityRecord inTenDays =
        ContentFixtures.opportunity(
            UUID.randomUUID(), FIXED_NOW.plus(Duration.ofDays(10)), true, FIXED_NOW);
    // Effective expiry is the start of 2026-03-12.
    final EventRecord endingSoon =
        ContentFixtures.event(UUID.randomUUID(), TODAY.minusDays(5), null, true, FIXED_NOW);
    when(eventRepository.findPublishedCandidates(FIXED_NOW)).thenReturn(List.of(endingSoon));
    when(opportunityRepository.findPublishedCandidates(FIXED_NOW))
        .thenReturn(List.of(inTenDays, inOneDay));

    assertThat(service.expiringWithin(Duration.ofDays(3)))
        .extracting(ActiveContentItem::id)
        .containsExactly(inOneDay.opportunityId(), endingSoon.eventId());
  }

  @Test
  void expiringWithinRejectsNonPositiveWindow() {
    assertThatThrownBy(() -> service.expiringWithin(Duration.ZERO))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void liveLookupsHideExpiredAndUnpublishedItems() {
    final EventRecord draft =
        ContentFixtures.event(UUID.randomUUID(), TODAY.plusDays(3), null, false, FIXED_NOW);
    final OpportunityRecord closed =
        ContentFixtures.opportunity(UUID.randomUUID(), FIXED_NOW.minusSeconds(1), true, FIXED_NOW);
    when(eventRepository.findById(draft.eventId())).thenReturn(Optional.of(draft));
    when(opportunityRepository.findById(closed.opportunityId())).thenReturn(Optional.of(closed));

    assertThatThrownBy(() -> service.getLiveEvent(draft.eventId()))
        .isInstanceOf(ContentNotFoundException.class);
    assertThatThrownBy(() -> service.getLiveOpportunity(closed.opportunityId()))
        .isInstanceOf(ContentNotFoundException.class);
  }

  @Test
  void eventProjectionUsesStartOfDayAndEffectiveExpiry() {
    final EventRecord event =
        ContentFixtures.event(UUID.randomUUID(), TODAY, null, true, FIXED_NOW);

    final ActiveContentItem item = service.project(event);

    assertThat(item.effectiveAt()).isEqualTo(Instant.parse("2026-03-10T00:00:00Z"));
    assertThat(item.effectiveDate()).isEqualTo(TODAY);
    assertThat(item.expiresAt()).isEqualTo(Instant.parse("2026-03-17T00:00:00Z"));
    assertThat(item.kind()).isEqualTo(ContentKind.EVENT);
  }

  @Test
  void opportunityProjectionTakesDeadlineDayInConfiguredZone() {
    final ExpirationPolicy tokyo =
        new ExpirationPolicy(new ExpirationProperties(Duration.ofDays(7), ZoneId.of("Asia/Tokyo")));
    final ActiveContentService tokyoService =
        new ActiveContentService(
            eventRepository, opportunityRepository, tokyo, Clock.fixed(FIXED_NOW, ZoneOffset.UTC));
    final OpportunityRecord lateEvening =
        ContentFixtures.opportunity(
            UUID.randomUUID(), Instant.parse("2026-03-11T16:00:00Z"), true, FIXED_NOW);

    assertThat(tokyoService.project(lateEvening).effectiveDate()).isEqualTo(TODAY.plusDays(2));
    assertThat(
            tokyoService.project(ContentFixtures.opportunity(UUID.randomUUID(), null, true, FIXED_NOW))
                .effectiveDate())
        .isNull();
  }
}
