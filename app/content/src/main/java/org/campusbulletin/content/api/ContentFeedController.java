/*
 * Where: content API
 * What: Unified active feed and single live event/opportunity reads
 * Why: Clients get events and opportunities from one ordered list
 */
package org.campusbulletin.content.api;

import java.time.Clock;
import java.time.Instant;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.campusbulletin.content.api.response.ContentItemResponse;
import org.campusbulletin.content.api.response.EventResponse;
import org.campusbulletin.content.api.response.FeedResponse;
import org.campusbulletin.content.api.response.OpportunityResponse;
import org.campusbulletin.content.model.EventRecord;
import org.campusbulletin.content.model.FeedFilter;
import org.campusbulletin.content.service.ActiveContentService;
import org.campusbulletin.content.service.ExpirationPolicy;
import org.campusbulletin.content.service.RsvpService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/v1")
@RequiredArgsConstructor
public class ContentFeedController {

  private final ActiveContentService activeContentService;
  private final RsvpService rsvpService;
  private final ExpirationPolicy expirationPolicy;
  private final Clock clock;

  @GetMapping("/feed")
  public ResponseEntity<FeedResponse> feed(
      @RequestParam(name = "kind", required = false) String kind,
      @RequestParam(name = "as_of", required = false) Instant asOf) {
    final Instant effectiveAsOf = asOf == null ? Instant.now(clock) : asOf;
    final FeedFilter filter = FeedFilter.parse(kind);
    return ResponseEntity.ok(
        new FeedResponse(
            effectiveAsOf,
            activeContentService.activeFeed(filter, effectiveAsOf).stream()
                .map(ContentItemResponse::from)
                .toList()));
  }

  @GetMapping("/events/{eventId}")
  public ResponseEntity<EventResponse> event(@PathVariable("eventId") UUID eventId) {
    final EventRecord event = activeContentService.getLiveEvent(eventId);
    return ResponseEntity.ok(
        EventResponse.from(
            event, expirationPolicy.effectiveExpiry(event), rsvpService.rsvpCount(eventId)));
  }

  @GetMapping("/opportunities/{opportunityId}")
  public ResponseEntity<OpportunityResponse> opportunity(
      @PathVariable("opportunityId") UUID opportunityId) {
    return ResponseEntity.ok(
        OpportunityResponse.from(activeContentService.getLiveOpportunity(opportunityId)));
  }
}
