/*
 * Where: content API
 * What: Event and opportunity authoring plus the expiring-soon outlook
 * Why: Admin tooling creates content and watches what is about to drop out of the feed
 */
package org.campusbulletin.content.api;

import jakarta.validation.Valid;
import java.time.Duration;
import java.time.format.DateTimeParseException;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.campusbulletin.content.api.request.CreateEventRequest;
import org.campusbulletin.content.api.request.CreateOpportunityRequest;
import org.campusbulletin.content.api.request.PublicationUpdateRequest;
import org.campusbulletin.content.api.response.ContentItemResponse;
import org.campusbulletin.content.api.response.EventResponse;
import org.campusbulletin.content.api.response.FeedResponse;
import org.campusbulletin.content.api.response.OpportunityResponse;
import org.campusbulletin.content.model.EventRecord;
import org.campusbulletin.content.service.ActiveContentService;
import org.campusbulletin.content.service.ContentAuthoringService;
import org.campusbulletin.content.service.ExpirationPolicy;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/v1/admin")
@RequiredArgsConstructor
public class ContentAdminController {

  private final ContentAuthoringService authoringService;
  private final ActiveContentService activeContentService;
  private final ExpirationPolicy expirationPolicy;

  @PostMapping("/events")
  public ResponseEntity<EventResponse> createEvent(@Valid @RequestBody CreateEventRequest request) {
    final EventRecord event = authoringService.createEvent(request);
    return ResponseEntity.status(HttpStatus.CREATED).body(toResponse(event));
  }

  @PatchMapping("/events/{eventId}")
  public ResponseEntity<EventResponse> updateEvent(
      @PathVariable("eventId") UUID eventId, @RequestBody PublicationUpdateRequest request) {
    return ResponseEntity.ok(toResponse(authoringService.updateEvent(eventId, request)));
  }

  @PostMapping("/opportunities")
  public ResponseEntity<OpportunityResponse> createOpportunity(
      @Valid @RequestBody CreateOpportunityRequest request) {
    return ResponseEntity.status(HttpStatus.CREATED)
        .body(OpportunityResponse.from(authoringService.createOpportunity(request)));
  }

  @PatchMapping("/opportunities/{opportunityId}")
  public ResponseEntity<OpportunityResponse> updateOpportunity(
      @PathVariable("opportunityId") UUID opportunityId,
      @RequestBody PublicationUpdateRequest request) {
    return ResponseEntity.ok(
        OpportunityResponse.from(authoringService.updateOpportunity(opportunityId, request)));
  }

  @GetMapping("/feed/expiring")
  public ResponseEntity<FeedResponse> expiring(
      @RequestParam(name = "within", defaultValue = "P3D") String within) {
    final Duration window = parseWindow(within);
    return ResponseEntity.ok(
        new FeedResponse(
            null,
            activeContentService.expiringWithin(window).stream()
                .map(ContentItemResponse::from)
                .toList()));
  }

  private EventResponse toResponse(EventRecord event) {
    return EventResponse.from(event, expirationPolicy.effectiveExpiry(event), null);
  }

  private Duration parseWindow(String within) {
    try {
      return Duration.parse(within);
    } catch (DateTimeParseException ex) {
      throw new IllegalArgumentException("within must be an ISO-8601 duration such as P3D", ex);
    }
  }
}
