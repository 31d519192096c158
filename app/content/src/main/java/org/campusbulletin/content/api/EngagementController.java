/*
 * Where: content API
 * What: Per-user opportunity bookmarks and event RSVPs
 * Why: PUT and DELETE are idempotent, so clients can retry freely
 */
package org.campusbulletin.content.api;

import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.campusbulletin.content.api.response.BookmarksResponse;
import org.campusbulletin.content.api.response.OpportunityResponse;
import org.campusbulletin.content.api.response.ToggleResponse;
import org.campusbulletin.content.service.BookmarkService;
import org.campusbulletin.content.service.RsvpService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/v1/users/{userId}")
@RequiredArgsConstructor
public class EngagementController {

  private final BookmarkService bookmarkService;
  private final RsvpService rsvpService;

  @GetMapping("/bookmarks")
  public ResponseEntity<BookmarksResponse> bookmarks(@PathVariable("userId") UUID userId) {
    return ResponseEntity.ok(
        new BookmarksResponse(
            userId,
            bookmarkService.listBookmarks(userId).stream()
                .map(OpportunityResponse::from)
                .toList()));
  }

  @PutMapping("/bookmarks/{opportunityId}")
  public ResponseEntity<ToggleResponse> addBookmark(
      @PathVariable("userId") UUID userId, @PathVariable("opportunityId") UUID opportunityId) {
    return ResponseEntity.ok(new ToggleResponse(bookmarkService.addBookmark(userId, opportunityId)));
  }

  @DeleteMapping("/bookmarks/{opportunityId}")
  public ResponseEntity<ToggleResponse> removeBookmark(
      @PathVariable("userId") UUID userId, @PathVariable("opportunityId") UUID opportunityId) {
    return ResponseEntity.ok(
        new ToggleResponse(bookmarkService.removeBookmark(userId, opportunityId)));
  }

  @PutMapping("/rsvps/{eventId}")
  public ResponseEntity<ToggleResponse> addRsvp(
      @PathVariable("userId") UUID userId, @PathVariable("eventId") UUID eventId) {
    return ResponseEntity.ok(new ToggleResponse(rsvpService.addRsvp(userId, eventId)));
  }

  @DeleteMapping("/rsvps/{eventId}")
  public ResponseEntity<ToggleResponse> removeRsvp(
      @PathVariable("userId") UUID userId, @PathVariable("eventId") UUID eventId) {
    return ResponseEntity.ok(new ToggleResponse(rsvpService.removeRsvp(userId, eventId)));
  }
}
