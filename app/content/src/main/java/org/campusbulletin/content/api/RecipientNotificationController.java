/*
 * Where: content API
 * What: Recipient-facing unread count, unread feed and mark-read endpoints
 * Why: Read paths answer with empty results for missing or expired content, never with errors
 */
package org.campusbulletin.content.api;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.List;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.campusbulletin.content.api.response.InboxItem;
import org.campusbulletin.content.api.response.InboxResponse;
import org.campusbulletin.content.api.response.MarkAllReadResponse;
import org.campusbulletin.content.api.response.MarkReadResponse;
import org.campusbulletin.content.api.response.UnreadCountResponse;
import org.campusbulletin.content.config.FeedProperties;
import org.campusbulletin.content.model.InboxEntry;
import org.campusbulletin.content.service.ReadStateService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/v1/users/{userId}/notifications")
@RequiredArgsConstructor
public class RecipientNotificationController {

  private final ReadStateService readStateService;
  private final FeedProperties feedProperties;
  private final ObjectMapper objectMapper;

  @GetMapping("/unread-count")
  public ResponseEntity<UnreadCountResponse> unreadCount(@PathVariable("userId") UUID userId) {
    return ResponseEntity.ok(new UnreadCountResponse(userId, readStateService.unreadCount(userId)));
  }

  @GetMapping
  public ResponseEntity<InboxResponse> unreadFeed(
      @PathVariable("userId") UUID userId,
      @RequestParam(name = "limit", required = false) Integer limit,
      @RequestParam(name = "offset", required = false, defaultValue = "0") int offset) {
    final int effectiveLimit = feedProperties.clampLimit(limit);
    final List<InboxItem> items =
        readStateService.unreadList(userId, effectiveLimit, offset).stream()
            .map(this::toItem)
            .toList();
    return ResponseEntity.ok(new InboxResponse(userId, effectiveLimit, offset, items));
  }

  @PostMapping("/{notificationId}/read")
  public ResponseEntity<MarkReadResponse> markRead(
      @PathVariable("userId") UUID userId,
      @PathVariable("notificationId") UUID notificationId) {
    return ResponseEntity.ok(new MarkReadResponse(readStateService.markRead(notificationId, userId)));
  }

  @PostMapping("/read-all")
  public ResponseEntity<MarkAllReadResponse> markAllRead(@PathVariable("userId") UUID userId) {
    return ResponseEntity.ok(new MarkAllReadResponse(userId, readStateService.markAllRead(userId)));
  }

  private InboxItem toItem(InboxEntry entry) {
    return new InboxItem(
        entry.notification().notificationId(),
        entry.notification().title(),
        entry.notification().body(),
        entry.notification().category(),
        entry.notification().priority(),
        parsePayload(entry.notification().payloadJson()),
        entry.delivery().read(),
        entry.delivery().readAt(),
        entry.notification().expiresAt(),
        entry.notification().createdAt(),
        entry.delivery().createdAt());
  }

  private JsonNode parsePayload(String payloadJson) {
    if (payloadJson == null) {
      return null;
    }
    try {
      return objectMapper.readTree(payloadJson);
    } catch (JsonProcessingException ex) {
      throw new IllegalStateException("notification payload parse failure", ex);
    }
  }
}
