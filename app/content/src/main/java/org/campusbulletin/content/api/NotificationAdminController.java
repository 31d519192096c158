/*
 * Where: content API
 * What: Notification authoring endpoints: publish, edit publication/expiry, re-deliver
 * Why: Fan-out runs synchronously inside the publish call
 */
package org.campusbulletin.content.api;

import jakarta.validation.Valid;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.campusbulletin.content.api.request.CreateNotificationRequest;
import org.campusbulletin.content.api.request.PublicationUpdateRequest;
import org.campusbulletin.content.api.response.DeliveryResponse;
import org.campusbulletin.content.api.response.NotificationResponse;
import org.campusbulletin.content.service.NotificationService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/v1/admin/notifications")
@RequiredArgsConstructor
public class NotificationAdminController {

  private final NotificationService notificationService;

  @PostMapping
  public ResponseEntity<DeliveryResponse> create(
      @Valid @RequestBody CreateNotificationRequest request) {
    return ResponseEntity.status(HttpStatus.CREATED)
        .body(DeliveryResponse.from(notificationService.createNotification(request)));
  }

  @PatchMapping("/{notificationId}")
  public ResponseEntity<NotificationResponse> update(
      @PathVariable("notificationId") UUID notificationId,
      @RequestBody PublicationUpdateRequest request) {
    return ResponseEntity.ok(
        NotificationResponse.from(notificationService.updateNotification(notificationId, request)));
  }

  @PostMapping("/{notificationId}/redeliver")
  public ResponseEntity<DeliveryResponse> redeliver(
      @PathVariable("notificationId") UUID notificationId) {
    return ResponseEntity.ok(DeliveryResponse.from(notificationService.redeliver(notificationId)));
  }
}
