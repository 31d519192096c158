package org.campusbulletin.content.api.response;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.util.UUID;
import org.campusbulletin.content.model.DeliveryResult;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record DeliveryResponse(UUID notificationId, int deliveredCount) {

  public static DeliveryResponse from(DeliveryResult result) {
    return new DeliveryResponse(result.notificationId(), result.deliveredCount());
  }
}
