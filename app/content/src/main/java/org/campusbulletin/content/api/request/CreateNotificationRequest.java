/*
 * Where: content API request DTO
 * What: Input of the notification authoring call
 * Why: Binds snake_case JSON and applies bean validation before the service runs
 */
package org.campusbulletin.content.api.request;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import java.time.Instant;
import java.util.Map;
import java.util.UUID;
import org.campusbulletin.content.model.NotificationPriority;
import org.campusbulletin.content.model.TargetingSpec;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@SuppressFBWarnings(
    value = "EI_EXPOSE_REP",
    justification = "request DTO records are only read once by the service")
public record CreateNotificationRequest(
    @NotBlank @Size(max = 200) String title,
    @NotBlank @Size(max = 5000) String body,
    @NotBlank @Size(max = 64) String category,
    NotificationPriority priority,
    @NotNull TargetingSpec targeting,
    Instant expiresAt,
    Map<String, Object> payload,
    UUID createdBy) {}
