/*
 * Where: content API request DTO
 * What: Administrative edit of the publication flag and expiry of a content item
 * Why: Publication and expiry are the only fields editable after publish
 */
package org.campusbulletin.content.api.request;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.time.Instant;

/**
 * Absent fields keep their current value. {@code expiresAt} is the explicit expiry of a
 * notification or event and the deadline of an opportunity; {@code clearExpiry} removes it.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record PublicationUpdateRequest(Boolean published, Instant expiresAt, Boolean clearExpiry) {

  public boolean publishedOr(boolean current) {
    return published == null ? current : published;
  }

  public Instant expiryOr(Instant current) {
    if (Boolean.TRUE.equals(clearExpiry)) {
      return null;
    }
    return expiresAt == null ? current : expiresAt;
  }
}
