package org.campusbulletin.content.api.response;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.time.Instant;
import java.time.LocalDate;
import java.util.Locale;
import java.util.UUID;
import org.campusbulletin.content.model.ActiveContentItem;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record ContentItemResponse(
    UUID id,
    String kind,
    String title,
    String description,
    Instant effectiveAt,
    LocalDate effectiveDate,
    String location,
    Instant expiresAt,
    boolean published,
    Instant createdAt) {

  public static ContentItemResponse from(ActiveContentItem item) {
    return new ContentItemResponse(
        item.id(),
        item.kind().name().toLowerCase(Locale.ROOT),
        item.title(),
        item.description(),
        item.effectiveAt(),
        item.effectiveDate(),
        item.location(),
        item.expiresAt(),
        item.published(),
        item.createdAt());
  }
}
