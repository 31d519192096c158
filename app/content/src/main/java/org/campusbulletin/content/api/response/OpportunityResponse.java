package org.campusbulletin.content.api.response;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.time.Instant;
import java.util.UUID;
import org.campusbulletin.content.model.OpportunityRecord;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record OpportunityResponse(
    UUID opportunityId,
    String title,
    String opportunityType,
    String organization,
    String description,
    String location,
    String applicationReference,
    Instant deadline,
    boolean published,
    Instant createdAt) {

  public static OpportunityResponse from(OpportunityRecord record) {
    return new OpportunityResponse(
        record.opportunityId(),
        record.title(),
        record.opportunityType(),
        record.organization(),
        record.description(),
        record.location(),
        record.applicationReference(),
        record.deadline(),
        record.published(),
        record.createdAt());
  }
}
