package org.campusbulletin.content.api.response;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.UUID;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record BookmarksResponse(UUID userId, List<OpportunityResponse> opportunities) {
  public BookmarksResponse {
    opportunities = Collections.unmodifiableList(new ArrayList<>(opportunities));
  }

  @Override
  public List<OpportunityResponse> opportunities() {
    return Collections.unmodifiableList(new ArrayList<>(opportunities));
  }
}
