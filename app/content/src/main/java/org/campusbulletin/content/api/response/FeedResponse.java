package org.campusbulletin.content.api.response;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record FeedResponse(Instant asOf, List<ContentItemResponse> items) {
  public FeedResponse {
    items = Collections.unmodifiableList(new ArrayList<>(items));
  }

  @Override
  public List<ContentItemResponse> items() {
    return Collections.unmodifiableList(new ArrayList<>(items));
  }
}
