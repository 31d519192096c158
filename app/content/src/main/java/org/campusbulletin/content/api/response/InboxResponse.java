package org.campusbulletin.content.api.response;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.UUID;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record InboxResponse(UUID userId, int limit, int offset, List<InboxItem> notifications) {
  public InboxResponse {
    // EI_EXPOSE_REP: keep an unmodifiable copy of the list.
    notifications = Collections.unmodifiableList(new ArrayList<>(notifications));
  }

  @Override
  public List<InboxItem> notifications() {
    return Collections.unmodifiableList(new ArrayList<>(notifications));
  }
}
