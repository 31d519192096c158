package org.campusbulletin.content.api.response;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.UUID;
import org.campusbulletin.content.model.TaxonomyEntry;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record TaxonomyResponse(String kind, List<Entry> entries) {
  public TaxonomyResponse {
    entries = Collections.unmodifiableList(new ArrayList<>(entries));
  }

  @Override
  public List<Entry> entries() {
    return Collections.unmodifiableList(new ArrayList<>(entries));
  }

  @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
  public record Entry(UUID id, UUID parentId, String name, Integer number, int displayOrder) {
    public static Entry from(TaxonomyEntry entry) {
      return new Entry(
          entry.id(), entry.parentId(), entry.name(), entry.number(), entry.displayOrder());
    }
  }
}
