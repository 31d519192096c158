package org.campusbulletin.content.api.response;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import org.campusbulletin.content.model.ContentKind;
import org.campusbulletin.content.model.SweepResult;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record SweepResponse(Map<String, Integer> deletedPerKind, List<String> failedKinds) {

  public static SweepResponse from(SweepResult result) {
    final Map<String, Integer> deleted = new LinkedHashMap<>();
    for (ContentKind kind : ContentKind.values()) {
      if (result.deletedPerKind().containsKey(kind)) {
        deleted.put(kind.name().toLowerCase(Locale.ROOT), result.deleted(kind));
      }
    }
    final List<String> failed =
        result.failedKinds().stream().map(kind -> kind.name().toLowerCase(Locale.ROOT)).toList();
    return new SweepResponse(Collections.unmodifiableMap(deleted), failed);
  }
}
