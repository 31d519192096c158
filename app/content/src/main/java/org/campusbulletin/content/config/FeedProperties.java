package org.campusbulletin.content.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

@ConfigurationProperties(prefix = "content.feed")
public record FeedProperties(@DefaultValue("20") int defaultLimit, @DefaultValue("100") int maxLimit) {

  public int clampLimit(Integer requested) {
    if (requested == null || requested <= 0) {
      return defaultLimit;
    }
    return Math.min(requested, maxLimit);
  }
}
