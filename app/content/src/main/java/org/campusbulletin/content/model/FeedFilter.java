/*
 * Where: content domain model
 * What: Kind selector for the active-content feed
 * Why: Lets the feed endpoint accept lower-case query values
 */
package org.campusbulletin.content.model;

import java.util.Locale;

public enum FeedFilter {
  ALL,
  EVENT,
  OPPORTUNITY;

  public static FeedFilter parse(String value) {
    if (value == null || value.isBlank()) {
      return ALL;
    }
    try {
      return FeedFilter.valueOf(value.trim().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException ex) {
      throw new IllegalArgumentException("kind must be one of all, event, opportunity", ex);
    }
  }

  public boolean includes(ContentKind kind) {
    return switch (this) {
      case ALL -> kind == ContentKind.EVENT || kind == ContentKind.OPPORTUNITY;
      case EVENT -> kind == ContentKind.EVENT;
      case OPPORTUNITY -> kind == ContentKind.OPPORTUNITY;
    };
  }
}
