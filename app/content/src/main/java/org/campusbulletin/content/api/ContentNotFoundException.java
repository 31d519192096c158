/*
 * Where: content API
 * What: Signals an unknown or no longer live notification, delivery, event, opportunity,
 *       recipient or taxonomy entry
 * Why: Mapped to 404
 */
package org.campusbulletin.content.api;

import java.util.UUID;

public class ContentNotFoundException extends RuntimeException {
  public ContentNotFoundException(String kind, UUID id) {
    super(kind + " not found: " + id);
  }

  public ContentNotFoundException(String message) {
    super(message);
  }
}
