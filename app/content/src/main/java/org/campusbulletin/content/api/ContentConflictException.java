package org.campusbulletin.content.api;

/** Authoring hit a natural-key uniqueness constraint (same title on the same day, etc.). */
public class ContentConflictException extends RuntimeException {
  public ContentConflictException(String message, Throwable cause) {
    super(message, cause);
  }
}
