/*
 * Where: content API
 * What: Rejects a targeting specification that is ambiguous, empty or malformed
 * Why: Raised before any notification row is written
 */
package org.campusbulletin.content.api;

public class InvalidSpecException extends RuntimeException {
  public InvalidSpecException(String message) {
    super(message);
  }
}
