/*
 * Where: content API
 * What: Error codes carried in every error body
 * Why: Clients tell targeting errors apart from generic bad requests under the same status
 */
package org.campusbulletin.content.api;

public enum ApiErrorCode {
  BAD_REQUEST,
  INVALID_SPEC,
  NOT_FOUND,
  CONFLICT
}
