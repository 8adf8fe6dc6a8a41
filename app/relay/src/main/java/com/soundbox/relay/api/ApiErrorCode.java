/*
 * Where: Relay API
 * What: Error codes carried in error responses
 * Why: Lets clients tell apart failures that share an HTTP status
 */
package com.soundbox.relay.api;

public enum ApiErrorCode {
  BAD_REQUEST,
  UNAUTHORIZED,
  STORE_UNAVAILABLE,
  NOT_FOUND,
  STORAGE_FAILURE
}
