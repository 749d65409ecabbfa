package com.gentorox.navigation.exception;

/**
 * Stable error codes for navigation failures. Codes are suitable for logs and HTTP error bodies.
 */
public enum NavigationErrorCode {
  UNKNOWN,
  INVALID_DECLARATION,
  DUPLICATE_ID,
  UNSUPPORTED_FEATURE,
  IO_ERROR,
}
