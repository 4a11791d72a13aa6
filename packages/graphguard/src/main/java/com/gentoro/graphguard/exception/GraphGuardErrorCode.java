package com.gentoro.graphguard.exception;

/**
 * Canonical error codes for GraphGuard. Codes are stable and suitable for logs and exit-code
 * mapping. Prefer the most specific code that reflects the failure origin and actionability.
 */
public enum GraphGuardErrorCode {
  // Generic
  UNKNOWN,
  INVALID_ARGUMENT,
  FAILED_PRECONDITION,
  NOT_FOUND,
  PERMISSION_DENIED,
  UNAUTHENTICATED,
  CANCELLED,

  // I/O and configuration
  CONFIGURATION_ERROR,
  IO_ERROR,
  SERIALIZATION_ERROR,

  // Remote graph API
  NETWORK_ERROR,
  REMOTE_REJECTED,
  UNSUPPORTED_FEATURE,
  API_COMPATIBILITY,
  EXPORT_ERROR,
}
