package com.trogonerror;

import com.google.common.collect.ImmutableMap;
import java.util.HashMap;
import java.util.Map;
import javax.annotation.Nonnull;

/**
 * Classification codes for a {@link TrogonError}. Aligned with the gRPC canonical codes, each code
 * carries a stable numeric value, a default human message and the HTTP status a transport layer
 * should use when it surfaces the error.
 *
 * <p>The HTTP mapping is part of the public contract and must not change once published.
 */
public enum Code {
  CANCELLED(1, 499, "the operation was cancelled"), // 499 Client Closed Request
  UNKNOWN(2, 500, "unknown error"), // 500 Internal Server Error
  INVALID_ARGUMENT(3, 400, "invalid argument provided"), // 400 Bad Request
  DEADLINE_EXCEEDED(4, 504, "deadline exceeded"), // 504 Gateway Timeout
  NOT_FOUND(5, 404, "resource not found"), // 404 Not Found
  ALREADY_EXISTS(6, 409, "resource already exists"), // 409 Conflict
  PERMISSION_DENIED(7, 403, "permission denied"), // 403 Forbidden
  RESOURCE_EXHAUSTED(8, 429, "resource exhausted"), // 429 Too Many Requests
  FAILED_PRECONDITION(9, 400, "failed precondition"), // 400 Bad Request
  ABORTED(10, 409, "operation aborted"), // 409 Conflict
  OUT_OF_RANGE(11, 400, "out of range"), // 400 Bad Request
  UNIMPLEMENTED(12, 501, "not implemented"), // 501 Not Implemented
  INTERNAL(13, 500, "internal error"), // 500 Internal Server Error
  UNAVAILABLE(14, 503, "service unavailable"), // 503 Service Unavailable
  DATA_LOSS(15, 500, "data loss or corruption"), // 500 Internal Server Error
  UNAUTHENTICATED(16, 401, "unauthenticated"); // 401 Unauthorized

  private static final ImmutableMap<Integer, Code> BY_HTTP_STATUS = indexByHttpStatus();

  private final int number;
  private final int httpStatusCode;
  private final String message;

  Code(int number, int httpStatusCode, String message) {
    this.number = number;
    this.httpStatusCode = httpStatusCode;
    this.message = message;
  }

  /** Returns the stable numeric value of this code. */
  public int number() {
    return number;
  }

  /** Returns the HTTP status code a transport layer should use for this code. */
  public int httpStatusCode() {
    return httpStatusCode;
  }

  /** Returns the default message used when an error carries no message of its own. */
  @Nonnull
  public String message() {
    return message;
  }

  /**
   * Resolves a numeric code value.
   *
   * @param number the numeric value, 1 through 16
   * @return the matching code, or {@link #UNKNOWN} for any value outside the known range
   */
  @Nonnull
  public static Code forNumber(int number) {
    for (Code code : values()) {
      if (code.number == number) {
        return code;
      }
    }
    return UNKNOWN;
  }

  /**
   * Finds the code whose {@link #httpStatusCode()} is the given status. A status shared by several
   * codes resolves to the most general of them, e.g. 400 to {@link #INVALID_ARGUMENT}. Statuses
   * outside the table resolve by class: other 4xx to {@link #INVALID_ARGUMENT}, other 5xx to
   * {@link #INTERNAL}, anything else to {@link #UNKNOWN}.
   */
  @Nonnull
  public static Code fromHttpStatus(int httpStatusCode) {
    Code code = BY_HTTP_STATUS.get(httpStatusCode);
    if (code != null) {
      return code;
    }
    switch (httpStatusCode / 100) {
      case 4:
        return INVALID_ARGUMENT;
      case 5:
        return INTERNAL;
      default:
        return UNKNOWN;
    }
  }

  private static ImmutableMap<Integer, Code> indexByHttpStatus() {
    Map<Integer, Code> index = new HashMap<>();
    // Declaration order puts the general code first for 400 and 409.
    for (Code code : values()) {
      index.putIfAbsent(code.httpStatusCode, code);
    }
    index.put(500, INTERNAL);
    return ImmutableMap.copyOf(index);
  }
}
