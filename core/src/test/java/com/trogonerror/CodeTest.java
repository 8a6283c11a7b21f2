package com.trogonerror;

import static org.junit.jupiter.api.Assertions.*;

import java.util.Map;
import org.junit.jupiter.api.Test;

/** Tests for the {@link Code} enum. */
class CodeTest {

  @Test
  void testHttpStatusCodes() {
    Map<Code, Integer> expected = Map.ofEntries(
        Map.entry(Code.CANCELLED, 499),
        Map.entry(Code.UNKNOWN, 500),
        Map.entry(Code.INVALID_ARGUMENT, 400),
        Map.entry(Code.DEADLINE_EXCEEDED, 504),
        Map.entry(Code.NOT_FOUND, 404),
        Map.entry(Code.ALREADY_EXISTS, 409),
        Map.entry(Code.PERMISSION_DENIED, 403),
        Map.entry(Code.RESOURCE_EXHAUSTED, 429),
        Map.entry(Code.FAILED_PRECONDITION, 400),
        Map.entry(Code.ABORTED, 409),
        Map.entry(Code.OUT_OF_RANGE, 400),
        Map.entry(Code.UNIMPLEMENTED, 501),
        Map.entry(Code.INTERNAL, 500),
        Map.entry(Code.UNAVAILABLE, 503),
        Map.entry(Code.DATA_LOSS, 500),
        Map.entry(Code.UNAUTHENTICATED, 401));

    assertEquals(16, Code.values().length);
    for (Code code : Code.values()) {
      assertEquals(expected.get(code), code.httpStatusCode(), "HTTP status for " + code);
    }
  }

  @Test
  void testDefaultMessages() {
    assertEquals("the operation was cancelled", Code.CANCELLED.message());
    assertEquals("unknown error", Code.UNKNOWN.message());
    assertEquals("invalid argument provided", Code.INVALID_ARGUMENT.message());
    assertEquals("resource not found", Code.NOT_FOUND.message());
    assertEquals("internal error", Code.INTERNAL.message());
    assertEquals("service unavailable", Code.UNAVAILABLE.message());
    assertEquals("data loss or corruption", Code.DATA_LOSS.message());
    assertEquals("unauthenticated", Code.UNAUTHENTICATED.message());

    for (Code code : Code.values()) {
      assertFalse(code.message().isEmpty(), "Message missing for " + code);
    }
  }

  @Test
  void testNumbersAreStable() {
    int expected = 1;
    for (Code code : Code.values()) {
      assertEquals(expected++, code.number());
    }
  }

  @Test
  void testForNumber() {
    assertEquals(Code.CANCELLED, Code.forNumber(1));
    assertEquals(Code.NOT_FOUND, Code.forNumber(5));
    assertEquals(Code.UNAUTHENTICATED, Code.forNumber(16));
    assertEquals(Code.UNKNOWN, Code.forNumber(0));
    assertEquals(Code.UNKNOWN, Code.forNumber(17));
    assertEquals(Code.UNKNOWN, Code.forNumber(-1));
  }

  @Test
  void testFromHttpStatus() {
    assertEquals(Code.INVALID_ARGUMENT, Code.fromHttpStatus(400));
    assertEquals(Code.UNAUTHENTICATED, Code.fromHttpStatus(401));
    assertEquals(Code.PERMISSION_DENIED, Code.fromHttpStatus(403));
    assertEquals(Code.NOT_FOUND, Code.fromHttpStatus(404));
    assertEquals(Code.ALREADY_EXISTS, Code.fromHttpStatus(409));
    assertEquals(Code.RESOURCE_EXHAUSTED, Code.fromHttpStatus(429));
    assertEquals(Code.CANCELLED, Code.fromHttpStatus(499));
    assertEquals(Code.INTERNAL, Code.fromHttpStatus(500));
    assertEquals(Code.UNIMPLEMENTED, Code.fromHttpStatus(501));
    assertEquals(Code.UNAVAILABLE, Code.fromHttpStatus(503));
    assertEquals(Code.DEADLINE_EXCEEDED, Code.fromHttpStatus(504));

    // Unmapped statuses fall back by class
    assertEquals(Code.INVALID_ARGUMENT, Code.fromHttpStatus(418));
    assertEquals(Code.INTERNAL, Code.fromHttpStatus(502));
    assertEquals(Code.UNKNOWN, Code.fromHttpStatus(200));
    assertEquals(Code.UNKNOWN, Code.fromHttpStatus(302));
  }

  @Test
  void testHttpStatusRoundTripForUniqueStatuses() {
    for (Code code : new Code[] {
        Code.CANCELLED, Code.DEADLINE_EXCEEDED, Code.NOT_FOUND, Code.PERMISSION_DENIED,
        Code.RESOURCE_EXHAUSTED, Code.UNIMPLEMENTED, Code.UNAVAILABLE, Code.UNAUTHENTICATED}) {
      assertEquals(code, Code.fromHttpStatus(code.httpStatusCode()));
    }
  }

  @Test
  void testFromHttpStatusAgreesWithTable() {
    for (Code code : Code.values()) {
      Code resolved = Code.fromHttpStatus(code.httpStatusCode());
      assertEquals(code.httpStatusCode(), resolved.httpStatusCode(),
          "Status " + code.httpStatusCode() + " should resolve to a code with that status");
    }
    assertEquals(Code.INVALID_ARGUMENT, Code.fromHttpStatus(400));
    assertEquals(Code.ALREADY_EXISTS, Code.fromHttpStatus(409));
    assertEquals(Code.INTERNAL, Code.fromHttpStatus(500));
    assertEquals(Code.UNKNOWN, Code.fromHttpStatus(-404));
    assertEquals(Code.UNKNOWN, Code.fromHttpStatus(600));
  }
}

