package com.trogonerror;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.Optional;
import org.junit.jupiter.api.Test;

/** Tests for looking up errors in a cause chain with {@link TrogonErrors}. */
class TrogonErrorsTest {

  private static final ErrorTemplate INSUFFICIENT_INVENTORY = ErrorTemplate.of(
      "shopify.inventory", "INSUFFICIENT_INVENTORY",
      TemplateOptions.withCode(Code.FAILED_PRECONDITION));

  @Test
  void testAsFindsDirectError() {
    TrogonError error = INSUFFICIENT_INVENTORY.newError(
        ErrorOptions.withMetadataValue(Visibility.PUBLIC, "sku", "TSHIRT-M"));

    Optional<TrogonError> found = TrogonErrors.as(error, INSUFFICIENT_INVENTORY);

    assertTrue(found.isPresent());
    assertSame(error, found.get());
  }

  @Test
  void testAsFindsErrorThroughDeepWrapping() {
    TrogonError inventory = INSUFFICIENT_INVENTORY.newError(
        ErrorOptions.withMetadataValue(Visibility.PUBLIC, "sku", "TSHIRT-M"));
    RuntimeException foreign = new RuntimeException("reservation failed", inventory);
    TrogonError checkout = TrogonError.newError("shopify.checkout", "CHECKOUT_FAILED",
        ErrorOptions.withWrap(foreign));
    UncheckedIOException outer = new UncheckedIOException(new IOException("request", checkout));

    Optional<TrogonError> found = TrogonErrors.as(outer, INSUFFICIENT_INVENTORY);

    assertTrue(found.isPresent());
    assertSame(inventory, found.get());
    assertEquals("TSHIRT-M", found.get().metadata().get("sku").value());
  }

  @Test
  void testAsReturnsEmptyWhenNothingMatches() {
    TrogonError error = TrogonError.newError("shopify.checkout", "CHECKOUT_FAILED",
        ErrorOptions.withWrap(new IllegalStateException("boom")));

    assertFalse(TrogonErrors.as(error, INSUFFICIENT_INVENTORY).isPresent());
    assertFalse(TrogonErrors.as(new IllegalStateException("boom"), INSUFFICIENT_INVENTORY)
        .isPresent());
    assertFalse(TrogonErrors.as(null, INSUFFICIENT_INVENTORY).isPresent());
  }

  @Test
  void testAsWithExemplarError() {
    TrogonError exemplar = TrogonError.newError("shopify.users", "NOT_FOUND");
    TrogonError actual = TrogonError.newError("shopify.users", "NOT_FOUND",
        ErrorOptions.withCode(Code.NOT_FOUND), ErrorOptions.withId("err_1"));
    TrogonError outer = TrogonError.newError("shopify.api", "REQUEST_FAILED",
        ErrorOptions.withWrap(actual));

    Optional<TrogonError> found = TrogonErrors.as(outer, exemplar);

    assertTrue(found.isPresent());
    assertEquals("err_1", found.get().id());
  }

  @Test
  void testAsReturnsOutermostMatch() {
    TrogonError inner = TrogonError.newError("shopify.users", "NOT_FOUND",
        ErrorOptions.withId("inner"));
    TrogonError outer = TrogonError.newError("shopify.users", "NOT_FOUND",
        ErrorOptions.withId("outer"), ErrorOptions.withWrap(inner));

    assertEquals("outer", TrogonErrors.as(outer, inner).get().id());
  }

  @Test
  void testAsAnyTrogonError() {
    TrogonError inner = TrogonError.newError("shopify.db", "TIMEOUT");
    RuntimeException outer = new RuntimeException("wrapper", inner);

    assertSame(inner, TrogonErrors.as(outer).get());
    assertFalse(TrogonErrors.as(new RuntimeException("plain")).isPresent());
  }

  @Test
  void testMatcherOnlySeesTrogonErrors() {
    TrogonError inner = TrogonError.newError("shopify.db", "TIMEOUT");
    RuntimeException middle = new RuntimeException("middle", inner);
    TrogonError outer = TrogonError.newError("shopify.api", "FAILED",
        ErrorOptions.withWrap(middle));

    ErrorMatcher matcher = mock(ErrorMatcher.class);
    when(matcher.matches(any())).thenReturn(false);

    assertFalse(TrogonErrors.as(outer, matcher).isPresent());

    verify(matcher).matches(outer);
    verify(matcher).matches(inner);
    verifyNoMoreInteractions(matcher);
  }

  @Test
  void testAsStopsOnCauseCycle() {
    CyclicException first = new CyclicException("first");
    CyclicException second = new CyclicException("second");
    first.setCause(second);
    second.setCause(first);

    assertFalse(TrogonErrors.as(first, INSUFFICIENT_INVENTORY).isPresent());
    assertFalse(TrogonErrors.is(first, new IllegalStateException("other")));
    assertTrue(TrogonErrors.is(first, second));
  }

  @Test
  void testIsMatchesIdentityAndDomainReason() {
    IllegalStateException root = new IllegalStateException("root");
    TrogonError middle = TrogonError.newError("shopify.db", "QUERY_FAILED",
        ErrorOptions.withWrap(root));
    RuntimeException outer = new RuntimeException("outer", middle);

    assertTrue(TrogonErrors.is(outer, outer));
    assertTrue(TrogonErrors.is(outer, root));
    assertTrue(TrogonErrors.is(outer, middle));
    assertTrue(TrogonErrors.is(outer, TrogonError.newError("shopify.db", "QUERY_FAILED")));
    assertFalse(TrogonErrors.is(outer, TrogonError.newError("shopify.db", "TIMEOUT")));
    assertFalse(TrogonErrors.is(outer, new IllegalStateException("root")));
  }

  @Test
  void testIsWithNulls() {
    assertTrue(TrogonErrors.is(null, null));
    assertFalse(TrogonErrors.is(new RuntimeException(), null));
    assertFalse(TrogonErrors.is(null, new RuntimeException()));
  }

  @Test
  void testTrogonErrorIsFollowsWrappedChain() {
    IllegalStateException root = new IllegalStateException("root");
    TrogonError error = TrogonError.newError("shopify.api", "FAILED",
        ErrorOptions.withWrap(new RuntimeException("middle", root)));

    assertTrue(error.is(root));
    assertFalse(error.is(new IllegalStateException("root")));
  }

  /** An exception whose cause can be set after construction, to build cause cycles. */
  private static final class CyclicException extends RuntimeException {
    private static final long serialVersionUID = 1L;

    private Throwable cause;

    CyclicException(String message) {
      super(message);
    }

    void setCause(Throwable cause) {
      this.cause = cause;
    }

    @Override
    public synchronized Throwable getCause() {
      return cause;
    }
  }
}
