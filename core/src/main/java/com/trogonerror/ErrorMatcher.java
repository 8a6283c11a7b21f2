package com.trogonerror;

import javax.annotation.Nonnull;

/**
 * Identity predicate over error kinds. Implemented by {@link TrogonError} and {@link ErrorTemplate}
 * so either can serve as the target of {@link TrogonErrors#as(Throwable, ErrorMatcher)}.
 */
@FunctionalInterface
public interface ErrorMatcher {

  /** Returns true when the candidate is the same kind of error, i.e. same domain and reason. */
  boolean matches(@Nonnull TrogonError candidate);
}
