package com.trogonerror;

/**
 * A construction step applied to the builder of a new {@link TrogonError}. Options run in argument
 * order; later options override earlier ones on scalar fields while metadata and help links
 * accumulate.
 *
 * @see ErrorOptions
 */
@FunctionalInterface
public interface ErrorOption {

  void apply(TrogonError.Builder builder);
}
