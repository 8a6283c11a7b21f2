package com.trogonerror;

/**
 * A change applied by {@link TrogonError#withChanges(ChangeOption...)} to a copy of an existing
 * error.
 *
 * @see ChangeOptions
 */
@FunctionalInterface
public interface ChangeOption {

  void apply(TrogonError.Builder builder);
}
