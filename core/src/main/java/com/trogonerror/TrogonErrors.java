package com.trogonerror;

import com.google.common.collect.Sets;
import java.util.Optional;
import java.util.Set;
import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import org.tinylog.Logger;

/**
 * Helpers for looking up {@link TrogonError}s in an exception chain. The chain is followed through
 * {@link Throwable#getCause()}; structured {@link TrogonError#causes()} are not visited.
 *
 * <p>None of these methods throw. A chain that loops back on itself is walked once.
 */
public final class TrogonErrors {

  private TrogonErrors() {
    // Utility class, no instances
  }

  /**
   * Reports whether any error in the chain of {@code error} matches {@code target}.
   *
   * <p>A layer matches when it equals the target, or when both are TrogonErrors with the same
   * domain and reason.
   *
   * @param error the outermost error, may be null
   * @param target the error to look for, may be null
   * @return true if a matching layer was found; two nulls match
   */
  public static boolean is(@Nullable Throwable error, @Nullable Throwable target) {
    if (error == null || target == null) {
      return error == target;
    }
    Set<Throwable> seen = Sets.newIdentityHashSet();
    for (Throwable layer = error; layer != null; layer = layer.getCause()) {
      if (!seen.add(layer)) {
        Logger.debug("Cause cycle detected at {}", layer.getClass().getName());
        return false;
      }
      if (layer.equals(target)) {
        return true;
      }
      if (layer instanceof TrogonError
          && target instanceof TrogonError
          && ((TrogonError) layer).matches((TrogonError) target)) {
        return true;
      }
    }
    return false;
  }

  /**
   * Finds the first TrogonError in the chain of {@code error} accepted by {@code matcher}.
   *
   * <p>The matcher is usually an {@link ErrorTemplate} or an exemplar {@link TrogonError}:
   *
   * <pre>
   * TrogonErrors.as(e, INSUFFICIENT_INVENTORY)
   *     .ifPresent(found -&gt; Logger.warn("Out of stock: {}", found.metadata()));
   * </pre>
   *
   * @param error the outermost error, may be null
   * @param matcher decides which TrogonError is wanted
   * @return the first matching error, or empty when none matches
   */
  @Nonnull
  public static Optional<TrogonError> as(@Nullable Throwable error, @Nonnull ErrorMatcher matcher) {
    Set<Throwable> seen = Sets.newIdentityHashSet();
    for (Throwable layer = error; layer != null; layer = layer.getCause()) {
      if (!seen.add(layer)) {
        Logger.debug("Cause cycle detected at {}", layer.getClass().getName());
        break;
      }
      if (layer instanceof TrogonError && matcher.matches((TrogonError) layer)) {
        return Optional.of((TrogonError) layer);
      }
    }
    return Optional.empty();
  }

  /** Finds the first TrogonError of any kind in the chain of {@code error}. */
  @Nonnull
  public static Optional<TrogonError> as(@Nullable Throwable error) {
    return as(error, candidate -> true);
  }
}
