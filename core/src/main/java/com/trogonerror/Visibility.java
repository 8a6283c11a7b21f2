package com.trogonerror;

import javax.annotation.Nonnull;

/**
 * Disclosure tier of an error or of one of its metadata entries, ordered by increasing audience.
 *
 * <p>The library only tags fields. Redacting them before they cross a trust boundary is the job of
 * whatever renders the error to that audience.
 */
public enum Visibility {
  /** Only the owning service may see the field. This is the default. */
  INTERNAL(0),

  /** Trusted callers inside the same organisation may see the field. */
  PRIVATE(1),

  /** Safe to show to end users. */
  PUBLIC(2);

  private final int number;

  Visibility(int number) {
    this.number = number;
  }

  public int number() {
    return number;
  }

  /**
   * Returns whether a field tagged with this visibility may be shown to the given audience.
   *
   * <p>A {@link #PUBLIC} field is visible to every audience, an {@link #INTERNAL} field only to an
   * internal audience.
   */
  public boolean isVisibleTo(@Nonnull Visibility audience) {
    return number >= audience.number;
  }

  /** Resolves a numeric visibility, falling back to {@link #INTERNAL} for unknown values. */
  @Nonnull
  public static Visibility forNumber(int number) {
    for (Visibility visibility : values()) {
      if (visibility.number == number) {
        return visibility;
      }
    }
    return INTERNAL;
  }
}
