package com.trogonerror;

import com.google.common.base.MoreObjects;
import java.io.Serializable;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import javax.annotation.Nonnull;
import javax.annotation.Nullable;

/**
 * Tells the client when it may retry: either after a relative offset or at an absolute time, never
 * both. The factories enforce the exclusivity.
 */
public final class RetryInfo implements Serializable {

  private static final long serialVersionUID = 1L;

  private final Duration retryOffset;
  private final Instant retryTime;

  private RetryInfo(Duration retryOffset, Instant retryTime) {
    this.retryOffset = retryOffset;
    this.retryTime = retryTime;
  }

  /** Retry after the given delay, measured from when the client received the error. */
  @Nonnull
  public static RetryInfo ofOffset(@Nonnull Duration retryOffset) {
    return new RetryInfo(Objects.requireNonNull(retryOffset, "retryOffset"), null);
  }

  /** Retry no earlier than the given instant. */
  @Nonnull
  public static RetryInfo ofTime(@Nonnull Instant retryTime) {
    return new RetryInfo(null, Objects.requireNonNull(retryTime, "retryTime"));
  }

  /** Returns the relative retry offset, or null when an absolute time is set instead. */
  @Nullable
  public Duration retryOffset() {
    return retryOffset;
  }

  /** Returns the absolute retry time, or null when a relative offset is set instead. */
  @Nullable
  public Instant retryTime() {
    return retryTime;
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (obj == null || getClass() != obj.getClass()) {
      return false;
    }
    RetryInfo other = (RetryInfo) obj;
    return Objects.equals(retryOffset, other.retryOffset)
        && Objects.equals(retryTime, other.retryTime);
  }

  @Override
  public int hashCode() {
    return Objects.hash(retryOffset, retryTime);
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .omitNullValues()
        .add("retryOffset", retryOffset)
        .add("retryTime", retryTime)
        .toString();
  }
}
