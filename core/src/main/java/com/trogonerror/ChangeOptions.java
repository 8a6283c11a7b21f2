package com.trogonerror;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;

/** Changes accepted by {@link TrogonError#withChanges(ChangeOption...)}. */
public final class ChangeOptions {

  private ChangeOptions() {
    // Utility class, no instances
  }

  /** Replaces the whole metadata map. */
  public static ChangeOption withMetadata(Map<String, MetadataValue> metadata) {
    return builder -> builder.replaceMetadata(metadata);
  }

  public static ChangeOption withMetadataValue(Visibility visibility, String key, String value) {
    return builder -> builder.putMetadata(visibility, key, value);
  }

  public static ChangeOption withMetadataValuef(
      Visibility visibility, String key, String valueFormat, Object... args) {
    return builder -> builder.putMetadata(visibility, key, String.format(valueFormat, args));
  }

  public static ChangeOption withId(String id) {
    return builder -> builder.id(id);
  }

  public static ChangeOption withTime(Instant time) {
    return builder -> builder.time(time);
  }

  public static ChangeOption withSourceId(String sourceId) {
    return builder -> builder.sourceId(sourceId);
  }

  /** Appends a help link after the existing ones. */
  public static ChangeOption withHelpLink(String description, String url) {
    return builder -> builder.addHelpLink(description, url);
  }

  public static ChangeOption withHelpLinkf(String description, String urlFormat, Object... args) {
    return builder -> builder.addHelpLink(description, String.format(urlFormat, args));
  }

  /** Replaces the retry info with a relative offset. */
  public static ChangeOption withRetryOffset(Duration retryOffset) {
    return builder -> builder.retryOffset(retryOffset);
  }

  /** Replaces the retry info with an absolute time. */
  public static ChangeOption withRetryTime(Instant retryTime) {
    return builder -> builder.retryTime(retryTime);
  }

  public static ChangeOption withLocalizedMessage(String locale, String message) {
    return builder -> builder.localizedMessage(locale, message);
  }
}
