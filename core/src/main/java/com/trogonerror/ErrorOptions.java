package com.trogonerror;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;

/**
 * Construction options for {@link TrogonError#newError(String, String, ErrorOption...)} and
 * {@link ErrorTemplate#newError(ErrorOption...)}.
 *
 * <p>Every option is total: empty strings are valid values and no option throws for data input.
 */
public final class ErrorOptions {

  private ErrorOptions() {
    // Utility class, no instances
  }

  public static ErrorOption withCode(Code code) {
    return builder -> builder.code(code);
  }

  /** Sets the message. An empty message falls back to the code's default message. */
  public static ErrorOption withMessage(String message) {
    return builder -> builder.message(message);
  }

  /** Sets the message to the human text of another error. */
  public static ErrorOption withErrorMessage(Throwable error) {
    return builder ->
        builder.message(
            error instanceof TrogonError ? ((TrogonError) error).message() : error.getMessage());
  }

  /** Adds every entry of the map, replacing entries with the same key. */
  public static ErrorOption withMetadata(Map<String, MetadataValue> metadata) {
    return builder -> builder.putAllMetadata(metadata);
  }

  public static ErrorOption withMetadataValue(Visibility visibility, String key, String value) {
    return builder -> builder.putMetadata(visibility, key, value);
  }

  /**
   * Adds a metadata entry whose value is built with {@link String#format(String, Object...)}.
   *
   * <p>Example: {@code withMetadataValuef(Visibility.PUBLIC, "orderId", "gid://shop/Order/%s", id)}
   */
  public static ErrorOption withMetadataValuef(
      Visibility visibility, String key, String valueFormat, Object... args) {
    return builder -> builder.putMetadata(visibility, key, String.format(valueFormat, args));
  }

  public static ErrorOption withVisibility(Visibility visibility) {
    return builder -> builder.visibility(visibility);
  }

  public static ErrorOption withSubject(String subject) {
    return builder -> builder.subject(subject);
  }

  public static ErrorOption withId(String id) {
    return builder -> builder.id(id);
  }

  public static ErrorOption withTime(Instant time) {
    return builder -> builder.time(time);
  }

  public static ErrorOption withSourceId(String sourceId) {
    return builder -> builder.sourceId(sourceId);
  }

  /** Replaces the help links. */
  public static ErrorOption withHelp(Help help) {
    return builder -> builder.help(help);
  }

  /** Appends a help link with a static URL. */
  public static ErrorOption withHelpLink(String description, String url) {
    return builder -> builder.addHelpLink(description, url);
  }

  /** Appends a help link whose URL is built with {@link String#format(String, Object...)}. */
  public static ErrorOption withHelpLinkf(String description, String urlFormat, Object... args) {
    return builder -> builder.addHelpLink(description, String.format(urlFormat, args));
  }

  public static ErrorOption withDebugInfo(DebugInfo debugInfo) {
    return builder -> builder.debugInfo(debugInfo);
  }

  /** Sets the debug detail without capturing a stack trace. */
  public static ErrorOption withDebugDetail(String detail) {
    return builder -> builder.debugDetail(detail);
  }

  /** Captures the stack of the caller with the configured default depth. */
  public static ErrorOption withStackTrace() {
    return withStackTraceDepth(0);
  }

  /**
   * Captures at most {@code maxDepth} frames of the caller's stack. The capture happens when the
   * option is applied and starts at the code that created the error.
   */
  public static ErrorOption withStackTraceDepth(int maxDepth) {
    return builder -> builder.stackFrames(StackTraces.capture(maxDepth));
  }

  public static ErrorOption withLocalizedMessage(String locale, String message) {
    return builder -> builder.localizedMessage(locale, message);
  }

  /** Sets a relative retry offset. Replaces any retry time. */
  public static ErrorOption withRetryOffset(Duration retryOffset) {
    return builder -> builder.retryOffset(retryOffset);
  }

  /** Sets an absolute retry time. Replaces any retry offset. */
  public static ErrorOption withRetryTime(Instant retryTime) {
    return builder -> builder.retryTime(retryTime);
  }

  /** Appends structured causes. They do not take part in the exception chain. */
  public static ErrorOption withCause(TrogonError... causes) {
    return builder -> builder.addCauses(causes);
  }

  /** Wraps another error; it becomes the {@link Throwable#getCause() cause} of the new error. */
  public static ErrorOption withWrap(Throwable wrapped) {
    return builder -> builder.wrap(wrapped);
  }
}
