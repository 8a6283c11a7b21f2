package com.trogonerror;

import java.time.Instant;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoUnit;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Map;
import javax.annotation.Nonnull;
import org.tinylog.Logger;

/**
 * Renders a {@link TrogonError} into its deterministic text form. The layout is a public contract;
 * log pipelines and tests assert on it.
 *
 * <pre>
 * Payment processing failed
 *   visibility: PRIVATE
 *   domain: shop.payments
 *   reason: PAYMENT_DECLINED
 *   code: INTERNAL
 *   id: err_123
 *   time: 2024-01-15T14:30:45Z
 *   subject: /payment/amount
 *   sourceId: gateway-01
 *   retryInfo: retryTime=2024-01-15T14:35:45Z
 *   metadata:
 *     - amount: 299.99 visibility=PRIVATE
 *     - currency: USD visibility=PUBLIC
 *
 * - Retry Payment: https://example.com/retry
 *
 * wrapped error: connection reset
 *
 * upstream timeout
 * Gateway.java:42 com.example.Gateway.charge
 * </pre>
 *
 * <p>The first five lines are always present. The optional lines follow in the order shown and
 * only when their field is set; metadata is sorted by key. The help block, the wrapped error and
 * the debug block are each preceded by one blank line. A wrapped TrogonError is rendered with this
 * same layout, any other wrapped error with its own message.
 */
public final class ErrorFormatter {

  private ErrorFormatter() {
    // Utility class, no instances
  }

  /** Renders the error and everything it wraps. Never throws. */
  @Nonnull
  public static String format(@Nonnull TrogonError error) {
    StringBuilder sb = new StringBuilder();
    // Debug blocks close in reverse order, after the wrapped errors they enclose.
    Deque<TrogonError> pendingDebug = new ArrayDeque<>();
    TrogonError current = error;
    while (current != null) {
      appendHead(sb, current);
      pendingDebug.push(current);

      Throwable wrapped = current.getCause();
      current = null;
      if (wrapped != null) {
        sb.append("\n\nwrapped error: ");
        if (wrapped instanceof TrogonError) {
          current = (TrogonError) wrapped;
        } else {
          sb.append(describe(wrapped));
        }
      }
    }
    while (!pendingDebug.isEmpty()) {
      appendDebug(sb, pendingDebug.pop());
    }
    return sb.toString();
  }

  private static void appendHead(StringBuilder sb, TrogonError error) {
    sb.append(error.message().strip());
    sb.append("\n  visibility: ").append(error.visibility().name());
    sb.append("\n  domain: ").append(error.domain());
    sb.append("\n  reason: ").append(error.reason());
    sb.append("\n  code: ").append(error.code().name());

    if (!error.id().isEmpty()) {
      sb.append("\n  id: ").append(error.id());
    }
    if (error.time() != null) {
      sb.append("\n  time: ").append(formatInstant(error.time()));
    }
    if (!error.subject().isEmpty()) {
      sb.append("\n  subject: ").append(error.subject());
    }
    if (!error.sourceId().isEmpty()) {
      sb.append("\n  sourceId: ").append(error.sourceId());
    }

    RetryInfo retryInfo = error.retryInfo();
    if (retryInfo != null) {
      sb.append("\n  retryInfo: ");
      if (retryInfo.retryOffset() != null) {
        sb.append("retryOffset=").append(retryInfo.retryOffset());
      } else {
        sb.append("retryTime=").append(formatInstant(retryInfo.retryTime()));
      }
    }

    if (!error.metadata().isEmpty()) {
      sb.append("\n  metadata:");
      for (Map.Entry<String, MetadataValue> entry : error.metadata().entrySet()) {
        sb.append("\n    - ")
            .append(entry.getKey())
            .append(": ")
            .append(entry.getValue().value())
            .append(" visibility=")
            .append(entry.getValue().visibility().name());
      }
    }

    Help help = error.help();
    if (help != null && !help.isEmpty()) {
      sb.append('\n');
      for (HelpLink link : help.links()) {
        sb.append("\n- ").append(link.description()).append(": ").append(link.url());
      }
    }
  }

  private static void appendDebug(StringBuilder sb, TrogonError error) {
    DebugInfo debugInfo = error.debugInfo();
    if (debugInfo == null || (debugInfo.detail().isEmpty() && debugInfo.stackFrames().isEmpty())) {
      return;
    }
    sb.append('\n');
    if (!debugInfo.detail().isEmpty()) {
      sb.append('\n').append(debugInfo.detail());
    }
    for (String entry : debugInfo.stackEntries()) {
      sb.append('\n').append(entry);
    }
  }

  /** RFC 3339 at second precision, always in UTC. */
  static String formatInstant(Instant instant) {
    return DateTimeFormatter.ISO_INSTANT.format(instant.truncatedTo(ChronoUnit.SECONDS));
  }

  private static String describe(Throwable wrapped) {
    try {
      String text = wrapped.getMessage();
      return text != null ? text : wrapped.toString();
    } catch (RuntimeException e) {
      Logger.warn(e, "Failed to render wrapped {}", wrapped.getClass().getName());
      return wrapped.getClass().getName();
    }
  }
}
