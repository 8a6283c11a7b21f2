package com.trogonerror.config;

import com.google.common.base.MoreObjects;
import com.google.common.base.Strings;
import com.google.common.primitives.Ints;
import org.tinylog.Logger;

/**
 * Configuration record for stack trace capture on error construction.
 *
 * <p>The default depth applies to {@code ErrorOptions.withStackTrace()} and to any explicit depth
 * that is zero or negative. It can be tuned per process through the {@value #DEPTH_PROPERTY}
 * system property or the {@value #DEPTH_ENV} environment variable; the system property wins.
 *
 * @param defaultDepth Maximum number of frames captured when the caller gives no usable depth
 */
public record StackTraceConfig(int defaultDepth) {

  /** Depth used when nothing else is configured. */
  public static final int DEFAULT_DEPTH = 32;

  public static final String DEPTH_PROPERTY = "trogonerror.stackDepth";
  public static final String DEPTH_ENV = "TROGONERROR_STACK_DEPTH";

  private static final StackTraceConfig CURRENT = fromEnvironment();

  public StackTraceConfig {
    if (defaultDepth <= 0) {
      defaultDepth = DEFAULT_DEPTH;
    }
  }

  /** Returns the process-wide configuration, read once from the environment. */
  public static StackTraceConfig current() {
    return CURRENT;
  }

  /** Reads the configuration from the system property, then the environment variable. */
  public static StackTraceConfig fromEnvironment() {
    String raw = System.getProperty(DEPTH_PROPERTY);
    if (Strings.isNullOrEmpty(raw)) {
      raw = System.getenv(DEPTH_ENV);
    }
    return parse(raw);
  }

  /**
   * Builds a configuration from a raw depth setting.
   *
   * @param raw the configured depth, may be null
   * @return the configuration, using {@link #DEFAULT_DEPTH} for missing or unusable values
   */
  public static StackTraceConfig parse(String raw) {
    if (Strings.isNullOrEmpty(raw)) {
      return new StackTraceConfig(DEFAULT_DEPTH);
    }
    Integer depth = Ints.tryParse(raw.trim());
    if (depth == null || depth <= 0) {
      Logger.debug("Ignoring invalid stack depth setting '{}', using {}", raw, DEFAULT_DEPTH);
      return new StackTraceConfig(DEFAULT_DEPTH);
    }
    return new StackTraceConfig(depth);
  }

  /** Returns the depth to use for a requested depth, falling back to the default. */
  public int resolve(int requestedDepth) {
    return requestedDepth > 0 ? requestedDepth : defaultDepth;
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this).add("defaultDepth", defaultDepth).toString();
  }
}
