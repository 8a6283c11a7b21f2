package com.trogonerror;

import com.google.common.base.MoreObjects;
import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;
import java.io.Serializable;
import java.util.List;
import java.util.Objects;
import javax.annotation.Nonnull;

/**
 * Technical details for internal debugging: the frames captured when the error was built and an
 * optional free-text detail. Never disclosed outside the owning service, so it carries no
 * {@link Visibility}.
 */
public final class DebugInfo implements Serializable {

  private static final long serialVersionUID = 1L;

  private final ImmutableList<StackTraceElement> stackFrames;
  private final String detail;

  private DebugInfo(ImmutableList<StackTraceElement> stackFrames, String detail) {
    this.stackFrames = stackFrames;
    this.detail = detail;
  }

  /** Creates debug info from captured frames and a detail message. */
  @Nonnull
  public static DebugInfo of(List<StackTraceElement> stackFrames, String detail) {
    return new DebugInfo(ImmutableList.copyOf(stackFrames), Strings.nullToEmpty(detail));
  }

  /** Creates debug info carrying only a detail message. */
  @Nonnull
  public static DebugInfo ofDetail(String detail) {
    return new DebugInfo(ImmutableList.of(), Strings.nullToEmpty(detail));
  }

  /** Returns the captured frames, innermost first. Empty when no stack was captured. */
  @Nonnull
  public List<StackTraceElement> stackFrames() {
    return stackFrames;
  }

  /** Returns the detail message, or an empty string. */
  @Nonnull
  public String detail() {
    return detail;
  }

  /**
   * Renders each frame as {@code <file>:<line> <class>.<method>}.
   *
   * @return one entry per captured frame, empty when no stack was captured
   */
  @Nonnull
  public List<String> stackEntries() {
    ImmutableList.Builder<String> entries =
        ImmutableList.builderWithExpectedSize(stackFrames.size());
    for (StackTraceElement frame : stackFrames) {
      entries.add(formatFrame(frame));
    }
    return entries.build();
  }

  static String formatFrame(StackTraceElement frame) {
    String file = frame.getFileName() != null ? frame.getFileName() : "Unknown Source";
    return file + ":" + frame.getLineNumber() + " " + frame.getClassName() + "."
        + frame.getMethodName();
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (obj == null || getClass() != obj.getClass()) {
      return false;
    }
    DebugInfo other = (DebugInfo) obj;
    return stackFrames.equals(other.stackFrames) && detail.equals(other.detail);
  }

  @Override
  public int hashCode() {
    return Objects.hash(stackFrames, detail);
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("detail", detail)
        .add("frameCount", stackFrames.size())
        .toString();
  }
}
