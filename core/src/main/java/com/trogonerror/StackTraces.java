package com.trogonerror;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.trogonerror.config.StackTraceConfig;

/** Captures the calling thread's stack for {@link DebugInfo}. */
final class StackTraces {

  // Frames of the option machinery are dropped so the capture starts at the caller.
  private static final ImmutableSet<String> LIBRARY_CLASSES =
      ImmutableSet.of(
          StackTraces.class.getName(),
          ErrorOptions.class.getName(),
          ErrorOption.class.getName(),
          TrogonError.class.getName(),
          TrogonError.Builder.class.getName(),
          ErrorTemplate.class.getName());

  private static final StackWalker WALKER = StackWalker.getInstance();

  private StackTraces() {
    // Utility class, no instances
  }

  /**
   * Captures up to {@code maxDepth} frames, starting at the first frame outside this library.
   * Non-positive depths use {@link StackTraceConfig#defaultDepth()}.
   */
  static ImmutableList<StackTraceElement> capture(int maxDepth) {
    int depth = StackTraceConfig.current().resolve(maxDepth);
    return WALKER.walk(
        frames ->
            frames
                .dropWhile(frame -> LIBRARY_CLASSES.contains(frame.getClassName()))
                .limit(depth)
                .map(StackWalker.StackFrame::toStackTraceElement)
                .collect(ImmutableList.toImmutableList()));
  }
}
