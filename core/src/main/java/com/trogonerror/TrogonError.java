package com.trogonerror;

import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSortedMap;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import javax.annotation.Nonnull;
import javax.annotation.Nullable;

/**
 * A structured, immutable error carrying everything a caller across a service boundary needs to
 * understand a failure: a {@link Code}, a human message, the {@code domain}/{@code reason} pair
 * that identifies the kind of error, metadata tagged with a {@link Visibility}, retry guidance,
 * help links, debug context and nested causes.
 *
 * <p>Two errors are the same kind of error when their domain and reason are equal, whatever their
 * other fields hold. See {@link #is(Throwable)} and {@link TrogonErrors}.
 *
 * <p>Instances never change after construction. {@link #withChanges(ChangeOption...)} returns a
 * new error and leaves the receiver untouched, so an error may be shared freely between threads.
 *
 * <h2>Wrapped error versus causes</h2>
 *
 * <p>An error can hold two kinds of attachments:
 *
 * <ul>
 *   <li>the <em>wrapped</em> error, any {@link Throwable}, exposed through {@link #getCause()} so
 *       it takes part in the usual Java exception chain;
 *   <li>structured {@link #causes()}, other TrogonErrors kept for reporting only. They are never
 *       part of the exception chain.
 * </ul>
 *
 * <h2>Rendering</h2>
 *
 * <p>{@link #getMessage()} returns the multi-line rendering produced by {@link ErrorFormatter}; the
 * human message alone is {@link #message()}.
 *
 * <p>The JVM stack trace is never filled in. Use {@link ErrorOptions#withStackTrace()} to capture
 * frames into {@link #debugInfo()} instead.
 */
public final class TrogonError extends RuntimeException implements ErrorMatcher {

  private static final long serialVersionUID = 1L;

  /** Version of the error format this class implements. */
  public static final int SPEC_VERSION = 1;

  private final int specVersion;
  private final Code code;
  private final String message;
  private final String domain;
  private final String reason;
  private final ImmutableSortedMap<String, MetadataValue> metadata;
  private final ImmutableList<TrogonError> causes;
  private final Visibility visibility;
  private final String subject;
  private final String id;
  private final Instant time;
  private final Help help;
  private final DebugInfo debugInfo;
  private final LocalizedMessage localizedMessage;
  private final RetryInfo retryInfo;
  private final String sourceId;

  private TrogonError(Builder builder) {
    super(null, builder.wrapped, false, false);
    this.specVersion = SPEC_VERSION;
    this.code = builder.code;
    this.message = builder.message;
    this.domain = builder.domain;
    this.reason = builder.reason;
    this.metadata = ImmutableSortedMap.copyOf(builder.metadata, CodePointOrder.INSTANCE);
    this.causes = ImmutableList.copyOf(builder.causes);
    this.visibility = builder.visibility;
    this.subject = builder.subject;
    this.id = builder.id;
    this.time = builder.time;
    this.help = builder.helpLinks != null ? Help.of(builder.helpLinks) : null;
    this.debugInfo = builder.buildDebugInfo();
    this.localizedMessage = builder.localizedMessage;
    this.retryInfo = builder.retryInfo;
    this.sourceId = builder.sourceId;
  }

  /**
   * Creates a new error.
   *
   * <p>The error starts with {@link Code#UNKNOWN}, an empty message, {@link Visibility#INTERNAL}
   * and no metadata, then each option is applied in order.
   *
   * @param domain namespace of the owning subsystem, e.g. "myapp.users"
   * @param reason stable identifier of the failure within the domain, e.g. "NOT_FOUND"
   * @param options construction options, see {@link ErrorOptions}
   * @return the new error
   */
  @Nonnull
  public static TrogonError newError(String domain, String reason, ErrorOption... options) {
    Builder builder = builder(domain, reason);
    for (ErrorOption option : options) {
      option.apply(builder);
    }
    return builder.build();
  }

  /** Returns a builder for a new error with the given identity and default fields. */
  @Nonnull
  public static Builder builder(String domain, String reason) {
    return new Builder(domain, reason);
  }

  /**
   * Returns a copy of this error with the given changes applied. The receiver is not modified.
   *
   * @param changes the changes to apply, in order
   * @return a new error
   */
  @Nonnull
  public TrogonError withChanges(ChangeOption... changes) {
    Builder builder = toBuilder();
    for (ChangeOption change : changes) {
      change.apply(builder);
    }
    return builder.build();
  }

  /** Returns a builder initialised with a copy of every field of this error. */
  @Nonnull
  public Builder toBuilder() {
    return new Builder(this);
  }

  /**
   * Returns whether the target is the same kind of error.
   *
   * <p>Another TrogonError matches when its domain and reason equal this error's. Any other target
   * is looked up in the chain of the wrapped error.
   */
  public boolean is(@Nullable Throwable target) {
    if (target instanceof TrogonError) {
      return matches((TrogonError) target);
    }
    return TrogonErrors.is(getCause(), target);
  }

  @Override
  public boolean matches(@Nonnull TrogonError candidate) {
    return domain.equals(candidate.domain) && reason.equals(candidate.reason);
  }

  /** Returns the full rendering of this error, see {@link ErrorFormatter}. */
  @Override
  public String getMessage() {
    return ErrorFormatter.format(this);
  }

  public int specVersion() {
    return specVersion;
  }

  @Nonnull
  public Code code() {
    return code;
  }

  /** Returns the message, or the code's default message when none was set. */
  @Nonnull
  public String message() {
    return message.isEmpty() ? code.message() : message;
  }

  @Nonnull
  public String domain() {
    return domain;
  }

  @Nonnull
  public String reason() {
    return reason;
  }

  /** Returns the metadata, sorted by key code point. */
  @Nonnull
  public Map<String, MetadataValue> metadata() {
    return metadata;
  }

  @Nonnull
  public List<TrogonError> causes() {
    return causes;
  }

  @Nonnull
  public Visibility visibility() {
    return visibility;
  }

  /** Returns the locator of the offending input, e.g. "/email", or an empty string. */
  @Nonnull
  public String subject() {
    return subject;
  }

  /** Returns the correlation identifier, or an empty string. */
  @Nonnull
  public String id() {
    return id;
  }

  @Nullable
  public Instant time() {
    return time;
  }

  @Nullable
  public Help help() {
    return help;
  }

  @Nullable
  public DebugInfo debugInfo() {
    return debugInfo;
  }

  @Nullable
  public LocalizedMessage localizedMessage() {
    return localizedMessage;
  }

  @Nullable
  public RetryInfo retryInfo() {
    return retryInfo;
  }

  /** Returns the identifier of the component that produced the error, or an empty string. */
  @Nonnull
  public String sourceId() {
    return sourceId;
  }

  /** Returns the wrapped error; same as {@link #getCause()}. */
  @Nullable
  public Throwable wrapped() {
    return getCause();
  }

  /** Orders metadata keys by Unicode code point, which matches UTF-8 byte order. */
  private enum CodePointOrder implements Comparator<String> {
    INSTANCE;

    @Override
    public int compare(String left, String right) {
      int i = 0;
      int j = 0;
      while (i < left.length() && j < right.length()) {
        int a = left.codePointAt(i);
        int b = right.codePointAt(j);
        if (a != b) {
          return Integer.compare(a, b);
        }
        i += Character.charCount(a);
        j += Character.charCount(b);
      }
      return Integer.compare(left.length() - i, right.length() - j);
    }
  }

  /**
   * Mutable construction target of a {@link TrogonError}. Options and change options write here;
   * {@link #build()} freezes the state into a new error.
   */
  public static final class Builder {
    private final String domain;
    private final String reason;
    private Code code = Code.UNKNOWN;
    private String message = "";
    private final Map<String, MetadataValue> metadata;
    private final List<TrogonError> causes;
    private Visibility visibility = Visibility.INTERNAL;
    private String subject = "";
    private String id = "";
    private Instant time;
    private List<HelpLink> helpLinks;
    private List<StackTraceElement> stackFrames;
    private String debugDetail;
    private LocalizedMessage localizedMessage;
    private RetryInfo retryInfo;
    private String sourceId = "";
    private Throwable wrapped;

    private Builder(String domain, String reason) {
      this.domain = Strings.nullToEmpty(domain);
      this.reason = Strings.nullToEmpty(reason);
      this.metadata = new HashMap<>();
      this.causes = new ArrayList<>();
    }

    private Builder(TrogonError source) {
      this.domain = source.domain;
      this.reason = source.reason;
      this.code = source.code;
      this.message = source.message;
      this.metadata = new HashMap<>(source.metadata);
      this.causes = new ArrayList<>(source.causes);
      this.visibility = source.visibility;
      this.subject = source.subject;
      this.id = source.id;
      this.time = source.time;
      if (source.help != null) {
        this.helpLinks = new ArrayList<>(source.help.links());
      }
      if (source.debugInfo != null) {
        this.stackFrames = new ArrayList<>(source.debugInfo.stackFrames());
        this.debugDetail = source.debugInfo.detail();
      }
      this.localizedMessage = source.localizedMessage;
      this.retryInfo = source.retryInfo;
      this.sourceId = source.sourceId;
      this.wrapped = source.getCause();
    }

    /** Applies construction options in order. */
    public Builder apply(ErrorOption... options) {
      for (ErrorOption option : options) {
        option.apply(this);
      }
      return this;
    }

    public Builder code(@Nonnull Code code) {
      this.code = Objects.requireNonNull(code, "code");
      return this;
    }

    /** Sets the message; an empty message falls back to the code's default. */
    public Builder message(String message) {
      this.message = Strings.nullToEmpty(message);
      return this;
    }

    /** Adds all entries, replacing existing entries with the same key. */
    public Builder putAllMetadata(Map<String, MetadataValue> entries) {
      metadata.putAll(entries);
      return this;
    }

    /** Replaces the whole metadata map. */
    public Builder replaceMetadata(Map<String, MetadataValue> entries) {
      metadata.clear();
      metadata.putAll(entries);
      return this;
    }

    public Builder putMetadata(Visibility visibility, String key, String value) {
      metadata.put(Strings.nullToEmpty(key), new MetadataValue(value, visibility));
      return this;
    }

    public Builder visibility(@Nonnull Visibility visibility) {
      this.visibility = Objects.requireNonNull(visibility, "visibility");
      return this;
    }

    public Builder subject(String subject) {
      this.subject = Strings.nullToEmpty(subject);
      return this;
    }

    public Builder id(String id) {
      this.id = Strings.nullToEmpty(id);
      return this;
    }

    public Builder time(@Nullable Instant time) {
      this.time = time;
      return this;
    }

    public Builder sourceId(String sourceId) {
      this.sourceId = Strings.nullToEmpty(sourceId);
      return this;
    }

    /** Replaces the help links with the given ones. */
    public Builder help(@Nonnull Help help) {
      this.helpLinks = new ArrayList<>(help.links());
      return this;
    }

    public Builder addHelpLink(String description, String url) {
      if (helpLinks == null) {
        helpLinks = new ArrayList<>();
      }
      helpLinks.add(new HelpLink(description, url));
      return this;
    }

    /** Replaces both the captured frames and the detail. */
    public Builder debugInfo(@Nonnull DebugInfo debugInfo) {
      this.stackFrames = new ArrayList<>(debugInfo.stackFrames());
      this.debugDetail = debugInfo.detail();
      return this;
    }

    /** Sets the debug detail, keeping any captured frames. */
    public Builder debugDetail(String detail) {
      this.debugDetail = Strings.nullToEmpty(detail);
      return this;
    }

    /** Sets the captured frames, keeping any debug detail. */
    public Builder stackFrames(List<StackTraceElement> frames) {
      this.stackFrames = new ArrayList<>(frames);
      return this;
    }

    public Builder localizedMessage(String locale, String message) {
      this.localizedMessage = new LocalizedMessage(locale, message);
      return this;
    }

    /** Sets a relative retry offset, clearing any absolute retry time. */
    public Builder retryOffset(@Nullable Duration retryOffset) {
      this.retryInfo = retryOffset != null ? RetryInfo.ofOffset(retryOffset) : null;
      return this;
    }

    /** Sets an absolute retry time, clearing any relative retry offset. */
    public Builder retryTime(@Nullable Instant retryTime) {
      this.retryInfo = retryTime != null ? RetryInfo.ofTime(retryTime) : null;
      return this;
    }

    public Builder addCauses(TrogonError... causes) {
      this.causes.addAll(Arrays.asList(causes));
      return this;
    }

    /** Sets the wrapped error exposed through {@link TrogonError#getCause()}. */
    public Builder wrap(@Nullable Throwable wrapped) {
      this.wrapped = wrapped;
      return this;
    }

    @Nonnull
    public TrogonError build() {
      return new TrogonError(this);
    }

    private DebugInfo buildDebugInfo() {
      if (stackFrames == null && debugDetail == null) {
        return null;
      }
      return DebugInfo.of(
          stackFrames != null ? stackFrames : ImmutableList.of(), debugDetail);
    }
  }
}
