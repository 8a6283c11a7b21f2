package com.trogonerror;

import com.google.common.base.MoreObjects;
import com.google.common.base.Strings;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import javax.annotation.Nonnull;
import javax.annotation.Nullable;

/**
 * A reusable definition of one kind of error. A template fixes the domain and reason and the
 * defaults for code, message, visibility and help; each call to {@link #newError(ErrorOption...)}
 * stamps a fresh {@link TrogonError} from it.
 *
 * <p>Templates are meant to be long-lived constants:
 *
 * <pre>
 * static final ErrorTemplate USER_NOT_FOUND =
 *     ErrorTemplate.of("myapp.users", "NOT_FOUND", TemplateOptions.withCode(Code.NOT_FOUND));
 *
 * throw USER_NOT_FOUND.newError(
 *     ErrorOptions.withMetadataValue(Visibility.PUBLIC, "userId", userId));
 * </pre>
 *
 * <p>A template is not itself an error. It only knows how to create one and how to recognise
 * errors of its kind through {@link #is(Throwable)}.
 */
public final class ErrorTemplate implements ErrorMatcher {

  private final String domain;
  private final String reason;
  private final Code code;
  private final String message;
  private final Visibility visibility;
  private final Help help;

  private ErrorTemplate(Builder builder) {
    this.domain = builder.domain;
    this.reason = builder.reason;
    this.code = builder.code;
    this.message = builder.message;
    this.visibility = builder.visibility;
    this.help = builder.helpLinks != null ? Help.of(builder.helpLinks) : null;
  }

  /**
   * Creates a template. Defaults are {@link Code#UNKNOWN}, the code's default message and {@link
   * Visibility#INTERNAL}.
   *
   * @param domain namespace of the owning subsystem
   * @param reason stable identifier of the failure within the domain
   * @param options template defaults, see {@link TemplateOptions}
   */
  @Nonnull
  public static ErrorTemplate of(String domain, String reason, TemplateOption... options) {
    Builder builder = new Builder(domain, reason);
    for (TemplateOption option : options) {
      option.apply(builder);
    }
    return new ErrorTemplate(builder);
  }

  /**
   * Creates an error from this template. The template defaults are applied first, then the given
   * options, so instance options override scalar defaults and add to the template's help links.
   */
  @Nonnull
  public TrogonError newError(ErrorOption... options) {
    List<ErrorOption> all = new ArrayList<>(options.length + 4);
    all.add(ErrorOptions.withCode(code));
    all.add(ErrorOptions.withVisibility(visibility));
    if (!message.isEmpty()) {
      all.add(ErrorOptions.withMessage(message));
    }
    if (help != null) {
      all.add(ErrorOptions.withHelp(help));
    }
    for (ErrorOption option : options) {
      all.add(option);
    }
    return TrogonError.newError(domain, reason, all.toArray(new ErrorOption[0]));
  }

  /** Returns true when the error is a TrogonError with this template's domain and reason. */
  public boolean is(@Nullable Throwable error) {
    return error instanceof TrogonError && matches((TrogonError) error);
  }

  @Override
  public boolean matches(@Nonnull TrogonError candidate) {
    return domain.equals(candidate.domain()) && reason.equals(candidate.reason());
  }

  @Nonnull
  public String domain() {
    return domain;
  }

  @Nonnull
  public String reason() {
    return reason;
  }

  @Nonnull
  public Code code() {
    return code;
  }

  /** Returns the default message, or an empty string when the code's message is used. */
  @Nonnull
  public String message() {
    return message;
  }

  @Nonnull
  public Visibility visibility() {
    return visibility;
  }

  @Nullable
  public Help help() {
    return help;
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("domain", domain)
        .add("reason", reason)
        .add("code", code)
        .add("visibility", visibility)
        .toString();
  }

  /** Mutable target of {@link TemplateOption}s. */
  public static final class Builder {
    private final String domain;
    private final String reason;
    private Code code = Code.UNKNOWN;
    private String message = "";
    private Visibility visibility = Visibility.INTERNAL;
    private List<HelpLink> helpLinks;

    private Builder(String domain, String reason) {
      this.domain = Strings.nullToEmpty(domain);
      this.reason = Strings.nullToEmpty(reason);
    }

    public Builder code(@Nonnull Code code) {
      this.code = Objects.requireNonNull(code, "code");
      return this;
    }

    public Builder message(String message) {
      this.message = Strings.nullToEmpty(message);
      return this;
    }

    public Builder visibility(@Nonnull Visibility visibility) {
      this.visibility = Objects.requireNonNull(visibility, "visibility");
      return this;
    }

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
  }
}
