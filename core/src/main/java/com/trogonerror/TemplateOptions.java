package com.trogonerror;

/** Options for {@link ErrorTemplate#of(String, String, TemplateOption...)}. */
public final class TemplateOptions {

  private TemplateOptions() {
    // Utility class, no instances
  }

  public static TemplateOption withCode(Code code) {
    return builder -> builder.code(code);
  }

  public static TemplateOption withMessage(String message) {
    return builder -> builder.message(message);
  }

  public static TemplateOption withVisibility(Visibility visibility) {
    return builder -> builder.visibility(visibility);
  }

  public static TemplateOption withHelp(Help help) {
    return builder -> builder.help(help);
  }

  public static TemplateOption withHelpLink(String description, String url) {
    return builder -> builder.addHelpLink(description, url);
  }
}
