package com.trogonerror;

/**
 * Configures the defaults of an {@link ErrorTemplate}.
 *
 * @see TemplateOptions
 */
@FunctionalInterface
public interface TemplateOption {

  void apply(ErrorTemplate.Builder builder);
}
