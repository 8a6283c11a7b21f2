package com.trogonerror;

import com.google.common.base.Strings;
import java.io.Serializable;

/**
 * A translated variant of the error message. The caller supplies the exact text; no catalog lookup
 * happens here.
 *
 * @param locale Locale identifier, e.g. "es-ES"
 * @param message The translated message
 */
public record LocalizedMessage(String locale, String message) implements Serializable {

  public LocalizedMessage {
    locale = Strings.nullToEmpty(locale);
    message = Strings.nullToEmpty(message);
  }
}
