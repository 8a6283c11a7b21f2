package com.trogonerror;

import com.google.common.base.Strings;
import java.io.Serializable;

/**
 * A documentation or remediation link attached to an error.
 *
 * @param description Short label shown next to the link
 * @param url Where the link points
 */
public record HelpLink(String description, String url) implements Serializable {

  public HelpLink {
    description = Strings.nullToEmpty(description);
    url = Strings.nullToEmpty(url);
  }
}
