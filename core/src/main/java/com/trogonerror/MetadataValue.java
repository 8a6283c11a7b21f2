package com.trogonerror;

import com.google.common.base.Strings;
import java.io.Serializable;
import java.util.Objects;
import javax.annotation.Nonnull;

/**
 * A metadata entry of a {@link TrogonError}: the value and the audience allowed to see it.
 *
 * @param value The metadata value, never null
 * @param visibility Who may see this entry
 */
public record MetadataValue(@Nonnull String value, @Nonnull Visibility visibility)
    implements Serializable {

  public MetadataValue {
    value = Strings.nullToEmpty(value);
    Objects.requireNonNull(visibility, "visibility");
  }

  /** Creates an entry with the given visibility. */
  public static MetadataValue of(Visibility visibility, String value) {
    return new MetadataValue(value, visibility);
  }
}
