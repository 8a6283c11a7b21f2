package com.trogonerror;

import com.google.common.base.MoreObjects;
import com.google.common.collect.ImmutableList;
import java.io.Serializable;
import java.util.Arrays;
import java.util.List;
import javax.annotation.Nonnull;

/** Ordered help links of an error. Links render in the order they were added. */
public final class Help implements Serializable {

  private static final long serialVersionUID = 1L;

  private static final Help EMPTY = new Help(ImmutableList.of());

  private final ImmutableList<HelpLink> links;

  private Help(ImmutableList<HelpLink> links) {
    this.links = links;
  }

  /** Returns a Help with no links. */
  @Nonnull
  public static Help empty() {
    return EMPTY;
  }

  @Nonnull
  public static Help of(HelpLink... links) {
    return of(Arrays.asList(links));
  }

  @Nonnull
  public static Help of(List<HelpLink> links) {
    return new Help(ImmutableList.copyOf(links));
  }

  @Nonnull
  public List<HelpLink> links() {
    return links;
  }

  public boolean isEmpty() {
    return links.isEmpty();
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (obj == null || getClass() != obj.getClass()) {
      return false;
    }
    return links.equals(((Help) obj).links);
  }

  @Override
  public int hashCode() {
    return links.hashCode();
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this).add("links", links).toString();
  }
}
