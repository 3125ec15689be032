package io.github.wphillipmoore.mturk.requester.request;

import java.util.Objects;

/**
 * A value substituted into a HIT layout placeholder.
 *
 * @param name the placeholder name, never null
 * @param value the substituted value, never null
 */
public record LayoutParameter(String name, String value) {

  /** Validates that name and value are non-null. */
  public LayoutParameter {
    Objects.requireNonNull(name, "name");
    Objects.requireNonNull(value, "value");
  }
}
