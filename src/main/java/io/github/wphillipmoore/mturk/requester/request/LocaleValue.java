package io.github.wphillipmoore.mturk.requester.request;

import java.util.Objects;
import org.jspecify.annotations.Nullable;

/**
 * A worker location used by a locale qualification comparison.
 *
 * @param country the ISO 3166 country code, never null
 * @param subdivision the ISO 3166-2 subdivision code, or {@code null}
 */
public record LocaleValue(String country, @Nullable String subdivision) {

  /** Validates that country is non-null. */
  public LocaleValue {
    Objects.requireNonNull(country, "country");
  }

  /** Creates a country-only locale. */
  public LocaleValue(String country) {
    this(country, null);
  }
}
