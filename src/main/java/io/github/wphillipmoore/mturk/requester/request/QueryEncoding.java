package io.github.wphillipmoore.mturk.requester.request;

import java.math.BigDecimal;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.Objects;

/** Renders and escapes scalar parameter values for the query string. */
public final class QueryEncoding {

  private QueryEncoding() {}

  /**
   * Form-encodes a value: UTF-8, space as {@code +}, with {@code *} and {@code ~} percent-encoded.
   *
   * @param value the raw value
   * @return the escaped value
   */
  public static String encode(String value) {
    Objects.requireNonNull(value, "value");
    return URLEncoder.encode(value, StandardCharsets.UTF_8)
        .replace("*", "%2A")
        .replace("~", "%7E");
  }

  /**
   * Renders a scalar parameter value as text.
   *
   * <p>Whole floating point numbers lose their fraction ({@code 3600.0} renders as {@code 3600}),
   * so numbers read from JSON configuration render the way they were written.
   *
   * @param value a {@link CharSequence}, {@link Number} or {@link Boolean}
   * @return the textual form
   * @throws IllegalArgumentException if the value is not a scalar
   */
  public static String render(Object value) {
    Objects.requireNonNull(value, "value");
    if (value instanceof CharSequence || value instanceof Boolean) {
      return value.toString();
    }
    if (value instanceof BigDecimal decimal) {
      return decimal.toPlainString();
    }
    if (value instanceof Double || value instanceof Float) {
      return new BigDecimal(value.toString()).stripTrailingZeros().toPlainString();
    }
    if (value instanceof Number) {
      return value.toString();
    }
    throw new IllegalArgumentException(
        "Not a scalar parameter value: " + value.getClass().getSimpleName());
  }

  /** Returns whether a value can be rendered by {@link #render(Object)}. */
  public static boolean isScalar(Object value) {
    return value instanceof CharSequence || value instanceof Number || value instanceof Boolean;
  }

  /**
   * Appends {@code &name=value} to the query, escaping the value.
   *
   * @param query the query under construction
   * @param name the parameter name, appended verbatim
   * @param value the scalar value
   */
  static void appendParameter(StringBuilder query, String name, Object value) {
    query.append('&').append(name).append('=').append(encode(render(value)));
  }
}
