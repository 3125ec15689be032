package io.github.wphillipmoore.mturk.requester.request;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.jspecify.annotations.Nullable;

/**
 * Immutable, insertion-ordered request parameters.
 *
 * <p>Scalar parameters hold a {@link CharSequence}, {@link Number} or {@link Boolean}. The keys
 * owned by a {@link StructuredField} hold that field's typed value; generic maps and lists (as
 * decoded from JSON) are converted when they are put, so a malformed structure fails at
 * construction rather than while a request is being sent.
 *
 * <pre>{@code
 * ParameterBag params = ParameterBag.builder()
 *     .put("Title", "Tag images")
 *     .reward(Reward.usd("0.05"))
 *     .keywords("image", "tagging")
 *     .build();
 * }</pre>
 */
public final class ParameterBag {

  private static final ParameterBag EMPTY = new ParameterBag(new LinkedHashMap<>());

  private final Map<String, Object> values;

  private ParameterBag(LinkedHashMap<String, Object> values) {
    this.values = Collections.unmodifiableMap(values);
  }

  /** Returns an empty parameter bag. */
  public static ParameterBag empty() {
    return EMPTY;
  }

  /** Returns a new builder. */
  public static Builder builder() {
    return new Builder();
  }

  /** Returns a bag holding a single parameter. */
  public static ParameterBag of(String key, Object value) {
    return builder().put(key, value).build();
  }

  /** Returns a bag holding two parameters, in order. */
  public static ParameterBag of(String key1, Object value1, String key2, Object value2) {
    return builder().put(key1, value1).put(key2, value2).build();
  }

  /**
   * Creates a bag from a generic map, such as one decoded from JSON.
   *
   * @param raw the parameters, iterated in their own order
   * @return the parameter bag
   * @throws IllegalArgumentException if a value has an unsupported shape
   */
  public static ParameterBag fromMap(Map<String, ?> raw) {
    Objects.requireNonNull(raw, "raw");
    Builder builder = builder();
    raw.forEach(builder::put);
    return builder.build();
  }

  /** Returns whether a parameter is present under the key. */
  public boolean contains(String key) {
    return values.containsKey(key);
  }

  /** Returns the value stored under the key, or {@code null} if absent. */
  public @Nullable Object get(String key) {
    return values.get(key);
  }

  /** Returns the keys in insertion order. */
  public List<String> keys() {
    return List.copyOf(values.keySet());
  }

  /** Returns whether the bag holds no parameters. */
  public boolean isEmpty() {
    return values.isEmpty();
  }

  /** Returns an unmodifiable, ordered view of the parameters. */
  public Map<String, Object> asMap() {
    return values;
  }

  /** Returns the reward, or {@code null} if absent. */
  public @Nullable Reward getReward() {
    return (Reward) values.get(StructuredField.REWARD.key());
  }

  /** Returns the keywords, or {@code null} if absent. */
  @SuppressWarnings("unchecked")
  public @Nullable List<String> getKeywords() {
    return (List<String>) values.get(StructuredField.KEYWORDS.key());
  }

  /** Returns the qualification requirements, or {@code null} if absent. */
  @SuppressWarnings("unchecked")
  public @Nullable List<QualificationRequirement> getQualificationRequirements() {
    return (List<QualificationRequirement>)
        values.get(StructuredField.QUALIFICATION_REQUIREMENT.key());
  }

  /** Returns the HIT layout parameters, or {@code null} if absent. */
  @SuppressWarnings("unchecked")
  public @Nullable List<LayoutParameter> getLayoutParameters() {
    return (List<LayoutParameter>) values.get(StructuredField.HIT_LAYOUT_PARAMETER.key());
  }

  /** Returns the notifications, or {@code null} if absent. */
  @SuppressWarnings("unchecked")
  public @Nullable List<NotificationSpec> getNotifications() {
    return (List<NotificationSpec>) values.get(StructuredField.NOTIFICATION.key());
  }

  /**
   * Returns this bag with the given parameters layered on top. Keys of {@code overrides} replace
   * keys of this bag; keys only present here are kept, in their original position.
   *
   * @param overrides the parameters taking precedence
   * @return the merged bag
   */
  public ParameterBag overriddenBy(ParameterBag overrides) {
    Objects.requireNonNull(overrides, "overrides");
    if (overrides.isEmpty()) {
      return this;
    }
    if (isEmpty()) {
      return overrides;
    }
    LinkedHashMap<String, Object> merged = new LinkedHashMap<>(values);
    merged.putAll(overrides.values);
    return new ParameterBag(merged);
  }

  /** Returns a builder pre-populated with this bag's parameters. */
  public Builder toBuilder() {
    Builder builder = builder();
    builder.values.putAll(values);
    return builder;
  }

  @Override
  public boolean equals(@Nullable Object other) {
    return this == other
        || (other instanceof ParameterBag bag && values.equals(bag.values));
  }

  @Override
  public int hashCode() {
    return values.hashCode();
  }

  @Override
  public String toString() {
    return "ParameterBag" + values;
  }

  /** Builder for {@link ParameterBag}. */
  public static final class Builder {

    private final LinkedHashMap<String, Object> values = new LinkedHashMap<>();

    private Builder() {}

    /**
     * Sets a parameter, replacing any previous value under the key.
     *
     * @param key the parameter name
     * @param value a scalar, or the typed or generic value of a structured field
     * @return this builder
     * @throws IllegalArgumentException if the value's shape does not fit the key
     */
    public Builder put(String key, Object value) {
      Objects.requireNonNull(key, "key");
      Objects.requireNonNull(value, "value");
      if (key.isBlank()) {
        throw new IllegalArgumentException("key must not be blank");
      }
      StructuredField field = StructuredField.forKey(key);
      if (field != null) {
        values.put(key, field.coerce(value));
      } else if (QueryEncoding.isScalar(value)) {
        values.put(key, value);
      } else {
        throw new IllegalArgumentException(
            key + " must be a string, number or boolean, got " + value.getClass().getSimpleName());
      }
      return this;
    }

    /** Removes a parameter. */
    public Builder remove(String key) {
      values.remove(key);
      return this;
    }

    /** Sets the reward. */
    public Builder reward(Reward reward) {
      return put(StructuredField.REWARD.key(), reward);
    }

    /** Sets the keywords. */
    public Builder keywords(List<String> keywords) {
      return put(StructuredField.KEYWORDS.key(), keywords);
    }

    /** Sets the keywords. */
    public Builder keywords(String... keywords) {
      return keywords(Arrays.asList(keywords));
    }

    /** Sets the qualification requirements. */
    public Builder qualificationRequirements(List<QualificationRequirement> requirements) {
      return put(StructuredField.QUALIFICATION_REQUIREMENT.key(), requirements);
    }

    /** Sets the qualification requirements. */
    public Builder qualificationRequirements(QualificationRequirement... requirements) {
      return qualificationRequirements(Arrays.asList(requirements));
    }

    /** Sets the HIT layout parameters. */
    public Builder layoutParameters(List<LayoutParameter> parameters) {
      return put(StructuredField.HIT_LAYOUT_PARAMETER.key(), parameters);
    }

    /** Sets the HIT layout parameters. */
    public Builder layoutParameters(LayoutParameter... parameters) {
      return layoutParameters(Arrays.asList(parameters));
    }

    /** Sets the notifications. */
    public Builder notifications(List<NotificationSpec> notifications) {
      return put(StructuredField.NOTIFICATION.key(), notifications);
    }

    /** Sets the notifications. */
    public Builder notifications(NotificationSpec... notifications) {
      return notifications(Arrays.asList(notifications));
    }

    /** Builds the parameter bag. */
    public ParameterBag build() {
      return values.isEmpty() ? EMPTY : new ParameterBag(new LinkedHashMap<>(values));
    }
  }
}
