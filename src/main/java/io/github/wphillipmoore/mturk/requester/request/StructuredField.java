package io.github.wphillipmoore.mturk.requester.request;

import io.github.wphillipmoore.mturk.requester.exception.MturkMissingParameterException;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.jspecify.annotations.Nullable;

/**
 * Parameters whose values are records or lists, encoded as positional, 1-indexed query fields.
 *
 * <p>Each constant owns one top-level parameter key. {@link #encode(ParameterBag)} renders the
 * value stored under that key as a run of {@code &name=value} fragments; the key must be present.
 * Values may be given either as the typed records of this package or as the generic maps and lists
 * a JSON document decodes to, which {@link ParameterBag} converts on insertion.
 */
public enum StructuredField {

  /** A single {@link Reward}, always at index 1. */
  REWARD("Reward") {
    @Override
    void appendFragments(Object value, StringBuilder query) {
      Reward reward = (Reward) value;
      QueryEncoding.appendParameter(query, "Reward.1.Amount", reward.amount());
      QueryEncoding.appendParameter(query, "Reward.1.CurrencyCode", reward.currencyCode());
      if (reward.formattedPrice() != null) {
        QueryEncoding.appendParameter(query, "Reward.1.FormattedPrice", reward.formattedPrice());
      }
    }

    @Override
    Object coerce(Object raw) {
      if (raw instanceof Reward) {
        return raw;
      }
      Map<?, ?> map = asMap(raw, key());
      Object formattedPrice = map.get("FormattedPrice");
      return new Reward(
          new BigDecimal(text(requireEntry(map, "Amount", key()))),
          text(requireEntry(map, "CurrencyCode", key())),
          formattedPrice != null ? text(formattedPrice) : null);
    }
  },

  /** A list of keywords, joined with commas into a single {@code Keywords} value. */
  KEYWORDS("Keywords") {
    @Override
    void appendFragments(Object value, StringBuilder query) {
      @SuppressWarnings("unchecked")
      List<String> keywords = (List<String>) value;
      QueryEncoding.appendParameter(query, key(), String.join(",", keywords));
    }

    @Override
    Object coerce(Object raw) {
      if (raw instanceof CharSequence) {
        return List.of(raw.toString());
      }
      List<String> keywords = new ArrayList<>();
      for (Object item : asList(raw, key())) {
        keywords.add(text(item));
      }
      return List.copyOf(keywords);
    }
  },

  /** A list of {@link QualificationRequirement}s, each with an optional nested locale list. */
  QUALIFICATION_REQUIREMENT("QualificationRequirement") {
    @Override
    void appendFragments(Object value, StringBuilder query) {
      @SuppressWarnings("unchecked")
      List<QualificationRequirement> requirements = (List<QualificationRequirement>) value;
      int i = 0;
      for (QualificationRequirement requirement : requirements) {
        String prefix = key() + '.' + ++i + '.';
        QueryEncoding.appendParameter(
            query, prefix + "QualificationTypeId", requirement.qualificationTypeId());
        QueryEncoding.appendParameter(query, prefix + "Comparator", requirement.comparator());
        if (requirement.integerValue() != null) {
          QueryEncoding.appendParameter(query, prefix + "IntegerValue", requirement.integerValue());
        }
        int z = 0;
        for (LocaleValue locale : requirement.localeValues()) {
          String localePrefix = prefix + "LocaleValue." + ++z + '.';
          QueryEncoding.appendParameter(query, localePrefix + "Country", locale.country());
          if (locale.subdivision() != null) {
            QueryEncoding.appendParameter(
                query, localePrefix + "Subdivision", locale.subdivision());
          }
        }
        if (requirement.requiredToPreview() != null) {
          QueryEncoding.appendParameter(
              query, prefix + "RequiredToPreview", requirement.requiredToPreview());
        }
      }
    }

    @Override
    Object coerce(Object raw) {
      List<QualificationRequirement> requirements = new ArrayList<>();
      int i = 0;
      for (Object item : asList(raw, key())) {
        String path = key() + '.' + ++i;
        if (item instanceof QualificationRequirement requirement) {
          requirements.add(requirement);
          continue;
        }
        Map<?, ?> map = asMap(item, path);
        Object integerValue = map.get("IntegerValue");
        Object requiredToPreview = map.get("RequiredToPreview");
        requirements.add(
            new QualificationRequirement(
                text(requireEntry(map, "QualificationTypeId", path)),
                text(requireEntry(map, "Comparator", path)),
                integerValue != null ? toInteger(integerValue, path + ".IntegerValue") : null,
                coerceLocales(map.get("LocaleValue"), path + ".LocaleValue"),
                requiredToPreview != null
                    ? toBoolean(requiredToPreview, path + ".RequiredToPreview")
                    : null));
      }
      return List.copyOf(requirements);
    }
  },

  /** A list of {@link LayoutParameter}s. */
  HIT_LAYOUT_PARAMETER("HITLayoutParameter") {
    @Override
    void appendFragments(Object value, StringBuilder query) {
      @SuppressWarnings("unchecked")
      List<LayoutParameter> parameters = (List<LayoutParameter>) value;
      int i = 0;
      for (LayoutParameter parameter : parameters) {
        String prefix = key() + '.' + ++i + '.';
        QueryEncoding.appendParameter(query, prefix + "Name", parameter.name());
        QueryEncoding.appendParameter(query, prefix + "Value", parameter.value());
      }
    }

    @Override
    Object coerce(Object raw) {
      List<LayoutParameter> parameters = new ArrayList<>();
      int i = 0;
      for (Object item : asList(raw, key())) {
        String path = key() + '.' + ++i;
        if (item instanceof LayoutParameter parameter) {
          parameters.add(parameter);
          continue;
        }
        Map<?, ?> map = asMap(item, path);
        parameters.add(
            new LayoutParameter(
                text(requireEntry(map, "Name", path)), text(requireEntry(map, "Value", path))));
      }
      return List.copyOf(parameters);
    }
  },

  /**
   * A list of {@link NotificationSpec}s.
   *
   * <p>A notification with one event type emits it at the notification's own index. With several
   * event types, each is emitted at its position within the event list instead, so the event
   * entries of notification 2 land on {@code Notification.1.EventType}, {@code
   * Notification.2.EventType} and so on.
   */
  NOTIFICATION("Notification") {
    @Override
    void appendFragments(Object value, StringBuilder query) {
      @SuppressWarnings("unchecked")
      List<NotificationSpec> notifications = (List<NotificationSpec>) value;
      int i = 0;
      for (NotificationSpec notification : notifications) {
        String prefix = key() + '.' + ++i + '.';
        QueryEncoding.appendParameter(query, prefix + "Destination", notification.destination());
        QueryEncoding.appendParameter(query, prefix + "Transport", notification.transport());
        QueryEncoding.appendParameter(query, prefix + "Version", notification.version());
        List<String> eventTypes = notification.eventTypes();
        if (eventTypes.size() > 1) {
          int z = 0;
          for (String eventType : eventTypes) {
            QueryEncoding.appendParameter(query, key() + '.' + ++z + ".EventType", eventType);
          }
        } else {
          QueryEncoding.appendParameter(query, prefix + "EventType", eventTypes.get(0));
        }
      }
    }

    @Override
    Object coerce(Object raw) {
      List<NotificationSpec> notifications = new ArrayList<>();
      int i = 0;
      for (Object item : asList(raw, key())) {
        String path = key() + '.' + ++i;
        if (item instanceof NotificationSpec notification) {
          notifications.add(notification);
          continue;
        }
        Map<?, ?> map = asMap(item, path);
        Object eventType = requireEntry(map, "EventType", path);
        List<String> eventTypes = new ArrayList<>();
        if (eventType instanceof List<?> list) {
          for (Object type : list) {
            eventTypes.add(text(type));
          }
        } else {
          eventTypes.add(text(eventType));
        }
        notifications.add(
            new NotificationSpec(
                text(requireEntry(map, "Destination", path)),
                text(requireEntry(map, "Transport", path)),
                text(requireEntry(map, "Version", path)),
                eventTypes));
      }
      return List.copyOf(notifications);
    }
  };

  private final String key;

  StructuredField(String key) {
    this.key = key;
  }

  /** Returns the top-level parameter key this field is stored under. */
  public String key() {
    return key;
  }

  /**
   * Returns the field stored under the given parameter key.
   *
   * @param key a parameter key
   * @return the field, or {@code null} if the key holds a scalar parameter
   */
  public static @Nullable StructuredField forKey(String key) {
    for (StructuredField field : values()) {
      if (field.key.equals(key)) {
        return field;
      }
    }
    return null;
  }

  /**
   * Encodes this field's value from the given parameters.
   *
   * @param params the effective request parameters
   * @return the query fragments, each starting with {@code &}; empty for an empty list
   * @throws MturkMissingParameterException if the parameters do not contain this field's key
   */
  public String encode(ParameterBag params) {
    Object value = params.get(key);
    if (value == null) {
      throw new MturkMissingParameterException(key);
    }
    StringBuilder query = new StringBuilder();
    appendFragments(value, query);
    return query.toString();
  }

  abstract void appendFragments(Object value, StringBuilder query);

  /** Converts a typed or generic value to this field's canonical representation. */
  abstract Object coerce(Object raw);

  private static Object requireEntry(Map<?, ?> map, String name, String path) {
    Object value = map.get(name);
    if (value == null) {
      throw new MturkMissingParameterException(path + '.' + name);
    }
    return value;
  }

  private static Map<?, ?> asMap(Object raw, String path) {
    if (raw instanceof Map<?, ?> map) {
      return map;
    }
    throw new IllegalArgumentException(path + " must be a record, got " + typeName(raw));
  }

  private static List<?> asList(Object raw, String path) {
    if (raw instanceof List<?> list) {
      return list;
    }
    throw new IllegalArgumentException(path + " must be a list, got " + typeName(raw));
  }

  private static String text(Object value) {
    return QueryEncoding.render(value);
  }

  private static Integer toInteger(Object value, String path) {
    if (value instanceof Integer integer) {
      return integer;
    }
    try {
      return new BigDecimal(text(value)).intValueExact();
    } catch (ArithmeticException | NumberFormatException e) {
      throw new IllegalArgumentException(path + " must be an integer, got " + value, e);
    }
  }

  private static Boolean toBoolean(Object value, String path) {
    if (value instanceof Boolean flag) {
      return flag;
    }
    if (value instanceof CharSequence) {
      String flag = value.toString();
      if ("true".equalsIgnoreCase(flag)) {
        return Boolean.TRUE;
      }
      if ("false".equalsIgnoreCase(flag)) {
        return Boolean.FALSE;
      }
    }
    throw new IllegalArgumentException(path + " must be true or false, got " + value);
  }

  private static List<LocaleValue> coerceLocales(@Nullable Object raw, String path) {
    if (raw == null) {
      return List.of();
    }
    List<LocaleValue> locales = new ArrayList<>();
    int z = 0;
    for (Object item : asList(raw, path)) {
      String localePath = path + '.' + ++z;
      if (item instanceof LocaleValue locale) {
        locales.add(locale);
        continue;
      }
      Map<?, ?> map = asMap(item, localePath);
      Object subdivision = map.get("Subdivision");
      locales.add(
          new LocaleValue(
              text(requireEntry(map, "Country", localePath)),
              subdivision != null ? text(subdivision) : null));
    }
    return List.copyOf(locales);
  }

  private static String typeName(@Nullable Object value) {
    return value == null ? "null" : value.getClass().getSimpleName();
  }
}
