package io.github.wphillipmoore.mturk.requester.config;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonParseException;
import com.google.gson.ToNumberPolicy;
import com.google.gson.reflect.TypeToken;
import io.github.wphillipmoore.mturk.requester.request.ParameterBag;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.lang.reflect.Type;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import org.jspecify.annotations.Nullable;

/**
 * Endpoints and default parameters for both modes.
 *
 * <p>The sandbox defaults are always the production defaults overlaid with the sandbox overrides,
 * so a sandbox session keeps every production default it does not explicitly replace.
 *
 * <p>Configuration can be given as JSON:
 *
 * <pre>{@code
 * {
 *   "production": {"region": "us-east-1", "defaults": {"MaxAssignments": 3}},
 *   "sandbox": {"region": "us-east-1", "defaults": {"MaxAssignments": 1}}
 * }
 * }</pre>
 *
 * <p>Each section may also set {@code baseUrl}; otherwise it is derived from the region.
 */
public final class MturkConfig {

  public static final String DEFAULT_REGION = "us-east-1";

  static final String RESOURCE_NAME = "mturk-defaults.json";
  static final String PRODUCTION_URL_TEMPLATE = "https://mturk-requester.%s.amazonaws.com";
  static final String SANDBOX_URL_TEMPLATE = "https://mturk-requester-sandbox.%s.amazonaws.com";

  private static final Set<String> VALID_TOP_LEVEL_KEYS = Set.of("production", "sandbox");
  private static final Set<String> VALID_SECTION_KEYS = Set.of("region", "baseUrl", "defaults");
  private static final Gson GSON =
      new GsonBuilder().setObjectToNumberStrategy(ToNumberPolicy.LAZILY_PARSED_NUMBER).create();
  private static final Type MAP_TYPE = new TypeToken<Map<String, Object>>() {}.getType();

  private final EndpointConfig production;
  private final EndpointConfig sandbox;
  private final ParameterBag sandboxOverrides;

  private MturkConfig(Builder builder) {
    this.production =
        new EndpointConfig(
            Mode.PRODUCTION,
            builder.productionBaseUrl != null
                ? builder.productionBaseUrl
                : String.format(PRODUCTION_URL_TEMPLATE, builder.productionRegion),
            builder.productionRegion,
            builder.productionDefaults);
    this.sandboxOverrides = builder.sandboxOverrides;
    this.sandbox =
        new EndpointConfig(
            Mode.SANDBOX,
            builder.sandboxBaseUrl != null
                ? builder.sandboxBaseUrl
                : String.format(SANDBOX_URL_TEMPLATE, builder.sandboxRegion),
            builder.sandboxRegion,
            builder.productionDefaults.overriddenBy(builder.sandboxOverrides));
  }

  /**
   * Returns the configuration for a mode.
   *
   * @param mode the mode
   * @return the endpoint and effective defaults of that mode
   */
  public EndpointConfig forMode(Mode mode) {
    Objects.requireNonNull(mode, "mode");
    return mode == Mode.SANDBOX ? sandbox : production;
  }

  /** Returns the sandbox overrides as configured, before layering over production defaults. */
  public ParameterBag getSandboxOverrides() {
    return sandboxOverrides;
  }

  /** Returns a builder. */
  public static Builder builder() {
    return new Builder();
  }

  /** Returns a configuration for the default region without default parameters. */
  public static MturkConfig defaults() {
    return builder().build();
  }

  /**
   * Loads the configuration bundled with the library.
   *
   * @return configuration loaded from the built-in resource file
   * @throws IllegalStateException if the resource cannot be found
   */
  public static MturkConfig loadDefault() {
    return loadFromResource(RESOURCE_NAME);
  }

  /**
   * Loads configuration from a named classpath resource relative to this class.
   *
   * @param resourceName the resource file name
   * @return configuration loaded from the resource
   * @throws IllegalStateException if the resource cannot be found, is empty or is not valid JSON
   */
  static MturkConfig loadFromResource(String resourceName) {
    InputStream stream = MturkConfig.class.getResourceAsStream(resourceName);
    if (stream == null) {
      throw new IllegalStateException("Configuration resource not found: " + resourceName);
    }
    Map<String, Object> parsed;
    try (Reader reader = new InputStreamReader(stream, StandardCharsets.UTF_8)) {
      parsed = GSON.fromJson(reader, MAP_TYPE);
    } catch (IOException | JsonParseException e) {
      throw new IllegalStateException("Configuration resource unreadable: " + resourceName, e);
    }
    if (parsed == null) {
      throw new IllegalStateException("Configuration resource unreadable: " + resourceName);
    }
    return fromMap(parsed);
  }

  /**
   * Parses configuration from a JSON string.
   *
   * @param json the JSON string to parse, must not be null or empty
   * @return the configuration
   * @throws NullPointerException if json is null
   * @throws IllegalArgumentException if json is empty, not valid JSON, or has an invalid shape
   */
  public static MturkConfig fromJson(String json) {
    Objects.requireNonNull(json, "json");
    if (json.isEmpty()) {
      throw new IllegalArgumentException("json must not be empty");
    }
    Map<String, Object> parsed;
    try {
      parsed = GSON.fromJson(json, MAP_TYPE);
    } catch (JsonParseException e) {
      throw new IllegalArgumentException("Invalid JSON configuration", e);
    }
    if (parsed == null) {
      throw new IllegalArgumentException("JSON configuration must be an object");
    }
    return fromMap(parsed);
  }

  private static MturkConfig fromMap(Map<String, Object> data) {
    for (String key : data.keySet()) {
      if (!VALID_TOP_LEVEL_KEYS.contains(key)) {
        throw new IllegalArgumentException("Unknown configuration section: " + key);
      }
    }
    Builder builder = builder();
    Map<String, Object> production = section(data, "production");
    if (production != null) {
      String region = stringEntry(production, "region");
      if (region != null) {
        builder.productionRegion(region);
      }
      builder.productionBaseUrl(stringEntry(production, "baseUrl"));
      builder.productionDefaults(defaultsEntry(production));
    }
    Map<String, Object> sandbox = section(data, "sandbox");
    if (sandbox != null) {
      String region = stringEntry(sandbox, "region");
      if (region != null) {
        builder.sandboxRegion(region);
      }
      builder.sandboxBaseUrl(stringEntry(sandbox, "baseUrl"));
      builder.sandboxOverrides(defaultsEntry(sandbox));
    }
    return builder.build();
  }

  @SuppressWarnings("unchecked")
  private static @Nullable Map<String, Object> section(Map<String, Object> data, String name) {
    Object value = data.get(name);
    if (value == null) {
      return null;
    }
    if (!(value instanceof Map)) {
      throw new IllegalArgumentException(name + " must be an object");
    }
    Map<String, Object> section = (Map<String, Object>) value;
    for (String key : section.keySet()) {
      if (!VALID_SECTION_KEYS.contains(key)) {
        throw new IllegalArgumentException("Unknown key in " + name + ": " + key);
      }
    }
    return section;
  }

  private static @Nullable String stringEntry(Map<String, Object> section, String key) {
    Object value = section.get(key);
    if (value == null) {
      return null;
    }
    if (!(value instanceof String)) {
      throw new IllegalArgumentException(key + " must be a string");
    }
    return (String) value;
  }

  @SuppressWarnings("unchecked")
  private static ParameterBag defaultsEntry(Map<String, Object> section) {
    Object value = section.get("defaults");
    if (value == null) {
      return ParameterBag.empty();
    }
    if (!(value instanceof Map)) {
      throw new IllegalArgumentException("defaults must be an object");
    }
    return ParameterBag.fromMap((Map<String, Object>) value);
  }

  /** Builder for {@link MturkConfig}. */
  public static final class Builder {

    private String productionRegion = DEFAULT_REGION;
    private String sandboxRegion = DEFAULT_REGION;
    private @Nullable String productionBaseUrl;
    private @Nullable String sandboxBaseUrl;
    private ParameterBag productionDefaults = ParameterBag.empty();
    private ParameterBag sandboxOverrides = ParameterBag.empty();

    private Builder() {}

    /** Sets the production region. Defaults to {@value MturkConfig#DEFAULT_REGION}. */
    public Builder productionRegion(String region) {
      this.productionRegion = Objects.requireNonNull(region, "region");
      return this;
    }

    /** Sets the sandbox region. Defaults to {@value MturkConfig#DEFAULT_REGION}. */
    public Builder sandboxRegion(String region) {
      this.sandboxRegion = Objects.requireNonNull(region, "region");
      return this;
    }

    /** Sets the production endpoint. Pass {@code null} to derive it from the region. */
    public Builder productionBaseUrl(@Nullable String baseUrl) {
      this.productionBaseUrl = baseUrl;
      return this;
    }

    /** Sets the sandbox endpoint. Pass {@code null} to derive it from the region. */
    public Builder sandboxBaseUrl(@Nullable String baseUrl) {
      this.sandboxBaseUrl = baseUrl;
      return this;
    }

    /** Sets the defaults merged into every request in both modes. */
    public Builder productionDefaults(ParameterBag defaults) {
      this.productionDefaults = Objects.requireNonNull(defaults, "defaults");
      return this;
    }

    /** Sets the defaults that replace production defaults in sandbox mode. */
    public Builder sandboxOverrides(ParameterBag overrides) {
      this.sandboxOverrides = Objects.requireNonNull(overrides, "overrides");
      return this;
    }

    /** Builds the configuration. */
    public MturkConfig build() {
      return new MturkConfig(this);
    }
  }
}
