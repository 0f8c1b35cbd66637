// Copyright 2025 The Enzonix DNS Authors. All Rights Reserved.
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
//     http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License.

package enzonix.dns.config;

import static com.google.common.base.Preconditions.checkState;
import static com.google.common.base.Suppliers.memoize;
import static java.nio.charset.StandardCharsets.UTF_8;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.flogger.FluentLogger;
import com.google.common.io.Resources;
import dagger.Module;
import dagger.Provides;
import jakarta.inject.Qualifier;
import jakarta.inject.Singleton;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.lang.annotation.Documented;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.net.URL;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;
import org.yaml.snakeyaml.Yaml;

/**
 * Configuration manager for the Enzonix client settings.
 *
 * <p>Defaults are read from {@code enzonix/default-config.yaml} on the classpath. An application
 * may put its own {@code enzonix/config.yaml} on the classpath; any keys it sets override the
 * defaults, map by map.
 */
public final class EnzonixConfig {

  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  static final String YAML_CONFIG_DEFAULT = "enzonix/default-config.yaml";
  static final String YAML_CONFIG_OVERRIDE = "enzonix/config.yaml";

  /** Dagger qualifier for configuration settings. */
  @Qualifier
  @Documented
  @Retention(RetentionPolicy.RUNTIME)
  public @interface Config {
    String value() default "";
  }

  /** Dagger module that provides Enzonix configuration settings. */
  @Module
  public static final class ConfigModule {

    @Singleton
    @Provides
    static EnzonixConfigSettings provideEnzonixConfigSettings() {
      return CONFIG_SETTINGS.get();
    }

    /** Base URL of the Enzonix DNS API. */
    @Provides
    @Config("enzonixBaseUrl")
    public static String provideEnzonixBaseUrl(EnzonixConfigSettings config) {
      return config.enzonix.baseUrl;
    }

    /** API token; empty unless the application configures one. */
    @Provides
    @Config("enzonixApiKey")
    public static String provideEnzonixApiKey(EnzonixConfigSettings config) {
      return config.enzonix.apiKey == null ? "" : config.enzonix.apiKey;
    }

    @Provides
    @Config("enzonixUserAgent")
    public static String provideEnzonixUserAgent(EnzonixConfigSettings config) {
      return config.enzonix.userAgent == null ? "" : config.enzonix.userAgent;
    }

    /** Overall timeout of a single API call. */
    @Provides
    @Config("enzonixTimeout")
    public static Duration provideEnzonixTimeout(EnzonixConfigSettings config) {
      return Duration.ofSeconds(config.enzonix.timeoutSeconds);
    }

    private ConfigModule() {}
  }

  /**
   * Memoizes loading of the {@link EnzonixConfigSettings} POJO.
   *
   * <p>The YAML files are bundled with the application, so they are read once per class loader.
   */
  @VisibleForTesting
  public static final Supplier<EnzonixConfigSettings> CONFIG_SETTINGS =
      memoize(
          () ->
              getConfigSettings(
                  readResource(YAML_CONFIG_DEFAULT)
                      .orElseThrow(
                          () ->
                              new IllegalStateException(
                                  "Missing config resource " + YAML_CONFIG_DEFAULT)),
                  readResource(YAML_CONFIG_OVERRIDE).orElse("")));

  /**
   * Parses the default YAML, merges the custom YAML on top of it and maps the result onto {@link
   * EnzonixConfigSettings}.
   */
  @VisibleForTesting
  static EnzonixConfigSettings getConfigSettings(String defaultYaml, String customYaml) {
    Yaml yaml = new Yaml();
    Map<String, Object> merged = loadAsMap(yaml, defaultYaml);
    mergeMaps(merged, loadAsMap(yaml, customYaml));
    EnzonixConfigSettings settings = yaml.loadAs(yaml.dump(merged), EnzonixConfigSettings.class);
    checkState(
        settings != null && settings.enzonix != null, "Config is missing the 'enzonix' section");
    checkState(
        settings.enzonix.timeoutSeconds != null && settings.enzonix.timeoutSeconds > 0,
        "enzonix.timeoutSeconds must be positive");
    return settings;
  }

  @SuppressWarnings("unchecked")
  private static Map<String, Object> loadAsMap(Yaml yaml, String yamlString) {
    Object loaded = yaml.load(yamlString);
    if (loaded == null) {
      return new LinkedHashMap<>();
    }
    checkState(loaded instanceof Map, "Config root must be a map, got %s", loaded.getClass());
    return new LinkedHashMap<>((Map<String, Object>) loaded);
  }

  /** Recursively merges {@code custom} into {@code base}; nested maps merge, values replace. */
  @SuppressWarnings("unchecked")
  private static void mergeMaps(Map<String, Object> base, Map<String, Object> custom) {
    for (Map.Entry<String, Object> entry : custom.entrySet()) {
      Object existing = base.get(entry.getKey());
      if (existing instanceof Map && entry.getValue() instanceof Map) {
        Map<String, Object> nested = new LinkedHashMap<>((Map<String, Object>) existing);
        mergeMaps(nested, (Map<String, Object>) entry.getValue());
        base.put(entry.getKey(), nested);
      } else {
        base.put(entry.getKey(), entry.getValue());
      }
    }
  }

  private static Optional<String> readResource(String name) {
    URL url = EnzonixConfig.class.getClassLoader().getResource(name);
    if (url == null) {
      return Optional.empty();
    }
    logger.atFine().log("Loading Enzonix config from %s", url);
    try {
      return Optional.of(Resources.toString(url, UTF_8));
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to read config resource " + name, e);
    }
  }

  private EnzonixConfig() {}
}
