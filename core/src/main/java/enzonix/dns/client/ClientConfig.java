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

package enzonix.dns.client;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Suppliers.memoize;
import static enzonix.dns.util.PreconditionsUtils.checkArgumentNotBlank;

import com.google.common.annotations.VisibleForTesting;
import java.time.Duration;
import java.util.function.Supplier;
import javax.annotation.Nullable;
import okhttp3.HttpUrl;
import okhttp3.OkHttpClient;

/**
 * Immutable configuration of an {@link EnzonixClient}.
 *
 * <p>Instances are created through {@link #builder(String)}. Each builder method validates its
 * argument when it is called and throws {@link IllegalArgumentException} straight away, so a
 * configuration with a bad override never gets built.
 *
 * @param apiKey the API token sent as a bearer credential
 * @param baseUrl absolute URL request paths are resolved against
 * @param httpClient transport used to execute requests
 * @param userAgent value of the {@code User-Agent} header, or empty to leave the header out
 */
public record ClientConfig(
    String apiKey, HttpUrl baseUrl, OkHttpClient httpClient, String userAgent) {

  public static final String DEFAULT_BASE_URL = "https://api.ns.enzonix.com";
  public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(10);
  public static final String DEFAULT_USER_AGENT = "enzonix-dns-sdk-java/0.1.0";

  // One connection pool and dispatcher shared by every client that keeps the default transport.
  @VisibleForTesting
  static final Supplier<OkHttpClient> DEFAULT_HTTP_CLIENT =
      memoize(() -> new OkHttpClient.Builder().callTimeout(DEFAULT_TIMEOUT).build());

  public ClientConfig {
    checkArgumentNotBlank(apiKey, "api key");
    checkArgument(baseUrl != null, "enzonix: base url must not be null");
    checkArgument(httpClient != null, "enzonix: http client must not be null");
    checkArgument(userAgent != null, "enzonix: user agent must not be null");
  }

  /** The overall call timeout enforced by the transport; zero means no timeout. */
  public Duration timeout() {
    return Duration.ofMillis(httpClient.callTimeoutMillis());
  }

  @Override
  public String toString() {
    return String.format(
        "ClientConfig{baseUrl=%s, userAgent=%s, apiKey=<redacted>}", baseUrl, userAgent);
  }

  /**
   * Starts a configuration with the given credential and the production defaults.
   *
   * @throws IllegalArgumentException if the credential is null or blank
   */
  public static Builder builder(String apiKey) {
    return new Builder(apiKey);
  }

  /** Builder for {@link ClientConfig}; overrides are applied in call order. */
  public static final class Builder {
    private final String apiKey;
    private HttpUrl baseUrl = HttpUrl.get(DEFAULT_BASE_URL);
    @Nullable private OkHttpClient httpClient;
    private String userAgent = DEFAULT_USER_AGENT;

    private Builder(String apiKey) {
      checkArgumentNotBlank(apiKey, "api key");
      this.apiKey = apiKey;
    }

    /**
     * Overrides the API base URL.
     *
     * @throws IllegalArgumentException if the URL is blank or not an absolute http(s) URL
     */
    public Builder baseUrl(String rawUrl) {
      String trimmed = checkArgumentNotBlank(rawUrl, "base url");
      HttpUrl parsed = HttpUrl.parse(trimmed);
      checkArgument(parsed != null, "enzonix: base url must be absolute: %s", rawUrl);
      this.baseUrl = parsed;
      return this;
    }

    /**
     * Replaces the transport. Timeouts, proxies and interceptors are taken from this client as-is.
     *
     * @throws IllegalArgumentException if {@code httpClient} is null
     */
    public Builder httpClient(OkHttpClient httpClient) {
      checkArgument(httpClient != null, "enzonix: http client must not be null");
      this.httpClient = httpClient;
      return this;
    }

    /** Overrides the user agent. The value is trimmed; an empty value suppresses the header. */
    public Builder userAgent(@Nullable String userAgent) {
      this.userAgent = userAgent == null ? "" : userAgent.trim();
      return this;
    }

    public ClientConfig build() {
      OkHttpClient transport = httpClient == null ? DEFAULT_HTTP_CLIENT.get() : httpClient;
      return new ClientConfig(apiKey, baseUrl, transport, userAgent);
    }
  }
}
