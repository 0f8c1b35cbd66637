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

package enzonix.dns.client.module;

import dagger.Module;
import dagger.Provides;
import enzonix.dns.client.ClientConfig;
import enzonix.dns.client.EnzonixClient;
import enzonix.dns.config.EnzonixConfig.Config;
import enzonix.dns.config.EnzonixConfig.ConfigModule;
import jakarta.inject.Named;
import jakarta.inject.Singleton;
import java.time.Duration;
import okhttp3.OkHttpClient;

/**
 * Dagger module that wires an {@link EnzonixClient} from the YAML configuration.
 *
 * <p>The resource clients ({@code DomainsClient}, {@code RecordsClient}, {@code AccountClient} and
 * {@code ZoneRecordsClient}) have injectable constructors and need no bindings of their own.
 */
@Module(includes = ConfigModule.class)
public final class EnzonixModule {

  static final String ENZONIX_HTTP_CLIENT = "enzonixHttpClient";

  @Provides
  @Singleton
  @Named(ENZONIX_HTTP_CLIENT)
  static OkHttpClient provideEnzonixHttpClient(@Config("enzonixTimeout") Duration timeout) {
    return new OkHttpClient.Builder().callTimeout(timeout).build();
  }

  /**
   * Provides the client configuration.
   *
   * @throws IllegalArgumentException if no API key is configured or the base URL is invalid
   */
  @Provides
  @Singleton
  static ClientConfig provideClientConfig(
      @Config("enzonixApiKey") String apiKey,
      @Config("enzonixBaseUrl") String baseUrl,
      @Config("enzonixUserAgent") String userAgent,
      @Named(ENZONIX_HTTP_CLIENT) OkHttpClient httpClient) {
    return ClientConfig.builder(apiKey)
        .baseUrl(baseUrl)
        .userAgent(userAgent)
        .httpClient(httpClient)
        .build();
  }

  @Provides
  @Singleton
  static EnzonixClient provideEnzonixClient(ClientConfig config) {
    return EnzonixClient.create(config);
  }

  private EnzonixModule() {}
}
