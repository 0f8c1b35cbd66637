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

import static com.google.common.truth.Truth.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

import enzonix.dns.client.ClientConfig;
import enzonix.dns.client.EnzonixClient;
import java.time.Duration;
import okhttp3.OkHttpClient;
import org.junit.jupiter.api.Test;

public class EnzonixModuleTest {

  @Test
  void testProvideEnzonixHttpClient_usesConfiguredTimeout() {
    OkHttpClient httpClient = EnzonixModule.provideEnzonixHttpClient(Duration.ofSeconds(7));

    assertThat(httpClient.callTimeoutMillis()).isEqualTo(7000);
  }

  @Test
  void testProvideClientConfig() {
    OkHttpClient httpClient = new OkHttpClient();

    ClientConfig config =
        EnzonixModule.provideClientConfig(
            "token", "https://enzonix.test", "my-app/2.0", httpClient);

    assertThat(config.apiKey()).isEqualTo("token");
    assertThat(config.baseUrl().host()).isEqualTo("enzonix.test");
    assertThat(config.userAgent()).isEqualTo("my-app/2.0");
    assertThat(config.httpClient()).isSameInstanceAs(httpClient);
  }

  @Test
  void testProvideClientConfig_missingApiKey() {
    IllegalArgumentException thrown =
        assertThrows(
            IllegalArgumentException.class,
            () ->
                EnzonixModule.provideClientConfig(
                    "", "https://enzonix.test", "", new OkHttpClient()));

    assertThat(thrown).hasMessageThat().isEqualTo("enzonix: api key must not be empty");
  }

  @Test
  void testProvideEnzonixClient() {
    ClientConfig config = ClientConfig.builder("token").build();

    EnzonixClient client = EnzonixModule.provideEnzonixClient(config);

    assertThat(client.getConfig()).isSameInstanceAs(config);
  }
}
